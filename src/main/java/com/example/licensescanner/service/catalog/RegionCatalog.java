package com.example.licensescanner.service.catalog;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable table of supported issuing regions. Iteration order is alphabetical by region code and
 * never changes after construction, so the catalog can be shared by concurrent extractions without
 * locking.
 */
public final class RegionCatalog {

    private static final List<RegionRule> BUILT_IN = List.of(
            RegionRule.of("CA", "California", "L1D7"),
            RegionRule.of("CT", "Connecticut", "D9"),
            RegionRule.of("FL", "Florida", "L1D12"),
            RegionRule.of("GA", "Georgia", "D9"),
            RegionRule.of("IL", "Illinois", "L1D11"),
            RegionRule.of("MI", "Michigan", "L1D12"),
            RegionRule.of("NC", "North Carolina", "D12"),
            RegionRule.of("NY", "New York", "D9"),
            RegionRule.of("OH", "Ohio", "L2D6"),
            RegionRule.of("PA", "Pennsylvania", "D8"),
            RegionRule.of("TX", "Texas", "D8")
    );

    private final Map<String, RegionRule> rulesByCode;
    private final List<RegionRule> ordered;

    public RegionCatalog(Collection<RegionRule> rules) {
        Map<String, RegionRule> byCode = new LinkedHashMap<>();
        rules.stream()
                .sorted(Comparator.comparing(RegionRule::code))
                .forEach(rule -> {
                    if (byCode.putIfAbsent(rule.code(), rule) != null) {
                        throw new IllegalArgumentException("Duplicate region code " + rule.code());
                    }
                });
        this.rulesByCode = Map.copyOf(byCode);
        this.ordered = List.copyOf(byCode.values());
    }

    public static RegionCatalog defaults() {
        return new RegionCatalog(BUILT_IN);
    }

    /**
     * Catalog made of the built-in regions, with {@code overrides} replacing built-in entries that
     * share their code and adding the others.
     */
    public static RegionCatalog withOverrides(List<RegionRule> overrides) {
        Map<String, RegionRule> merged = new LinkedHashMap<>();
        BUILT_IN.forEach(rule -> merged.put(rule.code(), rule));
        if (overrides != null) {
            overrides.forEach(rule -> merged.put(rule.code(), rule));
        }
        return new RegionCatalog(new ArrayList<>(merged.values()));
    }

    public Optional<RegionRule> find(String code) {
        if (code == null || code.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(rulesByCode.get(code.trim().toUpperCase(Locale.ROOT)));
    }

    /**
     * @throws UnknownRegionException when no region is registered under {@code code}
     */
    public RegionRule lookup(String code) {
        return find(code).orElseThrow(() -> new UnknownRegionException(code));
    }

    public List<RegionRule> all() {
        return ordered;
    }

    public int size() {
        return ordered.size();
    }
}

package com.example.licensescanner.service.catalog;

import java.util.Locale;
import java.util.Objects;

/**
 * One supported issuing region: its two-letter code, the name printed on its documents and the
 * shape of its document numbers.
 */
public record RegionRule(String code, String name, NumberRule numberRule) {

    public RegionRule {
        Objects.requireNonNull(code, "code");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(numberRule, "numberRule");
        code = code.trim().toUpperCase(Locale.ROOT);
        name = name.trim();
        if (!code.matches("[A-Z]{2}")) {
            throw new IllegalArgumentException("Region code must be two letters: " + code);
        }
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Region name must not be blank");
        }
    }

    public static RegionRule of(String code, String name, String rule) {
        return new RegionRule(code, name, NumberRule.parse(rule));
    }
}

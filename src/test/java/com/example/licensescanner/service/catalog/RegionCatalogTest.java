package com.example.licensescanner.service.catalog;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;

class RegionCatalogTest {

    private final RegionCatalog catalog = RegionCatalog.defaults();

    @Test
    void listsBuiltInRegionsInCodeOrder() {
        assertThat(catalog.all())
                .extracting(RegionRule::code)
                .containsExactly("CA", "CT", "FL", "GA", "IL", "MI", "NC", "NY", "OH", "PA", "TX");
    }

    @Test
    void looksUpCodesIgnoringCaseAndWhitespace() {
        RegionRule california = catalog.lookup(" ca ");

        assertThat(california.name()).isEqualTo("California");
        assertThat(california.numberRule().notation()).isEqualTo("L1D7");
        assertThat(catalog.find("tx")).map(RegionRule::name).contains("Texas");
    }

    @Test
    void unknownCodeFailsLookupButNotFind() {
        assertThat(catalog.find("ZZ")).isEmpty();
        assertThat(catalog.find(null)).isEmpty();
        assertThatThrownBy(() -> catalog.lookup("ZZ"))
                .isInstanceOf(UnknownRegionException.class)
                .hasMessageContaining("ZZ");
    }

    @Test
    void overridesReplaceAndExtendBuiltIns() {
        RegionCatalog custom = RegionCatalog.withOverrides(List.of(
                RegionRule.of("ca", "California", "L1D8"),
                RegionRule.of("WA", "Washington", "L7D5")));

        assertThat(custom.size()).isEqualTo(12);
        assertThat(custom.lookup("CA").numberRule().notation()).isEqualTo("L1D8");
        assertThat(custom.lookup("WA").name()).isEqualTo("Washington");
        assertThat(custom.all().get(custom.size() - 1).code()).isEqualTo("WA");
    }

    @Test
    void rejectsDuplicateCodes() {
        List<RegionRule> rules = List.of(
                RegionRule.of("TX", "Texas", "D8"),
                RegionRule.of("tx", "Texas again", "D7"));

        assertThatThrownBy(() -> new RegionCatalog(rules))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("TX");
    }

    @Test
    void rejectsInvalidRegionCodes() {
        assertThatThrownBy(() -> RegionRule.of("CAL", "California", "L1D7"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RegionRule.of("C1", "California", "L1D7"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}

package com.example.licensescanner.config;

import com.example.licensescanner.service.catalog.RegionCatalog;
import com.example.licensescanner.service.catalog.RegionRule;
import com.example.licensescanner.service.fieldcode.FieldCodeSet;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the immutable lookup tables shared by all extractions.
 */
@Configuration
public class ExtractionConfiguration {

    private static final Logger log = LoggerFactory.getLogger(ExtractionConfiguration.class);

    @Bean
    public RegionCatalog regionCatalog(ScannerProperties properties) {
        List<RegionRule> configured = properties.regions().stream()
                .map(region -> RegionRule.of(region.code(), region.name(), region.rule()))
                .toList();
        RegionCatalog catalog = RegionCatalog.withOverrides(configured);
        log.info("Region catalog loaded with {} regions ({} from configuration)", catalog.size(), configured.size());
        return catalog;
    }

    @Bean
    public FieldCodeSet fieldCodeSet() {
        return FieldCodeSet.standard();
    }
}

package com.example.licensescanner.api.dto;

import com.example.licensescanner.service.catalog.RegionRule;
import io.swagger.v3.oas.annotations.media.Schema;

public record RegionResponse(
        String code,
        String name,
        @Schema(description = "Number format, e.g. L1D7 for one letter followed by seven digits")
        String rule) {

    public static RegionResponse from(RegionRule region) {
        return new RegionResponse(region.code(), region.name(), region.numberRule().notation());
    }
}

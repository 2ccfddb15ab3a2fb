package com.example.licensescanner.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotEmpty;
import java.util.List;

public record ExtractionRequest(
        @Schema(description = "Text lines of one licence in top-to-bottom order",
                requiredMode = Schema.RequiredMode.REQUIRED)
        @NotEmpty
        List<String> lines,
        @Schema(description = "Optional two-letter issuing region code, e.g. TX")
        String region) {
}

package com.example.licensescanner.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;

public record ScanBase64Request(
        @Schema(description = "Base64 encoded licence image", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotBlank
        String imageBase64,
        @Schema(description = "Optional two-letter issuing region code, e.g. CA")
        String region) {
}

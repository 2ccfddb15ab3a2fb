package com.example.licensescanner.api.dto;

public record HealthResponse(String status, String service, int regions) {
}

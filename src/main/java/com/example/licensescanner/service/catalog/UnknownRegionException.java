package com.example.licensescanner.service.catalog;

/**
 * Raised when a region code is not part of the {@link RegionCatalog}. Callers are expected to
 * recover, typically by inferring the region from the document instead.
 */
public class UnknownRegionException extends RuntimeException {

    private final String code;

    public UnknownRegionException(String code) {
        super("Unknown issuing region: " + code);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}

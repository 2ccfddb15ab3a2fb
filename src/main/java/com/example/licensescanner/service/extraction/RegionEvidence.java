package com.example.licensescanner.service.extraction;

/**
 * How the issuing region of a result was established.
 */
public enum RegionEvidence {
    /** Supplied by the caller and present in the catalog. */
    HINT(true),
    /**
     * A header names the region: a line that is the region name, or a phrase such as
     * {@code TX DRIVER LICENSE} or {@code STATE OF NEW YORK}.
     */
    HEADER(true),
    /** The region name appears inside another line, for example an address. */
    MENTIONED(false),
    /** Exactly one region's number rule accepted the matched number. */
    INFERRED(false),
    /** Several regions' rules accepted the same number; the first in catalog order was chosen. */
    AMBIGUOUS(false),
    /** No region could be resolved. */
    NONE(false);

    private final boolean confirmed;

    RegionEvidence(boolean confirmed) {
        this.confirmed = confirmed;
    }

    public boolean confirmed() {
        return confirmed;
    }
}

package com.example.licensescanner.config;

import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "scanner")
public record ScannerProperties(
        Extraction extraction,
        Scoring scoring,
        OcrProperties ocr,
        List<RegionDefinition> regions) {

    public ScannerProperties {
        extraction = extraction != null ? extraction : Extraction.defaults();
        scoring = scoring != null ? scoring : Scoring.defaults();
        ocr = ocr != null ? ocr : OcrProperties.defaults();
        regions = regions != null ? List.copyOf(regions) : List.of();
    }

    public static ScannerProperties defaults() {
        return new ScannerProperties(null, null, null, null);
    }

    /**
     * @param maxLines    upper bound on the number of OCR lines accepted for one document
     * @param inferRegion whether number rules may be used to infer an unnamed region
     */
    public record Extraction(int maxLines, Boolean inferRegion) {

        public Extraction {
            maxLines = maxLines > 0 ? maxLines : 200;
            inferRegion = inferRegion == null || inferRegion;
        }

        public static Extraction defaults() {
            return new Extraction(0, null);
        }

        public boolean regionInferenceEnabled() {
            return inferRegion;
        }
    }

    public record Scoring(
            Double base,
            Double numberValidated,
            Double regionConfirmed,
            Double personalField,
            Double ambiguityPenalty) {

        public Scoring {
            base = base != null ? base : 0.10;
            numberValidated = numberValidated != null ? numberValidated : 0.40;
            regionConfirmed = regionConfirmed != null ? regionConfirmed : 0.20;
            personalField = personalField != null ? personalField : 0.10;
            ambiguityPenalty = ambiguityPenalty != null ? ambiguityPenalty : 0.05;
            if (personalField < 0) {
                throw new IllegalArgumentException("scanner.scoring.personal-field must not be negative");
            }
        }

        public static Scoring defaults() {
            return new Scoring(null, null, null, null, null);
        }
    }

    public record OcrProperties(String datapath, String language, Integer pageSegMode) {

        public OcrProperties {
            language = language != null && !language.isBlank() ? language : "eng";
            pageSegMode = pageSegMode != null ? pageSegMode : 6;
        }

        public static OcrProperties defaults() {
            return new OcrProperties(null, null, null);
        }
    }

    /**
     * Region added to, or replacing, the built-in catalog.
     *
     * @param rule number rule in compact notation, for example {@code L1D7}
     */
    public record RegionDefinition(String code, String name, String rule) {
    }
}

package com.example.licensescanner.service.extraction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.example.licensescanner.config.ScannerProperties;
import com.example.licensescanner.config.ScannerProperties.Extraction;
import com.example.licensescanner.service.catalog.RegionCatalog;
import com.example.licensescanner.service.fieldcode.FieldCodeLocator;
import com.example.licensescanner.service.fieldcode.FieldCodeSet;
import com.example.licensescanner.service.pattern.PatternMatcher;
import com.example.licensescanner.service.scoring.ConfidenceScorer;
import java.time.LocalDate;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class FieldExtractorTest {

    private final FieldExtractor extractor = extractor(ScannerProperties.defaults());
    private final ConfidenceScorer scorer = new ConfidenceScorer(ScannerProperties.defaults());

    private static FieldExtractor extractor(ScannerProperties properties) {
        RegionCatalog catalog = RegionCatalog.defaults();
        FieldCodeSet codes = FieldCodeSet.standard();
        return new FieldExtractor(catalog, new PatternMatcher(catalog, codes), new FieldCodeLocator(), codes,
                new ConfidenceScorer(properties), properties);
    }

    @Test
    void extractsEveryFieldFromACaliforniaLicence() {
        RawDocument document = RawDocument.of(
                "CALIFORNIA",
                "DRIVER LICENSE",
                "DL A1234567",
                "LN DOE",
                "FN JOHN",
                "DOB 01/15/1990");

        ExtractedFields fields = extractor.extract(document);

        assertThat(fields.regionCode()).isEqualTo("CA");
        assertThat(fields.regionEvidence()).isEqualTo(RegionEvidence.HEADER);
        assertThat(fields.documentNumber()).isEqualTo("A1234567");
        assertThat(fields.numberValidated()).isTrue();
        assertThat(fields.familyName()).isEqualTo("DOE");
        assertThat(fields.givenName()).isEqualTo("JOHN");
        assertThat(fields.dateOfBirth()).isEqualTo(LocalDate.of(1990, 1, 15));
        assertThat(fields.confidence()).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void headerConfirmedNumberReachesThreshold() {
        ExtractedFields fields = extractor.extract(RawDocument.of("Texas", "12345678"));

        assertThat(fields.regionCode()).isEqualTo("TX");
        assertThat(fields.documentNumber()).isEqualTo("12345678");
        assertThat(fields.confidence()).isGreaterThanOrEqualTo(scorer.headerConfirmedThreshold());
    }

    @Test
    void stateOfPhraseCountsAsHeader() {
        ExtractedFields fields = extractor.extract(RawDocument.of("STATE OF NEW YORK DRIVER LICENSE", "123456789"));

        assertThat(fields.regionCode()).isEqualTo("NY");
        assertThat(fields.regionEvidence()).isEqualTo(RegionEvidence.HEADER);
        assertThat(fields.numberValidated()).isTrue();
    }

    @Test
    void regionCodeHeaderPhrasesNameRegion() {
        ExtractedFields driver = extractor.extract(RawDocument.of("CA DRIVER LICENSE", "A1234567"));
        ExtractedFields stateOf = extractor.extract(RawDocument.of("STATE OF GA", "123456789"));

        assertThat(driver.regionCode()).isEqualTo("CA");
        assertThat(driver.regionEvidence()).isEqualTo(RegionEvidence.HEADER);
        assertThat(driver.confidence()).isCloseTo(0.70, within(1e-9));
        assertThat(stateOf.regionCode()).isEqualTo("GA");
        assertThat(stateOf.regionEvidence()).isEqualTo(RegionEvidence.HEADER);
    }

    @Test
    void prefersNamedRegionWhoseRuleMatches() {
        ExtractedFields fields = extractor.extract(RawDocument.of("Ohio", "Georgia", "123456789"));

        assertThat(fields.regionCode()).isEqualTo("GA");
        assertThat(fields.documentNumber()).isEqualTo("123456789");
    }

    @Test
    void readsPersonalFieldsWhateverTheMarkerCase() {
        ExtractedFields fields = extractor.extract(RawDocument.of("ln DOE", "Fn JOHN", "dob 01/15/1990"));

        assertThat(fields.familyName()).isEqualTo("DOE");
        assertThat(fields.givenName()).isEqualTo("JOHN");
        assertThat(fields.dateOfBirth()).isEqualTo(LocalDate.of(1990, 1, 15));
    }

    @Test
    void leavesUnparseableDateOfBirthEmpty() {
        ExtractedFields fields = extractor.extract(RawDocument.of("DOB 02/30/1990"));

        assertThat(fields.dateOfBirth()).isNull();
        assertThat(fields.personalFieldCount()).isZero();
    }

    @Test
    void documentWithoutRegionOrNumberScoresBase() {
        ExtractedFields fields = extractor.extract(RawDocument.of("HELLO", "WORLD"));

        assertThat(fields.regionCode()).isNull();
        assertThat(fields.documentNumber()).isNull();
        assertThat(fields.regionEvidence()).isEqualTo(RegionEvidence.NONE);
        assertThat(fields.numberValidated()).isFalse();
        assertThat(fields.confidence()).isCloseTo(0.10, within(1e-9));
    }

    @Test
    void extractionIsIdempotent() {
        RawDocument document = RawDocument.of("FLORIDA", "D123456789012", "LN DOE", "DOB 1990-01-15");

        assertThat(extractor.extract(document, "fl")).isEqualTo(extractor.extract(document, "fl"));
    }

    @Test
    void splitsCombinedNameLabel() {
        ExtractedFields fields = extractor.extract(RawDocument.of("NAME JOHN Q DOE", "BORN 07/04/1985"));

        assertThat(fields.givenName()).isEqualTo("JOHN");
        assertThat(fields.familyName()).isEqualTo("DOE");
        assertThat(fields.dateOfBirth()).isEqualTo(LocalDate.of(1985, 7, 4));
    }

    @Test
    void separateNameLabelsOutrankCombinedName() {
        ExtractedFields fields = extractor.extract(RawDocument.of("LICENSEE DOE, JANE", "FN MARY"));

        assertThat(fields.givenName()).isEqualTo("MARY");
        assertThat(fields.familyName()).isEqualTo("DOE");
    }

    @Nested
    class OrdinaryWordsResemblingElementIds {

        @Test
        void familyNameBelowLabelIsKept() {
            ExtractedFields fields = extractor.extract(
                    RawDocument.of("CALIFORNIA", "A1234567", "LN", "DACOSTA", "FN MARIA"));

            assertThat(fields.familyName()).isEqualTo("DACOSTA");
            assertThat(fields.givenName()).isEqualTo("MARIA");
        }

        @Test
        void addressLineIsNotAGivenName() {
            ExtractedFields fields = extractor.extract(RawDocument.of("CALIFORNIA", "A1234567", "DACULA GA 30019"));

            assertThat(fields.givenName()).isNull();
            assertThat(fields.confidence()).isCloseTo(0.70, within(1e-9));
        }
    }

    @Nested
    class RegionMentions {

        @Test
        void nameInsideAddressDoesNotConfirmRegion() {
            ExtractedFields fields = extractor.extract(RawDocument.of("123 TEXAS AVE", "12345678"));

            assertThat(fields.regionCode()).isEqualTo("TX");
            assertThat(fields.regionEvidence()).isEqualTo(RegionEvidence.MENTIONED);
            assertThat(fields.numberValidated()).isTrue();
            assertThat(fields.confidence()).isCloseTo(0.50, within(1e-9));
        }

        @Test
        void mentionWithoutMatchingNumberFallsBackToInference() {
            ExtractedFields fields = extractor.extract(RawDocument.of("DRIVER LICENSE", "123 TEXAS AVE", "A1234567"));

            assertThat(fields.regionCode()).isEqualTo("CA");
            assertThat(fields.regionEvidence()).isEqualTo(RegionEvidence.INFERRED);
            assertThat(fields.documentNumber()).isEqualTo("A1234567");
            assertThat(fields.confidence()).isCloseTo(0.50, within(1e-9));
        }

        @Test
        void mentionIsKeptWhenNothingElseResolves() {
            ExtractedFields fields = extractor.extract(RawDocument.of("123 TEXAS AVE"));

            assertThat(fields.regionCode()).isEqualTo("TX");
            assertThat(fields.regionEvidence()).isEqualTo(RegionEvidence.MENTIONED);
            assertThat(fields.confidence()).isCloseTo(0.10, within(1e-9));
        }
    }

    @Nested
    class RegionHints {

        @Test
        void hintOverridesHeader() {
            ExtractedFields fields = extractor.extract(RawDocument.of("TEXAS", "12345678"), "pa");

            assertThat(fields.regionCode()).isEqualTo("PA");
            assertThat(fields.regionEvidence()).isEqualTo(RegionEvidence.HINT);
            assertThat(fields.numberValidated()).isTrue();
        }

        @Test
        void unknownHintFallsBackToDocument() {
            ExtractedFields fields = extractor.extract(RawDocument.of("TEXAS", "12345678"), "ZZ");

            assertThat(fields.regionCode()).isEqualTo("TX");
            assertThat(fields.regionEvidence()).isEqualTo(RegionEvidence.HEADER);
        }

        @Test
        void labeledNumberFailingRuleIsReturnedUnvalidated() {
            ExtractedFields fields = extractor.extract(RawDocument.of("LIC# 12 34"), "CA");

            assertThat(fields.regionCode()).isEqualTo("CA");
            assertThat(fields.documentNumber()).isEqualTo("1234");
            assertThat(fields.numberValidated()).isFalse();
            assertThat(fields.confidence()).isCloseTo(0.30, within(1e-9));
        }
    }

    @Nested
    class Inference {

        @Test
        void singleMatchingRuleInfersRegion() {
            ExtractedFields fields = extractor.extract(RawDocument.of("DRIVER LICENSE", "AB123456"));

            assertThat(fields.regionCode()).isEqualTo("OH");
            assertThat(fields.regionEvidence()).isEqualTo(RegionEvidence.INFERRED);
            assertThat(fields.confidence()).isCloseTo(0.50, within(1e-9));
        }

        @Test
        void sharedRuleChoosesFirstRegionAndMarksAmbiguity() {
            ExtractedFields fields = extractor.extract(RawDocument.of("123456789"));

            assertThat(fields.regionCode()).isEqualTo("CT");
            assertThat(fields.regionEvidence()).isEqualTo(RegionEvidence.AMBIGUOUS);
            assertThat(fields.confidence()).isCloseTo(0.45, within(1e-9));
        }

        @Test
        void ambiguityIsJudgedOnTheChosenNumber() {
            ExtractedFields fields = extractor.extract(RawDocument.of("A1234567", "123456789"));

            assertThat(fields.regionCode()).isEqualTo("CA");
            assertThat(fields.regionEvidence()).isEqualTo(RegionEvidence.INFERRED);
            assertThat(fields.confidence()).isCloseTo(0.50, within(1e-9));
        }

        @Test
        void disabledInferenceStillOwnsMatchedNumber() {
            FieldExtractor strict = extractor(new ScannerProperties(new Extraction(200, false), null, null, null));

            ExtractedFields fields = strict.extract(RawDocument.of("A1234567"));

            assertThat(fields.regionCode()).isEqualTo("CA");
            assertThat(fields.documentNumber()).isEqualTo("A1234567");
        }
    }

    @Nested
    class MalformedDocuments {

        @Test
        void rejectsEmptyDocument() {
            assertThatThrownBy(() -> extractor.extract(RawDocument.of()))
                    .isInstanceOf(MalformedInputException.class)
                    .hasMessageContaining("no text lines");
        }

        @Test
        void rejectsOversizedDocument() {
            FieldExtractor small = extractor(new ScannerProperties(new Extraction(2, true), null, null, null));

            assertThatThrownBy(() -> small.extract(RawDocument.of("A", "B", "C")))
                    .isInstanceOf(MalformedInputException.class)
                    .hasMessageContaining("3 lines");
        }
    }
}

package com.example.licensescanner.service;

import com.example.licensescanner.service.catalog.RegionCatalog;
import com.example.licensescanner.service.catalog.RegionRule;
import com.example.licensescanner.service.extraction.ExtractedFields;
import com.example.licensescanner.service.extraction.FieldExtractor;
import com.example.licensescanner.service.extraction.RawDocument;
import com.example.licensescanner.service.ocr.OcrEngine;
import com.example.licensescanner.service.ocr.OcrText;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class LicenseScanService {

    private static final Logger log = LoggerFactory.getLogger(LicenseScanService.class);

    private final OcrEngine ocrEngine;
    private final FieldExtractor extractor;
    private final RegionCatalog catalog;

    public LicenseScanService(OcrEngine ocrEngine, FieldExtractor extractor, RegionCatalog catalog) {
        this.ocrEngine = ocrEngine;
        this.extractor = extractor;
        this.catalog = catalog;
    }

    /**
     * Recognise the text of a licence image and extract its fields.
     *
     * @param image      encoded image bytes
     * @param regionHint optional issuing region code
     */
    public ScanOutcome scan(byte[] image, String regionHint) {
        long start = System.nanoTime();
        OcrText text = ocrEngine.recognize(image);
        RawDocument document = text.toDocument();
        ExtractedFields fields = extractor.extract(document, regionHint);
        log.info("Scanned licence image: {} lines, region {}, confidence {} in {} ms", document.size(),
                fields.regionCode(), fields.confidence(), (System.nanoTime() - start) / 1_000_000);
        return new ScanOutcome(fields, document.lines(), text.meanConfidence());
    }

    /**
     * Extract fields from text lines that were recognised elsewhere.
     */
    public ScanOutcome extract(List<String> lines, String regionHint) {
        RawDocument document = new RawDocument(lines);
        ExtractedFields fields = extractor.extract(document, regionHint);
        return new ScanOutcome(fields, document.lines(), null);
    }

    public List<RegionRule> regions() {
        return catalog.all();
    }
}

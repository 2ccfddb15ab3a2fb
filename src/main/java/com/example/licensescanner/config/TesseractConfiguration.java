package com.example.licensescanner.config;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;
import net.sourceforge.tess4j.Tesseract;
import net.sourceforge.tess4j.util.LoadLibs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TesseractConfiguration {

    private static final Logger log = LoggerFactory.getLogger(TesseractConfiguration.class);

    private static final String[] SYSTEM_TESSDATA = {
            "/usr/share/tesseract-ocr/5/tessdata",
            "/usr/share/tesseract-ocr/4.00/tessdata",
            "/usr/local/share/tessdata"
    };

    @Bean
    public Tesseract tesseract(ScannerProperties properties) {
        ScannerProperties.OcrProperties ocr = properties.ocr();
        Tesseract tesseract = new Tesseract();
        resolveDataPath(ocr).ifPresent(path -> {
            log.info("Configuring Tesseract data path: {}", path);
            tesseract.setDatapath(path.toString());
        });
        tesseract.setLanguage(ocr.language());
        tesseract.setOcrEngineMode(1); // LSTM only
        tesseract.setPageSegMode(ocr.pageSegMode());
        return tesseract;
    }

    /**
     * First directory holding {@code <language>.traineddata}, looking at the configured path, the
     * {@code TESSDATA_PREFIX} environment variable and system property, then the usual install
     * locations. Falls back to the tessdata bundled with tess4j.
     */
    Optional<Path> resolveDataPath(ScannerProperties.OcrProperties ocr) {
        String language = ocr.language().split("\\+")[0];
        Optional<Path> installed = Stream.concat(
                        Stream.of(ocr.datapath(), System.getenv("TESSDATA_PREFIX"),
                                System.getProperty("TESSDATA_PREFIX")),
                        Stream.of(SYSTEM_TESSDATA))
                .filter(Objects::nonNull)
                .filter(candidate -> !candidate.isBlank())
                .map(candidate -> tessdataDirectory(candidate, language))
                .flatMap(Optional::stream)
                .findFirst();
        if (installed.isPresent()) {
            return installed;
        }
        return bundledTessdata(language);
    }

    private Optional<Path> tessdataDirectory(String candidate, String language) {
        Path base;
        try {
            base = Path.of(candidate).normalize();
        } catch (InvalidPathException ex) {
            log.warn("Tesseract data path candidate '{}' is invalid: {}", candidate, ex.getMessage());
            return Optional.empty();
        }
        return Stream.of(base, base.resolve("tessdata"))
                .filter(directory -> Files.isRegularFile(directory.resolve(language + ".traineddata")))
                .findFirst();
    }

    private Optional<Path> bundledTessdata(String language) {
        try {
            File extracted = LoadLibs.extractTessResources("tessdata");
            if (extracted != null && Files.isRegularFile(extracted.toPath().resolve(language + ".traineddata"))) {
                log.info("Using tessdata bundled with tess4j");
                return Optional.of(extracted.toPath());
            }
        } catch (RuntimeException ex) {
            log.warn("Unable to extract bundled tessdata: {}", ex.getMessage());
        }
        log.warn("Unable to locate Tesseract language data for '{}'. Provide it via scanner.ocr.datapath or "
                + "TESSDATA_PREFIX; image scans will fail until then.", language);
        return Optional.empty();
    }
}

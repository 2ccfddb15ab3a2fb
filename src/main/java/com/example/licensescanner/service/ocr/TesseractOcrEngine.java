package com.example.licensescanner.service.ocr;

import com.example.licensescanner.service.ocr.OcrFailureException.Kind;
import com.example.licensescanner.service.ocr.OcrText.OcrLine;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.List;
import java.util.Objects;
import javax.imageio.ImageIO;
import net.sourceforge.tess4j.ITessAPI;
import net.sourceforge.tess4j.ITesseract;
import net.sourceforge.tess4j.Word;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * {@link OcrEngine} backed by Tesseract. Lines are read at text-line iterator level so that every
 * line carries its own recognition confidence.
 */
@Component
public class TesseractOcrEngine implements OcrEngine {

    private static final Logger log = LoggerFactory.getLogger(TesseractOcrEngine.class);

    private final ITesseract tesseract;

    public TesseractOcrEngine(ITesseract tesseract) {
        this.tesseract = Objects.requireNonNull(tesseract, "tesseract");
    }

    @Override
    public OcrText recognize(byte[] image) {
        BufferedImage decoded = decode(image);
        List<Word> words;
        try {
            words = tesseract.getWords(decoded, ITessAPI.TessPageIteratorLevel.RIL_TEXTLINE);
        } catch (RuntimeException ex) {
            log.error("Tesseract failed to recognise the image", ex);
            throw new OcrFailureException(Kind.ENGINE_ERROR, "OCR engine failed: " + ex.getMessage(), ex);
        } catch (Error ex) {
            if ("Invalid memory access".equalsIgnoreCase(ex.getMessage())) {
                log.error("Tesseract native layer failed; verify the configured tessdata directory", ex);
                throw new OcrFailureException(Kind.ENGINE_ERROR,
                        "OCR engine failed in its native layer; check the Tesseract language data", ex);
            }
            throw ex;
        }
        if (words == null || words.isEmpty()) {
            log.debug("OCR recognised no text lines");
            return new OcrText(List.of());
        }
        List<OcrLine> lines = words.stream()
                .map(word -> new OcrLine(word.getText() == null ? "" : word.getText().trim(),
                        scale(word.getConfidence())))
                .filter(line -> !line.text().isEmpty())
                .toList();
        log.debug("OCR recognised {} text lines", lines.size());
        return new OcrText(lines);
    }

    private BufferedImage decode(byte[] image) {
        if (image == null || image.length == 0) {
            throw new OcrFailureException(Kind.UNREADABLE_IMAGE, "Image payload is empty");
        }
        try (ByteArrayInputStream inputStream = new ByteArrayInputStream(image)) {
            BufferedImage decoded = ImageIO.read(inputStream);
            if (decoded == null) {
                throw new OcrFailureException(Kind.UNREADABLE_IMAGE, "Unsupported or corrupt image format");
            }
            return decoded;
        } catch (IOException ex) {
            throw new OcrFailureException(Kind.UNREADABLE_IMAGE, "Unable to decode image: " + ex.getMessage(), ex);
        }
    }

    static double scale(float confidence) {
        double scaled = confidence / 100.0;
        if (!Double.isFinite(scaled)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, scaled));
    }
}

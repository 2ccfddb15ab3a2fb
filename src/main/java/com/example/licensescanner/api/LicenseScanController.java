package com.example.licensescanner.api;

import com.example.licensescanner.api.dto.ExtractionRequest;
import com.example.licensescanner.api.dto.HealthResponse;
import com.example.licensescanner.api.dto.LicenseScanResponse;
import com.example.licensescanner.api.dto.RegionResponse;
import com.example.licensescanner.api.dto.ScanBase64Request;
import com.example.licensescanner.service.LicenseScanService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.io.IOException;
import java.util.Base64;
import java.util.List;
import java.util.regex.Pattern;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

@RestController
@RequestMapping(path = "/api/v1/licenses", produces = MediaType.APPLICATION_JSON_VALUE)
@Tag(name = "Driver's license scanning")
@Validated
public class LicenseScanController {

    private static final String SERVICE_NAME = "license-scanner";
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final LicenseScanService scanService;

    public LicenseScanController(LicenseScanService scanService) {
        this.scanService = scanService;
    }

    @PostMapping(value = "/scan", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(summary = "Scan an uploaded licence image",
            description = "Runs OCR on the image and extracts number, issuing region, names and date of birth",
            responses = {
                    @ApiResponse(responseCode = "200", description = "Extraction result",
                            content = @Content(schema = @Schema(implementation = LicenseScanResponse.class))),
                    @ApiResponse(responseCode = "400", description = "Missing image"),
                    @ApiResponse(responseCode = "422", description = "Image could not be decoded")
            })
    public ResponseEntity<LicenseScanResponse> scanFile(@RequestPart("image") MultipartFile image,
                                                        @RequestParam(name = "region", required = false) String region) {
        if (image == null || image.isEmpty()) {
            throw new IllegalArgumentException("Uploaded image must not be empty");
        }
        try {
            return ResponseEntity.ok(LicenseScanResponse.from(scanService.scan(image.getBytes(), region)));
        } catch (IOException ex) {
            throw new IllegalStateException("Unable to read uploaded image", ex);
        }
    }

    @PostMapping(value = "/scan/base64", consumes = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Scan a base64 encoded licence image",
            responses = {
                    @ApiResponse(responseCode = "200", description = "Extraction result",
                            content = @Content(schema = @Schema(implementation = LicenseScanResponse.class))),
                    @ApiResponse(responseCode = "400", description = "Invalid payload"),
                    @ApiResponse(responseCode = "422", description = "Image could not be decoded")
            })
    public ResponseEntity<LicenseScanResponse> scanBase64(@Valid @RequestBody ScanBase64Request request) {
        byte[] imageBytes;
        try {
            imageBytes = Base64.getDecoder().decode(stripDataUrlPrefix(request.imageBase64()));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Invalid Base64 image data", ex);
        }
        return ResponseEntity.ok(LicenseScanResponse.from(scanService.scan(imageBytes, request.region())));
    }

    @PostMapping(value = "/extract", consumes = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Extract licence fields from text lines",
            description = "Skips OCR and runs field extraction on lines recognised elsewhere",
            responses = {
                    @ApiResponse(responseCode = "200", description = "Extraction result",
                            content = @Content(schema = @Schema(implementation = LicenseScanResponse.class))),
                    @ApiResponse(responseCode = "400", description = "No lines or too many lines")
            })
    public ResponseEntity<LicenseScanResponse> extract(@Valid @RequestBody ExtractionRequest request) {
        return ResponseEntity.ok(LicenseScanResponse.from(scanService.extract(request.lines(), request.region())));
    }

    @GetMapping("/regions")
    @Operation(summary = "List supported issuing regions and their number formats")
    public List<RegionResponse> regions() {
        return scanService.regions().stream()
                .map(RegionResponse::from)
                .toList();
    }

    @GetMapping("/health")
    @Operation(summary = "Retrieve scanner health state")
    public HealthResponse health() {
        return new HealthResponse("healthy", SERVICE_NAME, scanService.regions().size());
    }

    private static String stripDataUrlPrefix(String encoded) {
        String payload = encoded.trim();
        int comma = payload.indexOf(',');
        if (payload.startsWith("data:") && comma > 0) {
            payload = payload.substring(comma + 1);
        }
        return WHITESPACE.matcher(payload).replaceAll("");
    }
}

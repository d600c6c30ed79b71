package com.example.autocount.controller;

import com.example.autocount.config.VisualSearchProperties;
import com.example.autocount.model.DocumentSearchRequest;
import com.example.autocount.model.DocumentSearchResponse;
import com.example.autocount.model.HealthResponse;
import com.example.autocount.model.NormalizedBox;
import com.example.autocount.model.SearchRequest;
import com.example.autocount.model.SearchResponse;
import com.example.autocount.service.DocumentSearchService;
import com.example.autocount.service.SearchOptions;
import com.example.autocount.service.TemplateExtractor;
import com.example.autocount.service.VisualSearchService;
import com.example.autocount.service.matching.Orientation;
import com.example.autocount.util.ImageUtils;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.bytedeco.opencv.opencv_core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;

import java.io.IOException;
import java.util.List;
import java.util.stream.Collectors;

import static org.springframework.http.HttpStatus.BAD_REQUEST;

@RestController
@RequestMapping("/api/v1/visual-search")
@Tag(name = "Visual search", description = "Locate and count symbol occurrences on rendered drawing pages")
public class VisualSearchController {

    private static final Logger log = LoggerFactory.getLogger(VisualSearchController.class);

    private final VisualSearchProperties properties;
    private final VisualSearchService visualSearchService;
    private final DocumentSearchService documentSearchService;
    private final TemplateExtractor templateExtractor;

    public VisualSearchController(VisualSearchProperties properties,
                                  VisualSearchService visualSearchService,
                                  DocumentSearchService documentSearchService,
                                  TemplateExtractor templateExtractor) {
        this.properties = properties;
        this.visualSearchService = visualSearchService;
        this.documentSearchService = documentSearchService;
        this.templateExtractor = templateExtractor;
    }

    @PostMapping(value = "/search", consumes = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Search a page image on disk", description = "Matches the template at every position and right-angle orientation of the page.")
    public ResponseEntity<SearchResponse> search(@Valid @RequestBody SearchRequest request) {
        return ResponseEntity.ok(visualSearchService.search(request));
    }

    @PostMapping(value = "/search/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(summary = "Search an uploaded page image", description = "Accepts the page and the template as multipart files.")
    public ResponseEntity<SearchResponse> searchUpload(@RequestPart("image") MultipartFile image,
                                                       @RequestPart("template") MultipartFile template,
                                                       @RequestParam(value = "confidenceThreshold", required = false) Double confidenceThreshold,
                                                       @RequestParam(value = "method", required = false) String method,
                                                       @RequestParam(value = "pageNumber", required = false) Integer pageNumber,
                                                       @RequestParam(value = "maxMatches", required = false) Integer maxMatches) {
        SearchOptions options = visualSearchService.resolveOptions(confidenceThreshold, method, pageNumber, maxMatches);
        return ResponseEntity.ok(visualSearchService.search(readBytes(image, "image"), readBytes(template, "template"), options));
    }

    @PostMapping(value = "/search/document", consumes = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Search every page of a document", description = "Pages are numbered from 1 in list order; failing pages are reported and skipped.")
    public ResponseEntity<DocumentSearchResponse> searchDocument(@Valid @RequestBody DocumentSearchRequest request) {
        return ResponseEntity.ok(documentSearchService.search(request));
    }

    @PostMapping(value = "/template", consumes = MediaType.MULTIPART_FORM_DATA_VALUE, produces = MediaType.IMAGE_PNG_VALUE)
    @Operation(summary = "Crop a symbol template from a page", description = "The selection is given in page fractions between 0 and 1.")
    public ResponseEntity<byte[]> extractTemplate(@RequestPart("image") MultipartFile image,
                                                  @RequestParam("x") double x,
                                                  @RequestParam("y") double y,
                                                  @RequestParam("width") double width,
                                                  @RequestParam("height") double height) {
        Mat page = ImageUtils.decodeColor(readBytes(image, "image"), "image");
        try {
            Mat template = templateExtractor.crop(page, new NormalizedBox(x, y, width, height));
            try {
                log.info("Extracted {}x{} template from {}x{} page", template.cols(), template.rows(), page.cols(), page.rows());
                return ResponseEntity.ok()
                        .contentType(MediaType.IMAGE_PNG)
                        .body(ImageUtils.encodePng(template));
            } finally {
                template.close();
            }
        } finally {
            page.close();
        }
    }

    @GetMapping("/health")
    @Operation(summary = "Retrieve the active search defaults")
    public ResponseEntity<HealthResponse> health() {
        List<Integer> orientations = visualSearchService.orientations().stream()
                .map(Orientation::degrees)
                .collect(Collectors.toList());
        return ResponseEntity.ok(new HealthResponse("UP", properties.getDefaultThreshold(), properties.getDefaultMethod(),
                orientations, properties.getMaxRawDetections(), properties.getMaxMatches()));
    }

    private byte[] readBytes(MultipartFile file, String name) {
        if (file == null || file.isEmpty()) {
            throw new ResponseStatusException(BAD_REQUEST, "Multipart file '" + name + "' is required");
        }
        try {
            return file.getBytes();
        } catch (IOException ex) {
            throw new ResponseStatusException(BAD_REQUEST, "Failed to read uploaded " + name, ex);
        }
    }
}

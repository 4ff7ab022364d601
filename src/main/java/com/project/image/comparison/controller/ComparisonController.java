package com.project.image.comparison.controller;

import com.project.image.comparison.DTOs.AlignStrategy;
import com.project.image.comparison.DTOs.ComparisonOptions;
import com.project.image.comparison.DTOs.PreprocessMode;
import com.project.image.comparison.DTOs.SimilarityReport;
import com.project.image.comparison.config.ComparisonDefaults;
import com.project.image.comparison.exceptions.ComparisonException;
import com.project.image.comparison.service.ImageComparisonService;
import com.project.image.comparison.service.StorageService;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.multipart.MultipartFile;

import java.util.Arrays;
import java.util.List;

@Controller
@Validated
public class ComparisonController {
    private static final Logger log = LoggerFactory.getLogger(ComparisonController.class);

    private static final List<String> SUPPORTED_FORMATS = Arrays.asList(
            "image/jpeg", "image/jpg", "image/png", "image/gif", "image/bmp", "image/webp", "image/tiff"
    );
    private static final long MAX_UPLOAD_BYTES = 10 * 1024 * 1024;

    private final ImageComparisonService comparisonService;
    private final StorageService storageService;
    private final ComparisonDefaults defaults;

    public ComparisonController(ImageComparisonService comparisonService, StorageService storageService,
                                ComparisonDefaults defaults) {
        this.comparisonService = comparisonService;
        this.storageService = storageService;
        this.defaults = defaults;
    }

    @GetMapping("/compare")
    public String showForm(Model model) {
        populateForm(model);
        return "compare";
    }

    @PostMapping(value = "/compare", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public String handleUpload(
            @RequestParam("first") @NotNull MultipartFile first,
            @RequestParam("second") @NotNull MultipartFile second,
            @RequestParam(name = "threshold", required = false)
            @DecimalMin(value = "0", message = "The similarity threshold must be at least 0")
            @DecimalMax(value = "100", message = "The similarity threshold cannot exceed 100")
            Double threshold,
            @RequestParam(name = "align", defaultValue = "auto") String align,
            @RequestParam(name = "diffThreshold", required = false)
            @Min(value = 0, message = "The diff threshold must be at least 0")
            @Max(value = 255, message = "The diff threshold cannot exceed 255")
            Integer diffThreshold,
            @RequestParam(name = "cad", defaultValue = "false") boolean cad,
            @RequestParam(name = "cadEnhance", defaultValue = "false") boolean cadEnhance,
            @RequestParam(name = "contour", defaultValue = "false") boolean contour,
            @RequestParam(name = "contourThreshold", required = false)
            @DecimalMin(value = "0", message = "The contour threshold must be at least 0")
            @DecimalMax(value = "1", message = "The contour threshold cannot exceed 1")
            Double contourThreshold,
            Model model
    ) {
        validateUploadedFile(first);
        validateUploadedFile(second);

        ComparisonOptions base = defaults.options();
        ComparisonOptions options = new ComparisonOptions(
                base.outputDir(),
                threshold != null ? threshold : base.threshold(),
                AlignStrategy.fromName(align),
                diffThreshold != null ? diffThreshold : base.diffThreshold(),
                PreprocessMode.of(cad, cadEnhance),
                contour,
                contourThreshold != null ? contourThreshold : base.contourThreshold(),
                base.contourWeightedScore(),
                false);

        var storedFirst = storageService.store(first);
        var storedSecond = storageService.store(second);
        log.info("Comparing uploads {} and {}", storedFirst.filename(), storedSecond.filename());

        try {
            SimilarityReport report = comparisonService.compare(storedFirst.path(), storedSecond.path(), options);
            populateResultModel(model, storedFirst, storedSecond, report);
            return "result";
        } catch (ComparisonException e) {
            log.warn("Comparison failed: {}", e.getMessage());
            model.addAttribute("error", e.getMessage());
            populateForm(model);
            return "compare";
        }
    }

    private void validateUploadedFile(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new IllegalArgumentException("Please choose two images to compare");
        }
        String contentType = file.getContentType();
        if (contentType == null || !SUPPORTED_FORMATS.contains(contentType.toLowerCase())) {
            throw new IllegalArgumentException("Unsupported file type: " + contentType
                    + ". Supported types: " + String.join(", ", SUPPORTED_FORMATS));
        }
        if (file.getSize() > MAX_UPLOAD_BYTES) {
            throw new IllegalArgumentException("File too large. Maximum size: 10MB");
        }
    }

    private void populateForm(Model model) {
        ComparisonOptions base = defaults.options();
        model.addAttribute("defaultThreshold", base.threshold());
        model.addAttribute("defaultDiffThreshold", base.diffThreshold());
        model.addAttribute("defaultContourThreshold", base.contourThreshold());
        model.addAttribute("supportedFormats", String.join(", ", SUPPORTED_FORMATS));
    }

    private void populateResultModel(Model model, StorageService.StoredFile first, StorageService.StoredFile second,
                                     SimilarityReport report) {
        model.addAttribute("firstPath", "/" + first.relativeWebPath());
        model.addAttribute("secondPath", "/" + second.relativeWebPath());
        model.addAttribute("report", report);
        model.addAttribute("ssim", String.format("%.2f", report.ssim()));
        model.addAttribute("pixelSimilarity", String.format("%.2f", report.pixelSimilarity()));
        model.addAttribute("combined", String.format("%.2f", report.combined()));
        model.addAttribute("contourSimilarity",
                report.contourSimilarity() == null ? null : String.format("%.2f", report.contourSimilarity()));
        model.addAttribute("verdict", report.verdictLabel());
        model.addAttribute("artifacts", report.artifacts().stream()
                .map(p -> p.getFileName().toString())
                .map(name -> new Artifact(name, "/outputs/" + name))
                .toList());
    }

    public record Artifact(String name, String url) {}
}

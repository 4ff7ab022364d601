package com.project.image.comparison.cli;

import com.project.image.comparison.DTOs.AlignStrategy;
import com.project.image.comparison.DTOs.ComparisonOptions;
import com.project.image.comparison.DTOs.PreprocessMode;
import com.project.image.comparison.DTOs.SimilarityReport;
import com.project.image.comparison.config.ComparisonDefaults;
import com.project.image.comparison.exceptions.ComparisonException;
import com.project.image.comparison.service.ImageComparisonService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Command-line surface:
 * {@code <img1> <img2> [--output=DIR] [--threshold=90] [--align=auto|center|feature]
 * [--diff-threshold=30] [--cad] [--cad-enhance] [--contour] [--contour-threshold=0.8] [--display]}.
 * Does nothing when started without positional arguments (web mode).
 */
@Component
public class CompareCommand implements ApplicationRunner, ExitCodeGenerator {
    private static final Logger log = LoggerFactory.getLogger(CompareCommand.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILED = 1;
    public static final int EXIT_USAGE = 2;

    static final String USAGE = "Usage: <img1> <img2> [--output=DIR] [--threshold=0-100] "
            + "[--align=auto|center|feature] [--diff-threshold=N] [--cad] [--cad-enhance] "
            + "[--contour] [--contour-threshold=0-1] [--display]\n"
            + "Option values are joined with '=' (--output=DIR); a separate value counts as an image path.";

    private final ImageComparisonService comparisonService;
    private final ComparisonDefaults defaults;
    private int exitCode = EXIT_OK;

    public CompareCommand(ImageComparisonService comparisonService, ComparisonDefaults defaults) {
        this.comparisonService = comparisonService;
        this.defaults = defaults;
    }

    @Override
    public void run(ApplicationArguments args) {
        List<String> paths = args.getNonOptionArgs();
        if (paths.isEmpty()) {
            return;
        }
        ComparisonOptions options;
        try {
            if (paths.size() != 2) {
                throw new IllegalArgumentException("Expected exactly two image paths, got " + paths.size() + " " + paths);
            }
            options = parseOptions(args, defaults.options());
        } catch (IllegalArgumentException e) {
            log.error("{}\n{}", e.getMessage(), USAGE);
            exitCode = EXIT_USAGE;
            return;
        }

        try {
            SimilarityReport report = comparisonService.compare(Paths.get(paths.get(0)), Paths.get(paths.get(1)), options);
            log.info("Result: {} ({}%), artifacts in {}", report.verdictLabel(),
                    String.format("%.2f", report.combined()), options.outputDir().toAbsolutePath());
            exitCode = report.failedArtifacts().isEmpty() ? EXIT_OK : EXIT_FAILED;
        } catch (ComparisonException e) {
            log.error("Comparison aborted: {}", e.getMessage());
            exitCode = EXIT_FAILED;
        }
    }

    public static ComparisonOptions parseOptions(ApplicationArguments args, ComparisonOptions defaults) {
        Path outputDir = value(args, "output") != null ? Paths.get(value(args, "output")) : defaults.outputDir();
        double threshold = value(args, "threshold") != null
                ? parseDouble("threshold", value(args, "threshold")) : defaults.threshold();
        AlignStrategy align = value(args, "align") != null
                ? AlignStrategy.fromName(value(args, "align")) : defaults.align();
        int diffThreshold = value(args, "diff-threshold") != null
                ? parseInt("diff-threshold", value(args, "diff-threshold")) : defaults.diffThreshold();
        double contourThreshold = value(args, "contour-threshold") != null
                ? parseDouble("contour-threshold", value(args, "contour-threshold")) : defaults.contourThreshold();

        PreprocessMode mode = PreprocessMode.of(flag(args, "cad"), flag(args, "cad-enhance"));
        return new ComparisonOptions(outputDir, threshold, align, diffThreshold, mode, flag(args, "contour"),
                contourThreshold, defaults.contourWeightedScore(), flag(args, "display"));
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private static String value(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) {
            return null;
        }
        return values.get(values.size() - 1);
    }

    /** {@code --cad} and {@code --cad=true} enable, {@code --cad=false} disables. */
    private static boolean flag(ApplicationArguments args, String name) {
        if (!args.containsOption(name)) {
            return false;
        }
        String v = value(args, name);
        return v == null || !v.equalsIgnoreCase("false");
    }

    private static double parseDouble(String name, String raw) {
        try {
            return Double.parseDouble(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--" + name + " expects a number, got '" + raw + "'");
        }
    }

    private static int parseInt(String name, String raw) {
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--" + name + " expects an integer, got '" + raw + "'");
        }
    }
}

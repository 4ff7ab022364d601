package com.project.image.comparison;

import com.project.image.comparison.DTOs.AlignStrategy;
import com.project.image.comparison.DTOs.ComparisonOptions;
import com.project.image.comparison.DTOs.PreprocessMode;
import com.project.image.comparison.cli.CompareCommand;
import com.project.image.comparison.config.ComparisonDefaults;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.DefaultApplicationArguments;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

class CompareCommandTest {
    @TempDir
    Path tmp;

    private final ComparisonDefaults defaults = new ComparisonDefaults("output", 90.0, "auto", 30, 0.8, false);

    @Test
    void parseOptions_usesDefaultsWhenAbsent() {
        ComparisonOptions options = CompareCommand.parseOptions(args("a.png", "b.png"), defaults.options());

        assertThat(options.outputDir()).isEqualTo(Path.of("output"));
        assertThat(options.threshold()).isEqualTo(90.0);
        assertThat(options.align()).isEqualTo(AlignStrategy.AUTO);
        assertThat(options.diffThreshold()).isEqualTo(30);
        assertThat(options.preprocessMode()).isEqualTo(PreprocessMode.STANDARD);
        assertThat(options.contourMode()).isFalse();
        assertThat(options.contourThreshold()).isEqualTo(0.8);
        assertThat(options.display()).isFalse();
    }

    @Test
    void parseOptions_readsEveryOption() {
        ComparisonOptions options = CompareCommand.parseOptions(args("a.png", "b.png",
                "--output=results", "--threshold=75.5", "--align=feature", "--diff-threshold=12",
                "--cad-enhance", "--contour", "--contour-threshold=0.4", "--display=false"), defaults.options());

        assertThat(options.outputDir()).isEqualTo(Path.of("results"));
        assertThat(options.threshold()).isEqualTo(75.5);
        assertThat(options.align()).isEqualTo(AlignStrategy.FEATURE);
        assertThat(options.diffThreshold()).isEqualTo(12);
        assertThat(options.preprocessMode()).isEqualTo(PreprocessMode.CAD_ENHANCE);
        assertThat(options.contourMode()).isTrue();
        assertThat(options.contourThreshold()).isEqualTo(0.4);
        assertThat(options.display()).isFalse();
    }

    @Test
    void parseOptions_rejectsBadValues() {
        assertThatThrownBy(() -> CompareCommand.parseOptions(args("a", "b", "--align=sideways"), defaults.options()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CompareCommand.parseOptions(args("a", "b", "--threshold=abc"), defaults.options()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CompareCommand.parseOptions(args("a", "b", "--threshold=140"), defaults.options()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CompareCommand.parseOptions(args("a", "b", "--diff-threshold=300"), defaults.options()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void run_withoutPaths_isANoOp() {
        CompareCommand command = command();
        command.run(args());
        assertThat(command.getExitCode()).isEqualTo(CompareCommand.EXIT_OK);
    }

    @Test
    void run_withOnePath_isAUsageError() {
        CompareCommand command = command();
        command.run(args("only.png"));
        assertThat(command.getExitCode()).isEqualTo(CompareCommand.EXIT_USAGE);
    }

    @Test
    void run_withSpaceSeparatedOptionValue_isAUsageError() {
        CompareCommand command = command();
        command.run(args("a.png", "b.png", "--output", "results"));
        assertThat(command.getExitCode()).isEqualTo(CompareCommand.EXIT_USAGE);
    }

    @Test
    void run_withMissingImage_fails() {
        CompareCommand command = command();
        command.run(args(tmp.resolve("x.png").toString(), tmp.resolve("y.png").toString(),
                "--output=" + tmp.resolve("out")));
        assertThat(command.getExitCode()).isEqualTo(CompareCommand.EXIT_FAILED);
    }

    @Test
    void run_comparesAndWritesArtifacts() {
        Path a = TestImages.write(tmp, "left.png", TestImages.checkerboard(100, 10));
        Path b = TestImages.write(tmp, "right.png", TestImages.checkerboard(100, 10));
        Path out = tmp.resolve("out");

        CompareCommand command = command();
        command.run(args(a.toString(), b.toString(), "--output=" + out, "--align=center"));

        assertThat(command.getExitCode()).isEqualTo(CompareCommand.EXIT_OK);
        assertThat(out.resolve("left_right_result.txt")).exists();
        assertThat(out.resolve("left_right_comparison.png")).exists();
    }

    private CompareCommand command() {
        return new CompareCommand(TestImages.services(tmp.resolve("uploads")).comparison(), defaults);
    }

    private static DefaultApplicationArguments args(String... args) {
        return new DefaultApplicationArguments(args);
    }
}

package com.project.image.comparison;

import com.project.image.comparison.DTOs.AlignStrategy;
import com.project.image.comparison.DTOs.ComparisonOptions;
import com.project.image.comparison.DTOs.Image;
import com.project.image.comparison.DTOs.PreprocessMode;
import com.project.image.comparison.service.ImagePreprocessor;
import org.junit.jupiter.api.Test;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

class ImagePreprocessorTest {
    private final ImagePreprocessor preprocessor = new ImagePreprocessor();

    @Test
    void toGray_returnsSingleChannel() {
        Image gray = preprocessor.toGray(TestImages.image(TestImages.scene()));
        assertThat(gray.channels()).isEqualTo(1);
        assertThat(gray.width()).isEqualTo(400);
        assertThat(gray.height()).isEqualTo(300);
    }

    @Test
    void standardMode_leavesPixelsUntouched() {
        Image input = TestImages.image(TestImages.scene());
        Image out = preprocessor.preprocess(input, PreprocessMode.STANDARD);

        Mat diff = new Mat();
        Core.absdiff(input.toMat(), out.toMat(), diff);
        assertThat(Core.countNonZero(preprocessor.toGray(Image.of(diff)).toMat())).isZero();
    }

    @Test
    void cadModes_produceBinaryImages_andKeepChannelLayout() {
        Image input = TestImages.image(gradient());
        for (PreprocessMode mode : new PreprocessMode[]{PreprocessMode.CAD, PreprocessMode.CAD_ENHANCE}) {
            Image out = preprocessor.preprocess(input, mode);
            assertThat(out.channels()).as(mode.name()).isEqualTo(3);

            Mat midTones = new Mat();
            Core.inRange(preprocessor.toGray(out).toMat(), new Scalar(1), new Scalar(254), midTones);
            assertThat(Core.countNonZero(midTones)).as(mode.name()).isZero();
        }
    }

    @Test
    void resizeTo_changesDimensions() {
        Image resized = preprocessor.resizeTo(TestImages.image(TestImages.scene()), 200, 120);
        assertThat(resized.width()).isEqualTo(200);
        assertThat(resized.height()).isEqualTo(120);
    }

    @Test
    void cadPolicy_clampsDiffThreshold_andForcesCenterAlignment() {
        ComparisonOptions requested = options(PreprocessMode.CAD, AlignStrategy.FEATURE, 30);
        ComparisonOptions applied = preprocessor.applyCadPolicy(requested);

        assertThat(applied.diffThreshold()).isEqualTo(ImagePreprocessor.CAD_MAX_DIFF_THRESHOLD);
        assertThat(applied.align()).isEqualTo(AlignStrategy.CENTER);
    }

    @Test
    void cadPolicy_keepsLowerDiffThreshold() {
        ComparisonOptions applied = preprocessor.applyCadPolicy(options(PreprocessMode.CAD_ENHANCE, AlignStrategy.AUTO, 10));
        assertThat(applied.diffThreshold()).isEqualTo(10);
        assertThat(applied.align()).isEqualTo(AlignStrategy.CENTER);
    }

    @Test
    void cadPolicy_ignoresStandardMode() {
        ComparisonOptions requested = options(PreprocessMode.STANDARD, AlignStrategy.FEATURE, 30);
        assertThat(preprocessor.applyCadPolicy(requested)).isEqualTo(requested);
    }

    private static ComparisonOptions options(PreprocessMode mode, AlignStrategy align, int diffThreshold) {
        return new ComparisonOptions(Path.of("out"), 90, align, diffThreshold, mode, false, 0.8, false, false);
    }

    private static Mat gradient() {
        Mat img = new Mat(100, 256, CvType.CV_8UC3);
        for (int x = 0; x < 256; x++) {
            for (int y = 0; y < 100; y++) {
                img.put(y, x, x, x, x);
            }
        }
        return img;
    }
}

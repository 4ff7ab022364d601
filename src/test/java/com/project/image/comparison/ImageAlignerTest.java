package com.project.image.comparison;

import com.project.image.comparison.DTOs.AlignStrategy;
import com.project.image.comparison.DTOs.AlignmentMethod;
import com.project.image.comparison.DTOs.AlignmentResult;
import com.project.image.comparison.DTOs.Image;
import com.project.image.comparison.service.ImagePreprocessor;
import com.project.image.comparison.service.SsimCalculator;
import com.project.image.comparison.service.align.HuMomentShapeAlignment;
import com.project.image.comparison.service.align.ImageAligner;
import org.junit.jupiter.api.Test;
import org.opencv.core.Mat;
import org.opencv.core.Point;
import org.opencv.core.Scalar;
import org.opencv.imgproc.Imgproc;

import java.nio.file.Path;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

class ImageAlignerTest {
    private final ImageAligner aligner = TestImages.services(Path.of("target", "aligner-uploads")).aligner();

    @Test
    void shiftedScene_isRegisteredByATransformAwareMethod() {
        Image img1 = TestImages.image(TestImages.scene());
        Image img2 = TestImages.image(TestImages.translate(TestImages.scene(), 15, 10));

        AlignmentResult result = aligner.align(img1, img2, AlignStrategy.AUTO);

        assertThat(result.method()).isIn(AlignmentMethod.FEATURE_HOMOGRAPHY, AlignmentMethod.ECC_AFFINE);
        assertThat(result.confidence()).isGreaterThan(0.9);
        assertThat(result.aligned().sameSizeAs(img2)).isTrue();
    }

    @Test
    void textureless_pair_fallsBackToCentroid() {
        Image flat = TestImages.image(TestImages.solid(200, 200, 100));

        AlignmentResult result = aligner.align(flat, flat, AlignStrategy.AUTO);

        assertThat(result).isNotNull();
        assertThat(result.method()).isEqualTo(AlignmentMethod.CENTROID);
    }

    @Test
    void featureStrategy_fallsBackToCentroid_whenNothingMatches() {
        Image flat = TestImages.image(TestImages.solid(200, 200, 100));
        Image noise = TestImages.image(TestImages.noise(200, 200, 3));

        AlignmentResult result = aligner.align(flat, noise, AlignStrategy.FEATURE);

        assertThat(result.method()).isEqualTo(AlignmentMethod.CENTROID);
    }

    @Test
    void centerStrategy_skipsTransformAwareMethods() {
        Image img1 = TestImages.image(TestImages.scene());
        Image img2 = TestImages.image(TestImages.translate(TestImages.scene(), 15, 10));

        AlignmentResult result = aligner.align(img1, img2, AlignStrategy.CENTER);

        assertThat(result.method()).isEqualTo(AlignmentMethod.CENTROID);
        assertThat(result.aligned().sameSizeAs(img1)).isTrue();
        assertThat(result.reference().sameSizeAs(img2)).isTrue();
    }

    @Test
    void shapeAlignment_registersSameShapeAtOtherScaleAndPosition() {
        Image small = TestImages.image(TestImages.squares(200, 200, 40, new Point(20, 30)));
        Image large = TestImages.image(TestImages.squares(200, 200, 60, new Point(100, 90)));

        Optional<AlignmentResult> result = shapeAlignment().attempt(small, large);

        assertThat(result).isPresent();
        assertThat(result.get().method()).isEqualTo(AlignmentMethod.HU_MOMENT_SHAPE);
        assertThat(result.get().confidence()).isGreaterThan(ImageAligner.ACCEPTANCE_FLOOR);
    }

    @Test
    void shapeAlignment_rejectsDissimilarShapes() {
        Image square = TestImages.image(TestImages.squares(200, 200, 60, new Point(70, 70)));
        Mat bar = TestImages.solid(200, 200, 0);
        Imgproc.rectangle(bar, new Point(20, 90), new Point(179, 95), new Scalar(255, 255, 255), -1);

        assertThat(shapeAlignment().attempt(square, TestImages.image(bar))).isEmpty();
    }

    @Test
    void unequalSizes_areRejected() {
        Image small = TestImages.image(TestImages.solid(100, 100, 10));
        Image large = TestImages.image(TestImages.solid(120, 100, 10));
        assertThatThrownBy(() -> aligner.align(small, large, AlignStrategy.AUTO))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static HuMomentShapeAlignment shapeAlignment() {
        ImagePreprocessor preprocessor = new ImagePreprocessor();
        return new HuMomentShapeAlignment(preprocessor, new SsimCalculator(preprocessor));
    }
}

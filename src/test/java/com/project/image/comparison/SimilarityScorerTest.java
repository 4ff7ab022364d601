package com.project.image.comparison;

import com.project.image.comparison.DTOs.AlignStrategy;
import com.project.image.comparison.DTOs.AlignmentMethod;
import com.project.image.comparison.DTOs.AlignmentResult;
import com.project.image.comparison.DTOs.ComparisonOptions;
import com.project.image.comparison.DTOs.Image;
import com.project.image.comparison.DTOs.PreprocessMode;
import com.project.image.comparison.DTOs.SimilarityScores;
import com.project.image.comparison.service.SimilarityScorer;
import org.junit.jupiter.api.Test;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Point;
import org.opencv.core.Scalar;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

class SimilarityScorerTest {
    private final SimilarityScorer scorer = TestImages.services(Path.of("target", "scorer-uploads")).scorer();

    @Test
    void identicalPair_scoresExactlyOneHundred_andPassesStrictestThreshold() {
        Image board = TestImages.image(TestImages.checkerboard(200, 20));
        AlignmentResult pair = new AlignmentResult(board, board, AlignmentMethod.CENTROID, 1.0);

        SimilarityScores scores = scorer.score(pair, options(100, false, false));

        assertThat(scores.ssim()).isEqualTo(100.0);
        assertThat(scores.pixelSimilarity()).isEqualTo(100.0);
        assertThat(scores.combined()).isEqualTo(100.0);
        assertThat(scores.similar()).isTrue();
        assertThat(scores.contourSimilarity()).isNull();
    }

    @Test
    void verdict_isInclusiveAtThreshold() {
        assertThat(SimilarityScorer.verdict(90.0, 90.0)).isTrue();
        assertThat(SimilarityScorer.verdict(89.99, 90.0)).isFalse();
        assertThat(SimilarityScorer.verdict(0.0, 0.0)).isTrue();
    }

    @Test
    void combine_weightsStructureOverPixels() {
        assertThat(SimilarityScorer.combine(100, 0)).isCloseTo(70.0, within(1e-9));
        assertThat(SimilarityScorer.combine(0, 100)).isCloseTo(30.0, within(1e-9));
    }

    @Test
    void contourWeighted_dependsOnPreprocessMode() {
        assertThat(SimilarityScorer.contourWeighted(100, 0, 0, true)).isCloseTo(50.0, within(1e-9));
        assertThat(SimilarityScorer.contourWeighted(100, 0, 0, false)).isCloseTo(20.0, within(1e-9));
        assertThat(SimilarityScorer.contourWeighted(0, 100, 100, true)).isCloseTo(50.0, within(1e-9));
        assertThat(SimilarityScorer.contourWeighted(0, 100, 100, false)).isCloseTo(80.0, within(1e-9));
    }

    @Test
    void pixelSimilarity_countsAnyDifference() {
        Mat diff = new Mat(10, 10, CvType.CV_8UC1, new Scalar(0));
        diff.put(0, 0, 1);
        diff.put(5, 5, 200);
        assertThat(SimilarityScorer.pixelSimilarity(diff)).isCloseTo(98.0, within(1e-9));
    }

    @Test
    void contourMode_reportsContourScore_withoutChangingVerdictFormula() {
        Image shapes = TestImages.image(TestImages.squares(200, 200, 50, new Point(30, 30), new Point(120, 110)));
        AlignmentResult pair = new AlignmentResult(shapes, shapes, AlignmentMethod.CENTROID, 1.0);

        SimilarityScores scores = scorer.score(pair, options(90, true, false));

        assertThat(scores.contourSimilarity()).isCloseTo(200.0 / 3, within(1e-6));
        assertThat(scores.contourMatches()).hasSize(2);
        assertThat(scores.combined()).isEqualTo(100.0);
    }

    @Test
    void contourWeightedScore_replacesCombined_whenEnabled() {
        Image shapes = TestImages.image(TestImages.squares(200, 200, 50, new Point(30, 30), new Point(120, 110)));
        AlignmentResult pair = new AlignmentResult(shapes, shapes, AlignmentMethod.CENTROID, 1.0);

        SimilarityScores scores = scorer.score(pair, options(95, true, true));

        // 0.2 * 66.67 + 0.5 * 100 + 0.3 * 100
        assertThat(scores.combined()).isCloseTo(0.2 * 200.0 / 3 + 80.0, within(1e-6));
        assertThat(scores.similar()).isFalse();
    }

    private static ComparisonOptions options(double threshold, boolean contour, boolean weighted) {
        return new ComparisonOptions(Path.of("out"), threshold, AlignStrategy.AUTO, 30, PreprocessMode.STANDARD,
                contour, 0.5, weighted, false);
    }
}

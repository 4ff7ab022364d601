package com.project.image.comparison;

import com.project.image.comparison.DTOs.Image;
import com.project.image.comparison.service.ImagePreprocessor;
import com.project.image.comparison.service.SsimCalculator;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class SsimCalculatorTest {
    private final SsimCalculator ssim = new SsimCalculator(new ImagePreprocessor());

    @Test
    void identicalImages_scoreExactlyOne() {
        Image board = TestImages.image(TestImages.checkerboard(200, 20));
        assertThat(ssim.compute(board, board)).isEqualTo(1.0);
    }

    @Test
    void noiseAgainstFlatGray_scoresNearZero() {
        Image noise = TestImages.image(TestImages.noise(120, 120, 42));
        Image flat = TestImages.image(TestImages.solid(120, 120, 128));
        assertThat(ssim.compute(noise, flat)).isBetween(-0.1, 0.1);
    }

    @Test
    void shiftedScene_scoresBelowIdentical() {
        Image scene = TestImages.image(TestImages.scene());
        Image shifted = TestImages.image(TestImages.translate(TestImages.scene(), 15, 10));
        assertThat(ssim.compute(scene, shifted)).isLessThan(0.95);
    }

    @Test
    void differentSizes_areRejected() {
        Image a = TestImages.image(TestImages.solid(50, 50, 10));
        Image b = TestImages.image(TestImages.solid(60, 50, 10));
        assertThatThrownBy(() -> ssim.compute(a, b)).isInstanceOf(IllegalArgumentException.class);
    }
}

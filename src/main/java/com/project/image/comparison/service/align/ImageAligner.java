package com.project.image.comparison.service.align;

import com.project.image.comparison.DTOs.AlignStrategy;
import com.project.image.comparison.DTOs.AlignmentResult;
import com.project.image.comparison.DTOs.Image;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Runs the alignment fallback chain. Transform-aware methods are tried first
 * and the first one whose result clears the SSIM floor wins; the centroid
 * method closes every chain.
 */
@Service
public class ImageAligner {
    private static final Logger log = LoggerFactory.getLogger(ImageAligner.class);

    /** A candidate alignment is kept only if its SSIM (0-1) is strictly above this. */
    public static final double ACCEPTANCE_FLOOR = 0.30;

    private final List<AlignmentStrategy> autoChain;
    private final List<AlignmentStrategy> featureChain;
    private final CentroidAlignment centroid;

    public ImageAligner(FeatureHomographyAlignment feature,
                        EccAffineAlignment ecc,
                        HuMomentShapeAlignment shape,
                        CentroidAlignment centroid) {
        this.autoChain = List.of(feature, ecc, shape);
        this.featureChain = List.of(feature);
        this.centroid = centroid;
    }

    /**
     * @param img1 image to register; both images are expected to share a size
     * @param img2 reference frame
     */
    public AlignmentResult align(Image img1, Image img2, AlignStrategy strategy) {
        if (!img1.sameSizeAs(img2)) {
            throw new IllegalArgumentException("Images must be resized to a common size first: " + img1 + " vs " + img2);
        }
        for (AlignmentStrategy candidate : chainFor(strategy)) {
            Optional<AlignmentResult> result = candidate.attempt(img1, img2);
            if (result.isEmpty()) {
                continue;
            }
            double confidence = result.get().confidence();
            if (confidence > ACCEPTANCE_FLOOR) {
                log.info("Aligned with {} (SSIM {})", candidate.method(), String.format("%.3f", confidence));
                return result.get();
            }
            log.info("{} rejected, SSIM {} not above {}", candidate.method(),
                    String.format("%.3f", confidence), ACCEPTANCE_FLOOR);
        }
        AlignmentResult fallback = centroid.align(img1, img2);
        log.info("Aligned with {} (SSIM {})", fallback.method(), String.format("%.3f", fallback.confidence()));
        return fallback;
    }

    private List<AlignmentStrategy> chainFor(AlignStrategy strategy) {
        return switch (strategy) {
            case AUTO -> autoChain;
            case FEATURE -> featureChain;
            case CENTER -> List.of();
        };
    }
}

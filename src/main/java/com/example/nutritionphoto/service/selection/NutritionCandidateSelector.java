package com.example.nutritionphoto.service.selection;

import com.example.nutritionphoto.model.BoundingBox;
import com.example.nutritionphoto.model.CandidateEvaluation;
import com.example.nutritionphoto.model.ImageRecord;
import com.example.nutritionphoto.model.NutritionInsight;
import com.example.nutritionphoto.model.ProductContext;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Selects at most one nutrition photo per product. Images are scanned from the most recent to
 * the oldest and the scan stops at the first image qualifying for the product's main language,
 * so a newer qualifying photo always wins over an older one. Other languages are evaluated but
 * never selected.
 */
@Component
public class NutritionCandidateSelector {

    private static final Logger log = LoggerFactory.getLogger(NutritionCandidateSelector.class);

    private static final Comparator<ImageRecord> MOST_RECENT_FIRST =
            Comparator.comparingLong(ImageRecord::imageId).reversed();

    private final NutritionImageEvaluator evaluator;
    private final CropResolver cropResolver;

    public NutritionCandidateSelector(NutritionImageEvaluator evaluator, CropResolver cropResolver) {
        this.evaluator = evaluator;
        this.cropResolver = cropResolver;
    }

    public Optional<NutritionInsight> select(ProductContext product) {
        Objects.requireNonNull(product, "product");
        String mainLanguage = product.mainLanguage();
        if (mainLanguage == null || mainLanguage.isBlank()) {
            log.debug("Product {} has no main language, skipping", product.productCode());
            return Optional.empty();
        }

        List<ImageRecord> images = product.images().stream()
                .sorted(MOST_RECENT_FIRST)
                .collect(Collectors.toList());

        for (ImageRecord image : images) {
            Optional<CandidateEvaluation> match = evaluator.evaluate(image).stream()
                    .filter(evaluation -> mainLanguage.equals(evaluation.language()))
                    .min(Comparator.comparingInt(CandidateEvaluation::priority));
            if (match.isPresent()) {
                return Optional.of(toInsight(product, image, match.get()));
            }
        }

        log.debug("No image of product {} qualifies for language {}", product.productCode(), mainLanguage);
        return Optional.empty();
    }

    private NutritionInsight toInsight(ProductContext product, ImageRecord image, CandidateEvaluation evaluation) {
        BoundingBox crop = cropResolver.resolve(image).orElse(null);
        log.debug(
                "Selected image {} of product {} (language: {}, priority: {}, names: {}, values: {}, cropped: {})",
                image.imageId(),
                product.productCode(),
                evaluation.language(),
                evaluation.priority(),
                evaluation.nameCount(),
                evaluation.valueCount(),
                crop != null);
        return new NutritionInsight(product.productCode(), image.imageId(), evaluation.language(),
                evaluation.priority(), crop);
    }
}

package com.example.nutritionphoto.service;

import com.example.nutritionphoto.config.NutritionPhotoProperties;
import com.example.nutritionphoto.model.NutritionInsight;
import com.example.nutritionphoto.model.ObjectDetection;
import com.example.nutritionphoto.model.ProductContext;
import com.example.nutritionphoto.service.selection.NutritionCandidateSelector;
import jakarta.annotation.PostConstruct;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point for nutrition photo selection. Stateless: concurrent calls for different products
 * need no coordination.
 */
@Service
public class NutritionImageService {

    private static final Logger log = LoggerFactory.getLogger(NutritionImageService.class);

    private final NutritionCandidateSelector selector;
    private final ProductContextAssembler assembler;
    private final NutritionPhotoProperties properties;

    public NutritionImageService(NutritionCandidateSelector selector,
                                 ProductContextAssembler assembler,
                                 NutritionPhotoProperties properties) {
        this.selector = selector;
        this.assembler = assembler;
        this.properties = properties;
    }

    @PostConstruct
    void logThresholds() {
        log.info("Nutrition photo selection requires {} names, {} values (energy required: {}); crop on single {} >= {}",
                properties.selection().minNameMentions(),
                properties.selection().minValueMentions(),
                properties.selection().requireEnergyValue(),
                properties.crop().label(),
                properties.crop().minConfidence());
    }

    public Optional<NutritionInsight> evaluate(ProductContext product) {
        return selector.select(product);
    }

    public Optional<NutritionInsight> evaluate(String productCode,
                                               String mainLanguage,
                                               Collection<Long> imageIds,
                                               Map<Long, String> ocrTexts,
                                               Map<Long, List<ObjectDetection>> detections) {
        return evaluate(assembler.assembleFromText(productCode, mainLanguage, imageIds, ocrTexts, detections));
    }
}

package com.example.nutritionphoto.service;

import com.example.nutritionphoto.model.ImageRecord;
import com.example.nutritionphoto.model.NutrientMention;
import com.example.nutritionphoto.model.NutrientPair;
import com.example.nutritionphoto.model.ObjectDetection;
import com.example.nutritionphoto.model.ProductContext;
import com.example.nutritionphoto.service.extraction.ExtractedEvidence;
import com.example.nutritionphoto.service.extraction.NutrientMentionExtractor;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Builds a {@link ProductContext} from evidence delivered per image id. Evidence that refers to
 * an image the product does not own is dropped; images without evidence are still part of the
 * product and simply never qualify.
 */
@Component
public class ProductContextAssembler {

    private static final Logger log = LoggerFactory.getLogger(ProductContextAssembler.class);

    private final NutrientMentionExtractor extractor;

    public ProductContextAssembler(NutrientMentionExtractor extractor) {
        this.extractor = extractor;
    }

    public ProductContext assemble(String productCode,
                                   String mainLanguage,
                                   Collection<Long> imageIds,
                                   Map<Long, List<NutrientMention>> mentions,
                                   Map<Long, List<NutrientPair>> pairs,
                                   Map<Long, List<ObjectDetection>> detections) {
        Set<Long> knownImages = knownImages(imageIds);
        dropUnknown(productCode, "mention", mentions, knownImages);
        dropUnknown(productCode, "pair", pairs, knownImages);
        dropUnknown(productCode, "detection", detections, knownImages);

        List<ImageRecord> images = new ArrayList<>(knownImages.size());
        for (Long imageId : knownImages) {
            images.add(new ImageRecord(
                    imageId,
                    lookup(mentions, imageId),
                    lookup(pairs, imageId),
                    lookup(detections, imageId)));
        }
        return new ProductContext(productCode, mainLanguage, images);
    }

    /**
     * Same as {@link #assemble(String, String, Collection, Map, Map, Map)} but derives mentions
     * and pairs from the OCR text of each image.
     */
    public ProductContext assembleFromText(String productCode,
                                           String mainLanguage,
                                           Collection<Long> imageIds,
                                           Map<Long, String> ocrTexts,
                                           Map<Long, List<ObjectDetection>> detections) {
        Map<Long, List<NutrientMention>> mentions = new LinkedHashMap<>();
        Map<Long, List<NutrientPair>> pairs = new LinkedHashMap<>();
        if (ocrTexts != null) {
            ocrTexts.forEach((imageId, text) -> {
                ExtractedEvidence evidence = extractor.extract(text);
                if (!evidence.isEmpty()) {
                    mentions.put(imageId, evidence.mentions());
                    pairs.put(imageId, evidence.pairs());
                }
            });
        }
        return assemble(productCode, mainLanguage, imageIds, mentions, pairs, detections);
    }

    private Set<Long> knownImages(Collection<Long> imageIds) {
        Set<Long> known = new LinkedHashSet<>();
        if (imageIds != null) {
            imageIds.stream().filter(Objects::nonNull).forEach(known::add);
        }
        return known;
    }

    private void dropUnknown(String productCode, String kind, Map<Long, ? extends List<?>> evidence,
                             Set<Long> knownImages) {
        if (evidence == null) {
            return;
        }
        evidence.forEach((imageId, values) -> {
            if (!knownImages.contains(imageId)) {
                log.warn("Dropping {} {} evidence item(s) bound to unknown image {} of product {}",
                        values == null ? 0 : values.size(), kind, imageId, productCode);
            }
        });
    }

    private static <T> List<T> lookup(Map<Long, List<T>> evidence, Long imageId) {
        if (evidence == null) {
            return List.of();
        }
        List<T> values = evidence.get(imageId);
        return values == null ? List.of() : values;
    }
}

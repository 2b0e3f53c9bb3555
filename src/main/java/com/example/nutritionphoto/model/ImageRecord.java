package com.example.nutritionphoto.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One photo of a product with the evidence collected for it. The image id is assigned at upload
 * time and is the only recency signal: a higher id is a newer photo.
 */
public record ImageRecord(long imageId, List<NutrientMention> mentions, List<NutrientPair> pairs,
        List<ObjectDetection> detections) {

    public ImageRecord {
        mentions = copyOrEmpty(mentions);
        pairs = copyOrEmpty(pairs);
        detections = copyOrEmpty(detections);
    }

    public ImageRecord(long imageId, List<NutrientMention> mentions, List<NutrientPair> pairs) {
        this(imageId, mentions, pairs, List.of());
    }

    // null entries are kept here and skipped by the evaluator
    private static <T> List<T> copyOrEmpty(List<T> values) {
        if (values == null || values.isEmpty()) {
            return List.of();
        }
        return Collections.unmodifiableList(new ArrayList<>(values));
    }
}

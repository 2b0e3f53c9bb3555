package com.example.nutritionphoto.service.extraction;

import com.example.nutritionphoto.model.NutrientMention;
import com.example.nutritionphoto.model.NutrientPair;
import java.util.List;

public record ExtractedEvidence(List<NutrientMention> mentions, List<NutrientPair> pairs) {

    private static final ExtractedEvidence EMPTY = new ExtractedEvidence(List.of(), List.of());

    public ExtractedEvidence {
        mentions = List.copyOf(mentions);
        pairs = List.copyOf(pairs);
    }

    public static ExtractedEvidence empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return mentions.isEmpty() && pairs.isEmpty();
    }
}

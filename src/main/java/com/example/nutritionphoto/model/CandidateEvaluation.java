package com.example.nutritionphoto.model;

/**
 * Outcome of evaluating one image for one language. Only qualifying evaluations are produced.
 */
public record CandidateEvaluation(long imageId, String language, int nameCount, int valueCount,
        boolean hasEnergy, int priority) {

    /** Priority of a candidate backed by at least one nutrient name/value pair. */
    public static final int PAIR_BACKED_PRIORITY = 1;

    /** Priority of a candidate backed by isolated mentions only. */
    public static final int MENTION_ONLY_PRIORITY = 2;
}

package com.example.nutritionphoto.model;

/**
 * Region reported by the object detector for an image.
 *
 * @param label       detector class, relevant only when it is the nutrition-table class
 * @param confidence  detector score, expected in [0, 1]
 * @param boundingBox normalized region of the detection
 */
public record ObjectDetection(String label, double confidence, BoundingBox boundingBox) {

    public boolean isWellFormed() {
        return label != null
                && boundingBox != null
                && !Double.isNaN(confidence)
                && confidence >= 0.0
                && confidence <= 1.0;
    }
}

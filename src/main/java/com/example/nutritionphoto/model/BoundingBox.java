package com.example.nutritionphoto.model;

/**
 * Normalized bounding box of a detected nutrition table inside a product image. Coordinates are
 * relative to the image size and follow the detector's {@code [y_min, x_min, y_max, x_max]}
 * ordering, with the origin located in the top-left corner.
 */
public record BoundingBox(double yMin, double xMin, double yMax, double xMax) {

    public BoundingBox {
        if (!inUnitRange(yMin) || !inUnitRange(xMin) || !inUnitRange(yMax) || !inUnitRange(xMax)) {
            throw new IllegalArgumentException("Bounding box coordinates must be normalized to [0, 1]");
        }
        if (yMax <= yMin) {
            throw new IllegalArgumentException("Bounding box height must be positive");
        }
        if (xMax <= xMin) {
            throw new IllegalArgumentException("Bounding box width must be positive");
        }
    }

    private static boolean inUnitRange(double value) {
        return value >= 0.0 && value <= 1.0;
    }
}

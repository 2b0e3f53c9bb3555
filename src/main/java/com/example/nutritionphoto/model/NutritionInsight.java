package com.example.nutritionphoto.model;

import java.util.Optional;

/**
 * Nutrition photo selected for a product. At most one is produced per product and evaluation.
 *
 * @param productCode barcode of the evaluated product, when known
 * @param imageId     id of the selected image
 * @param language    main language the image qualified for
 * @param priority    1 when backed by nutrient pairs, 2 otherwise
 * @param boundingBox crop of the nutrition table, {@code null} when no unambiguous detection exists
 */
public record NutritionInsight(String productCode, long imageId, String language, int priority,
        BoundingBox boundingBox) {

    public Optional<BoundingBox> crop() {
        return Optional.ofNullable(boundingBox);
    }
}

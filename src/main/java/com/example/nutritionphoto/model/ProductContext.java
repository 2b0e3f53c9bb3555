package com.example.nutritionphoto.model;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Read-only description of a product: its main language and every photo it owns.
 *
 * @param productCode  barcode of the product, used for log correlation only; may be {@code null}
 * @param mainLanguage the only language eligible for nutrition photo selection
 * @param images       photos of the product, in any order; {@code null} entries are dropped
 */
public record ProductContext(String productCode, String mainLanguage, List<ImageRecord> images) {

    public ProductContext {
        images = images == null ? List.of() : images.stream()
                .filter(Objects::nonNull)
                .collect(Collectors.toUnmodifiableList());
    }

    public ProductContext(String mainLanguage, List<ImageRecord> images) {
        this(null, mainLanguage, images);
    }
}

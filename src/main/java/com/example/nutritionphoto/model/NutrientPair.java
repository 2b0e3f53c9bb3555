package com.example.nutritionphoto.model;

import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A nutrient name directly followed by its value in the OCR text, e.g. {@code Fett 3,4 g}.
 * Pairs only raise the priority of an image; they are not counted again as mentions.
 */
public record NutrientPair(Set<String> languages, String nutrient, String value, String unit, String raw) {

    public NutrientPair {
        languages = languages == null ? Set.of() : languages.stream()
                .filter(Objects::nonNull)
                .filter(language -> !language.isBlank())
                .collect(Collectors.toUnmodifiableSet());
    }

    public static NutrientPair of(Set<String> languages) {
        return new NutrientPair(languages, null, null, null, null);
    }

    public boolean isWellFormed() {
        return !languages.isEmpty();
    }
}

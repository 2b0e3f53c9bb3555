package com.example.nutritionphoto.model;

import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A nutrient token detected in the OCR text of one image. A surface form can be plausible in
 * several languages at once ({@code energie} is French, German and Dutch), so a mention carries
 * every language it may belong to.
 *
 * @param kind      whether the token names a nutrient or is a nutrient value
 * @param languages language codes the token is plausible in; empty or {@code null} marks a
 *                  malformed mention that contributes no evidence
 * @param energy    for {@link MentionKind#VALUE} mentions, whether the unit is kJ or kcal
 * @param nutrient  nutrient key such as {@code fat}, informational only
 * @param raw       matched OCR text, informational only
 */
public record NutrientMention(MentionKind kind, Set<String> languages, boolean energy, String nutrient,
        String raw) {

    public NutrientMention {
        languages = languages == null ? Set.of() : languages.stream()
                .filter(Objects::nonNull)
                .filter(language -> !language.isBlank())
                .collect(Collectors.toUnmodifiableSet());
    }

    public static NutrientMention name(String nutrient, Set<String> languages) {
        return new NutrientMention(MentionKind.NAME, languages, false, nutrient, null);
    }

    public static NutrientMention value(Set<String> languages, boolean energy) {
        return new NutrientMention(MentionKind.VALUE, languages, energy, null, null);
    }

    public boolean isName() {
        return kind == MentionKind.NAME;
    }

    public boolean isValue() {
        return kind == MentionKind.VALUE;
    }

    public boolean isWellFormed() {
        return kind != null && !languages.isEmpty();
    }
}

package com.example.nutritionphoto.service;

import static com.example.nutritionphoto.support.ImageFixtures.table;
import static org.assertj.core.api.Assertions.assertThat;

import com.example.nutritionphoto.config.NutritionPhotoProperties;
import com.example.nutritionphoto.model.NutritionInsight;
import com.example.nutritionphoto.service.extraction.NutrientMentionExtractor;
import com.example.nutritionphoto.service.selection.CropResolver;
import com.example.nutritionphoto.service.selection.NutritionCandidateSelector;
import com.example.nutritionphoto.service.selection.NutritionImageEvaluator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class NutritionImageServiceTest {

    private static final String FRENCH_TABLE = "Informations nutritionnelles pour 100 g\n"
            + "Énergie 2252 kJ / 539 kcal\n"
            + "Matières grasses 30,9 g\n"
            + "dont acides gras saturés 10,6 g\n"
            + "Glucides 57,5 g\n"
            + "dont sucres 56,3 g\n"
            + "Protéines 6,3 g\n"
            + "Sel 0,107 g";

    private static final String GERMAN_TABLE = "Nährwerte pro 100 g\n"
            + "Energie 2252 kJ / 539 kcal\n"
            + "Fett 30,9 g\n"
            + "Kohlenhydrate 57,5 g\n"
            + "Zucker 56,3 g\n"
            + "Eiweiß 6,3 g\n"
            + "Salz 0,107 g";

    private NutritionImageService service;

    @BeforeEach
    void setUp() {
        NutritionPhotoProperties properties = NutritionPhotoProperties.defaults();
        NutritionCandidateSelector selector = new NutritionCandidateSelector(
                new NutritionImageEvaluator(properties), new CropResolver(properties));
        service = new NutritionImageService(selector, new ProductContextAssembler(new NutrientMentionExtractor()),
                properties);
    }

    @Test
    void selectsPairBackedFrenchTableFromOcrText() {
        Optional<NutritionInsight> insight = service.evaluate("3017620422003", "fr", List.of(1L, 2L, 3L),
                Map.of(1L, FRENCH_TABLE, 3L, "Ingrédients : sucre, huile de palme"),
                Map.of(1L, List.of(table(0.98))));

        assertThat(insight).hasValueSatisfying(selected -> {
            assertThat(selected.imageId()).isEqualTo(1L);
            assertThat(selected.language()).isEqualTo("fr");
            assertThat(selected.priority()).isEqualTo(1);
            assertThat(selected.crop()).isPresent();
        });
    }

    @Test
    void germanTableIsNotSelectedForEnglishProduct() {
        Optional<NutritionInsight> insight = service.evaluate("4008400402222", "en", List.of(4L),
                Map.of(4L, GERMAN_TABLE), Map.of());

        assertThat(insight).isEmpty();
    }

    @Test
    void germanTableIsSelectedForGermanProduct() {
        Optional<NutritionInsight> insight = service.evaluate("4008400402222", "de", List.of(4L),
                Map.of(4L, GERMAN_TABLE), Map.of());

        assertThat(insight).map(NutritionInsight::language).hasValue("de");
    }
}

package com.example.nutritionphoto.service.extraction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import com.example.nutritionphoto.model.NutrientMention;
import com.example.nutritionphoto.model.NutrientPair;
import org.junit.jupiter.api.Test;

class NutrientMentionExtractorTest {

    private final NutrientMentionExtractor extractor = new NutrientMentionExtractor();

    @Test
    void tagsAmbiguousNameWithEveryLanguage() {
        ExtractedEvidence evidence = extractor.extract("Energie");

        assertThat(evidence.mentions()).singleElement().satisfies(mention -> {
            assertThat(mention.isName()).isTrue();
            assertThat(mention.nutrient()).isEqualTo("energy");
            assertThat(mention.languages()).containsExactlyInAnyOrder("fr", "de", "nl");
        });
    }

    @Test
    void recognisesEnergyValues() {
        ExtractedEvidence evidence = extractor.extract("Énergie 1500 kJ / 360 kcal, sucres 12 g");

        assertThat(evidence.mentions())
                .filteredOn(NutrientMention::isValue)
                .extracting(NutrientMention::raw, NutrientMention::energy)
                .containsExactly(
                        tuple("1500 kJ", true),
                        tuple("360 kcal", true),
                        tuple("12 g", false));
    }

    @Test
    void valueMentionsTakeLanguagesNamedInText() {
        ExtractedEvidence evidence = extractor.extract("Protein 3 g");

        assertThat(evidence.mentions())
                .filteredOn(NutrientMention::isValue)
                .singleElement()
                .satisfies(value -> assertThat(value.languages()).containsExactlyInAnyOrder("en", "da"));
    }

    @Test
    void extractsPairWithNormalisedDecimal() {
        ExtractedEvidence evidence = extractor.extract("matières grasses saturées 2,1 g");

        assertThat(evidence.pairs()).singleElement().satisfies(pair -> {
            assertThat(pair.nutrient()).isEqualTo("saturated_fat");
            assertThat(pair.value()).isEqualTo("2.1");
            assertThat(pair.unit()).isEqualTo("g");
            assertThat(pair.languages()).containsExactly("fr");
        });
        assertThat(evidence.mentions())
                .filteredOn(NutrientMention::isName)
                .extracting(NutrientMention::nutrient)
                .containsExactly("saturated_fat", "fat");
    }

    @Test
    void pairRequiresUnitOfTheNutrient() {
        ExtractedEvidence evidence = extractor.extract("Fett 3 kcal");

        assertThat(evidence.pairs()).isEmpty();
        assertThat(evidence.mentions()).hasSize(2);
    }

    @Test
    void saltAcceptsMilligrams() {
        ExtractedEvidence evidence = extractor.extract("Salz: 120 mg");

        assertThat(evidence.pairs())
                .extracting(NutrientPair::nutrient, NutrientPair::unit)
                .containsExactly(tuple("salt", "mg"));
    }

    @Test
    void doesNotMatchInsideWords() {
        ExtractedEvidence evidence = extractor.extract("selection fettuccine");

        assertThat(evidence.isEmpty()).isTrue();
    }

    @Test
    void blankTextYieldsNothing() {
        assertThat(extractor.extract("   ").isEmpty()).isTrue();
        assertThat(extractor.extract(null).isEmpty()).isTrue();
    }
}

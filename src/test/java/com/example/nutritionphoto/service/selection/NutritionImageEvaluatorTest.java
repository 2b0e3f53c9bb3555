package com.example.nutritionphoto.service.selection;

import static com.example.nutritionphoto.support.ImageFixtures.image;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import com.example.nutritionphoto.config.NutritionPhotoProperties;
import com.example.nutritionphoto.model.CandidateEvaluation;
import com.example.nutritionphoto.model.ImageRecord;
import com.example.nutritionphoto.model.MentionKind;
import com.example.nutritionphoto.model.NutrientMention;
import com.example.nutritionphoto.model.NutrientPair;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class NutritionImageEvaluatorTest {

    private final NutritionImageEvaluator evaluator = new NutritionImageEvaluator(NutritionPhotoProperties.defaults());

    @Test
    void qualifiesAtExactThresholds() {
        List<CandidateEvaluation> evaluations = evaluator.evaluate(image(1).qualifyingTable("fr").build());

        assertThat(evaluations).singleElement().satisfies(evaluation -> {
            assertThat(evaluation.language()).isEqualTo("fr");
            assertThat(evaluation.nameCount()).isEqualTo(4);
            assertThat(evaluation.valueCount()).isEqualTo(3);
            assertThat(evaluation.hasEnergy()).isTrue();
            assertThat(evaluation.priority()).isEqualTo(CandidateEvaluation.MENTION_ONLY_PRIORITY);
        });
    }

    @Test
    void rejectsThreeNames() {
        ImageRecord image = image(1).names(3, "fr").values(2, "fr").energyValues(1, "fr").build();

        assertThat(evaluator.evaluate(image)).isEmpty();
    }

    @Test
    void rejectsTwoValues() {
        ImageRecord image = image(1).names(4, "fr").values(1, "fr").energyValues(1, "fr").build();

        assertThat(evaluator.evaluate(image)).isEmpty();
    }

    @Test
    void rejectsTableWithoutEnergyValue() {
        ImageRecord image = image(1).names(4, "fr").values(3, "fr").build();

        assertThat(evaluator.evaluate(image)).isEmpty();
    }

    @Test
    void pairForLanguageRaisesPriority() {
        ImageRecord withoutPair = image(1).qualifyingTable("de").build();
        ImageRecord withPair = image(1).qualifyingTable("de").pair("de").build();

        assertThat(evaluator.evaluate(withoutPair)).extracting(CandidateEvaluation::priority).containsExactly(2);
        assertThat(evaluator.evaluate(withPair)).extracting(CandidateEvaluation::priority).containsExactly(1);
    }

    @Test
    void pairInAnotherLanguageDoesNotRaisePriority() {
        ImageRecord image = image(1).qualifyingTable("fr").pair("en").build();

        assertThat(evaluator.evaluate(image)).extracting(CandidateEvaluation::priority).containsExactly(2);
    }

    @Test
    void ambiguousMentionsCountForEveryTaggedLanguage() {
        ImageRecord image = image(1).qualifyingTable("fr", "nl").build();

        assertThat(evaluator.evaluate(image))
                .extracting(CandidateEvaluation::language)
                .containsExactlyInAnyOrder("fr", "nl");
    }

    @Test
    void ambiguousNameCompletesOtherwiseShortLanguage() {
        ImageRecord image = image(1)
                .names(3, "nl")
                .names(1, "fr", "nl")
                .values(2, "nl")
                .energyValues(1, "nl")
                .build();

        assertThat(evaluator.evaluate(image)).singleElement().satisfies(evaluation -> {
            assertThat(evaluation.language()).isEqualTo("nl");
            assertThat(evaluation.nameCount()).isEqualTo(4);
        });
    }

    @Test
    void duplicateOccurrencesEachCount() {
        NutrientMention sel = NutrientMention.name("salt", Set.of("fr"));
        ImageRecord image = image(1)
                .mention(sel).mention(sel).mention(sel).mention(sel)
                .values(2, "fr").energyValues(1, "fr")
                .build();

        assertThat(evaluator.evaluate(image)).hasSize(1);
    }

    @Test
    void supportsSeveralQualifyingLanguagesWithDistinctPriorities() {
        ImageRecord image = image(1).qualifyingTable("fr").qualifyingTable("en").pair("en").build();

        assertThat(evaluator.evaluate(image))
                .extracting(CandidateEvaluation::language, CandidateEvaluation::priority)
                .containsExactly(
                        tuple("fr", 2),
                        tuple("en", 1));
    }

    @Test
    void languageOnlySeenInValuesIsNeverCandidate() {
        NutritionImageEvaluator lenient = new NutritionImageEvaluator(new NutritionPhotoProperties(
                new NutritionPhotoProperties.Selection(1, 1, false),
                NutritionPhotoProperties.defaults().crop(),
                NutritionPhotoProperties.defaults().batch()));
        ImageRecord image = image(1).names(1, "fr").energyValues(5, "fr", "it").build();

        assertThat(lenient.evaluate(image)).extracting(CandidateEvaluation::language).containsExactly("fr");
    }

    @Test
    void skipsMalformedEvidenceWithoutAbortingImage() {
        List<NutrientMention> mentions = new ArrayList<>();
        mentions.add(null);
        mentions.add(new NutrientMention(MentionKind.NAME, Set.of(), false, "fat", "graisses"));
        mentions.add(new NutrientMention(null, Set.of("fr"), false, null, null));
        mentions.addAll(image(1).qualifyingTable("fr").build().mentions());
        List<NutrientPair> pairs = new ArrayList<>();
        pairs.add(null);
        pairs.add(NutrientPair.of(Set.of()));

        List<CandidateEvaluation> evaluations = evaluator.evaluate(new ImageRecord(1, mentions, pairs));

        assertThat(evaluations).singleElement().satisfies(evaluation -> {
            assertThat(evaluation.nameCount()).isEqualTo(4);
            assertThat(evaluation.priority()).isEqualTo(2);
        });
    }

    @Test
    void imageWithoutEvidenceYieldsNothing() {
        assertThat(evaluator.evaluate(new ImageRecord(7, null, null, null))).isEmpty();
    }
}

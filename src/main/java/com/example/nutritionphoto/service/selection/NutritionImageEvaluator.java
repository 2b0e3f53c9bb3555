package com.example.nutritionphoto.service.selection;

import com.example.nutritionphoto.config.NutritionPhotoProperties;
import com.example.nutritionphoto.model.CandidateEvaluation;
import com.example.nutritionphoto.model.ImageRecord;
import com.example.nutritionphoto.model.NutrientMention;
import com.example.nutritionphoto.model.NutrientPair;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Decides, for a single image, every language for which the image looks like a nutrition table.
 * Each mention is counted once for every language it is tagged with, so an ambiguous word such as
 * {@code energie} supports French, German and Dutch at the same time. Languages are only
 * candidates when at least one nutrient name was seen for them.
 */
@Component
public class NutritionImageEvaluator {

    private static final Logger log = LoggerFactory.getLogger(NutritionImageEvaluator.class);

    private final NutritionPhotoProperties.Selection thresholds;

    public NutritionImageEvaluator(NutritionPhotoProperties properties) {
        this.thresholds = properties.selection();
    }

    /**
     * @param image image to evaluate
     * @return qualifying evaluations in the order their language was first named in the image;
     * empty when the image does not qualify for any language
     */
    public List<CandidateEvaluation> evaluate(ImageRecord image) {
        Map<String, LanguageTally> tallies = new LinkedHashMap<>();
        for (NutrientMention mention : image.mentions()) {
            if (mention == null || !mention.isWellFormed()) {
                log.debug("Skipping malformed mention {} on image {}", mention, image.imageId());
                continue;
            }
            for (String language : mention.languages()) {
                tallies.computeIfAbsent(language, LanguageTally::new).observe(mention);
            }
        }
        if (tallies.isEmpty()) {
            return List.of();
        }

        Set<String> pairLanguages = pairLanguages(image.pairs());

        List<CandidateEvaluation> evaluations = tallies.values().stream()
                .filter(LanguageTally::hasNames)
                .map(tally -> tally.finalizeEvaluation(image.imageId(), pairLanguages))
                .flatMap(Optional::stream)
                .collect(Collectors.toList());

        if (log.isDebugEnabled()) {
            tallies.values().forEach(tally -> log.debug(
                    "Image {} language {}: names {}, values {}, energy {}",
                    image.imageId(), tally.language, tally.names, tally.values, tally.energy));
        }
        return evaluations;
    }

    private Set<String> pairLanguages(List<NutrientPair> pairs) {
        Set<String> languages = new HashSet<>();
        for (NutrientPair pair : pairs) {
            if (pair == null || !pair.isWellFormed()) {
                log.debug("Skipping malformed nutrient pair {}", pair);
                continue;
            }
            languages.addAll(pair.languages());
        }
        return languages;
    }

    private final class LanguageTally {

        private final String language;
        private int names;
        private int values;
        private boolean energy;

        private LanguageTally(String language) {
            this.language = language;
        }

        private void observe(NutrientMention mention) {
            if (mention.isName()) {
                names++;
            } else {
                values++;
                energy |= mention.energy();
            }
        }

        private boolean hasNames() {
            return names > 0;
        }

        private boolean qualifies() {
            return names >= thresholds.minNameMentions()
                    && values >= thresholds.minValueMentions()
                    && (energy || !thresholds.requireEnergyValue());
        }

        private Optional<CandidateEvaluation> finalizeEvaluation(long imageId, Set<String> pairLanguages) {
            if (!qualifies()) {
                return Optional.empty();
            }
            int priority = pairLanguages.contains(language)
                    ? CandidateEvaluation.PAIR_BACKED_PRIORITY
                    : CandidateEvaluation.MENTION_ONLY_PRIORITY;
            return Optional.of(new CandidateEvaluation(imageId, language, names, values, energy, priority));
        }
    }
}

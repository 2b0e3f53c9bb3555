package com.example.nutritionphoto.service.extraction;

import com.example.nutritionphoto.model.MentionKind;
import com.example.nutritionphoto.model.NutrientMention;
import com.example.nutritionphoto.model.NutrientPair;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.springframework.stereotype.Component;

/**
 * Finds nutrient names, nutrient values and name/value pairs in the OCR text of a product image.
 * Every name pattern carries the languages it is plausible in; value mentions carry no language
 * of their own and are attributed to every language named in the same text.
 */
@Component
public class NutrientMentionExtractor {

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.UNICODE_CHARACTER_CLASS;

    private static final String NUMBER = "([0-9]+[,.]?[0-9]*)";

    private static final Pattern VALUE_PATTERN = Pattern.compile("(?<!\\w)" + NUMBER + " ?(g|kj|kcal)(?!\\w)", FLAGS);

    private static final Set<String> ENERGY_UNITS = Set.of("kj", "kcal");

    private static final Map<String, List<NamePattern>> NUTRIENT_NAMES = buildLexicon();

    private static final Map<String, List<String>> NUTRIENT_UNITS = buildUnits();

    private static final List<NutrientRegex> MENTION_REGEXES = NUTRIENT_NAMES.entrySet().stream()
            .map(entry -> NutrientRegex.mention(entry.getKey(), entry.getValue()))
            .collect(Collectors.toList());

    private static final List<NutrientRegex> PAIR_REGEXES = NUTRIENT_UNITS.entrySet().stream()
            .map(entry -> NutrientRegex.pair(entry.getKey(), NUTRIENT_NAMES.get(entry.getKey()), entry.getValue()))
            .collect(Collectors.toList());

    /**
     * @param text contiguous OCR text of one image
     * @return mentions and pairs found in the text, empty for {@code null} or blank text
     */
    public ExtractedEvidence extract(String text) {
        if (text == null || text.isBlank()) {
            return ExtractedEvidence.empty();
        }

        List<NutrientMention> mentions = new ArrayList<>();
        Set<String> namedLanguages = new LinkedHashSet<>();
        for (NutrientRegex regex : MENTION_REGEXES) {
            Matcher matcher = regex.pattern().matcher(text);
            while (matcher.find()) {
                Set<String> languages = regex.languagesOf(matcher);
                namedLanguages.addAll(languages);
                mentions.add(new NutrientMention(MentionKind.NAME, languages, false, regex.nutrient(), matcher.group()));
            }
        }

        Matcher valueMatcher = VALUE_PATTERN.matcher(text);
        while (valueMatcher.find()) {
            String unit = valueMatcher.group(2).toLowerCase(Locale.ROOT);
            mentions.add(new NutrientMention(MentionKind.VALUE, namedLanguages, ENERGY_UNITS.contains(unit), null,
                    valueMatcher.group()));
        }

        List<NutrientPair> pairs = new ArrayList<>();
        for (NutrientRegex regex : PAIR_REGEXES) {
            Matcher matcher = regex.pattern().matcher(text);
            while (matcher.find()) {
                String value = matcher.group(regex.valueGroup()).replace(',', '.');
                String unit = matcher.group(regex.valueGroup() + 1).toLowerCase(Locale.ROOT);
                pairs.add(new NutrientPair(regex.languagesOf(matcher), regex.nutrient(), value, unit, matcher.group()));
            }
        }

        return new ExtractedEvidence(mentions, pairs);
    }

    private static Map<String, List<NamePattern>> buildLexicon() {
        Map<String, List<NamePattern>> lexicon = new LinkedHashMap<>();
        lexicon.put("energy", List.of(
                new NamePattern("énergie", "fr"),
                new NamePattern("energie", "fr", "de", "nl"),
                new NamePattern("valeurs? [ée]nerg[ée]tiques?", "fr"),
                new NamePattern("energy", "en"),
                new NamePattern("calories", "fr", "en"),
                new NamePattern("energia", "es", "it", "pt", "hu"),
                new NamePattern("valor energ[ée]tico", "es"),
                new NamePattern("energi", "da")));
        lexicon.put("saturated_fat", List.of(
                new NamePattern("mati[èe]res? grasses? satur[ée]s?", "fr"),
                new NamePattern("acides? gras satur[ée]s?", "fr"),
                new NamePattern("dont satur[ée]s?", "fr"),
                new NamePattern("acidi grassi saturi", "it"),
                new NamePattern("saturated fat", "en"),
                new NamePattern("of which saturates", "en"),
                new NamePattern("verzadigde vetzuren", "nl"),
                new NamePattern("waarvan verzadigde", "nl"),
                new NamePattern("gesättigte fettsäuren", "de"),
                new NamePattern("[aá]cidos grasos saturados", "es"),
                new NamePattern("dos quais saturados", "pt"),
                new NamePattern("mættede fedtsyrer", "da"),
                new NamePattern("amelyb[őö]l? telített zs[íi]rsavak", "hu")));
        lexicon.put("trans_fat", List.of(
                new NamePattern("mati[èe]res? grasses? trans", "fr"),
                new NamePattern("trans fat", "en")));
        lexicon.put("fat", List.of(
                new NamePattern("mati[èe]res? grasses?", "fr"),
                new NamePattern("graisses?", "fr"),
                new NamePattern("lipides?", "fr"),
                new NamePattern("total fat", "en"),
                new NamePattern("vetten", "nl"),
                new NamePattern("fett", "de"),
                new NamePattern("grasas", "es"),
                new NamePattern("grassi", "it"),
                new NamePattern("l[íi]pidos", "es", "pt"),
                new NamePattern("fedt", "da"),
                new NamePattern("zs[íi]r", "hu")));
        lexicon.put("sugar", List.of(
                new NamePattern("sucres?", "fr"),
                new NamePattern("sugars?", "en"),
                new NamePattern("zuccheri", "it"),
                new NamePattern("suikers?", "nl"),
                new NamePattern("zucker", "de"),
                new NamePattern("az[úu]cares", "es"),
                new NamePattern("sukkerarter", "da"),
                new NamePattern("amelyb[őö]l? cukrok", "hu")));
        lexicon.put("carbohydrate", List.of(
                new NamePattern("total carbohydrate", "en"),
                new NamePattern("glucids?", "fr"),
                new NamePattern("glucides?", "en"),
                new NamePattern("carboidrati", "it"),
                new NamePattern("koolhydraten", "nl"),
                new NamePattern("koolhydraat", "nl"),
                new NamePattern("kohlenhydrate", "de"),
                new NamePattern("hidratos de carbono", "es", "pt"),
                new NamePattern("kulhydrat", "da"),
                new NamePattern("szénhidrát", "hu")));
        lexicon.put("protein", List.of(
                new NamePattern("prot[ée]ines?", "fr"),
                new NamePattern("protein", "en", "da"),
                new NamePattern("eiwitten", "nl"),
                new NamePattern("eiweiß", "de"),
                new NamePattern("prote[íi]nas", "es", "pt"),
                new NamePattern("fehérje", "hu")));
        lexicon.put("salt", List.of(
                new NamePattern("sel", "fr"),
                new NamePattern("salt", "en", "da"),
                new NamePattern("zout", "nl"),
                new NamePattern("salz", "de"),
                new NamePattern("sale", "it"),
                new NamePattern("sal", "es", "pt"),
                new NamePattern("só", "hu")));
        lexicon.put("fiber", List.of(
                new NamePattern("fibres?", "en", "fr", "it"),
                new NamePattern("(?:dietary )?fibers?", "en"),
                new NamePattern("fibres? alimentaires?", "fr"),
                new NamePattern("(?:voedings)?vezels?", "nl"),
                new NamePattern("ballaststoffe", "de"),
                new NamePattern("fibra(?: alimentaria)?", "es"),
                new NamePattern("kostfibre", "da"),
                new NamePattern("rost", "hu")));
        lexicon.put("nutrition_values", List.of(
                new NamePattern("informations? nutritionnelles?(?: moyennes?)?", "fr"),
                new NamePattern("valeurs? nutritionnelles?(?: moyennes?)?", "fr"),
                new NamePattern("analyse moyenne pour", "fr"),
                new NamePattern("valeurs? nutritives?", "fr"),
                new NamePattern("valeurs? moyennes?", "fr"),
                new NamePattern("nutrition facts?", "en"),
                new NamePattern("average nutritional values?", "en"),
                new NamePattern("valori nutrizionali medi", "it"),
                new NamePattern("gemiddelde waarden per", "nl"),
                new NamePattern("nutritionele informatie", "nl"),
                new NamePattern("(?:er)?næringsindhold", "da"),
                new NamePattern("átlagos tápérték(?:tartalom)?", "hu"),
                new NamePattern("tápérték adatok", "hu")));
        return lexicon;
    }

    private static Map<String, List<String>> buildUnits() {
        Map<String, List<String>> units = new LinkedHashMap<>();
        units.put("energy", List.of("kj", "kcal"));
        units.put("saturated_fat", List.of("g"));
        units.put("trans_fat", List.of("g"));
        units.put("fat", List.of("g"));
        units.put("sugar", List.of("g"));
        units.put("carbohydrate", List.of("g"));
        units.put("protein", List.of("g"));
        units.put("salt", List.of("g", "mg"));
        units.put("fiber", List.of("g"));
        return units;
    }

    private record NamePattern(String regex, Set<String> languages) {

        private NamePattern(String regex, String... languages) {
            this(regex, Set.of(languages));
        }
    }

    /**
     * One compiled regex per nutrient. Each name alternative is wrapped in a named group so the
     * languages of the alternative that matched can be recovered.
     */
    private record NutrientRegex(String nutrient, Pattern pattern, List<NamePattern> names, int valueGroup) {

        private static NutrientRegex mention(String nutrient, List<NamePattern> names) {
            Pattern pattern = Pattern.compile("(?<!\\w)(?:" + alternatives(names) + ")(?!\\w)", FLAGS);
            return new NutrientRegex(nutrient, pattern, names, -1);
        }

        private static NutrientRegex pair(String nutrient, List<NamePattern> names, List<String> units) {
            Pattern pattern = Pattern.compile(
                    "(?<!\\w)(?:" + alternatives(names) + ") ?(?:[:-] ?)?" + NUMBER
                            + " ?(" + String.join("|", units) + ")(?!\\w)",
                    FLAGS);
            // value and unit are the last two capturing groups of the pattern
            int valueGroup = pattern.matcher("").groupCount() - 1;
            return new NutrientRegex(nutrient, pattern, names, valueGroup);
        }

        private static String alternatives(List<NamePattern> names) {
            return IntStream.range(0, names.size())
                    .mapToObj(i -> "(?<n" + i + ">" + names.get(i).regex() + ")")
                    .collect(Collectors.joining("|"));
        }

        private Set<String> languagesOf(Matcher matcher) {
            for (int i = 0; i < names.size(); i++) {
                if (matcher.group("n" + i) != null) {
                    return names.get(i).languages();
                }
            }
            return Set.of();
        }
    }
}

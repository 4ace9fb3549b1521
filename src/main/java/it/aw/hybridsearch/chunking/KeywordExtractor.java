package it.aw.hybridsearch.chunking;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Estrae da un chunk un piccolo insieme di keyword usate dal punteggio keyword
 * del retriever: identificatori di dominio (codici NAICS a 6 cifre, clausole FAR/DFARS,
 * domini email) e termini di un vocabolario noto.
 */
public final class KeywordExtractor {

    public static final int MAX_KEYWORDS = 15;

    private static final Pattern NAICS = Pattern.compile("\\b\\d{6}\\b");
    private static final Pattern CLAUSE = Pattern.compile("\\b(?:far|dfars)\\s+\\d+\\.\\d+(?:-\\d+)?", Pattern.CASE_INSENSITIVE);
    private static final Pattern EMAIL_DOMAIN = Pattern.compile("@[\\w.-]+\\.[a-zA-Z]{2,}");

    private static final List<String> VOCABULARY = List.of(
            "solicitation", "rfp", "rfi", "rfq", "contract", "task order", "idiq", "gsa", "sewp",
            "oasis", "requirement", "deliverable", "performance", "compliance", "far", "dfars",
            "provision", "clause", "federal acquisition regulation", "point of contact", "poc",
            "contracting officer", "cor", "security", "cloud", "email", "phone", "address");

    private static final List<Pattern> VOCABULARY_PATTERNS = VOCABULARY.stream()
            .map(term -> Pattern.compile("\\b" + Pattern.quote(term) + "\\b"))
            .toList();

    private KeywordExtractor() {}

    /** Keyword in ordine di prima scoperta, senza duplicati, al massimo {@value #MAX_KEYWORDS}. */
    public static List<String> extract(String text) {
        Set<String> keywords = new LinkedHashSet<>();
        collect(NAICS.matcher(text), keywords);
        collect(CLAUSE.matcher(text), keywords);
        collect(EMAIL_DOMAIN.matcher(text), keywords);

        String lower = text.toLowerCase(Locale.ROOT);
        for (int i = 0; i < VOCABULARY.size(); i++) {
            if (VOCABULARY_PATTERNS.get(i).matcher(lower).find()) {
                keywords.add(VOCABULARY.get(i));
            }
        }
        List<String> result = new ArrayList<>(keywords);
        return result.size() > MAX_KEYWORDS ? List.copyOf(result.subList(0, MAX_KEYWORDS)) : List.copyOf(result);
    }

    private static void collect(Matcher matcher, Set<String> target) {
        while (matcher.find()) {
            target.add(matcher.group().toLowerCase(Locale.ROOT).replaceAll("\\s+", " "));
        }
    }
}

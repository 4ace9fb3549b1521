package it.aw.hybridsearch.retrieval;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Punteggio keyword di un chunk rispetto ai termini della query, normalizzato in [0, 1].
 * <p>
 * BM25: per ogni termine {@code tf·(k1+1) / (tf + k1·(1 − b + b·docLen/avgDocLen))},
 * moltiplicato per il boost di corrispondenza esatta e per il peso del termine
 * {@code min(lunghezza/10, 2)}; la somma è divisa per il massimo teorico
 * {@code termini · boost · 2 · (k1+1)}.
 * <p>
 * Il tf conta le occorrenze esatte (parola intera) e quelle per prefisso ("secur" → "security");
 * il boost si applica solo alle corrispondenze esatte o ai termini presenti tra le keyword
 * estratte dal chunk.
 */
public class KeywordScorer {

    public static final double K1 = 1.2;
    public static final double B = 0.75;

    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}]+");
    private static final int MIN_TERM_LENGTH = 3;

    private static final Set<String> STOP_WORDS = Set.of(
            "the", "and", "or", "but", "in", "on", "at", "to", "for", "of", "with", "by",
            "is", "are", "was", "were", "be", "been", "have", "has", "had", "do", "does", "did",
            "will", "would", "should", "could", "can", "may", "might", "must", "shall",
            "from", "this", "that", "these", "those", "not", "all", "any",
            "il", "lo", "la", "gli", "le", "un", "una", "di", "da", "per", "con", "su", "tra", "fra",
            "che", "del", "della", "dei", "delle", "nel", "nella", "sono", "non");

    /** Esito per un chunk. */
    public record Match(double score, Set<String> matchedTerms) {

        public static final Match NONE = new Match(0.0, Set.of());
    }

    /**
     * Termini di ricerca: parole della query in minuscolo, senza stop-word e senza parole
     * di 2 caratteri o meno, seguite dalle keyword esplicite (anche frasi), senza duplicati.
     */
    public static List<String> queryTerms(String query, List<String> explicitKeywords) {
        Set<String> terms = new LinkedHashSet<>();
        for (String token : tokenize(query)) {
            if (token.length() >= MIN_TERM_LENGTH && !STOP_WORDS.contains(token)) {
                terms.add(token);
            }
        }
        if (explicitKeywords != null) {
            for (String keyword : explicitKeywords) {
                String normalized = String.join(" ", tokenize(keyword));
                if (!normalized.isEmpty()) terms.add(normalized);
            }
        }
        return List.copyOf(terms);
    }

    public static List<String> tokenize(String text) {
        List<String> tokens = new ArrayList<>();
        if (text == null) return tokens;
        for (String token : NON_WORD.split(text.toLowerCase(Locale.ROOT))) {
            if (!token.isEmpty()) tokens.add(token);
        }
        return tokens;
    }

    /**
     * @param tokens        token del chunk ({@link #tokenize})
     * @param chunkKeywords keyword estratte dal chunk in fase di segmentazione
     * @param avgDocLen     lunghezza media (in token) dei candidati
     */
    public Match bm25(List<String> tokens, List<String> chunkKeywords, List<String> terms,
                      double avgDocLen, double exactMatchBoost) {
        if (terms.isEmpty() || tokens.isEmpty()) return Match.NONE;
        double docLen = tokens.size();
        double norm = avgDocLen > 0 ? docLen / avgDocLen : 1.0;
        double total = 0;
        Set<String> matched = new LinkedHashSet<>();
        for (String term : terms) {
            int[] counts = count(tokens, term);
            int tf = counts[0] + counts[1];
            if (tf == 0) continue;
            matched.add(term);
            double termScore = tf * (K1 + 1) / (tf + K1 * (1 - B + B * norm));
            if (counts[0] > 0 || containsIgnoreCase(chunkKeywords, term)) {
                termScore *= exactMatchBoost;
            }
            termScore *= Math.min(term.length() / 10.0, 2.0);
            total += termScore;
        }
        double max = terms.size() * exactMatchBoost * 2.0 * (K1 + 1);
        return new Match(Math.min(total / max, 1.0), matched);
    }

    /**
     * Alternativa senza normalizzazione per lunghezza: {@code min(tf/3, 1)} per termine,
     * peso {@code min(lunghezza/8, 1.5)}, massimo teorico {@code termini · boost · 1.5}.
     */
    public Match simple(List<String> tokens, List<String> chunkKeywords, List<String> terms, double exactMatchBoost) {
        if (terms.isEmpty() || tokens.isEmpty()) return Match.NONE;
        double total = 0;
        Set<String> matched = new LinkedHashSet<>();
        for (String term : terms) {
            int[] counts = count(tokens, term);
            int tf = counts[0] + counts[1];
            if (tf == 0) continue;
            matched.add(term);
            double termScore = Math.min(tf / 3.0, 1.0);
            if (counts[0] > 0 || containsIgnoreCase(chunkKeywords, term)) {
                termScore *= exactMatchBoost;
            }
            termScore *= Math.min(term.length() / 8.0, 1.5);
            total += termScore;
        }
        double max = terms.size() * exactMatchBoost * 1.5;
        return new Match(Math.min(total / max, 1.0), matched);
    }

    /** {esatte, per prefisso}; le frasi contano solo come sequenze esatte di token. */
    private static int[] count(List<String> tokens, String term) {
        if (term.indexOf(' ') >= 0) {
            return new int[]{countPhrase(tokens, term.split(" ")), 0};
        }
        int exact = 0;
        int prefix = 0;
        for (String token : tokens) {
            if (token.equals(term)) exact++;
            else if (token.startsWith(term)) prefix++;
        }
        return new int[]{exact, prefix};
    }

    private static int countPhrase(List<String> tokens, String[] phrase) {
        int count = 0;
        outer:
        for (int i = 0; i + phrase.length <= tokens.size(); i++) {
            for (int j = 0; j < phrase.length; j++) {
                if (!tokens.get(i + j).equals(phrase[j])) continue outer;
            }
            count++;
        }
        return count;
    }

    private static boolean containsIgnoreCase(List<String> keywords, String term) {
        for (String keyword : keywords) {
            if (keyword.equalsIgnoreCase(term)) return true;
        }
        return false;
    }
}

package it.aw.hybridsearch.chunking;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Divide un intervallo di testo in frasi sulla punteggiatura finale (. ! ?),
 * senza spezzare su abbreviazioni comuni, iniziali puntate e numeri decimali.
 * Gli intervalli restituiti sono privi di spazi iniziali e finali.
 */
final class SentenceSplitter {

    private static final Set<String> ABBREVIATIONS = Set.of(
            "mr", "mrs", "ms", "dr", "prof", "sr", "jr", "st", "inc", "ltd", "co", "corp",
            "vs", "etc", "e.g", "i.e", "no", "nos", "vol", "fig", "pp", "approx", "dept", "est",
            "jan", "feb", "mar", "apr", "jun", "jul", "aug", "sep", "sept", "oct", "nov", "dec",
            "art", "sig", "sigg", "dott", "ing", "avv", "pag", "cfr", "ecc", "n", "u.s", "p.a");

    private SentenceSplitter() {}

    static List<TextSpan> split(String text, int start, int end) {
        List<TextSpan> sentences = new ArrayList<>();
        int sentenceStart = skipWhitespace(text, start, end);
        int i = sentenceStart;
        while (i < end) {
            char c = text.charAt(i);
            if (c == '.' || c == '!' || c == '?') {
                int stop = i + 1;
                // punteggiatura ripetuta e chiusure ("...", "?!", ".)" e virgolette)
                while (stop < end && isTrailing(text.charAt(stop))) stop++;
                boolean atBoundary = stop >= end || Character.isWhitespace(text.charAt(stop));
                if (atBoundary && !(c == '.' && isAbbreviation(text, sentenceStart, i))) {
                    addTrimmed(sentences, text, sentenceStart, stop);
                    sentenceStart = skipWhitespace(text, stop, end);
                    i = sentenceStart;
                    continue;
                }
                i = stop;
                continue;
            }
            i++;
        }
        if (sentenceStart < end) {
            addTrimmed(sentences, text, sentenceStart, end);
        }
        return sentences;
    }

    private static boolean isTrailing(char c) {
        return c == '.' || c == '!' || c == '?' || c == '"' || c == '\'' || c == ')' || c == ']'
                || c == '”' || c == '’' || c == '»';
    }

    /** La parola che termina in {@code dot} è un'abbreviazione o un'iniziale? */
    private static boolean isAbbreviation(String text, int sentenceStart, int dot) {
        int wordStart = dot;
        while (wordStart > sentenceStart && !Character.isWhitespace(text.charAt(wordStart - 1))
                && text.charAt(wordStart - 1) != '(') {
            wordStart--;
        }
        if (wordStart == dot) return false;
        String word = text.substring(wordStart, dot).toLowerCase(Locale.ROOT);
        if (word.length() == 1 && Character.isLetter(word.charAt(0))
                && Character.isUpperCase(text.charAt(wordStart))) {
            return true;
        }
        return ABBREVIATIONS.contains(word);
    }

    static int skipWhitespace(String text, int from, int end) {
        int i = from;
        while (i < end && Character.isWhitespace(text.charAt(i))) i++;
        return i;
    }

    static void addTrimmed(List<TextSpan> target, String text, int start, int end) {
        int s = skipWhitespace(text, start, end);
        int e = end;
        while (e > s && Character.isWhitespace(text.charAt(e - 1))) e--;
        if (s < e) target.add(TextSpan.of(text, s, e));
    }
}

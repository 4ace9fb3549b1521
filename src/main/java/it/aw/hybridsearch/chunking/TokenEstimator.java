package it.aw.hybridsearch.chunking;

/**
 * Stima approssimata del numero di token di un testo:
 * {@code max(ceil(parole × 1.3), ceil(caratteri / 3.5))}.
 * <p>
 * Non corrisponde al tokenizer del modello: chi usa il valore deve tollerare
 * un errore di circa ±20%. Il calcolo è in aritmetica intera per restare
 * identico tra esecuzioni.
 */
public final class TokenEstimator {

    private TokenEstimator() {}

    public static int estimate(String text) {
        if (text == null || text.isEmpty()) return 0;
        return estimate(countWords(text, 0, text.length()), text.length());
    }

    public static int estimate(int words, int chars) {
        if (words <= 0 && chars <= 0) return 0;
        int byWords = (words * 13 + 9) / 10;
        int byChars = (chars * 2 + 6) / 7;
        return Math.max(byWords, byChars);
    }

    /** Numero di sequenze massimali di caratteri non-spazio in [start, end). */
    public static int countWords(CharSequence text, int start, int end) {
        int words = 0;
        boolean inWord = false;
        for (int i = start; i < end; i++) {
            boolean space = Character.isWhitespace(text.charAt(i));
            if (!space && !inWord) words++;
            inWord = !space;
        }
        return words;
    }
}

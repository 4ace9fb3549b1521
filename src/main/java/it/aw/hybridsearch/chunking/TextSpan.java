package it.aw.hybridsearch.chunking;

/**
 * Intervallo [start, end) del testo originale con il suo numero di parole.
 * Unità elementare (frase o finestra di parole) della segmentazione.
 */
record TextSpan(int start, int end, int words) {

    static TextSpan of(CharSequence text, int start, int end) {
        return new TextSpan(start, end, TokenEstimator.countWords(text, start, end));
    }

    int tokens() {
        return TokenEstimator.estimate(words, end - start);
    }
}

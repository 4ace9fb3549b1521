package it.aw.hybridsearch.model;

/** Intervallo [startOffset, endOffset) di una pagina (1-based) nel testo concatenato. */
public record PageSpan(int page, int startOffset, int endOffset) {}

package it.aw.hybridsearch.chunking;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Rileva le righe-titolo che aprono una nuova sezione del documento.
 * <p>
 * Forme riconosciute, in ordine di priorità:
 * <ul>
 *   <li>keyword esplicite: "Section 3", "Chapter IV", "Capitolo 2", "Art. 5", "Articolo 12", "Sezione 1"</li>
 *   <li>numerazioni: "1. Introduzione", "2.3 Requisiti", "4.1.2 Scadenze"</li>
 *   <li>righe brevi tutte in MAIUSCOLO</li>
 *   <li>righe brevi in Title Case senza punteggiatura finale</li>
 *   <li>righe brevi che terminano con i due punti</li>
 * </ul>
 * L'offset di ogni heading è la posizione del primo carattere non vuoto della riga
 * nel testo completo.
 */
public final class SectionDetector {

    /** Heading rilevato: posizione nel testo, profondità (1..3) e titolo. */
    public record SectionBoundary(int offset, int level, String title) {}

    private static final int MAX_HEADING_CHARS = 100;
    private static final int MAX_SHORT_LINE_CHARS = 80;
    private static final int MAX_TITLE_WORDS = 10;

    private static final Pattern KEYWORD = Pattern.compile(
            "^(Section|Part|Chapter|Article|Capitolo|Articolo|Sezione|Parte|Art\\.)\\s+[\\dIVXLC]+\\b.*",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern NUMBERED = Pattern.compile(
            "^(\\d+(?:\\.\\d+){0,3})\\.?\\s+\\p{Lu}.*");
    private static final Pattern TERMINAL_PUNCTUATION = Pattern.compile(".*[.!?;,]$");
    private static final Pattern SMALL_WORDS = Pattern.compile(
            "(?i)a|an|and|or|of|the|in|on|for|to|by|with|di|e|il|la|le|lo|i|gli|del|della|dei|per|con|su|da");

    private SectionDetector() {}

    /**
     * Analizza il testo e restituisce gli heading in ordine di offset crescente.
     *
     * @return lista vuota se il testo non contiene heading
     */
    public static List<SectionBoundary> detect(String text) {
        List<SectionBoundary> boundaries = new ArrayList<>();
        int offset = 0;
        for (String line : text.split("\n", -1)) {
            String trimmed = line.trim();
            if (!trimmed.isEmpty()) {
                int level = matchLevel(trimmed);
                if (level > 0) {
                    int leading = line.indexOf(trimmed.charAt(0));
                    boundaries.add(new SectionBoundary(offset + leading, level, trimmed));
                }
            }
            offset += line.length() + 1; // +1 per il '\n'
        }
        return boundaries;
    }

    /** Livello della riga (già trimmata), oppure 0 se non è un heading. */
    static int matchLevel(String line) {
        if (line.length() > MAX_HEADING_CHARS) return 0;
        if (KEYWORD.matcher(line).matches()) {
            return line.regionMatches(true, 0, "Art", 0, 3) ? 2 : 1;
        }
        var numbered = NUMBERED.matcher(line);
        if (numbered.matches() && !line.endsWith(".")) {
            int depth = numbered.group(1).split("\\.").length;
            return Math.min(depth, 3);
        }
        if (line.length() > MAX_SHORT_LINE_CHARS) return 0;
        if (line.endsWith(":") && line.length() > 1) return 3;
        if (isAllCaps(line)) return 1;
        if (isTitleCase(line)) return 2;
        return 0;
    }

    private static boolean isAllCaps(String line) {
        int letters = 0;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (Character.isLetter(c)) {
                if (!Character.isUpperCase(c)) return false;
                letters++;
            }
        }
        return letters >= 3 && line.split("\\s+").length <= MAX_TITLE_WORDS;
    }

    private static boolean isTitleCase(String line) {
        if (TERMINAL_PUNCTUATION.matcher(line).matches()) return false;
        String[] words = line.split("\\s+");
        if (words.length > MAX_TITLE_WORDS - 2) return false;
        int capitalized = 0;
        for (int i = 0; i < words.length; i++) {
            String word = words[i];
            char first = word.charAt(0);
            if (Character.isUpperCase(first)) {
                capitalized++;
            } else if (i == 0 || !SMALL_WORDS.matcher(word).matches()) {
                return false;
            }
        }
        return capitalized > 0;
    }

    /**
     * Heading attivo all'offset dato: l'ultimo che lo precede o coincide.
     * Restituisce null se nessun heading precede l'offset.
     */
    public static SectionBoundary activeAt(int offset, List<SectionBoundary> boundaries) {
        SectionBoundary active = null;
        for (SectionBoundary b : boundaries) {
            if (b.offset() <= offset) active = b;
            else break;
        }
        return active;
    }
}

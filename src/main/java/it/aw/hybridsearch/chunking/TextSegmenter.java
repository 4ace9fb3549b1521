package it.aw.hybridsearch.chunking;

import it.aw.hybridsearch.chunking.SectionDetector.SectionBoundary;
import it.aw.hybridsearch.model.Chunk;
import it.aw.hybridsearch.model.ChunkingConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Divide il testo di un documento in chunk sovrapposti, limitati in token stimati,
 * lungo confini semantici.
 * <p>
 * Modalità semantica (default):
 * <ol>
 *   <li>il testo è diviso in sezioni dagli heading ({@link SectionDetector}); i paragrafi
 *       (separati da righe vuote) sono divisi in frasi ({@link SentenceSplitter});</li>
 *   <li>le frasi si accumulano finché la stima supera {@code targetChunkTokens}; il chunk
 *       successivo riparte dalle ultime frasi del precedente per circa {@code overlapTokens};
 *       un cambio di sezione chiude il chunk se ha già raggiunto {@code minChunkTokens};</li>
 *   <li>post-processing: i chunk sotto il minimo vengono fusi con il vicino se l'unione resta
 *       entro 1.2 × target, quelli oltre 1.5 × target vengono ri-accumulati da soli.</li>
 * </ol>
 * La modalità a caratteri ({@code semanticMode = false}) usa finestre di target × 3.5 caratteri
 * e passa per lo stesso post-processing.
 * <p>
 * Ogni chunk è un sotto-intervallo esatto del testo originale: a parità di input
 * il risultato è identico, offset compresi.
 */
@Component
public class TextSegmenter {

    private static final Logger log = LoggerFactory.getLogger(TextSegmenter.class);

    private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\n[ \\t\\x0B\\f\\r]*\\n");
    private static final double MERGE_LIMIT = 1.2;
    private static final double SPLIT_LIMIT = 1.5;
    private static final double CHARS_PER_TOKEN = 3.5;

    /**
     * Segmenta il testo del documento.
     *
     * @return chunk ordinati per sequenceIndex; lista vuota se il testo è vuoto o solo spazi
     */
    public List<Chunk> segment(String documentId, String text, ChunkingConfig config) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        List<SectionBoundary> headings = SectionDetector.detect(text);

        List<int[]> spans = config.semanticMode()
                ? semanticSpans(text, headings, config)
                : characterSpans(text, config);
        spans = mergeSmall(text, spans, config);
        spans = splitOversized(text, spans, config);

        List<Chunk> chunks = new ArrayList<>(spans.size());
        for (int[] span : spans) {
            int index = chunks.size();
            String chunkText = text.substring(span[0], span[1]);
            SectionBoundary section = SectionDetector.activeAt(span[0], headings);
            chunks.add(new Chunk(
                    Chunk.idFor(documentId, index),
                    index,
                    chunkText,
                    span[0],
                    span[1],
                    TokenEstimator.estimate(chunkText),
                    KeywordExtractor.extract(chunkText),
                    section != null ? section.title() : null));
        }
        log.debug("Documento {}: {} heading, {} chunk (semantic={})",
                documentId, headings.size(), chunks.size(), config.semanticMode());
        return chunks;
    }

    // -------------------------------------------------------------------------
    // Modalità semantica
    // -------------------------------------------------------------------------

    private List<int[]> semanticSpans(String text, List<SectionBoundary> headings, ChunkingConfig config) {
        int maxUnitTokens = Math.max(1, config.targetChunkTokens() / 2);
        List<TextSpan> units = new ArrayList<>();
        List<Integer> sectionOf = new ArrayList<>();

        List<int[]> sections = sections(text, headings);
        for (int s = 0; s < sections.size(); s++) {
            int before = units.size();
            collectUnits(text, sections.get(s)[0], sections.get(s)[1], headings, maxUnitTokens, units);
            int sectionId = config.preserveBoundaries() ? s : 0;
            for (int i = before; i < units.size(); i++) sectionOf.add(sectionId);
        }
        return accumulate(units, sectionOf, config);
    }

    /** Intervalli [start, end) delimitati dagli heading; il preambolo è la prima sezione. */
    private static List<int[]> sections(String text, List<SectionBoundary> headings) {
        List<int[]> sections = new ArrayList<>();
        int start = 0;
        for (SectionBoundary heading : headings) {
            if (heading.offset() > start) {
                sections.add(new int[]{start, heading.offset()});
            }
            start = heading.offset();
        }
        sections.add(new int[]{start, text.length()});
        sections.removeIf(s -> text.substring(s[0], s[1]).isBlank());
        return sections;
    }

    /**
     * Unità di accumulo della sezione: la riga di heading da sola, poi le frasi di ogni
     * paragrafo. Le frasi oltre {@code maxUnitTokens} vengono ridotte a finestre di parole.
     */
    private static void collectUnits(String text, int start, int end, List<SectionBoundary> headings,
                                     int maxUnitTokens, List<TextSpan> target) {
        int pos = SentenceSplitter.skipWhitespace(text, start, end);
        if (startsHeading(pos, headings)) {
            int lineEnd = text.indexOf('\n', pos);
            lineEnd = lineEnd < 0 || lineEnd > end ? end : lineEnd;
            addBounded(text, pos, lineEnd, maxUnitTokens, target);
            pos = lineEnd;
        }
        Matcher breaks = PARAGRAPH_BREAK.matcher(text).region(pos, end);
        int paragraphStart = pos;
        while (breaks.find()) {
            addParagraph(text, paragraphStart, breaks.start(), maxUnitTokens, target);
            paragraphStart = breaks.end();
        }
        addParagraph(text, paragraphStart, end, maxUnitTokens, target);
    }

    private static boolean startsHeading(int offset, List<SectionBoundary> headings) {
        for (SectionBoundary h : headings) {
            if (h.offset() == offset) return true;
            if (h.offset() > offset) return false;
        }
        return false;
    }

    private static void addParagraph(String text, int start, int end, int maxUnitTokens, List<TextSpan> target) {
        if (start >= end) return;
        for (TextSpan sentence : SentenceSplitter.split(text, start, end)) {
            addBounded(text, sentence.start(), sentence.end(), maxUnitTokens, target);
        }
    }

    private static void addBounded(String text, int start, int end, int maxUnitTokens, List<TextSpan> target) {
        List<TextSpan> trimmed = new ArrayList<>(1);
        SentenceSplitter.addTrimmed(trimmed, text, start, end);
        if (trimmed.isEmpty()) return;
        TextSpan unit = trimmed.get(0);
        if (unit.tokens() <= maxUnitTokens) {
            target.add(unit);
        } else {
            target.addAll(wordWindows(text, unit.start(), unit.end(), maxUnitTokens));
        }
    }

    /** Finestre consecutive di parole intere, ognuna entro {@code maxTokens} (salvo parole giganti). */
    static List<TextSpan> wordWindows(String text, int start, int end, int maxTokens) {
        List<TextSpan> windows = new ArrayList<>();
        int windowStart = -1;
        int windowEnd = -1;
        int words = 0;
        int i = start;
        while (i < end) {
            while (i < end && Character.isWhitespace(text.charAt(i))) i++;
            if (i >= end) break;
            int wordStart = i;
            while (i < end && !Character.isWhitespace(text.charAt(i))) i++;
            if (windowStart < 0) {
                windowStart = wordStart;
            } else if (TokenEstimator.estimate(words + 1, i - windowStart) > maxTokens) {
                windows.add(new TextSpan(windowStart, windowEnd, words));
                windowStart = wordStart;
                words = 0;
            }
            windowEnd = i;
            words++;
        }
        if (windowStart >= 0) {
            windows.add(new TextSpan(windowStart, windowEnd, words));
        }
        return windows;
    }

    /**
     * Accumula le unità in chunk. Restituisce intervalli [start, end) di caratteri.
     * Un chunk non viene mai chiuso sotto {@code minChunkTokens}, tranne l'ultimo.
     */
    static List<int[]> accumulate(List<TextSpan> units, List<Integer> sectionOf, ChunkingConfig config) {
        List<int[]> spans = new ArrayList<>();
        if (units.isEmpty()) return spans;

        int[] prefixWords = new int[units.size() + 1];
        for (int i = 0; i < units.size(); i++) {
            prefixWords[i + 1] = prefixWords[i] + units.get(i).words();
        }
        Estimator est = (from, to) -> TokenEstimator.estimate(
                prefixWords[to + 1] - prefixWords[from], units.get(to).end() - units.get(from).start());

        int first = 0;
        for (int j = 1; j < units.size(); j++) {
            boolean newSection = !sectionOf.get(j).equals(sectionOf.get(j - 1));
            if (newSection && est.tokens(first, j - 1) >= config.minChunkTokens()) {
                spans.add(new int[]{units.get(first).start(), units.get(j - 1).end()});
                first = j;
                continue;
            }
            if (est.tokens(first, j) > config.targetChunkTokens()
                    && est.tokens(first, j - 1) >= config.minChunkTokens()) {
                spans.add(new int[]{units.get(first).start(), units.get(j - 1).end()});
                int seed = j;
                for (int k = j - 1; k > first; k--) {
                    if (est.tokens(k, j - 1) > config.overlapTokens()) break;
                    seed = k;
                }
                while (seed < j && est.tokens(seed, j) > config.targetChunkTokens()) seed++;
                first = seed;
            }
        }
        spans.add(new int[]{units.get(first).start(), units.get(units.size() - 1).end()});
        return spans;
    }

    @FunctionalInterface
    private interface Estimator {
        int tokens(int fromUnit, int toUnit);
    }

    // -------------------------------------------------------------------------
    // Modalità a caratteri
    // -------------------------------------------------------------------------

    private static List<int[]> characterSpans(String text, ChunkingConfig config) {
        int chunkChars = (int) Math.round(config.targetChunkTokens() * CHARS_PER_TOKEN);
        int overlapChars = (int) Math.round(config.overlapTokens() * CHARS_PER_TOKEN);
        int minProgress = Math.max(1, chunkChars / 2);

        List<int[]> spans = new ArrayList<>();
        int pos = SentenceSplitter.skipWhitespace(text, 0, text.length());
        while (pos < text.length()) {
            int end = Math.min(pos + chunkChars, text.length());
            if (end < text.length() && config.preserveBoundaries()) {
                end = adjustEnd(text, pos, pos + minProgress, end, config.minChunkTokens());
            }
            List<TextSpan> trimmed = new ArrayList<>(1);
            SentenceSplitter.addTrimmed(trimmed, text, pos, end);
            trimmed.forEach(t -> spans.add(new int[]{t.start(), t.end()}));
            if (end >= text.length()) break;

            int next = Math.max(end - overlapChars, pos + minProgress);
            // non ripartire a metà parola
            while (next > pos && next < text.length() && !Character.isWhitespace(text.charAt(next - 1))) next--;
            if (next <= pos) next = Math.max(end - overlapChars, pos + minProgress);
            pos = SentenceSplitter.skipWhitespace(text, next, text.length());
        }
        return spans;
    }

    /**
     * Sposta la fine della finestra su fine paragrafo, fine frase o spazio, in quest'ordine.
     * Un confine è accettato solo se il chunk [pos, confine) raggiunge {@code minTokens}:
     * un chunk intermedio sotto il minimo non verrebbe più fuso con il successivo.
     */
    private static int adjustEnd(String text, int pos, int from, int end, int minTokens) {
        int paragraph = text.lastIndexOf("\n\n", end - 2);
        if (paragraph >= from && trimmedTokens(text, pos, paragraph + 2) >= minTokens) {
            return paragraph + 2;
        }
        for (int i = end - 1; i > from; i--) {
            char c = text.charAt(i - 1);
            if ((c == '.' || c == '!' || c == '?') && Character.isWhitespace(text.charAt(i))) {
                if (trimmedTokens(text, pos, i) >= minTokens) return i;
                break;
            }
        }
        for (int i = end; i > from; i--) {
            if (Character.isWhitespace(text.charAt(i - 1))) {
                return trimmedTokens(text, pos, i) >= minTokens ? i : end;
            }
        }
        return end;
    }

    private static int trimmedTokens(String text, int start, int end) {
        while (end > start && Character.isWhitespace(text.charAt(end - 1))) end--;
        return tokens(text, start, end);
    }

    // -------------------------------------------------------------------------
    // Post-processing
    // -------------------------------------------------------------------------

    private static int tokens(String text, int start, int end) {
        return TokenEstimator.estimate(TokenEstimator.countWords(text, start, end), end - start);
    }

    /**
     * Fonde i chunk sotto il minimo con il successivo (o, per l'ultimo, con il precedente)
     * finché l'unione resta entro 1.2 × target.
     */
    static List<int[]> mergeSmall(String text, List<int[]> spans, ChunkingConfig config) {
        int mergeLimit = (int) (config.targetChunkTokens() * MERGE_LIMIT);
        List<int[]> merged = new ArrayList<>(spans.size());
        int i = 0;
        while (i < spans.size()) {
            int[] current = spans.get(i);
            while (tokens(text, current[0], current[1]) < config.minChunkTokens()
                    && i + 1 < spans.size()
                    && tokens(text, current[0], spans.get(i + 1)[1]) <= mergeLimit) {
                current = new int[]{current[0], spans.get(i + 1)[1]};
                i++;
            }
            merged.add(current);
            i++;
        }
        int last = merged.size() - 1;
        if (last > 0) {
            int[] tail = merged.get(last);
            int[] previous = merged.get(last - 1);
            if (tokens(text, tail[0], tail[1]) < config.minChunkTokens()
                    && tokens(text, previous[0], tail[1]) <= mergeLimit) {
                merged.remove(last);
                merged.set(last - 1, new int[]{previous[0], tail[1]});
            }
        }
        return merged;
    }

    /** Ri-accumula da solo ogni chunk oltre 1.5 × target. */
    private static List<int[]> splitOversized(String text, List<int[]> spans, ChunkingConfig config) {
        int splitLimit = (int) (config.targetChunkTokens() * SPLIT_LIMIT);
        List<int[]> result = new ArrayList<>(spans.size());
        for (int[] span : spans) {
            if (tokens(text, span[0], span[1]) <= splitLimit) {
                result.add(span);
                continue;
            }
            int maxUnitTokens = Math.max(1, config.targetChunkTokens() / 2);
            List<TextSpan> units = new ArrayList<>();
            Matcher breaks = PARAGRAPH_BREAK.matcher(text).region(span[0], span[1]);
            int paragraphStart = span[0];
            while (breaks.find()) {
                addParagraph(text, paragraphStart, breaks.start(), maxUnitTokens, units);
                paragraphStart = breaks.end();
            }
            addParagraph(text, paragraphStart, span[1], maxUnitTokens, units);
            List<Integer> sameSection = new ArrayList<>(units.size());
            units.forEach(u -> sameSection.add(0));
            List<int[]> pieces = mergeSmall(text, accumulate(units, sameSection, config), config);
            log.debug("Chunk di {} token suddiviso in {} parti", tokens(text, span[0], span[1]), pieces.size());
            result.addAll(pieces);
        }
        return result;
    }
}

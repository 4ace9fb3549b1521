package it.aw.hybridsearch.model;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Metadati di documento prodotti a monte (tag di categoria, identificatori, data)
 * più la mappa delle pagine quando il testo proviene da un PDF.
 */
public record DocumentMetadata(List<String> tags,
                               List<String> categoryIdentifiers,
                               LocalDate documentDate,
                               List<PageSpan> pages) {

    public DocumentMetadata {
        tags = tags == null ? List.of() : List.copyOf(tags);
        categoryIdentifiers = categoryIdentifiers == null ? List.of() : List.copyOf(categoryIdentifiers);
        pages = pages == null ? List.of() : List.copyOf(pages);
    }

    public static DocumentMetadata empty() {
        return new DocumentMetadata(List.of(), List.of(), null, List.of());
    }

    /**
     * Page range coperto dall'intervallo [start, end) del testo.
     *
     * @return int[]{pageStart, pageEnd} (1-based), oppure null se non ci sono pagine note
     */
    public int[] pageRangeFor(int start, int end) {
        int pageStart = -1;
        int pageEnd = -1;
        for (PageSpan span : pages) {
            if (span.endOffset() <= start) continue;
            if (span.startOffset() >= end) break;
            if (pageStart == -1) pageStart = span.page();
            pageEnd = span.page();
        }
        return pageStart == -1 ? null : new int[]{pageStart, pageEnd};
    }

    /** Metadati da salvare insieme al vettore del chunk. */
    public Map<String, Object> forChunk(Chunk chunk) {
        Map<String, Object> map = new LinkedHashMap<>();
        if (chunk.sectionTitle() != null) map.put("sectionTitle", chunk.sectionTitle());
        int[] range = pageRangeFor(chunk.startOffset(), chunk.endOffset());
        if (range != null) {
            map.put("pageStart", range[0]);
            map.put("pageEnd", range[1]);
        }
        if (!tags.isEmpty()) map.put("tags", tags);
        if (!categoryIdentifiers.isEmpty()) map.put("categoryIdentifiers", categoryIdentifiers);
        if (documentDate != null) map.put("documentDate", documentDate.toString());
        map.put("startOffset", chunk.startOffset());
        map.put("endOffset", chunk.endOffset());
        return map;
    }
}

package it.aw.hybridsearch.service;

import it.aw.hybridsearch.model.PageSpan;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Estrae il testo di un file caricato: PDF pagina per pagina via PDFBox, altrimenti
 * testo UTF-8.
 * <p>
 * Per i PDF produce anche la mappa pagina → offset nel testo concatenato, usata
 * per calcolare pageStart/pageEnd di ogni chunk.
 */
public class DocumentParser {

    private static final Logger log = LoggerFactory.getLogger(DocumentParser.class);

    private DocumentParser() {}

    /** Testo completo del file; {@code pages} è vuota per i file non PDF. */
    public record ParsedText(String text, List<PageSpan> pages) {}

    public static boolean isPdf(String contentType, String filename) {
        return "application/pdf".equals(contentType)
                || (filename != null && filename.toLowerCase(Locale.ROOT).endsWith(".pdf"));
    }

    /**
     * L'input stream NON viene chiuso dal metodo: la responsabilità è del chiamante.
     */
    public static ParsedText parse(InputStream inputStream, String contentType, String filename) throws IOException {
        if (!isPdf(contentType, filename)) {
            return new ParsedText(new String(inputStream.readAllBytes(), StandardCharsets.UTF_8), List.of());
        }
        try (PDDocument doc = PDDocument.load(inputStream)) {
            int totalPages = doc.getNumberOfPages();
            log.debug("DocumentParser: {} pagine trovate in {}", totalPages, filename);

            PDFTextStripper stripper = new PDFTextStripper();
            StringBuilder sb = new StringBuilder();
            List<PageSpan> pages = new ArrayList<>(totalPages);

            for (int p = 1; p <= totalPages; p++) {
                stripper.setStartPage(p);
                stripper.setEndPage(p);
                int start = sb.length();
                sb.append(stripper.getText(doc));
                pages.add(new PageSpan(p, start, sb.length()));
            }
            return new ParsedText(sb.toString(), pages);
        }
    }
}

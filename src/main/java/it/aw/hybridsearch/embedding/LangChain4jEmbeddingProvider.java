package it.aw.hybridsearch.embedding;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import it.aw.hybridsearch.exception.ProviderErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeoutException;

/**
 * {@link EmbeddingProvider} sopra un {@link EmbeddingModel} LangChain4j
 * (AllMiniLM-L6-v2 locale oppure OpenAI).
 * <p>
 * Le eccezioni del modello vengono classificate lungo la catena delle cause
 * e restituite come {@link EmbeddingResult#err}; la risposta è validata
 * (numero di vettori e dimensioni) prima di essere accettata.
 */
public class LangChain4jEmbeddingProvider implements EmbeddingProvider {

    private static final Logger log = LoggerFactory.getLogger(LangChain4jEmbeddingProvider.class);

    private final EmbeddingModel embeddingModel;
    private final String modelName;
    private final int dimensions;
    private final int maxTokensPerItem;
    private final int maxBatchSize;

    public LangChain4jEmbeddingProvider(EmbeddingModel embeddingModel, String modelName, int dimensions,
                                        int maxTokensPerItem, int maxBatchSize) {
        this.embeddingModel = embeddingModel;
        this.modelName = modelName;
        this.dimensions = dimensions;
        this.maxTokensPerItem = maxTokensPerItem;
        this.maxBatchSize = maxBatchSize;
    }

    @Override
    public EmbeddingResult embed(List<String> texts) {
        if (texts.isEmpty()) {
            return EmbeddingResult.ok(List.of());
        }
        for (String text : texts) {
            if (text == null || text.isBlank()) {
                return EmbeddingResult.err(ProviderErrorKind.INVALID_INPUT, "testo vuoto nel batch");
            }
        }
        Response<List<Embedding>> response;
        try {
            response = embeddingModel.embedAll(texts.stream().map(TextSegment::from).toList());
        } catch (RuntimeException e) {
            ProviderErrorKind kind = classify(e);
            log.debug("Chiamata embedding fallita ({}): {}", kind, e.getMessage());
            return EmbeddingResult.err(kind, describe(e));
        }

        List<Embedding> embeddings = response == null ? null : response.content();
        if (embeddings == null || embeddings.size() != texts.size()) {
            return EmbeddingResult.err(ProviderErrorKind.INVALID_RESPONSE,
                    "attesi " + texts.size() + " vettori, ricevuti " + (embeddings == null ? 0 : embeddings.size()));
        }
        List<float[]> vectors = new ArrayList<>(embeddings.size());
        for (Embedding embedding : embeddings) {
            float[] vector = embedding == null ? null : embedding.vector();
            if (vector == null || vector.length == 0) {
                return EmbeddingResult.err(ProviderErrorKind.INVALID_RESPONSE, "vettore vuoto nella risposta");
            }
            if (dimensions > 0 && vector.length != dimensions) {
                return EmbeddingResult.err(ProviderErrorKind.INVALID_RESPONSE,
                        "dimensioni " + vector.length + " diverse da quelle configurate (" + dimensions + ")");
            }
            vectors.add(vector);
        }
        return EmbeddingResult.ok(vectors);
    }

    /** Classifica un fallimento del modello risalendo la catena delle cause. */
    static ProviderErrorKind classify(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof TimeoutException || t instanceof InterruptedIOException) {
                return ProviderErrorKind.TIMEOUT;
            }
            String message = t.getMessage() == null ? "" : t.getMessage().toLowerCase(Locale.ROOT);
            if (message.contains("insufficient_quota") || message.contains("quota")) {
                return ProviderErrorKind.QUOTA;
            }
            if (message.contains("429") || message.contains("rate limit") || message.contains("rate_limit")) {
                return ProviderErrorKind.RATE_LIMIT;
            }
            if (message.contains("timed out") || message.contains("timeout")) {
                return ProviderErrorKind.TIMEOUT;
            }
            if (t instanceof IOException) {
                return ProviderErrorKind.NETWORK;
            }
            if (t instanceof IllegalArgumentException) {
                return ProviderErrorKind.INVALID_INPUT;
            }
            if (t.getCause() == t) break;
        }
        return ProviderErrorKind.UNEXPECTED;
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    @Override
    public String model() {
        return modelName;
    }

    @Override
    public int dimensions() {
        return dimensions;
    }

    @Override
    public int maxTokensPerItem() {
        return maxTokensPerItem;
    }

    @Override
    public int maxBatchSize() {
        return maxBatchSize;
    }
}

package it.aw.hybridsearch.config;

import dev.langchain4j.model.embedding.AllMiniLmL6V2QuantizedEmbeddingModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import it.aw.hybridsearch.embedding.EmbeddingProvider;
import it.aw.hybridsearch.embedding.LangChain4jEmbeddingProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Configura il modello di embedding LangChain4j e il provider che lo espone alla pipeline.
 *
 * embedding.provider=local:  AllMiniLM-L6-v2 quantizzato, gira in locale, 384 dimensioni, senza API key.
 *                            Input massimo 512 token.
 * embedding.provider=openai: OpenAiEmbeddingModel (es. text-embedding-3-small, 1536 dimensioni).
 *                            Input massimo 8192 token. I tentativi sono gestiti dal BatchEmbedder, non dal client.
 *
 * embedding.max-tokens-per-item, se valorizzato, sostituisce il limite del provider.
 */
@Configuration
public class LangChain4jConfig {

    private static final Logger log = LoggerFactory.getLogger(LangChain4jConfig.class);

    static final int LOCAL_MAX_TOKENS  = 512;
    static final int OPENAI_MAX_TOKENS = 8192;

    @Value("${embedding.provider:local}")
    private String provider;

    @Value("${embedding.model:all-minilm-l6-v2-q}")
    private String modelName;

    @Value("${embedding.dimensions:384}")
    private int dimensions;

    @Value("${embedding.openai.api-key:}")
    private String openAiApiKey;

    @Value("${embedding.timeout-ms:60000}")
    private long timeoutMs;

    @Value("${embedding.max-tokens-per-item:0}")
    private int maxTokensPerItem;

    @Value("${embedding.max-batch-items:2048}")
    private int maxBatchItems;

    @Bean
    public EmbeddingModel embeddingModel() {
        if ("openai".equalsIgnoreCase(provider)) {
            if (openAiApiKey == null || openAiApiKey.isBlank()) {
                throw new IllegalStateException("embedding.openai.api-key obbligatoria con embedding.provider=openai");
            }
            log.info("Inizializzazione EmbeddingModel: OpenAI {} ({} dimensioni)", modelName, dimensions);
            return OpenAiEmbeddingModel.builder()
                    .apiKey(openAiApiKey)
                    .modelName(modelName)
                    .timeout(Duration.ofMillis(timeoutMs))
                    .maxRetries(0)
                    .build();
        }
        log.info("Inizializzazione EmbeddingModel: AllMiniLmL6V2Quantized (locale)");
        return new AllMiniLmL6V2QuantizedEmbeddingModel();
    }

    @Bean
    public EmbeddingProvider embeddingProvider(EmbeddingModel embeddingModel) {
        int maxTokens = maxTokensFor(provider, maxTokensPerItem);
        log.info("EmbeddingProvider {}: max {} token per input, {} input per chiamata", modelName, maxTokens, maxBatchItems);
        return new LangChain4jEmbeddingProvider(embeddingModel, modelName, dimensions, maxTokens, maxBatchItems);
    }

    /** Limite di token per input: quello configurato se > 0, altrimenti quello del provider. */
    static int maxTokensFor(String provider, int configured) {
        if (configured > 0) {
            return configured;
        }
        return "openai".equalsIgnoreCase(provider) ? OPENAI_MAX_TOKENS : LOCAL_MAX_TOKENS;
    }
}

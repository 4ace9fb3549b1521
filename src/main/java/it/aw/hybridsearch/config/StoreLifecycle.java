package it.aw.hybridsearch.config;

import it.aw.hybridsearch.cache.ResultCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import javax.annotation.PostConstruct;
import javax.annotation.PreDestroy;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Avvio e arresto delle risorse a lunga vita: pulizia periodica della cache e pool di thread.
 * <p>
 * Le connessioni DuckDB sono chiuse dai rispettivi bean (store, registry e connessione radice);
 * i dati sono già persistiti nel file del database, non serve alcun salvataggio esplicito.
 */
@Component
public class StoreLifecycle {

    private static final Logger log = LoggerFactory.getLogger(StoreLifecycle.class);
    private static final long SHUTDOWN_WAIT_SECONDS = 10;

    private final ResultCache resultCache;
    private final List<ExecutorService> executors;

    public StoreLifecycle(ResultCache resultCache,
                          @Qualifier("indexingExecutor") ExecutorService indexingExecutor,
                          @Qualifier("embeddingExecutor") ExecutorService embeddingExecutor,
                          @Qualifier("searchExecutor") ExecutorService searchExecutor) {
        this.resultCache = resultCache;
        this.executors = List.of(indexingExecutor, searchExecutor, embeddingExecutor);
    }

    @PostConstruct
    public void start() {
        resultCache.start();
    }

    @PreDestroy
    public void stop() {
        log.info("Shutdown: arresto pulizia cache e pool di thread...");
        resultCache.close();
        executors.forEach(ExecutorService::shutdown);
        for (ExecutorService executor : executors) {
            try {
                if (!executor.awaitTermination(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS)) {
                    log.warn("Pool non terminato entro {} s, interruzione dei task in corso", SHUTDOWN_WAIT_SECONDS);
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }
}

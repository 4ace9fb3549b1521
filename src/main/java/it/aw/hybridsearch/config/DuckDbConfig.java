package it.aw.hybridsearch.config;

import org.duckdb.DuckDBConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.DriverManager;
import java.sql.SQLException;

/**
 * Connessione radice al database DuckDB che contiene vettori e registry.
 * <p>
 * Ogni componente che accede al database ne ricava una propria connessione con
 * {@link DuckDBConnection#duplicate()}: le connessioni duplicate condividono lo stesso
 * database ma non lo stato di transazione.
 * Con {@code store.duckdb.path} vuoto o {@code :memory:} il database è in memoria.
 */
@Configuration
public class DuckDbConfig {

    private static final Logger log = LoggerFactory.getLogger(DuckDbConfig.class);

    @Value("${store.duckdb.path:data/hybrid-search.duckdb}")
    private String dbPath;

    @Bean(destroyMethod = "close")
    public DuckDBConnection duckDbConnection() throws SQLException, IOException {
        if (dbPath == null || dbPath.isBlank() || ":memory:".equals(dbPath)) {
            log.info("DuckDB: database in memoria");
            return (DuckDBConnection) DriverManager.getConnection("jdbc:duckdb:");
        }
        Path path = Paths.get(dbPath).toAbsolutePath();
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        log.info("DuckDB: database su {}", path);
        return (DuckDBConnection) DriverManager.getConnection("jdbc:duckdb:" + path);
    }
}

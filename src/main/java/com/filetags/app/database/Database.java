package com.filetags.app.database;

import com.filetags.app.config.Config;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.exception.FlywayValidateException;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.sqlobject.SqlObjectPlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Gerencia o pool de conexões, as migrações e o acesso Jdbi ao catálogo.
 * <p>
 * Cada operação do {@link CatalogStore} pega um handle próprio do pool e o
 * devolve ao terminar, então leituras da thread principal não esperam o fim
 * de uma varredura longa.
 */
public final class Database implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(Database.class);

    private final HikariDataSource dataSource;
    private final Jdbi jdbi;

    private Database(HikariDataSource dataSource) {
        this.dataSource = dataSource;
        this.jdbi = Jdbi.create(dataSource);
        this.jdbi.installPlugin(new SqlObjectPlugin());
    }

    /** Abre o catálogo no local resolvido por {@link Config}. */
    public static Database open() {
        return open(Config.getDbUrl(), Config.isCaseSensitivePaths());
    }

    public static Database open(Path dbFile) {
        return open("jdbc:sqlite:" + dbFile.toAbsolutePath(), Config.isCaseSensitivePaths());
    }

    public static Database open(String jdbcUrl, boolean caseSensitivePaths) {
        HikariDataSource ds = createDataSource(jdbcUrl, caseSensitivePaths);
        try {
            migrate(ds);
        } catch (RuntimeException e) {
            ds.close();
            throw e;
        }
        logger.debug("Catálogo aberto: {}", jdbcUrl);
        return new Database(ds);
    }

    private static HikariDataSource createDataSource(String jdbcUrl, boolean caseSensitivePaths) {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(jdbcUrl);
        config.setPoolName("filetags-db");
        config.setConnectionTestQuery("SELECT 1");
        config.setMaximumPoolSize(4);

        // Pragmas por conexão, aplicados pelo driver sqlite-jdbc ao abrir
        config.addDataSourceProperty("foreign_keys", "true");
        config.addDataSourceProperty("journal_mode", "WAL");
        config.addDataSourceProperty("synchronous", "NORMAL");
        config.addDataSourceProperty("busy_timeout", "10000");
        config.addDataSourceProperty("case_sensitive_like", Boolean.toString(caseSensitivePaths));

        try {
            return new HikariDataSource(config);
        } catch (RuntimeException e) {
            throw new StorageException("Falha ao abrir o catálogo: " + jdbcUrl, e);
        }
    }

    private static void migrate(HikariDataSource dataSource) {
        Flyway flyway = Flyway.configure()
                .dataSource(dataSource)
                .locations("classpath:db/migration")
                .baselineOnMigrate(true)
                .baselineVersion("0")
                .load();
        try {
            try {
                flyway.migrate();
            } catch (FlywayValidateException e) {
                logger.warn("Flyway validation failed; attempting repair.", e);
                flyway.repair();
                flyway.migrate();
            }
        } catch (RuntimeException e) {
            logger.error("Flyway migration failed", e);
            throw new StorageException("Flyway migration failed", e);
        }
    }

    public Jdbi jdbi() {
        return jdbi;
    }

    @Override
    public void close() {
        if (!dataSource.isClosed()) {
            dataSource.close();
            logger.debug("Catálogo fechado");
        }
    }
}

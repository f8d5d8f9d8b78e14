package com.filetags.app.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

import io.github.cdimascio.dotenv.Dotenv;

/**
 * Configuração central do FileTags.
 * Resolve o local do banco de dados por sistema operacional e as
 * convenções de caminho do host.
 */
public final class Config {

    private static final String APP_NAME = "FileTags";

    private static final String DEFAULT_DB_NAME = "filetags.db";

    // Cada chave: system property (testes/CI) > variável de ambiente > .env
    private static final Key DB_NAME = new Key("filetags.dbName", "FILETAGS_DB_NAME");
    private static final Key DATA_DIR = new Key("filetags.dataDir", "FILETAGS_DATA_DIR");
    private static final Key CASE_SENSITIVE = new Key("filetags.caseSensitivePaths", "FILETAGS_CASE_SENSITIVE_PATHS");

    private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(Config.class);
    private static final Dotenv dotenv = Dotenv.configure().ignoreIfMissing().load();

    private record Key(String property, String env) {}

    private Config() {}

    /**
     * URL JDBC do catálogo.
     */
    public static String getDbUrl() {
        return "jdbc:sqlite:" + getDbFilePath().toAbsolutePath();
    }

    public static Path getDbFilePath() {
        String name = lookup(DB_NAME);
        return dataDirectory().resolve(name == null ? DEFAULT_DB_NAME : name);
    }

    /**
     * Whether path comparisons (search, prefix filters) are case-sensitive.
     * Defaults to the host convention: Windows and macOS file systems fold case.
     */
    public static boolean isCaseSensitivePaths() {
        String v = lookup(CASE_SENSITIVE);
        if (v != null) {
            return switch (v.toLowerCase(Locale.ROOT)) {
                case "1", "true", "yes", "on" -> true;
                default -> false;
            };
        }
        String os = System.getProperty("os.name", "generic").toLowerCase(Locale.ROOT);
        return !(os.contains("win") || os.contains("mac"));
    }

    private static String lookup(Key key) {
        String v = System.getProperty(key.property());
        if (v == null || v.isBlank()) v = System.getenv(key.env());
        if (v == null || v.isBlank()) v = dotenv.get(key.env());
        return v == null || v.isBlank() ? null : v.trim();
    }

    private static Path dataDirectory() {
        String override = lookup(DATA_DIR);
        if (override != null) {
            Path dir = Paths.get(override);
            try {
                return Files.createDirectories(dir);
            } catch (IOException e) {
                throw new IllegalStateException("Não foi possível criar diretório de dados: " + dir, e);
            }
        }

        Path dir = platformDataDirectory();
        try {
            return Files.createDirectories(dir);
        } catch (IOException e) {
            Path local = Paths.get("").toAbsolutePath();
            logger.warn("Sem permissão em {}; usando o diretório atual: {}", dir, local);
            return local;
        }
    }

    /** APPDATA no Windows, Application Support no macOS, XDG nos demais. */
    private static Path platformDataDirectory() {
        String os = System.getProperty("os.name", "generic").toLowerCase(Locale.ROOT);
        String home = System.getProperty("user.home");
        if (os.contains("win")) {
            String appData = System.getenv("APPDATA");
            return appData == null || appData.isBlank()
                    ? Paths.get(home, "AppData", "Roaming", APP_NAME)
                    : Paths.get(appData, APP_NAME);
        }
        if (os.contains("mac")) {
            return Paths.get(home, "Library", "Application Support", APP_NAME);
        }
        String xdg = System.getenv("XDG_DATA_HOME");
        return xdg == null || xdg.isBlank()
                ? Paths.get(home, ".local", "share", APP_NAME)
                : Paths.get(xdg, APP_NAME);
    }
}

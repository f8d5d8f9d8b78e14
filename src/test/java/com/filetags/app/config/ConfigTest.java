package com.filetags.app.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class ConfigTest {

    @AfterEach
    void clearOverrides() {
        System.clearProperty("filetags.caseSensitivePaths");
    }

    @Test
    void dbPathFollowsSystemPropertyOverrides() {
        // Definidos pelo Surefire no pom.xml.
        String dataDir = System.getProperty("filetags.dataDir");
        assertNotNull(dataDir, "Expected filetags.dataDir from Surefire");

        Path db = Config.getDbFilePath();
        assertEquals("filetags-test.db", db.getFileName().toString());
        assertEquals(Path.of(dataDir).toAbsolutePath().normalize(), db.getParent().toAbsolutePath().normalize());
        assertTrue(Files.isDirectory(db.getParent()), "data dir is created on demand");
        assertEquals("jdbc:sqlite:" + db.toAbsolutePath(), Config.getDbUrl());
    }

    @Test
    void dbNameFallsBackToDefaultWhenNotOverridden() {
        String original = System.getProperty("filetags.dbName");
        System.clearProperty("filetags.dbName");
        try {
            assertEquals("filetags.db", Config.getDbFilePath().getFileName().toString());
        } finally {
            System.setProperty("filetags.dbName", original);
        }
    }

    @Test
    void caseSensitivityCanBeForced() {
        System.setProperty("filetags.caseSensitivePaths", "true");
        assertTrue(Config.isCaseSensitivePaths());

        System.setProperty("filetags.caseSensitivePaths", "no");
        assertFalse(Config.isCaseSensitivePaths());
    }
}

package db.migration;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

import org.flywaydb.core.api.migration.BaseJavaMigration;
import org.flywaydb.core.api.migration.Context;

public final class V1__catalog_schema extends BaseJavaMigration {

    @Override
    public void migrate(Context context) throws Exception {
        Connection conn = context.getConnection();

        try (Statement st = conn.createStatement()) {
            st.execute("PRAGMA foreign_keys=ON");
        }

        // Idempotente: catálogos antigos já podem ter as tabelas
        ensureSchema(conn);
        ensureIndexes(conn);
    }

    private void ensureSchema(Connection conn) throws SQLException {
        try (Statement st = conn.createStatement()) {
            st.execute("""
                CREATE TABLE IF NOT EXISTS files (
                    id    INTEGER PRIMARY KEY,
                    path  TEXT UNIQUE,
                    size  INTEGER,
                    mtime REAL,
                    hash  TEXT                 -- reservado, nunca preenchido
                )
                """);

            st.execute("""
                CREATE TABLE IF NOT EXISTS tags (
                    id   INTEGER PRIMARY KEY,
                    name TEXT UNIQUE,
                    ord  INTEGER
                )
                """);

            st.execute("""
                CREATE TABLE IF NOT EXISTS file_tags (
                    file_id INTEGER,
                    tag_id  INTEGER,
                    UNIQUE(file_id, tag_id),
                    FOREIGN KEY(file_id) REFERENCES files(id) ON DELETE CASCADE,
                    FOREIGN KEY(tag_id)  REFERENCES tags(id)  ON DELETE CASCADE
                )
                """);

            st.execute("""
                CREATE TABLE IF NOT EXISTS roots (
                    path         TEXT PRIMARY KEY,
                    last_scanned REAL
                )
                """);

            st.execute("""
                CREATE TABLE IF NOT EXISTS settings (
                    key   TEXT PRIMARY KEY,
                    value TEXT
                )
                """);
        }
    }

    private void ensureIndexes(Connection conn) throws SQLException {
        try (Statement st = conn.createStatement()) {
            st.execute("CREATE INDEX IF NOT EXISTS idx_files_path ON files(path)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_files_mtime ON files(mtime)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_tags_name ON tags(name)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_file_tags_file ON file_tags(file_id)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_file_tags_tag ON file_tags(tag_id)");
        }
    }
}

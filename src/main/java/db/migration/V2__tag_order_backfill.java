package db.migration;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

import org.flywaydb.core.api.migration.BaseJavaMigration;
import org.flywaydb.core.api.migration.Context;

/**
 * Catálogos criados antes da ordenação manual têm tags com ord NULL.
 * Numera essas tags por nome, depois das que já têm ordem.
 */
public final class V2__tag_order_backfill extends BaseJavaMigration {

    @Override
    public void migrate(Context context) throws Exception {
        Connection conn = context.getConnection();

        List<Long> pending = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement("SELECT id FROM tags WHERE ord IS NULL ORDER BY name");
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) pending.add(rs.getLong(1));
        }
        if (pending.isEmpty()) return;

        long next = maxOrd(conn) + 1;
        try (PreparedStatement ps = conn.prepareStatement("UPDATE tags SET ord = ? WHERE id = ?")) {
            for (Long id : pending) {
                ps.setLong(1, next++);
                ps.setLong(2, id);
                ps.addBatch();
            }
            ps.executeBatch();
        }
    }

    private long maxOrd(Connection conn) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT COALESCE(MAX(ord), 0) FROM tags");
             ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getLong(1) : 0;
        }
    }
}

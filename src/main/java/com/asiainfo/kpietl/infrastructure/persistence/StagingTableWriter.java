package com.asiainfo.kpietl.infrastructure.persistence;

import com.asiainfo.kpietl.domain.model.CounterRow;
import com.asiainfo.kpietl.shared.PipelineException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.sql.Types;
import java.util.List;

/**
 * 中间库写入：(Date DATETIME, indicateur VARCHAR(255), valeur FLOAT)
 * 每个批次一个事务，失败回滚后抛出
 */
public class StagingTableWriter {

    private static final Logger log = LoggerFactory.getLogger(StagingTableWriter.class);

    private final Connection conn;

    public StagingTableWriter(Connection conn) {
        this.conn = conn;
    }

    public void ensureTable(String table) {
        try {
            String sql = "CREATE TABLE IF NOT EXISTS " + SqlIdentifiers.quote(conn, table) + " ("
                    + "Date DATETIME, "
                    + "indicateur VARCHAR(255), "
                    + "valeur FLOAT)";
            try (Statement stmt = conn.createStatement()) {
                stmt.execute(sql);
            }
            if (!conn.getAutoCommit()) {
                conn.commit();
            }
        } catch (SQLException e) {
            throw new PipelineException("Failed to create staging table " + table, e);
        }
    }

    /**
     * 写入一个批次，NaN 写为 NULL
     *
     * @return 写入行数
     */
    public int insertBatch(String table, List<CounterRow> rows) {
        if (rows.isEmpty()) {
            return 0;
        }
        try {
            String sql = "INSERT INTO " + SqlIdentifiers.quote(conn, table)
                    + " (Date, indicateur, valeur) VALUES (?, ?, ?)";
            boolean autoCommit = conn.getAutoCommit();
            conn.setAutoCommit(false);
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                for (CounterRow row : rows) {
                    if (row.timestamp() != null) {
                        stmt.setTimestamp(1, Timestamp.valueOf(row.timestamp()));
                    } else {
                        stmt.setNull(1, Types.TIMESTAMP);
                    }
                    stmt.setString(2, row.indicator());
                    Double value = sanitize(row.value());
                    if (value != null) {
                        stmt.setDouble(3, value);
                    } else {
                        stmt.setNull(3, Types.FLOAT);
                    }
                    stmt.addBatch();
                }
                stmt.executeBatch();
                conn.commit();
            } catch (SQLException e) {
                rollback(table, e);
                throw e;
            } finally {
                conn.setAutoCommit(autoCommit);
            }
            log.debug("[Staging] Loaded {} rows into {}", rows.size(), table);
            return rows.size();
        } catch (SQLException e) {
            log.error("[Staging] Error loading batch into {}", table, e);
            throw new PipelineException("Failed to load batch into " + table, e);
        }
    }

    static Double sanitize(Double value) {
        if (value == null || value.isNaN()) {
            return null;
        }
        return value;
    }

    private void rollback(String table, SQLException cause) {
        try {
            conn.rollback();
        } catch (SQLException e) {
            cause.addSuppressed(e);
            log.error("[Staging] Rollback failed for {}", table, e);
        }
    }
}

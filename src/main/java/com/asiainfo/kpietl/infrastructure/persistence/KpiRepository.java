package com.asiainfo.kpietl.infrastructure.persistence;

import com.asiainfo.kpietl.domain.model.KpiDetailRow;
import com.asiainfo.kpietl.domain.model.KpiTableGroup;
import com.asiainfo.kpietl.shared.PipelineException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

/**
 * KPI 结果库
 * - kpi_summary(id, date, node)，(date, node) 唯一
 * - 每个明细表分组一张表 (id, kpi_id → kpi_summary.id, operator, suffix, &lt;kpi&gt; FLOAT ...)
 */
public class KpiRepository {

    private static final Logger log = LoggerFactory.getLogger(KpiRepository.class);

    public static final String SUMMARY_TABLE = "kpi_summary";

    private final Connection conn;

    public KpiRepository(Connection conn) {
        this.conn = conn;
    }

    /**
     * 表不存在时创建，已存在的表不做任何修改
     */
    public void createTables(List<KpiTableGroup> groups) {
        try (Statement stmt = conn.createStatement()) {
            if (!SqlIdentifiers.tableExists(conn, SUMMARY_TABLE)) {
                stmt.execute("CREATE TABLE " + SUMMARY_TABLE + " ("
                        + "id BIGINT AUTO_INCREMENT PRIMARY KEY, "
                        + "date DATETIME NOT NULL, "
                        + "node VARCHAR(50) NOT NULL, "
                        + "CONSTRAINT uk_kpi_summary_date_node UNIQUE (date, node))");
                log.info("[KPI] Created table {}", SUMMARY_TABLE);
            }
            for (KpiTableGroup group : groups) {
                String table = SqlIdentifiers.requireSafe(group.name());
                if (SqlIdentifiers.tableExists(conn, table)) {
                    continue;
                }
                String kpiColumns = group.kpiNames().stream()
                        .map(name -> SqlIdentifiers.requireSafe(name) + " FLOAT")
                        .collect(Collectors.joining(", "));
                stmt.execute("CREATE TABLE " + table + " ("
                        + "id BIGINT AUTO_INCREMENT PRIMARY KEY, "
                        + "kpi_id BIGINT NOT NULL, "
                        + "operator VARCHAR(50), "
                        + "suffix VARCHAR(255), "
                        + (kpiColumns.isEmpty() ? "" : kpiColumns + ", ")
                        + "CONSTRAINT fk_" + table + "_summary FOREIGN KEY (kpi_id) REFERENCES " + SUMMARY_TABLE + " (id))");
                stmt.execute("CREATE INDEX idx_" + table + "_kpi_operator_suffix ON " + table
                        + " (kpi_id, operator, suffix)");
                log.info("[KPI] Created table {} with {} KPI columns", table, group.kpis().size());
            }
            if (!conn.getAutoCommit()) {
                conn.commit();
            }
        } catch (SQLException e) {
            throw new PipelineException("Failed to create KPI tables", e);
        }
    }

    /**
     * 按 (date, node) 查找汇总行，不存在则创建
     *
     * @return 汇总行 id
     */
    public long findOrCreateSummary(LocalDateTime date, String node) {
        try {
            Long existing = findSummary(date, node);
            if (existing != null) {
                return existing;
            }
            String sql = "INSERT INTO " + SUMMARY_TABLE + " (date, node) VALUES (?, ?)";
            try (PreparedStatement stmt = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
                stmt.setTimestamp(1, Timestamp.valueOf(date));
                stmt.setString(2, node);
                stmt.executeUpdate();
                try (ResultSet keys = stmt.getGeneratedKeys()) {
                    if (!keys.next()) {
                        throw new SQLException("No generated key returned for " + SUMMARY_TABLE);
                    }
                    long id = keys.getLong(1);
                    commitIfNeeded();
                    log.debug("[KPI] Created summary id={} for date={}, node={}", id, date, node);
                    return id;
                }
            } catch (SQLException e) {
                rollbackQuietly(e);
                throw e;
            }
        } catch (SQLException e) {
            throw new PipelineException("Failed to resolve summary for date=" + date + ", node=" + node, e);
        }
    }

    Long findSummary(LocalDateTime date, String node) throws SQLException {
        String sql = "SELECT id FROM " + SUMMARY_TABLE + " WHERE date = ? AND node = ?";
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setTimestamp(1, Timestamp.valueOf(date));
            stmt.setString(2, node);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? rs.getLong(1) : null;
            }
        }
    }

    /**
     * 删除某个汇总行在各明细表中的已有明细
     */
    public int deleteDetails(List<KpiTableGroup> groups, long summaryId) {
        int deleted = 0;
        try {
            for (KpiTableGroup group : groups) {
                String sql = "DELETE FROM " + SqlIdentifiers.requireSafe(group.name()) + " WHERE kpi_id = ?";
                try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                    stmt.setLong(1, summaryId);
                    deleted += stmt.executeUpdate();
                }
            }
            commitIfNeeded();
        } catch (SQLException e) {
            rollbackQuietly(e);
            throw new PipelineException("Failed to delete details for summary id=" + summaryId, e);
        }
        return deleted;
    }

    /**
     * 批量写入明细，全部 KPI 为 null 的行不写
     *
     * @return 实际写入行数
     */
    public int insertDetails(KpiTableGroup group, List<KpiDetailRow> rows) {
        List<KpiDetailRow> writable = rows.stream().filter(KpiDetailRow::hasAnyValue).toList();
        if (writable.size() < rows.size()) {
            log.warn("[KPI] Skipping {} all-null row(s) for {}", rows.size() - writable.size(), group.name());
        }
        if (writable.isEmpty()) {
            return 0;
        }

        List<String> kpiNames = group.kpiNames();
        String table = SqlIdentifiers.requireSafe(group.name());
        String columns = kpiNames.isEmpty() ? "" : ", " + String.join(", ", kpiNames);
        String placeholders = "?, ?, ?" + ", ?".repeat(kpiNames.size());
        String sql = "INSERT INTO " + table + " (kpi_id, operator, suffix" + columns + ") VALUES (" + placeholders + ")";

        try {
            boolean autoCommit = conn.getAutoCommit();
            conn.setAutoCommit(false);
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                for (KpiDetailRow row : writable) {
                    stmt.setLong(1, row.summaryId());
                    stmt.setString(2, row.operator());
                    stmt.setString(3, row.suffix());
                    int idx = 4;
                    for (String kpi : kpiNames) {
                        Double value = row.values().get(kpi);
                        if (value != null) {
                            stmt.setDouble(idx++, value);
                        } else {
                            stmt.setNull(idx++, Types.FLOAT);
                        }
                    }
                    stmt.addBatch();
                }
                stmt.executeBatch();
                conn.commit();
            } catch (SQLException e) {
                rollbackQuietly(e);
                throw e;
            } finally {
                conn.setAutoCommit(autoCommit);
            }
        } catch (SQLException e) {
            log.error("[KPI] Error inserting {} rows into {}", writable.size(), table, e);
            throw new PipelineException("Failed to insert KPI details into " + table, e);
        }
        log.info("[KPI] Inserted {} rows into {}", writable.size(), table);
        return writable.size();
    }

    private void commitIfNeeded() throws SQLException {
        if (!conn.getAutoCommit()) {
            conn.commit();
        }
    }

    private void rollbackQuietly(SQLException cause) {
        try {
            if (!conn.getAutoCommit()) {
                conn.rollback();
            }
        } catch (SQLException e) {
            cause.addSuppressed(e);
        }
    }
}

package com.asiainfo.kpietl.infrastructure.persistence;

import com.asiainfo.kpietl.domain.model.CounterRow;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * 中间库读取：时间点清单、按时间点 + 计数器前缀过滤的原始行
 */
public class StagingCounterReader {

    private final Connection conn;

    public StagingCounterReader(Connection conn) {
        this.conn = conn;
    }

    public boolean tableExists(String table) throws SQLException {
        return SqlIdentifiers.tableExists(conn, table);
    }

    public List<LocalDateTime> distinctDates(String table) throws SQLException {
        String sql = "SELECT DISTINCT Date FROM " + SqlIdentifiers.quote(conn, table)
                + " WHERE Date IS NOT NULL ORDER BY Date";
        List<LocalDateTime> dates = new ArrayList<>();
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery(sql)) {
            while (rs.next()) {
                dates.add(rs.getTimestamp(1).toLocalDateTime());
            }
        }
        return dates;
    }

    /**
     * 读取指定时间点内、指标名以任一前缀开头的行
     */
    public List<CounterRow> fetchCounters(String table, List<LocalDateTime> dates, Collection<String> prefixes)
            throws SQLException {
        if (dates.isEmpty() || prefixes.isEmpty()) {
            return Collections.emptyList();
        }
        StringBuilder sql = new StringBuilder("SELECT Date, indicateur, valeur FROM ")
                .append(SqlIdentifiers.quote(conn, table))
                .append(" WHERE Date IN (")
                .append(String.join(", ", Collections.nCopies(dates.size(), "?")))
                .append(") AND (")
                .append(String.join(" OR ", Collections.nCopies(prefixes.size(), "indicateur LIKE ?")))
                .append(")");

        List<CounterRow> rows = new ArrayList<>();
        try (PreparedStatement stmt = conn.prepareStatement(sql.toString())) {
            int idx = 1;
            for (LocalDateTime date : dates) {
                stmt.setTimestamp(idx++, Timestamp.valueOf(date));
            }
            for (String prefix : prefixes) {
                stmt.setString(idx++, prefix + "%");
            }
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    LocalDateTime date = rs.getTimestamp(1).toLocalDateTime();
                    String indicator = rs.getString(2);
                    double value = rs.getDouble(3);
                    rows.add(new CounterRow(date, indicator, rs.wasNull() ? null : value));
                }
            }
        }
        return rows;
    }
}

package com.asiainfo.kpietl.infrastructure.persistence;

import com.asiainfo.kpietl.domain.model.RawCounterRow;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;

/**
 * 源库访问：表清单、行数、按 date_heure 排序的分页读取
 * 不捕获 SQLException，由调用方决定重试或失败
 */
public class SourceTableRepository {

    private final Connection conn;

    public SourceTableRepository(Connection conn) {
        this.conn = conn;
    }

    public List<String> listTables() throws SQLException {
        List<String> tables = new ArrayList<>();
        DatabaseMetaData meta = conn.getMetaData();
        try (ResultSet rs = meta.getTables(conn.getCatalog(), conn.getSchema(), "%", new String[]{"TABLE"})) {
            while (rs.next()) {
                tables.add(rs.getString("TABLE_NAME"));
            }
        }
        return tables;
    }

    public long countRows(String table) throws SQLException {
        String sql = "SELECT COUNT(*) FROM " + SqlIdentifiers.quote(conn, table);
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery(sql)) {
            return rs.next() ? rs.getLong(1) : 0L;
        }
    }

    public List<RawCounterRow> fetchBatch(String table, long offset, int limit) throws SQLException {
        String sql = "SELECT date_heure, ID_indicateur, valeur FROM " + SqlIdentifiers.quote(conn, table)
                + " ORDER BY date_heure LIMIT ? OFFSET ?";

        List<RawCounterRow> rows = new ArrayList<>();
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setInt(1, limit);
            stmt.setLong(2, offset);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    Timestamp ts = rs.getTimestamp(1);
                    long id = rs.getLong(2);
                    Long indicatorId = rs.wasNull() ? null : id;
                    double value = rs.getDouble(3);
                    Double valeur = rs.wasNull() ? null : value;
                    rows.add(new RawCounterRow(ts != null ? ts.toLocalDateTime() : null, indicatorId, valeur));
                }
            }
        }
        return rows;
    }
}

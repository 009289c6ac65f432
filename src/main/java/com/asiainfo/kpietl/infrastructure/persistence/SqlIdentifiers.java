package com.asiainfo.kpietl.infrastructure.persistence;

import com.asiainfo.kpietl.shared.PipelineConstants;
import com.asiainfo.kpietl.shared.PipelineException;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * 表名/列名拼接工具
 * 源表名可能含 '-'，统一用数据库的标识符引号包起来；KPI 表名/列名来自目录，只允许安全字符
 */
final class SqlIdentifiers {

    private SqlIdentifiers() {
    }

    static String quote(Connection conn, String name) throws SQLException {
        String q = conn.getMetaData().getIdentifierQuoteString();
        if (q == null || q.isBlank()) {
            return requireSafe(name);
        }
        q = q.trim();
        if (name.contains(q)) {
            throw new PipelineException("Table name contains identifier quote: " + name);
        }
        return q + name + q;
    }

    static String requireSafe(String name) {
        if (name == null || !PipelineConstants.SAFE_IDENTIFIER.matcher(name).matches()) {
            throw new PipelineException("Unsafe SQL identifier: " + name);
        }
        return name;
    }

    static boolean tableExists(Connection conn, String name) throws SQLException {
        DatabaseMetaData meta = conn.getMetaData();
        try (ResultSet rs = meta.getTables(conn.getCatalog(), conn.getSchema(), name, new String[]{"TABLE"})) {
            while (rs.next()) {
                if (name.equalsIgnoreCase(rs.getString("TABLE_NAME"))) {
                    return true;
                }
            }
        }
        return false;
    }
}

package com.asiainfo.kpietl.support;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Proxy;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.util.Properties;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 测试用 H2 内存库（MySQL 模式）
 */
public final class H2Support {

    private H2Support() {
    }

    public static String url(String name) {
        return "jdbc:h2:mem:" + name + ";MODE=MySQL;DATABASE_TO_LOWER=TRUE;DB_CLOSE_DELAY=-1";
    }

    public static String uniqueName(String prefix) {
        return prefix + "_" + UUID.randomUUID().toString().replace("-", "");
    }

    /**
     * 直接通过 H2 驱动建连，不依赖 DriverManager 的驱动注册（QuarkusTest 之后类加载器会变化）
     */
    public static Connection open(String name) throws SQLException {
        Properties props = new Properties();
        props.setProperty("user", "sa");
        props.setProperty("password", "");
        return new org.h2.Driver().connect(url(name), props);
    }

    /**
     * 包装连接：前 skip 次 prepareStatement 正常，随后 failures 次抛 SQLException，之后恢复正常
     */
    public static Connection failingPrepares(Connection delegate, int skip, int failures) {
        AtomicInteger calls = new AtomicInteger();
        return (Connection) Proxy.newProxyInstance(
                H2Support.class.getClassLoader(),
                new Class<?>[]{Connection.class},
                (proxy, method, args) -> {
                    if ("prepareStatement".equals(method.getName())) {
                        int call = calls.getAndIncrement();
                        if (call >= skip && call < skip + failures) {
                            throw new SQLException("Simulated read failure #" + (call - skip + 1));
                        }
                    }
                    try {
                        return method.invoke(delegate, args);
                    } catch (InvocationTargetException e) {
                        throw e.getCause();
                    }
                });
    }

    /**
     * 删除并重建库中所有对象
     */
    public static void reset(String name) throws SQLException {
        try (Connection conn = open(name); Statement stmt = conn.createStatement()) {
            stmt.execute("DROP ALL OBJECTS");
        }
    }

    public static void createSourceTable(Connection conn, String table) throws SQLException {
        try (Statement stmt = conn.createStatement()) {
            stmt.execute("CREATE TABLE \"" + table + "\" (date_heure DATETIME, ID_indicateur BIGINT, valeur DOUBLE)");
        }
    }

    public static void insertSourceRow(Connection conn, String table, LocalDateTime time, Long id, Double value)
            throws SQLException {
        String sql = "INSERT INTO \"" + table + "\" (date_heure, ID_indicateur, valeur) VALUES (?, ?, ?)";
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setTimestamp(1, Timestamp.valueOf(time));
            stmt.setObject(2, id);
            stmt.setObject(3, value);
            stmt.executeUpdate();
        }
    }

    public static void createStagingTable(Connection conn, String table) throws SQLException {
        try (Statement stmt = conn.createStatement()) {
            stmt.execute("CREATE TABLE \"" + table + "\" (Date DATETIME, indicateur VARCHAR(255), valeur FLOAT)");
        }
    }

    public static void insertStagingRow(Connection conn, String table, LocalDateTime time, String indicator, Double value)
            throws SQLException {
        String sql = "INSERT INTO \"" + table + "\" (Date, indicateur, valeur) VALUES (?, ?, ?)";
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setTimestamp(1, Timestamp.valueOf(time));
            stmt.setString(2, indicator);
            stmt.setObject(3, value);
            stmt.executeUpdate();
        }
    }

    public static long count(Connection conn, String sql) throws SQLException {
        try (Statement stmt = conn.createStatement(); ResultSet rs = stmt.executeQuery(sql)) {
            rs.next();
            return rs.getLong(1);
        }
    }

    public static long countTable(Connection conn, String quotedTable) throws SQLException {
        return count(conn, "SELECT COUNT(*) FROM " + quotedTable);
    }
}

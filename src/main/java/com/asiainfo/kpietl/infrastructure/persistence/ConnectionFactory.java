package com.asiainfo.kpietl.infrastructure.persistence;

import com.asiainfo.kpietl.config.ConnectionSettings;
import com.asiainfo.kpietl.config.PipelineConfig;
import com.asiainfo.kpietl.shared.RetryExecutor;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;

/**
 * 独占（非连接池）JDBC 连接
 * 每个组件在构造时打开自己的连接、在 close 时释放；建立连接失败按指数回退重试
 */
@ApplicationScoped
public class ConnectionFactory {

    private static final Logger log = LoggerFactory.getLogger(ConnectionFactory.class);

    @Inject
    PipelineConfig config;

    public Connection open(String name) {
        ConnectionSettings settings = config.connection(name);
        RetryExecutor retry = RetryExecutor.exponential(
                config.getConnectionMaxAttempts(),
                config.getConnectionInitialDelayMs(),
                config.getConnectionMaxDelayMs());
        return retry.execute("connect to " + name, () -> {
            Connection conn = DriverManager.getConnection(settings.url(), settings.user(), settings.password());
            log.info("[DB] Connected to {} ({})", name, settings.url());
            return conn;
        });
    }

    public static void closeQuietly(Connection conn) {
        if (conn == null) {
            return;
        }
        try {
            conn.close();
        } catch (SQLException e) {
            log.warn("[DB] Failed to close connection: {}", e.getMessage());
        }
    }
}

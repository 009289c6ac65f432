package com.asiainfo.kpietl.config;

/**
 * 命名数据库连接参数（pipeline.db.&lt;name&gt;.*）
 */
public record ConnectionSettings(String name, String url, String user, String password) {

    @Override
    public String toString() {
        return "ConnectionSettings[name=" + name + ", url=" + url + ", user=" + user + ", password=***]";
    }
}

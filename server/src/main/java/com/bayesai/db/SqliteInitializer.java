package com.bayesai.db;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

public class SqliteInitializer {

    public static void initialize(String dbPath) throws SQLException {
        String url = "jdbc:sqlite:" + dbPath;
        try (Connection conn = DriverManager.getConnection(url)) {
            try (Statement stmt = conn.createStatement()) {
                stmt.execute("PRAGMA journal_mode = WAL;");

                // One row per answered query; network_version is the network fingerprint
                stmt.execute("CREATE TABLE IF NOT EXISTS query_result (" +
                        "id INTEGER PRIMARY KEY AUTOINCREMENT, " +
                        "network_id TEXT NOT NULL, " +
                        "network_version TEXT NOT NULL, " +
                        "query_key TEXT NOT NULL, " +
                        "result_name TEXT, " +
                        "variables_json TEXT NOT NULL, " +
                        "assignments_json TEXT NOT NULL, " +
                        "weights_blob BLOB NOT NULL, " +
                        "created_ts INTEGER NOT NULL, " +
                        "UNIQUE (network_id, network_version, query_key)" +
                        ");");

                stmt.execute("CREATE INDEX IF NOT EXISTS idx_query_lookup " +
                        "ON query_result (network_id, network_version, query_key);");
            }
        }
    }
}

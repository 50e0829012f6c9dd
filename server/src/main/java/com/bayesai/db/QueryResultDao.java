package com.bayesai.db;

import com.bayesai.server.bn.factor.Factor;
import com.bayesai.util.DoubleArrayCodec;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.sql.*;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Stores posterior tables. Assignment values go through JSON, so only
 * booleans, strings, integers and doubles round-trip with their type intact.
 */
public class QueryResultDao {

    private static final TypeReference<List<String>> VARIABLES = new TypeReference<>() {
    };
    private static final TypeReference<List<List<Object>>> ASSIGNMENTS = new TypeReference<>() {
    };

    private final String dbPath;
    private final ObjectMapper mapper = new ObjectMapper();

    public QueryResultDao(String dbPath) {
        this.dbPath = dbPath;
    }

    private Connection connect() throws SQLException {
        return DriverManager.getConnection("jdbc:sqlite:" + dbPath);
    }

    public Optional<Factor> loadResult(String networkId, String networkVersion, String queryKey) throws SQLException {
        String sql = "SELECT result_name, variables_json, assignments_json, weights_blob FROM query_result " +
                "WHERE network_id = ? AND network_version = ? AND query_key = ?";
        try (Connection conn = connect();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, networkId);
            ps.setString(2, networkVersion);
            ps.setString(3, queryKey);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(decode(rs.getString("result_name"), rs.getString("variables_json"),
                            rs.getString("assignments_json"), rs.getBytes("weights_blob")));
                }
            }
        }
        return Optional.empty();
    }

    public void upsertResult(String networkId, String networkVersion, String queryKey, Factor result)
            throws SQLException {
        List<List<Object>> assignments = new ArrayList<>(result.getRows().keySet());
        double[] weights = new double[assignments.size()];
        for (int i = 0; i < weights.length; i++) {
            weights[i] = result.getRows().get(assignments.get(i));
        }

        String variablesJson;
        String assignmentsJson;
        try {
            variablesJson = mapper.writeValueAsString(result.getScope());
            assignmentsJson = mapper.writeValueAsString(assignments);
        } catch (JsonProcessingException e) {
            throw new SQLException("Cannot encode result " + result.getName(), e);
        }

        long now = System.currentTimeMillis();
        String sql = "INSERT INTO query_result (network_id, network_version, query_key, result_name, " +
                "variables_json, assignments_json, weights_blob, created_ts) " +
                "VALUES (?, ?, ?, ?, ?, ?, ?, ?) " +
                "ON CONFLICT(network_id, network_version, query_key) DO UPDATE SET " +
                "result_name = excluded.result_name, variables_json = excluded.variables_json, " +
                "assignments_json = excluded.assignments_json, weights_blob = excluded.weights_blob, " +
                "created_ts = excluded.created_ts";

        try (Connection conn = connect();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, networkId);
            ps.setString(2, networkVersion);
            ps.setString(3, queryKey);
            ps.setString(4, result.getName());
            ps.setString(5, variablesJson);
            ps.setString(6, assignmentsJson);
            ps.setBytes(7, DoubleArrayCodec.toBytes(weights));
            ps.setLong(8, now);
            ps.executeUpdate();
        }
    }

    public int deleteByNetwork(String networkId) throws SQLException {
        String sql = "DELETE FROM query_result WHERE network_id = ?";
        try (Connection conn = connect();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, networkId);
            return ps.executeUpdate();
        }
    }

    public int countByNetwork(String networkId) throws SQLException {
        String sql = "SELECT COUNT(*) FROM query_result WHERE network_id = ?";
        try (Connection conn = connect();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, networkId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        }
    }

    private Factor decode(String name, String variablesJson, String assignmentsJson, byte[] blob)
            throws SQLException {
        try {
            List<String> variables = mapper.readValue(variablesJson, VARIABLES);
            List<List<Object>> assignments = mapper.readValue(assignmentsJson, ASSIGNMENTS);
            double[] weights = DoubleArrayCodec.fromBytes(blob, assignments.size());
            Map<List<Object>, Double> rows = new LinkedHashMap<>();
            for (int i = 0; i < weights.length; i++) {
                rows.put(assignments.get(i), weights[i]);
            }
            return new Factor(name, variables, rows);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new SQLException("Corrupt cached result " + name, e);
        }
    }
}

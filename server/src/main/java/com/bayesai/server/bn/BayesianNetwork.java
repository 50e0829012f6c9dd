package com.bayesai.server.bn;

import com.bayesai.server.bn.cpt.CptStore;
import com.bayesai.server.bn.factor.Factor;
import com.bayesai.server.bn.graph.NetworkStructure;
import com.bayesai.server.bn.inference.InferenceEngine;
import com.bayesai.server.bn.inference.VariableEliminationEngine;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * A prepared Bayesian network answering posterior queries.
 *
 * <p>
 * Results are deterministic: variables appear in name order, rows in ascending
 * assignment order, and the table is named after the query, for example
 * {@code P(Burglary | JohnCalls=true, MaryCalls=true)}.
 */
public class BayesianNetwork {

    private final String id;
    private final CptStore cpts;
    private final InferenceEngine engine;
    private volatile String fingerprint;

    public BayesianNetwork(String id, CptStore cpts, InferenceEngine engine) {
        this.id = id;
        this.cpts = cpts.prepare();
        this.engine = engine;
    }

    public BayesianNetwork(String id, CptStore cpts) {
        this(id, cpts, new VariableEliminationEngine(cpts.prepare()));
    }

    public String getId() {
        return id;
    }

    public NetworkStructure getStructure() {
        return cpts.getStructure();
    }

    public CptStore getCpts() {
        return cpts;
    }

    public InferenceEngine getEngine() {
        return engine;
    }

    public Factor query(Map<String, ?> evidence, String... queryVars) {
        return query(Arrays.asList(queryVars), evidence);
    }

    public Factor query(Collection<String> queryVars, Map<String, ?> evidence) {
        if (queryVars == null || queryVars.isEmpty()) {
            throw new EmptyQueryException();
        }
        Map<String, ?> given = evidence != null ? evidence : Map.of();
        Set<String> query = new TreeSet<>(queryVars);
        Set<String> conflicting = new TreeSet<>(query);
        conflicting.retainAll(given.keySet());
        if (!conflicting.isEmpty()) {
            throw new VariableConflictException(conflicting);
        }

        Factor answer = engine.eliminate(query, given);
        return answer.reorder(new ArrayList<>(query))
                .sorted()
                .named(describe(query, given));
    }

    static String describe(Set<String> query, Map<String, ?> evidence) {
        StringBuilder sb = new StringBuilder("P(").append(String.join(", ", query));
        if (!evidence.isEmpty()) {
            List<String> given = new ArrayList<>();
            for (Map.Entry<String, ?> e : new TreeMap<>(evidence).entrySet()) {
                given.add(e.getKey() + "=" + e.getValue());
            }
            sb.append(" | ").append(String.join(", ", given));
        }
        return sb.append(')').toString();
    }

    /**
     * SHA-256 over the structure and the canonical tables. Two networks with the
     * same fingerprint answer every query identically.
     */
    public String fingerprint() {
        String cached = fingerprint;
        if (cached != null) {
            return cached;
        }
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            NetworkStructure structure = cpts.getStructure();
            for (String node : structure.nodes()) {
                digest.update((node + "<-" + structure.parents(node) + ";").getBytes(StandardCharsets.UTF_8));
                if (cpts.contains(node)) {
                    for (Map.Entry<List<Object>, Double> row : cpts.table(node).getRows().entrySet()) {
                        StringBuilder line = new StringBuilder();
                        for (Object value : row.getKey()) {
                            line.append(value.getClass().getSimpleName()).append(':').append(value).append(',');
                        }
                        line.append('=').append(Double.doubleToLongBits(row.getValue())).append(';');
                        digest.update(line.toString().getBytes(StandardCharsets.UTF_8));
                    }
                }
            }
            StringBuilder hex = new StringBuilder();
            for (byte b : digest.digest()) {
                String h = Integer.toHexString(0xff & b);
                if (h.length() == 1) {
                    hex.append('0');
                }
                hex.append(h);
            }
            fingerprint = hex.toString();
            return fingerprint;
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    @Override
    public String toString() {
        return "BayesianNetwork{id='" + id + "', nodes=" + cpts.getStructure().nodes() + '}';
    }
}

package com.bayesai.server.bn;

import com.bayesai.db.QueryResultDao;
import com.bayesai.server.bn.cpt.CptStore;
import com.bayesai.server.bn.factor.Factor;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Answers queries through a persistent result cache. Entries are keyed by the
 * network fingerprint, so a changed network never reads stale answers.
 * Cached assignments are stored as JSON, so a network whose domain values are
 * not all of a type JSON reads back unchanged is always computed directly.
 */
public class CachedQueryEvaluator {

    private static final Logger logger = LoggerFactory.getLogger(CachedQueryEvaluator.class);
    private static final ObjectMapper mapper = new ObjectMapper();

    private static final Set<Class<?>> STORABLE_TYPES = Set.of(Boolean.class, String.class, Integer.class,
            Double.class);

    private final BayesianNetwork network;
    private final QueryResultDao resultDao;
    private final boolean storable;

    public CachedQueryEvaluator(BayesianNetwork network, QueryResultDao resultDao) {
        this.network = network;
        this.resultDao = resultDao;
        this.storable = hasStorableValues(network);
        if (!storable) {
            logger.warn("Network {} has domain values that cannot be cached, queries will always be computed",
                    network.getId());
        }
    }

    public Factor query(Collection<String> queryVars, Map<String, ?> evidence) {
        if (queryVars == null || queryVars.isEmpty()) {
            throw new EmptyQueryException();
        }
        if (!storable) {
            return network.query(queryVars, evidence);
        }
        String id = network.getId();
        String version = network.fingerprint();
        String key = queryKey(queryVars, evidence);
        try {
            Optional<Factor> cached = resultDao.loadResult(id, version, key);
            if (cached.isPresent()) {
                logger.debug("Cache HIT for network {} query {}", id, key);
                return cached.get();
            }

            logger.debug("Cache MISS for network {} query {}", id, key);
            Factor result = network.query(queryVars, evidence);
            resultDao.upsertResult(id, version, key, result);
            return result;

        } catch (SQLException e) {
            logger.error("Database error in CachedQueryEvaluator, falling back to direct computation", e);
            return network.query(queryVars, evidence);
        }
    }

    public BayesianNetwork getNetwork() {
        return network;
    }

    public boolean isStorable() {
        return storable;
    }

    static boolean hasStorableValues(BayesianNetwork network) {
        CptStore cpts = network.getCpts();
        for (String node : cpts.nodes()) {
            if (!cpts.contains(node)) {
                continue;
            }
            for (List<Object> key : cpts.table(node).getRows().keySet()) {
                for (Object value : key) {
                    if (!STORABLE_TYPES.contains(value.getClass())) {
                        return false;
                    }
                }
            }
        }
        return true;
    }

    /**
     * Canonical JSON form of a query: the sorted variables, then one
     * {@code [name, type, value]} triple per evidence entry in name order.
     */
    public static String queryKey(Collection<String> queryVars, Map<String, ?> evidence) {
        List<List<String>> given = new ArrayList<>();
        if (evidence != null) {
            for (Map.Entry<String, ?> e : new TreeMap<>(evidence).entrySet()) {
                Object value = e.getValue();
                given.add(List.of(e.getKey(), value == null ? "null" : value.getClass().getName(),
                        String.valueOf(value)));
            }
        }
        try {
            return mapper.writeValueAsString(List.of(new ArrayList<>(new TreeSet<>(queryVars)), given));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot encode query key for " + queryVars, e);
        }
    }
}

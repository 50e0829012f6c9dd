package com.bayesai.server.service;

import com.bayesai.db.QueryResultDao;
import com.bayesai.db.SqliteInitializer;
import com.bayesai.server.bn.BayesianNetwork;
import com.bayesai.server.bn.CachedQueryEvaluator;
import com.bayesai.server.bn.config.NetworkDefinitionLoader;
import com.bayesai.server.bn.factor.Factor;
import com.bayesai.server.util.ConfigPathResolver;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.sql.SQLException;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

@Service
public class InferenceService {

    private static final Logger logger = LoggerFactory.getLogger(InferenceService.class);

    private final NetworkDefinitionLoader loader = new NetworkDefinitionLoader();
    private final Map<String, BayesianNetwork> networks = new TreeMap<>();
    private final Map<String, CachedQueryEvaluator> cachedEvaluators = new TreeMap<>();
    private QueryResultDao resultDao;
    private volatile boolean isReady = false;

    public boolean isReady() {
        return isReady;
    }

    @PostConstruct
    public void init() {
        try (InputStream is = ConfigPathResolver.openConfig()) {
            if (is == null) {
                logger.warn("No inference config found, starting without networks");
                isReady = true;
                return;
            }
            init(loader.loadConfig(is));
        } catch (IOException e) {
            throw new RuntimeException("Failed to read inference config", e);
        }
    }

    public synchronized void init(NetworkDefinitionLoader.ConfigRoot config) {
        logger.info("Initializing inference service (eliminationOrder={})...", config.eliminationOrder);

        if (config.cache != null && Boolean.TRUE.equals(config.cache.enabled)) {
            String dbPath = ConfigPathResolver.resolveDbPath(config.cache.dataDirectory);
            try {
                SqliteInitializer.initialize(dbPath);
                resultDao = new QueryResultDao(dbPath);
                logger.info("Initialized SQLite query cache at {}", dbPath);
            } catch (SQLException e) {
                logger.error("Failed to initialize SQLite query cache, continuing without it", e);
                resultDao = null;
            }
        }

        if (config.networks != null) {
            for (NetworkDefinitionLoader.NetworkRef ref : config.networks) {
                try (InputStream is = ConfigPathResolver.openResource(ref.resource)) {
                    NetworkDefinitionLoader.NetworkDefinition def = loader.loadDefinition(is);
                    if (ref.id != null) {
                        def.id = ref.id;
                    }
                    register(loader.build(def, config.eliminationOrder));
                } catch (IOException e) {
                    throw new RuntimeException("Failed to load network '" + ref.id + "' from " + ref.resource, e);
                }
            }
        }

        isReady = true;
        logger.info("Inference service ready with networks {}", networks.keySet());
    }

    public synchronized void register(BayesianNetwork network) {
        networks.put(network.getId(), network);
        if (resultDao != null) {
            cachedEvaluators.put(network.getId(), new CachedQueryEvaluator(network, resultDao));
        }
    }

    public synchronized Set<String> getNetworkIds() {
        return Set.copyOf(networks.keySet());
    }

    public synchronized Optional<BayesianNetwork> getNetwork(String id) {
        return Optional.ofNullable(networks.get(id));
    }

    /** Posterior for the query, or empty when no network has that id. */
    public Optional<Factor> query(String networkId, Collection<String> variables, Map<String, ?> evidence) {
        CachedQueryEvaluator cached;
        BayesianNetwork network;
        synchronized (this) {
            cached = cachedEvaluators.get(networkId);
            network = networks.get(networkId);
        }
        if (network == null) {
            return Optional.empty();
        }
        if (cached != null) {
            return Optional.of(cached.query(variables, evidence));
        }
        return Optional.of(network.query(variables, evidence));
    }

    /** Drops every cached result for the network; returns the number of rows removed. */
    public int clearCache(String networkId) {
        if (resultDao == null) {
            return 0;
        }
        try {
            int removed = resultDao.deleteByNetwork(networkId);
            logger.info("Cleared {} cached results for network {}", removed, networkId);
            return removed;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to clear query cache for " + networkId, e);
        }
    }

    public boolean isCacheEnabled() {
        return resultDao != null;
    }
}

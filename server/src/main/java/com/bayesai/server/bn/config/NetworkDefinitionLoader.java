package com.bayesai.server.bn.config;

import com.bayesai.server.bn.BayesianNetwork;
import com.bayesai.server.bn.cpt.CptStore;
import com.bayesai.server.bn.factor.Factor;
import com.bayesai.server.bn.graph.NetworkBuilder;
import com.bayesai.server.bn.graph.NetworkStructure;
import com.bayesai.server.bn.graph.StructureItem;
import com.bayesai.server.bn.inference.InferenceEngineFactory;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the service configuration and JSON network definitions.
 */
public class NetworkDefinitionLoader {

    private static final Logger logger = LoggerFactory.getLogger(NetworkDefinitionLoader.class);

    private final ObjectMapper mapper = new ObjectMapper();

    public static class CacheConfig {
        public Boolean enabled;
        public String dataDirectory;
    }

    public static class NetworkRef {
        public String id;
        public String resource;
    }

    public static class ConfigRoot {
        public String eliminationOrder = "lexical";
        public CacheConfig cache;
        public List<NetworkRef> networks;
    }

    public static class RowDefinition {
        public List<Object> key;
        public Double p;
    }

    public static class TableDefinition {
        // Absent for positional tables.
        public List<String> labels;
        public List<RowDefinition> rows;
    }

    public static class NetworkDefinition {
        public String id;
        // Each entry is a node name or an object {"parents": ..., "children": ...}.
        public List<JsonNode> structure;
        public Map<String, TableDefinition> cpts;
    }

    public ConfigRoot loadConfig(InputStream jsonStream) {
        try {
            return mapper.readValue(jsonStream, ConfigRoot.class);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read inference config from JSON", e);
        }
    }

    public NetworkDefinition loadDefinition(InputStream jsonStream) {
        try {
            return mapper.readValue(jsonStream, NetworkDefinition.class);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read network definition from JSON", e);
        }
    }

    public BayesianNetwork load(InputStream jsonStream, String eliminationOrder) {
        return build(loadDefinition(jsonStream), eliminationOrder);
    }

    public BayesianNetwork build(NetworkDefinition def, String eliminationOrder) {
        if (def.structure == null || def.structure.isEmpty()) {
            throw new IllegalArgumentException("Network '" + def.id + "' has no structure");
        }

        NetworkBuilder builder = new NetworkBuilder();
        for (JsonNode item : def.structure) {
            builder.add(parseItem(item));
        }
        NetworkStructure structure = builder.build();

        CptStore cpts = new CptStore(structure);
        if (def.cpts != null) {
            for (Map.Entry<String, TableDefinition> e : def.cpts.entrySet()) {
                defineTable(cpts, e.getKey(), e.getValue());
            }
        }
        cpts.prepare();

        BayesianNetwork network = new BayesianNetwork(def.id, cpts,
                InferenceEngineFactory.create(cpts, eliminationOrder));
        logger.info("Loaded network '{}' with {} nodes", def.id, structure.nodes().size());
        return network;
    }

    private static void defineTable(CptStore cpts, String node, TableDefinition table) {
        Map<List<Object>, Double> rows = new LinkedHashMap<>();
        if (table.rows != null) {
            for (RowDefinition row : table.rows) {
                if (row.key == null || row.p == null) {
                    throw new IllegalArgumentException("Table for '" + node + "' has a row without key or p");
                }
                if (rows.put(row.key, row.p) != null) {
                    throw new IllegalArgumentException("Table for '" + node + "' repeats row " + row.key);
                }
            }
        }
        if (table.labels == null) {
            cpts.define(node, rows);
        } else {
            cpts.define(node, new Factor(null, table.labels, rows));
        }
    }

    static StructureItem parseItem(JsonNode item) {
        if (item.isTextual()) {
            return StructureItem.node(item.asText());
        }
        if (item.isObject() && item.has("parents") && item.has("children")) {
            return StructureItem.edges(names(item.get("parents")), names(item.get("children")));
        }
        throw new IllegalArgumentException("Unrecognized structure item: " + item);
    }

    private static List<String> names(JsonNode side) {
        List<String> names = new ArrayList<>();
        if (side.isArray()) {
            for (JsonNode n : side) {
                names.add(n.asText());
            }
        } else {
            names.add(side.asText());
        }
        return names;
    }
}

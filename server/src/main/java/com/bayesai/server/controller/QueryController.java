package com.bayesai.server.controller;

import com.bayesai.server.bn.BayesNetException;
import com.bayesai.server.bn.factor.Factor;
import com.bayesai.server.service.InferenceService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;

@RestController
public class QueryController {

    private static final Logger logger = LoggerFactory.getLogger(QueryController.class);
    private final InferenceService inferenceService;

    public QueryController(InferenceService inferenceService) {
        this.inferenceService = inferenceService;
    }

    public static class QueryRequest {
        public List<String> variables;
        public Map<String, Object> evidence;
    }

    public static class RowView {
        public List<Object> assignment;
        public double probability;

        public RowView(List<Object> assignment, double probability) {
            this.assignment = assignment;
            this.probability = probability;
        }
    }

    public static class QueryResponse {
        public String name;
        public List<String> variables;
        public List<RowView> rows;

        public static QueryResponse of(Factor factor) {
            QueryResponse response = new QueryResponse();
            response.name = factor.getName();
            response.variables = factor.getScope();
            response.rows = new ArrayList<>();
            for (Map.Entry<List<Object>, Double> row : factor.getRows().entrySet()) {
                response.rows.add(new RowView(row.getKey(), row.getValue()));
            }
            return response;
        }
    }

    @GetMapping("/networks")
    public ResponseEntity<?> networks() {
        return ResponseEntity.ok(new TreeSet<>(inferenceService.getNetworkIds()));
    }

    @PostMapping("/networks/{id}/query")
    public ResponseEntity<?> query(@PathVariable("id") String id, @RequestBody QueryRequest request) {
        if (!inferenceService.isReady()) {
            return ResponseEntity.status(503).body("Networks are still loading, please try again later.");
        }
        if (request == null || request.variables == null || request.variables.isEmpty()) {
            return ResponseEntity.badRequest().body("At least one query variable has to be specified");
        }
        for (String variable : request.variables) {
            if (variable == null || variable.isBlank()) {
                return ResponseEntity.badRequest().body("Query variable names must not be blank");
            }
        }
        if (request.evidence != null) {
            for (String variable : request.evidence.keySet()) {
                if (variable == null || variable.isBlank()) {
                    return ResponseEntity.badRequest().body("Evidence variable names must not be blank");
                }
            }
        }

        logger.info("Received query on network {}: {} given {}", id, request.variables,
                request.evidence != null ? request.evidence.keySet() : "{}");

        try {
            Optional<Factor> result = inferenceService.query(id, request.variables,
                    request.evidence != null ? request.evidence : Map.of());
            if (result.isEmpty()) {
                return ResponseEntity.status(404).body("Unknown network: " + id);
            }
            return ResponseEntity.ok(QueryResponse.of(result.get()));
        } catch (BayesNetException e) {
            logger.info("Rejected query on network {}: {}", id, e.getMessage());
            return ResponseEntity.badRequest().body(e.getMessage());
        }
    }

    @DeleteMapping("/networks/{id}/cache")
    public ResponseEntity<?> clearCache(@PathVariable("id") String id) {
        if (inferenceService.getNetwork(id).isEmpty()) {
            return ResponseEntity.status(404).body("Unknown network: " + id);
        }
        return ResponseEntity.ok(Map.of("removed", inferenceService.clearCache(id)));
    }
}

package com.bayesai.server.controller;

import com.bayesai.server.service.InferenceService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.ResponseEntity;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class QueryControllerTest {

    private InferenceService service;
    private QueryController controller;

    @BeforeEach
    public void setup() {
        service = new InferenceService();
        service.init();
        controller = new QueryController(service);
    }

    private static QueryController.QueryRequest request(List<String> variables, Map<String, Object> evidence) {
        QueryController.QueryRequest request = new QueryController.QueryRequest();
        request.variables = variables;
        request.evidence = evidence;
        return request;
    }

    @Test
    public void testListNetworks() {
        ResponseEntity<?> response = controller.networks();
        assertEquals(200, response.getStatusCode().value());
        assertEquals(Set.of("alarm", "sprinkler"), response.getBody());
    }

    @Test
    public void testQuery() {
        ResponseEntity<?> response = controller.query("alarm",
                request(List.of("Burglary"), Map.of("JohnCalls", true, "MaryCalls", true)));

        assertEquals(200, response.getStatusCode().value());
        QueryController.QueryResponse body = (QueryController.QueryResponse) response.getBody();
        assertEquals("P(Burglary | JohnCalls=true, MaryCalls=true)", body.name);
        assertEquals(List.of("Burglary"), body.variables);
        assertEquals(2, body.rows.size());
        assertEquals(List.of(false), body.rows.get(0).assignment);
        assertEquals(0.7158, body.rows.get(0).probability, 1e-4);
        assertEquals(0.2842, body.rows.get(1).probability, 1e-4);
    }

    @Test
    public void testMissingEvidenceIsTreatedAsEmpty() {
        ResponseEntity<?> response = controller.query("sprinkler", request(List.of("Season"), null));
        assertEquals(200, response.getStatusCode().value());
    }

    @Test
    public void testBadRequests() {
        assertEquals(400, controller.query("alarm", request(List.of(), Map.of())).getStatusCode().value());
        assertEquals(400, controller.query("alarm", request(List.of("Alarm"), Map.of("Alarm", true)))
                .getStatusCode().value());
        assertEquals(400, controller.query("alarm", request(List.of("Burglary"), Map.of("Storm", true)))
                .getStatusCode().value());
        assertEquals(400, controller.query("alarm", request(List.of("Burglary"), Map.of("Alarm", "maybe")))
                .getStatusCode().value());
    }

    @Test
    public void testBlankVariableNamesAreRejected() {
        assertEquals(400, controller.query("alarm", request(Arrays.asList("Burglary", null), Map.of()))
                .getStatusCode().value());
        assertEquals(400, controller.query("alarm", request(List.of(" "), Map.of())).getStatusCode().value());

        Map<String, Object> evidence = new HashMap<>();
        evidence.put(null, true);
        assertEquals(400, controller.query("alarm", request(List.of("Burglary"), evidence))
                .getStatusCode().value());
    }

    @Test
    public void testUnknownNetwork() {
        assertEquals(404, controller.query("nope", request(List.of("A"), Map.of())).getStatusCode().value());
        assertEquals(404, controller.clearCache("nope").getStatusCode().value());
    }

    @Test
    public void testNotReady() {
        QueryController cold = new QueryController(new InferenceService());
        assertEquals(503, cold.query("alarm", request(List.of("Burglary"), Map.of())).getStatusCode().value());
    }

    @Test
    public void testClearCacheWithoutCache() {
        ResponseEntity<?> response = controller.clearCache("alarm");
        assertEquals(200, response.getStatusCode().value());
        assertEquals(Map.of("removed", 0), response.getBody());
    }
}

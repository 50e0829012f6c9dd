package com.bayesai.server.bn.inference;

import com.bayesai.server.bn.AlarmNetworks;
import com.bayesai.server.bn.cpt.CptStore;
import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

public class InferenceEngineFactoryTest {

    @Test
    public void testOrderSelection() {
        // 1. Default (null arg)
        assertTrue(InferenceEngineFactory.order(null) instanceof LexicalEliminationOrder, "Should default to lexical");
        assertTrue(InferenceEngineFactory.order("  ") instanceof LexicalEliminationOrder);

        // 2. Explicit names, case-insensitive
        assertTrue(InferenceEngineFactory.order("lexical") instanceof LexicalEliminationOrder);
        assertTrue(InferenceEngineFactory.order("MIN_DEGREE") instanceof MinDegreeEliminationOrder);
        assertTrue(InferenceEngineFactory.order("min-degree") instanceof MinDegreeEliminationOrder);

        // 3. Invalid -> Default
        assertTrue(InferenceEngineFactory.order("min_fill") instanceof LexicalEliminationOrder,
                "Unknown order should fall back to lexical");
    }

    @Test
    public void testCreateWiresTheOrder() {
        CptStore cpts = AlarmNetworks.alarmTables(AlarmNetworks.alarmStructure().build()).prepare();

        InferenceEngine engine = InferenceEngineFactory.create(cpts, "min_degree");
        assertTrue(engine instanceof VariableEliminationEngine);
        assertEquals(MinDegreeEliminationOrder.NAME, ((VariableEliminationEngine) engine).getOrder().getName());
    }
}

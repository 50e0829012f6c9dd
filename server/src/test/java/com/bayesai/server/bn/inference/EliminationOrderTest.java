package com.bayesai.server.bn.inference;

import com.bayesai.server.bn.AlarmNetworks;
import com.bayesai.server.bn.cpt.CptStore;
import com.bayesai.server.bn.factor.Factor;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class EliminationOrderTest {

    private static List<Factor> alarmFactors() {
        CptStore cpts = AlarmNetworks.alarmTables(AlarmNetworks.alarmStructure().build()).prepare();
        List<Factor> factors = new ArrayList<>();
        for (String node : cpts.getStructure().nodes()) {
            factors.add(cpts.table(node));
        }
        return factors;
    }

    @Test
    public void testLexicalPicksSmallestName() {
        assertEquals("Alarm", new LexicalEliminationOrder().next(Set.of("Earthquake", "Alarm"), alarmFactors()));
    }

    @Test
    public void testMinDegreePicksLeastConnected() {
        List<Factor> factors = alarmFactors();

        // Alarm touches Burglary, Earthquake, JohnCalls, MaryCalls; Earthquake only Burglary and Alarm
        assertEquals(4, MinDegreeEliminationOrder.degree("Alarm", factors));
        assertEquals(2, MinDegreeEliminationOrder.degree("Earthquake", factors));
        assertEquals("Earthquake", new MinDegreeEliminationOrder().next(Set.of("Earthquake", "Alarm"), factors));
    }

    @Test
    public void testMinDegreeBreaksTiesByName() {
        // JohnCalls and MaryCalls both touch only Alarm
        assertEquals("JohnCalls",
                new MinDegreeEliminationOrder().next(Set.of("MaryCalls", "JohnCalls"), alarmFactors()));
    }
}

package com.bayesai.server.bn.factor;

import com.bayesai.server.bn.DegenerateNormalizationException;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.bayesai.server.bn.AlarmNetworks.evidence;
import static com.bayesai.server.bn.AlarmNetworks.rows;
import static org.junit.jupiter.api.Assertions.*;

public class FactorTest {

    private static final double EPS = 1e-12;

    // f(X, Y)
    private static Factor xy() {
        return new Factor("f", List.of("X", "Y"), rows(
                List.of("x0", "y0"), 0.1,
                List.of("x0", "y1"), 0.2,
                List.of("x1", "y0"), 0.3,
                List.of("x1", "y1"), 0.4));
    }

    // g(Y, Z)
    private static Factor yz() {
        return new Factor("g", List.of("Y", "Z"), rows(
                List.of("y0", 0), 0.5,
                List.of("y0", 1), 0.5,
                List.of("y1", 0), 0.9,
                List.of("y1", 1), 0.1));
    }

    // h(Z)
    private static Factor z() {
        return new Factor("h", List.of("Z"), rows(List.of(0), 0.25, List.of(1), 0.75));
    }

    @Test
    public void testRestrictKeepsVariableInScope() {
        Factor restricted = xy().restrict(evidence("Y", "y1", "Unrelated", 42));

        assertEquals(List.of("X", "Y"), restricted.getScope());
        assertEquals(2, restricted.size());
        assertEquals(0.2, restricted.get("x0", "y1"), EPS);
        assertEquals(0.0, restricted.get("x0", "y0"), EPS);
    }

    @Test
    public void testRestrictWithoutMatchingEvidenceIsIdentity() {
        Factor f = xy();
        assertSame(f, f.restrict(Map.of("W", true)));
    }

    @Test
    public void testRestrictToUnknownValueEmptiesTable() {
        Factor restricted = xy().restrict(evidence("X", "x9"));
        assertEquals(0, restricted.size());
        assertEquals(0.0, restricted.total(), 0.0);
    }

    @Test
    public void testJoinOnSharedVariable() {
        Factor joined = xy().join(yz());

        assertEquals(List.of("X", "Y", "Z"), joined.getScope());
        assertEquals(8, joined.size());
        assertEquals(0.1 * 0.5, joined.get("x0", "y0", 0), EPS);
        assertEquals(0.4 * 0.1, joined.get("x1", "y1", 1), EPS);
        assertEquals(0.3 * 0.5, joined.get("x1", "y0", 1), EPS);
    }

    @Test
    public void testJoinWithoutSharedVariablesIsCartesian() {
        Factor joined = xy().join(z());

        assertEquals(List.of("X", "Y", "Z"), joined.getScope());
        assertEquals(xy().size() * z().size(), joined.size());
        assertEquals(0.4 * 0.75, joined.get("x1", "y1", 1), EPS);
    }

    @Test
    public void testJoinDropsUnmatchedRows() {
        Factor onlyY0 = yz().restrict(evidence("Y", "y0"));
        Factor joined = xy().join(onlyY0);

        assertEquals(4, joined.size());
        assertEquals(0.0, joined.get("x0", "y1", 0), 0.0);
    }

    @Test
    public void testJoinIsCommutative() {
        Factor ab = xy().join(yz());
        Factor ba = yz().join(xy());

        assertEquals(List.of("Y", "Z", "X"), ba.getScope());
        assertTrue(ab.contentEquals(ba, EPS));
    }

    @Test
    public void testJoinIsAssociative() {
        Factor left = xy().join(yz()).join(z());
        Factor right = xy().join(yz().join(z()));

        assertTrue(left.contentEquals(right, EPS));
        assertTrue(left.contentEquals(Factor.joinAll(List.of(z(), yz(), xy())), EPS));
    }

    @Test
    public void testMarginalize() {
        Factor summed = xy().marginalize("X");

        assertEquals(List.of("Y"), summed.getScope());
        assertEquals(0.1 + 0.3, summed.get("y0"), EPS);
        assertEquals(0.2 + 0.4, summed.get("y1"), EPS);
    }

    @Test
    public void testMarginalizeEverythingLeavesTheTotal() {
        Factor scalar = xy().marginalize("X").marginalize("Y");

        assertTrue(scalar.getScope().isEmpty());
        assertEquals(1.0, scalar.get(), EPS);
    }

    @Test
    public void testMarginalizeUnknownVariableFails() {
        assertThrows(IllegalArgumentException.class, () -> xy().marginalize("Z"));
    }

    @Test
    public void testNormalize() {
        Factor normalized = yz().normalize();

        assertEquals(1.0, normalized.total(), EPS);
        assertEquals(0.5 / 2.0, normalized.get("y0", 0), EPS);
        // the input is untouched
        assertEquals(0.5, yz().get("y0", 0), 0.0);
    }

    @Test
    public void testNormalizeZeroTotalFails() {
        Factor empty = xy().restrict(evidence("X", "nope"));
        assertThrows(DegenerateNormalizationException.class, empty::normalize);
    }

    @Test
    public void testReorderAndSort() {
        Map<List<Object>, Double> shuffled = new LinkedHashMap<>();
        shuffled.put(List.of("y1", "x1"), 0.4);
        shuffled.put(List.of("y0", "x0"), 0.1);
        shuffled.put(List.of("y1", "x0"), 0.2);
        shuffled.put(List.of("y0", "x1"), 0.3);
        Factor yx = new Factor("f", List.of("Y", "X"), shuffled);

        Factor canonical = yx.reorder(List.of("X", "Y")).sorted();

        assertEquals(List.of("X", "Y"), canonical.getScope());
        assertEquals(List.of(List.of("x0", "y0"), List.of("x0", "y1"), List.of("x1", "y0"), List.of("x1", "y1")),
                List.copyOf(canonical.getRows().keySet()));
        assertEquals(xy(), canonical);
    }

    @Test
    public void testReorderRejectsDifferentVariables() {
        assertThrows(IllegalArgumentException.class, () -> xy().reorder(List.of("X", "Z")));
    }

    @Test
    public void testProbabilityByName() {
        assertEquals(0.3, xy().probability(Map.of("Y", "y0", "X", "x1", "Extra", 1)), EPS);
        assertThrows(IllegalArgumentException.class, () -> xy().probability(Map.of("X", "x1")));
    }

    @Test
    public void testInvalidTablesAreRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new Factor("dup", List.of("A", "A"), rows(List.of(1, 1), 1.0)));
        assertThrows(IllegalArgumentException.class,
                () -> new Factor("arity", List.of("A", "B"), rows(List.of(1), 1.0)));
        assertThrows(IllegalArgumentException.class,
                () -> new Factor("negative", List.of("A"), rows(List.of(1), -0.5)));
        assertThrows(IllegalArgumentException.class,
                () -> new Factor("nan", List.of("A"), rows(List.of(1), Double.NaN)));
    }

    @Test
    public void testOperationsDoNotMutateInputs() {
        Factor f = xy();
        Factor copy = xy();
        f.restrict(evidence("X", "x0"));
        f.join(yz());
        f.marginalize("Y");
        f.normalize();
        f.reorder(List.of("Y", "X"));

        assertEquals(copy, f);
        assertThrows(UnsupportedOperationException.class, () -> f.getRows().clear());
    }
}

package com.bayesai.server.bn.factor;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class ValueOrderingTest {

    @Test
    void testNaturalOrderWithinAType() {
        assertTrue(ValueOrdering.VALUES.compare(false, true) < 0);
        assertTrue(ValueOrdering.VALUES.compare("high", "low") < 0);
        assertTrue(ValueOrdering.VALUES.compare(2, 10) < 0);
        assertEquals(0, ValueOrdering.VALUES.compare("a", "a"));
    }

    @Test
    void testMixedNumbersCompareByValue() {
        assertTrue(ValueOrdering.VALUES.compare(1, 1.5) < 0);
        assertTrue(ValueOrdering.VALUES.compare(2.5, 2) > 0);
    }

    @Test
    void testMixedTypesAreRankedByKind() {
        List<Object> values = new ArrayList<>(List.of("yes", true, 3, false, 'c'));
        values.sort(ValueOrdering.VALUES);

        assertEquals(List.of(3, false, true, "yes", 'c'), values);
    }

    @Test
    void testMixedNumbersAndStringsStayTransitive() {
        Object five = 5;
        Object text = "x";
        Object one = new BigDecimal("1");

        assertTrue(ValueOrdering.VALUES.compare(one, five) < 0);
        assertTrue(ValueOrdering.VALUES.compare(five, text) < 0);
        assertTrue(ValueOrdering.VALUES.compare(one, text) < 0);

        List<Object> values = new ArrayList<>();
        for (int i = 0; i < 40; i++) {
            values.add(i % 3 == 0 ? Integer.valueOf(i) : i % 3 == 1 ? (Object) ("v" + i) : new BigDecimal(i));
        }
        Collections.shuffle(values, new Random(7));
        values.sort(ValueOrdering.VALUES);

        for (int i = 1; i < values.size(); i++) {
            assertTrue(ValueOrdering.VALUES.compare(values.get(i - 1), values.get(i)) <= 0);
        }
        assertEquals(Integer.valueOf(0), values.get(0));
        assertTrue(values.get(values.size() - 1) instanceof String);
    }

    @Test
    void testEqualNumbersOfDifferentTypesAreDistinguished() {
        assertTrue(ValueOrdering.VALUES.compare(1.0, 1) < 0);
        assertTrue(ValueOrdering.VALUES.compare(1, 1.0) > 0);
    }

    @Test
    void testKeysCompareLexicographically() {
        assertTrue(ValueOrdering.KEYS.compare(List.of(false, true), List.of(true, false)) < 0);
        assertTrue(ValueOrdering.KEYS.compare(List.of(true, false), List.of(true, true)) < 0);
        assertEquals(0, ValueOrdering.KEYS.compare(List.of("a", 1), List.of("a", 1)));
    }
}

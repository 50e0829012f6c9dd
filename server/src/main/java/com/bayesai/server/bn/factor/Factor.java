package com.bayesai.server.bn.factor;

import com.bayesai.server.bn.DegenerateNormalizationException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A labeled probability table: an ordered scope of variables and a weight for
 * each assignment of values to that scope. Assignments missing from the table
 * have weight zero.
 *
 * <p>
 * Factors are immutable. Every operation returns a new factor and leaves its
 * inputs untouched.
 */
public final class Factor {

    private final String name;
    private final List<String> scope;
    private final Map<List<Object>, Double> rows;

    public Factor(String name, List<String> scope, Map<List<Object>, Double> rows) {
        if (scope == null || new HashSet<>(scope).size() != scope.size()) {
            throw new IllegalArgumentException("Factor scope must be non-null and free of duplicates: " + scope);
        }
        Objects.requireNonNull(rows, "rows");
        Map<List<Object>, Double> copy = new LinkedHashMap<>();
        for (Map.Entry<List<Object>, Double> row : rows.entrySet()) {
            List<Object> key = row.getKey();
            if (key == null || key.size() != scope.size()) {
                throw new IllegalArgumentException("Row " + key + " does not match scope " + scope);
            }
            for (Object value : key) {
                if (value == null) {
                    throw new IllegalArgumentException("Row " + key + " contains a null value");
                }
            }
            Double weight = row.getValue();
            if (weight == null || weight < 0.0 || !Double.isFinite(weight)) {
                throw new IllegalArgumentException("Row " + key + " has invalid weight " + weight);
            }
            copy.put(List.copyOf(key), weight);
        }
        this.name = name;
        this.scope = List.copyOf(scope);
        this.rows = Collections.unmodifiableMap(copy);
    }

    public String getName() {
        return name;
    }

    public List<String> getScope() {
        return scope;
    }

    public boolean mentions(String variable) {
        return scope.contains(variable);
    }

    /** Rows in table order, keyed by assignment in scope order. */
    public Map<List<Object>, Double> getRows() {
        return rows;
    }

    public int size() {
        return rows.size();
    }

    /** Weight of an assignment given positionally, zero if absent. */
    public double get(Object... values) {
        return rows.getOrDefault(List.of(values), 0.0);
    }

    /** Weight of an assignment given by variable name; every scope variable must be assigned. */
    public double probability(Map<String, ?> assignment) {
        List<Object> key = new ArrayList<>(scope.size());
        for (String variable : scope) {
            Object value = assignment.get(variable);
            if (value == null) {
                throw new IllegalArgumentException("Assignment " + assignment + " does not cover " + variable);
            }
            key.add(value);
        }
        return rows.getOrDefault(key, 0.0);
    }

    public double total() {
        double sum = 0.0;
        for (double w : rows.values()) {
            sum += w;
        }
        return sum;
    }

    public Factor named(String newName) {
        return new Factor(newName, scope, rows);
    }

    /**
     * Drops rows that disagree with the evidence. Evidence variables stay in the
     * scope; entries about variables outside the scope are ignored.
     */
    public Factor restrict(Map<String, ?> evidence) {
        Map<Integer, Object> fixed = new HashMap<>();
        for (int i = 0; i < scope.size(); i++) {
            if (evidence.containsKey(scope.get(i))) {
                fixed.put(i, evidence.get(scope.get(i)));
            }
        }
        if (fixed.isEmpty()) {
            return this;
        }

        Map<List<Object>, Double> kept = new LinkedHashMap<>();
        for (Map.Entry<List<Object>, Double> row : rows.entrySet()) {
            boolean agrees = true;
            for (Map.Entry<Integer, Object> f : fixed.entrySet()) {
                if (!row.getKey().get(f.getKey()).equals(f.getValue())) {
                    agrees = false;
                    break;
                }
            }
            if (agrees) {
                kept.put(row.getKey(), row.getValue());
            }
        }
        return new Factor(name, scope, kept);
    }

    /**
     * Pointwise product. The result scope is this scope followed by the other
     * factor's remaining variables. Rows pair up on equal values of the shared
     * variables, or as a full Cartesian product when nothing is shared.
     */
    public Factor join(Factor other) {
        List<String> shared = new ArrayList<>();
        List<Integer> otherExtra = new ArrayList<>();
        List<String> joinedScope = new ArrayList<>(scope);
        for (int i = 0; i < other.scope.size(); i++) {
            String variable = other.scope.get(i);
            if (scope.contains(variable)) {
                shared.add(variable);
            } else {
                otherExtra.add(i);
                joinedScope.add(variable);
            }
        }

        int[] thisShared = positions(scope, shared);
        int[] otherShared = positions(other.scope, shared);

        // Hash index over the other side, keyed by its shared sub-tuple.
        Map<List<Object>, List<Map.Entry<List<Object>, Double>>> index = new HashMap<>();
        for (Map.Entry<List<Object>, Double> row : other.rows.entrySet()) {
            index.computeIfAbsent(project(row.getKey(), otherShared), k -> new ArrayList<>()).add(row);
        }

        Map<List<Object>, Double> product = new LinkedHashMap<>();
        for (Map.Entry<List<Object>, Double> left : rows.entrySet()) {
            List<Map.Entry<List<Object>, Double>> matches = index.get(project(left.getKey(), thisShared));
            if (matches == null) {
                continue;
            }
            for (Map.Entry<List<Object>, Double> right : matches) {
                List<Object> key = new ArrayList<>(joinedScope.size());
                key.addAll(left.getKey());
                for (int i : otherExtra) {
                    key.add(right.getKey().get(i));
                }
                product.put(key, left.getValue() * right.getValue());
            }
        }
        return new Factor(null, joinedScope, product);
    }

    /** Joins a non-empty collection of factors left to right. */
    public static Factor joinAll(Collection<Factor> factors) {
        Iterator<Factor> it = factors.iterator();
        if (!it.hasNext()) {
            throw new IllegalArgumentException("Nothing to join");
        }
        Factor result = it.next();
        while (it.hasNext()) {
            result = result.join(it.next());
        }
        return result;
    }

    /** Sums the variable out; the result covers the remaining scope. */
    public Factor marginalize(String variable) {
        int drop = scope.indexOf(variable);
        if (drop < 0) {
            throw new IllegalArgumentException("Variable '" + variable + "' is not in scope " + scope);
        }
        List<String> remaining = new ArrayList<>(scope);
        remaining.remove(drop);

        Map<List<Object>, Double> summed = new LinkedHashMap<>();
        for (Map.Entry<List<Object>, Double> row : rows.entrySet()) {
            List<Object> key = new ArrayList<>(row.getKey());
            key.remove(drop);
            summed.merge(key, row.getValue(), Double::sum);
        }
        return new Factor(name, remaining, summed);
    }

    public Factor normalize() {
        double total = total();
        if (total == 0.0) {
            throw new DegenerateNormalizationException(name != null ? name : "factor over " + scope);
        }
        Map<List<Object>, Double> scaled = new LinkedHashMap<>();
        for (Map.Entry<List<Object>, Double> row : rows.entrySet()) {
            scaled.put(row.getKey(), row.getValue() / total);
        }
        return new Factor(name, scope, scaled);
    }

    /** Same table with the scope permuted into the given order. */
    public Factor reorder(List<String> newScope) {
        if (newScope.size() != scope.size() || !new HashSet<>(newScope).equals(new HashSet<>(scope))) {
            throw new IllegalArgumentException("Cannot reorder " + scope + " into " + newScope);
        }
        if (newScope.equals(scope)) {
            return this;
        }
        int[] from = positions(scope, newScope);
        Map<List<Object>, Double> moved = new LinkedHashMap<>();
        for (Map.Entry<List<Object>, Double> row : rows.entrySet()) {
            moved.put(project(row.getKey(), from), row.getValue());
        }
        return new Factor(name, newScope, moved);
    }

    /** Same table with rows in ascending assignment order. */
    public Factor sorted() {
        List<List<Object>> keys = new ArrayList<>(rows.keySet());
        keys.sort(ValueOrdering.KEYS);
        Map<List<Object>, Double> ordered = new LinkedHashMap<>();
        for (List<Object> key : keys) {
            ordered.put(key, rows.get(key));
        }
        return new Factor(name, scope, ordered);
    }

    /**
     * Compares two tables as unordered sets of (variable assignment, weight)
     * pairs. Scope order, row order and names are ignored; rows absent on one
     * side count as zero.
     */
    public boolean contentEquals(Factor other, double tolerance) {
        if (!new HashSet<>(scope).equals(new HashSet<>(other.scope))) {
            return false;
        }
        Factor aligned = other.reorder(scope);
        Set<List<Object>> keys = new HashSet<>(rows.keySet());
        keys.addAll(aligned.rows.keySet());
        for (List<Object> key : keys) {
            double a = rows.getOrDefault(key, 0.0);
            double b = aligned.rows.getOrDefault(key, 0.0);
            if (Math.abs(a - b) > tolerance) {
                return false;
            }
        }
        return true;
    }

    private static int[] positions(List<String> in, List<String> variables) {
        int[] pos = new int[variables.size()];
        for (int i = 0; i < pos.length; i++) {
            pos[i] = in.indexOf(variables.get(i));
        }
        return pos;
    }

    private static List<Object> project(List<Object> key, int[] positions) {
        List<Object> sub = new ArrayList<>(positions.length);
        for (int p : positions) {
            sub.add(key.get(p));
        }
        return sub;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Factor)) {
            return false;
        }
        Factor other = (Factor) o;
        return Objects.equals(name, other.name) && scope.equals(other.scope) && rows.equals(other.rows);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, scope, rows);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(name != null ? name : "Factor").append(' ').append(scope);
        for (Map.Entry<List<Object>, Double> row : rows.entrySet()) {
            sb.append("\n  ").append(row.getKey()).append(" = ").append(String.format("%.6f", row.getValue()));
        }
        return sb.toString();
    }
}

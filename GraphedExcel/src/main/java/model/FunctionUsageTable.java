package model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Function name -> number of calls. Keeps the order in which names were first seen,
 * used to break ties when sorting by count.
 */
public class FunctionUsageTable {

    private final Map<String, Integer> counts = new LinkedHashMap<>();

    public void increment(String function) {
        add(function, 1);
    }

    public void add(String function, int n) {
        if (function == null || function.isEmpty()) throw new IllegalArgumentException("Function name is empty");
        if (n < 0) throw new IllegalArgumentException("Negative count for " + function + ": " + n);
        counts.merge(function, n, Integer::sum);
    }

    /** Adds all counts of {@code other} into this table and returns this. */
    public FunctionUsageTable merge(FunctionUsageTable other) {
        other.counts.forEach(this::add);
        return this;
    }

    public int count(String function) {
        return counts.getOrDefault(function, 0);
    }

    public int size() { return counts.size(); }
    public boolean isEmpty() { return counts.isEmpty(); }

    int total() {
        return counts.values().stream().mapToInt(Integer::intValue).sum();
    }

    Map<String, Integer> asMap() {
        return Collections.unmodifiableMap(counts);
    }

    /** Entries by descending count; equal counts keep first-seen order. */
    public List<Map.Entry<String, Integer>> sortedByCount() {
        List<Map.Entry<String, Integer>> out = new ArrayList<>(counts.entrySet());
        out.sort(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder()));
        return out;
    }

    @Override
    public String toString() {
        return counts.toString();
    }
}

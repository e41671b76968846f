package com.crypto.rebalance.market;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Rolling per-symbol price history for one simulation run.
 * Append-only; once a symbol holds {@code maxLength} prices the oldest is evicted.
 * Not thread-safe: owned by a single engine instance.
 */
public class PriceHistoryStore {

    public static final int DEFAULT_MAX_LENGTH = 30;

    private final int maxLength;
    private final Map<String, Deque<Double>> histories = new LinkedHashMap<>();

    public PriceHistoryStore() {
        this(DEFAULT_MAX_LENGTH);
    }

    public PriceHistoryStore(int maxLength) {
        if (maxLength < 1) {
            throw new IllegalArgumentException("maxLength must be positive: " + maxLength);
        }
        this.maxLength = maxLength;
    }

    public void append(String symbol, double price) {
        if (!Double.isFinite(price) || price < 0) {
            throw new IllegalArgumentException("Invalid price for " + symbol + ": " + price);
        }
        Deque<Double> history = histories.computeIfAbsent(symbol, s -> new ArrayDeque<>());
        history.addLast(price);
        while (history.size() > maxLength) {
            history.removeFirst();
        }
    }

    public void appendAll(String symbol, List<Double> prices) {
        for (double price : prices) {
            append(symbol, price);
        }
    }

    /**
     * Multiply every stored price of the symbol by {@code factor}. Returns are unchanged.
     */
    public void rescale(String symbol, double factor) {
        if (!Double.isFinite(factor) || factor <= 0) {
            throw new IllegalArgumentException("Invalid scale factor for " + symbol + ": " + factor);
        }
        Deque<Double> history = histories.get(symbol);
        if (history == null) {
            return;
        }
        Deque<Double> scaled = new ArrayDeque<>(history.size());
        for (double price : history) {
            scaled.addLast(price * factor);
        }
        histories.put(symbol, scaled);
    }

    /**
     * Snapshot of the symbol's prices, oldest first. Empty if unknown.
     */
    public List<Double> getHistory(String symbol) {
        Deque<Double> history = histories.get(symbol);
        if (history == null) {
            return List.of();
        }
        return Collections.unmodifiableList(new ArrayList<>(history));
    }

    public Optional<Double> latest(String symbol) {
        Deque<Double> history = histories.get(symbol);
        if (history == null || history.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(history.peekLast());
    }

    public int size(String symbol) {
        Deque<Double> history = histories.get(symbol);
        return history == null ? 0 : history.size();
    }

    public boolean hasAtLeast(String symbol, int points) {
        return size(symbol) >= points;
    }

    public Set<String> symbols() {
        return Collections.unmodifiableSet(histories.keySet());
    }

    /**
     * Copy of every symbol's history, in insertion order of symbols.
     */
    public Map<String, List<Double>> snapshot() {
        Map<String, List<Double>> copy = new LinkedHashMap<>();
        for (String symbol : histories.keySet()) {
            copy.put(symbol, getHistory(symbol));
        }
        return copy;
    }

    public int getMaxLength() {
        return maxLength;
    }
}

package com.stocktracker.kr.feed;

import com.stocktracker.kr.model.Cycle;

import java.util.Map;
import java.util.OptionalDouble;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory prices keyed by cycle id and ticker, for tests and dry runs.
 */
public final class MapPriceFeed implements PriceFeed {
    private final Map<String, Map<String, Double>> prices = new ConcurrentHashMap<>();

    public MapPriceFeed put(String cycleId, String ticker, double price) {
        prices.computeIfAbsent(cycleId, key -> new ConcurrentHashMap<>()).put(ticker, price);
        return this;
    }

    @Override
    public OptionalDouble priceOf(String ticker, Cycle cycle) {
        if (ticker == null || cycle == null) {
            return OptionalDouble.empty();
        }
        Map<String, Double> byTicker = prices.get(cycle.id);
        Double price = byTicker == null ? null : byTicker.get(ticker);
        if (price == null || !Double.isFinite(price) || price <= 0.0) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(price);
    }
}

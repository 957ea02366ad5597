package com.stocktracker.kr.feed;

import com.stocktracker.kr.config.Config;
import com.stocktracker.kr.model.Cycle;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Recorded closing prices, one {@code <cycleId>.json} file per cycle mapping ticker to price.
 */
public final class SnapshotPriceFeed implements PriceFeed {
    private static final Logger LOG = LogManager.getLogger(SnapshotPriceFeed.class);

    private final Path dir;
    private final Map<String, Map<String, Double>> snapshots = new ConcurrentHashMap<>();

    public SnapshotPriceFeed(Path dir) {
        this.dir = dir;
    }

    public static SnapshotPriceFeed fromConfig(Config config) {
        return new SnapshotPriceFeed(config.getPath("replay.prices_dir"));
    }

    @Override
    public OptionalDouble priceOf(String ticker, Cycle cycle) {
        if (ticker == null || cycle == null) {
            return OptionalDouble.empty();
        }
        Double price = snapshots.computeIfAbsent(cycle.id, this::load).get(ticker);
        if (price == null) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(price);
    }

    private Map<String, Double> load(String cycleId) {
        Path file = dir.resolve(cycleId + ".json");
        if (!Files.exists(file)) {
            LOG.warn("price snapshot missing: {}", file);
            return Map.of();
        }
        try {
            JSONObject root = new JSONObject(Files.readString(file, StandardCharsets.UTF_8));
            Map<String, Double> out = new HashMap<>();
            for (String ticker : root.keySet()) {
                double price = root.optDouble(ticker, Double.NaN);
                if (Double.isFinite(price) && price > 0.0) {
                    out.put(ticker, price);
                } else {
                    LOG.warn("ignoring price for {} in {}: {}", ticker, file, root.opt(ticker));
                }
            }
            return Map.copyOf(out);
        } catch (IOException | JSONException e) {
            LOG.error("price snapshot unreadable: {} ({})", file, e.getMessage());
            return Map.of();
        }
    }
}

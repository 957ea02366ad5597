package com.stocktracker.kr.capacity;

import com.stocktracker.kr.config.Config;
import com.stocktracker.kr.model.Position;
import com.stocktracker.kr.model.Scenario;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Locale;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Slot accounting for the open set. Only the slot count and the per-sector cap gate entries;
 * weights are for reporting.
 */
public final class CapacityManager {
    private static final Logger LOG = LogManager.getLogger(CapacityManager.class);

    private final AtomicInteger maxPortfolioSize;
    private final int maxPerSector;
    private final OpenPositions openPositions;

    public CapacityManager(int maxPortfolioSize, int maxPerSector, OpenPositions openPositions) {
        if (maxPortfolioSize <= 0) {
            throw new IllegalArgumentException("portfolio.max_size must be positive: " + maxPortfolioSize);
        }
        this.maxPortfolioSize = new AtomicInteger(maxPortfolioSize);
        this.maxPerSector = Math.max(0, maxPerSector);
        this.openPositions = openPositions;
    }

    public static CapacityManager fromConfig(Config config, OpenPositions openPositions) {
        return new CapacityManager(
                config.getInt("portfolio.max_size", 10),
                config.getInt("portfolio.max_per_sector", 3),
                openPositions
        );
    }

    public int capacity() {
        return maxPortfolioSize.get();
    }

    public int openCount() {
        return openPositions.openCount();
    }

    public boolean hasFreeSlot() {
        return openPositions.openCount() < maxPortfolioSize.get();
    }

    /**
     * Adopts the scenario's capacity hint when it carries one; the latest observed value wins.
     */
    public void observe(Scenario scenario) {
        if (scenario == null || scenario.maxPortfolioSize <= 0) {
            return;
        }
        int previous = maxPortfolioSize.getAndSet(scenario.maxPortfolioSize);
        if (previous != scenario.maxPortfolioSize) {
            LOG.info("capacity revised by scenario: {} -> {}", previous, scenario.maxPortfolioSize);
        }
    }

    public boolean sectorHasRoom(String sector) {
        if (maxPerSector <= 0 || sector == null || sector.trim().isEmpty()) {
            return true;
        }
        return sectorCount(sector) < maxPerSector;
    }

    public int sectorCount(String sector) {
        String wanted = normalize(sector);
        int count = 0;
        for (Position position : openPositions.openPositions()) {
            if (normalize(position.sector).equals(wanted)) {
                count++;
            }
        }
        return count;
    }

    public int maxPerSector() {
        return maxPerSector;
    }

    /**
     * Share of total capital held in the position, in percent. 0 when capital is not positive.
     */
    public double weightOf(Position position, double totalCapital) {
        if (position == null || !(totalCapital > 0.0)) {
            return 0.0;
        }
        return position.currentPrice / totalCapital * 100.0;
    }

    private static String normalize(String sector) {
        return sector == null ? "" : sector.trim().toLowerCase(Locale.ROOT);
    }
}

package com.stocktracker.kr.history;

import com.stocktracker.kr.model.ClosedTrade;
import com.stocktracker.kr.model.DailyDecision;
import com.stocktracker.kr.model.HistoryStats;
import com.stocktracker.kr.store.PortfolioStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.SQLException;
import java.util.List;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Append-only log of closed trades and the statistics derived from it. Statistics are recomputed
 * from the full log on every query so they always reconcile with the stored trades.
 */
public final class HistoryAggregator {
    private static final Logger LOG = LogManager.getLogger(HistoryAggregator.class);

    private final PortfolioStore store;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public HistoryAggregator(PortfolioStore store) {
        this.store = store;
    }

    /**
     * Appends the trade. The store retires the holding with the same ticker in the same write.
     */
    public void record(ClosedTrade trade) throws SQLException {
        record(trade, null);
    }

    /**
     * Appends the trade together with the decision that closed it, when one is given.
     *
     * @return false when the decision duplicates a stored one; nothing is written then
     */
    public boolean record(ClosedTrade trade, DailyDecision decision) throws SQLException {
        if (trade == null || trade.ticker == null || trade.ticker.trim().isEmpty()) {
            throw new IllegalArgumentException("closed trade must carry a ticker");
        }
        if (!(trade.buyPrice > 0.0) || !Double.isFinite(trade.profitRatePercent)) {
            throw new IllegalArgumentException("closed trade has invalid prices: " + trade.ticker);
        }
        lock.writeLock().lock();
        try {
            if (decision == null) {
                store.recordClosedTrade(trade);
            } else if (!store.recordClosedTrade(trade, decision)) {
                return false;
            }
        } finally {
            lock.writeLock().unlock();
        }
        LOG.info("trade recorded ticker={} outcome={} profit_rate={}% days={}",
                trade.ticker, trade.outcome, round2(trade.profitRatePercent), trade.holdingDays);
        return true;
    }

    public HistoryStats stats() throws SQLException {
        return compute(trades());
    }

    public List<ClosedTrade> trades() throws SQLException {
        lock.readLock().lock();
        try {
            return store.loadClosedTrades();
        } finally {
            lock.readLock().unlock();
        }
    }

    public static HistoryStats compute(List<ClosedTrade> trades) {
        if (trades == null || trades.isEmpty()) {
            return HistoryStats.empty();
        }
        int count = 0;
        int wins = 0;
        int losses = 0;
        int even = 0;
        double profitSum = 0.0;
        long daysSum = 0L;
        for (ClosedTrade trade : trades) {
            count++;
            switch (trade.outcome) {
                case WIN:
                    wins++;
                    break;
                case LOSS:
                    losses++;
                    break;
                default:
                    even++;
                    break;
            }
            profitSum += trade.profitRatePercent;
            daysSum += trade.holdingDays;
        }
        return new HistoryStats(
                count,
                wins,
                losses,
                even,
                (double) wins / count * 100.0,
                profitSum / count,
                (double) daysSum / count,
                profitSum
        );
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}

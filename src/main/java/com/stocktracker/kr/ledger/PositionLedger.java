package com.stocktracker.kr.ledger;

import com.stocktracker.core.diagnostics.CauseCode;
import com.stocktracker.core.diagnostics.PortfolioException;
import com.stocktracker.kr.capacity.CapacityManager;
import com.stocktracker.kr.history.HistoryAggregator;
import com.stocktracker.kr.model.ClosedTrade;
import com.stocktracker.kr.model.Cycle;
import com.stocktracker.kr.model.DailyDecision;
import com.stocktracker.kr.model.PortfolioSummary;
import com.stocktracker.kr.model.Position;
import com.stocktracker.kr.model.Scenario;
import com.stocktracker.kr.model.TradeOutcome;
import com.stocktracker.kr.model.WatchlistCandidate;
import com.stocktracker.kr.store.PortfolioStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Single writer for open positions. Mutations for one ticker are serialized, opens are
 * additionally serialized against each other so the last free slot cannot be taken twice, and
 * each mutation is one store write followed by the in-process mirror update.
 */
public final class PositionLedger {
    private static final Logger LOG = LogManager.getLogger(PositionLedger.class);

    private final PortfolioStore store;
    private final HoldingBook book;
    private final CapacityManager capacity;
    private final HistoryAggregator history;
    private final TickerLocks locks = new TickerLocks();
    private final ReentrantLock slotLock = new ReentrantLock();

    public PositionLedger(PortfolioStore store, HoldingBook book, CapacityManager capacity, HistoryAggregator history) {
        this.store = store;
        this.book = book;
        this.capacity = capacity;
        this.history = history;
    }

    @FunctionalInterface
    public interface LockedWork<T> {
        T run() throws SQLException;
    }

    /**
     * Runs work while holding the ticker's mutex. Ledger calls made inside re-enter the same lock.
     */
    public <T> T withTickerLock(String ticker, LockedWork<T> work) throws SQLException {
        ReentrantLock lock = locks.forTicker(requireTicker(ticker, ""));
        lock.lock();
        try {
            return work.run();
        } finally {
            lock.unlock();
        }
    }

    public Position open(Cycle cycle, WatchlistCandidate candidate, Scenario scenario) throws SQLException {
        String cycleId = cycle == null ? "" : cycle.id;
        if (cycle == null) {
            throw new IllegalArgumentException("cycle must not be null");
        }
        if (candidate == null || candidate.ticker == null || candidate.ticker.trim().isEmpty()) {
            throw new PortfolioException(CauseCode.INVALID_CANDIDATE, "", cycleId, "candidate has no ticker");
        }
        String ticker = candidate.ticker;
        if (!candidate.admitted()) {
            throw new PortfolioException(CauseCode.INVALID_CANDIDATE, ticker, cycleId,
                    "candidate was not admitted: " + candidate.rationale);
        }
        double buyPrice = candidate.quotedPrice;
        if (!Double.isFinite(buyPrice) || buyPrice <= 0.0) {
            throw new PortfolioException(CauseCode.INVALID_CANDIDATE, ticker, cycleId, "quoted price must be positive");
        }
        validateOpeningScenario(ticker, cycleId, buyPrice, scenario);

        ReentrantLock tickerLock = locks.forTicker(ticker);
        tickerLock.lock();
        try {
            slotLock.lock();
            try {
                if (book.contains(ticker)) {
                    throw new PortfolioException(CauseCode.DUPLICATE_POSITION, ticker, cycleId, "position already open");
                }
                if (!capacity.hasFreeSlot()) {
                    throw new PortfolioException(CauseCode.CAPACITY_EXCEEDED, ticker, cycleId,
                            "no free slot (" + capacity.openCount() + "/" + capacity.capacity() + ")");
                }
                Position position = Position.builder()
                        .ticker(ticker)
                        .companyName(candidate.companyName)
                        .sector(candidate.sector)
                        .buyPrice(buyPrice)
                        .buyDate(cycle.date)
                        .currentPrice(buyPrice)
                        .scenario(scenario)
                        .build();
                store.insertPosition(position);
                book.put(position);
                capacity.observe(scenario);
                LOG.info("opened ticker={} cycle={} buy={} target={} stop={} slots={}/{}",
                        ticker, cycleId, buyPrice, scenario.targetPrice, scenario.stopLoss,
                        capacity.openCount(), capacity.capacity());
                return position;
            } finally {
                slotLock.unlock();
            }
        } finally {
            tickerLock.unlock();
        }
    }

    /**
     * Replaces the position's scenario. Buy price and buy date never change.
     */
    public Position revise(String ticker, Scenario newScenario) throws SQLException {
        return revise(ticker, newScenario, null);
    }

    /**
     * Revises the scenario and, when a decision is given, appends it in the same store write.
     */
    public Position revise(String ticker, Scenario newScenario, DailyDecision decision) throws SQLException {
        requireTicker(ticker, "");
        if (newScenario == null || !newScenario.levelsPositive()) {
            throw new PortfolioException(CauseCode.INVALID_SCENARIO, ticker, "", "scenario levels must be positive");
        }
        if (!newScenario.levelsOrdered()) {
            throw new PortfolioException(CauseCode.INVALID_SCENARIO, ticker, "",
                    String.format(Locale.US, "stop loss %.2f must stay below target %.2f",
                            newScenario.stopLoss, newScenario.targetPrice));
        }
        return withTickerLock(ticker, () -> {
            Position current = book.get(ticker).orElseThrow(() -> unknown(ticker, ""));
            Position revised = current.toBuilder().scenario(newScenario).build();
            if (decision == null) {
                store.updatePosition(revised);
            } else if (!store.updatePosition(revised, decision)) {
                throw duplicateDecision(decision);
            }
            book.put(revised);
            capacity.observe(newScenario);
            LOG.info("revised ticker={} target={} -> {} stop={} -> {}",
                    ticker, current.targetPrice(), newScenario.targetPrice, current.stopLoss(), newScenario.stopLoss);
            return revised;
        });
    }

    /**
     * Records the price seen by the feed this cycle.
     */
    public Position markPrice(String ticker, double price) throws SQLException {
        requireTicker(ticker, "");
        if (!Double.isFinite(price) || price <= 0.0) {
            throw new IllegalArgumentException("price must be positive: " + ticker + "=" + price);
        }
        return withTickerLock(ticker, () -> {
            Position current = book.get(ticker).orElseThrow(() -> unknown(ticker, ""));
            if (current.currentPrice == price) {
                return current;
            }
            Position marked = current.toBuilder().currentPrice(price).build();
            store.updatePosition(marked);
            book.put(marked);
            return marked;
        });
    }

    /**
     * Closes the position at the given price. The trade append and the holding removal are one
     * store write, so no state exists where both or neither are present.
     */
    public ClosedTrade close(Cycle cycle, String ticker, double sellPrice, String reason) throws SQLException {
        return close(cycle, ticker, sellPrice, reason, null);
    }

    /**
     * Closes the position and, when a decision is given, appends it in the same store write.
     */
    public ClosedTrade close(Cycle cycle, String ticker, double sellPrice, String reason, DailyDecision decision)
            throws SQLException {
        if (cycle == null) {
            throw new IllegalArgumentException("cycle must not be null");
        }
        requireTicker(ticker, cycle.id);
        if (!Double.isFinite(sellPrice) || sellPrice <= 0.0) {
            throw new IllegalArgumentException("sell price must be positive: " + ticker + "=" + sellPrice);
        }
        return withTickerLock(ticker, () -> {
            Position current = book.get(ticker).orElseThrow(() -> unknown(ticker, cycle.id));
            double profitRate = ClosedTrade.profitRatePercent(current.buyPrice, sellPrice);
            ClosedTrade trade = ClosedTrade.builder()
                    .ticker(ticker)
                    .companyName(current.companyName)
                    .sector(current.sector)
                    .buyPrice(current.buyPrice)
                    .sellPrice(sellPrice)
                    .buyDate(current.buyDate)
                    .sellDate(cycle.date)
                    .holdingDays(current.holdingDays(cycle.date))
                    .profitRatePercent(profitRate)
                    .outcome(TradeOutcome.classify(profitRate))
                    .sellReason(reason == null ? "" : reason)
                    .cycleId(cycle.id)
                    .build();
            if (!history.record(trade, decision)) {
                throw duplicateDecision(decision);
            }
            book.remove(ticker);
            LOG.info("closed ticker={} cycle={} sell={} profit_rate={}% reason={}",
                    ticker, cycle.id, sellPrice, Math.round(profitRate * 100.0) / 100.0, trade.sellReason);
            return trade;
        });
    }

    public Optional<Position> get(String ticker) {
        return book.get(ticker);
    }

    public List<Position> listOpen() {
        return book.openPositions();
    }

    public PortfolioSummary summary() {
        List<Position> open = book.openPositions();
        double evaluation = 0.0;
        double invested = 0.0;
        for (Position position : open) {
            evaluation += position.currentPrice;
            invested += position.buyPrice;
        }
        return new PortfolioSummary(open.size(), evaluation, invested, evaluation - invested, capacity.capacity());
    }

    private void validateOpeningScenario(String ticker, String cycleId, double buyPrice, Scenario scenario) {
        if (scenario == null || !scenario.levelsPositive()) {
            throw new PortfolioException(CauseCode.INVALID_SCENARIO, ticker, cycleId, "scenario levels must be positive");
        }
        if (!(scenario.stopLoss < buyPrice)) {
            throw new PortfolioException(CauseCode.INVALID_SCENARIO, ticker, cycleId,
                    String.format(Locale.US, "stop loss %.2f must be below buy price %.2f", scenario.stopLoss, buyPrice));
        }
        if (!(scenario.targetPrice > buyPrice)) {
            throw new PortfolioException(CauseCode.INVALID_SCENARIO, ticker, cycleId,
                    String.format(Locale.US, "target %.2f must be above buy price %.2f", scenario.targetPrice, buyPrice));
        }
    }

    private static PortfolioException duplicateDecision(DailyDecision decision) {
        return new PortfolioException(CauseCode.DUPLICATE_DECISION, decision.ticker, decision.cycleId,
                "decision already recorded for this cycle");
    }

    private static String requireTicker(String ticker, String cycleId) {
        if (ticker == null || ticker.trim().isEmpty()) {
            throw new PortfolioException(CauseCode.UNKNOWN_POSITION, "", cycleId, "ticker must not be empty");
        }
        return ticker;
    }

    private static PortfolioException unknown(String ticker, String cycleId) {
        return new PortfolioException(CauseCode.UNKNOWN_POSITION, ticker, cycleId, "no open position");
    }
}

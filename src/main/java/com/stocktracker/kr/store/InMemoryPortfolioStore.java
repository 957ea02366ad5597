package com.stocktracker.kr.store;

import com.stocktracker.kr.model.ClosedTrade;
import com.stocktracker.kr.model.DailyDecision;
import com.stocktracker.kr.model.Position;
import com.stocktracker.kr.model.WatchlistCandidate;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Process-local store for dry runs and tests. A single monitor makes each call atomic.
 */
public final class InMemoryPortfolioStore implements PortfolioStore {
    private final Map<String, Position> holdings = new LinkedHashMap<>();
    private final List<ClosedTrade> closedTrades = new ArrayList<>();
    private final List<DailyDecision> decisions = new ArrayList<>();
    private final Set<String> decisionKeys = new HashSet<>();
    private final List<WatchlistCandidate> candidates = new ArrayList<>();

    @Override
    public synchronized List<Position> loadOpenPositions() {
        return List.copyOf(holdings.values());
    }

    @Override
    public synchronized void insertPosition(Position position) {
        if (holdings.containsKey(position.ticker)) {
            throw new IllegalStateException("holding already stored: " + position.ticker);
        }
        holdings.put(position.ticker, position);
    }

    @Override
    public synchronized void updatePosition(Position position) {
        if (!holdings.containsKey(position.ticker)) {
            throw new IllegalStateException("holding not stored: " + position.ticker);
        }
        holdings.put(position.ticker, position);
    }

    @Override
    public synchronized boolean updatePosition(Position position, DailyDecision decision) {
        if (hasDecision(decision.ticker, decision.cycleId)) {
            return false;
        }
        updatePosition(position);
        appendDecision(decision);
        return true;
    }

    @Override
    public synchronized void recordClosedTrade(ClosedTrade trade) {
        holdings.remove(trade.ticker);
        closedTrades.add(trade);
    }

    @Override
    public synchronized boolean recordClosedTrade(ClosedTrade trade, DailyDecision decision) {
        if (hasDecision(decision.ticker, decision.cycleId)) {
            return false;
        }
        recordClosedTrade(trade);
        appendDecision(decision);
        return true;
    }

    @Override
    public synchronized List<ClosedTrade> loadClosedTrades() {
        return List.copyOf(closedTrades);
    }

    @Override
    public synchronized boolean appendDecision(DailyDecision decision) {
        if (!decisionKeys.add(key(decision.ticker, decision.cycleId))) {
            return false;
        }
        decisions.add(decision);
        return true;
    }

    @Override
    public synchronized boolean hasDecision(String ticker, String cycleId) {
        return decisionKeys.contains(key(ticker, cycleId));
    }

    @Override
    public synchronized List<DailyDecision> loadDecisions(String ticker) {
        List<DailyDecision> out = new ArrayList<>();
        for (DailyDecision decision : decisions) {
            if (decision.ticker.equals(ticker)) {
                out.add(decision);
            }
        }
        return out;
    }

    @Override
    public synchronized void saveCandidate(WatchlistCandidate candidate) {
        candidates.add(candidate);
    }

    @Override
    public synchronized List<WatchlistCandidate> loadCandidates(String cycleId) {
        List<WatchlistCandidate> out = new ArrayList<>();
        for (WatchlistCandidate candidate : candidates) {
            if (cycleId == null || cycleId.equals(candidate.cycleId)) {
                out.add(candidate);
            }
        }
        return out;
    }

    private static String key(String ticker, String cycleId) {
        return ticker + "|" + cycleId;
    }
}

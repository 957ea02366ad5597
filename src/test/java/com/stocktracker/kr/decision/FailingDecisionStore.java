package com.stocktracker.kr.decision;

import com.stocktracker.kr.model.ClosedTrade;
import com.stocktracker.kr.model.DailyDecision;
import com.stocktracker.kr.model.Position;
import com.stocktracker.kr.model.WatchlistCandidate;
import com.stocktracker.kr.store.InMemoryPortfolioStore;
import com.stocktracker.kr.store.PortfolioStore;

import java.sql.SQLException;
import java.util.List;

/**
 * Memory store whose decision-bearing writes fail while armed. A failed write leaves nothing
 * behind, as a rolled-back transaction would.
 */
final class FailingDecisionStore implements PortfolioStore {
    private final InMemoryPortfolioStore delegate = new InMemoryPortfolioStore();
    private volatile boolean armed;

    void arm(boolean armed) {
        this.armed = armed;
    }

    private void failIfArmed(DailyDecision decision) throws SQLException {
        if (armed) {
            throw new SQLException("connection reset while writing decision " + decision.ticker + "/" + decision.cycleId);
        }
    }

    @Override
    public List<Position> loadOpenPositions() {
        return delegate.loadOpenPositions();
    }

    @Override
    public void insertPosition(Position position) {
        delegate.insertPosition(position);
    }

    @Override
    public void updatePosition(Position position) {
        delegate.updatePosition(position);
    }

    @Override
    public boolean updatePosition(Position position, DailyDecision decision) throws SQLException {
        failIfArmed(decision);
        return delegate.updatePosition(position, decision);
    }

    @Override
    public void recordClosedTrade(ClosedTrade trade) {
        delegate.recordClosedTrade(trade);
    }

    @Override
    public boolean recordClosedTrade(ClosedTrade trade, DailyDecision decision) throws SQLException {
        failIfArmed(decision);
        return delegate.recordClosedTrade(trade, decision);
    }

    @Override
    public List<ClosedTrade> loadClosedTrades() {
        return delegate.loadClosedTrades();
    }

    @Override
    public boolean appendDecision(DailyDecision decision) throws SQLException {
        failIfArmed(decision);
        return delegate.appendDecision(decision);
    }

    @Override
    public boolean hasDecision(String ticker, String cycleId) {
        return delegate.hasDecision(ticker, cycleId);
    }

    @Override
    public List<DailyDecision> loadDecisions(String ticker) {
        return delegate.loadDecisions(ticker);
    }

    @Override
    public void saveCandidate(WatchlistCandidate candidate) {
        delegate.saveCandidate(candidate);
    }

    @Override
    public List<WatchlistCandidate> loadCandidates(String cycleId) {
        return delegate.loadCandidates(cycleId);
    }
}

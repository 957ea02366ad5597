package com.stocktracker.kr.store;

import com.stocktracker.kr.model.ClosedTrade;
import com.stocktracker.kr.model.DailyDecision;
import com.stocktracker.kr.model.Position;
import com.stocktracker.kr.model.WatchlistCandidate;

import java.sql.SQLException;
import java.util.List;

/**
 * Durable storage behind the ledger. Every mutating call is one atomic write.
 */
public interface PortfolioStore {

    List<Position> loadOpenPositions() throws SQLException;

    void insertPosition(Position position) throws SQLException;

    /**
     * Rewrites the whole holding row: scenario, levels and current price together.
     */
    void updatePosition(Position position) throws SQLException;

    /**
     * Rewrites the holding row and appends the decision in one transaction.
     *
     * @return false when a decision for the same (ticker, cycle) is already stored; nothing is written then
     */
    boolean updatePosition(Position position, DailyDecision decision) throws SQLException;

    /**
     * Appends the trade and removes the holding with the same ticker, if any, in one transaction.
     */
    void recordClosedTrade(ClosedTrade trade) throws SQLException;

    /**
     * Appends the trade, removes the holding and appends the closing decision in one transaction.
     *
     * @return false when a decision for the same (ticker, cycle) is already stored; nothing is written then
     */
    boolean recordClosedTrade(ClosedTrade trade, DailyDecision decision) throws SQLException;

    List<ClosedTrade> loadClosedTrades() throws SQLException;

    /**
     * @return false when a decision for the same (ticker, cycle) is already stored; nothing is written then
     */
    boolean appendDecision(DailyDecision decision) throws SQLException;

    boolean hasDecision(String ticker, String cycleId) throws SQLException;

    List<DailyDecision> loadDecisions(String ticker) throws SQLException;

    void saveCandidate(WatchlistCandidate candidate) throws SQLException;

    List<WatchlistCandidate> loadCandidates(String cycleId) throws SQLException;
}

package com.stocktracker.kr.gate;

import com.stocktracker.core.diagnostics.CauseCode;
import com.stocktracker.core.diagnostics.PortfolioException;
import com.stocktracker.kr.capacity.CapacityManager;
import com.stocktracker.kr.capacity.OpenPositions;
import com.stocktracker.kr.model.Cycle;
import com.stocktracker.kr.model.EntryDecision;
import com.stocktracker.kr.model.Position;
import com.stocktracker.kr.model.Scenario;
import com.stocktracker.kr.model.ScreeningRequest;
import com.stocktracker.kr.model.WatchlistCandidate;
import com.stocktracker.kr.store.InMemoryPortfolioStore;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScoringGateTest {
    private static final Cycle CYCLE = new Cycle("2026-10-19-0930", LocalDate.of(2026, 10, 19));

    private final InMemoryPortfolioStore store = new InMemoryPortfolioStore();
    private final FakeOpenPositions open = new FakeOpenPositions();
    private final ScoringGate gate = new ScoringGate(store, new CapacityManager(3, 2, open), open);

    @Test
    void evaluate_shouldAdmitStrongCandidateAndPersistIt() throws SQLException {
        WatchlistCandidate candidate = gate.evaluate(request("AAA", 8.5, EntryDecision.ENTER, "Tech"), 8.0, CYCLE);

        assertTrue(candidate.admitted());
        assertEquals(8.0, candidate.minScoreThreshold, 1e-9);
        assertEquals(CYCLE.id, candidate.cycleId);
        assertEquals("breakout above resistance", candidate.rationale);
        assertEquals(1, store.loadCandidates(CYCLE.id).size());
    }

    @Test
    void evaluate_shouldAdmitScoreExactlyAtThreshold() throws SQLException {
        assertTrue(gate.evaluate(request("AAA", 8.0, EntryDecision.ENTER, "Tech"), 8.0, CYCLE).admitted());
    }

    @Test
    void evaluate_shouldSkipLowScoreWithReason() throws SQLException {
        WatchlistCandidate candidate = gate.evaluate(request("AAA", 7.9, EntryDecision.ENTER, "Tech"), 8.0, CYCLE);

        assertFalse(candidate.admitted());
        assertTrue(candidate.rationale.contains("below threshold"));
        assertEquals(1, store.loadCandidates(null).size());
    }

    @Test
    void evaluate_shouldSkipWhenAnalystSaysWatch() throws SQLException {
        WatchlistCandidate candidate = gate.evaluate(request("AAA", 9.5, EntryDecision.SKIP, "Tech"), 8.0, CYCLE);

        assertEquals(EntryDecision.SKIP, candidate.decision);
        assertTrue(candidate.rationale.contains("watch"));
    }

    @Test
    void evaluate_shouldSkipHeldTickerAndFullPortfolio() throws SQLException {
        open.add("AAA", "Tech");
        open.add("BBB", "Energy");
        open.add("CCC", "Energy");

        WatchlistCandidate held = gate.evaluate(request("AAA", 9.5, EntryDecision.ENTER, "Tech"), 8.0, CYCLE);
        WatchlistCandidate full = gate.evaluate(request("DDD", 9.5, EntryDecision.ENTER, "Bio"), 8.0, CYCLE);

        assertTrue(held.rationale.contains("already held"));
        assertTrue(full.rationale.contains("no free slot (3/3)"));
        assertFalse(full.admitted());
    }

    @Test
    void evaluate_shouldSkipWhenSectorIsFull() throws SQLException {
        open.add("BBB", "Energy");
        open.add("CCC", "energy");

        WatchlistCandidate candidate = gate.evaluate(request("DDD", 9.5, EntryDecision.ENTER, "Energy"), 8.0, CYCLE);

        assertFalse(candidate.admitted());
        assertTrue(candidate.rationale.contains("sector Energy full"));
    }

    @Test
    void evaluate_shouldRejectOutOfRangeScoreWithoutSaving() {
        PortfolioException e = assertThrows(PortfolioException.class,
                () -> gate.evaluate(request("AAA", 10.5, EntryDecision.ENTER, "Tech"), 8.0, CYCLE));

        assertEquals(CauseCode.INVALID_CANDIDATE, e.causeCode());
        assertTrue(store.loadCandidates(null).isEmpty());
    }

    @Test
    void evaluate_shouldRejectMissingTicker() {
        ScreeningRequest noTicker = request("AAA", 9.0, EntryDecision.ENTER, "Tech").toBuilder().ticker(" ").build();

        PortfolioException e = assertThrows(PortfolioException.class, () -> gate.evaluate(noTicker, 8.0, CYCLE));

        assertEquals(CauseCode.INVALID_CANDIDATE, e.causeCode());
    }

    private static ScreeningRequest request(String ticker, double score, EntryDecision decision, String sector) {
        return ScreeningRequest.builder()
                .ticker(ticker)
                .companyName(ticker + " Corp")
                .sector(sector)
                .analyzedAt(Instant.parse("2026-10-19T00:10:00Z"))
                .buyScore(score)
                .analystDecision(decision)
                .rationale("breakout above resistance")
                .quotedPrice(10_000.0)
                .scenario(Scenario.builder().targetPrice(12_000.0).stopLoss(9_000.0).build())
                .build();
    }

    private static final class FakeOpenPositions implements OpenPositions {
        private final List<Position> positions = new ArrayList<>();

        void add(String ticker, String sector) {
            positions.add(Position.builder()
                    .ticker(ticker)
                    .companyName(ticker + " Corp")
                    .sector(sector)
                    .buyPrice(100.0)
                    .buyDate(LocalDate.of(2026, 10, 1))
                    .currentPrice(100.0)
                    .scenario(Scenario.builder().targetPrice(120.0).stopLoss(90.0).build())
                    .build());
        }

        @Override
        public int openCount() {
            return positions.size();
        }

        @Override
        public List<Position> openPositions() {
            return List.copyOf(positions);
        }
    }
}

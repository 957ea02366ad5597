package com.stocktracker.kr.ledger;

import com.stocktracker.core.diagnostics.CauseCode;
import com.stocktracker.core.diagnostics.PortfolioException;
import com.stocktracker.kr.capacity.CapacityManager;
import com.stocktracker.kr.history.HistoryAggregator;
import com.stocktracker.kr.model.ClosedTrade;
import com.stocktracker.kr.model.Cycle;
import com.stocktracker.kr.model.EntryDecision;
import com.stocktracker.kr.model.InvestmentHorizon;
import com.stocktracker.kr.model.PortfolioSummary;
import com.stocktracker.kr.model.Position;
import com.stocktracker.kr.model.Scenario;
import com.stocktracker.kr.model.TradeOutcome;
import com.stocktracker.kr.model.WatchlistCandidate;
import com.stocktracker.kr.store.InMemoryPortfolioStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PositionLedgerTest {
    private static final Cycle OPEN_CYCLE = new Cycle("2026-10-01-0930", LocalDate.of(2026, 10, 1));
    private static final Cycle CLOSE_CYCLE = new Cycle("2026-10-08-1500", LocalDate.of(2026, 10, 8));

    private InMemoryPortfolioStore store;
    private HoldingBook book;
    private CapacityManager capacity;
    private PositionLedger ledger;

    @BeforeEach
    void setUp() throws SQLException {
        store = new InMemoryPortfolioStore();
        book = HoldingBook.load(store);
        capacity = new CapacityManager(3, 0, book);
        ledger = new PositionLedger(store, book, capacity, new HistoryAggregator(store));
    }

    @Test
    void open_shouldStorePositionAtQuotedPrice() throws SQLException {
        Position position = ledger.open(OPEN_CYCLE, candidate("AAA", 10_000.0), scenario(12_000.0, 9_000.0));

        assertEquals(10_000.0, position.buyPrice, 1e-9);
        assertEquals(10_000.0, position.currentPrice, 1e-9);
        assertEquals(OPEN_CYCLE.date, position.buyDate);
        assertEquals(1, store.loadOpenPositions().size());
        assertTrue(book.contains("AAA"));
        assertEquals(1, capacity.openCount());
    }

    @Test
    void open_shouldRejectSecondPositionForSameTicker() throws SQLException {
        ledger.open(OPEN_CYCLE, candidate("AAA", 10_000.0), scenario(12_000.0, 9_000.0));

        PortfolioException e = assertThrows(PortfolioException.class,
                () -> ledger.open(OPEN_CYCLE, candidate("AAA", 10_500.0), scenario(12_000.0, 9_000.0)));

        assertEquals(CauseCode.DUPLICATE_POSITION, e.causeCode());
        assertEquals(10_000.0, ledger.get("AAA").orElseThrow().buyPrice, 1e-9);
    }

    @Test
    void open_shouldRejectWhenPortfolioIsFull() throws SQLException {
        ledger.open(OPEN_CYCLE, candidate("AAA", 100.0), scenario(120.0, 90.0));
        ledger.open(OPEN_CYCLE, candidate("BBB", 100.0), scenario(120.0, 90.0));
        ledger.open(OPEN_CYCLE, candidate("CCC", 100.0), scenario(120.0, 90.0));

        PortfolioException e = assertThrows(PortfolioException.class,
                () -> ledger.open(OPEN_CYCLE, candidate("DDD", 100.0), scenario(120.0, 90.0)));

        assertEquals(CauseCode.CAPACITY_EXCEEDED, e.causeCode());
        assertEquals(3, store.loadOpenPositions().size());
    }

    @Test
    void open_shouldRejectScenarioWithStopAboveBuyPrice() {
        PortfolioException e = assertThrows(PortfolioException.class,
                () -> ledger.open(OPEN_CYCLE, candidate("AAA", 10_000.0), scenario(12_000.0, 10_500.0)));

        assertEquals(CauseCode.INVALID_SCENARIO, e.causeCode());
        assertEquals(0, book.openCount());
    }

    @Test
    void open_shouldRejectCandidateThatWasSkipped() {
        WatchlistCandidate skipped = candidate("AAA", 10_000.0).toBuilder().decision(EntryDecision.SKIP).build();

        PortfolioException e = assertThrows(PortfolioException.class,
                () -> ledger.open(OPEN_CYCLE, skipped, scenario(12_000.0, 9_000.0)));

        assertEquals(CauseCode.INVALID_CANDIDATE, e.causeCode());
    }

    @Test
    void open_shouldNeverExceedCapacityUnderConcurrentOpens() throws Exception {
        int attempts = 12;
        ExecutorService pool = Executors.newFixedThreadPool(6);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < attempts; i++) {
                String ticker = "T" + i;
                Callable<Boolean> task = () -> {
                    start.await();
                    try {
                        ledger.open(OPEN_CYCLE, candidate(ticker, 100.0), scenario(120.0, 90.0));
                        return true;
                    } catch (PortfolioException e) {
                        assertEquals(CauseCode.CAPACITY_EXCEEDED, e.causeCode());
                        return false;
                    }
                };
                futures.add(pool.submit(task));
            }
            start.countDown();
            int opened = 0;
            for (Future<Boolean> future : futures) {
                if (future.get(10, TimeUnit.SECONDS)) {
                    opened++;
                }
            }
            assertEquals(3, opened);
            assertEquals(3, store.loadOpenPositions().size());
            assertEquals(3, book.openCount());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void revise_shouldReplaceScenarioAndKeepBuyPrice() throws SQLException {
        ledger.open(OPEN_CYCLE, candidate("AAA", 10_000.0), scenario(12_000.0, 9_000.0));

        Position revised = ledger.revise("AAA", scenario(12_000.0, 9_000.0).withLevels(13_000.0, 9_500.0, null));

        assertEquals(13_000.0, revised.targetPrice(), 1e-9);
        assertEquals(9_500.0, revised.stopLoss(), 1e-9);
        assertEquals(10_000.0, revised.buyPrice, 1e-9);
        assertEquals(9_500.0, store.loadOpenPositions().get(0).stopLoss(), 1e-9);
    }

    @Test
    void revise_shouldRejectStopAtOrAboveTarget() throws SQLException {
        ledger.open(OPEN_CYCLE, candidate("AAA", 10_000.0), scenario(12_000.0, 9_000.0));

        PortfolioException e = assertThrows(PortfolioException.class,
                () -> ledger.revise("AAA", scenario(12_000.0, 9_000.0).withLevels(null, 12_000.0, null)));

        assertEquals(CauseCode.INVALID_SCENARIO, e.causeCode());
        assertEquals(9_000.0, ledger.get("AAA").orElseThrow().stopLoss(), 1e-9);
    }

    @Test
    void revise_shouldRejectUnknownTicker() {
        PortfolioException e = assertThrows(PortfolioException.class,
                () -> ledger.revise("ZZZ", scenario(120.0, 90.0)));

        assertEquals(CauseCode.UNKNOWN_POSITION, e.causeCode());
    }

    @Test
    void close_shouldMoveHoldingIntoHistoryAtomically() throws SQLException {
        ledger.open(OPEN_CYCLE, candidate("AAA", 10_000.0), scenario(12_000.0, 9_000.0));

        ClosedTrade trade = ledger.close(CLOSE_CYCLE, "AAA", 11_000.0, "target trimmed");

        assertEquals(10.0, trade.profitRatePercent, 1e-9);
        assertEquals(TradeOutcome.WIN, trade.outcome);
        assertEquals(7, trade.holdingDays);
        assertEquals(CLOSE_CYCLE.id, trade.cycleId);
        assertFalse(book.contains("AAA"));
        assertTrue(store.loadOpenPositions().isEmpty());
        assertEquals(1, store.loadClosedTrades().size());
        assertTrue(capacity.hasFreeSlot());
    }

    @Test
    void close_shouldRejectTickerThatIsNotHeld() {
        PortfolioException e = assertThrows(PortfolioException.class,
                () -> ledger.close(CLOSE_CYCLE, "AAA", 100.0, "none"));

        assertEquals(CauseCode.UNKNOWN_POSITION, e.causeCode());
        assertTrue(store.loadClosedTrades().isEmpty());
    }

    @Test
    void summary_shouldAggregateMarkedPrices() throws SQLException {
        ledger.open(OPEN_CYCLE, candidate("AAA", 10_000.0), scenario(12_000.0, 9_000.0));
        ledger.open(OPEN_CYCLE, candidate("BBB", 5_000.0), scenario(6_000.0, 4_500.0));
        ledger.markPrice("AAA", 10_400.0);
        ledger.markPrice("BBB", 4_900.0);

        PortfolioSummary summary = ledger.summary();

        assertEquals(2, summary.totalPositions());
        assertEquals(15_300.0, summary.totalEvaluation(), 1e-9);
        assertEquals(15_000.0, summary.totalInvested(), 1e-9);
        assertEquals(300.0, summary.totalUnrealizedProfit(), 1e-9);
        assertEquals("2/3", summary.slotUsage());
    }

    @Test
    void reload_shouldRebuildOpenSetFromStore() throws SQLException {
        ledger.open(OPEN_CYCLE, candidate("AAA", 10_000.0), scenario(12_000.0, 9_000.0));

        HoldingBook reloaded = HoldingBook.load(store);

        assertEquals(1, reloaded.openCount());
        assertEquals(12_000.0, reloaded.get("AAA").orElseThrow().targetPrice(), 1e-9);
    }

    static WatchlistCandidate candidate(String ticker, double price) {
        return WatchlistCandidate.builder()
                .ticker(ticker)
                .companyName(ticker + " Corp")
                .sector("Tech")
                .analyzedAt(Instant.parse("2026-10-01T00:30:00Z"))
                .buyScore(9.0)
                .minScoreThreshold(8.0)
                .decision(EntryDecision.ENTER)
                .rationale("strong setup")
                .quotedPrice(price)
                .cycleId(OPEN_CYCLE.id)
                .build();
    }

    static Scenario scenario(double target, double stop) {
        return Scenario.builder()
                .targetPrice(target)
                .stopLoss(stop)
                .investmentHorizon(InvestmentHorizon.MID)
                .rationale("base plan")
                .build();
    }
}

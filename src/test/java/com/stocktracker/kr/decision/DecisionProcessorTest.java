package com.stocktracker.kr.decision;

import com.stocktracker.core.diagnostics.CauseCode;
import com.stocktracker.core.diagnostics.PortfolioException;
import com.stocktracker.kr.capacity.CapacityManager;
import com.stocktracker.kr.history.HistoryAggregator;
import com.stocktracker.kr.ledger.HoldingBook;
import com.stocktracker.kr.ledger.PositionLedger;
import com.stocktracker.kr.model.ClosedTrade;
import com.stocktracker.kr.model.Cycle;
import com.stocktracker.kr.model.DailyDecision;
import com.stocktracker.kr.model.EntryDecision;
import com.stocktracker.kr.model.InvestmentHorizon;
import com.stocktracker.kr.model.Scenario;
import com.stocktracker.kr.model.SellSignal;
import com.stocktracker.kr.model.TradeOutcome;
import com.stocktracker.kr.model.WatchlistCandidate;
import com.stocktracker.kr.notify.BufferedNotificationSink;
import com.stocktracker.kr.notify.PortfolioEvent;
import com.stocktracker.kr.store.InMemoryPortfolioStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DecisionProcessorTest {
    private static final LocalDate BUY_DATE = LocalDate.of(2026, 10, 1);

    private InMemoryPortfolioStore store;
    private PositionLedger ledger;
    private BufferedNotificationSink sink;
    private DecisionProcessor processor;

    @BeforeEach
    void setUp() throws SQLException {
        store = new InMemoryPortfolioStore();
        HoldingBook book = HoldingBook.load(store);
        CapacityManager capacity = new CapacityManager(5, 0, book);
        ledger = new PositionLedger(store, book, capacity, new HistoryAggregator(store));
        sink = new BufferedNotificationSink();
        processor = new DecisionProcessor(ledger, store, new JudgmentParser(), new ExitRuleBook(true), sink);

        Cycle openCycle = new Cycle("2026-10-01-0930", BUY_DATE);
        ledger.open(openCycle, candidate("AAA", 10_000.0, openCycle.id), Scenario.builder()
                .targetPrice(12_000.0)
                .stopLoss(9_000.0)
                .investmentHorizon(InvestmentHorizon.MID)
                .rationale("breakout")
                .build());
    }

    @Test
    void process_shouldHoldWhenNothingFires() throws SQLException {
        Cycle cycle = cycle(1);
        Transition transition = processor.process(cycle, "AAA", "{\"confidence\":7}", 10_100.0);

        assertEquals(PositionState.HOLDING, transition.finalState());
        assertEquals(List.of(PositionState.HOLDING), transition.path());
        assertFalse(transition.closed());
        assertEquals(10_100.0, ledger.get("AAA").orElseThrow().currentPrice, 1e-9);
        assertTrue(store.hasDecision("AAA", cycle.id));
        assertEquals(PortfolioEvent.Type.HELD, sink.drain().get(0).type());
    }

    @Test
    void process_shouldReviseLevelsWhenAdjustmentRequested() throws SQLException {
        Cycle cycle = cycle(1);
        String raw = "{\"confidence\":8,\"portfolio_adjustment_needed\":true,\"adjustment_urgency\":\"high\","
                + "\"new_target_price\":13000,\"new_stop_loss\":0,\"rationale\":\"momentum extended\"}";

        Transition transition = processor.process(cycle, "AAA", raw, 10_200.0);

        assertTrue(transition.revised());
        assertEquals(List.of(PositionState.HOLDING, PositionState.PENDING_REVISION, PositionState.HOLDING),
                transition.path());
        assertEquals(13_000.0, ledger.get("AAA").orElseThrow().targetPrice(), 1e-9);
        assertEquals(9_000.0, ledger.get("AAA").orElseThrow().stopLoss(), 1e-9);
        assertEquals("momentum extended", ledger.get("AAA").orElseThrow().scenario.rationale);
        assertEquals(10_000.0, ledger.get("AAA").orElseThrow().buyPrice, 1e-9);
    }

    @Test
    void process_shouldCloseAtStopLevelWhenPriceFallsThroughStop() throws SQLException {
        Cycle cycle = cycle(2);
        Transition transition = processor.process(cycle, "AAA", "{\"confidence\":5}", 8_800.0);

        assertTrue(transition.closed());
        ClosedTrade trade = transition.trade();
        assertEquals(9_000.0, trade.sellPrice, 1e-9);
        assertEquals(-10.0, trade.profitRatePercent, 1e-9);
        assertEquals(TradeOutcome.LOSS, trade.outcome);
        assertTrue(ledger.get("AAA").isEmpty());
        assertTrue(transition.decision().signals(SellSignal.STOP_LOSS));
    }

    @Test
    void process_shouldCloseAtCurrentPriceWhenTargetOnlySignalled() throws SQLException {
        Cycle cycle = cycle(2);
        String raw = "{\"confidence\":9,\"sell_signals\":[\"target_reached\"],\"sell_reason\":\"target hit intraday\"}";

        Transition transition = processor.process(cycle, "AAA", raw, 10_300.0);

        assertTrue(transition.closed());
        assertEquals(10_300.0, transition.trade().sellPrice, 1e-9);
        assertEquals(3.0, transition.trade().profitRatePercent, 1e-9);
        assertEquals("target hit intraday", transition.trade().sellReason);
        assertEquals(3.0, new HistoryAggregator(store).stats().cumulativeProfitRate(), 1e-9);
    }

    @Test
    void process_shouldCloseAtTargetLevelWhenPriceCrossesTarget() throws SQLException {
        Transition transition = processor.process(cycle(2), "AAA", "{\"confidence\":9}", 12_400.0);

        assertEquals(12_000.0, transition.trade().sellPrice, 1e-9);
        assertEquals(20.0, transition.trade().profitRatePercent, 1e-9);
        assertTrue(transition.decision().signals(SellSignal.TARGET_REACHED));
    }

    @Test
    void process_shouldCloseAtCurrentPriceWhenStopOnlySignalled() throws SQLException {
        String raw = "{\"confidence\":4,\"sell_signals\":[\"STOP_LOSS\"]}";

        Transition transition = processor.process(cycle(2), "AAA", raw, 9_800.0);

        assertEquals(9_800.0, transition.trade().sellPrice, 1e-9);
        assertEquals(-2.0, transition.trade().profitRatePercent, 1e-9);
    }

    @Test
    void process_shouldPreferStopLossWhenBothSignalsArePresent() throws SQLException {
        String raw = "{\"confidence\":6,\"sell_signals\":[\"TARGET_REACHED\",\"STOP_LOSS\"]}";

        Transition atMarket = processor.process(cycle(2), "AAA", raw, 10_000.0);

        assertTrue(atMarket.decision().signals(SellSignal.STOP_LOSS));
        assertEquals(10_000.0, atMarket.trade().sellPrice, 1e-9);
    }

    @Test
    void process_shouldCloseAtStopLevelWhenBothSignalledAndStopCrossed() throws SQLException {
        String raw = "{\"confidence\":6,\"sell_signals\":[\"TARGET_REACHED\",\"STOP_LOSS\"]}";

        Transition transition = processor.process(cycle(2), "AAA", raw, 8_950.0);

        assertEquals(9_000.0, transition.trade().sellPrice, 1e-9);
        assertEquals(TradeOutcome.LOSS, transition.trade().outcome);
    }

    @Test
    void process_shouldKeepHoldingBetweenStopAndTarget() throws SQLException {
        Transition lower = processor.process(cycle(1), "AAA",
                "{\"confidence\":7,\"portfolio_adjustment_needed\":false}", 9_400.0);
        Transition upper = processor.process(cycle(2), "AAA",
                "{\"confidence\":9,\"technical_trend\":\"strong uptrend\"}", 11_000.0);

        assertEquals(PositionState.HOLDING, lower.finalState());
        assertEquals(PositionState.HOLDING, upper.finalState());
        assertEquals(9_000.0, ledger.get("AAA").orElseThrow().stopLoss(), 1e-9);
        assertEquals(12_000.0, ledger.get("AAA").orElseThrow().targetPrice(), 1e-9);
        assertTrue(store.loadClosedTrades().isEmpty());
        assertEquals(2, store.loadDecisions("AAA").size());
    }

    @Test
    void process_shouldCloseAtCurrentPriceOnSellTrigger() throws SQLException {
        Transition transition = processor.process(cycle(2), "AAA", "{\"confidence\":4,\"should_sell\":\"yes\"}", 10_200.0);

        assertTrue(transition.closed());
        assertEquals(10_200.0, transition.trade().sellPrice, 1e-9);
        assertEquals(TradeOutcome.WIN, transition.trade().outcome);
    }

    @Test
    void process_shouldLetCloseWinOverRequestedAdjustment() throws SQLException {
        String raw = "{\"confidence\":3,\"portfolio_adjustment_needed\":true,\"new_stop_loss\":8500,"
                + "\"sell_signals\":[\"STOP_LOSS\"]}";

        Transition transition = processor.process(cycle(2), "AAA", raw, 9_100.0);

        assertTrue(transition.closed());
        assertNull(transition.position());
        assertEquals(9_100.0, transition.trade().sellPrice, 1e-9);
        assertEquals(1, store.loadClosedTrades().size());
    }

    @Test
    void process_shouldCloseOnHoldingPeriodRule() throws SQLException {
        Cycle late = new Cycle("2026-11-05-1500", BUY_DATE.plusDays(35));

        Transition transition = processor.process(late, "AAA", "{\"confidence\":5}", 9_900.0);

        assertTrue(transition.closed());
        assertEquals(9_900.0, transition.trade().sellPrice, 1e-9);
        assertTrue(transition.trade().sellReason.contains("30+ days"));
    }

    @Test
    void process_shouldRejectSecondDecisionInSameCycle() throws SQLException {
        Cycle cycle = cycle(1);
        processor.process(cycle, "AAA", "{\"confidence\":7}", 10_100.0);
        sink.drain();

        PortfolioException e = assertThrows(PortfolioException.class,
                () -> processor.process(cycle, "AAA", "{\"confidence\":2,\"should_sell\":true}", 10_100.0));

        assertEquals(CauseCode.DUPLICATE_DECISION, e.causeCode());
        assertEquals(cycle.id, e.cycleId());
        assertTrue(ledger.get("AAA").isPresent());
        assertEquals(1, store.loadDecisions("AAA").size());
        assertEquals(PortfolioEvent.Type.REJECTED, sink.drain().get(0).type());
    }

    @Test
    void process_shouldLeaveNoDecisionWhenJudgmentIsMalformed() {
        Cycle cycle = cycle(1);

        PortfolioException e = assertThrows(PortfolioException.class,
                () -> processor.process(cycle, "AAA", "{\"confidence\":\"high\"}", 10_100.0));

        assertEquals(CauseCode.MALFORMED_JUDGMENT, e.causeCode());
        assertFalse(store.hasDecision("AAA", cycle.id));
        assertTrue(ledger.get("AAA").isPresent());
        assertEquals(10_000.0, ledger.get("AAA").orElseThrow().currentPrice, 1e-9);
    }

    @Test
    void process_shouldRejectRevisionThatInvertsLevels() {
        Cycle cycle = cycle(1);
        String raw = "{\"confidence\":6,\"portfolio_adjustment_needed\":true,\"new_stop_loss\":12500}";

        PortfolioException e = assertThrows(PortfolioException.class,
                () -> processor.process(cycle, "AAA", raw, 10_100.0));

        assertEquals(CauseCode.INVALID_SCENARIO, e.causeCode());
        assertEquals(9_000.0, ledger.get("AAA").orElseThrow().stopLoss(), 1e-9);
        assertFalse(store.hasDecision("AAA", cycle.id));
    }

    @Test
    void process_shouldLeavePositionOpenWhenClosingWriteFails() throws SQLException {
        FailingDecisionStore failing = new FailingDecisionStore();
        PositionLedger failingLedger = openLedger(failing);
        DecisionProcessor failingProcessor =
                new DecisionProcessor(failingLedger, failing, new JudgmentParser(), new ExitRuleBook(false), sink);
        Cycle cycle = cycle(2);

        failing.arm(true);
        assertThrows(SQLException.class, () -> failingProcessor.process(cycle, "AAA", "{\"confidence\":5}", 8_800.0));

        assertTrue(failingLedger.get("AAA").isPresent());
        assertEquals(1, failing.loadOpenPositions().size());
        assertTrue(failing.loadClosedTrades().isEmpty());
        assertFalse(failing.hasDecision("AAA", cycle.id));

        failing.arm(false);
        Transition retried = failingProcessor.process(cycle, "AAA", "{\"confidence\":5}", 8_800.0);

        assertTrue(retried.closed());
        assertEquals(1, failing.loadClosedTrades().size());
        assertTrue(failing.hasDecision("AAA", cycle.id));
        assertTrue(failing.loadOpenPositions().isEmpty());
    }

    @Test
    void process_shouldKeepOldLevelsWhenRevisionWriteFails() throws SQLException {
        FailingDecisionStore failing = new FailingDecisionStore();
        PositionLedger failingLedger = openLedger(failing);
        DecisionProcessor failingProcessor =
                new DecisionProcessor(failingLedger, failing, new JudgmentParser(), new ExitRuleBook(false), sink);
        Cycle cycle = cycle(1);
        String raw = "{\"confidence\":8,\"portfolio_adjustment_needed\":true,\"new_stop_loss\":9500}";

        failing.arm(true);
        assertThrows(SQLException.class, () -> failingProcessor.process(cycle, "AAA", raw, 10_200.0));

        assertEquals(9_000.0, failingLedger.get("AAA").orElseThrow().stopLoss(), 1e-9);
        assertEquals(9_000.0, failing.loadOpenPositions().get(0).stopLoss(), 1e-9);
        assertFalse(failing.hasDecision("AAA", cycle.id));

        failing.arm(false);
        assertTrue(failingProcessor.process(cycle, "AAA", raw, 10_200.0).revised());
        assertEquals(9_500.0, failing.loadOpenPositions().get(0).stopLoss(), 1e-9);
    }

    @Test
    void process_shouldRejectTickerWithoutPosition() {
        PortfolioException e = assertThrows(PortfolioException.class,
                () -> processor.process(cycle(1), "ZZZ", "{\"confidence\":7}", 100.0));

        assertEquals(CauseCode.UNKNOWN_POSITION, e.causeCode());
    }

    @Test
    void apply_shouldAcceptPreParsedDecision() throws SQLException {
        Cycle cycle = cycle(1);
        DailyDecision decision = new JudgmentParser().parse("{\"confidence\":7}", "AAA", cycle);

        Transition transition = processor.apply(cycle, decision, 0.0);

        assertEquals(PositionState.HOLDING, transition.finalState());
        assertEquals(10_000.0, ledger.get("AAA").orElseThrow().currentPrice, 1e-9);
    }

    private static PositionLedger openLedger(FailingDecisionStore failing) throws SQLException {
        HoldingBook book = HoldingBook.load(failing);
        PositionLedger opened = new PositionLedger(failing, book, new CapacityManager(5, 0, book),
                new HistoryAggregator(failing));
        Cycle openCycle = new Cycle("2026-10-01-0930", BUY_DATE);
        opened.open(openCycle, candidate("AAA", 10_000.0, openCycle.id), Scenario.builder()
                .targetPrice(12_000.0)
                .stopLoss(9_000.0)
                .investmentHorizon(InvestmentHorizon.MID)
                .rationale("breakout")
                .build());
        return opened;
    }

    private static Cycle cycle(int day) {
        LocalDate date = BUY_DATE.plusDays(day);
        return new Cycle(date + "-1500", date);
    }

    private static WatchlistCandidate candidate(String ticker, double price, String cycleId) {
        return WatchlistCandidate.builder()
                .ticker(ticker)
                .companyName(ticker + " Corp")
                .sector("Tech")
                .analyzedAt(Instant.parse("2026-10-01T00:30:00Z"))
                .buyScore(9.0)
                .minScoreThreshold(8.0)
                .decision(EntryDecision.ENTER)
                .rationale("breakout")
                .quotedPrice(price)
                .cycleId(cycleId)
                .build();
    }
}

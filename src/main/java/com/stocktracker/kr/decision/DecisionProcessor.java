package com.stocktracker.kr.decision;

import com.stocktracker.core.diagnostics.CauseCode;
import com.stocktracker.core.diagnostics.PortfolioException;
import com.stocktracker.kr.ledger.PositionLedger;
import com.stocktracker.kr.model.ClosedTrade;
import com.stocktracker.kr.model.Cycle;
import com.stocktracker.kr.model.DailyDecision;
import com.stocktracker.kr.model.Position;
import com.stocktracker.kr.model.Scenario;
import com.stocktracker.kr.model.SellSignal;
import com.stocktracker.kr.notify.NotificationSink;
import com.stocktracker.kr.notify.PortfolioEvent;
import com.stocktracker.kr.store.PortfolioStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.SQLException;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Applies one judgment per open position per cycle: hold, revise or close.
 *
 * <p>Everything for one ticker happens under the ledger's ticker lock: the duplicate check, the
 * ledger mutation and the decision append. A close or a revision is written together with its
 * decision in one store write. A rejected judgment leaves no trace besides the log and the
 * cycle's price mark.
 */
public final class DecisionProcessor {
    private static final Logger LOG = LogManager.getLogger(DecisionProcessor.class);

    private final PositionLedger ledger;
    private final PortfolioStore store;
    private final JudgmentParser parser;
    private final ExitRuleBook exitRules;
    private final NotificationSink sink;

    public DecisionProcessor(PositionLedger ledger, PortfolioStore store, JudgmentParser parser,
                             ExitRuleBook exitRules, NotificationSink sink) {
        this.ledger = ledger;
        this.store = store;
        this.parser = parser;
        this.exitRules = exitRules;
        this.sink = sink;
    }

    /**
     * Parses the raw payload and applies it at the given price.
     */
    public Transition process(Cycle cycle, String ticker, String rawJudgment, double price) throws SQLException {
        try {
            return ledger.withTickerLock(ticker, () -> {
                rejectDuplicate(cycle, ticker);
                DailyDecision decision = parser.parse(rawJudgment, ticker, cycle);
                return applyLocked(cycle, decision, price);
            });
        } catch (PortfolioException e) {
            throw rejected(e.inCycle(cycle.id));
        }
    }

    public Transition apply(Cycle cycle, DailyDecision decision, double price) throws SQLException {
        if (decision == null) {
            throw new IllegalArgumentException("decision must not be null");
        }
        try {
            return ledger.withTickerLock(decision.ticker, () -> {
                rejectDuplicate(cycle, decision.ticker);
                return applyLocked(cycle, decision, price);
            });
        } catch (PortfolioException e) {
            throw rejected(e.inCycle(cycle.id));
        }
    }

    private void rejectDuplicate(Cycle cycle, String ticker) throws SQLException {
        if (store.hasDecision(ticker, cycle.id)) {
            throw new PortfolioException(CauseCode.DUPLICATE_DECISION, ticker, cycle.id,
                    "decision already recorded for this cycle");
        }
    }

    private Transition applyLocked(Cycle cycle, DailyDecision parsed, double price) throws SQLException {
        String ticker = parsed.ticker;
        DailyDecision decision = parsed.cycleId == null || !parsed.cycleId.equals(cycle.id)
                ? parsed.toBuilder().cycleId(cycle.id).build()
                : parsed;
        Position position = ledger.get(ticker)
                .orElseThrow(() -> new PortfolioException(CauseCode.UNKNOWN_POSITION, ticker, cycle.id, "no open position"));
        if (Double.isFinite(price) && price > 0.0) {
            position = ledger.markPrice(ticker, price);
        }
        double current = position.currentPrice;

        Optional<CloseOrder> close = closeOrder(position, decision, current, cycle);
        if (close.isPresent()) {
            CloseOrder order = close.get();
            if (decision.requestsRevision()) {
                LOG.info("adjustment ignored on close ticker={} cycle={} new_target={} new_stop={}",
                        ticker, cycle.id, decision.newTargetPrice, decision.newStopLoss);
            }
            DailyDecision recorded = withCloseSignal(decision, order);
            ClosedTrade trade = ledger.close(cycle, ticker, order.price, order.reason, recorded);
            sink.publish(PortfolioEvent.of(PortfolioEvent.Type.CLOSED, ticker, cycle.id,
                    String.format(Locale.US, "%s at %.0f, profit_rate=%.2f%% (%s)",
                            order.signal, order.price, trade.profitRatePercent, order.reason)));
            return new Transition(ticker, cycle.id, List.of(PositionState.HOLDING, PositionState.CLOSING),
                    recorded, null, trade, order.reason);
        }

        if (decision.requestsRevision()) {
            Scenario revisedScenario = position.scenario.withLevels(
                    decision.newTargetPrice, decision.newStopLoss, revisionNote(decision));
            Position revised = ledger.revise(ticker, revisedScenario, decision);
            sink.publish(PortfolioEvent.of(PortfolioEvent.Type.REVISED, ticker, cycle.id,
                    String.format(Locale.US, "target %.0f -> %.0f, stop %.0f -> %.0f (urgency %s)",
                            position.targetPrice(), revised.targetPrice(), position.stopLoss(), revised.stopLoss(),
                            decision.adjustmentUrgency)));
            return new Transition(ticker, cycle.id,
                    List.of(PositionState.HOLDING, PositionState.PENDING_REVISION, PositionState.HOLDING),
                    decision, revised, null, "levels revised");
        }

        append(decision);
        sink.publish(PortfolioEvent.of(PortfolioEvent.Type.HELD, ticker, cycle.id,
                String.format(Locale.US, "confidence %d, price %.0f", decision.confidence, current)));
        return new Transition(ticker, cycle.id, List.of(PositionState.HOLDING), decision, position, null, "hold");
    }

    /**
     * Stop-loss first, then target, then an explicit sell trigger, then the holding-period rules.
     * A level is the sell price only once the price has crossed it; a signal alone sells at the
     * current price.
     */
    private Optional<CloseOrder> closeOrder(Position position, DailyDecision decision, double current, Cycle cycle) {
        double stop = position.stopLoss();
        double target = position.targetPrice();
        boolean stopCrossed = current <= stop;
        if (stopCrossed || decision.signals(SellSignal.STOP_LOSS)) {
            double price = stopCrossed ? stop : current;
            return Optional.of(new CloseOrder(SellSignal.STOP_LOSS, price, reasonOr(decision, stopCrossed
                    ? String.format(Locale.US, "stop loss %.0f reached (price %.0f)", stop, current)
                    : String.format(Locale.US, "stop loss signalled at %.0f (stop %.0f)", current, stop))));
        }
        boolean targetCrossed = current >= target;
        if (targetCrossed || decision.signals(SellSignal.TARGET_REACHED)) {
            double price = targetCrossed ? target : current;
            return Optional.of(new CloseOrder(SellSignal.TARGET_REACHED, price, reasonOr(decision, targetCrossed
                    ? String.format(Locale.US, "target %.0f reached (price %.0f)", target, current)
                    : String.format(Locale.US, "target signalled at %.0f (target %.0f)", current, target))));
        }
        if (decision.signals(SellSignal.SELL_TRIGGER)) {
            return Optional.of(new CloseOrder(SellSignal.SELL_TRIGGER, current, reasonOr(decision, "sell trigger")));
        }
        return exitRules.evaluate(position, current, cycle.date, ExitRuleBook.trendScore(decision.technicalTrend))
                .map(reason -> new CloseOrder(SellSignal.SELL_TRIGGER, current, reason));
    }

    private void append(DailyDecision decision) throws SQLException {
        if (!store.appendDecision(decision)) {
            throw new PortfolioException(CauseCode.DUPLICATE_DECISION, decision.ticker, decision.cycleId,
                    "decision already recorded for this cycle");
        }
    }

    private PortfolioException rejected(PortfolioException e) {
        LOG.warn("decision rejected ticker={} cycle={} cause={} reason={}",
                e.ticker(), e.cycleId(), e.causeCode(), e.getMessage());
        sink.publish(PortfolioEvent.of(PortfolioEvent.Type.REJECTED, e.ticker(), e.cycleId(),
                e.causeCode() + ": " + e.getMessage()));
        return e;
    }

    private static DailyDecision withCloseSignal(DailyDecision decision, CloseOrder order) {
        Set<SellSignal> signals = EnumSet.noneOf(SellSignal.class);
        if (decision.sellSignals != null) {
            signals.addAll(decision.sellSignals);
        }
        signals.add(order.signal);
        return decision.toBuilder()
                .sellSignals(Set.copyOf(signals))
                .sellReason(order.reason)
                .build();
    }

    private static String revisionNote(DailyDecision decision) {
        if (decision.extras == null) {
            return null;
        }
        return decision.extras.get("rationale");
    }

    private static String reasonOr(DailyDecision decision, String fallback) {
        if (decision.sellReason == null || decision.sellReason.trim().isEmpty()) {
            return fallback;
        }
        return decision.sellReason.trim();
    }

    private static final class CloseOrder {
        final SellSignal signal;
        final double price;
        final String reason;

        CloseOrder(SellSignal signal, double price, String reason) {
            this.signal = signal;
            this.price = price;
            this.reason = reason;
        }
    }
}

package com.stocktracker.kr.runner;

import com.stocktracker.core.CycleTelemetry;
import com.stocktracker.core.diagnostics.CauseCode;
import com.stocktracker.core.diagnostics.Outcome;
import com.stocktracker.core.diagnostics.PortfolioException;
import com.stocktracker.kr.capacity.CapacityManager;
import com.stocktracker.kr.decision.DecisionProcessor;
import com.stocktracker.kr.decision.Transition;
import com.stocktracker.kr.feed.JudgmentProducer;
import com.stocktracker.kr.feed.PriceFeed;
import com.stocktracker.kr.gate.ScoringGate;
import com.stocktracker.kr.gate.ThresholdPolicy;
import com.stocktracker.kr.history.HistoryAggregator;
import com.stocktracker.kr.ledger.PositionLedger;
import com.stocktracker.kr.model.Cycle;
import com.stocktracker.kr.model.HistoryStats;
import com.stocktracker.kr.model.MarketCondition;
import com.stocktracker.kr.model.Position;
import com.stocktracker.kr.model.ScreeningRequest;
import com.stocktracker.kr.model.WatchlistCandidate;
import com.stocktracker.kr.notify.NotificationSink;
import com.stocktracker.kr.notify.PortfolioEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Drives one cycle: judge every open position on a worker pool, then screen the day's list and
 * open what the gate admits. Per-item failures become failed outcomes; the cycle carries on.
 */
public final class CycleRunner {
    private static final Logger LOG = LogManager.getLogger(CycleRunner.class);
    private static final String OWNER_DECISION = "decision";
    private static final String OWNER_ENTRY = "entry";

    private final PortfolioEngine engine;
    private final PriceFeed prices;
    private final JudgmentProducer judgments;
    private final CycleRunLog runLog;
    private final int threads;
    private final long judgmentTimeoutSec;

    public CycleRunner(PortfolioEngine engine, PriceFeed prices, JudgmentProducer judgments, CycleRunLog runLog,
                       int threads, long judgmentTimeoutSec) {
        this.engine = engine;
        this.prices = prices;
        this.judgments = judgments;
        this.runLog = runLog;
        this.threads = Math.max(1, threads);
        this.judgmentTimeoutSec = Math.max(1L, judgmentTimeoutSec);
    }

    public CycleReport run(Cycle cycle, MarketCondition market, List<ScreeningRequest> screening, String trigger) {
        CycleTelemetry telemetry = new CycleTelemetry(0L, cycle.id, trigger, Instant.now());
        long runId = startRun(cycle, trigger);
        telemetry.setRunId(runId);
        LOG.info("cycle start id={} market={} open={} screening={}",
                cycle.id, market, engine.ledger().listOpen().size(), screening == null ? 0 : screening.size());

        List<Outcome<Transition>> decisions = new ArrayList<>();
        List<Outcome<WatchlistCandidate>> entries = new ArrayList<>();
        boolean interrupted = false;
        String error = "";
        try {
            decisions.addAll(judgeOpenPositions(cycle, telemetry));
            if (Thread.currentThread().isInterrupted()) {
                interrupted = true;
            } else {
                entries.addAll(screen(cycle, market, screening, telemetry));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            interrupted = true;
            error = "interrupted";
        }
        telemetry.finish();

        HistoryStats stats;
        try {
            stats = engine.history().stats();
        } catch (SQLException e) {
            LOG.error("history stats unavailable for cycle {}: {}", cycle.id, e.getMessage());
            stats = HistoryStats.empty();
            telemetry.incrementErrors(1);
        }

        String status = status(decisions, entries, interrupted);
        CycleReport report = new CycleReport(cycle.id, status, decisions, entries,
                engine.ledger().summary(), stats, telemetry.getSummary());
        finishRun(runId, status, telemetry.getSummary(), error);
        LOG.info("cycle end id={} status={} failures={} {} | {}",
                cycle.id, status, report.failures(), report.summary().toSummaryLine(), stats.toSummaryLine());
        return report;
    }

    private List<Outcome<Transition>> judgeOpenPositions(Cycle cycle, CycleTelemetry telemetry) throws InterruptedException {
        List<Position> open = engine.ledger().listOpen();
        telemetry.startStep(CycleTelemetry.STEP_DECISION);
        List<Outcome<Transition>> out = new ArrayList<>(open.size());
        if (open.isEmpty()) {
            telemetry.endStep(CycleTelemetry.STEP_DECISION, 0, 0, 0);
            return out;
        }
        ExecutorService pool = Executors.newFixedThreadPool(Math.min(threads, open.size()));
        ExecutorService judgmentPool = Executors.newCachedThreadPool();
        CompletionService<Outcome<Transition>> completion = new ExecutorCompletionService<>(pool);
        List<Future<Outcome<Transition>>> submitted = new ArrayList<>();
        for (Position position : open) {
            submitted.add(completion.submit(() -> judge(cycle, position, judgmentPool)));
        }
        long errors = 0;
        try {
            for (int i = 0; i < submitted.size(); i++) {
                Future<Outcome<Transition>> future = completion.take();
                Outcome<Transition> outcome;
                try {
                    outcome = future.get();
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() == null ? e : e.getCause();
                    LOG.error("decision task failed in cycle {}: {}", cycle.id, cause.toString());
                    outcome = Outcome.failure(CauseCode.RUNTIME_ERROR, OWNER_DECISION,
                            Map.of("cycle_id", cycle.id, "reason", String.valueOf(cause.getMessage())));
                }
                if (!outcome.success) {
                    errors++;
                    telemetry.count(CycleTelemetry.Counter.REJECTED);
                } else if (outcome.value.closed()) {
                    telemetry.count(CycleTelemetry.Counter.CLOSED);
                } else if (outcome.value.revised()) {
                    telemetry.count(CycleTelemetry.Counter.REVISED);
                } else {
                    telemetry.count(CycleTelemetry.Counter.HELD);
                }
                out.add(outcome);
            }
        } catch (InterruptedException e) {
            for (Future<Outcome<Transition>> future : submitted) {
                future.cancel(true);
            }
            LOG.warn("cycle {} interrupted after {} of {} decisions", cycle.id, out.size(), submitted.size());
            throw e;
        } finally {
            pool.shutdownNow();
            judgmentPool.shutdownNow();
            telemetry.endStep(CycleTelemetry.STEP_DECISION, open.size(), out.size() - errors, errors);
        }
        return out;
    }

    private Outcome<Transition> judge(Cycle cycle, Position position, ExecutorService judgmentPool) {
        String ticker = position.ticker;
        try {
            OptionalDouble price = prices.priceOf(ticker, cycle);
            if (price.isEmpty()) {
                return reject(new PortfolioException(CauseCode.PRICE_MISSING, ticker, cycle.id,
                        "no price for this cycle, transition skipped"));
            }
            String raw = produceWithTimeout(cycle, position, judgmentPool);
            Transition transition = engine.processor().process(cycle, ticker, raw, price.getAsDouble());
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("ticker", ticker);
            details.put("cycle_id", cycle.id);
            details.put("state", transition.finalState().name());
            details.put("note", transition.note());
            return Outcome.success(transition, OWNER_DECISION, details);
        } catch (PortfolioException e) {
            return Outcome.failure(e, OWNER_DECISION);
        } catch (SQLException e) {
            return reject(new PortfolioException(CauseCode.STORE_ERROR, ticker, cycle.id, e.getMessage(), e));
        }
    }

    private String produceWithTimeout(Cycle cycle, Position position, ExecutorService judgmentPool) {
        Future<String> future = judgmentPool.submit(() -> judgments.produce(position, cycle));
        try {
            return future.get(judgmentTimeoutSec, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw unavailable(cycle, position, "timed out after " + judgmentTimeoutSec + "s", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            if (cause instanceof IOException) {
                throw unavailable(cycle, position, cause.getMessage(), cause);
            }
            throw unavailable(cycle, position, cause.toString(), cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw unavailable(cycle, position, "interrupted", e);
        }
    }

    private PortfolioException unavailable(Cycle cycle, Position position, String message, Throwable cause) {
        PortfolioException e = new PortfolioException(CauseCode.JUDGMENT_UNAVAILABLE, position.ticker, cycle.id,
                "judgment unavailable: " + message, cause);
        LOG.warn("judgment unavailable ticker={} cycle={} reason={}", position.ticker, cycle.id, message);
        engine.sink().publish(PortfolioEvent.of(PortfolioEvent.Type.REJECTED, position.ticker, cycle.id,
                CauseCode.JUDGMENT_UNAVAILABLE + ": " + message));
        return e;
    }

    private Outcome<Transition> reject(PortfolioException e) {
        LOG.warn("decision skipped ticker={} cycle={} cause={} reason={}",
                e.ticker(), e.cycleId(), e.causeCode(), e.getMessage());
        engine.sink().publish(PortfolioEvent.of(PortfolioEvent.Type.REJECTED, e.ticker(), e.cycleId(),
                e.causeCode() + ": " + e.getMessage()));
        return Outcome.failure(e, OWNER_DECISION);
    }

    /**
     * Best scores first, so the remaining slots go to the strongest candidates.
     */
    private List<Outcome<WatchlistCandidate>> screen(
            Cycle cycle,
            MarketCondition market,
            List<ScreeningRequest> screening,
            CycleTelemetry telemetry
    ) {
        List<Outcome<WatchlistCandidate>> out = new ArrayList<>();
        if (screening == null || screening.isEmpty()) {
            return out;
        }
        CapacityManager capacity = engine.capacity();
        ThresholdPolicy thresholds = engine.thresholds();
        double threshold = thresholds.minScore(market, capacity.openCount(), capacity.capacity());
        LOG.info("screening cycle={} market={} threshold={} slots={}/{}",
                cycle.id, market, threshold, capacity.openCount(), capacity.capacity());

        List<ScreeningRequest> ordered = new ArrayList<>(screening);
        ordered.sort(Comparator.comparingDouble((ScreeningRequest r) -> Double.isFinite(r.buyScore) ? r.buyScore : -1.0)
                .reversed());

        telemetry.startStep(CycleTelemetry.STEP_SCREENING);
        long errors = 0;
        long opened = 0;
        ScoringGate gate = engine.gate();
        PositionLedger ledger = engine.ledger();
        for (ScreeningRequest request : ordered) {
            if (Thread.currentThread().isInterrupted()) {
                LOG.warn("cycle {} interrupted during screening", cycle.id);
                break;
            }
            String ticker = request == null || request.ticker == null ? "" : request.ticker;
            try {
                WatchlistCandidate candidate = gate.evaluate(request, threshold, cycle);
                if (!candidate.admitted()) {
                    telemetry.count(CycleTelemetry.Counter.SKIPPED);
                    engine.sink().publish(PortfolioEvent.of(PortfolioEvent.Type.SKIPPED, ticker, cycle.id,
                            candidate.rationale));
                    out.add(Outcome.success(candidate, OWNER_ENTRY, Map.of("ticker", ticker, "opened", false)));
                    continue;
                }
                Position position = ledger.open(cycle, candidate, request.scenario);
                opened++;
                telemetry.count(CycleTelemetry.Counter.OPENED);
                engine.sink().publish(PortfolioEvent.of(PortfolioEvent.Type.OPENED, ticker, cycle.id,
                        String.format(Locale.US, "buy %.0f, target %.0f, stop %.0f, horizon %s",
                                position.buyPrice, position.targetPrice(), position.stopLoss(),
                                position.investmentHorizon())));
                out.add(Outcome.success(candidate, OWNER_ENTRY, Map.of("ticker", ticker, "opened", true)));
            } catch (PortfolioException e) {
                errors++;
                telemetry.count(CycleTelemetry.Counter.REJECTED);
                PortfolioException tagged = e.inCycle(cycle.id);
                LOG.warn("entry rejected ticker={} cycle={} cause={} reason={}",
                        tagged.ticker(), tagged.cycleId(), tagged.causeCode(), tagged.getMessage());
                engine.sink().publish(PortfolioEvent.of(PortfolioEvent.Type.REJECTED, ticker, cycle.id,
                        tagged.causeCode() + ": " + tagged.getMessage()));
                out.add(Outcome.failure(tagged, OWNER_ENTRY));
            } catch (SQLException e) {
                errors++;
                telemetry.count(CycleTelemetry.Counter.REJECTED);
                LOG.error("entry store error ticker={} cycle={} err={}", ticker, cycle.id, e.getMessage());
                out.add(Outcome.failure(new PortfolioException(CauseCode.STORE_ERROR, ticker, cycle.id,
                        e.getMessage(), e), OWNER_ENTRY));
            }
        }
        telemetry.endStep(CycleTelemetry.STEP_SCREENING, ordered.size(), opened, errors);
        return out;
    }

    private long startRun(Cycle cycle, String trigger) {
        try {
            return runLog.start(cycle.id, trigger);
        } catch (SQLException e) {
            LOG.warn("cycle run log unavailable, cycle={} err={}", cycle.id, e.getMessage());
            return 0L;
        }
    }

    private void finishRun(long runId, String status, String summary, String error) {
        if (runId <= 0L) {
            return;
        }
        try {
            runLog.finish(runId, status, summary, error);
        } catch (SQLException e) {
            LOG.warn("failed to finish cycle run {}: {}", runId, e.getMessage());
        }
    }

    private static String status(
            List<Outcome<Transition>> decisions,
            List<Outcome<WatchlistCandidate>> entries,
            boolean interrupted
    ) {
        if (interrupted) {
            return CycleReport.STATUS_ABORTED;
        }
        int total = decisions.size() + entries.size();
        long failed = decisions.stream().filter(o -> !o.success).count()
                + entries.stream().filter(o -> !o.success).count();
        if (failed == 0) {
            return CycleReport.STATUS_SUCCESS;
        }
        return failed == total ? CycleReport.STATUS_FAILED : CycleReport.STATUS_PARTIAL;
    }
}

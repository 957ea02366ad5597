package com.stocktracker.kr.runner;

import com.stocktracker.kr.capacity.CapacityManager;
import com.stocktracker.kr.config.Config;
import com.stocktracker.kr.decision.DecisionProcessor;
import com.stocktracker.kr.decision.ExitRuleBook;
import com.stocktracker.kr.decision.JudgmentParser;
import com.stocktracker.kr.gate.ScoringGate;
import com.stocktracker.kr.gate.ThresholdPolicy;
import com.stocktracker.kr.history.HistoryAggregator;
import com.stocktracker.kr.ledger.HoldingBook;
import com.stocktracker.kr.ledger.PositionLedger;
import com.stocktracker.kr.notify.NotificationSink;
import com.stocktracker.kr.store.PortfolioStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.SQLException;

/**
 * Wires the components over one store. The open set is loaded once here; afterwards the ledger
 * is the only writer.
 */
public final class PortfolioEngine {
    private static final Logger LOG = LogManager.getLogger(PortfolioEngine.class);

    private final PortfolioStore store;
    private final CapacityManager capacity;
    private final HistoryAggregator history;
    private final PositionLedger ledger;
    private final ThresholdPolicy thresholds;
    private final ScoringGate gate;
    private final DecisionProcessor processor;
    private final NotificationSink sink;

    private PortfolioEngine(
            PortfolioStore store,
            CapacityManager capacity,
            HistoryAggregator history,
            PositionLedger ledger,
            ThresholdPolicy thresholds,
            ScoringGate gate,
            DecisionProcessor processor,
            NotificationSink sink
    ) {
        this.store = store;
        this.capacity = capacity;
        this.history = history;
        this.ledger = ledger;
        this.thresholds = thresholds;
        this.gate = gate;
        this.processor = processor;
        this.sink = sink;
    }

    public static PortfolioEngine create(Config config, PortfolioStore store, NotificationSink sink) throws SQLException {
        HoldingBook book = HoldingBook.load(store);
        CapacityManager capacity = CapacityManager.fromConfig(config, book);
        HistoryAggregator history = new HistoryAggregator(store);
        PositionLedger ledger = new PositionLedger(store, book, capacity, history);
        ScoringGate gate = new ScoringGate(store, capacity, book);
        DecisionProcessor processor = new DecisionProcessor(
                ledger, store, new JudgmentParser(), ExitRuleBook.fromConfig(config), sink);
        LOG.info("engine ready open={} capacity={} max_per_sector={}",
                book.openCount(), capacity.capacity(), capacity.maxPerSector());
        return new PortfolioEngine(store, capacity, history, ledger, ThresholdPolicy.fromConfig(config),
                gate, processor, sink);
    }

    public PortfolioStore store() {
        return store;
    }

    public CapacityManager capacity() {
        return capacity;
    }

    public HistoryAggregator history() {
        return history;
    }

    public PositionLedger ledger() {
        return ledger;
    }

    public ThresholdPolicy thresholds() {
        return thresholds;
    }

    public ScoringGate gate() {
        return gate;
    }

    public DecisionProcessor processor() {
        return processor;
    }

    public NotificationSink sink() {
        return sink;
    }
}

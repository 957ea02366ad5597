package com.stocktracker.kr.gate;

import com.stocktracker.core.diagnostics.CauseCode;
import com.stocktracker.core.diagnostics.PortfolioException;
import com.stocktracker.kr.capacity.CapacityManager;
import com.stocktracker.kr.capacity.OpenPositions;
import com.stocktracker.kr.model.Cycle;
import com.stocktracker.kr.model.EntryDecision;
import com.stocktracker.kr.model.Position;
import com.stocktracker.kr.model.ScreeningRequest;
import com.stocktracker.kr.model.WatchlistCandidate;
import com.stocktracker.kr.store.PortfolioStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Admits or skips screened symbols. Every well-formed request leaves exactly one
 * {@link WatchlistCandidate} in the store; the ledger re-checks capacity when it opens.
 */
public final class ScoringGate {
    private static final Logger LOG = LogManager.getLogger(ScoringGate.class);

    private final PortfolioStore store;
    private final CapacityManager capacity;
    private final OpenPositions openPositions;

    public ScoringGate(PortfolioStore store, CapacityManager capacity, OpenPositions openPositions) {
        this.store = store;
        this.capacity = capacity;
        this.openPositions = openPositions;
    }

    public WatchlistCandidate evaluate(ScreeningRequest request, double threshold, Cycle cycle) throws SQLException {
        String cycleId = cycle == null ? "" : cycle.id;
        validate(request, threshold, cycleId);

        List<String> shortfalls = new ArrayList<>();
        if (request.buyScore < threshold) {
            shortfalls.add(String.format(Locale.US, "score %.1f below threshold %.1f", request.buyScore, threshold));
        }
        if (request.analystDecision != EntryDecision.ENTER) {
            shortfalls.add("analyst decision is watch");
        }
        if (isHeld(request.ticker)) {
            shortfalls.add("already held");
        }
        if (!capacity.hasFreeSlot()) {
            shortfalls.add("no free slot (" + capacity.openCount() + "/" + capacity.capacity() + ")");
        }
        if (!capacity.sectorHasRoom(request.sector)) {
            shortfalls.add("sector " + request.sector + " full (" + capacity.sectorCount(request.sector)
                    + "/" + capacity.maxPerSector() + ")");
        }

        EntryDecision decision = shortfalls.isEmpty() ? EntryDecision.ENTER : EntryDecision.SKIP;
        String rationale = shortfalls.isEmpty()
                ? nonNull(request.rationale)
                : String.join("; ", shortfalls);

        WatchlistCandidate candidate = WatchlistCandidate.builder()
                .ticker(request.ticker.trim())
                .companyName(nonNull(request.companyName))
                .sector(nonNull(request.sector))
                .analyzedAt(request.analyzedAt == null ? Instant.now() : request.analyzedAt)
                .buyScore(request.buyScore)
                .minScoreThreshold(threshold)
                .decision(decision)
                .rationale(rationale)
                .quotedPrice(request.quotedPrice)
                .cycleId(cycleId)
                .build();
        store.saveCandidate(candidate);
        LOG.info("gate ticker={} cycle={} score={} threshold={} decision={} rationale={}",
                candidate.ticker, cycleId, request.buyScore, threshold, decision, rationale);
        return candidate;
    }

    private boolean isHeld(String ticker) {
        String wanted = ticker.trim();
        for (Position position : openPositions.openPositions()) {
            if (position.ticker.equals(wanted)) {
                return true;
            }
        }
        return false;
    }

    private static void validate(ScreeningRequest request, double threshold, String cycleId) {
        if (request == null || request.ticker == null || request.ticker.trim().isEmpty()) {
            throw new PortfolioException(CauseCode.INVALID_CANDIDATE, "", cycleId, "screening request has no ticker");
        }
        String ticker = request.ticker.trim();
        if (!Double.isFinite(request.buyScore) || request.buyScore < 0.0 || request.buyScore > 10.0) {
            throw new PortfolioException(CauseCode.INVALID_CANDIDATE, ticker, cycleId,
                    "buy score must be within [0,10]: " + request.buyScore);
        }
        if (!Double.isFinite(threshold)) {
            throw new PortfolioException(CauseCode.INVALID_CANDIDATE, ticker, cycleId, "threshold must be finite");
        }
        if (!Double.isFinite(request.quotedPrice) || request.quotedPrice <= 0.0) {
            throw new PortfolioException(CauseCode.INVALID_CANDIDATE, ticker, cycleId,
                    "quoted price must be positive: " + request.quotedPrice);
        }
    }

    private static String nonNull(String value) {
        return value == null ? "" : value;
    }
}

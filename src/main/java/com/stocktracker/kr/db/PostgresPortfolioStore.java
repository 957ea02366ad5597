package com.stocktracker.kr.db;

import com.stocktracker.kr.db.mybatis.CandidateMapper;
import com.stocktracker.kr.db.mybatis.CandidateRow;
import com.stocktracker.kr.db.mybatis.ClosedTradeMapper;
import com.stocktracker.kr.db.mybatis.ClosedTradeRow;
import com.stocktracker.kr.db.mybatis.DecisionMapper;
import com.stocktracker.kr.db.mybatis.DecisionRow;
import com.stocktracker.kr.db.mybatis.HoldingMapper;
import com.stocktracker.kr.db.mybatis.HoldingRow;
import com.stocktracker.kr.db.mybatis.MyBatisSupport;
import com.stocktracker.kr.model.AdjustmentUrgency;
import com.stocktracker.kr.model.ClosedTrade;
import com.stocktracker.kr.model.DailyDecision;
import com.stocktracker.kr.model.EntryDecision;
import com.stocktracker.kr.model.Position;
import com.stocktracker.kr.model.ScenarioJson;
import com.stocktracker.kr.model.SellSignal;
import com.stocktracker.kr.model.TradeOutcome;
import com.stocktracker.kr.model.WatchlistCandidate;
import com.stocktracker.kr.store.PortfolioStore;
import org.apache.ibatis.session.SqlSession;
import org.json.JSONObject;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.StringJoiner;

/**
 * {@link PortfolioStore} over the PostgreSQL schema written by {@link MigrationRunner}. Each
 * mutating call runs in its own transaction.
 */
public final class PostgresPortfolioStore implements PortfolioStore {
    private final Database database;

    public PostgresPortfolioStore(Database database) {
        this.database = database;
    }

    @Override
    public List<Position> loadOpenPositions() throws SQLException {
        List<Position> out = new ArrayList<>();
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            for (HoldingRow row : session.getMapper(HoldingMapper.class).selectAll()) {
                out.add(toPosition(row));
            }
        }
        return out;
    }

    @Override
    public void insertPosition(Position position) throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            conn.setAutoCommit(false);
            session.getMapper(HoldingMapper.class).insert(toRow(position));
            conn.commit();
        }
    }

    @Override
    public void updatePosition(Position position) throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            conn.setAutoCommit(false);
            int updated = session.getMapper(HoldingMapper.class).update(toRow(position));
            if (updated != 1) {
                conn.rollback();
                throw new SQLException("holding not found: " + position.ticker);
            }
            conn.commit();
        }
    }

    @Override
    public boolean updatePosition(Position position, DailyDecision decision) throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            conn.setAutoCommit(false);
            try {
                if (session.getMapper(DecisionMapper.class).insertIfAbsent(toRow(decision)) != 1) {
                    conn.rollback();
                    return false;
                }
                if (session.getMapper(HoldingMapper.class).update(toRow(position)) != 1) {
                    throw new SQLException("holding not found: " + position.ticker);
                }
                conn.commit();
                return true;
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            }
        }
    }

    @Override
    public boolean recordClosedTrade(ClosedTrade trade, DailyDecision decision) throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            conn.setAutoCommit(false);
            try {
                if (session.getMapper(DecisionMapper.class).insertIfAbsent(toRow(decision)) != 1) {
                    conn.rollback();
                    return false;
                }
                session.getMapper(ClosedTradeMapper.class).insert(toRow(trade));
                session.getMapper(HoldingMapper.class).delete(trade.ticker);
                conn.commit();
                return true;
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            }
        }
    }

    @Override
    public void recordClosedTrade(ClosedTrade trade) throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            conn.setAutoCommit(false);
            try {
                session.getMapper(ClosedTradeMapper.class).insert(toRow(trade));
                session.getMapper(HoldingMapper.class).delete(trade.ticker);
                conn.commit();
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            }
        }
    }

    @Override
    public List<ClosedTrade> loadClosedTrades() throws SQLException {
        List<ClosedTrade> out = new ArrayList<>();
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            for (ClosedTradeRow row : session.getMapper(ClosedTradeMapper.class).selectAll()) {
                out.add(toTrade(row));
            }
        }
        return out;
    }

    @Override
    public boolean appendDecision(DailyDecision decision) throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            conn.setAutoCommit(false);
            int inserted = session.getMapper(DecisionMapper.class).insertIfAbsent(toRow(decision));
            conn.commit();
            return inserted == 1;
        }
    }

    @Override
    public boolean hasDecision(String ticker, String cycleId) throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            return session.getMapper(DecisionMapper.class).count(ticker, cycleId) > 0;
        }
    }

    @Override
    public List<DailyDecision> loadDecisions(String ticker) throws SQLException {
        List<DailyDecision> out = new ArrayList<>();
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            for (DecisionRow row : session.getMapper(DecisionMapper.class).selectByTicker(ticker)) {
                out.add(toDecision(row));
            }
        }
        return out;
    }

    @Override
    public void saveCandidate(WatchlistCandidate candidate) throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            conn.setAutoCommit(false);
            session.getMapper(CandidateMapper.class).insert(toRow(candidate));
            conn.commit();
        }
    }

    @Override
    public List<WatchlistCandidate> loadCandidates(String cycleId) throws SQLException {
        List<WatchlistCandidate> out = new ArrayList<>();
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            CandidateMapper mapper = session.getMapper(CandidateMapper.class);
            List<CandidateRow> rows = cycleId == null ? mapper.selectAll() : mapper.selectByCycle(cycleId);
            for (CandidateRow row : rows) {
                out.add(toCandidate(row));
            }
        }
        return out;
    }

    static HoldingRow toRow(Position position) {
        return HoldingRow.builder()
                .ticker(position.ticker)
                .companyName(position.companyName)
                .sector(position.sector)
                .buyPrice(position.buyPrice)
                .buyDate(position.buyDate)
                .currentPrice(position.currentPrice)
                .targetPrice(position.targetPrice())
                .stopLoss(position.stopLoss())
                .investmentHorizon(position.investmentHorizon().name())
                .scenarioJson(ScenarioJson.toJson(position.scenario))
                .updatedAt(OffsetDateTime.now(ZoneOffset.UTC))
                .build();
    }

    static Position toPosition(HoldingRow row) {
        return Position.builder()
                .ticker(row.getTicker())
                .companyName(row.getCompanyName())
                .sector(row.getSector())
                .buyPrice(row.getBuyPrice())
                .buyDate(row.getBuyDate())
                .currentPrice(row.getCurrentPrice())
                .scenario(ScenarioJson.fromJson(row.getScenarioJson()))
                .build();
    }

    static ClosedTradeRow toRow(ClosedTrade trade) {
        return ClosedTradeRow.builder()
                .ticker(trade.ticker)
                .companyName(trade.companyName)
                .sector(trade.sector)
                .buyPrice(trade.buyPrice)
                .sellPrice(trade.sellPrice)
                .buyDate(trade.buyDate)
                .sellDate(trade.sellDate)
                .holdingDays(trade.holdingDays)
                .profitRate(trade.profitRatePercent)
                .outcome(trade.outcome.name())
                .sellReason(trade.sellReason)
                .cycleId(trade.cycleId)
                .build();
    }

    static ClosedTrade toTrade(ClosedTradeRow row) {
        return ClosedTrade.builder()
                .ticker(row.getTicker())
                .companyName(row.getCompanyName())
                .sector(row.getSector())
                .buyPrice(row.getBuyPrice())
                .sellPrice(row.getSellPrice())
                .buyDate(row.getBuyDate())
                .sellDate(row.getSellDate())
                .holdingDays(row.getHoldingDays())
                .profitRatePercent(row.getProfitRate())
                .outcome(TradeOutcome.valueOf(row.getOutcome()))
                .sellReason(row.getSellReason())
                .cycleId(row.getCycleId())
                .build();
    }

    static DecisionRow toRow(DailyDecision decision) {
        StringJoiner signals = new StringJoiner(",");
        if (decision.sellSignals != null) {
            for (SellSignal signal : SellSignal.values()) {
                if (decision.sellSignals.contains(signal)) {
                    signals.add(signal.name());
                }
            }
        }
        return DecisionRow.builder()
                .ticker(decision.ticker)
                .cycleId(decision.cycleId)
                .decidedAt(OffsetDateTime.ofInstant(
                        decision.decidedAt == null ? Instant.now() : decision.decidedAt, ZoneOffset.UTC))
                .confidence(decision.confidence)
                .technicalTrend(decision.technicalTrend)
                .volumeAnalysis(decision.volumeAnalysis)
                .marketConditionImpact(decision.marketConditionImpact)
                .timeFactor(decision.timeFactor)
                .portfolioAdjustmentNeeded(decision.portfolioAdjustmentNeeded)
                .adjustmentUrgency(decision.adjustmentUrgency == null
                        ? AdjustmentUrgency.LOW.name()
                        : decision.adjustmentUrgency.name())
                .newTargetPrice(decision.newTargetPrice)
                .newStopLoss(decision.newStopLoss)
                .sellSignals(signals.toString())
                .sellReason(decision.sellReason)
                .extrasJson(new JSONObject(decision.extras == null ? Map.of() : decision.extras).toString())
                .build();
    }

    static DailyDecision toDecision(DecisionRow row) {
        Set<SellSignal> signals = EnumSet.noneOf(SellSignal.class);
        String rawSignals = row.getSellSignals() == null ? "" : row.getSellSignals();
        for (String token : rawSignals.split(",")) {
            SellSignal.parse(token).ifPresent(signals::add);
        }
        Map<String, String> extras = new LinkedHashMap<>();
        JSONObject json = new JSONObject(row.getExtrasJson() == null ? "{}" : row.getExtrasJson());
        for (String key : json.keySet()) {
            extras.put(key, json.optString(key, ""));
        }
        return DailyDecision.builder()
                .ticker(row.getTicker())
                .cycleId(row.getCycleId())
                .decidedAt(row.getDecidedAt() == null ? null : row.getDecidedAt().toInstant())
                .confidence(row.getConfidence() == null ? 0 : row.getConfidence())
                .technicalTrend(row.getTechnicalTrend())
                .volumeAnalysis(row.getVolumeAnalysis())
                .marketConditionImpact(row.getMarketConditionImpact())
                .timeFactor(row.getTimeFactor())
                .portfolioAdjustmentNeeded(Boolean.TRUE.equals(row.getPortfolioAdjustmentNeeded()))
                .adjustmentUrgency(AdjustmentUrgency.parse(row.getAdjustmentUrgency()).orElse(AdjustmentUrgency.LOW))
                .newTargetPrice(row.getNewTargetPrice())
                .newStopLoss(row.getNewStopLoss())
                .sellSignals(Set.copyOf(signals))
                .sellReason(row.getSellReason())
                .extras(Map.copyOf(extras))
                .build();
    }

    static CandidateRow toRow(WatchlistCandidate candidate) {
        return CandidateRow.builder()
                .ticker(candidate.ticker)
                .companyName(candidate.companyName)
                .sector(candidate.sector)
                .analyzedAt(candidate.analyzedAt == null ? null : OffsetDateTime.ofInstant(candidate.analyzedAt, ZoneOffset.UTC))
                .buyScore(candidate.buyScore)
                .minScoreThreshold(candidate.minScoreThreshold)
                .decision(candidate.decision.name())
                .rationale(candidate.rationale)
                .quotedPrice(candidate.quotedPrice)
                .cycleId(candidate.cycleId)
                .build();
    }

    static WatchlistCandidate toCandidate(CandidateRow row) {
        return WatchlistCandidate.builder()
                .ticker(row.getTicker())
                .companyName(row.getCompanyName())
                .sector(row.getSector())
                .analyzedAt(row.getAnalyzedAt() == null ? null : row.getAnalyzedAt().toInstant())
                .buyScore(row.getBuyScore())
                .minScoreThreshold(row.getMinScoreThreshold())
                .decision(EntryDecision.valueOf(row.getDecision()))
                .rationale(row.getRationale())
                .quotedPrice(row.getQuotedPrice())
                .cycleId(row.getCycleId())
                .build();
    }
}

package com.stocktracker.kr.db.mybatis;

import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.util.List;

public interface DecisionMapper {
    /**
     * @return 0 when a row for the same (ticker, cycle_id) already exists
     */
    @Insert("INSERT INTO daily_decisions(ticker, cycle_id, decided_at, confidence, technical_trend, volume_analysis, " +
            "market_condition_impact, time_factor, portfolio_adjustment_needed, adjustment_urgency, new_target_price, " +
            "new_stop_loss, sell_signals, sell_reason, extras_json) " +
            "VALUES(#{ticker}, #{cycleId}, #{decidedAt}, #{confidence}, #{technicalTrend}, #{volumeAnalysis}, " +
            "#{marketConditionImpact}, #{timeFactor}, #{portfolioAdjustmentNeeded}, #{adjustmentUrgency}, " +
            "#{newTargetPrice}, #{newStopLoss}, #{sellSignals}, #{sellReason}, #{extrasJson}) " +
            "ON CONFLICT (ticker, cycle_id) DO NOTHING")
    int insertIfAbsent(DecisionRow row);

    @Select("SELECT COUNT(*) FROM daily_decisions WHERE ticker=#{ticker} AND cycle_id=#{cycleId}")
    int count(@Param("ticker") String ticker, @Param("cycleId") String cycleId);

    @Select("SELECT id, ticker, cycle_id, decided_at, confidence, technical_trend, volume_analysis, market_condition_impact, " +
            "time_factor, portfolio_adjustment_needed, adjustment_urgency, new_target_price, new_stop_loss, sell_signals, " +
            "sell_reason, extras_json FROM daily_decisions WHERE ticker=#{ticker} ORDER BY id")
    List<DecisionRow> selectByTicker(@Param("ticker") String ticker);
}

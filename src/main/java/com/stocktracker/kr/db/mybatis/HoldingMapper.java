package com.stocktracker.kr.db.mybatis;

import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

import java.util.List;

public interface HoldingMapper {
    @Select("SELECT ticker, company_name, sector, buy_price, buy_date, current_price, target_price, stop_loss, " +
            "investment_horizon, scenario_json, updated_at FROM holdings ORDER BY ticker")
    List<HoldingRow> selectAll();

    @Insert("INSERT INTO holdings(ticker, company_name, sector, buy_price, buy_date, current_price, target_price, " +
            "stop_loss, investment_horizon, scenario_json, updated_at) " +
            "VALUES(#{ticker}, #{companyName}, #{sector}, #{buyPrice}, #{buyDate}, #{currentPrice}, #{targetPrice}, " +
            "#{stopLoss}, #{investmentHorizon}, #{scenarioJson}, #{updatedAt})")
    int insert(HoldingRow row);

    @Update("UPDATE holdings SET current_price=#{currentPrice}, target_price=#{targetPrice}, stop_loss=#{stopLoss}, " +
            "investment_horizon=#{investmentHorizon}, scenario_json=#{scenarioJson}, updated_at=#{updatedAt} " +
            "WHERE ticker=#{ticker}")
    int update(HoldingRow row);

    @Delete("DELETE FROM holdings WHERE ticker=#{ticker}")
    int delete(@Param("ticker") String ticker);
}

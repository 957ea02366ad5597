package com.stocktracker.kr.db.mybatis;

import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Options;
import org.apache.ibatis.annotations.Select;

import java.util.List;

public interface ClosedTradeMapper {
    @Insert("INSERT INTO closed_trades(ticker, company_name, sector, buy_price, sell_price, buy_date, sell_date, " +
            "holding_days, profit_rate, outcome, sell_reason, cycle_id) " +
            "VALUES(#{ticker}, #{companyName}, #{sector}, #{buyPrice}, #{sellPrice}, #{buyDate}, #{sellDate}, " +
            "#{holdingDays}, #{profitRate}, #{outcome}, #{sellReason}, #{cycleId})")
    @Options(useGeneratedKeys = true, keyProperty = "id", keyColumn = "id")
    int insert(ClosedTradeRow row);

    @Select("SELECT id, ticker, company_name, sector, buy_price, sell_price, buy_date, sell_date, holding_days, " +
            "profit_rate, outcome, sell_reason, cycle_id FROM closed_trades ORDER BY id")
    List<ClosedTradeRow> selectAll();
}

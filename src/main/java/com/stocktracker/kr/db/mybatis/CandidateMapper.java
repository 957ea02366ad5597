package com.stocktracker.kr.db.mybatis;

import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Options;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.util.List;

public interface CandidateMapper {
    @Insert("INSERT INTO watchlist_candidates(ticker, company_name, sector, analyzed_at, buy_score, min_score_threshold, " +
            "decision, rationale, quoted_price, cycle_id) " +
            "VALUES(#{ticker}, #{companyName}, #{sector}, #{analyzedAt}, #{buyScore}, #{minScoreThreshold}, " +
            "#{decision}, #{rationale}, #{quotedPrice}, #{cycleId})")
    @Options(useGeneratedKeys = true, keyProperty = "id", keyColumn = "id")
    int insert(CandidateRow row);

    @Select("SELECT id, ticker, company_name, sector, analyzed_at, buy_score, min_score_threshold, decision, rationale, " +
            "quoted_price, cycle_id FROM watchlist_candidates WHERE cycle_id=#{cycleId} ORDER BY id")
    List<CandidateRow> selectByCycle(@Param("cycleId") String cycleId);

    @Select("SELECT id, ticker, company_name, sector, analyzed_at, buy_score, min_score_threshold, decision, rationale, " +
            "quoted_price, cycle_id FROM watchlist_candidates ORDER BY id")
    List<CandidateRow> selectAll();
}

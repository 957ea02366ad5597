package com.stocktracker.kr.model;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.assertEquals;

class TradeOutcomeTest {

    @Test
    void classify_shouldSplitOnSign() {
        assertEquals(TradeOutcome.WIN, TradeOutcome.classify(0.01));
        assertEquals(TradeOutcome.LOSS, TradeOutcome.classify(-5.0));
        assertEquals(TradeOutcome.BREAK_EVEN, TradeOutcome.classify(0.0));
    }

    @Test
    void textParsers_shouldAcceptAnalystWording() {
        assertEquals(EntryDecision.ENTER, EntryDecision.fromText("진입"));
        assertEquals(EntryDecision.SKIP, EntryDecision.fromText("관망"));
        assertEquals(InvestmentHorizon.LONG, InvestmentHorizon.fromText("장기"));
        assertEquals(InvestmentHorizon.MID, InvestmentHorizon.fromText("someday"));
        assertEquals(MarketCondition.BEAR, MarketCondition.fromText(" bear "));
        assertEquals(MarketCondition.NEUTRAL, MarketCondition.fromText(null));
        assertEquals(AdjustmentUrgency.HIGH, AdjustmentUrgency.parse("높음").orElseThrow());
    }

    @Test
    void cycleOf_shouldBuildSessionId() {
        Cycle cycle = Cycle.of(LocalDate.of(2026, 10, 19), "am");

        assertEquals("2026-10-19-AM", cycle.id);
        assertEquals(LocalDate.of(2026, 10, 19), cycle.date);
    }
}

package com.stocktracker.kr.feed;

import com.stocktracker.kr.model.Cycle;
import com.stocktracker.kr.model.Position;

import java.io.IOException;

/**
 * Source of the raw judgment payload for one open position in one cycle. Calls may block.
 */
public interface JudgmentProducer {
    String produce(Position position, Cycle cycle) throws IOException;
}

package com.stocktracker.kr.decision;

import com.stocktracker.kr.model.ClosedTrade;
import com.stocktracker.kr.model.DailyDecision;
import com.stocktracker.kr.model.Position;

import java.util.List;

/**
 * What one decision did to one position. {@code position} is null once the position is closed;
 * {@code trade} is only set on close.
 */
public record Transition(
        String ticker,
        String cycleId,
        List<PositionState> path,
        DailyDecision decision,
        Position position,
        ClosedTrade trade,
        String note
) {
    public Transition {
        path = List.copyOf(path);
        note = note == null ? "" : note;
    }

    public PositionState finalState() {
        return path.get(path.size() - 1);
    }

    public boolean closed() {
        return trade != null;
    }

    public boolean revised() {
        return path.contains(PositionState.PENDING_REVISION);
    }
}

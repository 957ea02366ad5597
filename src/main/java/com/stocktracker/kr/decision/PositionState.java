package com.stocktracker.kr.decision;

public enum PositionState {
    HOLDING,
    PENDING_REVISION,
    CLOSING
}

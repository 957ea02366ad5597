package com.stocktracker.kr.ledger;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One mutex per ticker so that transitions for the same symbol never interleave.
 */
final class TickerLocks {
    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    ReentrantLock forTicker(String ticker) {
        return locks.computeIfAbsent(ticker, ignored -> new ReentrantLock());
    }
}

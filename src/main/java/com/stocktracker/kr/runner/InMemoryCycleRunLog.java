package com.stocktracker.kr.runner;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

public final class InMemoryCycleRunLog implements CycleRunLog {
    private final List<Entry> entries = new ArrayList<>();

    @Override
    public synchronized long start(String cycleId, String trigger) {
        Entry entry = new Entry(entries.size() + 1L, cycleId, trigger, Instant.now());
        entries.add(entry);
        return entry.runId;
    }

    @Override
    public synchronized void finish(long runId, String status, String summary, String error) {
        for (Entry entry : entries) {
            if (entry.runId == runId) {
                entry.status = status;
                entry.summary = summary;
                entry.error = error;
                entry.finishedAt = Instant.now();
                return;
            }
        }
        throw new IllegalArgumentException("unknown run id: " + runId);
    }

    public synchronized List<Entry> entries() {
        return List.copyOf(entries);
    }

    public static final class Entry {
        public final long runId;
        public final String cycleId;
        public final String trigger;
        public final Instant startedAt;
        private String status = "RUNNING";
        private String summary = "";
        private String error = "";
        private Instant finishedAt;

        private Entry(long runId, String cycleId, String trigger, Instant startedAt) {
            this.runId = runId;
            this.cycleId = cycleId;
            this.trigger = trigger;
            this.startedAt = startedAt;
        }

        public synchronized String status() {
            return status;
        }

        public synchronized String summary() {
            return summary;
        }

        public synchronized String error() {
            return error;
        }

        public synchronized Instant finishedAt() {
            return finishedAt;
        }
    }
}

package com.stocktracker.kr.model;

import java.time.LocalDate;
import java.util.Locale;
import java.util.Objects;

/**
 * One scheduled evaluation pass. The id keys decision idempotence; the date drives holding-day math.
 */
public final class Cycle {
    public final String id;
    public final LocalDate date;

    public Cycle(String id, LocalDate date) {
        if (id == null || id.trim().isEmpty()) {
            throw new IllegalArgumentException("cycle id must not be empty");
        }
        this.id = id.trim();
        this.date = Objects.requireNonNull(date, "cycle date");
    }

    /**
     * Cycle for a trading session on a date, e.g. {@code 2026-10-19-AM}.
     */
    public static Cycle of(LocalDate date, String session) {
        String label = session == null || session.trim().isEmpty() ? "RUN" : session.trim().toUpperCase(Locale.ROOT);
        return new Cycle(date + "-" + label, date);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Cycle)) {
            return false;
        }
        Cycle other = (Cycle) o;
        return id.equals(other.id) && date.equals(other.date);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, date);
    }

    @Override
    public String toString() {
        return id;
    }
}

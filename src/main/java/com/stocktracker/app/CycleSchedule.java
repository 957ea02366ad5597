package com.stocktracker.app;

import com.stocktracker.kr.model.Cycle;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Run times of the trading day and the cycle ids derived from them.
 */
final class CycleSchedule {
    private static final DateTimeFormatter SCHEDULE_TIME_FMT = DateTimeFormatter.ofPattern("H:mm");
    private static final DateTimeFormatter SESSION_FMT = DateTimeFormatter.ofPattern("HHmm");

    private final List<LocalTime> runTimes;

    private CycleSchedule(List<LocalTime> runTimes) {
        this.runTimes = runTimes;
    }

    static CycleSchedule parse(String value) {
        return new CycleSchedule(parseTimes(value));
    }

    boolean isEmpty() {
        return runTimes.isEmpty();
    }

    List<LocalTime> runTimes() {
        return runTimes;
    }

    ZonedDateTime nextRunTime(ZonedDateTime now) {
        for (LocalTime t : runTimes) {
            ZonedDateTime candidate = now.toLocalDate().atTime(t).atZone(now.getZone());
            if (candidate.isAfter(now)) {
                return candidate;
            }
        }
        return now.toLocalDate().plusDays(1).atTime(runTimes.get(0)).atZone(now.getZone());
    }

    /**
     * Cycle for a scheduled slot, e.g. {@code 2026-10-19-0930}.
     */
    static Cycle cycleAt(ZonedDateTime slot) {
        return Cycle.of(slot.toLocalDate(), slot.toLocalTime().format(SESSION_FMT));
    }

    /**
     * Cycle for an explicit id. A leading {@code yyyy-MM-dd} sets the cycle date; otherwise today is used.
     */
    static Cycle cycleFor(String id, LocalDate today) {
        String trimmed = id == null ? "" : id.trim();
        if (trimmed.isEmpty()) {
            return Cycle.of(today, "MANUAL");
        }
        LocalDate date = today;
        if (trimmed.length() >= 10) {
            try {
                date = LocalDate.parse(trimmed.substring(0, 10));
            } catch (DateTimeParseException ignored) {
                date = today;
            }
        }
        return new Cycle(trimmed, date);
    }

    String format() {
        return runTimes.stream()
                .map(t -> t.format(DateTimeFormatter.ofPattern("HH:mm")))
                .collect(Collectors.joining(","));
    }

    static boolean sleepUntil(ZonedDateTime next) {
        while (true) {
            long millis = Duration.between(ZonedDateTime.now(next.getZone()), next).toMillis();
            if (millis <= 0) {
                return true;
            }
            long chunk = Math.min(30_000L, millis);
            try {
                Thread.sleep(chunk);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
    }

    private static LocalTime parseTime(String value) {
        try {
            return LocalTime.parse(value, SCHEDULE_TIME_FMT);
        } catch (DateTimeParseException ignored) {
            return null;
        }
    }

    private static List<LocalTime> parseTimes(String value) {
        if (value == null || value.trim().isEmpty()) {
            return List.of();
        }
        List<LocalTime> out = new ArrayList<>();
        for (String token : value.split(",")) {
            LocalTime parsed = parseTime(token.trim());
            if (parsed != null && !out.contains(parsed)) {
                out.add(parsed);
            }
        }
        Collections.sort(out);
        return List.copyOf(out);
    }
}

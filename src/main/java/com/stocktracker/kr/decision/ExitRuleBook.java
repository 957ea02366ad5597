package com.stocktracker.kr.decision;

import com.stocktracker.kr.config.Config;
import com.stocktracker.kr.model.InvestmentHorizon;
import com.stocktracker.kr.model.Position;

import java.time.LocalDate;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Holding-period exits checked after the explicit stop/target levels. A firing rule closes the
 * position at the current price.
 *
 * <p>Every rule is time-gated and is suspended while the judgment reports an uptrend, so a fresh
 * hold between stop and target never closes here. Price-only exits belong to the scenario levels.
 */
public final class ExitRuleBook {
    private static final Pattern NUMERIC = Pattern.compile("[-+]?\\d+(\\.\\d+)?");

    static final int STRONG_UP = 2;
    static final int WEAK_UP = 1;

    private final boolean enabled;

    public ExitRuleBook(boolean enabled) {
        this.enabled = enabled;
    }

    public static ExitRuleBook fromConfig(Config config) {
        return new ExitRuleBook(config.getBoolean("exit.rules.enabled", false));
    }

    public boolean enabled() {
        return enabled;
    }

    /**
     * @param trend judgment trend on the -2..2 scale, see {@link #trendScore(String)}
     * @return the exit reason when a rule fires, empty to keep holding
     */
    public Optional<String> evaluate(Position position, double price, LocalDate asOf, int trend) {
        if (!enabled || position == null || !(position.buyPrice > 0.0) || !(price > 0.0)) {
            return Optional.empty();
        }
        int days = position.holdingDays(asOf);
        double rate = (price - position.buyPrice) / position.buyPrice * 100.0;
        InvestmentHorizon horizon = position.investmentHorizon();

        if (horizon == InvestmentHorizon.SHORT && trend < STRONG_UP) {
            if (days >= 15 && rate >= 5.0) {
                return reason("short horizon goal reached", days, rate);
            }
            if (days >= 10 && rate <= -3.0) {
                return reason("short horizon loss guard", days, rate);
            }
        }
        if (trend >= WEAK_UP) {
            return Optional.empty();
        }
        if (days >= 30 && rate < 0.0) {
            return reason("held 30+ days at a loss", days, rate);
        }
        if (days >= 60 && rate >= 3.0) {
            return reason("held 60+ days with 3%+ profit", days, rate);
        }
        if (horizon == InvestmentHorizon.LONG && days >= 90 && rate < 0.0) {
            return reason("long horizon loss cleanup", days, rate);
        }
        return Optional.empty();
    }

    /**
     * Maps the judgment's free-text trend to -2 (strong downtrend) .. 2 (strong uptrend). Unknown or
     * empty text is neutral.
     */
    public static int trendScore(String text) {
        if (text == null) {
            return 0;
        }
        String t = text.trim().toLowerCase(Locale.ROOT);
        if (t.isEmpty()) {
            return 0;
        }
        if (NUMERIC.matcher(t).matches()) {
            int value = (int) Math.round(Double.parseDouble(t));
            return Math.max(-2, Math.min(2, value));
        }
        boolean strong = t.contains("strong") || t.contains("강한");
        if (t.contains("down") || t.contains("bear") || t.contains("하락")) {
            return strong ? -2 : -1;
        }
        if (t.contains("up") || t.contains("bull") || t.contains("상승")) {
            return strong ? 2 : 1;
        }
        return 0;
    }

    private static Optional<String> reason(String rule, int days, double rate) {
        return Optional.of(String.format(Locale.US, "%s (days=%d, profit_rate=%.2f%%)", rule, days, rate));
    }
}

package com.stocktracker.kr.decision;

import com.stocktracker.core.diagnostics.CauseCode;
import com.stocktracker.core.diagnostics.PortfolioException;
import com.stocktracker.kr.model.AdjustmentUrgency;
import com.stocktracker.kr.model.Cycle;
import com.stocktracker.kr.model.DailyDecision;
import com.stocktracker.kr.model.SellSignal;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.time.Instant;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Turns a raw judgment payload into a {@link DailyDecision}.
 *
 * <p>Fields that drive the state machine are checked strictly: {@code confidence} (1-10),
 * {@code portfolio_adjustment_needed}, {@code adjustment_urgency}, {@code new_target_price},
 * {@code new_stop_loss} and {@code sell_signals}. Any other key is kept as text in the extras bag.
 */
public final class JudgmentParser {
    private static final Set<String> KNOWN_KEYS = Set.of(
            "confidence",
            "technical_trend",
            "volume_analysis",
            "market_condition_impact",
            "time_factor",
            "portfolio_adjustment_needed",
            "adjustment_urgency",
            "new_target_price",
            "new_stop_loss",
            "sell_signals",
            "should_sell",
            "sell_reason"
    );

    public DailyDecision parse(String raw, String ticker, Cycle cycle) {
        String cycleId = cycle == null ? "" : cycle.id;
        if (raw == null || raw.trim().isEmpty()) {
            throw malformed(ticker, cycleId, "judgment payload is empty", null);
        }
        JSONObject json;
        try {
            json = new JSONObject(stripFence(raw));
        } catch (JSONException e) {
            throw malformed(ticker, cycleId, "judgment payload is not a JSON object: " + e.getMessage(), e);
        }

        int confidence = requireConfidence(json, ticker, cycleId);
        boolean adjustmentNeeded = flag(json, "portfolio_adjustment_needed", ticker, cycleId);
        Double newTarget = optionalLevel(json, "new_target_price", ticker, cycleId);
        Double newStop = optionalLevel(json, "new_stop_loss", ticker, cycleId);

        AdjustmentUrgency urgency = AdjustmentUrgency.LOW;
        String urgencyText = json.optString("adjustment_urgency", "").trim();
        if (!urgencyText.isEmpty()) {
            Optional<AdjustmentUrgency> parsed = AdjustmentUrgency.parse(urgencyText);
            if (parsed.isEmpty()) {
                throw malformed(ticker, cycleId, "unknown adjustment_urgency: " + urgencyText, null);
            }
            urgency = parsed.get();
        }

        Set<SellSignal> signals = sellSignals(json, ticker, cycleId);
        if (json.has("should_sell") && flag(json, "should_sell", ticker, cycleId) && signals.isEmpty()) {
            signals.add(SellSignal.SELL_TRIGGER);
        }

        Map<String, String> extras = new LinkedHashMap<>();
        for (String key : json.keySet()) {
            if (!KNOWN_KEYS.contains(key)) {
                Object value = json.opt(key);
                extras.put(key, value == null || JSONObject.NULL.equals(value) ? "" : value.toString());
            }
        }

        return DailyDecision.builder()
                .ticker(ticker)
                .cycleId(cycleId)
                .decidedAt(Instant.now())
                .confidence(confidence)
                .technicalTrend(json.optString("technical_trend", ""))
                .volumeAnalysis(json.optString("volume_analysis", ""))
                .marketConditionImpact(json.optString("market_condition_impact", ""))
                .timeFactor(json.optString("time_factor", ""))
                .portfolioAdjustmentNeeded(adjustmentNeeded)
                .adjustmentUrgency(urgency)
                .newTargetPrice(newTarget)
                .newStopLoss(newStop)
                .sellSignals(Set.copyOf(signals))
                .sellReason(json.optString("sell_reason", ""))
                .extras(Map.copyOf(extras))
                .build();
    }

    private static int requireConfidence(JSONObject json, String ticker, String cycleId) {
        if (!json.has("confidence")) {
            throw malformed(ticker, cycleId, "confidence is missing", null);
        }
        double value = json.optDouble("confidence", Double.NaN);
        if (!Double.isFinite(value) || value != Math.rint(value) || value < 1 || value > 10) {
            throw malformed(ticker, cycleId, "confidence must be an integer in [1,10]: " + json.opt("confidence"), null);
        }
        return (int) value;
    }

    private static boolean flag(JSONObject json, String key, String ticker, String cycleId) {
        Object value = json.opt(key);
        if (value == null || JSONObject.NULL.equals(value)) {
            return false;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof Number) {
            double number = ((Number) value).doubleValue();
            if (number == 1.0) {
                return true;
            }
            if (number == 0.0) {
                return false;
            }
            throw malformed(ticker, cycleId, key + " is not a boolean: " + value, null);
        }
        String text = value.toString().trim().toLowerCase(Locale.ROOT);
        if (text.equals("true") || text.equals("1") || text.equals("yes")) {
            return true;
        }
        if (text.equals("false") || text.equals("0") || text.equals("no") || text.isEmpty()) {
            return false;
        }
        throw malformed(ticker, cycleId, key + " is not a boolean: " + value, null);
    }

    /**
     * Null, absent and 0 all mean "no change"; negative or non-numeric values are malformed.
     */
    private static Double optionalLevel(JSONObject json, String key, String ticker, String cycleId) {
        Object value = json.opt(key);
        if (value == null || JSONObject.NULL.equals(value)) {
            return null;
        }
        double level;
        if (value instanceof Number) {
            level = ((Number) value).doubleValue();
        } else {
            try {
                level = Double.parseDouble(value.toString().replace(",", "").trim());
            } catch (NumberFormatException e) {
                throw malformed(ticker, cycleId, key + " is not a number: " + value, e);
            }
        }
        if (!Double.isFinite(level) || level < 0.0) {
            throw malformed(ticker, cycleId, key + " must be a positive number: " + value, null);
        }
        return level == 0.0 ? null : level;
    }

    private static Set<SellSignal> sellSignals(JSONObject json, String ticker, String cycleId) {
        Set<SellSignal> out = EnumSet.noneOf(SellSignal.class);
        Object value = json.opt("sell_signals");
        if (value == null || JSONObject.NULL.equals(value)) {
            return out;
        }
        if (!(value instanceof JSONArray)) {
            throw malformed(ticker, cycleId, "sell_signals must be an array", null);
        }
        JSONArray array = (JSONArray) value;
        for (int i = 0; i < array.length(); i++) {
            String text = array.optString(i, "");
            SellSignal signal = SellSignal.parse(text)
                    .orElseThrow(() -> malformed(ticker, cycleId, "unknown sell signal: " + text, null));
            out.add(signal);
        }
        return out;
    }

    private static String stripFence(String raw) {
        String text = raw.trim();
        if (text.startsWith("```")) {
            int firstNewline = text.indexOf('\n');
            int lastFence = text.lastIndexOf("```");
            if (firstNewline > 0 && lastFence > firstNewline) {
                text = text.substring(firstNewline + 1, lastFence).trim();
            }
        }
        return text;
    }

    private static PortfolioException malformed(String ticker, String cycleId, String message, Throwable cause) {
        return new PortfolioException(CauseCode.MALFORMED_JUDGMENT, ticker, cycleId, message, cause);
    }
}

package com.stocktracker.kr.model;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.List;

/**
 * JSON form of {@link Scenario}, using the snake_case keys analysts emit
 * ({@code target_price}, {@code stop_loss}, {@code investment_period}, ...).
 */
public final class ScenarioJson {

    private ScenarioJson() {
    }

    public static String toJson(Scenario scenario) {
        return toJsonObject(scenario).toString();
    }

    public static JSONObject toJsonObject(Scenario scenario) {
        JSONObject out = new JSONObject();
        out.put("target_price", scenario.targetPrice);
        out.put("stop_loss", scenario.stopLoss);
        out.put("investment_period", scenario.investmentHorizon.name());
        out.put("rationale", scenario.rationale);
        out.put("support_levels", new JSONArray(scenario.supportLevels));
        out.put("resistance_levels", new JSONArray(scenario.resistanceLevels));
        out.put("sell_triggers", new JSONArray(scenario.sellTriggers));
        out.put("hold_conditions", new JSONArray(scenario.holdConditions));
        out.put("max_portfolio_size", scenario.maxPortfolioSize);
        return out;
    }

    /**
     * @throws IllegalArgumentException when the text is not a JSON object
     */
    public static Scenario fromJson(String raw) {
        if (raw == null || raw.trim().isEmpty()) {
            throw new IllegalArgumentException("scenario json is empty");
        }
        try {
            return fromJsonObject(new JSONObject(raw));
        } catch (JSONException e) {
            throw new IllegalArgumentException("scenario json is invalid: " + e.getMessage(), e);
        }
    }

    public static Scenario fromJsonObject(JSONObject in) {
        return Scenario.builder()
                .targetPrice(in.optDouble("target_price", Double.NaN))
                .stopLoss(in.optDouble("stop_loss", Double.NaN))
                .investmentHorizon(InvestmentHorizon.fromText(in.optString("investment_period", "")))
                .rationale(in.optString("rationale", ""))
                .supportLevels(numbers(in.optJSONArray("support_levels")))
                .resistanceLevels(numbers(in.optJSONArray("resistance_levels")))
                .sellTriggers(strings(in.optJSONArray("sell_triggers")))
                .holdConditions(strings(in.optJSONArray("hold_conditions")))
                .maxPortfolioSize(in.optInt("max_portfolio_size", 0))
                .build();
    }

    private static List<Double> numbers(JSONArray array) {
        if (array == null) {
            return List.of();
        }
        List<Double> out = new ArrayList<>();
        for (int i = 0; i < array.length(); i++) {
            double value = array.optDouble(i, Double.NaN);
            if (Double.isFinite(value)) {
                out.add(value);
            }
        }
        return out;
    }

    private static List<String> strings(JSONArray array) {
        if (array == null) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        for (int i = 0; i < array.length(); i++) {
            String value = array.optString(i, "").trim();
            if (!value.isEmpty()) {
                out.add(value);
            }
        }
        return out;
    }
}

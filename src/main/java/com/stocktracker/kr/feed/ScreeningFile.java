package com.stocktracker.kr.feed;

import com.stocktracker.kr.model.EntryDecision;
import com.stocktracker.kr.model.ScenarioJson;
import com.stocktracker.kr.model.ScreeningRequest;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the day's screening list. Each entry carries the analyst's score and decision plus the
 * trading plan, either nested under {@code scenario} or flat on the entry itself.
 */
public final class ScreeningFile {

    private ScreeningFile() {
    }

    public static List<ScreeningRequest> read(Path file) throws IOException {
        if (file == null || !Files.exists(file)) {
            return List.of();
        }
        return parse(Files.readString(file, StandardCharsets.UTF_8));
    }

    /**
     * @throws IOException when the text is not a JSON array of objects
     */
    public static List<ScreeningRequest> parse(String raw) throws IOException {
        if (raw == null || raw.trim().isEmpty()) {
            return List.of();
        }
        JSONArray array;
        try {
            array = new JSONArray(raw.trim());
        } catch (JSONException e) {
            throw new IOException("screening list is not a JSON array: " + e.getMessage(), e);
        }
        List<ScreeningRequest> out = new ArrayList<>();
        for (int i = 0; i < array.length(); i++) {
            JSONObject item = array.optJSONObject(i);
            if (item == null) {
                throw new IOException("screening entry " + i + " is not an object");
            }
            JSONObject plan = item.optJSONObject("scenario");
            out.add(ScreeningRequest.builder()
                    .ticker(item.optString("ticker", "").trim())
                    .companyName(item.optString("company_name", ""))
                    .sector(item.optString("sector", ""))
                    .analyzedAt(instant(item.optString("analyzed_at", "")))
                    .buyScore(item.optDouble("buy_score", Double.NaN))
                    .analystDecision(EntryDecision.fromText(item.optString("decision", "")))
                    .rationale(item.optString("rationale", ""))
                    .quotedPrice(item.optDouble("current_price", Double.NaN))
                    .scenario(ScenarioJson.fromJsonObject(plan == null ? item : plan))
                    .build());
        }
        return out;
    }

    private static Instant instant(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(raw.trim());
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}

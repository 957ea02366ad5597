package com.stocktracker.kr.model;

import java.util.Locale;

public enum InvestmentHorizon {
    SHORT,
    MID,
    LONG;

    /**
     * Accepts the enum name or the Korean labels used by analysts (단기/중기/장기). Unknown text means MID.
     */
    public static InvestmentHorizon fromText(String raw) {
        String value = raw == null ? "" : raw.trim();
        if (value.equals("단기")) {
            return SHORT;
        }
        if (value.equals("장기")) {
            return LONG;
        }
        String upper = value.toUpperCase(Locale.ROOT);
        if (upper.equals("SHORT")) {
            return SHORT;
        }
        if (upper.equals("LONG")) {
            return LONG;
        }
        return MID;
    }
}

package io.github.calltable.schema;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds raw records for tests.
 */
public final class CallRecords {

    private CallRecords() {
    }

    /**
     * Returns a mutable record with every required field set to a well-typed value.
     */
    public static Map<String, Object> valid() {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("callid", "100000000001");
        record.put("filename", "benefits_card.mp4");
        record.put("timestamp", "2025-03-01T10:15:00Z");
        record.put("agent", "Maria G.");
        record.put("account_id", "ACC-1234-AB");
        record.put("total_call_time", 12.5);
        record.put("primary_reason", "Card stopped working at the store");
        record.put("call_type", "Inbound");
        record.put("call_category", "Benefits Access or Card Issues");
        record.put("call_outcome", "Resolved");
        record.put("sentiment_score", 7);
        record.put("food_program", true);
        return record;
    }

    public static Map<String, Object> validWithThemes(Object themes) {
        Map<String, Object> record = valid();
        record.put("themes", themes);
        return record;
    }

    public static Map<String, Object> theme(String emotion) {
        Map<String, Object> theme = new LinkedHashMap<>();
        theme.put("theme", "Card issue");
        theme.put("emotion", emotion);
        return theme;
    }

    public static List<Object> themes(Object... items) {
        return new ArrayList<>(List.of(items));
    }
}

package io.github.calltable.schema;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import io.github.calltable.converter.FieldKind;

/**
 * The canonical call table layout.
 *
 * <p>Column order is the CSV column order. {@code last_theme_emotion} is derived from the
 * optional {@code themes} array and is therefore not a required input field.</p>
 */
public final class CallSchema {

    public static final String CALL_ID = "callid";
    public static final String FILENAME = "filename";
    public static final String TIMESTAMP = "timestamp";
    public static final String AGENT = "agent";
    public static final String ACCOUNT_ID = "account_id";
    public static final String TOTAL_CALL_TIME = "total_call_time";
    public static final String PRIMARY_REASON = "primary_reason";
    public static final String CALL_TYPE = "call_type";
    public static final String CALL_CATEGORY = "call_category";
    public static final String CALL_OUTCOME = "call_outcome";
    public static final String LAST_THEME_EMOTION = "last_theme_emotion";
    public static final String SENTIMENT_SCORE = "sentiment_score";
    public static final String FOOD_PROGRAM = "food_program";

    /** Input array the derived column is read from. */
    public static final String THEMES = "themes";
    public static final String EMOTION = "emotion";

    public static final ImmutableList<SchemaColumn> COLUMNS = ImmutableList.of(
            new SchemaColumn(CALL_ID, FieldKind.STRING),
            new SchemaColumn(FILENAME, FieldKind.STRING),
            new SchemaColumn(TIMESTAMP, FieldKind.STRING),
            new SchemaColumn(AGENT, FieldKind.STRING),
            new SchemaColumn(ACCOUNT_ID, FieldKind.STRING),
            new SchemaColumn(TOTAL_CALL_TIME, FieldKind.FLOAT),
            new SchemaColumn(PRIMARY_REASON, FieldKind.STRING),
            new SchemaColumn(CALL_TYPE, FieldKind.STRING),
            new SchemaColumn(CALL_CATEGORY, FieldKind.STRING),
            new SchemaColumn(CALL_OUTCOME, FieldKind.STRING),
            new SchemaColumn(LAST_THEME_EMOTION, FieldKind.STRING),
            new SchemaColumn(SENTIMENT_SCORE, FieldKind.INTEGER),
            new SchemaColumn(FOOD_PROGRAM, FieldKind.BOOLEAN)
    );

    public static final ImmutableSet<String> REQUIRED_FIELDS = COLUMNS.stream()
            .map(SchemaColumn::name)
            .filter(name -> !LAST_THEME_EMOTION.equals(name))
            .collect(ImmutableSet.toImmutableSet());

    private CallSchema() {
    }

    /**
     * Returns the column names in output order.
     */
    public static String[] header() {
        return COLUMNS.stream().map(SchemaColumn::name).toArray(String[]::new);
    }
}

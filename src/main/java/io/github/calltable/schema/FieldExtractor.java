package io.github.calltable.schema;

import io.github.calltable.converter.CoercionException;
import io.github.calltable.converter.Coercer;
import io.github.calltable.converter.FieldKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Maps a validated raw record to a {@link CallRow}.
 *
 * <p>Each column is looked up by name and coerced to its kind. An absent or null
 * field yields null. Any coercion failure rejects the whole record; there are no
 * partial rows. {@code last_theme_emotion} is derived instead of looked up.</p>
 */
public class FieldExtractor {

    private static final Logger LOG = LoggerFactory.getLogger(FieldExtractor.class);

    private final Coercer coercer;

    public FieldExtractor() {
        this(new Coercer());
    }

    public FieldExtractor(Coercer coercer) {
        this.coercer = coercer;
    }

    /**
     * Extracts one row.
     *
     * @param record a record that passed {@link SchemaValidator}
     * @return the coerced row in canonical column order
     * @throws CoercionException if any column fails to coerce
     */
    public CallRow extract(Map<String, Object> record) {
        ThemeEmotion emotion = deriveLastThemeEmotion(record);

        List<Object> values = new ArrayList<>(CallSchema.COLUMNS.size());
        for (SchemaColumn column : CallSchema.COLUMNS) {
            if (CallSchema.LAST_THEME_EMOTION.equals(column.name())) {
                values.add(emotion.value());
                continue;
            }
            Object raw = record.get(column.name());
            values.add(raw == null ? null : coercer.coerce(raw, column.kind(), column.name()));
        }
        return new CallRow(values);
    }

    /**
     * Derives the emotion of the last entry in {@code themes}.
     */
    public ThemeEmotion deriveLastThemeEmotion(Map<String, Object> record) {
        try {
            Object themes = record.get(CallSchema.THEMES);
            if (themes == null) {
                return ThemeEmotion.none(ThemeEmotion.Reason.ABSENT);
            }
            if (!(themes instanceof List<?> list)) {
                return ThemeEmotion.none(ThemeEmotion.Reason.NOT_A_LIST);
            }
            if (list.isEmpty()) {
                return ThemeEmotion.none(ThemeEmotion.Reason.EMPTY);
            }
            if (!(list.get(list.size() - 1) instanceof Map<?, ?> last)) {
                return ThemeEmotion.none(ThemeEmotion.Reason.NOT_AN_OBJECT);
            }
            Object emotion = last.get(CallSchema.EMOTION);
            if (emotion == null) {
                return ThemeEmotion.none(ThemeEmotion.Reason.MISSING_EMOTION);
            }
            return ThemeEmotion.derived((String) coercer.coerce(emotion, FieldKind.STRING));
        } catch (RuntimeException e) {
            LOG.debug("Could not derive {}: {}", CallSchema.LAST_THEME_EMOTION, e.toString());
            return ThemeEmotion.none(ThemeEmotion.Reason.FAILED);
        }
    }
}

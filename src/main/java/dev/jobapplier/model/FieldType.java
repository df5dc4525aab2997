package dev.jobapplier.model;

import java.util.Locale;

public enum FieldType {
    TEXT,
    SELECT,
    CHECKBOX,
    RADIO,
    FILE;

    /**
     * Derives the field type from an element's tag name and {@code type} attribute.
     */
    public static FieldType of(String tagName, String inputType) {
        String tag = tagName == null ? "" : tagName.toLowerCase(Locale.ROOT);
        String type = inputType == null ? "" : inputType.toLowerCase(Locale.ROOT);
        if ("select".equals(tag)) {
            return SELECT;
        }
        switch (type) {
            case "checkbox":
                return CHECKBOX;
            case "radio":
                return RADIO;
            case "file":
                return FILE;
            default:
                return TEXT;
        }
    }
}

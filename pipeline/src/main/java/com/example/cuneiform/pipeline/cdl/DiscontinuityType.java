package com.example.cuneiform.pipeline.cdl;

public enum DiscontinuityType {
    CELL_START("cell-start"),
    CELL_END("cell-end"),
    COLUMN("column"),
    FIELD_START("field-start"),
    FIELD_END("field-end"),
    LINE_START("line-start"),
    NONW("nonw"),
    NONX("nonx"),
    OBJECT("object"),
    SURFACE("surface");

    private final String value;

    DiscontinuityType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static DiscontinuityType fromValue(String value) {
        for (DiscontinuityType type : values()) {
            if (type.value.equals(value)) {
                return type;
            }
        }
        throw new CdlFormatException("Unknown discontinuity type: " + value);
    }
}

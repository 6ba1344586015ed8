package com.example.cuneiform.pipeline.cdl;

public enum ChunkType {
    DISCOURSE("discourse"),
    PHRASE("phrase"),
    SENTENCE("sentence"),
    TEXT("text");

    private final String value;

    ChunkType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static ChunkType fromValue(String value) {
        for (ChunkType type : values()) {
            if (type.value.equals(value)) {
                return type;
            }
        }
        throw new CdlFormatException("Unknown chunk type: " + value);
    }
}

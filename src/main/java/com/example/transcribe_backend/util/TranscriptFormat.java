package com.example.transcribe_backend.util;

import java.util.Locale;

public enum TranscriptFormat {
    AS_TXT("text/plain"),
    AS_SRT("application/x-subrip"),
    AS_TSV("text/tab-separated-values"),
    AS_VTT("text/vtt"),
    AS_JSON("application/json");

    private final String contentType;

    TranscriptFormat(String contentType) {
        this.contentType = contentType;
    }

    public String contentType() {
        return contentType;
    }

    public static TranscriptFormat parse(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}

package com.example.transcribe_backend.util;

import java.util.Locale;

public enum JobEventKind {
    JOB_CREATED,
    JOB_UPDATED,
    JOB_DELETED;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static JobEventKind fromWireName(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}

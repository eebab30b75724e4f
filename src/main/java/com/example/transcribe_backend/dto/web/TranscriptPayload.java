package com.example.transcribe_backend.dto.web;

import com.example.transcribe_backend.util.TranscriptFormat;

import java.util.Map;

/**
 * Transcript as uploaded by a runner, one rendition per download format.
 */
public record TranscriptPayload(
        String asTxt,
        String asSrt,
        String asTsv,
        String asVtt,
        Map<String, Object> asJson
) {
    /** Text rendition for a format, {@code null} when the runner did not provide it. */
    public String text(TranscriptFormat format) {
        return switch (format) {
            case AS_TXT -> asTxt;
            case AS_SRT -> asSrt;
            case AS_TSV -> asTsv;
            case AS_VTT -> asVtt;
            case AS_JSON -> null;
        };
    }
}

package com.example.transcribe_backend.service.Interfaces;

import java.io.InputStream;
import java.nio.file.Path;

/**
 * Opaque storage for audio inputs and transcript outputs, addressed by key. Encryption at rest is
 * the implementation's business.
 */
public interface BlobStore {
    /** Writes an audio upload and closes the stream. */
    void writeAudio(String key, InputStream content);

    /** Resolves the readable location of a stored audio file. */
    Path resolveAudio(String key);

    boolean existsAudio(String key);

    void deleteAudio(String key);

    void writeTranscript(String key, byte[] content);

    byte[] readTranscript(String key);

    void deleteTranscript(String key);
}

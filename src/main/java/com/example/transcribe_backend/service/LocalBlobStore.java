package com.example.transcribe_backend.service;

import com.example.transcribe_backend.exception.StorageException;
import com.example.transcribe_backend.service.Interfaces.BlobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;


public class LocalBlobStore implements BlobStore {
    private static final Logger LOGGER = LoggerFactory.getLogger(LocalBlobStore.class);

    private final Path baseDir;
    private final Path audioDir;
    private final Path transcriptDir;

    public LocalBlobStore(Path baseDir, String audioPrefix, String transcriptPrefix) {
        this.baseDir = baseDir.toAbsolutePath().normalize();
        this.audioDir = this.baseDir.resolve(audioPrefix).normalize();
        this.transcriptDir = this.baseDir.resolve(transcriptPrefix).normalize();

        try {
            Files.createDirectories(audioDir);
            Files.createDirectories(transcriptDir);
            LOGGER.info("LocalBlobStore ready. base={}, audio={}, transcripts={}", this.baseDir, this.audioDir, this.transcriptDir);
        } catch (IOException e) {
            throw new StorageException("Cannot create storage directories", e);
        }
    }

    @Override
    public void writeAudio(String key, InputStream content) {
        Path target = safeResolve(audioDir, key);
        try (InputStream in = content) {
            Files.createDirectories(target.getParent());
            Files.copy(in, target, REPLACE_EXISTING);
        } catch (IOException e) {
            throw new StorageException("Audio write failed: " + key, e);
        }
    }

    @Override
    public Path resolveAudio(String key) {
        Path p = safeResolve(audioDir, key);
        if (!Files.exists(p)) {
            throw new StorageException("Audio missing for key: " + key);
        }
        return p;
    }

    @Override
    public boolean existsAudio(String key) {
        return Files.exists(safeResolve(audioDir, key));
    }

    @Override
    public void deleteAudio(String key) {
        deleteIfExists(safeResolve(audioDir, key));
    }

    @Override
    public void writeTranscript(String key, byte[] content) {
        Path target = safeResolve(transcriptDir, key);
        try {
            Files.createDirectories(target.getParent());
            Files.write(target, content);
        } catch (IOException e) {
            throw new StorageException("Transcript write failed: " + key, e);
        }
    }

    @Override
    public byte[] readTranscript(String key) {
        try {
            return Files.readAllBytes(safeResolve(transcriptDir, key));
        } catch (IOException e) {
            throw new StorageException("Transcript read failed: " + key, e);
        }
    }

    @Override
    public void deleteTranscript(String key) {
        deleteIfExists(safeResolve(transcriptDir, key));
    }

    private Path safeResolve(Path root, String key) {
        if (key == null || key.isBlank()) {
            throw new StorageException("key is blank");
        }
        // Force forward slashes; strip leading slashes
        String normalizedKey = key.replace('\\', '/').replaceAll("^/+", "");
        Path p = root.resolve(normalizedKey).normalize();
        if (!p.startsWith(root)) {
            throw new StorageException("Invalid key (path traversal?): " + key);
        }
        return p;
    }

    private void deleteIfExists(Path p) {
        try {
            Files.deleteIfExists(p);
        } catch (IOException e) {
            throw new StorageException("Delete failed: " + p, e);
        }
    }
}

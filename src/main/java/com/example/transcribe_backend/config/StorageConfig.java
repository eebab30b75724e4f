package com.example.transcribe_backend.config;

import com.example.transcribe_backend.service.Interfaces.BlobStore;
import com.example.transcribe_backend.service.LocalBlobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * Blob storage for uploaded audio and finished transcripts.
 */
@EnableConfigurationProperties(StorageProperties.class)
@Configuration
public class StorageConfig {
    private static final Logger LOGGER = LoggerFactory.getLogger(StorageConfig.class);

    @Bean
    public BlobStore blobStore(StorageProperties properties) {
        Path base = Path.of(properties.getBaseDir());
        BlobStore store = new LocalBlobStore(base, properties.getAudioPrefix(), properties.getTranscriptPrefix());
        LOGGER.info("Blob store wired: base={} audio={} transcripts={}",
                base, properties.getAudioPrefix(), properties.getTranscriptPrefix());
        return store;
    }
}

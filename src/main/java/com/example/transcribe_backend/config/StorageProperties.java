package com.example.transcribe_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "storage.local")
public class StorageProperties {
    private String baseDir = "./data";
    private String audioPrefix = "audio";
    private String transcriptPrefix = "transcripts";

    public String getBaseDir() { return baseDir; }
    public void setBaseDir(String baseDir) { this.baseDir = baseDir; }

    public String getAudioPrefix() { return audioPrefix; }
    public void setAudioPrefix(String audioPrefix) { this.audioPrefix = audioPrefix; }

    public String getTranscriptPrefix() { return transcriptPrefix; }
    public void setTranscriptPrefix(String transcriptPrefix) { this.transcriptPrefix = transcriptPrefix; }
}

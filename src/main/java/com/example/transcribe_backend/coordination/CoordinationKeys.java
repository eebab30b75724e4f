package com.example.transcribe_backend.coordination;

/**
 * Key layout inside the coordination store.
 */
public class CoordinationKeys {
    private final String prefix;

    public CoordinationKeys(String prefix) {
        this.prefix = prefix;
    }

    public String runnerLiveness(long runnerId) {
        return prefix + ":runner:" + runnerId;
    }

    public String onlineRunners() {
        return prefix + ":runners:online";
    }

    public String sweepLock() {
        return prefix + ":sweep-lock";
    }

    public String ownerEvents(long ownerId) {
        return prefix + ":events:owner:" + ownerId;
    }
}

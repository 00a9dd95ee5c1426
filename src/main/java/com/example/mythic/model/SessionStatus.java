package com.example.mythic.model;

/**
 * Lifecycle state of a combat session.
 */
public enum SessionStatus {

    /** Turns are being resolved */
    ACTIVE("active"),

    /** Combat has been settled; terminal */
    ENDED("ended");

    private final String key;

    SessionStatus(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    public static SessionStatus fromKey(String key) {
        if (key != null) {
            for (SessionStatus status : values()) {
                if (status.key.equalsIgnoreCase(key.trim())) {
                    return status;
                }
            }
        }
        throw new IllegalArgumentException("Unknown session status: " + key);
    }
}

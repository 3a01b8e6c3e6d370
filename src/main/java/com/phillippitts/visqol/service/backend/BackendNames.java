package com.phillippitts.visqol.service.backend;

/**
 * Canonical backend names used in results, logs and metric tags.
 */
public final class BackendNames {

    public static final String NATIVE = "visqol-native";
    public static final String APPROXIMATE = "approximate";

    private BackendNames() {
        // Utility class - prevent instantiation
    }
}

package com.example.sos.connectivity;

import java.util.Locale;

public enum ConnectionQuality {
    EXCELLENT,
    GOOD,
    FAIR,
    POOR,
    NONE;

    public static ConnectionQuality of(ConnectivityStatus status) {
        if (!status.connected()) return NONE;
        String type = status.type() == null
            ? ""
            : status.type().toLowerCase(Locale.ROOT);
        return switch (type) {
            case "wifi", "ethernet" -> EXCELLENT;
            case "cellular" -> ofGeneration(status.cellularGeneration());
            default -> FAIR;
        };
    }

    private static ConnectionQuality ofGeneration(String generation) {
        if (generation == null) return GOOD;
        return switch (generation.toLowerCase(Locale.ROOT)) {
            case "5g" -> EXCELLENT;
            case "4g" -> GOOD;
            case "3g" -> FAIR;
            default -> POOR;
        };
    }
}

package com.example.sos.connectivity;

import com.example.sos.model.ConnectivityEvent;

public record ConnectivityStatus(
    boolean connected,
    Boolean reachable,
    String type,
    String cellularGeneration
) {
    public static final ConnectivityStatus OFFLINE = new ConnectivityStatus(
        false,
        false,
        "none",
        null
    );

    public static final ConnectivityStatus UNKNOWN_ONLINE = new ConnectivityStatus(
        true,
        null,
        "unknown",
        null
    );

    public static ConnectivityStatus of(ConnectivityEvent e) {
        return new ConnectivityStatus(
            e.connected,
            e.reachable,
            e.type == null ? "unknown" : e.type,
            e.cellularGeneration
        );
    }

    public boolean online() {
        return connected && !Boolean.FALSE.equals(reachable);
    }
}

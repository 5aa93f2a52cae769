package com.example.sos.model;

public class ConnectivityEvent {
    public boolean connected;
    public Boolean reachable;            // null when the platform cannot tell
    public String type;                  // wifi, cellular, none, unknown
    public String cellularGeneration;    // 2g..5g, optional
    public long eventTsMs;

    public ConnectivityEvent() {}
}

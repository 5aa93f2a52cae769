package com.example.sos.connectivity;

@FunctionalInterface
public interface ConnectivityListener {

    void onChange(ConnectivityStatus status, boolean restored);
}

package com.example.sos.capabilities;

import com.example.sos.connectivity.ConnectivityStatus;
import java.util.function.Consumer;

public interface ConnectivityCapability {

    boolean available();

    ConnectivityStatus current();

    Subscription subscribe(Consumer<ConnectivityStatus> listener);
}

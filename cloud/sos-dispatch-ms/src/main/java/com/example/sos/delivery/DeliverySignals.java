package com.example.sos.delivery;

import com.example.sos.model.QueuedAlert;

public interface DeliverySignals {

    void onDispatched(DispatchOutcome outcome);

    void onReplayDelivered(QueuedAlert alert, DeliveryReport report);

    void onTerminalFailure(QueuedAlert alert, DeliveryReport report);
}

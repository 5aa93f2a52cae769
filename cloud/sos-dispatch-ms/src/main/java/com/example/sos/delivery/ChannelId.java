package com.example.sos.delivery;

public enum ChannelId {
    CLOUD,
    SMS,
    PUSH
}

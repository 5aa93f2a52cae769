package com.example.sos.delivery;

public record ChannelResult(int accepted, int targeted, boolean timedOut, String detail) {

    public static ChannelResult accepted(int accepted, int targeted) {
        return new ChannelResult(accepted, targeted, false, null);
    }

    public static ChannelResult failed(int targeted, String detail) {
        return new ChannelResult(0, targeted, false, detail);
    }

    public static ChannelResult timedOut(int targeted) {
        return new ChannelResult(0, targeted, true, "timed out");
    }

    // partial acceptance still counts as sent
    public boolean sent() {
        return accepted > 0;
    }
}

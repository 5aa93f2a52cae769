package com.example.sos.capabilities;

@FunctionalInterface
public interface Subscription extends AutoCloseable {

    @Override
    void close();
}

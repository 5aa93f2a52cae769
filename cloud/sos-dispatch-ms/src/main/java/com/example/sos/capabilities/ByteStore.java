package com.example.sos.capabilities;

public interface ByteStore {

    byte[] get(String key);

    void set(String key, byte[] value);

    void delete(String key);
}

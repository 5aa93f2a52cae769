package com.example.sos.capabilities;

public interface PhoneCallCapability {

    boolean available();

    boolean call(String phoneNumber);
}

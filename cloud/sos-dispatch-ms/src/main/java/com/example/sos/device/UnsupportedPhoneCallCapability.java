package com.example.sos.device;

import com.example.sos.capabilities.PhoneCallCapability;
import io.quarkus.arc.DefaultBean;
import jakarta.enterprise.context.ApplicationScoped;

@DefaultBean
@ApplicationScoped
public class UnsupportedPhoneCallCapability implements PhoneCallCapability {

    @Override
    public boolean available() {
        return false;
    }

    @Override
    public boolean call(String phoneNumber) {
        return false;
    }
}

package com.example.sos.otp;

public enum OtpPurpose {
    REGISTRATION,
    VERIFICATION,
    LOGIN
}

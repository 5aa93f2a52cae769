package com.example.sos.util;

import java.util.regex.Pattern;

public final class PhoneNumbers {

    // '+', a non-zero country digit, then 9 to 14 digits
    private static final Pattern E164 = Pattern.compile("^\\+[1-9]\\d{9,14}$");

    private PhoneNumbers() {}

    public static boolean isValid(String phoneNumber) {
        return phoneNumber != null && E164.matcher(phoneNumber).matches();
    }

    // keeps the last four digits
    public static String mask(String phoneNumber) {
        if (phoneNumber == null) return "<none>";
        if (phoneNumber.length() < 6) return phoneNumber;
        int keep = 4;
        return "*".repeat(phoneNumber.length() - keep) +
            phoneNumber.substring(phoneNumber.length() - keep);
    }
}

package com.prismTax.simulator.gateway.util;

/**
 * Utility class for masking simulated phone numbers in logs.
 */
public class PhoneNumberMasker {

    private PhoneNumberMasker() {
    }

    /**
     * Shows the first 4 and last 2 characters, masks the middle.
     *
     * @param phoneNumber phone number to mask
     * @return masked number (e.g. "+234****89")
     */
    public static String mask(String phoneNumber) {
        if (phoneNumber == null || phoneNumber.length() <= 6) {
            return "****";
        }
        return phoneNumber.substring(0, 4) + "****" + phoneNumber.substring(phoneNumber.length() - 2);
    }
}

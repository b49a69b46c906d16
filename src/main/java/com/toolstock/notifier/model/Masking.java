package com.toolstock.notifier.model;

/** Log-safe renderings of customer identifiers. */
public final class Masking {

    private Masking() {}

    /** Keeps the first six characters ({@code 346123***}), enough to spot the prefix. */
    public static String maskPhone(final String phone) {
        if (phone == null || phone.length() < 6) return "***";
        return phone.substring(0, 6) + "***";
    }
}

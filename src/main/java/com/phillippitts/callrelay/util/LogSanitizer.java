package com.phillippitts.callrelay.util;

/** Utility for privacy-safe logging of transcript previews and phone numbers. */
public final class LogSanitizer {

    /** Default preview length for transcript and response text. */
    public static final int PREVIEW_LENGTH = 40;

    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null) {
            return "";
        }
        if (max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max);
    }

    public static String preview(String s) {
        return truncate(s, PREVIEW_LENGTH);
    }

    /**
     * Masks all but the last four characters of a phone number ({@code +15551234567} becomes
     * {@code ********4567}). Returns "" for null.
     */
    public static String maskPhoneNumber(String phoneNumber) {
        if (phoneNumber == null) {
            return "";
        }
        int visible = Math.min(4, phoneNumber.length());
        int hidden = phoneNumber.length() - visible;
        return "*".repeat(hidden) + phoneNumber.substring(hidden);
    }
}

package com.fieldservice.sale.util;

/**
 * Sequential document names such as {@code FSO-00042}.
 */
public final class DocumentNumbers {

    private DocumentNumbers() {
    }

    /**
     * Next name after {@code lastName} (Max + 1). Falls back to {@code fallback + 1}
     * when the last name does not carry the expected prefix or a numeric suffix.
     */
    public static String next(String prefix, String lastName, long fallback) {
        long nextNum = 1;
        if (lastName != null) {
            String expectedPrefix = prefix + "-";
            if (lastName.startsWith(expectedPrefix)) {
                try {
                    nextNum = Long.parseLong(lastName.substring(expectedPrefix.length())) + 1;
                } catch (NumberFormatException e) {
                    nextNum = fallback + 1;
                }
            } else {
                nextNum = fallback + 1;
            }
        }
        return String.format("%s-%05d", prefix, nextNum);
    }
}

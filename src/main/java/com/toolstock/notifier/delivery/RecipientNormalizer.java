package com.toolstock.notifier.delivery;

import com.toolstock.notifier.error.ValidationException;
import com.toolstock.notifier.model.Masking;

import java.util.regex.Pattern;

/**
 * Canonical form of a Spanish mobile or landline number: {@code 34} followed
 * by nine digits.
 *
 * <pre>
 *   "+34 612 34 56 78"  → 34612345678
 *   "0034612345678"     → 34612345678
 *   "612-345-678"       → 34612345678
 *   "(91) 123.45.67"    → 34911234567
 * </pre>
 */
public final class RecipientNormalizer {

    private static final Pattern SEPARATORS = Pattern.compile("[\\s\\-().]");
    private static final Pattern CANONICAL  = Pattern.compile("34\\d{9}");

    /** @throws ValidationException if the input is not a Spanish number */
    public String normalize(final String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ValidationException("recipient is empty");
        }
        String cleaned = SEPARATORS.matcher(raw).replaceAll("");
        if (cleaned.startsWith("+")) {
            cleaned = cleaned.substring(1);
        }

        if (cleaned.startsWith("0034")) {
            cleaned = cleaned.substring(2);
        } else if (!cleaned.startsWith("34")
                && (cleaned.startsWith("6") || cleaned.startsWith("7") || cleaned.startsWith("9"))) {
            cleaned = "34" + cleaned;
        }

        if (!CANONICAL.matcher(cleaned).matches()) {
            throw new ValidationException("Invalid Spanish number format: " + Masking.maskPhone(raw));
        }
        return cleaned;
    }
}

package com.flagship.credit_ledger.voucher;

import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Generates and normalizes voucher codes.
 *
 * Generated codes are {@value #CODE_LENGTH} characters: the prefix followed by
 * random upper-case letters and digits.
 */
@Component
public class VoucherCodeGenerator {

    public static final String DEFAULT_PREFIX = "CID";
    static final int CODE_LENGTH = 12;
    static final int MIN_RANDOM_LENGTH = 6;
    static final int MIN_CODE_LENGTH = 6;
    static final int MAX_CODE_LENGTH = 20;

    private static final String ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";
    private static final Pattern CODE_PATTERN = Pattern.compile("^[A-Z0-9_-]+$");
    private static final Pattern PREFIX_PATTERN = Pattern.compile("^[A-Z0-9]{0,6}$");

    private final SecureRandom random = new SecureRandom();

    public String generate(String prefix) {
        String normalizedPrefix = prefix == null ? DEFAULT_PREFIX : prefix.trim().toUpperCase(Locale.ROOT);
        if (!PREFIX_PATTERN.matcher(normalizedPrefix).matches()) {
            throw new IllegalArgumentException("Voucher prefix must be up to 6 letters or digits");
        }

        int randomLength = Math.max(MIN_RANDOM_LENGTH, CODE_LENGTH - normalizedPrefix.length());
        StringBuilder code = new StringBuilder(normalizedPrefix);
        for (int i = 0; i < randomLength; i++) {
            code.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return code.toString();
    }

    /**
     * Trims and upper-cases user input. Returns null for input that cannot be a code.
     */
    public String normalize(String code) {
        if (code == null) {
            return null;
        }
        String normalized = code.trim().toUpperCase(Locale.ROOT);
        if (normalized.length() < MIN_CODE_LENGTH || normalized.length() > MAX_CODE_LENGTH
                || !CODE_PATTERN.matcher(normalized).matches()) {
            return null;
        }
        return normalized;
    }

    /**
     * Validates an administrator-chosen code.
     */
    public String requireValidCustomCode(String code) {
        String normalized = normalize(code);
        if (normalized == null) {
            throw new IllegalArgumentException(String.format(
                "Voucher code must be %d-%d letters, digits, '-' or '_'", MIN_CODE_LENGTH, MAX_CODE_LENGTH));
        }
        return normalized;
    }
}

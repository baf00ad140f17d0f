package com.flagship.credit_ledger.conversion;

import org.springframework.stereotype.Component;

/**
 * Normalizes installation ids to their digits and checks their shape.
 */
@Component
public class InstallationIdValidator {

    static final int INSTALLATION_ID_LENGTH = 63;

    /**
     * @return the 63 digits of the installation id
     * @throws InvalidInstallationIdException if it does not have exactly 63 digits or starts with 000
     */
    public String normalize(String installationId) {
        if (installationId == null) {
            throw new InvalidInstallationIdException("Installation id is required");
        }

        StringBuilder digits = new StringBuilder(INSTALLATION_ID_LENGTH);
        for (int i = 0; i < installationId.length(); i++) {
            char c = installationId.charAt(i);
            if (c >= '0' && c <= '9') {
                digits.append(c);
            }
        }

        if (digits.length() != INSTALLATION_ID_LENGTH) {
            throw new InvalidInstallationIdException(String.format(
                "Installation id must contain exactly %d digits (got %d)", INSTALLATION_ID_LENGTH, digits.length()));
        }
        if (digits.indexOf("000") == 0) {
            throw new InvalidInstallationIdException("Installation id must not start with 000");
        }
        return digits.toString();
    }
}

package com.flagship.credit_ledger.conversion;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class InstallationIdValidatorTest {

    private static final String VALID = "1234567".repeat(9);

    private final InstallationIdValidator validator = new InstallationIdValidator();

    @Test
    void separatorsAreStripped() {
        String grouped = VALID.replaceAll("(.{7})", "$1-");

        assertEquals(VALID, validator.normalize(grouped));
        assertEquals(VALID, validator.normalize(" " + VALID.substring(0, 30) + " " + VALID.substring(30)));
    }

    @Test
    void wrongLengthIsRejected() {
        assertThrows(InvalidInstallationIdException.class, () -> validator.normalize(VALID.substring(1)));
        assertThrows(InvalidInstallationIdException.class, () -> validator.normalize(VALID + "1"));
        assertThrows(InvalidInstallationIdException.class, () -> validator.normalize(""));
        assertThrows(InvalidInstallationIdException.class, () -> validator.normalize(null));
    }

    @Test
    void leadingZerosAreRejected() {
        assertThrows(InvalidInstallationIdException.class, () -> validator.normalize("000" + VALID.substring(3)));
    }
}

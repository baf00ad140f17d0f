package com.flagship.credit_ledger.voucher;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class VoucherCodeGeneratorTest {

    private final VoucherCodeGenerator generator = new VoucherCodeGenerator();

    @Test
    void generatedCodesCarryThePrefix() {
        Set<String> codes = new HashSet<>();
        for (int i = 0; i < 200; i++) {
            String code = generator.generate("promo");
            assertTrue(code.startsWith("PROMO"));
            assertEquals(12, code.length());
            codes.add(code);
        }
        assertEquals(200, codes.size());
        assertTrue(generator.generate(null).startsWith(VoucherCodeGenerator.DEFAULT_PREFIX));
    }

    @Test
    void invalidPrefixIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> generator.generate("TOOLONG"));
        assertThrows(IllegalArgumentException.class, () -> generator.generate("A-B"));
    }

    @Test
    void userInputIsNormalized() {
        assertEquals("SAVE20", generator.normalize("  save20 "));
        assertNull(generator.normalize("abc"));
        assertNull(generator.normalize("SAVE 20"));
        assertNull(generator.normalize(null));
    }
}

package com.ryuqq.cryptogateway.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AcquireFlagsTest {

    @Test
    void 정의된_플래그_조합() {
        AcquireFlags flags = AcquireFlags.of(AcquireFlags.NEW_KEYSET | AcquireFlags.SILENT);

        assertTrue(flags.isNewKeyset());
        assertFalse(flags.isVerifyContext());
        assertFalse(flags.hasUnknownBits());
    }

    @Test
    void 정의되지_않은_비트_감지() {
        assertTrue(AcquireFlags.of(0x00000100).hasUnknownBits());
        assertTrue(AcquireFlags.of(AcquireFlags.VERIFY_CONTEXT).isVerifyContext());
    }
}

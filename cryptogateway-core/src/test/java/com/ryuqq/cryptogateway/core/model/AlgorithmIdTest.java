package com.ryuqq.cryptogateway.core.model;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * AlgorithmId 테스트.
 *
 * @author CryptoGateway Team
 * @since 1.0.0
 */
class AlgorithmIdTest {

    @Test
    void fromCode_지원하는_코드() {
        assertEquals(Optional.of(AlgorithmId.SHA_256), AlgorithmId.fromCode(0x800C));
        assertEquals(Optional.of(AlgorithmId.RSA_KEYX), AlgorithmId.fromCode(0xA400));
        assertEquals(Optional.of(AlgorithmId.ECDSA_P256), AlgorithmId.fromCode(0x2203));
    }

    @Test
    void fromCode_알_수_없는_코드는_empty() {
        assertTrue(AlgorithmId.fromCode(0x6610).isEmpty());
    }

    @Test
    void keyAlgorithmFromCode_KeySpec_코드는_RSA로_해석() {
        assertEquals(Optional.of(AlgorithmId.RSA_KEYX), AlgorithmId.keyAlgorithmFromCode(1));
        assertEquals(Optional.of(AlgorithmId.RSA_SIGN), AlgorithmId.keyAlgorithmFromCode(2));
    }

    @Test
    void keyAlgorithmFromCode_해시_코드는_empty() {
        assertTrue(AlgorithmId.keyAlgorithmFromCode(0x8004).isEmpty());
    }

    @Test
    void 해시_알고리즘은_다이제스트_길이를_가짐() {
        assertEquals(20, AlgorithmId.SHA1.digestLength());
        assertEquals(32, AlgorithmId.SHA_256.digestLength());
        assertEquals(48, AlgorithmId.SHA_384.digestLength());
        assertEquals(64, AlgorithmId.SHA_512.digestLength());
    }
}

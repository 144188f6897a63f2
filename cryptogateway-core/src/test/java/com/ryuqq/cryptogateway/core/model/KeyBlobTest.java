package com.ryuqq.cryptogateway.core.model;

import com.ryuqq.cryptogateway.core.error.HostStatus;
import com.ryuqq.cryptogateway.core.error.InvalidParameterException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * KeyBlob 테스트.
 *
 * @author CryptoGateway Team
 * @since 1.0.0
 */
class KeyBlobTest {

    private static final byte[] SPKI = {0x30, 0x59, 0x30, 0x13, 0x06, 0x07};

    @Test
    void encode_헤더_레이아웃() {
        // given
        KeyBlob blob = new KeyBlob(AlgorithmId.RSA_SIGN, 2048, SPKI);

        // when
        byte[] encoded = blob.encode();

        // then
        assertEquals(KeyBlob.HEADER_LENGTH + SPKI.length, encoded.length);
        assertEquals(0x06, encoded[0]);
        assertEquals(0x02, encoded[1]);
        assertEquals(0x00, encoded[4]);
        assertEquals(0x24, encoded[5]);
        assertEquals(0x00, encoded[8]);
        assertEquals(0x08, encoded[9]);
    }

    @Test
    void decode_encode_결과를_복원() {
        KeyBlob blob = new KeyBlob(AlgorithmId.ECDSA_P256, 256, SPKI);

        assertEquals(blob, KeyBlob.decode(blob.encode()));
    }

    @Test
    void decode_다른_블롭_타입은_BAD_TYPE() {
        // given
        byte[] encoded = new KeyBlob(AlgorithmId.RSA_KEYX, 2048, SPKI).encode();
        encoded[0] = 0x07;

        // when
        InvalidParameterException exception = assertThrows(InvalidParameterException.class,
            () -> KeyBlob.decode(encoded));

        // then
        assertEquals(HostStatus.BAD_TYPE, exception.hostStatus());
    }

    @Test
    void decode_해시_알고리즘은_BAD_ALGID() {
        // given
        byte[] encoded = new KeyBlob(AlgorithmId.RSA_KEYX, 2048, SPKI).encode();
        encoded[4] = 0x0C;
        encoded[5] = (byte) 0x80;

        // when
        InvalidParameterException exception = assertThrows(InvalidParameterException.class,
            () -> KeyBlob.decode(encoded));

        // then
        assertEquals(HostStatus.BAD_ALGID, exception.hostStatus());
    }

    @Test
    void decode_짧은_블롭은_BAD_DATA() {
        InvalidParameterException exception = assertThrows(InvalidParameterException.class,
            () -> KeyBlob.decode(new byte[KeyBlob.HEADER_LENGTH]));

        assertEquals(HostStatus.BAD_DATA, exception.hostStatus());
    }
}

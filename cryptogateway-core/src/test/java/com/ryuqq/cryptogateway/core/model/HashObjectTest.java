package com.ryuqq.cryptogateway.core.model;

import com.ryuqq.cryptogateway.core.error.HostStatus;
import com.ryuqq.cryptogateway.core.error.InvalidParameterException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * HashObject 테스트.
 *
 * @author CryptoGateway Team
 * @since 1.0.0
 */
class HashObjectTest {

    @Test
    void append_여러번_호출한_입력이_순서대로_누적() {
        // given
        HashObject hash = new HashObject(AlgorithmId.SHA_256);

        // when
        hash.append(new byte[]{1, 2}, 1024);
        hash.append(new byte[]{3}, 1024);

        // then
        assertArrayEquals(new byte[]{1, 2, 3}, hash.input());
        assertEquals(3, hash.inputLength());
    }

    @Test
    void append_최종화_이후는_BAD_HASH_STATE() {
        // given
        HashObject hash = new HashObject(AlgorithmId.SHA_256);
        hash.cacheDigest(new byte[32]);

        // when
        InvalidParameterException exception = assertThrows(InvalidParameterException.class,
            () -> hash.append(new byte[]{1}, 1024));

        // then
        assertEquals(HostStatus.BAD_HASH_STATE, exception.hostStatus());
    }

    @Test
    void append_한도_초과는_BAD_LEN() {
        // given
        HashObject hash = new HashObject(AlgorithmId.SHA1);
        hash.append(new byte[8], 10);

        // when
        InvalidParameterException exception = assertThrows(InvalidParameterException.class,
            () -> hash.append(new byte[3], 10));

        // then
        assertEquals(HostStatus.BAD_LEN, exception.hostStatus());
        assertEquals(8, hash.inputLength());
    }

    @Test
    void 큰_입력도_손실_없이_버퍼링() {
        // given
        HashObject hash = new HashObject(AlgorithmId.SHA_512);
        byte[] chunk = new byte[1024 * 1024];
        chunk[0] = 7;

        // when
        for (int i = 0; i < 8; i++) {
            hash.append(chunk, 64L * 1024 * 1024);
        }

        // then
        assertEquals(8 * 1024 * 1024, hash.inputLength());
        assertEquals(7, hash.input()[1024 * 1024]);
    }

    @Test
    void cachedSignature_같은_키_슬롯일_때만_반환() {
        HashObject hash = new HashObject(AlgorithmId.SHA_256);

        hash.cacheSignature(KeySpec.SIGNATURE, new byte[]{9, 9});

        assertArrayEquals(new byte[]{9, 9}, hash.cachedSignature(KeySpec.SIGNATURE));
        assertNull(hash.cachedSignature(KeySpec.EXCHANGE));
        assertTrue(hash.isFinalized());
    }

    @Test
    void duplicate_독립적인_사본() {
        // given
        HashObject hash = new HashObject(AlgorithmId.SHA_256);
        hash.append(new byte[]{1, 2}, 1024);

        // when
        HashObject copy = hash.duplicate();
        copy.append(new byte[]{3}, 1024);

        // then
        assertArrayEquals(new byte[]{1, 2}, hash.input());
        assertArrayEquals(new byte[]{1, 2, 3}, copy.input());
    }

    @Test
    void 키_알고리즘으로는_생성_불가() {
        assertThrows(IllegalArgumentException.class, () -> new HashObject(AlgorithmId.RSA_SIGN));
    }
}

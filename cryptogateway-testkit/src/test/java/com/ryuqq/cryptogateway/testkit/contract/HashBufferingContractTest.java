package com.ryuqq.cryptogateway.testkit.contract;

import com.ryuqq.cryptogateway.application.gateway.GatewayConfig;
import com.ryuqq.cryptogateway.core.error.ErrorKind;
import com.ryuqq.cryptogateway.core.error.HostStatus;
import com.ryuqq.cryptogateway.core.model.AlgorithmId;
import com.ryuqq.cryptogateway.core.model.HashParam;
import com.ryuqq.cryptogateway.core.model.KeySpec;
import com.ryuqq.cryptogateway.core.model.OutputBuffer;
import com.ryuqq.cryptogateway.core.outcome.Outcome;
import org.junit.jupiter.api.Test;

import java.security.MessageDigest;
import java.util.Arrays;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: Hash Buffering.
 *
 * <p>Hash input is buffered locally and sent to the backend only when the digest or a signature
 * is requested. Once the value has been produced the hash is finalized and accepts no more data.</p>
 *
 * @author CryptoGateway Team
 * @since 1.0.0
 */
class HashBufferingContractTest extends AbstractGatewayContractTest {

    private static final int HASH_LIMIT = 64 * 1024;
    private static final int CHUNK = 4096;

    @Override
    protected GatewayConfig gatewayConfig() {
        return new GatewayConfig().withMaxHashInputBytes(HASH_LIMIT);
    }

    @Test
    void testChunkedInput_DigestMatchesSingleShotDigest() throws Exception {
        // Given
        byte[] input = randomBytes(HASH_LIMIT);
        long hProv = acquireProvider("hash-chunks");
        long hHash = assertSuccess(gateway.createHash(ctx, hProv, AlgorithmId.SHA_256.code(), 0L, 0));
        long callsBefore = connector.remoteCalls();

        // When
        for (int offset = 0; offset < input.length; offset += CHUNK) {
            assertSuccess(gateway.hashData(ctx, hProv, hHash, Arrays.copyOfRange(input, offset, offset + CHUNK), 0));
        }
        assertEquals(callsBefore, connector.remoteCalls(), "hashData must not call the backend");

        OutputBuffer out = OutputBuffer.ofCapacity(32);
        int written = assertSuccess(gateway.getHashParam(ctx, hProv, hHash, HashParam.HASHVAL.code(), out));

        // Then
        assertEquals(32, written);
        assertArrayEquals(MessageDigest.getInstance("SHA-256").digest(input), out.data());
    }

    @Test
    void testInputBeyondLimit_FailsWithBadLen() {
        // Given
        long hProv = acquireProvider("hash-limit");
        long hHash = assertSuccess(gateway.createHash(ctx, hProv, AlgorithmId.SHA_256.code(), 0L, 0));
        assertSuccess(gateway.hashData(ctx, hProv, hHash, new byte[HASH_LIMIT - 1], 0));

        // When
        Outcome<Void> overflow = gateway.hashData(ctx, hProv, hHash, new byte[2], 0);

        // Then
        assertFailure(overflow, ErrorKind.INVALID_PARAMETER, HostStatus.BAD_LEN);
        assertSuccess(gateway.hashData(ctx, hProv, hHash, new byte[1], 0));
    }

    @Test
    void testSizeQuery_DoesNotFinalizeHash() {
        // Given
        long hProv = acquireProvider("hash-size-query");
        long hHash = assertSuccess(gateway.createHash(ctx, hProv, AlgorithmId.SHA_512.code(), 0L, 0));
        long callsBefore = connector.remoteCalls();

        // When
        OutputBuffer query = OutputBuffer.sizeQuery();
        int required = assertSuccess(gateway.getHashParam(ctx, hProv, hHash, HashParam.HASHVAL.code(), query));

        Outcome<Integer> tooSmall = gateway.getHashParam(ctx, hProv, hHash, HashParam.HASHVAL.code(),
            OutputBuffer.ofCapacity(16));

        // Then
        assertEquals(64, required);
        assertFailure(tooSmall, ErrorKind.INSUFFICIENT_BUFFER, HostStatus.MORE_DATA);
        assertEquals(callsBefore, connector.remoteCalls());
        assertSuccess(gateway.hashData(ctx, hProv, hHash, new byte[] {1}, 0));
    }

    @Test
    void testHashValue_FinalizesHash() {
        // Given
        long hProv = acquireProvider("hash-finalize");
        long hHash = assertSuccess(gateway.createHash(ctx, hProv, AlgorithmId.SHA1.code(), 0L, 0));
        assertSuccess(gateway.hashData(ctx, hProv, hHash, "abc".getBytes(), 0));

        // When
        OutputBuffer first = OutputBuffer.ofCapacity(20);
        assertSuccess(gateway.getHashParam(ctx, hProv, hHash, HashParam.HASHVAL.code(), first));
        long callsAfterFirst = connector.remoteCalls();

        // Then: no more data, and reading the value again uses the cached digest
        assertFailure(gateway.hashData(ctx, hProv, hHash, new byte[] {1}, 0),
            ErrorKind.INVALID_PARAMETER, HostStatus.BAD_HASH_STATE);

        OutputBuffer second = OutputBuffer.ofCapacity(20);
        assertSuccess(gateway.getHashParam(ctx, hProv, hHash, HashParam.HASHVAL.code(), second));
        assertArrayEquals(first.data(), second.data());
        assertEquals(callsAfterFirst, connector.remoteCalls());
    }

    @Test
    void testDuplicateHash_ContinuesIndependently() throws Exception {
        // Given
        long hProv = acquireProvider("hash-duplicate");
        long hHash = assertSuccess(gateway.createHash(ctx, hProv, AlgorithmId.SHA_256.code(), 0L, 0));
        assertSuccess(gateway.hashData(ctx, hProv, hHash, "prefix-".getBytes(), 0));

        // When
        long hCopy = assertSuccess(gateway.duplicateHash(ctx, hProv, hHash));
        assertSuccess(gateway.hashData(ctx, hProv, hHash, "left".getBytes(), 0));
        assertSuccess(gateway.hashData(ctx, hProv, hCopy, "right".getBytes(), 0));

        // Then
        OutputBuffer left = OutputBuffer.ofCapacity(32);
        OutputBuffer right = OutputBuffer.ofCapacity(32);
        assertSuccess(gateway.getHashParam(ctx, hProv, hHash, HashParam.HASHVAL.code(), left));
        assertSuccess(gateway.getHashParam(ctx, hProv, hCopy, HashParam.HASHVAL.code(), right));

        MessageDigest sha256 = MessageDigest.getInstance("SHA-256");
        assertArrayEquals(sha256.digest("prefix-left".getBytes()), left.data());
        assertArrayEquals(sha256.digest("prefix-right".getBytes()), right.data());
    }

    @Test
    void testSignAndVerify_LargeBufferedInput() {
        // Given: the same large input hashed in the signing and the verifying provider
        byte[] input = randomBytes(HASH_LIMIT);
        long hProv = acquireProvider("hash-sign");
        assertSuccess(gateway.generateKey(ctx, hProv, AlgorithmId.ECDSA_P256.code(), 0));
        long hHash = assertSuccess(gateway.createHash(ctx, hProv, AlgorithmId.SHA_256.code(), 0L, 0));
        feed(hProv, hHash, input);

        // When
        OutputBuffer signature = OutputBuffer.ofCapacity(128);
        assertSuccess(gateway.signHash(ctx, hProv, hHash, KeySpec.SIGNATURE.code(), 0, signature));

        // Then
        long hPubKey = assertSuccess(gateway.getUserKey(ctx, hProv, KeySpec.SIGNATURE.code()));
        long hVerify = assertSuccess(gateway.createHash(ctx, hProv, AlgorithmId.SHA_256.code(), 0L, 0));
        feed(hProv, hVerify, input);
        assertSuccess(gateway.verifySignature(ctx, hProv, hVerify, signature.data(), hPubKey, 0));

        input[0] ^= 0x01;
        long hTampered = assertSuccess(gateway.createHash(ctx, hProv, AlgorithmId.SHA_256.code(), 0L, 0));
        feed(hProv, hTampered, input);
        assertFailure(gateway.verifySignature(ctx, hProv, hTampered, signature.data(), hPubKey, 0),
            ErrorKind.BACKEND_REJECTED, HostStatus.BAD_SIGNATURE);
    }

    private void feed(long hProv, long hHash, byte[] input) {
        for (int offset = 0; offset < input.length; offset += CHUNK) {
            int end = Math.min(offset + CHUNK, input.length);
            assertSuccess(gateway.hashData(ctx, hProv, hHash, Arrays.copyOfRange(input, offset, end), 0));
        }
    }

    private static byte[] randomBytes(int length) {
        byte[] bytes = new byte[length];
        new Random(42).nextBytes(bytes);
        return bytes;
    }
}

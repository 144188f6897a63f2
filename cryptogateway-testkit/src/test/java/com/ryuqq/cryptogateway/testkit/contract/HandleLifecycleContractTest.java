package com.ryuqq.cryptogateway.testkit.contract;

import com.ryuqq.cryptogateway.core.error.ErrorKind;
import com.ryuqq.cryptogateway.core.error.HostStatus;
import com.ryuqq.cryptogateway.core.model.AlgorithmId;
import com.ryuqq.cryptogateway.core.model.HashParam;
import com.ryuqq.cryptogateway.core.model.KeyParam;
import com.ryuqq.cryptogateway.core.model.OutputBuffer;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: Handle Lifecycle.
 *
 * <p>Every handle the host receives must stay valid until released, and releasing a provider
 * must invalidate every key and hash created through it.</p>
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Unknown, zero and already released handles are rejected with INVALID_HANDLE</li>
 *   <li>Releasing a provider cascades to its keys and hashes</li>
 *   <li>Invalid handles are rejected locally without touching the backend</li>
 *   <li>Children of one provider cannot be used through another provider</li>
 * </ul>
 *
 * @author CryptoGateway Team
 * @since 1.0.0
 */
class HandleLifecycleContractTest extends AbstractGatewayContractTest {

    @Test
    void testUnknownHandle_IsRejected() {
        // When
        var zero = gateway.releaseContext(ctx, 0L, 0);

        // Then
        assertFailure(zero, ErrorKind.INVALID_HANDLE, HostStatus.INVALID_HANDLE);

        var unknown = gateway.generateRandom(ctx, 0x7FFF_0000L, 16);
        assertFailure(unknown, ErrorKind.INVALID_HANDLE, HostStatus.INVALID_HANDLE);
    }

    @Test
    void testReleaseContext_Twice_SecondCallFails() {
        // Given
        long hProv = acquireProvider("lifecycle-double");

        // When
        assertSuccess(gateway.releaseContext(ctx, hProv, 0));
        var second = gateway.releaseContext(ctx, hProv, 0);

        // Then
        assertFailure(second, ErrorKind.INVALID_HANDLE, HostStatus.INVALID_HANDLE);
        assertEquals(0, gateway.stats().liveHandles(), "No handle should survive the release");
    }

    @Test
    void testReleaseContext_CascadesToKeysAndHashes() {
        // Given: a provider owning one key and two hashes
        long hProv = acquireProvider("lifecycle-cascade");
        long hKey = assertSuccess(gateway.generateKey(ctx, hProv, AlgorithmId.ECDSA_P256.code(), 0));
        long hHash = assertSuccess(gateway.createHash(ctx, hProv, AlgorithmId.SHA_256.code(), 0L, 0));
        long hCopy = assertSuccess(gateway.duplicateHash(ctx, hProv, hHash));
        assertEquals(4, gateway.stats().liveHandles());

        // When
        assertSuccess(gateway.releaseContext(ctx, hProv, 0));

        // Then: every child handle is gone
        assertEquals(0, gateway.stats().liveHandles());
        assertFailure(gateway.getKeyParam(ctx, hProv, hKey, KeyParam.ALGID.code(), OutputBuffer.ofCapacity(4)),
            ErrorKind.INVALID_HANDLE, HostStatus.INVALID_HANDLE);
        assertFailure(gateway.hashData(ctx, hProv, hHash, new byte[] {1, 2, 3}, 0),
            ErrorKind.INVALID_HANDLE, HostStatus.INVALID_HANDLE);
        assertFailure(gateway.getHashParam(ctx, hProv, hCopy, HashParam.HASHSIZE.code(), OutputBuffer.ofCapacity(4)),
            ErrorKind.INVALID_HANDLE, HostStatus.INVALID_HANDLE);
    }

    @Test
    void testKeyAfterProviderRelease_NeverReachesBackend() {
        // Given
        long hProv = acquireProvider("lifecycle-local");
        long hKey = assertSuccess(gateway.generateKey(ctx, hProv, AlgorithmId.RSA_KEYX.code(), keyFlags(1024, 0)));
        assertSuccess(gateway.releaseContext(ctx, hProv, 0));
        long callsBefore = connector.remoteCalls();

        // When
        var encrypted = gateway.encrypt(ctx, hProv, hKey, new byte[] {1, 2, 3}, OutputBuffer.ofCapacity(256));

        // Then
        assertFailure(encrypted, ErrorKind.INVALID_HANDLE, HostStatus.INVALID_HANDLE);
        assertEquals(callsBefore, connector.remoteCalls(), "Invalid handles must be rejected locally");
    }

    @Test
    void testChildOfAnotherProvider_IsRejected() {
        // Given: two providers, the key belongs to the first
        long hAlice = acquireProvider("lifecycle-alice");
        long hBob = acquireProvider("lifecycle-bob");
        long hKey = assertSuccess(gateway.generateKey(ctx, hAlice, AlgorithmId.ECDSA_P256.code(), 0));

        // When
        var viaBob = gateway.getKeyParam(ctx, hBob, hKey, KeyParam.KEYLEN.code(), OutputBuffer.ofCapacity(4));

        // Then
        assertFailure(viaBob, ErrorKind.INVALID_HANDLE, HostStatus.INVALID_HANDLE);

        // the key still works through its owner
        OutputBuffer out = OutputBuffer.ofCapacity(4);
        assertEquals(4, assertSuccess(gateway.getKeyParam(ctx, hAlice, hKey, KeyParam.KEYLEN.code(), out)));
    }

    @Test
    void testDestroyHash_OtherHandlesStayValid() {
        // Given
        long hProv = acquireProvider("lifecycle-destroy");
        long hFirst = assertSuccess(gateway.createHash(ctx, hProv, AlgorithmId.SHA_256.code(), 0L, 0));
        long hSecond = assertSuccess(gateway.createHash(ctx, hProv, AlgorithmId.SHA_512.code(), 0L, 0));

        // When
        assertSuccess(gateway.destroyHash(ctx, hProv, hFirst));

        // Then
        assertFailure(gateway.destroyHash(ctx, hProv, hFirst), ErrorKind.INVALID_HANDLE);
        assertSuccess(gateway.hashData(ctx, hProv, hSecond, new byte[] {42}, 0));
        assertEquals(2, gateway.stats().liveHandles());
    }
}

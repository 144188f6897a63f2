package com.ryuqq.cryptogateway.adapter.grpc;

import com.ryuqq.cryptogateway.adapter.inmemory.InMemoryBackendConnector;
import com.ryuqq.cryptogateway.adapter.inmemory.InMemoryCryptoBackend;
import com.ryuqq.cryptogateway.core.contract.GenerateKeyRequest;
import com.ryuqq.cryptogateway.core.contract.KeyMetadata;
import com.ryuqq.cryptogateway.core.contract.SignRequest;
import com.ryuqq.cryptogateway.core.contract.VerifyRequest;
import com.ryuqq.cryptogateway.core.error.BackendConnectException;
import com.ryuqq.cryptogateway.core.error.BackendErrorCode;
import com.ryuqq.cryptogateway.core.error.BackendRejectedException;
import com.ryuqq.cryptogateway.core.error.ErrorKind;
import com.ryuqq.cryptogateway.core.error.TransportException;
import com.ryuqq.cryptogateway.core.error.TransportStatus;
import com.ryuqq.cryptogateway.core.model.AlgorithmId;
import io.grpc.Server;
import io.grpc.Status;
import io.grpc.inprocess.InProcessChannelBuilder;
import io.grpc.inprocess.InProcessServerBuilder;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * GrpcBackendConnector / GrpcBackendChannel 테스트 (in-process 서버).
 *
 * @author CryptoGateway Team
 * @since 1.0.0
 */
class GrpcBackendChannelTest {

    private static final byte[] MESSAGE = "grpc payload".getBytes(StandardCharsets.UTF_8);
    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(2);

    private String serverName;
    private Server server;
    private InMemoryBackendService service;
    private GrpcBackendConnector connector;
    private GrpcBackendChannel channel;

    @BeforeEach
    void setUp() throws IOException {
        InMemoryCryptoBackend backend = new InMemoryCryptoBackend();
        service = new InMemoryBackendService(new InMemoryBackendConnector(backend).connect(CONNECT_TIMEOUT));
        serverName = InProcessServerBuilder.generateName();
        server = InProcessServerBuilder.forName(serverName).addService(service).build().start();
        connector = new GrpcBackendConnector("inprocess:" + serverName,
            () -> InProcessChannelBuilder.forName(serverName).build(), Duration.ofMillis(500));
        channel = connector.connect(CONNECT_TIMEOUT);
    }

    @AfterEach
    void tearDown() {
        channel.close();
        server.shutdownNow();
    }

    // ============================================================
    // 1. 정상 호출
    // ============================================================

    @Test
    void connect_ReturnsHealthyChannel() {
        assertThat(channel.isHealthy()).isTrue();
        assertThat(connector.target()).isEqualTo("inprocess:" + serverName);
    }

    @Test
    void generateKeyAndSign_RoundTripOverGrpc() {
        // given
        KeyMetadata metadata = channel.generateKey(
            new GenerateKeyRequest("c1/SIGNATURE", AlgorithmId.RSA_SIGN, 1024, true, false));

        // when
        byte[] signature = channel.sign(new SignRequest("c1/SIGNATURE", AlgorithmId.SHA_256, MESSAGE));

        // then
        assertThat(metadata.algorithm()).isEqualTo(AlgorithmId.RSA_SIGN);
        assertThat(metadata.exportable()).isTrue();
        assertThat(channel.getKey("c1/SIGNATURE").publicKey()).isEqualTo(metadata.publicKey());
        assertThat(channel.verify(new VerifyRequest("c1/SIGNATURE", AlgorithmId.SHA_256, MESSAGE, signature)))
            .isTrue();
        assertThat(channel.listKeys("c1/")).extracting(KeyMetadata::keyId).containsExactly("c1/SIGNATURE");
    }

    @Test
    void encryptDecrypt_RoundTripOverGrpc() {
        channel.generateKey(new GenerateKeyRequest("c1/EXCHANGE", AlgorithmId.RSA_KEYX, 1024, false, false));

        byte[] ciphertext = channel.encrypt("c1/EXCHANGE", MESSAGE);

        assertThat(channel.decrypt("c1/EXCHANGE", ciphertext)).isEqualTo(MESSAGE);
    }

    @Test
    void digestAndRandom_ReturnBackendResults() throws Exception {
        assertThat(channel.digest(AlgorithmId.SHA_384, MESSAGE))
            .isEqualTo(MessageDigest.getInstance("SHA-384").digest(MESSAGE));
        assertThat(channel.generateRandom(16)).hasSize(16);
    }

    // ============================================================
    // 2. 오류 변환
    // ============================================================

    @Test
    void getKey_Unknown_MapsErrorDetailsToBackendRejected() {
        assertThatThrownBy(() -> channel.getKey("missing"))
            .isInstanceOfSatisfying(BackendRejectedException.class, e -> {
                assertThat(e.reason()).isEqualTo(BackendErrorCode.KEY_NOT_FOUND);
                assertThat(e.kind()).isEqualTo(ErrorKind.BACKEND_REJECTED);
            });
    }

    @Test
    void deleteKey_Unknown_MapsErrorDetailsToBackendRejected() {
        assertThatThrownBy(() -> channel.deleteKey("missing"))
            .isInstanceOfSatisfying(BackendRejectedException.class,
                e -> assertThat(e.reason()).isEqualTo(BackendErrorCode.KEY_NOT_FOUND));
    }

    @Test
    void unavailableStatus_MapsToTransportException() {
        service.failWith(Status.UNAVAILABLE.withDescription("backend draining"));

        assertThatThrownBy(() -> channel.generateRandom(8))
            .isInstanceOfSatisfying(TransportException.class, e -> {
                assertThat(e.status()).isEqualTo(TransportStatus.UNAVAILABLE);
                assertThat(e.getMessage()).contains("backend draining");
            });
    }

    @Test
    void slowBackend_ExceedsCallDeadline() {
        service.delay(Duration.ofMillis(1500));

        assertThatThrownBy(() -> channel.generateRandom(8))
            .isInstanceOfSatisfying(TransportException.class,
                e -> assertThat(e.status()).isEqualTo(TransportStatus.DEADLINE_EXCEEDED));
    }

    // ============================================================
    // 3. 연결 수명
    // ============================================================

    @Test
    void close_MakesChannelUnhealthy() {
        channel.close();

        assertThat(channel.isHealthy()).isFalse();
    }

    @Test
    void connect_UnknownServer_ThrowsBackendConnect() {
        GrpcBackendConnector missing = new GrpcBackendConnector("inprocess:missing",
            () -> InProcessChannelBuilder.forName("no-such-server-" + serverName).build(), Duration.ofMillis(500));

        assertThatThrownBy(() -> missing.connect(Duration.ofMillis(500)))
            .isInstanceOfSatisfying(BackendConnectException.class,
                e -> assertThat(e.target()).isEqualTo("inprocess:missing"));
    }
}

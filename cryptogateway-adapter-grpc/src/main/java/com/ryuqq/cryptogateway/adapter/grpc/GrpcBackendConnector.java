package com.ryuqq.cryptogateway.adapter.grpc;

import com.ryuqq.cryptogateway.core.error.BackendConnectException;
import com.ryuqq.cryptogateway.core.spi.BackendConnector;
import io.grpc.ChannelCredentials;
import io.grpc.ConnectivityState;
import io.grpc.Grpc;
import io.grpc.InsecureChannelCredentials;
import io.grpc.ManagedChannel;
import io.grpc.TlsChannelCredentials;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * gRPC 백엔드 커넥터.
 *
 * <p>connect 호출마다 새 {@link ManagedChannel}을 만들고 connectTimeout 안에 READY가 되기를
 * 기다립니다. TRANSIENT_FAILURE나 SHUTDOWN을 보면 즉시 실패합니다.</p>
 *
 * <p><strong>자격 증명:</strong></p>
 * <ul>
 *   <li>tls=false: {@link InsecureChannelCredentials}</li>
 *   <li>tls=true: {@link TlsChannelCredentials}, caCertPath가 있으면 해당 CA만 신뢰</li>
 *   <li>clientCertPath/clientKeyPath가 있으면 mTLS</li>
 * </ul>
 *
 * @author CryptoGateway Team
 * @since 1.0.0
 */
public class GrpcBackendConnector implements BackendConnector {

    private static final Logger log = LoggerFactory.getLogger(GrpcBackendConnector.class);

    /**
     * 호출 단위 deadline 기본값. ConnectionPoolConfig의 requestTimeout 기본값과 같습니다.
     */
    public static final Duration DEFAULT_CALL_DEADLINE = Duration.ofSeconds(10);

    private final String target;
    private final Supplier<ManagedChannel> channelFactory;
    private final Duration callDeadline;

    public GrpcBackendConnector(GrpcEndpointConfig endpoint) {
        this(endpoint, DEFAULT_CALL_DEADLINE);
    }

    public GrpcBackendConnector(GrpcEndpointConfig endpoint, Duration callDeadline) {
        this(endpoint.target(), channelFactory(endpoint), callDeadline);
    }

    /**
     * 채널 생성 방식을 직접 지정하는 생성자. in-process 채널 등에 사용합니다.
     *
     * @param target 로그와 오류 메시지에 쓰일 대상 이름
     * @param channelFactory 호출마다 새 채널을 반환하는 팩토리
     * @param callDeadline RPC 단위 deadline
     */
    public GrpcBackendConnector(String target, Supplier<ManagedChannel> channelFactory, Duration callDeadline) {
        if (target == null || target.isBlank()) {
            throw new IllegalArgumentException("target cannot be null or blank");
        }
        if (channelFactory == null) {
            throw new IllegalArgumentException("channelFactory cannot be null");
        }
        if (callDeadline == null || callDeadline.isNegative() || callDeadline.isZero()) {
            throw new IllegalArgumentException("callDeadline must be positive (current: " + callDeadline + ")");
        }
        this.target = target;
        this.channelFactory = channelFactory;
        this.callDeadline = callDeadline;
    }

    @Override
    public GrpcBackendChannel connect(Duration connectTimeout) {
        ManagedChannel channel;
        try {
            channel = channelFactory.get();
        } catch (RuntimeException e) {
            throw new BackendConnectException(target, "Failed to build channel", e);
        }

        try {
            awaitReady(channel, connectTimeout);
        } catch (InterruptedException e) {
            channel.shutdownNow();
            Thread.currentThread().interrupt();
            throw new BackendConnectException(target, "Interrupted while connecting", e);
        } catch (BackendConnectException e) {
            channel.shutdownNow();
            throw e;
        }
        log.debug("gRPC channel READY: target={}", target);
        return new GrpcBackendChannel(channel, callDeadline);
    }

    @Override
    public String target() {
        return target;
    }

    // ========== 내부 구현 ==========

    private void awaitReady(ManagedChannel channel, Duration connectTimeout) throws InterruptedException {
        long deadline = System.nanoTime() + connectTimeout.toNanos();
        ConnectivityState state = channel.getState(true);
        while (state != ConnectivityState.READY) {
            if (state == ConnectivityState.TRANSIENT_FAILURE || state == ConnectivityState.SHUTDOWN) {
                throw new BackendConnectException(target, "Channel entered " + state, null);
            }
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                throw new BackendConnectException(target,
                    "Not ready within " + connectTimeout.toMillis() + "ms (state: " + state + ")", null);
            }
            CountDownLatch changed = new CountDownLatch(1);
            channel.notifyWhenStateChanged(state, changed::countDown);
            changed.await(remaining, TimeUnit.NANOSECONDS);
            state = channel.getState(true);
        }
    }

    private static Supplier<ManagedChannel> channelFactory(GrpcEndpointConfig endpoint) {
        if (endpoint == null) {
            throw new IllegalArgumentException("endpoint cannot be null");
        }
        ChannelCredentials credentials = credentials(endpoint);
        log.info("gRPC connector configured: target={}, tls={}, mtls={}",
            endpoint.target(), endpoint.tls(), endpoint.isMutualTls());
        return () -> Grpc.newChannelBuilder(endpoint.target(), credentials).build();
    }

    static ChannelCredentials credentials(GrpcEndpointConfig endpoint) {
        if (!endpoint.tls()) {
            return InsecureChannelCredentials.create();
        }
        try {
            TlsChannelCredentials.Builder builder = TlsChannelCredentials.newBuilder();
            if (endpoint.caCertPath() != null) {
                builder.trustManager(endpoint.caCertPath().toFile());
            }
            if (endpoint.isMutualTls()) {
                builder.keyManager(endpoint.clientCertPath().toFile(), endpoint.clientKeyPath().toFile());
            }
            return builder.build();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load TLS material for " + endpoint.target(), e);
        }
    }
}

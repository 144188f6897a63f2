package com.ryuqq.cryptogateway.testkit.fault;

import com.ryuqq.cryptogateway.core.contract.GenerateKeyRequest;
import com.ryuqq.cryptogateway.core.contract.ImportKeyRequest;
import com.ryuqq.cryptogateway.core.contract.KeyMetadata;
import com.ryuqq.cryptogateway.core.contract.SignRequest;
import com.ryuqq.cryptogateway.core.contract.VerifyRequest;
import com.ryuqq.cryptogateway.core.error.BackendConnectException;
import com.ryuqq.cryptogateway.core.error.TransportException;
import com.ryuqq.cryptogateway.core.error.TransportStatus;
import com.ryuqq.cryptogateway.core.model.AlgorithmId;
import com.ryuqq.cryptogateway.core.spi.BackendChannel;
import com.ryuqq.cryptogateway.core.spi.BackendConnector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * 장애 주입 커넥터.
 *
 * <p>다른 커넥터를 감싸고, 그 커넥터가 만든 채널의 모든 원격 호출 앞에 지연과 실패를 끼워 넣습니다.
 * 연결 시도와 원격 호출 횟수를 세므로 "네트워크 시도 없음"을 검증할 수 있습니다.</p>
 *
 * <p><strong>주입 가능한 장애:</strong></p>
 * <ul>
 *   <li>{@link #failConnects(boolean)}: 연결 실패 (CONNECT_ERROR)</li>
 *   <li>{@link #delayCalls(Duration)}: 호출 지연. 인터럽트되면 CANCELLED 전송 오류</li>
 *   <li>{@link #failCalls(Supplier)}: 호출마다 지정한 예외</li>
 *   <li>{@link #failNextCalls(int, Supplier)}: 다음 N번의 호출만 실패</li>
 * </ul>
 *
 * @author CryptoGateway Team
 * @since 1.0.0
 */
public final class FaultInjectingConnector implements BackendConnector {

    private static final Logger log = LoggerFactory.getLogger(FaultInjectingConnector.class);

    private final BackendConnector delegate;

    private volatile boolean connectFailure;
    private volatile Duration callDelay = Duration.ZERO;
    private final AtomicReference<Supplier<? extends RuntimeException>> callFailure = new AtomicReference<>();
    private final AtomicInteger remainingFailures = new AtomicInteger(-1);

    private final AtomicLong connectAttempts = new AtomicLong();
    private final AtomicLong remoteCalls = new AtomicLong();
    private final AtomicInteger inFlight = new AtomicInteger();

    public FaultInjectingConnector(BackendConnector delegate) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate cannot be null");
        }
        this.delegate = delegate;
    }

    // ========== 장애 설정 ==========

    public FaultInjectingConnector failConnects(boolean fail) {
        this.connectFailure = fail;
        return this;
    }

    public FaultInjectingConnector delayCalls(Duration delay) {
        if (delay == null || delay.isNegative()) {
            throw new IllegalArgumentException("delay must be zero or positive (current: " + delay + ")");
        }
        this.callDelay = delay;
        return this;
    }

    public FaultInjectingConnector failCalls(Supplier<? extends RuntimeException> failure) {
        remainingFailures.set(-1);
        callFailure.set(failure);
        return this;
    }

    public FaultInjectingConnector failNextCalls(int count, Supplier<? extends RuntimeException> failure) {
        if (count <= 0) {
            throw new IllegalArgumentException("count must be positive (current: " + count + ")");
        }
        remainingFailures.set(count);
        callFailure.set(failure);
        return this;
    }

    /**
     * 모든 장애 설정 해제. 카운터는 유지합니다.
     */
    public FaultInjectingConnector heal() {
        connectFailure = false;
        callDelay = Duration.ZERO;
        callFailure.set(null);
        remainingFailures.set(-1);
        return this;
    }

    // ========== 관측 ==========

    public long connectAttempts() {
        return connectAttempts.get();
    }

    public long remoteCalls() {
        return remoteCalls.get();
    }

    public int inFlight() {
        return inFlight.get();
    }

    // ========== BackendConnector ==========

    @Override
    public BackendChannel connect(Duration connectTimeout) {
        connectAttempts.incrementAndGet();
        if (connectFailure) {
            throw new BackendConnectException(target(), "Injected connect failure", null);
        }
        return new FaultInjectingChannel(delegate.connect(connectTimeout));
    }

    @Override
    public String target() {
        return delegate.target();
    }

    private void beforeCall(String operation) {
        remoteCalls.incrementAndGet();
        Duration delay = callDelay;
        if (!delay.isZero()) {
            try {
                Thread.sleep(delay.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new TransportException(TransportStatus.CANCELLED, operation + " cancelled while delayed", e);
            }
        }
        Supplier<? extends RuntimeException> failure = callFailure.get();
        if (failure != null && consumeFailure()) {
            log.debug("Injecting failure into {}", operation);
            throw failure.get();
        }
    }

    private boolean consumeFailure() {
        while (true) {
            int remaining = remainingFailures.get();
            if (remaining < 0) {
                return true;
            }
            if (remaining == 0) {
                return false;
            }
            if (remainingFailures.compareAndSet(remaining, remaining - 1)) {
                return true;
            }
        }
    }

    /**
     * 호출마다 장애를 적용하는 채널.
     */
    private final class FaultInjectingChannel implements BackendChannel {

        private final BackendChannel target;

        private FaultInjectingChannel(BackendChannel target) {
            this.target = target;
        }

        private <T> T around(String operation, Supplier<T> call) {
            inFlight.incrementAndGet();
            try {
                beforeCall(operation);
                return call.get();
            } finally {
                inFlight.decrementAndGet();
            }
        }

        @Override
        public KeyMetadata generateKey(GenerateKeyRequest request) {
            return around("generateKey", () -> target.generateKey(request));
        }

        @Override
        public KeyMetadata getKey(String keyId) {
            return around("getKey", () -> target.getKey(keyId));
        }

        @Override
        public List<KeyMetadata> listKeys(String keyIdPrefix) {
            return around("listKeys", () -> target.listKeys(keyIdPrefix));
        }

        @Override
        public void deleteKey(String keyId) {
            around("deleteKey", () -> {
                target.deleteKey(keyId);
                return null;
            });
        }

        @Override
        public KeyMetadata importKey(ImportKeyRequest request) {
            return around("importKey", () -> target.importKey(request));
        }

        @Override
        public byte[] sign(SignRequest request) {
            return around("sign", () -> target.sign(request));
        }

        @Override
        public boolean verify(VerifyRequest request) {
            return around("verify", () -> target.verify(request));
        }

        @Override
        public byte[] encrypt(String keyId, byte[] plaintext) {
            return around("encrypt", () -> target.encrypt(keyId, plaintext));
        }

        @Override
        public byte[] decrypt(String keyId, byte[] ciphertext) {
            return around("decrypt", () -> target.decrypt(keyId, ciphertext));
        }

        @Override
        public byte[] digest(AlgorithmId hashAlgorithm, byte[] data) {
            return around("digest", () -> target.digest(hashAlgorithm, data));
        }

        @Override
        public byte[] generateRandom(int length) {
            return around("generateRandom", () -> target.generateRandom(length));
        }

        @Override
        public boolean isHealthy() {
            return target.isHealthy();
        }

        @Override
        public void close() {
            target.close();
        }
    }
}

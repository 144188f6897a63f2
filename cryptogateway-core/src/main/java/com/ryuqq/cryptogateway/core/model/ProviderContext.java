package com.ryuqq.cryptogateway.core.model;

import java.util.UUID;

/**
 * 프로바이더 컨텍스트.
 *
 * <p>호스트가 acquireContext로 얻는 세션입니다. 컨테이너 이름이 없으면 검증 전용
 * (verify context) 세션이며, 이 경우 영속 키에 접근할 수 없습니다.</p>
 *
 * <p>소유한 키/해시 목록은 핸들 테이블의 부모-자식 인덱스가 관리합니다.</p>
 *
 * @author CryptoGateway Team
 * @since 1.0.0
 */
public final class ProviderContext implements ManagedObject {

    private final String sessionId;
    private final String container;
    private final AcquireFlags flags;
    private volatile long clientWindow;

    private ProviderContext(String sessionId, String container, AcquireFlags flags) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId cannot be null or blank");
        }
        if (flags == null) {
            throw new IllegalArgumentException("flags cannot be null");
        }
        this.sessionId = sessionId;
        this.container = container;
        this.flags = flags;
    }

    /**
     * 새 세션 생성.
     *
     * @param container 컨테이너 이름 (null이면 verify context)
     * @param flags 획득 플래그
     * @return ProviderContext
     */
    public static ProviderContext open(String container, AcquireFlags flags) {
        return new ProviderContext(UUID.randomUUID().toString(), container, flags);
    }

    @Override
    public HandleKind kind() {
        return HandleKind.PROVIDER;
    }

    public String sessionId() {
        return sessionId;
    }

    /**
     * 컨테이너 이름.
     *
     * @return 컨테이너 이름, verify context이면 null
     */
    public String container() {
        return container;
    }

    public AcquireFlags flags() {
        return flags;
    }

    public boolean isVerifyContext() {
        return container == null;
    }

    public long clientWindow() {
        return clientWindow;
    }

    public void setClientWindow(long clientWindow) {
        this.clientWindow = clientWindow;
    }

    /**
     * 컨테이너 키의 백엔드 식별자.
     *
     * @param spec 키 슬롯
     * @return "컨테이너/슬롯" 형식 식별자
     * @throws IllegalStateException verify context인 경우
     */
    public String keyIdFor(KeySpec spec) {
        if (container == null) {
            throw new IllegalStateException("verify context has no persistent keys");
        }
        return container + "/" + spec.name();
    }

    @Override
    public String toString() {
        return "ProviderContext{sessionId=" + sessionId + ", container=" + container + ", flags=" + flags + '}';
    }
}

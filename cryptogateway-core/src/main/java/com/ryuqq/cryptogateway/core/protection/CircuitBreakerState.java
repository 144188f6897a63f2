package com.ryuqq.cryptogateway.core.protection;

/**
 * 백엔드 연결 상태에 대한 브레이커의 판단.
 *
 * <pre>
 * CLOSED ──(연속 실패 failureThreshold회)──► OPEN
 * OPEN ──(마지막 실패 + timeout 경과)──► HALF_OPEN
 * HALF_OPEN ──(탐색 성공 비율 ≥ successThreshold)──► CLOSED
 * HALF_OPEN ──(탐색 실패 또는 비율 미달)──► OPEN
 * </pre>
 *
 * @author CryptoGateway Team
 * @since 1.0.0
 */
public enum CircuitBreakerState {

    CLOSED("backend healthy"),

    /** 호출은 네트워크에 나가지 않고 CIRCUIT_OPEN으로 실패합니다. */
    OPEN("backend marked unavailable"),

    /** 제한된 수의 탐색 호출만 통과합니다. */
    HALF_OPEN("probing backend, probe slots in use");

    private final String rejectionReason;

    CircuitBreakerState(String rejectionReason) {
        this.rejectionReason = rejectionReason;
    }

    /**
     * 이 상태에서 호출이 거부됐을 때 호스트에게 보여줄 사유.
     *
     * @return 사유 문구
     */
    public String rejectionReason() {
        return rejectionReason;
    }

    public boolean isProbing() {
        return this == HALF_OPEN;
    }
}

package com.ryuqq.cryptogateway.core.model;

import com.ryuqq.cryptogateway.core.error.InsufficientBufferException;

/**
 * 호스트 출력 버퍼.
 *
 * <p>호스트의 "버퍼 포인터 + 길이 in/out" 관례를 표현합니다.</p>
 * <ul>
 *   <li>버퍼 없음 (size query): 성공하며 필요한 길이만 보고</li>
 *   <li>버퍼가 작음: ERROR_MORE_DATA로 실패하며 필요한 길이를 보고</li>
 *   <li>버퍼가 충분함: 데이터를 쓰고 실제 길이를 보고</li>
 * </ul>
 *
 * <p>어느 경우든 {@link #length()}는 호출 후 호스트가 length 출력 인자로 받을 값입니다.</p>
 *
 * @author CryptoGateway Team
 * @since 1.0.0
 */
public final class OutputBuffer {

    private final Integer capacity;
    private byte[] data;
    private int length;

    private OutputBuffer(Integer capacity) {
        if (capacity != null && capacity < 0) {
            throw new IllegalArgumentException("capacity cannot be negative");
        }
        this.capacity = capacity;
        this.data = new byte[0];
    }

    /**
     * 크기 조회용 버퍼 (호스트가 null 포인터를 전달한 경우).
     *
     * @return size query 버퍼
     */
    public static OutputBuffer sizeQuery() {
        return new OutputBuffer(null);
    }

    /**
     * 주어진 용량의 버퍼.
     *
     * @param capacity 바이트 용량
     * @return 출력 버퍼
     */
    public static OutputBuffer ofCapacity(int capacity) {
        return new OutputBuffer(capacity);
    }

    public boolean isSizeQuery() {
        return capacity == null;
    }

    /**
     * 결과 기록.
     *
     * @param result 결과 바이트
     * @throws InsufficientBufferException 버퍼 용량이 부족한 경우 (필요 길이는 기록됨)
     */
    public void fill(byte[] result) {
        this.length = result.length;
        if (capacity == null) {
            return;
        }
        if (capacity < result.length) {
            throw new InsufficientBufferException(result.length, capacity);
        }
        this.data = result.clone();
    }

    /**
     * 필요 길이 또는 실제로 쓴 길이.
     *
     * @return 길이
     */
    public int length() {
        return length;
    }

    /**
     * 기록된 데이터.
     *
     * @return 데이터 사본, size query이거나 실패한 경우 빈 배열
     */
    public byte[] data() {
        return data.clone();
    }

    public int capacity() {
        return capacity == null ? 0 : capacity;
    }
}

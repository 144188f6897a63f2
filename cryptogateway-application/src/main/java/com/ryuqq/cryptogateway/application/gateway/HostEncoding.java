package com.ryuqq.cryptogateway.application.gateway;

import com.ryuqq.cryptogateway.core.error.InvalidParameterException;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;

/**
 * 호스트 파라미터 값 인코딩 (little-endian DWORD, NUL 종료 ASCII).
 */
final class HostEncoding {

    private HostEncoding() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    static byte[] dword(int value) {
        return ByteBuffer.allocate(Integer.BYTES).order(ByteOrder.LITTLE_ENDIAN).putInt(value).array();
    }

    static byte[] asciiz(String value) {
        byte[] text = value.getBytes(StandardCharsets.US_ASCII);
        byte[] result = new byte[text.length + 1];
        System.arraycopy(text, 0, result, 0, text.length);
        return result;
    }

    static int readDword(byte[] value) {
        if (value == null || value.length != Integer.BYTES) {
            throw new InvalidParameterException("DWORD parameter must be exactly 4 bytes");
        }
        return ByteBuffer.wrap(value).order(ByteOrder.LITTLE_ENDIAN).getInt();
    }

    static long readHandleValue(byte[] value) {
        if (value == null) {
            throw new InvalidParameterException("parameter value cannot be null");
        }
        if (value.length == Integer.BYTES) {
            return Integer.toUnsignedLong(readDword(value));
        }
        if (value.length == Long.BYTES) {
            return ByteBuffer.wrap(value).order(ByteOrder.LITTLE_ENDIAN).getLong();
        }
        throw new InvalidParameterException("window handle must be 4 or 8 bytes");
    }
}

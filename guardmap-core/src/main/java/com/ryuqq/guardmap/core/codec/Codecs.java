package com.ryuqq.guardmap.core.codec;

import com.ryuqq.guardmap.core.exception.DataIntegrityException;
import com.ryuqq.guardmap.core.spi.Codec;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * 자주 쓰는 {@link Codec} 구현 모음.
 *
 * @author GuardMap Team
 * @since 1.0.0
 */
public final class Codecs {

    private static final Codec<String> UTF8 = new Codec<>() {
        @Override
        public byte[] encode(String value) {
            return value.getBytes(StandardCharsets.UTF_8);
        }

        @Override
        public String decode(byte[] bytes) {
            return new String(bytes, StandardCharsets.UTF_8);
        }
    };

    private static final Codec<Integer> INT32 = new Codec<>() {
        @Override
        public byte[] encode(Integer value) {
            return ByteBuffer.allocate(Integer.BYTES).putInt(value).array();
        }

        @Override
        public Integer decode(byte[] bytes) {
            requireLength(bytes, Integer.BYTES, "int32");
            return ByteBuffer.wrap(bytes).getInt();
        }
    };

    private static final Codec<Long> INT64 = new Codec<>() {
        @Override
        public byte[] encode(Long value) {
            return ByteBuffer.allocate(Long.BYTES).putLong(value).array();
        }

        @Override
        public Long decode(byte[] bytes) {
            requireLength(bytes, Long.BYTES, "int64");
            return ByteBuffer.wrap(bytes).getLong();
        }
    };

    private static final Codec<byte[]> BYTES = new Codec<>() {
        @Override
        public byte[] encode(byte[] value) {
            return Arrays.copyOf(value, value.length);
        }

        @Override
        public byte[] decode(byte[] bytes) {
            return Arrays.copyOf(bytes, bytes.length);
        }
    };

    private Codecs() {
    }

    public static Codec<String> utf8String() {
        return UTF8;
    }

    /**
     * Big-endian 4바이트 정수.
     *
     * @return codec
     */
    public static Codec<Integer> int32() {
        return INT32;
    }

    /**
     * Big-endian 8바이트 정수.
     *
     * @return codec
     */
    public static Codec<Long> int64() {
        return INT64;
    }

    public static Codec<byte[]> bytes() {
        return BYTES;
    }

    private static void requireLength(byte[] bytes, int expected, String type) {
        if (bytes.length != expected) {
            throw new DataIntegrityException(
                type + " requires " + expected + " bytes (current: " + bytes.length + ")"
            );
        }
    }
}

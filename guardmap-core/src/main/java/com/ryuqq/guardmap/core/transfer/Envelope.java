package com.ryuqq.guardmap.core.transfer;

import java.util.Arrays;

/**
 * 체크섬이 붙은 전송 단위.
 *
 * <p>하나의 논리 필드(크기, 최대 크기, 버킷 수, 각 레코드)가 하나의 Envelope에 담깁니다.
 * 페이로드는 생성 시와 조회 시 모두 복사되므로 외부에서 변경할 수 없습니다.</p>
 *
 * @param checksum 페이로드의 CRC-32
 * @param payload 페이로드 바이트
 * @author GuardMap Team
 * @since 1.0.0
 */
public record Envelope(int checksum, byte[] payload) {

    public Envelope {
        if (payload == null) {
            throw new IllegalArgumentException("payload cannot be null");
        }
        payload = payload.clone();
    }

    /**
     * 페이로드로부터 체크섬을 계산하여 Envelope을 생성합니다.
     *
     * @param payload 페이로드
     * @return Envelope
     */
    public static Envelope seal(byte[] payload) {
        if (payload == null) {
            throw new IllegalArgumentException("payload cannot be null");
        }
        return new Envelope(Crc32Checksum.compute(payload), payload);
    }

    @Override
    public byte[] payload() {
        return payload.clone();
    }

    public int length() {
        return payload.length;
    }

    public boolean isIntact() {
        return Crc32Checksum.matches(checksum, payload);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Envelope)) {
            return false;
        }
        Envelope other = (Envelope) o;
        return checksum == other.checksum && Arrays.equals(payload, other.payload);
    }

    @Override
    public int hashCode() {
        return 31 * Integer.hashCode(checksum) + Arrays.hashCode(payload);
    }

    @Override
    public String toString() {
        return "Envelope{checksum=" + Integer.toHexString(checksum) + ", length=" + payload.length + "}";
    }
}

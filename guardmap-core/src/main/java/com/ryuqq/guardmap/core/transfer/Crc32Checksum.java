package com.ryuqq.guardmap.core.transfer;

import java.util.zip.CRC32;

/**
 * CRC-32 (IEEE 802.3) 체크섬.
 *
 * @author GuardMap Team
 * @since 1.0.0
 */
public final class Crc32Checksum {

    private Crc32Checksum() {
    }

    public static int compute(byte[] payload) {
        CRC32 crc = new CRC32();
        crc.update(payload, 0, payload.length);
        return (int) crc.getValue();
    }

    public static boolean matches(int checksum, byte[] payload) {
        return compute(payload) == checksum;
    }
}

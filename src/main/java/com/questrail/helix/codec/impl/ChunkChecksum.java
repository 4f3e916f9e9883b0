package com.questrail.helix.codec.impl;

import java.util.zip.CRC32;

/**
 * ChunkChecksum
 * -----------------------------------------------------------------------------
 * CRC-32 (IEEE 802.3) over a chunk's data bytes, recorded in the chunk header
 * and re-checked after error correction.
 *
 * <p>Integrity only, not authentication: the Reed-Solomon code carries the
 * correction burden and this is the final confirmation that it succeeded.</p>
 *
 * <p>Check value ("123456789"): {@code 0xCBF43926}.</p>
 */
public final class ChunkChecksum
{
    private ChunkChecksum() {}

    /**
     * Computes the checksum of {@code data}.
     *
     * @return unsigned 32-bit value in a {@code long}
     */
    public static long compute(byte[] data)
    {
        final CRC32 crc = new CRC32();
        crc.update(data);
        return crc.getValue();
    }
}

package com.questrail.helix.error;

/**
 * Indicates that a chunk passed error correction and header validation but its
 * data does not match the CRC-32 recorded in its header.
 *
 * <p>This means corruption escaped the Reed-Solomon guarantee, for example by
 * exceeding the correction bound in a way that decoded to a different valid
 * codeword.</p>
 */
public final class ChecksumMismatchException extends DnaCodecException
{
    private final int chunkIndex;
    private final long expected;
    private final long actual;

    public ChecksumMismatchException(int chunkIndex, long expected, long actual) {
        super(ErrorKind.CHECKSUM_MISMATCH, String.format(
                "Chunk %d checksum mismatch: header=0x%08X computed=0x%08X",
                chunkIndex, expected, actual));
        this.chunkIndex = chunkIndex;
        this.expected = expected;
        this.actual = actual;
    }

    public int chunkIndex() {
        return chunkIndex;
    }

    public long expected() {
        return expected;
    }

    public long actual() {
        return actual;
    }
}

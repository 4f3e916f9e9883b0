package com.questrail.helix.error;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class DecodeFailureExceptionTest
{
    @Test
    void failuresAreSortedBySequencePosition()
    {
        ChunkFailure late = new ChunkFailure(5, 2, new ChecksumMismatchException(2, 1L, 2L));
        ChunkFailure early = new ChunkFailure(1, -1, new UncorrectableChunkException(1, -1, "too many errors"));

        DecodeFailureException e = new DecodeFailureException(List.of(late, early));

        assertEquals(List.of(early, late), e.failures());
        assertEquals(ErrorKind.UNCORRECTABLE, e.kind());
        assertSame(early.cause(), e.getCause());
        assertEquals(1, e.getSuppressed().length);
        assertSame(late.cause(), e.getSuppressed()[0]);
    }

    @Test
    void reportsEveryKindPresent()
    {
        DecodeFailureException e = new DecodeFailureException(List.of(
                new ChunkFailure(0, -1, new ValidationException("bad symbol")),
                new ChunkFailure(3, 3, new ChecksumMismatchException(3, 0L, 5L))));

        assertTrue(e.hasFailureOfKind(ErrorKind.VALIDATION));
        assertTrue(e.hasFailureOfKind(ErrorKind.CHECKSUM_MISMATCH));
        assertFalse(e.hasFailureOfKind(ErrorKind.UNCORRECTABLE));
    }

    @Test
    void messageListsEachSequence()
    {
        DecodeFailureException e = new DecodeFailureException(List.of(
                new ChunkFailure(4, -1, new ValidationException("bad symbol"))));

        assertTrue(e.getMessage().startsWith("1 sequence failed validation"));
        assertTrue(e.getMessage().contains("sequence=4"));
        assertTrue(e.getMessage().contains("chunk=?"));
    }

    @Test
    void rejectsEmptyList()
    {
        assertThrows(IllegalArgumentException.class, () -> new DecodeFailureException(List.of()));
    }

    @Test
    void chunkFailureExposesKnownIndex()
    {
        assertTrue(new ChunkFailure(0, -1, new ValidationException("x")).knownChunkIndex().isEmpty());
        assertEquals(7, new ChunkFailure(0, 7, new ChecksumMismatchException(7, 0, 1)).knownChunkIndex().getAsInt());
    }

    @Test
    void uncorrectableNamesClaimedIndexWhenKnown()
    {
        UncorrectableChunkException withHint = new UncorrectableChunkException(2, 9, "locator degree 6");
        assertEquals(9, withHint.claimedChunkIndex().getAsInt());
        assertTrue(withHint.getMessage().contains("claims chunk index 9"));

        UncorrectableChunkException withoutHint = new UncorrectableChunkException(2, -1, "locator degree 6");
        assertTrue(withoutHint.claimedChunkIndex().isEmpty());
    }
}

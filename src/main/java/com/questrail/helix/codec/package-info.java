/**
 * Helix Codec: Chunk-Level Wire Format
 * =============================================================================
 *
 * <p>This package defines the <strong>codec layer</strong>: the byte-level
 * rules that turn a chunk into a protected block and back.</p>
 *
 * <ul>
 *   <li>Fixed-width chunk header serialization and validation</li>
 *   <li>Reed-Solomon parity over header and data together</li>
 *   <li>CRC-32 confirmation of chunk data after correction</li>
 *   <li>2-bit symbol mapping between bytes and {@code A, T, C, G}</li>
 * </ul>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   payload / envelope bytes
 *        → Chunker                (fixed-size split, header per chunk)
 *            → ChunkEncoder       (header ‖ data ‖ parity)
 *                → SymbolCodec    (4 symbols per byte)
 *                    → sequence
 *
 *   sequence
 *        → SymbolCodec
 *            → ChunkDecoder       (correct, parse header, verify checksum)
 *                → Reassembler    (cross-chunk checks, ordered merge)
 * </pre>
 *
 * <h2>Important Boundaries</h2>
 * <ul>
 *   <li>Each chunk is exactly one Reed-Solomon codeword of at most 255 bytes.</li>
 *   <li>The header travels inside the codeword; it is corrected before it is read.</li>
 *   <li>Nothing in this layer knows about passwords, ordering or completeness.</li>
 * </ul>
 */
package com.questrail.helix.codec;

/**
 * Helix Codec: Concrete Implementation
 * =============================================================================
 *
 * <p>Concrete chunk encoder and decoder plus the primitives they are built
 * from.</p>
 *
 * <pre>
 *   encode:  HeaderCodec.encodeHeader → ReedSolomonCoder.protect → SymbolCodec.bytesToSymbols
 *   decode:  SymbolCodec.symbolsToBytes → ReedSolomonCoder.recover
 *              → HeaderCodec.decodeHeader → ChunkChecksum
 * </pre>
 *
 * <p>This layer is strictly:</p>
 * <ul>
 *   <li>per-chunk (no cross-chunk state)</li>
 *   <li>deterministic</li>
 *   <li>free of encryption and ordering concerns</li>
 * </ul>
 *
 * <p>Unlike a datagram codec, nothing here is dropped silently: every failure
 * is raised as a typed {@link com.questrail.helix.error.DnaCodecException} so
 * the orchestrator can report it against the offending sequence.</p>
 */
package com.questrail.helix.codec.impl;

package com.questrail.helix.constraints;

/**
 * A single way in which a sequence misses the {@link ConstraintPolicy}.
 */
public sealed interface ConstraintViolation
        permits ConstraintViolation.GcContent, ConstraintViolation.Homopolymer {

    /**
     * GC fraction of the whole sequence lies outside the allowed band.
     */
    record GcContent(double actual, double min, double max) implements ConstraintViolation {
        @Override
        public String toString() {
            return String.format("GcContent[%.3f outside %.3f..%.3f]", actual, min, max);
        }
    }

    /**
     * A run of one symbol longer than allowed.
     *
     * @param offset symbol offset where the run starts
     */
    record Homopolymer(int offset, char symbol, int length, int maxAllowed) implements ConstraintViolation {
        @Override
        public String toString() {
            return "Homopolymer[" + symbol + "x" + length + " at " + offset + ", max " + maxAllowed + "]";
        }
    }
}

package com.questrail.helix.api;

import java.util.Objects;

/**
 * Immutable per-call options for {@link DnaCodec#encode(byte[], EncodeOptions)}.
 *
 * <p>A {@code null} or empty password disables encryption. Structural limits on
 * {@code baseLength} depend on the correction level and are checked by the
 * codec, which reports violations as
 * {@link com.questrail.helix.error.ConfigurationException}.</p>
 */
public record EncodeOptions(
    String password,
    int baseLength,
    CorrectionLevel correctionLevel
) {
    public static final int DEFAULT_BASE_LENGTH = 200;

    public EncodeOptions {
        Objects.requireNonNull(correctionLevel, "correctionLevel");
    }

    /**
     * Returns true if a non-empty password was supplied.
     */
    public boolean encrypted() {
        return password != null && !password.isEmpty();
    }

    @Override
    public String toString() {
        return "EncodeOptions[" +
                "password=" + (encrypted() ? "****" : "<none>") +
                ", baseLength=" + baseLength +
                ", correctionLevel=" + correctionLevel +
                ']';
    }

    public static EncodeOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String password;
        private int baseLength = DEFAULT_BASE_LENGTH;
        private CorrectionLevel correctionLevel = CorrectionLevel.BASIC;

        public Builder withPassword(String password) {
            this.password = password;
            return this;
        }

        public Builder withBaseLength(int baseLength) {
            this.baseLength = baseLength;
            return this;
        }

        public Builder withCorrectionLevel(CorrectionLevel correctionLevel) {
            this.correctionLevel = correctionLevel;
            return this;
        }

        public EncodeOptions build() {
            return new EncodeOptions(password, baseLength, correctionLevel);
        }
    }
}

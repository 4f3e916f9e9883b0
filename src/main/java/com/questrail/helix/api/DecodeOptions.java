package com.questrail.helix.api;

import java.util.Objects;

/**
 * Immutable per-call options for {@link DnaCodec#decode(java.util.Collection, DecodeOptions)}.
 *
 * <p>{@code correctionLevel} is advisory. The level recorded in each chunk
 * header is authoritative; the advisory value only decides which level the
 * decoder attempts first.</p>
 */
public record DecodeOptions(
    String password,
    CorrectionLevel correctionLevel
) {
    public DecodeOptions {
        Objects.requireNonNull(correctionLevel, "correctionLevel");
    }

    public boolean hasPassword() {
        return password != null && !password.isEmpty();
    }

    @Override
    public String toString() {
        return "DecodeOptions[" +
                "password=" + (hasPassword() ? "****" : "<none>") +
                ", correctionLevel=" + correctionLevel +
                ']';
    }

    public static DecodeOptions defaults() {
        return new DecodeOptions(null, CorrectionLevel.BASIC);
    }

    public static DecodeOptions withPassword(String password) {
        return new DecodeOptions(password, CorrectionLevel.BASIC);
    }
}

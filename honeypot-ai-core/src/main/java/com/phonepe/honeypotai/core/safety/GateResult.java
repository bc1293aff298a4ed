package com.phonepe.honeypotai.core.safety;

import lombok.Value;

/**
 * Outcome of checking an outgoing reply
 */
@Value
public class GateResult {
    boolean ok;
    String violation;

    public static GateResult pass() {
        return new GateResult(true, null);
    }

    public static GateResult fail(final String violation) {
        return new GateResult(false, violation);
    }
}

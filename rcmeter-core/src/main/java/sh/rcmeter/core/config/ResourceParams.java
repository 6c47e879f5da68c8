// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rcmeter.core.config;

import java.util.Objects;

import sh.rcmeter.primitives.CurveParams;

/**
 * Dynamics and price curve of one resource.
 */
public record ResourceParams(ResourceDynamicsParams dynamics, CurveParams priceCurve) {

    public ResourceParams {
        Objects.requireNonNull(dynamics, "dynamics cannot be null");
        Objects.requireNonNull(priceCurve, "priceCurve cannot be null");
    }
}

/**
 * Copyright (C) 2026 Hal Hildebrand. All rights reserved.
 *
 * This file is part of Strata.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.strata.engine;

import com.hellblazer.strata.common.VectorMath;

import java.util.Objects;

/**
 * Adaptive, sign-preserving logarithmic compression of a pressure vector.
 * <p>
 * For each tick:
 * <pre>
 * mean' = tau * mean + (1 - tau) * ||p||
 * gain  = clip(alpha0 / (epsilon + mean'), gainMin, gainMax)
 * p^[i] = sign(p[i]) * ln(1 + gain * |p[i]|) / ln(logBase)
 * </pre>
 * The gain shrinks as recent pressure grows, so inputs spanning many orders of magnitude
 * land in a comparable range. Near zero the transform is approximately linear with slope
 * {@code gain / ln(logBase)}. The output is odd in p for a fixed gain state.
 * <p>
 * The running mean saturates at {@link Double#MAX_VALUE}, and a non-finite pressure
 * magnitude leaves it unchanged. When disabled the pressure is returned unchanged and the
 * gain state is not touched.
 *
 * @author hal.hildebrand
 */
public final class LogAlignment {

    /**
     * Outcome of aligning one pressure vector.
     *
     * @param transformed aligned pressure p^
     * @param gainState   gain state to persist for the next tick
     */
    public record Result(double[] transformed, AdaptiveGainState gainState) {
    }

    private final LogAlignmentConfig config;
    private final double             logNormalizer;

    public LogAlignment(LogAlignmentConfig config) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.logNormalizer = VectorMath.log(config.logBase());
    }

    /**
     * Align a pressure vector and advance the running mean.
     *
     * @param pressure  raw pressure, not modified
     * @param gainState gain state from the previous tick
     * @return aligned pressure and the updated gain state
     */
    public Result apply(double[] pressure, AdaptiveGainState gainState) {
        if (!config.enabled()) {
            return new Result(pressure.clone(), gainState);
        }
        var tau = config.emaDecay();
        var runningMean = tau * gainState.runningMean() + (1.0 - tau) * VectorMath.norm(pressure);
        // saturate; an undefined magnitude keeps the previous mean
        if (Double.isNaN(runningMean)) {
            runningMean = gainState.runningMean();
        } else {
            runningMean = StrictMath.min(runningMean, Double.MAX_VALUE);
        }
        var gain = VectorMath.clamp(config.baseGain() / (config.epsilon() + runningMean), config.gainMin(),
                                    config.gainMax());
        return new Result(transform(pressure, gain), gainState.withAlignment(runningMean, gain));
    }

    /**
     * Pure component-wise transform at a fixed gain.
     *
     * @param pressure raw pressure
     * @param gain     adaptive gain
     * @return new vector sign(p) * log_base(1 + gain * |p|)
     */
    public double[] transform(double[] pressure, double gain) {
        var result = new double[pressure.length];
        for (int i = 0; i < pressure.length; i++) {
            var p = pressure[i];
            result[i] = VectorMath.sign(p) * VectorMath.log1p(gain * StrictMath.abs(p)) / logNormalizer;
        }
        return result;
    }

    public boolean isEnabled() {
        return config.enabled();
    }
}

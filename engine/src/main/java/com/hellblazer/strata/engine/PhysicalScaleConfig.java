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

/**
 * Controls for the scale factor (zeta) of the physical-space residual.
 * <p>
 * Zeta maps throughput back into raw pressure units. When auto-estimation is on it tracks
 * an EMA of {@code (||raw|| + eps) / (||j|| + eps)} clipped to {@code [min, max]};
 * otherwise it stays at {@code initial}.
 *
 * @param autoEstimate whether zeta is re-estimated every tick
 * @param initial      starting value of zeta
 * @param min          lower clip bound
 * @param max          upper clip bound
 * @param decay        weight of the previous zeta in the EMA
 * @author hal.hildebrand
 */
public record PhysicalScaleConfig(boolean autoEstimate, double initial, double min, double max, double decay) {

    public PhysicalScaleConfig {
        if (min > max) {
            throw new ConfigurationException(String.format("scale min %s exceeds max %s", min, max));
        }
        if (decay < 0.0 || decay > 1.0) {
            throw new ConfigurationException("scale decay must be in [0, 1]: " + decay);
        }
    }

    public static PhysicalScaleConfig defaults() {
        return new PhysicalScaleConfig(true, 1.0, 0.01, 100.0, 0.9);
    }

    /**
     * @param zeta the fixed scale factor
     * @return controls that hold zeta constant
     */
    public static PhysicalScaleConfig fixed(double zeta) {
        return new PhysicalScaleConfig(false, zeta, zeta, zeta, 0.9);
    }

    /**
     * @param previous zeta of the previous tick
     * @param ratio    this tick's magnitude ratio
     * @return the next zeta; the previous one when the ratio is not finite
     */
    double estimate(double previous, double ratio) {
        if (!autoEstimate || !Double.isFinite(ratio)) {
            return previous;
        }
        return VectorMath.clamp(decay * previous + (1.0 - decay) * ratio, min, max);
    }
}

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
 * Residual accounting mode: how much of the pressure throughput failed to carry.
 * <p>
 * Both modes return a component-wise non-negative residual.
 *
 * @author hal.hildebrand
 */
public enum ResidualMode {

    /**
     * {@code max(0, |p^| - |j|)}, measured in aligned units. The scale factor is carried
     * through unchanged.
     */
    LOG_SPACE {
        @Override
        Residual compute(double[] raw, double[] transformed, double[] throughput, double scaleFactor,
                         PhysicalScaleConfig scale, double epsilon) {
            var residual = new double[transformed.length];
            for (int i = 0; i < residual.length; i++) {
                residual[i] = VectorMath.floorAt(StrictMath.abs(transformed[i]) - StrictMath.abs(throughput[i]),
                                                 0.0);
            }
            return new Residual(residual, scaleFactor);
        }
    },

    /**
     * {@code max(0, |p| - zeta |j|)}, measured in raw pressure units. Zeta is re-estimated
     * from {@code (||p|| + eps) / (||j|| + eps)} before it is applied.
     */
    PHYSICAL_SPACE {
        @Override
        Residual compute(double[] raw, double[] transformed, double[] throughput, double scaleFactor,
                         PhysicalScaleConfig scale, double epsilon) {
            var ratio = (VectorMath.norm(raw) + epsilon) / (VectorMath.norm(throughput) + epsilon);
            var zeta = scale.estimate(scaleFactor, ratio);
            var residual = new double[raw.length];
            for (int i = 0; i < residual.length; i++) {
                residual[i] = VectorMath.floorAt(StrictMath.abs(raw[i]) - zeta * StrictMath.abs(throughput[i]), 0.0);
            }
            return new Residual(residual, zeta);
        }
    };

    /**
     * @param values      per-layer residual, each >= 0
     * @param scaleFactor scale factor to persist
     */
    record Residual(double[] values, double scaleFactor) {
    }

    abstract Residual compute(double[] raw, double[] transformed, double[] throughput, double scaleFactor,
                              PhysicalScaleConfig scale, double epsilon);
}

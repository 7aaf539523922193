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
 * Per-layer structural power and the dynamic leap threshold derived from it.
 * <p>
 * Power[i] = p^[i] x E[i] x kappa[i] x R[i]
 * <p>
 * With the dynamic threshold enabled:
 * <pre>
 * influence = sum(Power) / sum(kappa x R)      (0 when the denominator is not positive)
 * Theta'[i] = max(1, Theta[i] x (1 - sensitivity x influence))
 * </pre>
 * An undefined influence (opposing infinite powers) yields the floor. Otherwise Theta'[i]
 * is exactly Theta[i].
 *
 * @author hal.hildebrand
 */
final class StructuralPower {

    static final double MIN_DYNAMIC_THRESHOLD = 1.0;

    private final EngineConfig config;

    StructuralPower(EngineConfig config) {
        this.config = config;
    }

    double[] power(double[] transformed, double[] energy, double[] inertia) {
        var power = new double[transformed.length];
        for (int i = 0; i < power.length; i++) {
            power[i] = transformed[i] * energy[i] * inertia[i] * config.resistance[i];
        }
        return power;
    }

    double influence(double[] power, double[] inertia) {
        var denominator = VectorMath.stableSum(VectorMath.multiply(inertia, config.resistance));
        if (!(denominator > 0.0)) {
            return 0.0;
        }
        return VectorMath.stableSum(power) / denominator;
    }

    double[] thresholds(double[] power, double[] inertia) {
        if (!config.isDynamicThetaEnabled()) {
            return config.baseThreshold.clone();
        }
        var scale = 1.0 - config.getThetaSensitivity() * influence(power, inertia);
        var thresholds = new double[power.length];
        for (int i = 0; i < thresholds.length; i++) {
            thresholds[i] = VectorMath.floorAt(config.baseThreshold[i] * scale, MIN_DYNAMIC_THRESHOLD);
        }
        return thresholds;
    }
}

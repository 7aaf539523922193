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

/**
 * Cross-tick bookkeeping of the adaptive transforms.
 * <p>
 * Immutable record - each tick produces a new instance.
 *
 * @param runningMean EMA of recent pressure-vector magnitude
 * @param gain        adaptive Log-Alignment gain computed from the running mean
 * @param scaleFactor zeta, the physical-space residual scale factor
 * @author hal.hildebrand
 */
public record AdaptiveGainState(double runningMean, double gain, double scaleFactor) {

    /**
     * Initial gain state for a fresh session.
     *
     * @param config engine configuration
     * @return zero running mean, base gain, initial zeta
     */
    public static AdaptiveGainState initial(EngineConfig config) {
        return new AdaptiveGainState(0.0, config.getLogAlignment().baseGain(), config.getPhysicalScale().initial());
    }

    AdaptiveGainState withAlignment(double runningMean, double gain) {
        return new AdaptiveGainState(runningMean, gain, scaleFactor);
    }

    AdaptiveGainState withScaleFactor(double scaleFactor) {
        return new AdaptiveGainState(runningMean, gain, scaleFactor);
    }
}

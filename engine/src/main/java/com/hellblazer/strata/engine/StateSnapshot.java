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
 * Read-only export of a state for consumers.
 * <p>
 * Built from copies; mutating the arrays of a snapshot never reaches the state it came
 * from.
 *
 * @param energy       per-layer energy
 * @param inertia      per-layer inertia
 * @param adaptiveGain current Log-Alignment gain
 * @param scaleFactor  current physical-space residual scale factor
 * @param runningMean  running mean of pressure magnitude
 * @param time         simulation time
 * @param stepCount    ticks advanced so far
 * @author hal.hildebrand
 */
public record StateSnapshot(double[] energy, double[] inertia, double adaptiveGain, double scaleFactor,
                            double runningMean, double time, long stepCount) {

    static StateSnapshot of(EngineState state) {
        var gain = state.getGainState();
        return new StateSnapshot(state.getEnergy(), state.getInertia(), gain.gain(), gain.scaleFactor(),
                                 gain.runningMean(), state.getSimTime(), state.getStepCount());
    }
}

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
 * Conductance, residual and the explicit Euler integration of energy and inertia.
 * <pre>
 * G       = G0 + g x kappa
 * j       = G x p^
 * dE/dt   = gamma x residual / R - beta x E + transfer
 * dk/dt   = eta x |j| / (|j| + 1) - lambda x kappa
 * E'      = max(0, E + dE dt)
 * kappa'  = max(kappaMin, kappa + dk dt)
 * </pre>
 * Generation divides by resistance: a stiffer layer turns less residual into energy.
 *
 * @author hal.hildebrand
 */
final class FlowIntegrator {

    /**
     * @param throughput per-layer throughput j
     * @param residual   per-layer residual
     */
    record Flow(double[] throughput, ResidualMode.Residual residual) {
    }

    private final EngineConfig config;
    private final ResidualMode mode;
    private final double       epsilon;

    FlowIntegrator(EngineConfig config) {
        this.config = config;
        this.mode = config.getResidualMode();
        this.epsilon = config.getLogAlignment().epsilon();
    }

    double[] throughput(double[] inertia, double[] transformed) {
        var j = new double[inertia.length];
        for (int i = 0; i < j.length; i++) {
            j[i] = (config.getBaseConductance() + config.getInertiaGain() * inertia[i]) * transformed[i];
        }
        return j;
    }

    Flow flow(double[] raw, double[] transformed, double[] inertia, double scaleFactor) {
        var j = throughput(inertia, transformed);
        return new Flow(j, mode.compute(raw, transformed, j, scaleFactor, config.getPhysicalScale(), epsilon));
    }

    /**
     * Integrate one tick into the builder's energy and inertia.
     *
     * @param next     state under construction, already leap-adjusted
     * @param flow     throughput and residual of this tick
     * @param transfer optional inter-layer transfer added to dE/dt, may be null
     * @param dt       time step
     */
    void integrate(EngineState.Builder next, Flow flow, double[] transfer, double dt) {
        var energy = next.energy();
        var inertia = next.inertia();
        var residual = flow.residual().values();
        var j = flow.throughput();
        for (int i = 0; i < energy.length; i++) {
            var generation = config.generationRate[i] * residual[i] / config.resistance[i];
            var dE = generation - config.decayRate[i] * energy[i];
            if (transfer != null) {
                dE += transfer[i];
            }
            energy[i] = VectorMath.floorAt(energy[i] + dE * dt, 0.0);

            var usage = StrictMath.abs(j[i]) / (StrictMath.abs(j[i]) + 1.0);
            var dKappa = config.learningRate[i] * usage - config.forgettingRate[i] * inertia[i];
            inertia[i] = VectorMath.floorAt(inertia[i] + dKappa * dt, config.inertiaFloor[i]);
        }
    }
}

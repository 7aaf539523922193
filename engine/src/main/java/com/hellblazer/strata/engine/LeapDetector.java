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

import java.util.random.RandomGenerator;

/**
 * Detects and executes structural leaps.
 * <p>
 * Session phases:
 * - Warmup: {@code stepCount < warmupSteps}, detection always reports no leap
 * - Active: the configured {@link LeapPolicy} decides, drawing from the injected generator
 * <p>
 * Execution keeps a tenth of the layer's energy (residual tension) and reinforces its
 * inertia by a fixed increment. At most one layer leaps per tick.
 *
 * @author hal.hildebrand
 */
final class LeapDetector {

    /**
     * Fraction of a layer's energy that survives a leap.
     */
    static final double ENERGY_RETENTION = 0.1;

    /**
     * Inertia added to a layer by a leap.
     */
    static final double INERTIA_INCREMENT = 0.1;

    static final int NO_LEAP = -1;

    /**
     * @param layer         layer that leapt, {@link #NO_LEAP} when none
     * @param probabilities probability evaluated per layer during the scan
     */
    record Detection(int layer, double[] probabilities) {
        boolean leapt() {
            return layer != NO_LEAP;
        }
    }

    private final LeapPolicy policy;
    private final double     temperature;
    private final int        warmupSteps;

    LeapDetector(EngineConfig config) {
        this.policy = config.getLeapPolicy();
        this.temperature = config.getTemperature();
        this.warmupSteps = config.getLogAlignment().warmupSteps();
    }

    boolean inWarmup(long stepCount) {
        return stepCount < warmupSteps;
    }

    Detection detect(double[] energy, double[] thresholds, long stepCount, RandomGenerator random) {
        var probabilities = new double[energy.length];
        if (inWarmup(stepCount)) {
            return new Detection(NO_LEAP, probabilities);
        }
        for (int i = 0; i < energy.length; i++) {
            if (!policy.eligible(energy[i], thresholds[i])) {
                continue;
            }
            probabilities[i] = policy.probability(energy[i], thresholds[i], temperature);
            if (random.nextDouble() < probabilities[i]) {
                return new Detection(i, probabilities);
            }
        }
        return new Detection(NO_LEAP, probabilities);
    }

    void execute(EngineState.Builder next, int layer) {
        next.energy()[layer] *= ENERGY_RETENTION;
        next.inertia()[layer] += INERTIA_INCREMENT;
        next.appendLeap(new LeapEvent(next.simTime(), layer));
    }
}

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
 * Controls for the adaptive logarithmic compression applied to each pressure vector.
 *
 * @param enabled     when false, pressure passes through unchanged
 * @param baseGain    alpha0, numerator of the adaptive gain
 * @param logBase     base of the output logarithm
 * @param emaDecay    tau, weight of the previous running mean in the EMA
 * @param epsilon     guard added to every magnitude denominator
 * @param gainMin     lower clip bound of the adaptive gain
 * @param gainMax     upper clip bound of the adaptive gain
 * @param warmupSteps number of initial ticks during which leap detection is suppressed
 * @author hal.hildebrand
 */
public record LogAlignmentConfig(boolean enabled, double baseGain, double logBase, double emaDecay, double epsilon,
                                 double gainMin, double gainMax, int warmupSteps) {

    public LogAlignmentConfig {
        if (!(logBase > 0.0) || logBase == 1.0) {
            throw new ConfigurationException("logBase must be positive and not 1: " + logBase);
        }
        if (emaDecay < 0.0 || emaDecay > 1.0) {
            throw new ConfigurationException("emaDecay must be in [0, 1]: " + emaDecay);
        }
        if (!(epsilon > 0.0)) {
            throw new ConfigurationException("epsilon must be positive: " + epsilon);
        }
        if (gainMin > gainMax) {
            throw new ConfigurationException(
            String.format("gainMin %s exceeds gainMax %s", gainMin, gainMax));
        }
        if (warmupSteps < 0) {
            throw new ConfigurationException("warmupSteps cannot be negative: " + warmupSteps);
        }
    }

    /**
     * @return enabled alignment with natural-log output and a ten tick warmup
     */
    public static LogAlignmentConfig defaults() {
        return new LogAlignmentConfig(true, 1.0, StrictMath.E, 0.9, 1e-6, 0.01, 10.0, 10);
    }

    /**
     * @return the default controls with the transform switched off
     */
    public static LogAlignmentConfig disabled() {
        return defaults().withEnabled(false);
    }

    public LogAlignmentConfig withEnabled(boolean enabled) {
        return new LogAlignmentConfig(enabled, baseGain, logBase, emaDecay, epsilon, gainMin, gainMax, warmupSteps);
    }

    public LogAlignmentConfig withWarmupSteps(int warmupSteps) {
        return new LogAlignmentConfig(enabled, baseGain, logBase, emaDecay, epsilon, gainMin, gainMax, warmupSteps);
    }
}

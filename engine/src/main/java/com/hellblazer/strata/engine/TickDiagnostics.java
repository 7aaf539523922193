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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-tick observability record.
 * <p>
 * Derived from a tick and never read back into the update equations. Array accessors
 * return copies.
 *
 * @param dynamicThresholds     effective leap threshold per layer
 * @param structuralPower       transformed pressure x energy x inertia x resistance per layer
 * @param dominantLayer         index of the maximum structural power
 * @param dominantPower         structural power of the dominant layer
 * @param leapOccurred          whether a leap executed this tick
 * @param leapLayer             layer that leapt, -1 when none
 * @param leapProbabilities     trigger probability evaluated per layer, 0 for layers not reached
 * @param adaptiveGain          Log-Alignment gain in effect this tick
 * @param scaleFactor           physical-space residual scale factor after this tick
 * @param residualNorm          ||residual||
 * @param alignmentEfficiency   ||j|| / ||raw pressure||
 * @param transformedEfficiency ||j|| / ||transformed pressure||
 * @param compressionRatio      ||transformed pressure|| / ||raw pressure||
 * @param warmupCompleted       true only on the tick where the step count first reaches the warmup length
 * @param totalEnergy           sum of the post-tick energy vector
 * @author hal.hildebrand
 */
public record TickDiagnostics(double[] dynamicThresholds, double[] structuralPower, int dominantLayer,
                              double dominantPower, boolean leapOccurred, int leapLayer, double[] leapProbabilities,
                              double adaptiveGain, double scaleFactor, double residualNorm,
                              double alignmentEfficiency, double transformedEfficiency, double compressionRatio,
                              boolean warmupCompleted, double totalEnergy) {

    public TickDiagnostics {
        dynamicThresholds = dynamicThresholds.clone();
        structuralPower = structuralPower.clone();
        leapProbabilities = leapProbabilities.clone();
    }

    /**
     * Diagnostics of a state that has not been advanced yet.
     *
     * @param layerCount number of layers
     * @return all-zero diagnostics with no leap
     */
    public static TickDiagnostics none(int layerCount) {
        var zeros = new double[layerCount];
        return new TickDiagnostics(zeros, zeros, 0, 0.0, false, -1, zeros, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0, false, 0.0);
    }

    @Override
    public double[] dynamicThresholds() {
        return dynamicThresholds.clone();
    }

    @Override
    public double[] structuralPower() {
        return structuralPower.clone();
    }

    @Override
    public double[] leapProbabilities() {
        return leapProbabilities.clone();
    }

    /**
     * Keyed view for consumers that log or chart diagnostics generically.
     *
     * @return unmodifiable map in declaration order
     */
    public Map<String, Object> asMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("dynamicThresholds", dynamicThresholds());
        map.put("structuralPower", structuralPower());
        map.put("dominantLayer", dominantLayer);
        map.put("dominantPower", dominantPower);
        map.put("leapOccurred", leapOccurred);
        map.put("leapLayer", leapLayer);
        map.put("leapProbabilities", leapProbabilities());
        map.put("adaptiveGain", adaptiveGain);
        map.put("scaleFactor", scaleFactor);
        map.put("residualNorm", residualNorm);
        map.put("alignmentEfficiency", alignmentEfficiency);
        map.put("transformedEfficiency", transformedEfficiency);
        map.put("compressionRatio", compressionRatio);
        map.put("warmupCompleted", warmupCompleted);
        map.put("totalEnergy", totalEnergy);
        return Collections.unmodifiableMap(map);
    }
}

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
 * Leap trigger policy.
 * <p>
 * Both policies scan layers in index order and draw one uniform variate for every
 * eligible layer; the first successful draw triggers the leap.
 *
 * @author hal.hildebrand
 */
public enum LeapPolicy {

    /**
     * A layer is eligible once its energy reaches the threshold; it then leaps with
     * probability {@code min(1, (E - Theta) / Theta)}. Sub-threshold energy never leaps.
     */
    DETERMINISTIC_BIASED {
        @Override
        boolean eligible(double energy, double threshold) {
            return energy >= threshold;
        }

        @Override
        double probability(double energy, double threshold, double temperature) {
            if (energy < threshold) {
                return 0.0;
            }
            if (!(threshold > 0.0)) {
                return 1.0;
            }
            return StrictMath.min(1.0, (energy - threshold) / threshold);
        }
    },

    /**
     * Every layer is eligible and leaps with probability
     * {@code sigmoid((E - Theta) / T)}, so thermal fluctuation can trigger below the
     * threshold.
     */
    THERMAL {
        @Override
        boolean eligible(double energy, double threshold) {
            return true;
        }

        @Override
        double probability(double energy, double threshold, double temperature) {
            return VectorMath.sigmoid((energy - threshold) / temperature);
        }
    };

    abstract boolean eligible(double energy, double threshold);

    /**
     * @param energy      layer energy
     * @param threshold   effective layer threshold
     * @param temperature configured temperature, positive for {@link #THERMAL}
     * @return leap probability in [0, 1]
     */
    abstract double probability(double energy, double threshold, double temperature);
}

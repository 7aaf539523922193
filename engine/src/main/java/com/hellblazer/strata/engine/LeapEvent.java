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
 * A leap recorded in the state history.
 *
 * @param time  simulation time at which the leap fired, before the tick advanced time
 * @param layer index of the layer that leapt
 * @author hal.hildebrand
 */
public record LeapEvent(double time, int layer) {

    public LeapEvent {
        if (layer < 0) {
            throw new InvalidInputException("layer cannot be negative: " + layer);
        }
    }

    /**
     * Layer-derived leap kind, numbered from one.
     *
     * @return e.g. {@code LEAP_LAYER_1} for layer 0
     */
    public String kind() {
        return "LEAP_LAYER_" + (layer + 1);
    }

    @Override
    public String toString() {
        return kind() + "@" + time;
    }
}

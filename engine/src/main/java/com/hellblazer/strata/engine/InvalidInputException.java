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
 * Thrown when a vector or state passed to the engine at call time does not match the
 * configured layer count.
 */
public final class InvalidInputException extends StrataException {

    public InvalidInputException(String message) {
        super(message);
    }

    static void requireLayerCount(EngineState state, int layerCount) {
        if (state == null) {
            throw new InvalidInputException("state cannot be null");
        }
        if (state.getLayerCount() != layerCount) {
            throw new InvalidInputException(
            String.format("state has %d layers but layer count is %d", state.getLayerCount(), layerCount));
        }
    }

    static void requireLayerCount(String name, double[] vector, int layerCount) {
        if (vector == null) {
            throw new InvalidInputException(name + " cannot be null");
        }
        if (vector.length != layerCount) {
            throw new InvalidInputException(
            String.format("%s length %d does not match layer count %d", name, vector.length, layerCount));
        }
    }
}

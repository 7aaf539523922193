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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Immutable simulation state of one session.
 * <p>
 * A tick never modifies a state; it derives the next one field by field through
 * {@link #toBuilder()}. Vector accessors return copies.
 * <p>
 * Invariants after every {@link StructuralEngine#advance} call:
 * - energy[i] >= 0
 * - inertia[i] >= inertiaFloor[i]
 * - leap history is append-only
 *
 * @author hal.hildebrand
 */
public final class EngineState {

    final double[] energy;
    final double[] inertia;

    private final double            simTime;
    private final long              stepCount;
    private final List<LeapEvent>   leapHistory;
    private final AdaptiveGainState gainState;
    private final TickDiagnostics   diagnostics;

    private EngineState(Builder builder) {
        this.energy = builder.energy.clone();
        this.inertia = builder.inertia.clone();
        this.simTime = builder.simTime;
        this.stepCount = builder.stepCount;
        this.leapHistory = List.copyOf(builder.leapHistory);
        this.gainState = builder.gainState;
        this.diagnostics = builder.diagnostics;
    }

    /**
     * Fresh session state: zero energy, inertia at its floor, zero time and steps.
     *
     * @param config engine configuration
     * @return the initial state
     */
    public static EngineState initial(EngineConfig config) {
        return builder(config).build();
    }

    /**
     * Builder seeded like {@link #initial(EngineConfig)}, for caller-chosen starting points.
     *
     * @param config engine configuration
     * @return a new builder
     */
    public static Builder builder(EngineConfig config) {
        Objects.requireNonNull(config, "config cannot be null");
        return new Builder(new double[config.layerCount], config.getInertiaFloor(), 0.0, 0L, List.of(),
                           AdaptiveGainState.initial(config), TickDiagnostics.none(config.layerCount));
    }

    /**
     * @return a builder holding copies of every field of this state
     */
    public Builder toBuilder() {
        return new Builder(energy.clone(), inertia.clone(), simTime, stepCount, leapHistory, gainState, diagnostics);
    }

    public int getLayerCount() {
        return energy.length;
    }

    public double[] getEnergy() {
        return energy.clone();
    }

    public double[] getInertia() {
        return inertia.clone();
    }

    public double getSimTime() {
        return simTime;
    }

    public long getStepCount() {
        return stepCount;
    }

    /**
     * @return unmodifiable leap history, oldest first
     */
    public List<LeapEvent> getLeapHistory() {
        return leapHistory;
    }

    public AdaptiveGainState getGainState() {
        return gainState;
    }

    public TickDiagnostics getDiagnostics() {
        return diagnostics;
    }

    @Override
    public String toString() {
        return "EngineState{t=" + simTime + ", step=" + stepCount + ", E=" + Arrays.toString(energy)
        + ", kappa=" + Arrays.toString(inertia) + ", leaps=" + leapHistory.size() + "}";
    }

    /**
     * Builder class for EngineState
     */
    public static final class Builder {
        private final double[]        energy;
        private final double[]        inertia;
        private final List<LeapEvent> leapHistory;
        private double                simTime;
        private long                  stepCount;
        private AdaptiveGainState     gainState;
        private TickDiagnostics       diagnostics;

        private Builder(double[] energy, double[] inertia, double simTime, long stepCount, List<LeapEvent> history,
                        AdaptiveGainState gainState, TickDiagnostics diagnostics) {
            this.energy = energy;
            this.inertia = inertia;
            this.simTime = simTime;
            this.stepCount = stepCount;
            this.leapHistory = new ArrayList<>(history);
            this.gainState = gainState;
            this.diagnostics = diagnostics;
        }

        /**
         * @param energy per-layer energy, same length as the layer count
         * @return this builder instance
         */
        public Builder withEnergy(double... energy) {
            InvalidInputException.requireLayerCount("energy", energy, this.energy.length);
            System.arraycopy(energy, 0, this.energy, 0, energy.length);
            return this;
        }

        /**
         * @param inertia per-layer inertia, same length as the layer count
         * @return this builder instance
         */
        public Builder withInertia(double... inertia) {
            InvalidInputException.requireLayerCount("inertia", inertia, this.inertia.length);
            System.arraycopy(inertia, 0, this.inertia, 0, inertia.length);
            return this;
        }

        public Builder withSimTime(double simTime) {
            this.simTime = simTime;
            return this;
        }

        public Builder withStepCount(long stepCount) {
            if (stepCount < 0) {
                throw new InvalidInputException("stepCount cannot be negative: " + stepCount);
            }
            this.stepCount = stepCount;
            return this;
        }

        public Builder withGainState(AdaptiveGainState gainState) {
            this.gainState = Objects.requireNonNull(gainState, "gainState cannot be null");
            return this;
        }

        Builder withDiagnostics(TickDiagnostics diagnostics) {
            this.diagnostics = diagnostics;
            return this;
        }

        Builder appendLeap(LeapEvent event) {
            leapHistory.add(event);
            return this;
        }

        double[] energy() {
            return energy;
        }

        double[] inertia() {
            return inertia;
        }

        double simTime() {
            return simTime;
        }

        long stepCount() {
            return stepCount;
        }

        AdaptiveGainState gainState() {
            return gainState;
        }

        public EngineState build() {
            return new EngineState(this);
        }
    }
}

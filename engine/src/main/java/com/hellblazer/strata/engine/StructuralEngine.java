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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Random;
import java.util.random.RandomGenerator;

/**
 * Structural pressure, inertia and leap dynamics over a fixed set of abstract layers.
 * <p>
 * One tick of {@link #advance(EngineState, double[], double, double[])}:
 * <ol>
 * <li>Log-Alignment of the raw pressure</li>
 * <li>structural power and effective thresholds</li>
 * <li>leap detection, suppressed during warmup</li>
 * <li>leap execution on the derived state</li>
 * <li>conductance throughput and residual</li>
 * <li>energy and inertia integration</li>
 * <li>diagnostics</li>
 * </ol>
 * The engine holds no session state. Its only mutable collaborator is the injected
 * random generator consumed by leap detection, so a seeded generator replays a session
 * exactly. Sessions that run concurrently need their own engine.
 * <p>
 * Usage:
 * <pre>
 * var engine = new StructuralEngine(EngineConfig.defaults(), new Random(42));
 * var state = engine.initialState();
 * for (int i = 0; i &lt; 100; i++) {
 *     state = engine.advance(state, pressure, 0.1);
 * }
 * var dominant = engine.dominantLayer(state, pressure);
 * </pre>
 *
 * @author hal.hildebrand
 */
public class StructuralEngine {

    private static final Logger log = LoggerFactory.getLogger(StructuralEngine.class);

    private final EngineConfig    config;
    private final RandomGenerator random;
    private final LogAlignment    alignment;
    private final StructuralPower structuralPower;
    private final LeapDetector    leapDetector;
    private final FlowIntegrator  integrator;

    /**
     * Create an engine with an unseeded generator.
     *
     * @param config engine configuration
     */
    public StructuralEngine(EngineConfig config) {
        this(config, new Random());
    }

    /**
     * Create an engine.
     *
     * @param config engine configuration
     * @param random source of leap draws
     */
    public StructuralEngine(EngineConfig config, RandomGenerator random) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.random = Objects.requireNonNull(random, "random cannot be null");
        this.alignment = new LogAlignment(config.getLogAlignment());
        this.structuralPower = new StructuralPower(config);
        this.leapDetector = new LeapDetector(config);
        this.integrator = new FlowIntegrator(config);
        log.debug("Structural engine created: {}", config);
    }

    public EngineConfig getConfig() {
        return config;
    }

    /**
     * @return zero energy, inertia at its floor, zero time and steps
     */
    public EngineState initialState() {
        return EngineState.initial(config);
    }

    /**
     * Seeded starting state.
     *
     * @param energy  initial energy per layer
     * @param inertia initial inertia per layer
     * @return state at time zero with the given vectors
     * @throws InvalidInputException if a vector length differs from the layer count
     */
    public EngineState initialState(double[] energy, double[] inertia) {
        return EngineState.builder(config).withEnergy(energy).withInertia(inertia).build();
    }

    /**
     * Advance one tick without inter-layer transfer.
     *
     * @see #advance(EngineState, double[], double, double[])
     */
    public EngineState advance(EngineState state, double[] pressure, double dt) {
        return advance(state, pressure, dt, null);
    }

    /**
     * Advance one tick.
     *
     * @param state    current state, not modified
     * @param pressure raw pressure per layer
     * @param dt       time step, >= 0
     * @param transfer inter-layer transfer per layer added to dE/dt, or null
     * @return the next state
     * @throws InvalidInputException if the state, pressure or transfer length differs from the layer count
     */
    public EngineState advance(EngineState state, double[] pressure, double dt, double[] transfer) {
        InvalidInputException.requireLayerCount(state, config.layerCount);
        InvalidInputException.requireLayerCount("pressure", pressure, config.layerCount);
        if (transfer != null) {
            InvalidInputException.requireLayerCount("transfer", transfer, config.layerCount);
        }

        var aligned = alignment.apply(pressure, state.getGainState());
        var transformed = aligned.transformed();
        var power = structuralPower.power(transformed, state.energy, state.inertia);
        var thresholds = structuralPower.thresholds(power, state.inertia);
        var dominant = VectorMath.argMax(power);

        var detection = leapDetector.detect(state.energy, thresholds, state.getStepCount(), random);
        var next = state.toBuilder().withGainState(aligned.gainState());
        if (detection.leapt()) {
            leapDetector.execute(next, detection.layer());
            log.info("Leap on layer {} at t={} (E={}, Theta={}, p={})", detection.layer(), state.getSimTime(),
                     state.energy[detection.layer()], thresholds[detection.layer()],
                     detection.probabilities()[detection.layer()]);
        }

        var flow = integrator.flow(pressure, transformed, next.inertia(), next.gainState().scaleFactor());
        integrator.integrate(next, flow, transfer, dt);

        var stepCount = state.getStepCount() + 1;
        var warmupSteps = config.getLogAlignment().warmupSteps();
        var warmupCompleted = state.getStepCount() < warmupSteps && stepCount >= warmupSteps;
        if (warmupCompleted) {
            log.info("Warmup complete after {} steps, leap detection active", stepCount);
        }

        var gainState = next.gainState().withScaleFactor(flow.residual().scaleFactor());
        next.withSimTime(state.getSimTime() + dt).withStepCount(stepCount).withGainState(gainState);

        var rawNorm = VectorMath.norm(pressure);
        var transformedNorm = VectorMath.norm(transformed);
        var throughputNorm = VectorMath.norm(flow.throughput());
        var epsilon = config.getLogAlignment().epsilon();
        var diagnostics = new TickDiagnostics(thresholds, power, dominant, power[dominant], detection.leapt(),
                                              detection.layer(), detection.probabilities(), gainState.gain(),
                                              gainState.scaleFactor(),
                                              VectorMath.norm(flow.residual().values()),
                                              throughputNorm / (rawNorm + epsilon),
                                              throughputNorm / (transformedNorm + epsilon),
                                              transformedNorm / (rawNorm + epsilon), warmupCompleted,
                                              VectorMath.stableSum(next.energy()));
        var result = next.withDiagnostics(diagnostics).build();
        if (log.isDebugEnabled()) {
            log.debug("Step {} t={} dominant={} residual={} E={} kappa={}", stepCount, result.getSimTime(),
                      dominant, diagnostics.residualNorm(), result.energy, result.inertia);
        }
        return result;
    }

    /**
     * Layer with the highest structural power under the given pressure. Time does not
     * advance and the gain state is not persisted.
     *
     * @param state    current state
     * @param pressure raw pressure per layer
     * @return index of the dominant layer, lowest index on ties
     * @throws InvalidInputException if the state or pressure length differs from the layer count
     */
    public int dominantLayer(EngineState state, double[] pressure) {
        return VectorMath.argMax(power(state, pressure));
    }

    /**
     * Structural power per layer under the given pressure, without advancing time.
     *
     * @param state    current state
     * @param pressure raw pressure per layer
     * @return power vector
     * @throws InvalidInputException if the state or pressure length differs from the layer count
     */
    public double[] structuralPower(EngineState state, double[] pressure) {
        return power(state, pressure);
    }

    /**
     * Effective leap threshold of one layer under the given pressure. With the dynamic
     * threshold disabled this is exactly the configured base threshold.
     *
     * @param state    current state
     * @param pressure raw pressure per layer
     * @param layer    layer index
     * @return effective threshold
     * @throws InvalidInputException if the state or pressure length differs from the layer count or the layer is
     *                               out of range
     */
    public double dynamicTheta(EngineState state, double[] pressure, int layer) {
        if (layer < 0 || layer >= config.layerCount) {
            throw new InvalidInputException(
            String.format("layer %d out of range [0, %d)", layer, config.layerCount));
        }
        InvalidInputException.requireLayerCount(state, config.layerCount);
        InvalidInputException.requireLayerCount("pressure", pressure, config.layerCount);
        if (!config.isDynamicThetaEnabled()) {
            return config.baseThreshold[layer];
        }
        return structuralPower.thresholds(power(state, pressure), state.inertia)[layer];
    }

    /**
     * Export independent copies of a state's vectors and gain bookkeeping.
     *
     * @param state state to export
     * @return the snapshot
     */
    public StateSnapshot snapshot(EngineState state) {
        return StateSnapshot.of(Objects.requireNonNull(state, "state cannot be null"));
    }

    private double[] power(EngineState state, double[] pressure) {
        InvalidInputException.requireLayerCount(state, config.layerCount);
        InvalidInputException.requireLayerCount("pressure", pressure, config.layerCount);
        var transformed = alignment.apply(pressure, state.getGainState()).transformed();
        return structuralPower.power(transformed, state.energy, state.inertia);
    }
}

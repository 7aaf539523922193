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

import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;
import net.jqwik.api.constraints.DoubleRange;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for StructuralEngine - full ticks, queries and the session-level guarantees.
 *
 * @author hal.hildebrand
 */
class StructuralEngineTest {

    private static final double DT = 0.1;

    @Test
    void testInitialState() {
        var engine = new StructuralEngine(EngineConfig.defaults(), new Random(1));
        var state = engine.initialState();

        assertArrayEquals(new double[4], state.getEnergy(), 0.0);
        assertArrayEquals(new double[] { 0.9, 0.8, 0.5, 0.3 }, state.getInertia(), 0.0);
        assertEquals(0.0, state.getSimTime());
        assertEquals(0L, state.getStepCount());
        assertTrue(state.getLeapHistory().isEmpty());
        assertEquals(1.0, state.getGainState().gain());
        assertEquals(1.0, state.getGainState().scaleFactor());
    }

    @Test
    void testTwoLayerScenario() {
        // default conductance (0.5 + 0.7 kappa) carries more than the pressure, leaving no log residual
        var config = TestConfigs.twoLayer()
                                .withoutDynamicTheta()
                                .withLogAlignment(LogAlignmentConfig.disabled())
                                .withConductance(0.1, 0.05)
                                .build();
        var engine = new StructuralEngine(config, new Random(2025));
        var state = engine.initialState(new double[] { 0.0, 0.0 }, new double[] { 1.0, 1.0 });
        var pressure = new double[] { 50.0, 30.0 };

        var previous = state.getEnergy();
        for (int tick = 0; tick < 20; tick++) {
            state = engine.advance(state, pressure, DT);
            var energy = state.getEnergy();
            assertTrue(energy[0] > previous[0], "layer 0 energy rises at tick " + tick);
            assertTrue(energy[1] > previous[1], "layer 1 energy rises at tick " + tick);
            assertTrue(energy[0] < 100.0);
            assertTrue(state.getLeapHistory().isEmpty(), "no leap before energy[0] reaches 100");
            previous = energy;
        }
        assertEquals(20L, state.getStepCount());
        assertEquals(2.0, state.getSimTime(), 1e-9);
    }

    @Test
    void testNoLeapDuringWarmup() {
        var config = TestConfigs.twoLayer()
                                .withoutDynamicTheta()
                                .withBaseThreshold(10.0, 10.0)
                                .withDecayRate(0.0, 0.0)
                                .build();
        var warmupSteps = config.getLogAlignment().warmupSteps();
        var engine = new StructuralEngine(config, new Random(3));
        var state = engine.initialState(new double[] { 1000.0, 0.0 }, new double[] { 1.0, 1.0 });
        var pressure = new double[] { 10000.0, 0.0 };

        for (int tick = 0; tick < warmupSteps - 1; tick++) {
            state = engine.advance(state, pressure, DT);
            assertTrue(state.getLeapHistory().isEmpty(), "leap during warmup at tick " + tick);
            assertFalse(state.getDiagnostics().warmupCompleted());
        }

        state = engine.advance(state, pressure, DT);
        assertTrue(state.getLeapHistory().isEmpty());
        assertTrue(state.getDiagnostics().warmupCompleted(), "flag fires when stepCount reaches warmupSteps");

        state = engine.advance(state, pressure, DT);
        assertFalse(state.getDiagnostics().warmupCompleted(), "flag fires once");
        assertEquals(1, state.getLeapHistory().size(), "energy far above threshold leaps once active");
        var leap = state.getLeapHistory().get(0);
        assertEquals(0, leap.layer());
        assertEquals(warmupSteps * DT, leap.time(), 1e-9);
    }

    @Test
    void testWarmupFlagFiresExactlyOnce() {
        var engine = new StructuralEngine(TestConfigs.twoLayer().build(), new Random(4));
        var state = engine.initialState();
        var fired = 0;
        for (int tick = 0; tick < 30; tick++) {
            state = engine.advance(state, new double[] { 5.0, 5.0 }, DT);
            if (state.getDiagnostics().warmupCompleted()) {
                fired++;
                assertEquals(10L, state.getStepCount());
            }
        }
        assertEquals(1, fired);
    }

    @Test
    void testLeapAppliedBeforeIntegration() {
        var config = TestConfigs.twoLayer()
                                .withoutDynamicTheta()
                                .withBaseThreshold(10.0, 10.0)
                                .withDecayRate(0.0, 0.0)
                                .withLogAlignment(LogAlignmentConfig.disabled())
                                .build();
        var engine = new StructuralEngine(config, new Random(5));
        var state = EngineState.builder(config)
                               .withEnergy(1000.0, 0.0)
                               .withInertia(1.0, 1.0)
                               .withStepCount(50)
                               .withSimTime(5.0)
                               .build();

        var next = engine.advance(state, new double[] { 0.0, 0.0 }, DT);

        var diagnostics = next.getDiagnostics();
        assertTrue(diagnostics.leapOccurred());
        assertEquals(0, diagnostics.leapLayer());
        assertEquals(1.0, diagnostics.leapProbabilities()[0]);
        assertEquals(100.0, next.getEnergy()[0], 1e-9);
        assertEquals(1.1 + DT * (-0.01 * 1.1), next.getInertia()[0], 1e-12);
        assertEquals(List.of(new LeapEvent(5.0, 0)), next.getLeapHistory());

        assertArrayEquals(new double[] { 1000.0, 0.0 }, state.getEnergy(), 0.0, "input state untouched");
        assertTrue(state.getLeapHistory().isEmpty());
    }

    @Test
    void testThermalPolicyLeapsBelowThreshold() {
        assertLeapFrequency(TestConfigs.singleLayer().withStochasticLeap(5.0).build(), 0.30, 0.60);
    }

    @Test
    void testDeterministicPolicyNeverLeapsBelowThreshold() {
        assertLeapFrequency(TestConfigs.singleLayer().build(), 0.0, 0.0);
    }

    private void assertLeapFrequency(EngineConfig config, double min, double max) {
        var engine = new StructuralEngine(config, new Random(17));
        var state = EngineState.builder(config).withEnergy(49.0).withStepCount(100).build();
        var trials = 2000;
        var leaps = 0;
        for (int trial = 0; trial < trials; trial++) {
            if (engine.advance(state, new double[] { 0.0 }, DT).getDiagnostics().leapOccurred()) {
                leaps++;
            }
        }
        var frequency = leaps / (double) trials;
        assertTrue(frequency >= min && frequency <= max, "frequency " + frequency);
    }

    @Test
    void testSnapshotIsIndependent() {
        var config = TestConfigs.twoLayer().build();
        var engine = new StructuralEngine(config, new Random(6));
        var state = engine.initialState();
        var pressure = new double[] { 40.0, 12.0 };
        for (int tick = 0; tick < 5; tick++) {
            state = engine.advance(state, pressure, DT);
        }
        var expected = new StructuralEngine(config, new Random(9)).advance(state, pressure, DT);
        var energyBefore = state.getEnergy();

        var snapshot = engine.snapshot(state);
        assertArrayEquals(energyBefore, snapshot.energy(), 0.0);
        assertEquals(state.getGainState().gain(), snapshot.adaptiveGain());
        assertEquals(state.getGainState().runningMean(), snapshot.runningMean());
        assertEquals(state.getGainState().scaleFactor(), snapshot.scaleFactor());
        assertEquals(5L, snapshot.stepCount());
        assertEquals(state.getSimTime(), snapshot.time());

        snapshot.energy()[0] = 1e9;
        snapshot.inertia()[1] = -42.0;
        state.getEnergy()[1] = 1e9;

        assertArrayEquals(energyBefore, state.getEnergy(), 0.0);
        var actual = new StructuralEngine(config, new Random(9)).advance(state, pressure, DT);
        assertArrayEquals(expected.getEnergy(), actual.getEnergy(), 0.0);
        assertArrayEquals(expected.getInertia(), actual.getInertia(), 0.0);
    }

    @Test
    void testDynamicThetaDisabledReturnsBase() {
        var config = TestConfigs.twoLayer().withoutDynamicTheta().build();
        var engine = new StructuralEngine(config, new Random(7));
        var state = engine.initialState(new double[] { 500.0, 80.0 }, new double[] { 3.0, 2.0 });
        assertEquals(100.0, engine.dynamicTheta(state, new double[] { 1e6, -1e6 }, 0));
        assertEquals(30.0, engine.dynamicTheta(state, new double[] { 1e6, -1e6 }, 1));
    }

    @Test
    void testDynamicThetaEnabled() {
        var config = TestConfigs.twoLayer().withDynamicTheta(0.3).withLogAlignment(LogAlignmentConfig.disabled()).build();
        var engine = new StructuralEngine(config, new Random(8));
        var state = engine.initialState(new double[] { 10.0, 0.0 }, new double[] { 1.0, 1.0 });

        var influence = 10.0 / 101.0;
        assertEquals(100.0 * (1.0 - 0.3 * influence), engine.dynamicTheta(state, new double[] { 0.01, 0.0 }, 0),
                     1e-9);
        assertEquals(1.0, engine.dynamicTheta(state, new double[] { 0.5, 0.0 }, 1), "floored at 1");
    }

    @Test
    void testDominantLayer() {
        var config = TestConfigs.twoLayer().withLogAlignment(LogAlignmentConfig.disabled()).build();
        var engine = new StructuralEngine(config, new Random(9));
        var state = engine.initialState(new double[] { 1.0, 1.0 }, new double[] { 1.0, 1.0 });

        assertEquals(0, engine.dominantLayer(state, new double[] { 1.0, 1.0 }));
        assertEquals(1, engine.dominantLayer(state, new double[] { 0.0, 5.0 }));
        assertArrayEquals(new double[] { 0.0, 5.0 }, engine.structuralPower(state, new double[] { 0.0, 5.0 }), 0.0);
        assertEquals(0L, state.getStepCount(), "queries do not advance time");
    }

    @Test
    void testShapeErrors() {
        var engine = new StructuralEngine(TestConfigs.twoLayer().build(), new Random(10));
        var state = engine.initialState();

        assertThrows(InvalidInputException.class, () -> engine.advance(state, new double[] { 1.0, 2.0, 3.0 }, DT));
        assertThrows(InvalidInputException.class, () -> engine.advance(state, null, DT));
        assertThrows(InvalidInputException.class,
                     () -> engine.advance(state, new double[] { 1.0, 2.0 }, DT, new double[] { 1.0 }));
        assertThrows(InvalidInputException.class, () -> engine.dominantLayer(state, new double[] { 1.0 }));
        assertThrows(InvalidInputException.class, () -> engine.dynamicTheta(state, new double[] { 1.0, 2.0 }, 2));
        assertThrows(InvalidInputException.class,
                     () -> engine.initialState(new double[] { 0.0 }, new double[] { 1.0, 1.0 }));
    }

    @Test
    void testSeededReplayIsDeterministic() {
        var config = TestConfigs.twoLayer().withBaseThreshold(5.0, 3.0).withStochasticLeap(5.0).build();
        var first = run(new StructuralEngine(config, new Random(42)));
        var second = run(new StructuralEngine(config, new Random(42)));

        assertFalse(first.getLeapHistory().isEmpty());
        assertEquals(first.getLeapHistory(), second.getLeapHistory());
        assertArrayEquals(first.getEnergy(), second.getEnergy(), 0.0);
        assertArrayEquals(first.getInertia(), second.getInertia(), 0.0);
    }

    private EngineState run(StructuralEngine engine) {
        var state = engine.initialState();
        for (int tick = 0; tick < 200; tick++) {
            state = engine.advance(state, new double[] { 80.0, 20.0 }, DT);
        }
        return state;
    }

    @Test
    void testPhysicalScaleFactorPersists() {
        var config = TestConfigs.twoLayer().withPhysicalResidual(PhysicalScaleConfig.defaults()).build();
        var engine = new StructuralEngine(config, new Random(11));
        var pressure = new double[] { 80.0, 20.0 };

        var first = engine.advance(engine.initialState(), pressure, DT);
        var second = engine.advance(first, pressure, DT);

        var s1 = first.getGainState().scaleFactor();
        var s2 = second.getGainState().scaleFactor();
        assertNotEquals(1.0, s1);
        assertNotEquals(s1, s2);
        assertEquals(s1, first.getDiagnostics().scaleFactor());
        assertEquals(s2, engine.snapshot(second).scaleFactor());
        assertTrue(s2 >= 0.01 && s2 <= 100.0);
    }

    @Test
    void testDiagnostics() {
        var config = TestConfigs.twoLayer()
                                .withoutDynamicTheta()
                                .withLogAlignment(LogAlignmentConfig.disabled())
                                .withConductance(0.1, 0.05)
                                .build();
        var engine = new StructuralEngine(config, new Random(12));
        var state = engine.initialState(new double[] { 2.0, 1.0 }, new double[] { 1.0, 1.0 });
        var next = engine.advance(state, new double[] { 50.0, 30.0 }, DT);
        var diagnostics = next.getDiagnostics();

        assertArrayEquals(new double[] { 100.0, 30.0 }, diagnostics.dynamicThresholds(), 0.0);
        assertArrayEquals(new double[] { 50.0 * 2.0 * 100.0, 30.0 * 1.0 * 1.0 }, diagnostics.structuralPower(),
                          1e-9);
        assertEquals(0, diagnostics.dominantLayer());
        assertEquals(10000.0, diagnostics.dominantPower(), 1e-9);
        assertFalse(diagnostics.leapOccurred());
        assertEquals(-1, diagnostics.leapLayer());
        assertEquals(0.15, diagnostics.alignmentEfficiency(), 1e-6);
        assertEquals(0.15, diagnostics.transformedEfficiency(), 1e-6);
        assertEquals(1.0, diagnostics.compressionRatio(), 1e-6);
        assertEquals(Math.hypot(42.5, 25.5), diagnostics.residualNorm(), 1e-6);
        assertEquals(next.getEnergy()[0] + next.getEnergy()[1], diagnostics.totalEnergy(), 1e-12);

        var map = diagnostics.asMap();
        assertEquals(15, map.size());
        assertEquals(0, map.get("dominantLayer"));
        assertEquals(false, map.get("leapOccurred"));
        assertThrows(UnsupportedOperationException.class, () -> map.put("extra", 1));
    }

    @Test
    void testStateFromOtherConfigRejected() {
        var engine = new StructuralEngine(TestConfigs.twoLayer().build(), new Random(15));
        var foreign = EngineState.initial(TestConfigs.singleLayer().build());
        var pressure = new double[] { 1.0, 2.0 };

        assertThrows(InvalidInputException.class, () -> engine.advance(foreign, pressure, DT));
        assertThrows(InvalidInputException.class, () -> engine.dominantLayer(foreign, pressure));
        assertThrows(InvalidInputException.class, () -> engine.structuralPower(foreign, pressure));
        assertThrows(InvalidInputException.class, () -> engine.dynamicTheta(foreign, pressure, 0));
        assertThrows(InvalidInputException.class, () -> engine.advance(null, pressure, DT));
    }

    @Test
    void testScaleFactorSurvivesOverflowingPressure() {
        var config = TestConfigs.twoLayer()
                                .withLogAlignment(LogAlignmentConfig.disabled())
                                .withConductance(0.1, 0.05)
                                .withPhysicalResidual(PhysicalScaleConfig.defaults())
                                .build();
        var engine = new StructuralEngine(config, new Random(16));

        var state = engine.advance(engine.initialState(), new double[] { 1e200, 1e200 }, DT);
        var zeta = state.getGainState().scaleFactor();
        assertTrue(Double.isFinite(zeta), "zeta " + zeta);

        var pressure = new double[] { 50.0, 30.0 };
        state = engine.advance(state, pressure, DT);
        assertTrue(state.getDiagnostics().residualNorm() > 0.0, "generation continues after the extreme tick");

        for (int tick = 0; tick < 50; tick++) {
            state = engine.advance(state, pressure, DT);
        }
        zeta = state.getGainState().scaleFactor();
        assertTrue(zeta >= 0.01 && zeta <= 100.0, "zeta " + zeta);
    }

    @Test
    void testGainSurvivesOverflowingPressure() {
        var engine = new StructuralEngine(TestConfigs.twoLayer().build(), new Random(17));

        var state = engine.advance(engine.initialState(), new double[] { Double.MAX_VALUE, -Double.MAX_VALUE }, DT);
        assertTrue(Double.isFinite(state.getGainState().runningMean()));
        assertEquals(0.01, state.getGainState().gain());

        for (int tick = 0; tick < 20; tick++) {
            state = engine.advance(state, new double[] { 1e200, 1e200 }, DT);
            assertTrue(Double.isFinite(state.getGainState().runningMean()));
            assertTrue(Double.isFinite(state.getGainState().gain()));
        }
        assertTrue(Double.isFinite(engine.dynamicTheta(state, new double[] { 1.0, 1.0 }, 0)));
    }

    @Test
    void testTransferFeedsEnergy() {
        var config = TestConfigs.twoLayer().withLogAlignment(LogAlignmentConfig.disabled()).build();
        var engine = new StructuralEngine(config, new Random(13));
        var state = engine.initialState();
        var zero = new double[] { 0.0, 0.0 };

        var next = engine.advance(state, zero, DT, new double[] { 2.0, -2.0 });

        assertArrayEquals(new double[] { 0.2, 0.0 }, next.getEnergy(), 1e-12);
    }

    @Property(tries = 200)
    void invariantsHoldAfterEveryTick(@ForAll("pressureSequences") List<double[]> pressures,
                                      @ForAll @DoubleRange(min = 0.0, max = 1.0) double dt,
                                      @ForAll boolean logResidual, @ForAll boolean thermal,
                                      @ForAll boolean aligned, @ForAll long seed) {
        var builder = TestConfigs.twoLayer()
                                 .withBaseThreshold(5.0, 3.0)
                                 .withLogAlignment(LogAlignmentConfig.defaults().withEnabled(aligned).withWarmupSteps(2));
        if (!logResidual) {
            builder.withPhysicalResidual(PhysicalScaleConfig.defaults());
        }
        if (thermal) {
            builder.withStochasticLeap(5.0);
        }
        var config = builder.build();
        var floor = config.getInertiaFloor();
        var engine = new StructuralEngine(config, new Random(seed));
        var state = engine.initialState();

        for (var pressure : pressures) {
            state = engine.advance(state, pressure, dt);
            var energy = state.getEnergy();
            var inertia = state.getInertia();
            for (int i = 0; i < energy.length; i++) {
                assertTrue(energy[i] >= 0.0, "energy " + energy[i]);
                assertTrue(inertia[i] >= floor[i], "inertia " + inertia[i]);
            }
            assertTrue(state.getDiagnostics().residualNorm() >= 0.0);
            assertTrue(Double.isFinite(state.getGainState().runningMean()));
            assertTrue(Double.isFinite(state.getGainState().scaleFactor()));
        }
    }

    @Property
    void staticThresholdIgnoresState(@ForAll("pressures") double[] pressure,
                                     @ForAll("pressures") double[] energy) {
        var config = TestConfigs.twoLayer().withoutDynamicTheta().build();
        var engine = new StructuralEngine(config, new Random(14));
        var abs = new double[] { Math.abs(energy[0]), Math.abs(energy[1]) };
        var state = engine.initialState(abs, new double[] { 1.0, 1.0 });
        assertEquals(100.0, engine.dynamicTheta(state, pressure, 0));
        assertEquals(30.0, engine.dynamicTheta(state, pressure, 1));
    }

    @Provide
    Arbitrary<double[]> pressures() {
        return Arbitraries.doubles().between(-1e6, 1e6).array(double[].class).ofSize(2);
    }

    @Provide
    Arbitrary<List<double[]>> pressureSequences() {
        var anyFinite = Arbitraries.doubles()
                                   .between(-Double.MAX_VALUE, Double.MAX_VALUE)
                                   .withSpecialValue(Double.MAX_VALUE)
                                   .withSpecialValue(-Double.MAX_VALUE)
                                   .withSpecialValue(1e200)
                                   .array(double[].class)
                                   .ofSize(2);
        return Arbitraries.oneOf(pressures(), anyFinite).list().ofMinSize(1).ofMaxSize(40);
    }
}

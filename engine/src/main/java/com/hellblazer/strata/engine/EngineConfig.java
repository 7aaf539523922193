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

import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable configuration of a {@link StructuralEngine}.
 * <p>
 * Seven per-layer parameter vectors, each exactly {@code layerCount} long:
 * <ul>
 * <li>resistance R: how hard the layer is to influence</li>
 * <li>generation rate gamma: energy produced per unit residual</li>
 * <li>decay rate beta: fraction of energy dissipated per unit time</li>
 * <li>learning rate eta: inertia gained from throughput</li>
 * <li>forgetting rate lambda: inertia lost per unit time</li>
 * <li>inertia floor kappaMin</li>
 * <li>base leap threshold Theta</li>
 * </ul>
 * plus scalar controls for the dynamic threshold, leap policy, conductance model,
 * Log-Alignment and residual accounting.
 * <p>
 * The builder starts from the four-layer reference parameter set. Changing the layer
 * count without supplying matching arrays fails validation in {@link Builder#build()}.
 *
 * @author hal.hildebrand
 */
public final class EngineConfig {

    final int      layerCount;
    final double[] resistance;
    final double[] generationRate;
    final double[] decayRate;
    final double[] learningRate;
    final double[] forgettingRate;
    final double[] inertiaFloor;
    final double[] baseThreshold;

    private final boolean             dynamicTheta;
    private final double              thetaSensitivity;
    private final boolean             stochasticLeap;
    private final double              temperature;
    private final double              baseConductance;
    private final double              inertiaGain;
    private final LogAlignmentConfig  logAlignment;
    private final boolean             logResidual;
    private final PhysicalScaleConfig physicalScale;

    private EngineConfig(Builder builder) {
        this.layerCount = builder.layerCount;
        this.resistance = builder.resistance.clone();
        this.generationRate = builder.generationRate.clone();
        this.decayRate = builder.decayRate.clone();
        this.learningRate = builder.learningRate.clone();
        this.forgettingRate = builder.forgettingRate.clone();
        this.inertiaFloor = builder.inertiaFloor.clone();
        this.baseThreshold = builder.baseThreshold.clone();
        this.dynamicTheta = builder.dynamicTheta;
        this.thetaSensitivity = builder.thetaSensitivity;
        this.stochasticLeap = builder.stochasticLeap;
        this.temperature = builder.temperature;
        this.baseConductance = builder.baseConductance;
        this.inertiaGain = builder.inertiaGain;
        this.logAlignment = builder.logAlignment;
        this.logResidual = builder.logResidual;
        this.physicalScale = builder.physicalScale;
    }

    /**
     * Creates a new builder seeded with the four-layer reference parameters.
     *
     * @return a new Builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return the four-layer reference configuration
     */
    public static EngineConfig defaults() {
        return builder().build();
    }

    public int getLayerCount() {
        return layerCount;
    }

    public double[] getResistance() {
        return resistance.clone();
    }

    public double[] getGenerationRate() {
        return generationRate.clone();
    }

    public double[] getDecayRate() {
        return decayRate.clone();
    }

    public double[] getLearningRate() {
        return learningRate.clone();
    }

    public double[] getForgettingRate() {
        return forgettingRate.clone();
    }

    public double[] getInertiaFloor() {
        return inertiaFloor.clone();
    }

    public double[] getBaseThreshold() {
        return baseThreshold.clone();
    }

    public boolean isDynamicThetaEnabled() {
        return dynamicTheta;
    }

    public double getThetaSensitivity() {
        return thetaSensitivity;
    }

    public boolean isStochasticLeapEnabled() {
        return stochasticLeap;
    }

    public double getTemperature() {
        return temperature;
    }

    public double getBaseConductance() {
        return baseConductance;
    }

    public double getInertiaGain() {
        return inertiaGain;
    }

    public LogAlignmentConfig getLogAlignment() {
        return logAlignment;
    }

    public boolean isLogResidual() {
        return logResidual;
    }

    public PhysicalScaleConfig getPhysicalScale() {
        return physicalScale;
    }

    /**
     * The thermal policy applies only when stochastic leaps are enabled and the temperature
     * is strictly positive.
     *
     * @return the leap trigger policy selected by this configuration
     */
    public LeapPolicy getLeapPolicy() {
        return stochasticLeap && temperature > 0.0 ? LeapPolicy.THERMAL : LeapPolicy.DETERMINISTIC_BIASED;
    }

    /**
     * @return the residual accounting mode selected by this configuration
     */
    public ResidualMode getResidualMode() {
        return logResidual ? ResidualMode.LOG_SPACE : ResidualMode.PHYSICAL_SPACE;
    }

    @Override
    public String toString() {
        return "EngineConfig{layers=" + layerCount + ", R=" + Arrays.toString(resistance) + ", Theta="
        + Arrays.toString(baseThreshold) + ", dynamicTheta=" + dynamicTheta + ", policy=" + getLeapPolicy()
        + ", residual=" + getResidualMode() + ", logAlignment=" + logAlignment.enabled() + "}";
    }

    /**
     * Builder class for EngineConfig
     */
    public static class Builder {
        private int                 layerCount       = 4;
        private double[]            resistance       = { 1000.0, 100.0, 10.0, 1.0 };
        private double[]            generationRate   = { 0.15, 0.10, 0.08, 0.05 };
        private double[]            decayRate        = { 0.001, 0.01, 0.05, 0.1 };
        private double[]            learningRate     = { 0.9, 0.5, 0.3, 0.2 };
        private double[]            forgettingRate   = { 0.001, 0.01, 0.02, 0.05 };
        private double[]            inertiaFloor     = { 0.9, 0.8, 0.5, 0.3 };
        private double[]            baseThreshold    = { 200.0, 100.0, 50.0, 30.0 };
        private boolean             dynamicTheta     = true;
        private double              thetaSensitivity = 0.3;
        private boolean             stochasticLeap   = false;
        private double              temperature      = 0.0;
        private double              baseConductance  = 0.5;
        private double              inertiaGain      = 0.7;
        private LogAlignmentConfig  logAlignment     = LogAlignmentConfig.defaults();
        private boolean             logResidual      = true;
        private PhysicalScaleConfig physicalScale    = PhysicalScaleConfig.defaults();

        private Builder() {
        }

        public Builder withLayerCount(int layerCount) {
            this.layerCount = layerCount;
            return this;
        }

        public Builder withResistance(double... resistance) {
            this.resistance = resistance;
            return this;
        }

        public Builder withGenerationRate(double... generationRate) {
            this.generationRate = generationRate;
            return this;
        }

        public Builder withDecayRate(double... decayRate) {
            this.decayRate = decayRate;
            return this;
        }

        public Builder withLearningRate(double... learningRate) {
            this.learningRate = learningRate;
            return this;
        }

        public Builder withForgettingRate(double... forgettingRate) {
            this.forgettingRate = forgettingRate;
            return this;
        }

        public Builder withInertiaFloor(double... inertiaFloor) {
            this.inertiaFloor = inertiaFloor;
            return this;
        }

        public Builder withBaseThreshold(double... baseThreshold) {
            this.baseThreshold = baseThreshold;
            return this;
        }

        /**
         * Enables threshold lowering under aggregate structural influence.
         *
         * @param sensitivity scale applied to the influence before it reduces Theta
         * @return this builder instance
         */
        public Builder withDynamicTheta(double sensitivity) {
            this.dynamicTheta = true;
            this.thetaSensitivity = sensitivity;
            return this;
        }

        public Builder withoutDynamicTheta() {
            this.dynamicTheta = false;
            return this;
        }

        /**
         * Selects the thermal leap policy when {@code temperature > 0}.
         *
         * @param temperature sigmoid temperature, must be non-negative
         * @return this builder instance
         */
        public Builder withStochasticLeap(double temperature) {
            this.stochasticLeap = true;
            this.temperature = temperature;
            return this;
        }

        public Builder withoutStochasticLeap() {
            this.stochasticLeap = false;
            return this;
        }

        /**
         * Sets the Ohm's-law conductance model {@code G = G0 + g * inertia}.
         *
         * @param baseConductance G0
         * @param inertiaGain     g
         * @return this builder instance
         */
        public Builder withConductance(double baseConductance, double inertiaGain) {
            this.baseConductance = baseConductance;
            this.inertiaGain = inertiaGain;
            return this;
        }

        public Builder withLogAlignment(LogAlignmentConfig logAlignment) {
            this.logAlignment = logAlignment;
            return this;
        }

        public Builder withLogResidual() {
            this.logResidual = true;
            return this;
        }

        public Builder withPhysicalResidual(PhysicalScaleConfig physicalScale) {
            this.logResidual = false;
            this.physicalScale = physicalScale;
            return this;
        }

        /**
         * Validates and builds the configuration.
         *
         * @return the immutable configuration
         * @throws ConfigurationException if any per-layer array length differs from the layer count, or a scalar
         *                                control is out of range
         */
        public EngineConfig build() {
            if (layerCount < 1) {
                throw new ConfigurationException("layerCount must be at least 1: " + layerCount);
            }
            requireLength("resistance", resistance);
            requireLength("generationRate", generationRate);
            requireLength("decayRate", decayRate);
            requireLength("learningRate", learningRate);
            requireLength("forgettingRate", forgettingRate);
            requireLength("inertiaFloor", inertiaFloor);
            requireLength("baseThreshold", baseThreshold);
            if (!(temperature >= 0.0)) {
                throw new ConfigurationException("temperature must be non-negative: " + temperature);
            }
            Objects.requireNonNull(logAlignment, "logAlignment cannot be null");
            Objects.requireNonNull(physicalScale, "physicalScale cannot be null");
            return new EngineConfig(this);
        }

        private void requireLength(String name, double[] values) {
            if (values == null) {
                throw new ConfigurationException(name + " cannot be null");
            }
            if (values.length != layerCount) {
                throw new ConfigurationException(
                String.format("%s has %d entries but layerCount is %d", name, values.length, layerCount));
            }
        }
    }
}

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
package com.hellblazer.strata.common;

import javax.vecmath.GVector;

/**
 * Deterministic scalar and vector math for layered simulation state.
 * <p>
 * Ensures identical results across platforms and runs by:
 * - Using StrictMath (IEEE 754 compliance) instead of Math (platform-specific intrinsics)
 * - Binary reduction tree for stable floating-point accumulation
 * <p>
 * Per-layer quantities are plain {@code double[]} vectors of the same length. The vector
 * operations here never mutate their arguments.
 * <p>
 * Usage:
 * <pre>
 * double magnitude = VectorMath.norm(pressure);
 * double total = VectorMath.stableSum(power);
 * double squashed = VectorMath.sigmoid(gap / temperature);
 * </pre>
 *
 * @author hal.hildebrand
 */
public final class VectorMath {

    private VectorMath() {
    }

    /**
     * Euclidean norm of a vector.
     * <p>
     * Components are scaled by the largest magnitude before squaring, so the result is
     * finite whenever the true norm is representable.
     *
     * @param values vector components
     * @return ||values||, 0 for an empty vector
     */
    public static double norm(double[] values) {
        var largest = 0.0;
        for (var value : values) {
            var magnitude = StrictMath.abs(value);
            if (Double.isNaN(magnitude)) {
                return Double.NaN;
            }
            largest = StrictMath.max(largest, magnitude);
        }
        if (largest == 0.0 || Double.isInfinite(largest)) {
            return largest;
        }
        var scaled = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            scaled[i] = values[i] / largest;
        }
        return largest * new GVector(scaled).norm();
    }

    /**
     * Sign of a value: -1, 0 or 1.
     *
     * @param x input value
     * @return signum of x
     */
    public static double sign(double x) {
        return StrictMath.signum(x);
    }

    /**
     * Deterministic natural logarithm of 1 + x.
     *
     * @param x input value, > -1
     * @return ln(1 + x)
     */
    public static double log1p(double x) {
        return StrictMath.log1p(x);
    }

    /**
     * Deterministic natural logarithm.
     *
     * @param x input value
     * @return ln(x)
     */
    public static double log(double x) {
        return StrictMath.log(x);
    }

    /**
     * Clamp value between min and max.
     *
     * @param value value to clamp
     * @param min   minimum value
     * @param max   maximum value
     * @return clamped value
     */
    public static double clamp(double value, double min, double max) {
        return StrictMath.max(min, StrictMath.min(max, value));
    }

    /**
     * Floor a value at a minimum, mapping NaN to the minimum.
     * <p>
     * {@code StrictMath.max} propagates NaN, which would break floor invariants after an
     * overflowing update; this variant does not.
     *
     * @param value value to floor
     * @param min   floor
     * @return max(min, value), or min when value is NaN
     */
    public static double floorAt(double value, double min) {
        if (Double.isNaN(value)) {
            return min;
        }
        return StrictMath.max(min, value);
    }

    /**
     * Logistic sigmoid 1 / (1 + e^-x), evaluated without overflow for large |x|.
     *
     * @param x input value
     * @return value in [0, 1]
     */
    public static double sigmoid(double x) {
        if (x >= 0) {
            return 1.0 / (1.0 + StrictMath.exp(-x));
        }
        var e = StrictMath.exp(x);
        return e / (1.0 + e);
    }

    /**
     * Stable summation using binary reduction tree.
     * <p>
     * Splits the range in half recursively so the result does not depend on the order
     * in which partial sums accumulate.
     *
     * @param values array of values to sum
     * @return sum of all values
     */
    public static double stableSum(double[] values) {
        if (values.length == 0) {
            return 0.0;
        }
        return stableSumRecursive(values, 0, values.length);
    }

    private static double stableSumRecursive(double[] values, int start, int end) {
        int length = end - start;
        if (length == 1) {
            return values[start];
        }
        int mid = start + length / 2;
        return stableSumRecursive(values, start, mid) + stableSumRecursive(values, mid, end);
    }

    /**
     * Component-wise product of two vectors.
     *
     * @param a first vector
     * @param b second vector, same length as a
     * @return new vector a[i] * b[i]
     */
    public static double[] multiply(double[] a, double[] b) {
        var result = new double[a.length];
        for (int i = 0; i < a.length; i++) {
            result[i] = a[i] * b[i];
        }
        return result;
    }

    /**
     * Component-wise absolute value.
     *
     * @param values input vector
     * @return new vector |values[i]|
     */
    public static double[] abs(double[] values) {
        var result = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            result[i] = StrictMath.abs(values[i]);
        }
        return result;
    }

    /**
     * Index of the largest component; the lowest index wins ties.
     *
     * @param values non-empty vector
     * @return index of the maximum, 0 if every component is NaN
     */
    public static int argMax(double[] values) {
        int best = 0;
        for (int i = 1; i < values.length; i++) {
            if (values[i] > values[best] || (Double.isNaN(values[best]) && !Double.isNaN(values[i]))) {
                best = i;
            }
        }
        return best;
    }
}

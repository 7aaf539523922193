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

import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.DoubleRange;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for VectorMath - deterministic scalar and vector helpers.
 *
 * @author hal.hildebrand
 */
class VectorMathTest {

    private static final double EPSILON = 1e-12;

    @Test
    void testNorm() {
        assertEquals(5.0, VectorMath.norm(new double[] { 3.0, 4.0 }), EPSILON);
        assertEquals(0.0, VectorMath.norm(new double[] { 0.0, 0.0, 0.0 }), EPSILON);
        assertEquals(0.0, VectorMath.norm(new double[0]), EPSILON);
    }

    @Test
    void testNormDoesNotMutateInput() {
        var values = new double[] { -3.0, 4.0 };
        VectorMath.norm(values);
        assertArrayEquals(new double[] { -3.0, 4.0 }, values, 0.0);
    }

    @Test
    void testSign() {
        assertEquals(1.0, VectorMath.sign(42.0));
        assertEquals(-1.0, VectorMath.sign(-0.5));
        assertEquals(0.0, VectorMath.sign(0.0));
    }

    @Test
    void testClamp() {
        assertEquals(1.0, VectorMath.clamp(-5.0, 1.0, 2.0));
        assertEquals(2.0, VectorMath.clamp(5.0, 1.0, 2.0));
        assertEquals(1.5, VectorMath.clamp(1.5, 1.0, 2.0));
    }

    @Test
    void testFloorAtAbsorbsNaN() {
        assertEquals(0.3, VectorMath.floorAt(Double.NaN, 0.3));
        assertEquals(0.3, VectorMath.floorAt(-10.0, 0.3));
        assertEquals(7.0, VectorMath.floorAt(7.0, 0.3));
    }

    @Test
    void testSigmoid() {
        assertEquals(0.5, VectorMath.sigmoid(0.0), EPSILON);
        assertEquals(1.0, VectorMath.sigmoid(1000.0), EPSILON);
        assertEquals(0.0, VectorMath.sigmoid(-1000.0), EPSILON);
        assertFalse(Double.isNaN(VectorMath.sigmoid(-1000.0)));
    }

    @ParameterizedTest
    @ValueSource(doubles = { 0.1, 0.5, 2.0, 7.5 })
    void testSigmoidSymmetry(double x) {
        assertEquals(1.0, VectorMath.sigmoid(x) + VectorMath.sigmoid(-x), EPSILON);
    }

    @Test
    void testStableSum_EmptyArray() {
        assertEquals(0.0, VectorMath.stableSum(new double[0]), EPSILON);
    }

    @Test
    void testStableSum_MultipleElements() {
        assertEquals(15.0, VectorMath.stableSum(new double[] { 1.0, 2.0, 3.0, 4.0, 5.0 }), EPSILON);
    }

    @Test
    void testStableSum_OrderIndependent() {
        var sum1 = VectorMath.stableSum(new double[] { 1.0, 2.0, 3.0, 4.0 });
        var sum2 = VectorMath.stableSum(new double[] { 4.0, 3.0, 2.0, 1.0 });
        assertEquals(sum1, sum2, 0.0, "Binary reduction should produce identical results regardless of order");
    }

    @Test
    void testMultiplyAndAbs() {
        assertArrayEquals(new double[] { -2.0, 12.0 }, VectorMath.multiply(new double[] { 1.0, 3.0 },
                                                                             new double[] { -2.0, 4.0 }), EPSILON);
        assertArrayEquals(new double[] { 2.0, 0.0, 4.0 }, VectorMath.abs(new double[] { -2.0, 0.0, 4.0 }), EPSILON);
    }

    @Test
    void testArgMax() {
        assertEquals(2, VectorMath.argMax(new double[] { 1.0, 3.0, 5.0, 4.0 }));
        assertEquals(0, VectorMath.argMax(new double[] { 2.0, 2.0 }), "lowest index wins ties");
        assertEquals(1, VectorMath.argMax(new double[] { Double.NaN, -1.0 }));
    }

    @Property
    void log1pIsOdd(@ForAll @DoubleRange(min = 0.0, max = 1e9) double x) {
        var positive = VectorMath.sign(x) * VectorMath.log1p(Math.abs(x));
        var negative = VectorMath.sign(-x) * VectorMath.log1p(Math.abs(-x));
        assertEquals(positive, -negative, 0.0);
    }

    @Test
    void testNormAvoidsOverflow() {
        assertEquals(5e300, VectorMath.norm(new double[] { 3e300, 4e300 }), 1e288);
        assertEquals(StrictMath.sqrt(2.0) * 1e200, VectorMath.norm(new double[] { 1e200, -1e200 }), 1e188);
        assertEquals(5e-300, VectorMath.norm(new double[] { 3e-300, 4e-300 }), 1e-312);
        assertEquals(Double.MAX_VALUE, VectorMath.norm(new double[] { Double.MAX_VALUE, 0.0 }));
    }

    @Test
    void testNormBeyondRange() {
        assertEquals(Double.POSITIVE_INFINITY, VectorMath.norm(new double[] { Double.MAX_VALUE, Double.MAX_VALUE }));
        assertEquals(Double.POSITIVE_INFINITY, VectorMath.norm(new double[] { 1.0, Double.NEGATIVE_INFINITY }));
        assertTrue(Double.isNaN(VectorMath.norm(new double[] { 1.0, Double.NaN })));
    }
}

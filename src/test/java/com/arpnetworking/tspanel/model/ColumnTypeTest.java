/*
 * Copyright 2026 Inscope Metrics
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.arpnetworking.tspanel.model;

import com.google.common.collect.ImmutableList;
import org.hamcrest.MatcherAssert;
import org.hamcrest.Matchers;
import org.junit.Assert;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;

/**
 * Tests for the {@link ColumnType} and {@link Column} classes.
 *
 * @author Inscope Metrics
 */
public class ColumnTypeTest {

    @Test
    public void inferIntegers() {
        Assert.assertEquals(ColumnType.INT64, ColumnType.infer(Arrays.asList(1L, 2, null)));
    }

    @Test
    public void inferMixedNumbers() {
        Assert.assertEquals(ColumnType.FLOAT64, ColumnType.infer(Arrays.asList(1L, 2.5)));
    }

    @Test
    public void inferBooleans() {
        Assert.assertEquals(ColumnType.BOOLEAN, ColumnType.infer(Arrays.asList(true, null, false)));
    }

    @Test
    public void inferMixedKinds() {
        Assert.assertEquals(ColumnType.STRING, ColumnType.infer(Arrays.asList(1L, "a")));
    }

    @Test
    public void inferAllMissing() {
        Assert.assertEquals(ColumnType.FLOAT64, ColumnType.infer(Arrays.asList(null, Double.NaN)));
        Assert.assertEquals(ColumnType.FLOAT64, ColumnType.infer(Collections.emptyList()));
    }

    @Test
    public void fromNameAcceptsAliases() {
        Assert.assertEquals(ColumnType.INT64, ColumnType.fromName("int"));
        Assert.assertEquals(ColumnType.INT64, ColumnType.fromName("Long"));
        Assert.assertEquals(ColumnType.FLOAT64, ColumnType.fromName("double"));
        Assert.assertEquals(ColumnType.BOOLEAN, ColumnType.fromName("boolean"));
        Assert.assertEquals(ColumnType.STRING, ColumnType.fromName("object"));
        Assert.assertFalse(ColumnType.tryFromName("decimal").isPresent());
    }

    @Test(expected = IllegalArgumentException.class)
    public void fromNameRejectsUnknown() {
        ColumnType.fromName("decimal");
    }

    @Test
    public void unify() {
        Assert.assertEquals(ColumnType.INT64, ColumnType.unify(ColumnType.INT64, ColumnType.INT64));
        Assert.assertEquals(ColumnType.FLOAT64, ColumnType.unify(ColumnType.INT64, ColumnType.FLOAT64));
        Assert.assertEquals(ColumnType.STRING, ColumnType.unify(ColumnType.BOOLEAN, ColumnType.FLOAT64));
    }

    @Test
    public void convert() {
        Assert.assertEquals(3L, ColumnType.INT64.convert(3.0));
        Assert.assertEquals(7L, ColumnType.INT64.convert(" 7 "));
        Assert.assertNull(ColumnType.INT64.convert(Double.NaN));
        Assert.assertNull(ColumnType.FLOAT64.convert(null));
        Assert.assertEquals(1.0, ColumnType.FLOAT64.convert(true));
        Assert.assertEquals(Boolean.TRUE, ColumnType.BOOLEAN.convert("TRUE"));
        Assert.assertEquals("2.5", ColumnType.STRING.convert(2.5));
    }

    @Test(expected = TypeMismatchException.class)
    public void convertRejectsFractionToInteger() {
        ColumnType.INT64.convert(2.5);
    }

    @Test(expected = TypeMismatchException.class)
    public void convertRejectsIntegerBeyondLongRange() {
        ColumnType.INT64.convert(1e19);
    }

    @Test
    public void convertAcceptsLongRangeBoundary() {
        Assert.assertEquals(Long.MIN_VALUE, ColumnType.INT64.convert(-0x1p63));
    }

    @Test
    public void columnConversionNamesTheColumn() {
        try {
            Column.of("price", ColumnType.FLOAT64, ImmutableList.of("1.5", "cheap"));
            Assert.fail("Expected exception");
        } catch (final TypeMismatchException e) {
            MatcherAssert.assertThat(e.getMessage(), Matchers.containsString("column=price"));
        }
    }

    @Test
    public void columnAccessors() {
        final Column column = Column.of("v", Arrays.asList(1L, null, 3L));
        Assert.assertEquals(ColumnType.INT64, column.getType());
        Assert.assertEquals(3, column.size());
        Assert.assertEquals(1, column.countMissing());
        Assert.assertTrue(column.isMissing(1));
        Assert.assertEquals(Double.valueOf(3.0), column.getDouble(2));
        Assert.assertNull(column.getDouble(1));
        Assert.assertEquals(Arrays.asList(3L, null, 1L), column.select(new int[]{2, -1, 0}).getValues());
        Assert.assertEquals(Arrays.asList(null, 3L), column.slice(1, 3).getValues());
    }

    @Test(expected = IllegalStateException.class)
    public void getDoubleRequiresNumericColumn() {
        Column.of("s", ImmutableList.of("a")).getDouble(0);
    }

    @Test
    public void constantInfersTypeFromValue() {
        Assert.assertEquals(ColumnType.STRING, Column.constant("c", "west", 0).getType());
        Assert.assertEquals(ColumnType.INT64, Column.constant("c", 5L, 2).getType());
        Assert.assertEquals(ImmutableList.of(5L, 5L), Column.constant("c", 5L, 2).getValues());
    }
}

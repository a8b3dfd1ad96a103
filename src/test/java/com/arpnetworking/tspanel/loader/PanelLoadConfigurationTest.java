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
package com.arpnetworking.tspanel.loader;

import com.arpnetworking.tspanel.time.Frequency;
import com.arpnetworking.tspanel.transform.FillMethod;
import com.google.common.collect.ImmutableList;
import net.sf.oval.exception.ConstraintsViolatedException;
import org.junit.Assert;
import org.junit.Test;

import java.io.IOException;
import java.util.Optional;

/**
 * Tests for the {@link PanelLoadConfiguration} class.
 *
 * @author Inscope Metrics
 */
public class PanelLoadConfigurationTest {

    @Test
    public void defaults() {
        final PanelLoadConfiguration configuration = new PanelLoadConfiguration.Builder().build();
        Assert.assertEquals(Optional.empty(), configuration.getTimeColumn());
        Assert.assertEquals(Optional.empty(), configuration.getFrequency());
        Assert.assertFalse(configuration.hasRoleColumns());
        Assert.assertFalse(configuration.getFillMissingDates());
        Assert.assertEquals(FillMethod.PREVIOUS, configuration.getFillMethod());
        Assert.assertEquals(10, configuration.getFillWindowSize());
        Assert.assertEquals(',', configuration.getSeparator());
    }

    @Test
    public void deserialize() throws IOException {
        final PanelLoadConfiguration configuration = PanelLoadConfiguration.createObjectMapper()
                .readValue(
                        getClass().getResource(getClass().getSimpleName() + ".json"),
                        PanelLoadConfiguration.Builder.class)
                .build();
        Assert.assertEquals(Optional.of("date"), configuration.getTimeColumn());
        Assert.assertEquals(ImmutableList.of("sales"), configuration.getTargetColumns());
        Assert.assertEquals(ImmutableList.of("visits"), configuration.getObservedColumns());
        Assert.assertEquals(ImmutableList.of("promo"), configuration.getKnownColumns());
        Assert.assertEquals(ImmutableList.of("store"), configuration.getStaticColumns());
        Assert.assertEquals(Optional.of(Frequency.calendar("D")), configuration.getFrequency());
        Assert.assertTrue(configuration.getFillMissingDates());
        Assert.assertEquals(FillMethod.AVG, configuration.getFillMethod());
        Assert.assertEquals(3, configuration.getFillWindowSize());
        Assert.assertEquals(';', configuration.getSeparator());
        Assert.assertTrue(configuration.hasRoleColumns());
    }

    @Test
    public void ordinalFrequency() {
        final PanelLoadConfiguration configuration = new PanelLoadConfiguration.Builder()
                .setFrequency("7")
                .build();
        Assert.assertEquals(Optional.of(Frequency.ordinal(7)), configuration.getFrequency());
    }

    @Test(expected = ConstraintsViolatedException.class)
    public void rejectsInvalidFrequency() {
        new PanelLoadConfiguration.Builder()
                .setFrequency("fortnightly")
                .build();
    }

    @Test(expected = ConstraintsViolatedException.class)
    public void rejectsEmptyWindow() {
        new PanelLoadConfiguration.Builder()
                .setFillWindowSize(0)
                .build();
    }

    @Test(expected = ConstraintsViolatedException.class)
    public void rejectsEmptyTimeColumn() {
        new PanelLoadConfiguration.Builder()
                .setTimeColumn("")
                .build();
    }
}

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

import com.arpnetworking.commons.builder.OvalBuilder;
import com.arpnetworking.commons.jackson.databind.ObjectMapperFactory;
import com.arpnetworking.tspanel.time.Frequency;
import com.arpnetworking.tspanel.transform.FillMethod;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import net.sf.oval.constraint.NotEmpty;
import net.sf.oval.constraint.NotNull;
import net.sf.oval.constraint.Range;
import net.sf.oval.constraint.ValidateWithMethod;

import java.util.Optional;
import javax.annotation.Nullable;

/**
 * Describes how to build a panel from a table: which column holds the time
 * points, which columns play which role and how missing values are filled.
 *
 * @author Inscope Metrics
 */
public final class PanelLoadConfiguration {
    /**
     * Create an {@link com.fasterxml.jackson.databind.ObjectMapper} for panel load configuration.
     *
     * @return An {@link ObjectMapper} for panel load configuration.
     */
    public static ObjectMapper createObjectMapper() {
        return ObjectMapperFactory.getInstance();
    }

    public Optional<String> getTimeColumn() {
        return _timeColumn;
    }

    public ImmutableList<String> getTargetColumns() {
        return _targetColumns;
    }

    public ImmutableList<String> getObservedColumns() {
        return _observedColumns;
    }

    public ImmutableList<String> getKnownColumns() {
        return _knownColumns;
    }

    public ImmutableList<String> getStaticColumns() {
        return _staticColumns;
    }

    public Optional<Frequency> getFrequency() {
        return _frequency;
    }

    public boolean getFillMissingDates() {
        return _fillMissingDates;
    }

    public FillMethod getFillMethod() {
        return _fillMethod;
    }

    public int getFillWindowSize() {
        return _fillWindowSize;
    }

    public char getSeparator() {
        return _separator;
    }

    /**
     * Whether any column has been assigned a role.
     *
     * @return True if at least one role lists a column.
     */
    public boolean hasRoleColumns() {
        return !_targetColumns.isEmpty()
                || !_observedColumns.isEmpty()
                || !_knownColumns.isEmpty()
                || !_staticColumns.isEmpty();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("id", Integer.toHexString(System.identityHashCode(this)))
                .add("TimeColumn", _timeColumn)
                .add("TargetColumns", _targetColumns)
                .add("ObservedColumns", _observedColumns)
                .add("KnownColumns", _knownColumns)
                .add("StaticColumns", _staticColumns)
                .add("Frequency", _frequency)
                .add("FillMissingDates", _fillMissingDates)
                .add("FillMethod", _fillMethod)
                .add("FillWindowSize", _fillWindowSize)
                .add("Separator", _separator)
                .toString();
    }

    private PanelLoadConfiguration(final Builder builder) {
        _timeColumn = Optional.ofNullable(builder._timeColumn);
        _targetColumns = builder._targetColumns;
        _observedColumns = builder._observedColumns;
        _knownColumns = builder._knownColumns;
        _staticColumns = builder._staticColumns;
        _frequency = Optional.ofNullable(builder._frequency).map(Frequency::parse);
        _fillMissingDates = builder._fillMissingDates;
        _fillMethod = builder._fillMethod;
        _fillWindowSize = builder._fillWindowSize;
        _separator = builder._separator;
    }

    private final Optional<String> _timeColumn;
    private final ImmutableList<String> _targetColumns;
    private final ImmutableList<String> _observedColumns;
    private final ImmutableList<String> _knownColumns;
    private final ImmutableList<String> _staticColumns;
    private final Optional<Frequency> _frequency;
    private final boolean _fillMissingDates;
    private final FillMethod _fillMethod;
    private final int _fillWindowSize;
    private final char _separator;

    /**
     * {@link com.arpnetworking.commons.builder.Builder} implementation for
     * {@link PanelLoadConfiguration}.
     */
    public static final class Builder extends OvalBuilder<PanelLoadConfiguration> {

        /**
         * Public constructor.
         */
        public Builder() {
            super(PanelLoadConfiguration::new);
        }

        /**
         * Set the time column. Optional. Can be null. When absent the table
         * index or the row positions are used.
         *
         * @param value The time column name.
         * @return This {@link Builder} instance.
         */
        public Builder setTimeColumn(@Nullable final String value) {
            _timeColumn = value;
            return this;
        }

        /**
         * Set the target columns. Optional. Cannot be null. Defaults to an
         * empty {@link ImmutableList}.
         *
         * @param value The target column names.
         * @return This {@link Builder} instance.
         */
        public Builder setTargetColumns(final ImmutableList<String> value) {
            _targetColumns = value;
            return this;
        }

        /**
         * Set the observed covariate columns. Optional. Cannot be null.
         * Defaults to an empty {@link ImmutableList}.
         *
         * @param value The observed covariate column names.
         * @return This {@link Builder} instance.
         */
        public Builder setObservedColumns(final ImmutableList<String> value) {
            _observedColumns = value;
            return this;
        }

        /**
         * Set the known covariate columns. Optional. Cannot be null. Defaults
         * to an empty {@link ImmutableList}.
         *
         * @param value The known covariate column names.
         * @return This {@link Builder} instance.
         */
        public Builder setKnownColumns(final ImmutableList<String> value) {
            _knownColumns = value;
            return this;
        }

        /**
         * Set the static covariate columns. Optional. Cannot be null. Defaults
         * to an empty {@link ImmutableList}.
         *
         * @param value The static covariate column names.
         * @return This {@link Builder} instance.
         */
        public Builder setStaticColumns(final ImmutableList<String> value) {
            _staticColumns = value;
            return this;
        }

        /**
         * Set the frequency. Optional. Can be null. Digits are an integer
         * step, anything else a calendar period code such as {@code "D"}.
         *
         * @param value The frequency.
         * @return This {@link Builder} instance.
         */
        public Builder setFrequency(@Nullable final String value) {
            _frequency = value;
            return this;
        }

        /**
         * Set whether to fill missing values. Optional. Cannot be null.
         * Defaults to false.
         *
         * @param value Whether to fill missing values.
         * @return This {@link Builder} instance.
         */
        public Builder setFillMissingDates(final Boolean value) {
            _fillMissingDates = value;
            return this;
        }

        /**
         * Set the fill method. Optional. Cannot be null. Defaults to
         * {@link FillMethod#PREVIOUS}.
         *
         * @param value The fill method.
         * @return This {@link Builder} instance.
         */
        public Builder setFillMethod(final FillMethod value) {
            _fillMethod = value;
            return this;
        }

        /**
         * Set the fill window size. Optional. Cannot be null. Must be at
         * least one. Defaults to 10.
         *
         * @param value The window size.
         * @return This {@link Builder} instance.
         */
        public Builder setFillWindowSize(final Integer value) {
            _fillWindowSize = value;
            return this;
        }

        /**
         * Set the CSV separator. Optional. Cannot be null. Defaults to a comma.
         *
         * @param value The separator.
         * @return This {@link Builder} instance.
         */
        public Builder setSeparator(final Character value) {
            _separator = value;
            return this;
        }

        /**
         * Checks that the frequency is an integer step or a period code.
         *
         * @param frequency The frequency.
         * @return True if the frequency can be parsed.
         */
        @SuppressFBWarnings(value = "UPM_UNCALLED_PRIVATE_METHOD", justification = "invoked reflectively by @ValidateWithMethod")
        public boolean validateFrequency(@Nullable final String frequency) {
            if (frequency == null) {
                return true;
            }
            try {
                Frequency.parse(frequency);
                return true;
            } catch (final IllegalArgumentException e) {
                return false;
            }
        }

        @Nullable
        @NotEmpty
        private String _timeColumn;
        @NotNull
        private ImmutableList<String> _targetColumns = ImmutableList.of();
        @NotNull
        private ImmutableList<String> _observedColumns = ImmutableList.of();
        @NotNull
        private ImmutableList<String> _knownColumns = ImmutableList.of();
        @NotNull
        private ImmutableList<String> _staticColumns = ImmutableList.of();
        @Nullable
        @ValidateWithMethod(methodName = "validateFrequency", parameterType = String.class)
        private String _frequency;
        @NotNull
        private Boolean _fillMissingDates = false;
        @NotNull
        private FillMethod _fillMethod = FillMethod.PREVIOUS;
        @NotNull
        @Range(min = 1, max = Integer.MAX_VALUE)
        private Integer _fillWindowSize = 10;
        @NotNull
        private Character _separator = ',';
    }
}

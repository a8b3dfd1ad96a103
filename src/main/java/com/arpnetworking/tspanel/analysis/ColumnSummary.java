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
package com.arpnetworking.tspanel.analysis;

import com.arpnetworking.commons.builder.OvalBuilder;
import com.arpnetworking.logback.annotations.Loggable;
import com.arpnetworking.tspanel.model.ColumnType;
import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import net.sf.oval.constraint.Min;
import net.sf.oval.constraint.NotNull;

import java.util.Optional;
import javax.annotation.Nullable;

/**
 * Descriptive statistics of one column.
 *
 * @author Inscope Metrics
 */
@Loggable
public final class ColumnSummary {

    public ColumnType getType() {
        return _type;
    }

    public long getCount() {
        return _count;
    }

    public long getMissing() {
        return _missing;
    }

    public Optional<Double> getMean() {
        return _mean;
    }

    public Optional<Double> getStandardDeviation() {
        return _standardDeviation;
    }

    public Optional<Double> getMin() {
        return _min;
    }

    public Optional<Double> getMax() {
        return _max;
    }

    @Override
    public boolean equals(final Object object) {
        if (this == object) {
            return true;
        }
        if (object == null || getClass() != object.getClass()) {
            return false;
        }

        final ColumnSummary other = (ColumnSummary) object;

        return _count == other._count
                && _missing == other._missing
                && _type == other._type
                && Objects.equal(_mean, other._mean)
                && Objects.equal(_standardDeviation, other._standardDeviation)
                && Objects.equal(_min, other._min)
                && Objects.equal(_max, other._max);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(
                _type,
                _count,
                _missing,
                _mean,
                _standardDeviation,
                _min,
                _max);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("id", Integer.toHexString(System.identityHashCode(this)))
                .add("Type", _type)
                .add("Count", _count)
                .add("Missing", _missing)
                .add("Mean", _mean)
                .add("StandardDeviation", _standardDeviation)
                .add("Min", _min)
                .add("Max", _max)
                .toString();
    }

    private ColumnSummary(final Builder builder) {
        _type = builder._type;
        _count = builder._count;
        _missing = builder._missing;
        _mean = Optional.ofNullable(builder._mean);
        _standardDeviation = Optional.ofNullable(builder._standardDeviation);
        _min = Optional.ofNullable(builder._min);
        _max = Optional.ofNullable(builder._max);
    }

    private final ColumnType _type;
    private final long _count;
    private final long _missing;
    private final Optional<Double> _mean;
    private final Optional<Double> _standardDeviation;
    private final Optional<Double> _min;
    private final Optional<Double> _max;

    /**
     * {@link com.arpnetworking.commons.builder.Builder} implementation for
     * {@link ColumnSummary}.
     */
    public static final class Builder extends OvalBuilder<ColumnSummary> {

        /**
         * Public constructor.
         */
        public Builder() {
            super(ColumnSummary::new);
        }

        /**
         * Set the column type. Required. Cannot be null.
         *
         * @param value The column type.
         * @return This {@link Builder} instance.
         */
        public Builder setType(final ColumnType value) {
            _type = value;
            return this;
        }

        /**
         * Set the number of present values. Required. Cannot be null.
         *
         * @param value The count.
         * @return This {@link Builder} instance.
         */
        public Builder setCount(final Long value) {
            _count = value;
            return this;
        }

        /**
         * Set the number of missing values. Required. Cannot be null.
         *
         * @param value The count.
         * @return This {@link Builder} instance.
         */
        public Builder setMissing(final Long value) {
            _missing = value;
            return this;
        }

        /**
         * Set the mean. Can be null.
         *
         * @param value The mean.
         * @return This {@link Builder} instance.
         */
        public Builder setMean(@Nullable final Double value) {
            _mean = value;
            return this;
        }

        /**
         * Set the sample standard deviation. Can be null.
         *
         * @param value The standard deviation.
         * @return This {@link Builder} instance.
         */
        public Builder setStandardDeviation(@Nullable final Double value) {
            _standardDeviation = value;
            return this;
        }

        /**
         * Set the minimum. Can be null.
         *
         * @param value The minimum.
         * @return This {@link Builder} instance.
         */
        public Builder setMin(@Nullable final Double value) {
            _min = value;
            return this;
        }

        /**
         * Set the maximum. Can be null.
         *
         * @param value The maximum.
         * @return This {@link Builder} instance.
         */
        public Builder setMax(@Nullable final Double value) {
            _max = value;
            return this;
        }

        @NotNull
        private ColumnType _type;
        @NotNull
        @Min(0)
        private Long _count;
        @NotNull
        @Min(0)
        private Long _missing;
        @Nullable
        private Double _mean;
        @Nullable
        private Double _standardDeviation;
        @Nullable
        private Double _min;
        @Nullable
        private Double _max;
    }
}

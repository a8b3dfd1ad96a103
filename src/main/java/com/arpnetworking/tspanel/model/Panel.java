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

import com.arpnetworking.commons.builder.OvalBuilder;
import com.arpnetworking.logback.annotations.Loggable;
import com.arpnetworking.steno.Logger;
import com.arpnetworking.steno.LoggerFactory;
import com.arpnetworking.tspanel.analysis.OperatorRegistry;
import com.arpnetworking.tspanel.time.Frequency;
import com.arpnetworking.tspanel.transform.FillMethod;
import com.arpnetworking.tspanel.transform.GapFiller;
import com.arpnetworking.tspanel.transform.WindowGapFiller;
import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import net.sf.oval.constraint.NotNull;
import net.sf.oval.constraint.Range;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;
import javax.annotation.Nullable;

/**
 * A panel of time series: an optional target series, optional observed and
 * known covariate series and optional static covariates.
 *
 * Column names are unique across all partitions and every time varying
 * partition has the same frequency. Operations that modify a panel build the
 * new partitions first and check these invariants before replacing the old
 * ones, so a failed modification leaves the panel unchanged. Series handed
 * to and returned from a panel are copies.
 *
 * @author Inscope Metrics
 */
@Loggable
public final class Panel {

    /**
     * Concatenate panels partition by partition. Static covariates are merged
     * and must agree where names repeat.
     *
     * @param panels The panels.
     * @param axis The concatenation axis.
     * @return The concatenated panel.
     * @throws IllegalArgumentException if the list is empty, the series cannot
     * be concatenated or static covariates conflict.
     */
    public static Panel concat(final List<Panel> panels, final ConcatAxis axis) {
        if (panels.isEmpty()) {
            throw new IllegalArgumentException("At least one panel is required");
        }
        final Map<Partition, RegularSeries> series = new EnumMap<>(Partition.class);
        for (final Partition partition : TIME_VARYING) {
            final List<RegularSeries> parts = panels.stream()
                    .map(panel -> panel._series.get(partition))
                    .filter(part -> part != null)
                    .collect(Collectors.toList());
            if (!parts.isEmpty()) {
                series.put(partition, RegularSeries.concat(parts, axis));
            }
        }
        final Map<String, Object> statics = new LinkedHashMap<>();
        for (final Panel panel : panels) {
            for (final Map.Entry<String, Object> entry : panel._static.entrySet()) {
                final Object existing = statics.putIfAbsent(entry.getKey(), entry.getValue());
                if (existing != null && !staticValuesEqual(existing, entry.getValue())) {
                    throw new IllegalArgumentException(String.format(
                            "Static covariate values conflict; column=%s, values=[%s, %s]",
                            entry.getKey(),
                            existing,
                            entry.getValue()));
                }
            }
        }
        return new Panel(series, statics);
    }

    public Optional<RegularSeries> getTarget() {
        return getSeries(Partition.TARGET);
    }

    public Optional<RegularSeries> getObserved() {
        return getSeries(Partition.OBSERVED);
    }

    public Optional<RegularSeries> getKnown() {
        return getSeries(Partition.KNOWN);
    }

    /**
     * The static covariates.
     *
     * @return The values by name; empty when the panel has none.
     */
    public Optional<ImmutableMap<String, Object>> getStaticCovariates() {
        return _static.isEmpty() ? Optional.empty() : Optional.of(_static);
    }

    /**
     * A copy of a time varying partition.
     *
     * @param partition The partition.
     * @return The series, if the partition is present.
     * @throws IllegalArgumentException for {@link Partition#STATIC}.
     */
    public Optional<RegularSeries> getSeries(final Partition partition) {
        if (!partition.isTimeVarying()) {
            throw new IllegalArgumentException(String.format("Partition is not time varying; partition=%s", partition));
        }
        return Optional.ofNullable(_series.get(partition)).map(RegularSeries::copy);
    }

    public Frequency getFrequency() {
        return _frequency;
    }

    /**
     * The partition of every time varying column.
     *
     * @return The partitions by column name, in partition and column order.
     */
    public ImmutableMap<String, Partition> getColumns() {
        final ImmutableMap.Builder<String, Partition> columns = ImmutableMap.builder();
        for (final Map.Entry<Partition, RegularSeries> entry : _series.entrySet()) {
            for (final String name : entry.getValue().getColumnNames()) {
                columns.put(name, entry.getKey());
            }
        }
        return columns.build();
    }

    /**
     * The type of every time varying column.
     *
     * @return The types by column name, in partition and column order.
     */
    public ImmutableMap<String, ColumnType> getColumnTypes() {
        final ImmutableMap.Builder<String, ColumnType> types = ImmutableMap.builder();
        for (final RegularSeries series : _series.values()) {
            types.putAll(series.getColumnTypes());
        }
        return types.build();
    }

    /**
     * Find the partition holding a column. Partitions are searched in the
     * order target, observed, known, static.
     *
     * @param column The column name.
     * @return The partition.
     * @throws UnknownColumnException if no partition holds the column.
     */
    public Partition locate(final String column) {
        return tryLocate(column).orElseThrow(
                () -> new UnknownColumnException("Column does not exist", ImmutableList.of(column)));
    }

    /**
     * Find the partition holding a column.
     *
     * @param column The column name.
     * @return The partition, if any holds the column.
     */
    public Optional<Partition> tryLocate(final String column) {
        for (final Map.Entry<Partition, RegularSeries> entry : _series.entrySet()) {
            if (entry.getValue().hasColumn(column)) {
                return Optional.of(entry.getKey());
            }
        }
        if (_static.containsKey(column)) {
            return Optional.of(Partition.STATIC);
        }
        return Optional.empty();
    }

    /**
     * Read columns as one series.
     *
     * @param columns The column names.
     * @return The series.
     * @see #read(List)
     */
    public RegularSeries read(final String... columns) {
        return read(Arrays.asList(columns));
    }

    /**
     * Read columns from any partition as one series with the columns in the
     * requested order. Repeated names are read once. Static covariates are
     * repeated over the rows of the target.
     *
     * @param columns The column names.
     * @return The series.
     * @throws UnknownColumnException if a column does not exist.
     * @throws IllegalArgumentException if static covariates are read from a panel without a target.
     */
    public RegularSeries read(final List<String> columns) {
        final List<String> requested = ImmutableList.copyOf(new LinkedHashSet<>(columns));
        final List<RegularSeries> parts = new ArrayList<>();
        for (final RegularSeries series : _series.values()) {
            final List<String> names = requested.stream()
                    .filter(series::hasColumn)
                    .collect(Collectors.toList());
            if (!names.isEmpty()) {
                parts.add(series.select(names));
            }
        }
        final List<String> staticNames = requested.stream()
                .filter(_static::containsKey)
                .collect(Collectors.toList());
        if (!staticNames.isEmpty()) {
            final RegularSeries target = _series.get(Partition.TARGET);
            if (target == null) {
                throw new IllegalArgumentException(String.format(
                        "Static covariates can only be read from a panel with a target; columns=%s",
                        staticNames));
            }
            final List<Column> staticColumns = new ArrayList<>(staticNames.size());
            for (final String name : staticNames) {
                staticColumns.add(Column.constant(name, _static.get(name), target.size()));
            }
            parts.add(RegularSeries.of(target.getAxis(), staticColumns));
        }
        if (parts.isEmpty()) {
            throw new UnknownColumnException("The specified columns don't exist", requested);
        }
        final RegularSeries result = parts.size() == 1 ? parts.get(0) : RegularSeries.concat(parts, ConcatAxis.COLUMNS);
        if (result.getColumnNames().size() != requested.size()) {
            final List<String> missing = requested.stream()
                    .filter(name -> !result.hasColumn(name))
                    .collect(Collectors.toList());
            throw new UnknownColumnException("The specified columns don't exist", missing);
        }
        return result.select(requested);
    }

    /**
     * Write a column. An existing column is replaced in its partition; a new
     * column is added to the default partition, which is created from the
     * value when absent. Static columns take a string or number; time varying
     * columns take a single column series, which is aligned to the rows of the
     * partition.
     *
     * @param column The column name.
     * @param value A string or number for static columns, a single column series otherwise.
     * @param defaultPartition The partition for a new column.
     * @throws TypeMismatchException if the value does not suit the partition.
     * @throws IllegalArgumentException if the result would break the panel invariants.
     */
    public void write(final String column, final Object value, final Partition defaultPartition) {
        final Partition partition = tryLocate(column).orElse(defaultPartition);
        final Map<Partition, RegularSeries> series = mutableSeries();
        final Map<String, Object> statics = new LinkedHashMap<>(_static);
        if (partition == Partition.STATIC) {
            if (!(value instanceof String || value instanceof Number)) {
                throw new TypeMismatchException(String.format(
                        "Static covariates must be a string or a number; column=%s, value=%s",
                        column,
                        value));
            }
            statics.put(column, value);
        } else {
            final RegularSeries source = requireSingleColumn(column, value);
            final RegularSeries destination = series.get(partition);
            if (destination == null) {
                series.put(
                        partition,
                        RegularSeries.of(source.getAxis(), ImmutableList.of(source.getColumns().get(0).rename(column))));
            } else {
                if (source.getAxis().getType() != destination.getAxis().getType()) {
                    throw new TypeMismatchException(String.format(
                            "Value axis does not match the partition; column=%s, expected=%s, actual=%s",
                            column,
                            destination.getAxis().getType(),
                            source.getAxis().getType()));
                }
                final RegularSeries updated = destination.copy();
                updated.setColumn(source.reindex(destination.getAxis()).getColumns().get(0).rename(column));
                series.put(partition, updated);
            }
        }
        replace(series, statics);
        LOGGER.trace()
                .setMessage("Wrote column")
                .addData("column", column)
                .addData("partition", partition)
                .log();
    }

    /**
     * Write a column, adding a new column to the known covariates.
     *
     * @param column The column name.
     * @param value A string or number for static columns, a single column series otherwise.
     * @see #write(String, Object, Partition)
     */
    public void set(final String column, final Object value) {
        write(column, value, Partition.KNOWN);
    }

    /**
     * Remove columns.
     *
     * @param columns The column names.
     * @see #drop(Collection)
     */
    public void drop(final String... columns) {
        drop(Arrays.asList(columns));
    }

    /**
     * Remove columns. Names that do not exist are ignored and partitions left
     * without columns become absent.
     *
     * @param columns The column names.
     * @throws IllegalArgumentException if a name is repeated.
     */
    public void drop(final Collection<String> columns) {
        final Set<String> unique = new HashSet<>(columns);
        if (unique.size() != columns.size()) {
            throw new IllegalArgumentException(String.format("Duplicated column names; columns=%s", columns));
        }
        final Map<Partition, RegularSeries> series = new EnumMap<>(Partition.class);
        for (final Map.Entry<Partition, RegularSeries> entry : _series.entrySet()) {
            final RegularSeries updated = entry.getValue().copy();
            updated.dropColumns(unique);
            if (!updated.getColumnNames().isEmpty()) {
                series.put(entry.getKey(), updated);
            }
        }
        final Map<String, Object> statics = new LinkedHashMap<>(_static);
        statics.keySet().removeAll(unique);
        replace(series, statics);
    }

    /**
     * Split into two panels at a point of the target, see
     * {@link RegularSeries#split(Object, boolean)}. Observed covariates are
     * split after the last time point of the left target. Known and static
     * covariates are copied into both panels.
     *
     * @param point The split point.
     * @param preferAfter Whether a timestamp between two points resolves to the later one.
     * @return The two panels.
     * @throws IllegalArgumentException if the panel has no target or the point is invalid.
     */
    public Split<Panel> split(final Object point, final boolean preferAfter) {
        final RegularSeries target = _series.get(Partition.TARGET);
        if (target == null) {
            throw new IllegalArgumentException("Panels without a target cannot be split");
        }
        final Split<RegularSeries> targets = target.split(point, preferAfter);
        final Map<Partition, RegularSeries> left = new EnumMap<>(Partition.class);
        final Map<Partition, RegularSeries> right = new EnumMap<>(Partition.class);
        left.put(Partition.TARGET, targets.getLeft());
        right.put(Partition.TARGET, targets.getRight());
        final RegularSeries observed = _series.get(Partition.OBSERVED);
        if (observed != null) {
            final Split<RegularSeries> observedSplit;
            if (targets.getLeft().isEmpty()) {
                observedSplit = new Split<>(observed.slice(0, 0), observed.copy());
            } else {
                observedSplit = observed.splitAfter(targets.getLeft().getEndTime());
            }
            left.put(Partition.OBSERVED, observedSplit.getLeft());
            right.put(Partition.OBSERVED, observedSplit.getRight());
        }
        final RegularSeries known = _series.get(Partition.KNOWN);
        if (known != null) {
            left.put(Partition.KNOWN, known.copy());
            right.put(Partition.KNOWN, known.copy());
        }
        return new Split<>(new Panel(left, _static), new Panel(right, _static));
    }

    /**
     * Convert every time varying column to a type. Either every column is
     * converted or none is.
     *
     * @param type The target type.
     * @throws TypeMismatchException if a value cannot be converted.
     */
    public void cast(final ColumnType type) {
        transform(series -> {
            series.cast(type);
            return series;
        });
    }

    /**
     * Convert time varying columns to types. Either every listed column is
     * converted or none is.
     *
     * @param types The target type per column name.
     * @throws UnknownColumnException if a name is not a time varying column.
     * @throws TypeMismatchException if a value cannot be converted.
     */
    public void cast(final Map<String, ColumnType> types) {
        final List<String> unknown = types.keySet().stream()
                .filter(name -> !tryLocate(name).map(Partition::isTimeVarying).orElse(false))
                .collect(Collectors.toList());
        if (!unknown.isEmpty()) {
            throw new UnknownColumnException("Columns are not time varying columns of the panel", unknown);
        }
        transform(series -> {
            series.cast(Maps.filterKeys(types, series::hasColumn));
            return series;
        });
    }

    /**
     * Replace every time varying partition with the result of a function.
     * The function receives a copy it may modify and return.
     *
     * @param operator The function.
     * @throws IllegalArgumentException if the results break the panel invariants.
     */
    public void transform(final UnaryOperator<RegularSeries> operator) {
        final Map<Partition, RegularSeries> series = new EnumMap<>(Partition.class);
        for (final Map.Entry<Partition, RegularSeries> entry : _series.entrySet()) {
            series.put(entry.getKey(), operator.apply(entry.getValue().copy()));
        }
        replace(series, _static);
    }

    /**
     * Replace the target.
     *
     * @param target The new target; null removes the target unless appending.
     * @param append Whether to add the columns to the existing target.
     */
    public void setTarget(@Nullable final RegularSeries target, final boolean append) {
        setSeries(Partition.TARGET, target, append);
    }

    /**
     * Replace the observed covariates.
     *
     * @param observed The new covariates; null removes them unless appending.
     * @param append Whether to add the columns to the existing covariates.
     */
    public void setObserved(@Nullable final RegularSeries observed, final boolean append) {
        setSeries(Partition.OBSERVED, observed, append);
    }

    /**
     * Replace the known covariates.
     *
     * @param known The new covariates; null removes them unless appending.
     * @param append Whether to add the columns to the existing covariates.
     */
    public void setKnown(@Nullable final RegularSeries known, final boolean append) {
        setSeries(Partition.KNOWN, known, append);
    }

    /**
     * Replace the static covariates.
     *
     * @param statics The new values; null removes them unless appending.
     * @param append Whether to add the values to the existing ones.
     */
    public void setStatic(@Nullable final Map<String, ?> statics, final boolean append) {
        final Map<String, Object> updated = new LinkedHashMap<>();
        if (append) {
            updated.putAll(_static);
        }
        if (statics != null) {
            updated.putAll(statics);
        }
        replace(_series, updated);
    }

    /**
     * The observed and known covariates as one series.
     *
     * @return The covariates, if the panel has any.
     */
    public Optional<RegularSeries> getAllCovariates() {
        final List<RegularSeries> covariates = new ArrayList<>();
        for (final Partition partition : ImmutableList.of(Partition.OBSERVED, Partition.KNOWN)) {
            final RegularSeries series = _series.get(partition);
            if (series != null) {
                covariates.add(series);
            }
        }
        if (covariates.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(RegularSeries.concat(covariates, ConcatAxis.COLUMNS));
    }

    /**
     * Every time varying column as one series.
     *
     * @return The series.
     * @throws IllegalStateException if the panel has no time varying partition.
     */
    public RegularSeries toSeries() {
        if (_series.isEmpty()) {
            throw new IllegalStateException("Panel has no time varying partitions");
        }
        return RegularSeries.concat(ImmutableList.copyOf(_series.values()), ConcatAxis.COLUMNS);
    }

    /**
     * Order the columns of every partition by name.
     *
     * @param ascending Whether to sort in ascending order.
     */
    public void sortColumns(final boolean ascending) {
        transform(series -> {
            series.sortColumns(ascending);
            return series;
        });
        final Comparator<String> comparator = ascending
                ? Comparator.<String>naturalOrder()
                : Comparator.<String>reverseOrder();
        final Map<String, Object> statics = new TreeMap<>(comparator);
        statics.putAll(_static);
        replace(_series, statics);
    }

    /**
     * Apply a registered operator to this panel.
     *
     * @param name The operator name or alias.
     * @param arguments The operator arguments.
     * @return The operator result.
     * @throws IllegalArgumentException if no operator is registered under the name.
     */
    public Object invoke(final String name, final Object... arguments) {
        return OPERATOR_REGISTRY.getOperator(name).apply(this, Arrays.asList(arguments));
    }

    /**
     * An independent copy of this panel.
     *
     * @return The copy.
     */
    public Panel copy() {
        return new Panel(_series, _static);
    }

    @Override
    public boolean equals(final Object object) {
        if (this == object) {
            return true;
        }
        if (object == null || getClass() != object.getClass()) {
            return false;
        }

        final Panel other = (Panel) object;

        return Objects.equal(_series, other._series)
                && Objects.equal(_static, other._static)
                && Objects.equal(_frequency, other._frequency);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(_series, _static, _frequency);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("id", Integer.toHexString(System.identityHashCode(this)))
                .add("Frequency", _frequency)
                .add("Series", _series)
                .add("Static", _static)
                .toString();
    }

    private void setSeries(final Partition partition, @Nullable final RegularSeries value, final boolean append) {
        final Map<Partition, RegularSeries> series = mutableSeries();
        final RegularSeries existing = series.get(partition);
        if (value == null) {
            if (!append) {
                series.remove(partition);
            }
        } else if (append && existing != null) {
            series.put(partition, RegularSeries.concat(ImmutableList.of(existing, value), ConcatAxis.COLUMNS));
        } else {
            series.put(partition, value.copy());
        }
        replace(series, _static);
    }

    private Map<Partition, RegularSeries> mutableSeries() {
        final Map<Partition, RegularSeries> series = new EnumMap<>(Partition.class);
        series.putAll(_series);
        return series;
    }

    private void replace(final Map<Partition, RegularSeries> series, final Map<String, ?> statics) {
        final ImmutableMap<String, Object> normalized = normalizeStatic(statics);
        final Frequency frequency = checkInvariants(series, normalized, _frequency);
        _series = Maps.immutableEnumMap(series);
        _static = normalized;
        _frequency = frequency;
    }

    private static RegularSeries requireSingleColumn(final String column, final Object value) {
        if (!(value instanceof RegularSeries) || ((RegularSeries) value).getColumnNames().size() != 1) {
            throw new TypeMismatchException(String.format(
                    "Time varying columns must be written from a single column series; column=%s, value=%s",
                    column,
                    value));
        }
        return (RegularSeries) value;
    }

    private static Frequency checkInvariants(
            final Map<Partition, RegularSeries> series,
            final Map<String, Object> statics,
            @Nullable final Frequency fallback) {
        final Set<Frequency> frequencies = series.values().stream()
                .map(RegularSeries::getFrequency)
                .collect(Collectors.toCollection(LinkedHashSet::new));
        if (frequencies.size() > 1 || (frequencies.isEmpty() && fallback == null)) {
            throw new IllegalArgumentException(String.format(
                    "The target, observed and known partitions must have exactly one frequency; frequencies=%s",
                    frequencies));
        }
        final Set<String> names = new HashSet<>();
        final Set<String> duplicated = new LinkedHashSet<>();
        for (final RegularSeries partition : series.values()) {
            for (final String name : partition.getColumnNames()) {
                if (!names.add(name)) {
                    duplicated.add(name);
                }
            }
        }
        for (final String name : statics.keySet()) {
            if (!names.add(name)) {
                duplicated.add(name);
            }
        }
        if (!duplicated.isEmpty()) {
            throw new IllegalArgumentException(String.format(
                    "Column names must be unique across the target, observed, known and static partitions; columns=%s",
                    duplicated));
        }
        return frequencies.isEmpty() ? fallback : frequencies.iterator().next();
    }

    private static ImmutableMap<String, Object> normalizeStatic(final Map<String, ?> statics) {
        final ImmutableMap.Builder<String, Object> normalized = ImmutableMap.builder();
        for (final Map.Entry<String, ?> entry : statics.entrySet()) {
            normalized.put(entry.getKey(), normalizeStaticValue(entry.getKey(), entry.getValue()));
        }
        return normalized.build();
    }

    private static Object normalizeStaticValue(final String name, @Nullable final Object value) {
        if (value instanceof String || value instanceof Long || value instanceof Double) {
            return value;
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte || value instanceof BigInteger) {
            return ((Number) value).longValue();
        }
        if (value instanceof Float || value instanceof BigDecimal) {
            return ((Number) value).doubleValue();
        }
        throw new TypeMismatchException(String.format(
                "Static covariates must be a string or a number; column=%s, value=%s",
                name,
                value));
    }

    private static boolean staticValuesEqual(final Object left, final Object right) {
        if (left instanceof Number && right instanceof Number) {
            if (left instanceof Long && right instanceof Long) {
                return left.equals(right);
            }
            return ((Number) left).doubleValue() == ((Number) right).doubleValue();
        }
        return left.equals(right);
    }

    private Panel(final Map<Partition, RegularSeries> series, final Map<String, ?> statics) {
        final Map<Partition, RegularSeries> copies = new EnumMap<>(Partition.class);
        for (final Map.Entry<Partition, RegularSeries> entry : series.entrySet()) {
            copies.put(entry.getKey(), entry.getValue().copy());
        }
        _static = normalizeStatic(statics);
        _frequency = checkInvariants(copies, _static, null);
        _series = Maps.immutableEnumMap(copies);
    }

    private Panel(final Builder builder) {
        this(builder.getSeries(), builder._staticCovariates == null ? ImmutableMap.of() : builder._staticCovariates);
        if (builder._fillMissingDates) {
            GAP_FILLER.fill(this, builder._fillMethod, builder._fillWindowSize);
        }
    }

    private ImmutableMap<Partition, RegularSeries> _series;
    private ImmutableMap<String, Object> _static;
    private Frequency _frequency;

    private static final ImmutableList<Partition> TIME_VARYING =
            ImmutableList.of(Partition.TARGET, Partition.OBSERVED, Partition.KNOWN);
    private static final GapFiller GAP_FILLER = new WindowGapFiller();
    private static final OperatorRegistry OPERATOR_REGISTRY = new OperatorRegistry();
    private static final Logger LOGGER = LoggerFactory.getLogger(Panel.class);

    /**
     * {@link com.arpnetworking.commons.builder.Builder} implementation for
     * {@link Panel}.
     */
    public static final class Builder extends OvalBuilder<Panel> {

        /**
         * Public constructor.
         */
        public Builder() {
            super((Builder builder) -> new Panel(builder));
        }

        /**
         * Set the target. Optional. Can be null.
         *
         * @param value The target series.
         * @return This {@link Builder} instance.
         */
        public Builder setTarget(@Nullable final RegularSeries value) {
            _target = value;
            return this;
        }

        /**
         * Set the observed covariates. Optional. Can be null.
         *
         * @param value The observed covariate series.
         * @return This {@link Builder} instance.
         */
        public Builder setObserved(@Nullable final RegularSeries value) {
            _observed = value;
            return this;
        }

        /**
         * Set the known covariates. Optional. Can be null.
         *
         * @param value The known covariate series.
         * @return This {@link Builder} instance.
         */
        public Builder setKnown(@Nullable final RegularSeries value) {
            _known = value;
            return this;
        }

        /**
         * Set the static covariates. Optional. Can be null. Values must be
         * strings or numbers.
         *
         * @param value The static covariates by name.
         * @return This {@link Builder} instance.
         */
        public Builder setStaticCovariates(@Nullable final Map<String, ?> value) {
            _staticCovariates = value;
            return this;
        }

        /**
         * Set whether to fill missing values on construction. Optional.
         * Cannot be null. Defaults to false.
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
         * Set the window size of windowed fill methods. Optional. Cannot be
         * null. Must be at least one. Defaults to 10.
         *
         * @param value The window size.
         * @return This {@link Builder} instance.
         */
        public Builder setFillWindowSize(final Integer value) {
            _fillWindowSize = value;
            return this;
        }

        private Map<Partition, RegularSeries> getSeries() {
            final Map<Partition, RegularSeries> series = new EnumMap<>(Partition.class);
            if (_target != null) {
                series.put(Partition.TARGET, _target);
            }
            if (_observed != null) {
                series.put(Partition.OBSERVED, _observed);
            }
            if (_known != null) {
                series.put(Partition.KNOWN, _known);
            }
            return series;
        }

        @Nullable
        private RegularSeries _target;
        @Nullable
        private RegularSeries _observed;
        @Nullable
        private RegularSeries _known;
        @Nullable
        private Map<String, ?> _staticCovariates;
        @NotNull
        private Boolean _fillMissingDates = false;
        @NotNull
        private FillMethod _fillMethod = FillMethod.PREVIOUS;
        @NotNull
        @Range(min = 1, max = Integer.MAX_VALUE)
        private Integer _fillWindowSize = 10;
    }
}

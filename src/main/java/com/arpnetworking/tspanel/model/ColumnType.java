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

import com.google.common.collect.ImmutableMap;

import java.util.Locale;
import java.util.Optional;
import javax.annotation.Nullable;

/**
 * The value type of a column. Missing values are represented by {@code null}
 * in every type.
 *
 * @author Inscope Metrics
 */
public enum ColumnType {

    /**
     * 64 bit integers stored as {@link Long}.
     */
    INT64("int64", true) {
        @Override
        @Nullable
        Object convertPresent(final Object value) {
            if (value instanceof Long) {
                return value;
            }
            if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
                return ((Number) value).longValue();
            }
            if (value instanceof Number) {
                final double number = ((Number) value).doubleValue();
                if (Double.isNaN(number)) {
                    return null;
                }
                if (Double.isFinite(number)
                        && number == Math.rint(number)
                        && number >= MIN_LONG_AS_DOUBLE
                        && number < MAX_LONG_AS_DOUBLE) {
                    return (long) number;
                }
                throw mismatch(value);
            }
            if (value instanceof Boolean) {
                return (Boolean) value ? 1L : 0L;
            }
            if (value instanceof String) {
                try {
                    return Long.parseLong(((String) value).trim());
                } catch (final NumberFormatException e) {
                    throw mismatch(value, e);
                }
            }
            throw mismatch(value);
        }
    },

    /**
     * Double precision floating point numbers stored as {@link Double}.
     */
    FLOAT64("float64", true) {
        @Override
        @Nullable
        Object convertPresent(final Object value) {
            if (value instanceof Number) {
                final double number = ((Number) value).doubleValue();
                return Double.isNaN(number) ? null : number;
            }
            if (value instanceof Boolean) {
                return (Boolean) value ? 1.0 : 0.0;
            }
            if (value instanceof String) {
                try {
                    final double number = Double.parseDouble(((String) value).trim());
                    return Double.isNaN(number) ? null : number;
                } catch (final NumberFormatException e) {
                    throw mismatch(value, e);
                }
            }
            throw mismatch(value);
        }
    },

    /**
     * Booleans stored as {@link Boolean}.
     */
    BOOLEAN("bool", false) {
        @Override
        Object convertPresent(final Object value) {
            if (value instanceof Boolean) {
                return value;
            }
            if (value instanceof Number) {
                return ((Number) value).doubleValue() != 0.0;
            }
            if (value instanceof String) {
                final String text = ((String) value).trim();
                if ("true".equalsIgnoreCase(text)) {
                    return Boolean.TRUE;
                }
                if ("false".equalsIgnoreCase(text)) {
                    return Boolean.FALSE;
                }
            }
            throw mismatch(value);
        }
    },

    /**
     * Text stored as {@link String}.
     */
    STRING("string", false) {
        @Override
        Object convertPresent(final Object value) {
            return String.valueOf(value);
        }
    };

    /**
     * Look up a type by name. Accepts {@code int64}, {@code int}, {@code long},
     * {@code float64}, {@code float}, {@code double}, {@code bool},
     * {@code boolean}, {@code str}, {@code string} and {@code object}, ignoring case.
     *
     * @param name The type name.
     * @return The type.
     * @throws IllegalArgumentException if the name is not a known type.
     */
    public static ColumnType fromName(final String name) {
        return tryFromName(name).orElseThrow(() -> new IllegalArgumentException(
                String.format("Invalid column type; name=%s", name)));
    }

    /**
     * Look up a type by name.
     *
     * @param name The type name.
     * @return The type, if the name is known.
     */
    public static Optional<ColumnType> tryFromName(final String name) {
        return Optional.ofNullable(TYPES_BY_NAME.get(name.trim().toLowerCase(Locale.ROOT)));
    }

    /**
     * Infer the narrowest type that holds every present value. Integers infer
     * {@link #INT64}, numbers with at least one non-integer {@link #FLOAT64},
     * only booleans {@link #BOOLEAN}, and anything else, including a mix of
     * kinds, {@link #STRING}. Values that are all missing infer {@link #FLOAT64}.
     *
     * @param values The values.
     * @return The inferred type.
     */
    public static ColumnType infer(final Iterable<?> values) {
        boolean allIntegral = true;
        boolean allNumeric = true;
        boolean allBoolean = true;
        boolean anyPresent = false;
        for (final Object value : values) {
            if (value == null || isNaN(value)) {
                continue;
            }
            anyPresent = true;
            final boolean integral = value instanceof Long || value instanceof Integer
                    || value instanceof Short || value instanceof Byte;
            allIntegral &= integral;
            allNumeric &= value instanceof Number;
            allBoolean &= value instanceof Boolean;
        }
        if (!anyPresent) {
            return FLOAT64;
        }
        if (allIntegral) {
            return INT64;
        }
        if (allNumeric) {
            return FLOAT64;
        }
        if (allBoolean) {
            return BOOLEAN;
        }
        return STRING;
    }

    /**
     * The type that holds the values of two types: numeric types widen to
     * {@link #FLOAT64}, any other mix to {@link #STRING}.
     *
     * @param first The first type.
     * @param second The second type.
     * @return The common type.
     */
    public static ColumnType unify(final ColumnType first, final ColumnType second) {
        if (first == second) {
            return first;
        }
        if (first.isNumeric() && second.isNumeric()) {
            return FLOAT64;
        }
        return STRING;
    }

    public String getName() {
        return _name;
    }

    public boolean isNumeric() {
        return _numeric;
    }

    /**
     * Convert a value to this type.
     *
     * @param value The value; {@code null} is missing.
     * @return The converted value; {@code null} if missing.
     * @throws TypeMismatchException if the value cannot be represented in this type.
     */
    @Nullable
    public Object convert(@Nullable final Object value) {
        if (value == null) {
            return null;
        }
        return convertPresent(value);
    }

    @Nullable
    abstract Object convertPresent(Object value);

    TypeMismatchException mismatch(final Object value) {
        return new TypeMismatchException(String.format(
                "Value cannot be converted; value=%s, from=%s, to=%s",
                value,
                value.getClass().getSimpleName(),
                _name));
    }

    TypeMismatchException mismatch(final Object value, final Throwable cause) {
        return new TypeMismatchException(String.format(
                "Value cannot be converted; value=%s, from=%s, to=%s",
                value,
                value.getClass().getSimpleName(),
                _name), cause);
    }

    private static boolean isNaN(final Object value) {
        return (value instanceof Double && ((Double) value).isNaN())
                || (value instanceof Float && ((Float) value).isNaN());
    }

    ColumnType(final String name, final boolean numeric) {
        _name = name;
        _numeric = numeric;
    }

    private final String _name;
    private final boolean _numeric;

    // Long.MIN_VALUE is exact as a double; Long.MAX_VALUE rounds up to 2^63.
    private static final double MIN_LONG_AS_DOUBLE = -0x1p63;
    private static final double MAX_LONG_AS_DOUBLE = 0x1p63;

    private static final ImmutableMap<String, ColumnType> TYPES_BY_NAME = ImmutableMap.<String, ColumnType>builder()
            .put("int64", INT64)
            .put("int", INT64)
            .put("long", INT64)
            .put("float64", FLOAT64)
            .put("float", FLOAT64)
            .put("double", FLOAT64)
            .put("bool", BOOLEAN)
            .put("boolean", BOOLEAN)
            .put("str", STRING)
            .put("string", STRING)
            .put("object", STRING)
            .build();
}

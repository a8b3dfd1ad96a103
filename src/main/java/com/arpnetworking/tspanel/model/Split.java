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

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;

/**
 * The two halves of a split.
 *
 * @param <T> The type of the halves.
 * @author Inscope Metrics
 */
public final class Split<T> {

    /**
     * Public constructor.
     *
     * @param left The part up to the split point.
     * @param right The part after the split point.
     */
    public Split(final T left, final T right) {
        _left = left;
        _right = right;
    }

    public T getLeft() {
        return _left;
    }

    public T getRight() {
        return _right;
    }

    @Override
    public boolean equals(final Object object) {
        if (this == object) {
            return true;
        }
        if (object == null || getClass() != object.getClass()) {
            return false;
        }
        final Split<?> other = (Split<?>) object;
        return Objects.equal(_left, other._left)
                && Objects.equal(_right, other._right);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(_left, _right);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Left", _left)
                .add("Right", _right)
                .toString();
    }

    private final T _left;
    private final T _right;
}

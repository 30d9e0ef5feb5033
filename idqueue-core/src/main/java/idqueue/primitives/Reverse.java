/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package idqueue.primitives;

import idqueue.utils.Invariants;

/**
 * Wraps a value so that it sorts in the opposite order to its natural ordering.
 * A min-heap of {@code Reverse<T>} is a max-heap of {@code T}.
 */
public final class Reverse<T extends Comparable<? super T>> implements Comparable<Reverse<T>>
{
    public final T value;

    public Reverse(T value)
    {
        this.value = Invariants.nonNull(value);
    }

    public static <T extends Comparable<? super T>> Reverse<T> of(T value)
    {
        return new Reverse<>(value);
    }

    public static <T extends Comparable<? super T>> T unwrap(Reverse<T> reverse)
    {
        return reverse == null ? null : reverse.value;
    }

    @Override
    public int compareTo(Reverse<T> that)
    {
        return that.value.compareTo(this.value);
    }

    @Override
    public int hashCode()
    {
        return value.hashCode();
    }

    @Override
    public boolean equals(Object that)
    {
        return that instanceof Reverse && value.equals(((Reverse<?>) that).value);
    }

    @Override
    public String toString()
    {
        return "Reverse(" + value + ')';
    }
}

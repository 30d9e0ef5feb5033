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
 * A raw identifier as minted by an arena: a dense {@code index} plus the {@code generation}
 * the index was minted at, so that a recycled index is never equal to its previous incarnation.
 */
public final class UntypedId implements Comparable<UntypedId>
{
    public final int index;
    public final int generation;

    public UntypedId(int index, int generation)
    {
        this.index = Invariants.isNatural(index);
        this.generation = generation;
    }

    /**
     * @return the id for {@code index} at its first generation
     */
    public static UntypedId first(int index)
    {
        return new UntypedId(index, 0);
    }

    public UntypedId next()
    {
        return new UntypedId(index, generation + 1);
    }

    @Override
    public int hashCode()
    {
        return index * 31 + generation;
    }

    @Override
    public boolean equals(Object that)
    {
        return that instanceof UntypedId && equals((UntypedId) that);
    }

    public boolean equals(UntypedId that)
    {
        return that != null && index == that.index && generation == that.generation;
    }

    @Override
    public int compareTo(UntypedId that)
    {
        int c = Integer.compare(this.index, that.index);
        if (c == 0) c = Integer.compare(this.generation, that.generation);
        return c;
    }

    @Override
    public String toString()
    {
        return index + "v" + generation;
    }
}

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

import idqueue.api.ValidId;
import idqueue.utils.Invariants;

/**
 * An {@link UntypedId} bound to the arena {@code A}. The arena type exists only for the compiler,
 * which will refuse to pass an {@code Id<Nodes>} where an {@code Id<Edges>} is expected.
 */
public final class Id<A> implements ValidId<A>, Comparable<Id<A>>
{
    public final UntypedId untyped;

    public Id(UntypedId untyped)
    {
        this.untyped = Invariants.nonNull(untyped);
    }

    public static <A> Id<A> first(int index)
    {
        return new Id<>(UntypedId.first(index));
    }

    public int index()
    {
        return untyped.index;
    }

    public int generation()
    {
        return untyped.generation;
    }

    @Override
    public Id<A> id()
    {
        return this;
    }

    @Override
    public int hashCode()
    {
        return untyped.hashCode();
    }

    @Override
    public boolean equals(Object that)
    {
        return that instanceof Id && untyped.equals(((Id<?>) that).untyped);
    }

    @Override
    public int compareTo(Id<A> that)
    {
        return untyped.compareTo(that.untyped);
    }

    @Override
    public String toString()
    {
        return untyped.toString();
    }
}

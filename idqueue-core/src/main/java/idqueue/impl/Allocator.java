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

package idqueue.impl;

import com.google.common.collect.Iterables;

import idqueue.api.ValidId;
import idqueue.primitives.Id;

/**
 * An {@link UntypedAllocator} whose ids are bound to the arena type {@code A}
 */
public class Allocator<A>
{
    private final UntypedAllocator untyped = new UntypedAllocator();

    public Id<A> create()
    {
        return new Id<>(untyped.create());
    }

    public boolean kill(ValidId<A> id)
    {
        return untyped.kill(id.id().untyped);
    }

    public boolean isAlive(ValidId<A> id)
    {
        return untyped.isAlive(id.id().untyped);
    }

    public Iterable<Id<A>> ids()
    {
        return Iterables.transform(untyped.ids(), id -> new Id<A>(id));
    }

    public int size()
    {
        return untyped.size();
    }

    public boolean isEmpty()
    {
        return untyped.isEmpty();
    }
}

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

import java.util.BitSet;

import org.agrona.collections.IntArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import idqueue.primitives.UntypedId;
import idqueue.utils.Invariants;

/**
 * Mints {@link UntypedId}s with dense indexes. Killed indexes are recycled most-recent-first
 * at the next generation, so a stale id is never confused with the live one occupying its index.
 */
public class UntypedAllocator
{
    private static final Logger logger = LoggerFactory.getLogger(UntypedAllocator.class);

    private final IntComponent generations = new IntComponent();
    private final BitSet alive = new BitSet();
    private final IntArrayList free = new IntArrayList();
    private int nextIndex;

    public UntypedId create()
    {
        int index;
        int generation;
        if (!free.isEmpty())
        {
            index = free.popInt();
            generation = generations.get(index) + 1;
            Invariants.checkState(generation >= 0, "Generation overflow for index %d", index);
            logger.trace("Recycling index {} at generation {}", index, generation);
        }
        else
        {
            Invariants.checkState(nextIndex < Integer.MAX_VALUE, "Exhausted identifier space");
            index = nextIndex++;
            generation = 0;
        }

        generations.set(index, generation);
        alive.set(index);
        return new UntypedId(index, generation);
    }

    /**
     * @return false if {@code id} was not alive, either never minted or already killed
     */
    public boolean kill(UntypedId id)
    {
        if (!isAlive(id))
            return false;

        alive.clear(id.index);
        free.addInt(id.index);
        return true;
    }

    public boolean isAlive(UntypedId id)
    {
        return alive.get(id.index) && generations.get(id.index) == id.generation;
    }

    /**
     * @return the live ids in index order; reflects the allocator at the time {@code iterator()} is invoked
     */
    public Iterable<UntypedId> ids()
    {
        return () -> alive.stream().mapToObj(i -> new UntypedId(i, generations.get(i))).iterator();
    }

    public int size()
    {
        return alive.cardinality();
    }

    public boolean isEmpty()
    {
        return alive.isEmpty();
    }
}

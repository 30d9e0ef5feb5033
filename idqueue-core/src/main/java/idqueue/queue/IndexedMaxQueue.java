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

package idqueue.queue;

import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;

import com.google.common.collect.Iterables;
import com.google.common.collect.Iterators;
import com.google.common.collect.Maps;

import idqueue.api.ContextualIterable;
import idqueue.api.QueueConfig;
import idqueue.api.ValidId;
import idqueue.primitives.Id;
import idqueue.primitives.Reverse;

/**
 * An {@link Id}-indexed max priority queue, implemented as an {@link IndexedMinQueue} of {@link Reverse}d priorities.
 * <p>
 * As a consequence {@link #increase} is the inner queue's decrease, and {@link #decrease} its increase.
 */
public class IndexedMaxQueue<A, T extends Comparable<? super T>>
{
    private final IndexedMinQueue<A, Reverse<T>> inner;

    public IndexedMaxQueue()
    {
        this(QueueConfig.DEFAULT);
    }

    public IndexedMaxQueue(QueueConfig config)
    {
        this(new IndexedMinQueue<>(config));
    }

    private IndexedMaxQueue(IndexedMinQueue<A, Reverse<T>> inner)
    {
        this.inner = inner;
    }

    public IndexedMaxQueue<A, T> copy()
    {
        return new IndexedMaxQueue<>(inner.copy());
    }

    public void copyFrom(IndexedMaxQueue<A, T> copy)
    {
        if (copy == this)
            return;
        inner.copyFrom(copy.inner);
    }

    public void clear()
    {
        inner.clear();
    }

    public void insert(ValidId<A> id, T value)
    {
        inner.insert(id, Reverse.of(value));
    }

    @Nullable
    public Map.Entry<Id<A>, T> remove(ValidId<A> id)
    {
        return unwrap(inner.remove(id));
    }

    @Nullable
    public T peek()
    {
        return Reverse.unwrap(inner.peek());
    }

    @Nullable
    public Map.Entry<Id<A>, T> peekId()
    {
        return unwrap(inner.peekId());
    }

    @Nullable
    public T getPosition(int position)
    {
        return Reverse.unwrap(inner.getPosition(position));
    }

    @Nullable
    public Map.Entry<Id<A>, T> getPositionWithId(int position)
    {
        return unwrap(inner.getPositionWithId(position));
    }

    @Nullable
    public Map.Entry<Id<A>, T> pop()
    {
        return unwrap(inner.pop());
    }

    @Nullable
    public Map.Entry<Id<A>, T> removePosition(int position)
    {
        return unwrap(inner.removePosition(position));
    }

    /**
     * Raise the priority of {@code id} to {@code value}, if {@code id} is queued and {@code value} is strictly greater
     */
    public void increase(ValidId<A> id, T value)
    {
        inner.decrease(id, Reverse.of(value));
    }

    /**
     * Lower the priority of {@code id} to {@code value}, if {@code id} is queued and {@code value} is strictly smaller
     */
    public void decrease(ValidId<A> id, T value)
    {
        inner.increase(id, Reverse.of(value));
    }

    @Nullable
    public T get(ValidId<A> id)
    {
        return Reverse.unwrap(inner.get(id));
    }

    /**
     * The queued ids in heap array order; only the first is guaranteed to hold the maximum
     */
    public Iterable<Map.Entry<Id<A>, T>> iterSorted()
    {
        return Iterables.transform(inner.iterSorted(), IndexedMaxQueue::unwrap);
    }

    public ContextualIterable<A, T> values()
    {
        ContextualIterable<A, Reverse<T>> values = inner.values();
        return () -> Iterators.transform(values.iterator(), Reverse::unwrap);
    }

    public int size()
    {
        return inner.size();
    }

    public boolean isEmpty()
    {
        return inner.isEmpty();
    }

    List<Id<A>> heapArray()
    {
        return inner.heapArray();
    }

    boolean isConsistent()
    {
        return inner.isConsistent();
    }

    @Override
    public String toString()
    {
        return inner.toString();
    }

    private static <A, T extends Comparable<? super T>> Map.Entry<Id<A>, T> unwrap(Map.Entry<Id<A>, Reverse<T>> entry)
    {
        return entry == null ? null : Maps.immutableEntry(entry.getKey(), entry.getValue().value);
    }
}

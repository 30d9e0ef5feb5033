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
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import idqueue.api.ContextualIterable;
import idqueue.api.QueueConfig;
import idqueue.api.ValidId;
import idqueue.primitives.Id;
import idqueue.primitives.UntypedId;

/**
 * An {@link Id}-indexed min priority queue based on a D-ary heap, accepting only ids of the arena {@code A}.
 * See {@link UntypedIndexedMinQueue} for the semantics of each operation.
 */
public class IndexedMinQueue<A, T extends Comparable<? super T>>
{
    private final UntypedIndexedMinQueue<T> inner;

    public IndexedMinQueue()
    {
        this(QueueConfig.DEFAULT);
    }

    public IndexedMinQueue(QueueConfig config)
    {
        this(new UntypedIndexedMinQueue<>(config));
    }

    private IndexedMinQueue(UntypedIndexedMinQueue<T> inner)
    {
        this.inner = inner;
    }

    public IndexedMinQueue<A, T> copy()
    {
        return new IndexedMinQueue<>(inner.copy());
    }

    public void copyFrom(IndexedMinQueue<A, T> copy)
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
        inner.insert(untyped(id), value);
    }

    @Nullable
    public Map.Entry<Id<A>, T> remove(ValidId<A> id)
    {
        return typed(inner.remove(untyped(id)));
    }

    @Nullable
    public T peek()
    {
        return inner.peek();
    }

    @Nullable
    public Map.Entry<Id<A>, T> peekId()
    {
        return typed(inner.peekId());
    }

    @Nullable
    public T getPosition(int position)
    {
        return inner.getPosition(position);
    }

    @Nullable
    public Map.Entry<Id<A>, T> getPositionWithId(int position)
    {
        return typed(inner.getPositionWithId(position));
    }

    @Nullable
    public Map.Entry<Id<A>, T> pop()
    {
        return typed(inner.pop());
    }

    @Nullable
    public Map.Entry<Id<A>, T> removePosition(int position)
    {
        return typed(inner.removePosition(position));
    }

    public void decrease(ValidId<A> id, T value)
    {
        inner.decrease(untyped(id), value);
    }

    public void increase(ValidId<A> id, T value)
    {
        inner.increase(untyped(id), value);
    }

    /**
     * @return the current priority of {@code id}, or {@code null} if it is not queued
     */
    @Nullable
    public T get(ValidId<A> id)
    {
        return inner.get(untyped(id));
    }

    public Iterable<Map.Entry<Id<A>, T>> iterSorted()
    {
        return Iterables.transform(inner.iterSorted(), IndexedMinQueue::typed);
    }

    /**
     * The priority of every id index of the arena {@code A} up to the highest index queued,
     * {@code null} where the index is not queued
     */
    public ContextualIterable<A, T> values()
    {
        Iterable<T> values = inner.values();
        return values::iterator;
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
        return Lists.transform(inner.heapArray(), id -> new Id<A>(id));
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

    private static <A> UntypedId untyped(ValidId<A> id)
    {
        return id.id().untyped;
    }

    private static <A, T> Map.Entry<Id<A>, T> typed(Map.Entry<UntypedId, T> entry)
    {
        return entry == null ? null : Maps.immutableEntry(new Id<>(entry.getKey()), entry.getValue());
    }
}

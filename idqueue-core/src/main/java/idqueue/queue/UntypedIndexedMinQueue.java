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

import java.util.ArrayList;
import java.util.ConcurrentModificationException;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;

import com.google.common.collect.AbstractIterator;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import idqueue.api.QueueConfig;
import idqueue.impl.Component;
import idqueue.impl.IntComponent;
import idqueue.primitives.UntypedId;
import idqueue.utils.DaryHeaps;
import idqueue.utils.Invariants;

import static idqueue.impl.IntComponent.NONE;
import static idqueue.utils.DaryHeaps.NO_PARENT;

/**
 * An indexed min priority queue over raw identifiers, implemented as a D-ary heap.
 * <p>
 * Three structures are kept in step: the heap array of ids, the heap position of each id, and the
 * priority of each id. The latter two are dense per-id storage keyed by {@link UntypedId#index}, so the
 * queue is oblivious to generations and trusts the caller to pass only ids that are still valid.
 * <p>
 * Every lookup that may miss (absent id, position out of range, empty queue) returns {@code null} rather
 * than throwing, and {@link #decrease}/{@link #increase} quietly ignore values that do not strictly improve
 * on the current priority.
 * <p>
 * Not thread safe.
 */
public class UntypedIndexedMinQueue<T extends Comparable<? super T>>
{
    private static final Logger logger = LoggerFactory.getLogger(UntypedIndexedMinQueue.class);

    /**
     * The maximum number of ids a queue may hold, as heap positions are {@code int}s
     */
    public static final int MAX_SIZE = Integer.MAX_VALUE - 8;

    private final int arity;
    private final Component<T> values;
    private final IntComponent positions;
    private final ArrayList<UntypedId> heap;
    private int modCount;

    public UntypedIndexedMinQueue()
    {
        this(QueueConfig.DEFAULT);
    }

    public UntypedIndexedMinQueue(QueueConfig config)
    {
        this.arity = config.arity();
        DaryHeaps.checkArity(arity);
        int initialCapacity = config.initialCapacity();
        this.values = new Component<>(initialCapacity);
        this.positions = new IntComponent(initialCapacity);
        this.heap = new ArrayList<>(initialCapacity);
    }

    private UntypedIndexedMinQueue(UntypedIndexedMinQueue<T> copy)
    {
        this.arity = copy.arity;
        this.values = new Component<>(copy.values);
        this.positions = new IntComponent(copy.positions);
        this.heap = new ArrayList<>(copy.heap);
    }

    public UntypedIndexedMinQueue<T> copy()
    {
        return new UntypedIndexedMinQueue<>(this);
    }

    /**
     * Replace the contents of this queue with those of {@code copy}, reusing this queue's storage
     */
    public void copyFrom(UntypedIndexedMinQueue<T> copy)
    {
        if (copy == this)
            return;

        Invariants.checkArgument(arity == copy.arity, "Cannot copy a queue of arity %d", copy.arity);
        values.copyFrom(copy.values);
        positions.copyFrom(copy.positions);
        heap.clear();
        heap.addAll(copy.heap);
        ++modCount;
    }

    public int arity()
    {
        return arity;
    }

    public void clear()
    {
        logger.debug("Clearing queue of {} ids", heap.size());
        values.fill(null);
        positions.fill(NONE);
        heap.clear();
        ++modCount;
    }

    /**
     * Set the priority of {@code id}, adding it to the queue if it is not already present
     */
    public void insert(UntypedId id, T value)
    {
        Invariants.nonNull(id, "id");
        Invariants.nonNull(value, "value");

        int position = positions.get(id);
        if (position != NONE)
        {
            values.set(id, value);
            // only one of these can move the element
            sink(position);
            swim(position);
        }
        else
        {
            Invariants.checkState(heap.size() < MAX_SIZE, "Queue is at capacity (%d ids)", MAX_SIZE);
            values.set(id, value);
            position = heap.size();
            positions.set(id, position);
            heap.add(id);
            swim(position);
        }
        ++modCount;
        checkConsistent();
    }

    /**
     * @return the removed id and its priority, or {@code null} if {@code id} was not queued
     */
    @Nullable
    public Map.Entry<UntypedId, T> remove(UntypedId id)
    {
        int position = positions.get(id);
        if (position == NONE)
            return null;

        return removeAt(position);
    }

    /**
     * @return the id and priority removed from heap {@code position}, or {@code null} if out of range
     */
    @Nullable
    public Map.Entry<UntypedId, T> removePosition(int position)
    {
        if (position < 0 || position >= heap.size())
            return null;

        return removeAt(position);
    }

    @Nullable
    public Map.Entry<UntypedId, T> pop()
    {
        return removePosition(0);
    }

    @Nullable
    public T peek()
    {
        return getPosition(0);
    }

    @Nullable
    public Map.Entry<UntypedId, T> peekId()
    {
        return getPositionWithId(0);
    }

    @Nullable
    public T getPosition(int position)
    {
        if (position < 0 || position >= heap.size())
            return null;

        return values.get(heap.get(position));
    }

    @Nullable
    public Map.Entry<UntypedId, T> getPositionWithId(int position)
    {
        if (position < 0 || position >= heap.size())
            return null;

        UntypedId id = heap.get(position);
        T value = values.get(id);
        return value == null ? null : Maps.immutableEntry(id, value);
    }

    /**
     * @return the current priority of {@code id}, or {@code null} if it is not queued
     */
    @Nullable
    public T get(UntypedId id)
    {
        return values.get(id);
    }

    /**
     * Lower the priority of {@code id} to {@code value}, if {@code id} is queued and {@code value} is strictly smaller
     */
    public void decrease(UntypedId id, T value)
    {
        Invariants.nonNull(value, "value");
        T current = values.get(id);
        int position = positions.get(id);
        if (current == null || position == NONE)
            return;

        if (value.compareTo(current) < 0)
        {
            values.set(id, value);
            swim(position);
            ++modCount;
            checkConsistent();
        }
    }

    /**
     * Raise the priority of {@code id} to {@code value}, if {@code id} is queued and {@code value} is strictly greater
     */
    public void increase(UntypedId id, T value)
    {
        Invariants.nonNull(value, "value");
        T current = values.get(id);
        int position = positions.get(id);
        if (current == null || position == NONE)
            return;

        if (value.compareTo(current) > 0)
        {
            values.set(id, value);
            sink(position);
            ++modCount;
            checkConsistent();
        }
    }

    /**
     * The queued ids and their priorities in heap array order. Only the first element is guaranteed to be
     * the minimum; the remainder are ordered only with respect to their heap ancestors.
     * <p>
     * Each invocation of {@code iterator()} starts afresh. Iterators fail if the queue is modified.
     */
    public Iterable<Map.Entry<UntypedId, T>> iterSorted()
    {
        return () -> new FailFastIterator<Map.Entry<UntypedId, T>>()
        {
            int next = 0;

            @Override
            protected Map.Entry<UntypedId, T> computeNextChecked()
            {
                if (next >= heap.size())
                    return endOfData();

                UntypedId id = heap.get(next++);
                return Maps.immutableEntry(id, values.get(id));
            }
        };
    }

    /**
     * The priority stored against every id index up to the highest index ever queued, {@code null} for
     * indexes that are not currently queued. Iterators fail if the queue is modified.
     */
    public Iterable<T> values()
    {
        return () -> new FailFastIterator<T>()
        {
            final Iterator<T> slots = values.iterator();

            @Override
            protected T computeNextChecked()
            {
                if (!slots.hasNext())
                    return endOfData();
                return slots.next();
            }
        };
    }

    public int size()
    {
        return heap.size();
    }

    public boolean isEmpty()
    {
        return heap.isEmpty();
    }

    private Map.Entry<UntypedId, T> removeAt(int position)
    {
        int last = heap.size() - 1;
        swap(position, last);

        UntypedId removed = heap.remove(last);
        T value = values.take(removed);
        int removedFrom = positions.take(removed);
        Invariants.checkState(value != null && removedFrom == last, "Position map out of sync with heap at position %d", last);

        if (position < last)
        {
            sink(position);
            swim(position);
        }
        ++modCount;
        checkConsistent();
        return Maps.immutableEntry(removed, value);
    }

    private void sink(int index)
    {
        int size = heap.size();
        while (true)
        {
            int child = minChild(index, size);
            if (child < 0 || valueAt(child).compareTo(valueAt(index)) >= 0)
                return;

            swap(index, child);
            index = child;
        }
    }

    /**
     * @return the child of {@code parent} with the smallest priority, the lowest position winning ties; or -1 if none
     */
    private int minChild(int parent, int size)
    {
        int start = DaryHeaps.firstChild(parent, arity);
        int end = DaryHeaps.childrenEnd(parent, size, arity);
        if (start >= end)
            return -1;

        int min = start;
        T minValue = valueAt(start);
        for (int child = start + 1 ; child < end ; ++child)
        {
            T childValue = valueAt(child);
            if (childValue.compareTo(minValue) < 0)
            {
                min = child;
                minValue = childValue;
            }
        }
        return min;
    }

    private void swim(int index)
    {
        if (index >= heap.size())
            return;

        T value = valueAt(index);
        int parent;
        while ((parent = DaryHeaps.parent(index, arity)) != NO_PARENT)
        {
            if (value.compareTo(valueAt(parent)) >= 0)
                return;

            swap(index, parent);
            index = parent;
        }
    }

    private void swap(int a, int b)
    {
        int size = heap.size();
        if (a == b || a < 0 || b < 0 || a >= size || b >= size)
            return;

        UntypedId idA = heap.get(a), idB = heap.get(b);
        positions.swap(idA, idB);
        heap.set(a, idB);
        heap.set(b, idA);
    }

    private T valueAt(int position)
    {
        T value = values.get(heap.get(position));
        Invariants.checkState(value != null, "No priority for the id at position %d", position);
        return value;
    }

    private void checkConsistent()
    {
        Invariants.paranoid(this::isConsistent, "Queue invariants violated");
    }

    boolean isHeapOrdered()
    {
        for (int parent = 0 ; parent < heap.size() ; ++parent)
        {
            T parentValue = valueAt(parent);
            int end = DaryHeaps.childrenEnd(parent, heap.size(), arity);
            for (int child = DaryHeaps.firstChild(parent, arity) ; child < end ; ++child)
            {
                if (valueAt(child).compareTo(parentValue) < 0)
                    return false;
            }
        }
        return true;
    }

    boolean isConsistent()
    {
        if (!isHeapOrdered())
            return false;

        for (int position = 0 ; position < heap.size() ; ++position)
        {
            if (positions.get(heap.get(position)) != position)
                return false;
        }

        int present = 0;
        int slots = Math.max(values.size(), positions.size());
        for (int index = 0 ; index < slots ; ++index)
        {
            boolean hasValue = values.get(index) != null;
            boolean hasPosition = positions.get(index) != NONE;
            if (hasValue != hasPosition)
                return false;
            if (hasValue)
                ++present;
        }
        return present == heap.size();
    }

    int positionOf(UntypedId id)
    {
        return positions.get(id);
    }

    List<UntypedId> heapArray()
    {
        return ImmutableList.copyOf(heap);
    }

    @Override
    public String toString()
    {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0 ; i < heap.size() ; ++i)
        {
            if (i > 0) sb.append(", ");
            UntypedId id = heap.get(i);
            sb.append(id).append('=').append(values.get(id));
        }
        return sb.append(']').toString();
    }

    private abstract class FailFastIterator<E> extends AbstractIterator<E>
    {
        private final int expectedModCount = modCount;

        @Override
        protected final E computeNext()
        {
            if (modCount != expectedModCount)
                throw new ConcurrentModificationException();
            return computeNextChecked();
        }

        protected abstract E computeNextChecked();
    }
}

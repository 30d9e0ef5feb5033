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

import java.util.Arrays;
import java.util.Iterator;
import java.util.NoSuchElementException;
import javax.annotation.Nullable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import idqueue.primitives.UntypedId;
import idqueue.utils.Invariants;

import static org.agrona.BitUtil.findNextPositivePowerOfTwo;

/**
 * Dense storage of one optional value per identifier index. A slot holding {@code null} is unset.
 * Writing beyond the current size grows the storage, leaving the intervening slots unset.
 */
public class Component<T> implements Iterable<T>
{
    private static final Logger logger = LoggerFactory.getLogger(Component.class);
    private static final Object[] EMPTY = new Object[0];
    static final int MAX_CAPACITY = Integer.MAX_VALUE - 8;

    private Object[] slots;
    private int size;

    public Component()
    {
        this(0);
    }

    public Component(int initialCapacity)
    {
        Invariants.isNatural(initialCapacity);
        this.slots = initialCapacity == 0 ? EMPTY : new Object[initialCapacity];
    }

    public Component(Component<? extends T> copy)
    {
        this.slots = Arrays.copyOf(copy.slots, copy.size);
        this.size = copy.size;
    }

    public void copyFrom(Component<? extends T> copy)
    {
        if (slots.length < copy.size) slots = Arrays.copyOf(copy.slots, copy.size);
        else System.arraycopy(copy.slots, 0, slots, 0, copy.size);
        if (size > copy.size)
            Arrays.fill(slots, copy.size, size, null);
        size = copy.size;
    }

    /**
     * Overwrite the slot at {@code index}, growing the storage if necessary
     */
    public void set(int index, @Nullable T value)
    {
        Invariants.isNatural(index);
        if (index >= size)
        {
            if (value == null)
                return;
            Invariants.checkState(index < MAX_CAPACITY, "Cannot grow storage beyond %d slots", MAX_CAPACITY);
            ensureCapacity(index + 1);
            size = index + 1;
        }
        slots[index] = value;
    }

    public void set(UntypedId id, @Nullable T value)
    {
        set(id.index, value);
    }

    @Nullable
    @SuppressWarnings("unchecked")
    public T get(int index)
    {
        return index >= 0 && index < size ? (T) slots[index] : null;
    }

    @Nullable
    public T get(UntypedId id)
    {
        return get(id.index);
    }

    /**
     * Unset the slot at {@code index}, returning its previous contents
     */
    @Nullable
    public T take(int index)
    {
        T prev = get(index);
        if (prev != null)
            slots[index] = null;
        return prev;
    }

    @Nullable
    public T take(UntypedId id)
    {
        return take(id.index);
    }

    /**
     * Set every slot within the current size to {@code value}
     */
    public void fill(@Nullable T value)
    {
        Arrays.fill(slots, 0, size, value);
    }

    public void swap(int a, int b)
    {
        Invariants.checkArgument(a >= 0 && a < size, "Index %d out of bounds", a);
        Invariants.checkArgument(b >= 0 && b < size, "Index %d out of bounds", b);
        Object tmp = slots[a];
        slots[a] = slots[b];
        slots[b] = tmp;
    }

    public void swap(UntypedId a, UntypedId b)
    {
        swap(a.index, b.index);
    }

    /**
     * @return one more than the highest index ever written
     */
    public int size()
    {
        return size;
    }

    public int capacity()
    {
        return slots.length;
    }

    private void ensureCapacity(int minCapacity)
    {
        if (minCapacity <= slots.length)
            return;

        Invariants.checkState(minCapacity <= MAX_CAPACITY, "Cannot grow storage beyond %d slots", MAX_CAPACITY);
        int newCapacity = minCapacity > (1 << 30) ? MAX_CAPACITY : findNextPositivePowerOfTwo(Math.max(8, minCapacity));
        logger.trace("Growing storage from {} to {} slots", slots.length, newCapacity);
        slots = Arrays.copyOf(slots, newCapacity);
    }

    /**
     * Iterates every slot up to {@link #size()}, yielding {@code null} for unset slots
     */
    @Override
    public Iterator<T> iterator()
    {
        return new Iterator<T>()
        {
            int next = 0;

            @Override
            public boolean hasNext()
            {
                return next < size;
            }

            @Override
            @SuppressWarnings("unchecked")
            public T next()
            {
                if (next >= size)
                    throw new NoSuchElementException();
                return (T) slots[next++];
            }
        };
    }

    @Override
    public String toString()
    {
        return Arrays.toString(Arrays.copyOf(slots, size));
    }
}

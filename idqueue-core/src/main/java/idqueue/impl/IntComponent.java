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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import idqueue.primitives.UntypedId;
import idqueue.utils.Invariants;

import static org.agrona.BitUtil.findNextPositivePowerOfTwo;

/**
 * Dense storage of one {@code int} per identifier index, with {@link #NONE} marking an unset slot.
 * Values written must be non-negative.
 */
public class IntComponent
{
    private static final Logger logger = LoggerFactory.getLogger(IntComponent.class);
    private static final int[] EMPTY = new int[0];
    public static final int NONE = -1;

    private int[] slots;
    private int size;

    public IntComponent()
    {
        this(0);
    }

    public IntComponent(int initialCapacity)
    {
        Invariants.isNatural(initialCapacity);
        this.slots = initialCapacity == 0 ? EMPTY : newSlots(initialCapacity);
    }

    public IntComponent(IntComponent copy)
    {
        this.slots = Arrays.copyOf(copy.slots, copy.size);
        this.size = copy.size;
    }

    public void copyFrom(IntComponent copy)
    {
        if (slots.length < copy.size) slots = Arrays.copyOf(copy.slots, copy.size);
        else System.arraycopy(copy.slots, 0, slots, 0, copy.size);
        if (size > copy.size)
            Arrays.fill(slots, copy.size, size, NONE);
        size = copy.size;
    }

    public void set(int index, int value)
    {
        Invariants.isNatural(index);
        Invariants.checkArgument(value >= NONE, "Invalid slot value %d", value);
        if (index >= size)
        {
            if (value == NONE)
                return;
            Invariants.checkState(index < Component.MAX_CAPACITY, "Cannot grow storage beyond %d slots", Component.MAX_CAPACITY);
            ensureCapacity(index + 1);
            size = index + 1;
        }
        slots[index] = value;
    }

    public void set(UntypedId id, int value)
    {
        set(id.index, value);
    }

    public int get(int index)
    {
        return index >= 0 && index < size ? slots[index] : NONE;
    }

    public int get(UntypedId id)
    {
        return get(id.index);
    }

    public boolean isSet(UntypedId id)
    {
        return get(id.index) != NONE;
    }

    public int take(int index)
    {
        int prev = get(index);
        if (prev != NONE)
            slots[index] = NONE;
        return prev;
    }

    public int take(UntypedId id)
    {
        return take(id.index);
    }

    public void fill(int value)
    {
        Arrays.fill(slots, 0, size, value);
    }

    public void swap(int a, int b)
    {
        Invariants.checkArgument(a >= 0 && a < size, "Index %d out of bounds", a);
        Invariants.checkArgument(b >= 0 && b < size, "Index %d out of bounds", b);
        int tmp = slots[a];
        slots[a] = slots[b];
        slots[b] = tmp;
    }

    public void swap(UntypedId a, UntypedId b)
    {
        swap(a.index, b.index);
    }

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

        Invariants.checkState(minCapacity <= Component.MAX_CAPACITY, "Cannot grow storage beyond %d slots", Component.MAX_CAPACITY);
        int newCapacity = minCapacity > (1 << 30) ? Component.MAX_CAPACITY : findNextPositivePowerOfTwo(Math.max(8, minCapacity));
        logger.trace("Growing storage from {} to {} slots", slots.length, newCapacity);
        int prevCapacity = slots.length;
        slots = Arrays.copyOf(slots, newCapacity);
        Arrays.fill(slots, prevCapacity, newCapacity, NONE);
    }

    private static int[] newSlots(int capacity)
    {
        int[] slots = new int[capacity];
        Arrays.fill(slots, NONE);
        return slots;
    }

    @Override
    public String toString()
    {
        return Arrays.toString(Arrays.copyOf(slots, size));
    }
}

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

package idqueue.utils;

import net.nicoulaj.compilecommand.annotations.Inline;

/**
 * Position arithmetic for a heap of arity {@code D} laid out in a flat array:
 * the children of {@code p} occupy {@code [p*D+1, p*D+D+1)}, and the parent of {@code p > 0} is {@code (p-1)/D}.
 */
public class DaryHeaps
{
    public static final int DEFAULT_ARITY = 8;
    public static final int NO_PARENT = -1;

    private DaryHeaps() {}

    /**
     * @return the parent position of {@code index}, or {@link #NO_PARENT} for the root
     */
    @Inline
    public static int parent(int index, int arity)
    {
        return index == 0 ? NO_PARENT : (index - 1) / arity;
    }

    /**
     * @return the first child position of {@code index}, saturating at {@link Integer#MAX_VALUE}
     */
    @Inline
    public static int firstChild(int index, int arity)
    {
        return (int) Math.min((long) index * arity + 1, Integer.MAX_VALUE);
    }

    /**
     * @return the exclusive end of the child range of {@code index} in a heap of {@code size} elements;
     * the range is empty whenever this is not greater than {@link #firstChild}
     */
    @Inline
    public static int childrenEnd(int index, int size, int arity)
    {
        return (int) Math.min((long) index * arity + arity + 1, size);
    }

    public static void checkArity(int arity)
    {
        Invariants.checkArgument(arity >= 2, "Heap arity must be at least 2; found %d", arity);
    }
}

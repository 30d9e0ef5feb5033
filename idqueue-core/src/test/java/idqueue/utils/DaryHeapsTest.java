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

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import static idqueue.utils.DaryHeaps.NO_PARENT;
import static idqueue.utils.DaryHeaps.childrenEnd;
import static idqueue.utils.DaryHeaps.firstChild;
import static idqueue.utils.DaryHeaps.parent;
import static idqueue.utils.Property.qt;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class DaryHeapsTest
{
    private static List<Integer> children(int index, int size, int arity)
    {
        List<Integer> result = new ArrayList<>();
        for (int i = firstChild(index, arity), end = childrenEnd(index, size, arity) ; i < end ; ++i)
            result.add(i);
        return result;
    }

    @Test
    public void parentChild()
    {
        assertThat(parent(0, 4)).isEqualTo(NO_PARENT);
        assertThat(parent(7, 4)).isEqualTo(1);
        assertThat(children(1, 10, 4)).contains(7);
    }

    @Test
    public void childRanges()
    {
        assertThat(children(0, 1, 4)).isEmpty();
        assertThat(children(0, 2, 4)).containsExactly(1);
        assertThat(children(0, 5, 4)).containsExactly(1, 2, 3, 4);
        assertThat(children(0, 6, 4)).containsExactly(1, 2, 3, 4);
        assertThat(children(2, 20, 4)).containsExactly(9, 10, 11, 12);
        assertThat(children(0, 10, 2)).containsExactly(1, 2);
        assertThat(children(2, 3, 8)).isEmpty();
    }

    @Test
    public void everyPositionIsAChildOfItsParent()
    {
        qt().forAll(Gens.ints().between(2, 16), Gens.ints().between(1, 1 << 20)).check((arity, index) -> {
            int parent = parent(index, arity);
            assertThat(parent).isBetween(0, index - 1);
            assertThat(index).isGreaterThanOrEqualTo(firstChild(parent, arity))
                             .isLessThan(childrenEnd(parent, Integer.MAX_VALUE, arity));
        });
    }

    @Test
    public void largePositionsDoNotOverflow()
    {
        int index = Integer.MAX_VALUE / 2;
        assertThat(firstChild(index, 8)).isEqualTo(Integer.MAX_VALUE);
        assertThat(childrenEnd(index, 100, 8)).isEqualTo(100);
        assertThat(children(index, Integer.MAX_VALUE, 8)).isEmpty();
    }

    @Test
    public void arityMustBeAtLeastTwo()
    {
        DaryHeaps.checkArity(2);
        assertThatThrownBy(() -> DaryHeaps.checkArity(1)).isInstanceOf(IllegalArgumentException.class);
    }
}

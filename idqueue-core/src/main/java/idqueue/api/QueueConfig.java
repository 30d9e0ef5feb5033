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

package idqueue.api;

import idqueue.utils.DaryHeaps;

public interface QueueConfig
{
    QueueConfig DEFAULT = new QueueConfig() {};

    // Number of children per heap node; wider heaps are shallower but compare more siblings per sink step
    default int arity()
    {
        return DaryHeaps.DEFAULT_ARITY;
    }

    // Number of elements to pre-size the heap array and per-id storage for
    default int initialCapacity()
    {
        return 0;
    }

    static QueueConfig withArity(int arity)
    {
        DaryHeaps.checkArity(arity);
        return new QueueConfig()
        {
            @Override
            public int arity()
            {
                return arity;
            }
        };
    }
}

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

/**
 * An {@link Iterable} whose elements correspond, slot by slot, to the identifiers of the arena {@code C}.
 * The type parameter is never inspected at runtime; it only lets method signatures insist that two
 * iterables are indexed by the same kind of identifier.
 */
public interface ContextualIterable<C, T> extends Iterable<T>
{
}

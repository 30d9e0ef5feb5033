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
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import idqueue.impl.Allocator;
import idqueue.primitives.Id;
import idqueue.utils.RandomSource;
import idqueue.utils.RandomTestRunner;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Dijkstra's algorithm driven by {@link IndexedMinQueue#decrease}, checked against Bellman-Ford
 */
public class ShortestPathTest
{
    private static class Nodes {}

    private static class Edge
    {
        final Id<Nodes> to;
        final long weight;

        Edge(Id<Nodes> to, long weight)
        {
            this.to = to;
            this.weight = weight;
        }
    }

    private static long[] dijkstra(List<Id<Nodes>> nodes, List<List<Edge>> edges, Id<Nodes> source)
    {
        long[] distances = new long[nodes.size()];
        Arrays.fill(distances, Long.MAX_VALUE);
        boolean[] settled = new boolean[nodes.size()];

        IndexedMinQueue<Nodes, Long> queue = new IndexedMinQueue<>();
        queue.insert(source, 0L);
        Map.Entry<Id<Nodes>, Long> next;
        while (null != (next = queue.pop()))
        {
            int from = next.getKey().index();
            distances[from] = next.getValue();
            settled[from] = true;
            for (Edge edge : edges.get(from))
            {
                if (settled[edge.to.index()])
                    continue;

                long distance = next.getValue() + edge.weight;
                if (queue.get(edge.to) == null) queue.insert(edge.to, distance);
                else queue.decrease(edge.to, distance);
            }
        }
        return distances;
    }

    private static long[] bellmanFord(int count, List<List<Edge>> edges, int source)
    {
        long[] distances = new long[count];
        Arrays.fill(distances, Long.MAX_VALUE);
        distances[source] = 0;
        for (int round = 1 ; round < count ; ++round)
        {
            for (int from = 0 ; from < count ; ++from)
            {
                if (distances[from] == Long.MAX_VALUE)
                    continue;
                for (Edge edge : edges.get(from))
                    distances[edge.to.index()] = Math.min(distances[edge.to.index()], distances[from] + edge.weight);
            }
        }
        return distances;
    }

    @Test
    public void smallGraph()
    {
        Allocator<Nodes> allocator = new Allocator<>();
        List<Id<Nodes>> nodes = new ArrayList<>();
        List<List<Edge>> edges = new ArrayList<>();
        for (int i = 0 ; i < 5 ; ++i)
        {
            nodes.add(allocator.create());
            edges.add(new ArrayList<>());
        }
        edges.get(0).add(new Edge(nodes.get(1), 10));
        edges.get(0).add(new Edge(nodes.get(2), 3));
        edges.get(2).add(new Edge(nodes.get(1), 4));
        edges.get(1).add(new Edge(nodes.get(3), 2));
        edges.get(2).add(new Edge(nodes.get(3), 8));

        assertThat(dijkstra(nodes, edges, nodes.get(0))).containsExactly(0, 7, 3, 9, Long.MAX_VALUE);
    }

    @Test
    public void randomGraphs()
    {
        for (int i = 0 ; i < 20 ; ++i)
            RandomTestRunner.test().check(ShortestPathTest::checkRandomGraph);
    }

    private static void checkRandomGraph(RandomSource rs)
    {
        Allocator<Nodes> allocator = new Allocator<>();
        int count = rs.nextInt(1, 60);
        List<Id<Nodes>> nodes = new ArrayList<>();
        List<List<Edge>> edges = new ArrayList<>();
        for (int i = 0 ; i < count ; ++i)
        {
            nodes.add(allocator.create());
            edges.add(new ArrayList<>());
        }

        int edgeCount = rs.nextInt(count * 4 + 1);
        for (int i = 0 ; i < edgeCount ; ++i)
            edges.get(rs.nextInt(count)).add(new Edge(rs.pick(nodes), rs.nextInt(100)));

        int source = rs.nextInt(count);
        assertThat(dijkstra(nodes, edges, nodes.get(source))).containsExactly(bellmanFord(count, edges, source));
    }
}

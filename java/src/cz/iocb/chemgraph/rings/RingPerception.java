/*
 * Copyright (C) 2015-2017 Jakub Galgonek   galgonek@uochb.cas.cz
 *
 * This program is free software; you can redistribute it and/or modify it under the terms of the GNU Lesser General
 * Public License as published by the Free Software Foundation; either version 2.1 of the License, or (at your option)
 * any later version. All we ask is that proper credit is given for our work, which includes - but is not limited to -
 * adding the above copyright notice to the beginning of your source code files, and to any copyright notice that you
 * may distribute with programs based on this work.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Lesser General Public License for more
 * details.
 */
package cz.iocb.chemgraph.rings;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import cz.iocb.chemgraph.molecule.Bond;
import cz.iocb.chemgraph.molecule.Molecule;
import cz.iocb.chemgraph.molecule.RingInfo;



/**
 * Perception of the smallest set of smallest rings.
 *
 * The candidate cycles are built in the way of Horton: for every atom v and every bond (x, y), the cycle formed by
 * the shortest paths v-x and y-v together with the bond is a candidate whenever the two paths share only v. The
 * candidates are sorted by size and then by their sorted atom ids, and accepted greedily while they are linearly
 * independent over GF(2). Exactly |bonds| - |atoms| + |components| rings are returned.
 */
public class RingPerception
{
    private static final Logger LOGGER = LogManager.getLogger(RingPerception.class);


    private static class Candidate
    {
        final int[] cycle;
        final int[] sorted;
        final BitSet edges;

        Candidate(int[] cycle, BitSet edges)
        {
            this.cycle = cycle;
            this.sorted = cycle.clone();
            this.edges = edges;
            Arrays.sort(sorted);
        }
    }


    private static final Comparator<Candidate> candidateComparator = new Comparator<Candidate>()
    {
        @Override
        public int compare(Candidate a, Candidate b)
        {
            if(a.cycle.length != b.cycle.length)
                return Integer.compare(a.cycle.length, b.cycle.length);

            for(int i = 0; i < a.sorted.length; i++)
                if(a.sorted[i] != b.sorted[i])
                    return Integer.compare(a.sorted[i], b.sorted[i]);

            return 0;
        }
    };


    public static RingInfo perceiveRings(Molecule molecule)
    {
        int[] ids = molecule.getAtomIds();
        int atomCount = ids.length;

        Map<Integer, Integer> indexes = new HashMap<Integer, Integer>();

        for(int i = 0; i < atomCount; i++)
            indexes.put(ids[i], i);

        List<Bond> bonds = molecule.getBonds();
        int[][] edges = new int[bonds.size()][2];
        List<List<Integer>> adjacency = new ArrayList<List<Integer>>(atomCount);
        Map<Long, Integer> edgeIndexes = new HashMap<Long, Integer>();

        for(int i = 0; i < atomCount; i++)
            adjacency.add(new ArrayList<Integer>());

        for(int e = 0; e < bonds.size(); e++)
        {
            int a = indexes.get(bonds.get(e).getAtom1());
            int b = indexes.get(bonds.get(e).getAtom2());
            edges[e][0] = a;
            edges[e][1] = b;
            adjacency.get(a).add(b);
            adjacency.get(b).add(a);
            edgeIndexes.put(key(a, b), e);
        }

        int[][] neighbours = new int[atomCount][];

        for(int i = 0; i < atomCount; i++)
        {
            Collections.sort(adjacency.get(i));
            neighbours[i] = new int[adjacency.get(i).size()];

            for(int j = 0; j < neighbours[i].length; j++)
                neighbours[i][j] = adjacency.get(i).get(j);
        }

        int ringCount = bonds.size() - atomCount + countComponents(neighbours);

        if(ringCount == 0)
            return RingInfo.empty();


        List<Candidate> candidates = new ArrayList<Candidate>();
        Set<BitSet> seen = new HashSet<BitSet>();

        int[] dist = new int[atomCount];
        int[] parent = new int[atomCount];
        boolean[] onPath = new boolean[atomCount];

        for(int v = 0; v < atomCount; v++)
        {
            if(neighbours[v].length < 2)
                continue;

            shortestPathTree(neighbours, v, dist, parent);

            for(int[] edge : edges)
            {
                int x = edge[0];
                int y = edge[1];

                if(dist[x] < 0 || dist[y] < 0 || parent[x] == y || parent[y] == x)
                    continue;

                if(Math.abs(dist[x] - dist[y]) > 1)
                    continue;

                for(int w = x; w != v; w = parent[w])
                    onPath[w] = true;

                boolean disjoint = true;

                for(int w = y; w != v; w = parent[w])
                {
                    if(onPath[w])
                    {
                        disjoint = false;
                        break;
                    }
                }

                for(int w = x; w != v; w = parent[w])
                    onPath[w] = false;

                if(!disjoint)
                    continue;

                int[] cycle = new int[dist[x] + dist[y] + 1];
                int position = dist[x];

                for(int w = x; w != v; w = parent[w])
                    cycle[position--] = w;

                cycle[0] = v;
                position = dist[x] + 1;

                for(int w = y; w != v; w = parent[w])
                    cycle[position++] = w;

                BitSet vector = new BitSet(edges.length);

                for(int i = 0; i < cycle.length; i++)
                    vector.set(edgeIndexes.get(key(cycle[i], cycle[(i + 1) % cycle.length])));

                if(seen.add(vector))
                    candidates.add(new Candidate(cycle, vector));
            }
        }

        Collections.sort(candidates, candidateComparator);


        List<int[]> ringAtoms = new ArrayList<int[]>(ringCount);
        List<int[]> ringBonds = new ArrayList<int[]>(ringCount);
        CycleBasis basis = new CycleBasis();

        for(Candidate candidate : candidates)
        {
            if(basis.size() == ringCount)
                break;

            if(!basis.add(candidate.edges))
                continue;

            int[] ring = normalize(candidate.cycle);
            int[] atoms = new int[ring.length];
            int[] ringBondIds = new int[ring.length];

            for(int i = 0; i < ring.length; i++)
            {
                atoms[i] = ids[ring[i]];
                ringBondIds[i] = bonds.get(edgeIndexes.get(key(ring[i], ring[(i + 1) % ring.length]))).getId();
            }

            ringAtoms.add(atoms);
            ringBonds.add(ringBondIds);
        }

        if(ringAtoms.size() != ringCount)
            throw new IllegalStateException("cycle basis is incomplete: " + ringAtoms.size() + " of " + ringCount);

        LOGGER.debug("perceived " + ringCount + " rings from " + candidates.size() + " candidates");

        return new RingInfo(ringAtoms, ringBonds);
    }


    /**
     * Returns a copy of the molecule with its rings perceived.
     */
    public static Molecule withRings(Molecule molecule)
    {
        return molecule.withRingInfo(perceiveRings(molecule));
    }


    private static void shortestPathTree(int[][] neighbours, int root, int[] dist, int[] parent)
    {
        Arrays.fill(dist, -1);
        Arrays.fill(parent, -1);

        ArrayDeque<Integer> queue = new ArrayDeque<Integer>();
        dist[root] = 0;
        queue.add(root);

        while(!queue.isEmpty())
        {
            int atom = queue.poll();

            for(int neighbour : neighbours[atom])
            {
                if(dist[neighbour] < 0)
                {
                    dist[neighbour] = dist[atom] + 1;
                    parent[neighbour] = atom;
                    queue.add(neighbour);
                }
            }
        }
    }


    private static int countComponents(int[][] neighbours)
    {
        int[] dist = new int[neighbours.length];
        int[] parent = new int[neighbours.length];
        boolean[] visited = new boolean[neighbours.length];
        int components = 0;

        for(int i = 0; i < neighbours.length; i++)
        {
            if(visited[i])
                continue;

            components++;
            shortestPathTree(neighbours, i, dist, parent);

            for(int j = 0; j < neighbours.length; j++)
                if(dist[j] >= 0)
                    visited[j] = true;
        }

        return components;
    }


    /**
     * Rotates the cycle to start at its lowest index and to continue toward the smaller neighbour of that index.
     */
    static int[] normalize(int[] cycle)
    {
        int length = cycle.length;
        int start = 0;

        for(int i = 1; i < length; i++)
            if(cycle[i] < cycle[start])
                start = i;

        int next = cycle[(start + 1) % length];
        int previous = cycle[(start + length - 1) % length];
        int step = next < previous ? 1 : length - 1;

        int[] result = new int[length];

        for(int i = 0; i < length; i++)
            result[i] = cycle[(start + i * step) % length];

        return result;
    }


    private static long key(int a, int b)
    {
        long low = Math.min(a, b);
        long high = Math.max(a, b);
        return (high << 32) | low;
    }
}

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
package cz.iocb.chemgraph.canonical;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import cz.iocb.chemgraph.molecule.Atom;
import cz.iocb.chemgraph.molecule.Bond;
import cz.iocb.chemgraph.molecule.DoubleBondStereo;
import cz.iocb.chemgraph.molecule.Molecule;
import cz.iocb.chemgraph.molecule.RingInfo;
import cz.iocb.chemgraph.rings.RingPerception;
import cz.iocb.chemgraph.shared.PerceptionSettings;



/**
 * Canonical atom ranking.
 *
 * Atoms are first partitioned by a seed invariant, the partition is then refined by the ranks of the neighbours
 * (Morgan-like) until it stops splitting. The parity of stereo centres and of double bonds takes part in the
 * refinement as soon as their neighbours are told apart. Remaining ties are resolved by a search: every member of
 * the lowest tied class is individualized in turn, the partition is refined again, and of all complete rankings the
 * one with the smallest certificate is kept. Branches that are images of already explored ones under an automorphism
 * found on the way are skipped.
 *
 * The rank of an atom is the position of its class in the partition. When a class splits, its largest part keeps
 * the position and the other parts follow in the order of their keys.
 */
public class Canonicalizer
{
    private static final Logger LOGGER = LogManager.getLogger(Canonicalizer.class);

    private static final int NONE = -1;

    private final int maxSearchNodes;


    public Canonicalizer(PerceptionSettings settings)
    {
        this(settings.getMaxCanonicalSearchNodes());
    }


    public Canonicalizer(int maxSearchNodes)
    {
        if(maxSearchNodes < 1)
            throw new IllegalArgumentException("invalid canonical search bound " + maxSearchNodes);

        this.maxSearchNodes = maxSearchNodes;
    }


    public CanonicalResult canonicalize(Molecule molecule)
    {
        Graph graph = new Graph(molecule);
        int atomCount = graph.atoms.length;

        RingInfo rings = molecule.getRingInfo() != null ? molecule.getRingInfo() :
                RingPerception.perceiveRings(molecule);

        int[][] seeds = new int[atomCount][];

        for(int i = 0; i < atomCount; i++)
        {
            int ringBonds = 0;

            for(Bond bond : molecule.getBonds(graph.ids[i]))
                if(rings.isBondInRing(bond.getId()))
                    ringBonds++;

            seeds[i] = seedInvariant(molecule, graph.atoms[i], ringBonds);
        }

        int[] ranks = rank(seeds);
        int[] order = orderOf(ranks);

        boolean[] dirty = new boolean[atomCount];
        Arrays.fill(dirty, true);
        graph.refine(ranks, order, dirty);

        if(!isDiscrete(ranks, order))
            ranks = search(graph, ranks, order);


        Map<Integer, Integer> ranking = new HashMap<Integer, Integer>();
        int[] ordered = new int[atomCount];

        for(int i = 0; i < atomCount; i++)
        {
            ranking.put(graph.ids[i], ranks[i]);
            ordered[ranks[i]] = graph.ids[i];
        }

        return new CanonicalResult(molecule, ranking, ordered);
    }


    /**
     * Seed invariant of an atom. Ring membership is counted in ring bonds, which do not depend on the choice of the
     * smallest set of smallest rings.
     */
    static int[] seedInvariant(Molecule molecule, Atom atom, int ringBonds)
    {
        return new int[] { atom.getAtomicNumber(), atom.getCharge(), atom.getIsotope(), atom.isAromatic() ? 1 : 0,
                molecule.getDegree(atom.getId()), ringBonds, atom.getHydrogenCount() };
    }


    private int[] search(Graph graph, int[] ranks, int[] order)
    {
        List<Node> stack = new ArrayList<Node>();
        stack.add(new Node(ranks, order, new int[0]));

        List<int[]> automorphisms = new ArrayList<int[]>();
        Leaf first = null;
        Leaf best = null;
        int nodes = 0;

        while(!stack.isEmpty())
        {
            boolean exhausted = nodes >= maxSearchNodes;

            if(exhausted && best != null)
            {
                LOGGER.warn("canonical search stopped after " + nodes + " nodes, the ranking may depend on atom ids");
                break;
            }

            Node node = stack.get(stack.size() - 1);
            int candidate = node.nextCandidate(automorphisms, exhausted);

            if(candidate == NONE)
            {
                stack.remove(stack.size() - 1);
                continue;
            }

            nodes++;

            int[] childRanks = node.ranks.clone();
            int[] childOrder = node.order.clone();
            graph.individualize(childRanks, childOrder, candidate);

            int[] path = Arrays.copyOf(node.path, node.path.length + 1);
            path[node.path.length] = candidate;

            if(!isDiscrete(childRanks, childOrder))
            {
                stack.add(new Node(childRanks, childOrder, path));
                continue;
            }

            Leaf leaf = new Leaf(childRanks, childOrder, graph.certificate(childRanks, childOrder));

            if(best == null)
            {
                first = leaf;
                best = leaf;
                continue;
            }

            int comparison = compareKeys(leaf.certificate, best.certificate);
            int[] automorphism = null;

            if(comparison < 0)
                best = leaf;
            else if(comparison == 0)
                automorphism = mapping(best, leaf);
            else if(Arrays.equals(leaf.certificate, first.certificate))
                automorphism = mapping(first, leaf);

            if(automorphism != null && !isIdentity(automorphism))
            {
                automorphisms.add(automorphism);
                skipEquivalentSubtree(stack, automorphism);
            }
        }

        LOGGER.trace("canonical search explored " + nodes + " nodes");

        return best.ranks;
    }


    /**
     * Leaves the subtree being explored when the automorphism maps an already explored sibling on it.
     */
    private static void skipEquivalentSubtree(List<Node> stack, int[] automorphism)
    {
        int[] inverse = new int[automorphism.length];

        for(int i = 0; i < automorphism.length; i++)
            inverse[automorphism[i]] = i;

        for(int level = 0; level < stack.size(); level++)
        {
            Node node = stack.get(level);

            if(!fixes(automorphism, node.path))
                return;

            int current = node.explored.get(node.explored.size() - 1);
            int preimage = inverse[current];

            if(preimage != current && node.explored.contains(preimage))
            {
                while(stack.size() > level + 1)
                    stack.remove(stack.size() - 1);

                return;
            }
        }
    }


    private static int[] mapping(Leaf from, Leaf to)
    {
        int[] automorphism = new int[from.ranks.length];

        for(int i = 0; i < automorphism.length; i++)
            automorphism[i] = to.order[from.ranks[i]];

        return automorphism;
    }


    private static boolean isIdentity(int[] automorphism)
    {
        for(int i = 0; i < automorphism.length; i++)
            if(automorphism[i] != i)
                return false;

        return true;
    }


    private static boolean fixes(int[] automorphism, int[] atoms)
    {
        for(int atom : atoms)
            if(automorphism[atom] != atom)
                return false;

        return true;
    }


    private static boolean isDiscrete(int[] ranks, int[] order)
    {
        for(int i = 0; i < order.length - 1; i++)
            if(ranks[order[i]] == ranks[order[i + 1]])
                return false;

        return true;
    }


    /**
     * Ranks the keys: the rank of an atom is the number of atoms with a strictly smaller key.
     */
    private static int[] rank(final int[][] keys)
    {
        Integer[] order = new Integer[keys.length];

        for(int i = 0; i < order.length; i++)
            order[i] = i;

        Comparator<Integer> comparator = new Comparator<Integer>()
        {
            @Override
            public int compare(Integer a, Integer b)
            {
                return compareKeys(keys[a], keys[b]);
            }
        };

        Arrays.sort(order, comparator);

        int[] ranks = new int[keys.length];

        for(int i = 0; i < order.length; i++)
        {
            if(i > 0 && comparator.compare(order[i - 1], order[i]) == 0)
                ranks[order[i]] = ranks[order[i - 1]];
            else
                ranks[order[i]] = i;
        }

        return ranks;
    }


    /**
     * @return atom indexes sorted by rank, atoms of one class following the lowest index
     */
    private static int[] orderOf(int[] ranks)
    {
        int[] order = new int[ranks.length];
        int[] filled = new int[ranks.length];

        for(int i = 0; i < ranks.length; i++)
            order[ranks[i] + filled[ranks[i]]++] = i;

        return order;
    }


    private static int compareKeys(int[] a, int[] b)
    {
        int length = Math.min(a.length, b.length);

        for(int i = 0; i < length; i++)
            if(a[i] != b[i])
                return Integer.compare(a[i], b[i]);

        return Integer.compare(a.length, b.length);
    }


    private static final Comparator<Entry> byKey = new Comparator<Entry>()
    {
        @Override
        public int compare(Entry a, Entry b)
        {
            return compareKeys(a.key, b.key);
        }
    };


    /**
     * Molecule in index form: atom i of the arrays is the atom with the i-th lowest id.
     */
    private static class Graph
    {
        final int[] ids;
        final Atom[] atoms;
        final Map<Integer, Integer> indexes = new HashMap<Integer, Integer>();
        final int[][] neighbours;
        final int[][] bondValues;
        final DoubleBondStereo[][] stereo;
        final int[][] partners;


        Graph(Molecule molecule)
        {
            ids = molecule.getAtomIds();
            atoms = new Atom[ids.length];

            for(int i = 0; i < ids.length; i++)
            {
                indexes.put(ids[i], i);
                atoms[i] = molecule.getAtom(ids[i]);
            }

            Map<Integer, DoubleBondStereo> stereoBonds = new HashMap<Integer, DoubleBondStereo>();
            List<List<Integer>> partnerLists = new ArrayList<List<Integer>>();

            for(int i = 0; i < ids.length; i++)
                partnerLists.add(new ArrayList<Integer>());

            for(DoubleBondStereo bond : DoubleBondStereo.perceive(molecule))
            {
                stereoBonds.put(bond.getBond().getId(), bond);

                int atom1 = indexes.get(bond.getAtom1());
                int atom2 = indexes.get(bond.getAtom2());
                partnerLists.get(atom1).add(atom2);
                partnerLists.get(atom2).add(atom1);
            }

            neighbours = new int[ids.length][];
            bondValues = new int[ids.length][];
            stereo = new DoubleBondStereo[ids.length][];
            partners = new int[ids.length][];

            for(int i = 0; i < ids.length; i++)
            {
                List<Bond> bonds = molecule.getBonds(ids[i]);
                neighbours[i] = new int[bonds.size()];
                bondValues[i] = new int[bonds.size()];
                stereo[i] = new DoubleBondStereo[bonds.size()];

                for(int j = 0; j < bonds.size(); j++)
                {
                    neighbours[i][j] = indexes.get(bonds.get(j).getOther(ids[i]));
                    bondValues[i][j] = bonds.get(j).getOrder().getValue();
                    stereo[i][j] = stereoBonds.get(bonds.get(j).getId());
                }

                List<Integer> list = partnerLists.get(i);
                partners[i] = new int[list.size()];

                for(int j = 0; j < list.size(); j++)
                    partners[i][j] = list.get(j);
            }
        }


        /**
         * Gives the atom its own class at the start of its current class and refines the partition.
         */
        void individualize(int[] ranks, int[] order, int atom)
        {
            int start = ranks[atom];
            int end = cellEnd(ranks, order, start);

            for(int i = start; i < end; i++)
            {
                if(order[i] == atom)
                {
                    order[i] = order[start];
                    order[start] = atom;
                    break;
                }
            }

            boolean[] dirty = new boolean[ranks.length];

            for(int i = start + 1; i < end; i++)
            {
                ranks[order[i]] = start + 1;
                markNeighbours(order[i], dirty);
            }

            refine(ranks, order, dirty);
        }


        /**
         * Refines the ranks in place until no class splits. Only classes with a dirty member are examined in a
         * round; the other members of such a class share one key.
         */
        void refine(int[] ranks, int[] order, boolean[] dirty)
        {
            int atomCount = ranks.length;

            while(true)
            {
                boolean[] affected = new boolean[atomCount];

                for(int i = 0; i < atomCount; i++)
                    if(dirty[i])
                        affected[ranks[i]] = true;

                List<int[]> arrangements = new ArrayList<int[]>();

                for(int start = 0; start < atomCount; start++)
                {
                    if(!affected[start])
                        continue;

                    int[] arrangement = split(ranks, order, dirty, start);

                    if(arrangement != null)
                        arrangements.add(arrangement);
                }

                boolean[] next = new boolean[atomCount];
                boolean changed = false;

                for(int[] arrangement : arrangements)
                {
                    int start = arrangement[0];
                    int size = (arrangement.length - 1) / 2;

                    for(int i = 0; i < size; i++)
                    {
                        int atom = arrangement[1 + i];
                        int rank = arrangement[1 + size + i];

                        order[start + i] = atom;

                        if(ranks[atom] != rank)
                        {
                            ranks[atom] = rank;
                            markNeighbours(atom, next);
                            changed = true;
                        }
                    }
                }

                if(!changed)
                    return;

                dirty = next;
            }
        }


        /**
         * Computes the split of the class starting at the given position.
         *
         * @return start, atoms in their new order and their new ranks; null if the class does not split
         */
        private int[] split(int[] ranks, int[] order, boolean[] dirty, int start)
        {
            int end = cellEnd(ranks, order, start);

            if(end - start == 1)
                return null;

            List<Entry> entries = new ArrayList<Entry>();
            int[] clean = new int[end - start];
            int cleanCount = 0;

            for(int i = start; i < end; i++)
            {
                int atom = order[i];

                if(dirty[atom])
                    entries.add(new Entry(atom, key(atom, ranks)));
                else
                    clean[cleanCount++] = atom;
            }

            Collections.sort(entries, byKey);

            List<Group> groups = new ArrayList<Group>();

            for(Entry entry : entries)
            {
                Group last = groups.isEmpty() ? null : groups.get(groups.size() - 1);

                if(last == null || compareKeys(last.key, entry.key) != 0)
                {
                    last = new Group(entry.key);
                    groups.add(last);
                }

                last.add(entry.atom);
            }

            if(cleanCount > 0)
            {
                int[] cleanKey = key(clean[0], ranks);
                int position = 0;

                while(position < groups.size() && compareKeys(groups.get(position).key, cleanKey) < 0)
                    position++;

                if(position == groups.size() || compareKeys(groups.get(position).key, cleanKey) != 0)
                    groups.add(position, new Group(cleanKey));

                Group group = groups.get(position);

                for(int i = 0; i < cleanCount; i++)
                    group.add(clean[i]);
            }

            if(groups.size() == 1)
                return null;

            Group largest = groups.get(0);

            for(Group group : groups)
                if(group.count > largest.count)
                    largest = group;

            groups.remove(largest);
            groups.add(0, largest);

            int size = end - start;
            int[] arrangement = new int[1 + 2 * size];
            arrangement[0] = start;

            int position = 0;

            for(Group group : groups)
            {
                int rank = start + position;

                for(int i = 0; i < group.count; i++)
                {
                    arrangement[1 + position] = group.members[i];
                    arrangement[1 + size + position] = rank;
                    position++;
                }
            }

            return arrangement;
        }


        private int[] key(int atom, int[] ranks)
        {
            int[] key = new int[neighbours[atom].length + 2];
            key[0] = ranks[atom];
            key[1] = chiralityCode(atom, ranks);

            for(int j = 0; j < neighbours[atom].length; j++)
                key[j + 2] = ranks[neighbours[atom][j]] * 64 + bondCode(atom, j, ranks);

            Arrays.sort(key, 2, key.length);
            return key;
        }


        /**
         * Writes the atoms in rank order together with their bonds to ranked neighbours. Equal certificates mean
         * equal molecules written in equal order.
         */
        int[] certificate(int[] ranks, int[] order)
        {
            int length = 0;

            for(int i = 0; i < atoms.length; i++)
                length += 8 + neighbours[i].length;

            int[] certificate = new int[length];
            int position = 0;

            for(int atom : order)
            {
                Atom value = atoms[atom];

                certificate[position++] = value.getAtomicNumber();
                certificate[position++] = value.getCharge();
                certificate[position++] = value.getIsotope();
                certificate[position++] = value.isAromatic() ? 1 : 0;
                certificate[position++] = value.getHydrogenCount();
                certificate[position++] = value.getAtomClass();
                certificate[position++] = chiralityCode(atom, ranks);
                certificate[position++] = neighbours[atom].length;

                int begin = position;

                for(int j = 0; j < neighbours[atom].length; j++)
                    certificate[position++] = ranks[neighbours[atom][j]] * 64 + bondCode(atom, j, ranks);

                Arrays.sort(certificate, begin, position);
            }

            return certificate;
        }


        private int bondCode(int atom, int slot, int[] ranks)
        {
            DoubleBondStereo bond = stereo[atom][slot];
            return bondValues[atom][slot] * 4 + (bond == null ? 0 : doubleBondCode(bond, ranks));
        }


        /**
         * @return 1 for cis and 2 for trans lowest ranked substituents, 0 while the substituents of one end are tied
         */
        private int doubleBondCode(DoubleBondStereo bond, int[] ranks)
        {
            int reference1 = lowestRanked(bond.getSubstituents(bond.getAtom1()), ranks);
            int reference2 = lowestRanked(bond.getSubstituents(bond.getAtom2()), ranks);

            if(reference1 == NONE || reference2 == NONE)
                return 0;

            return bond.isTrans(reference1, reference2) ? 2 : 1;
        }


        private int lowestRanked(int[] substituents, int[] ranks)
        {
            if(substituents.length == 1)
                return substituents[0];

            int rank0 = ranks[indexes.get(substituents[0])];
            int rank1 = ranks[indexes.get(substituents[1])];

            if(rank0 == rank1)
                return NONE;

            return rank0 < rank1 ? substituents[0] : substituents[1];
        }


        /**
         * Parity of the stereo centre relative to the ranks of its neighbours, an implicit hydrogen ranking first.
         *
         * @return 1 or 2 for the two tetrahedral or allene configurations, 0 for atoms without a usable centre or with
         *         tied neighbours
         */
        private int chiralityCode(int atom, int[] ranks)
        {
            Atom value = atoms[atom];
            String chirality = value.getChirality();

            if(chirality == null)
                return 0;

            int[] reference = value.getNeighbourOrder();
            int expected = neighbours[atom].length + (value.getHydrogenCount() > 0 ? 1 : 0);

            if(reference.length < 3 || reference.length != expected)
                return 0;

            int[] values = new int[reference.length];

            for(int i = 0; i < reference.length; i++)
            {
                if(reference[i] == Atom.IMPLICIT_HYDROGEN)
                {
                    values[i] = -1;
                }
                else
                {
                    Integer index = indexes.get(reference[i]);

                    if(index == null)
                        return 0;

                    values[i] = ranks[index];
                }
            }

            int inversions = 0;

            for(int i = 0; i < values.length; i++)
            {
                for(int j = i + 1; j < values.length; j++)
                {
                    if(values[i] == values[j])
                        return 0;

                    if(values[i] > values[j])
                        inversions++;
                }
            }

            int base;

            switch(chirality)
            {
                case "@":
                case "@TH1":
                case "@AL1":
                    base = 1;
                    break;
                case "@@":
                case "@TH2":
                case "@AL2":
                    base = 2;
                    break;
                default:
                    // other classes are written as they were read
                    return 3 + (chirality.hashCode() & 0xffff);
            }

            return inversions % 2 == 0 ? base : 3 - base;
        }


        private void markNeighbours(int atom, boolean[] dirty)
        {
            for(int neighbour : neighbours[atom])
            {
                dirty[neighbour] = true;

                for(int partner : partners[neighbour])
                    dirty[partner] = true;
            }
        }


        private static int cellEnd(int[] ranks, int[] order, int start)
        {
            int end = start + 1;

            while(end < order.length && ranks[order[end]] == start)
                end++;

            return end;
        }
    }


    private static class Entry
    {
        final int atom;
        final int[] key;


        Entry(int atom, int[] key)
        {
            this.atom = atom;
            this.key = key;
        }
    }


    private static class Group
    {
        final int[] key;
        int[] members = new int[4];
        int count;


        Group(int[] key)
        {
            this.key = key;
        }


        void add(int atom)
        {
            if(count == members.length)
                members = Arrays.copyOf(members, 2 * count);

            members[count++] = atom;
        }
    }


    private static class Leaf
    {
        final int[] ranks;
        final int[] order;
        final int[] certificate;


        Leaf(int[] ranks, int[] order, int[] certificate)
        {
            this.ranks = ranks;
            this.order = order;
            this.certificate = certificate;
        }
    }


    /**
     * Search tree node: a refined partition with the individualized atoms leading to it.
     */
    private static class Node
    {
        final int[] ranks;
        final int[] order;
        final int[] path;
        final List<Integer> explored = new ArrayList<Integer>();

        int[] candidates;
        int next;

        int[] orbits;
        int orbitAutomorphisms = -1;


        Node(int[] ranks, int[] order, int[] path)
        {
            this.ranks = ranks;
            this.order = order;
            this.path = path;
        }


        /**
         * @return next member of the lowest tied class not equivalent to an explored one, or NONE
         */
        int nextCandidate(List<int[]> automorphisms, boolean exhausted)
        {
            if(candidates == null)
                candidates = lowestTiedClass();

            if(exhausted && !explored.isEmpty())
                return NONE;

            while(next < candidates.length)
            {
                int candidate = candidates[next++];

                if(!isEquivalent(candidate, automorphisms))
                {
                    explored.add(candidate);
                    return candidate;
                }
            }

            return NONE;
        }


        private int[] lowestTiedClass()
        {
            for(int i = 0; i < order.length - 1; i++)
            {
                if(ranks[order[i]] == ranks[order[i + 1]])
                {
                    int end = Graph.cellEnd(ranks, order, i);
                    int[] members = Arrays.copyOfRange(order, i, end);
                    Arrays.sort(members);
                    return members;
                }
            }

            return new int[0];
        }


        private boolean isEquivalent(int candidate, List<int[]> automorphisms)
        {
            if(explored.isEmpty() || automorphisms.isEmpty())
                return false;

            if(orbitAutomorphisms != automorphisms.size())
            {
                orbits = new int[ranks.length];

                for(int i = 0; i < orbits.length; i++)
                    orbits[i] = i;

                for(int[] automorphism : automorphisms)
                    if(fixes(automorphism, path))
                        for(int i = 0; i < automorphism.length; i++)
                            union(orbits, i, automorphism[i]);

                orbitAutomorphisms = automorphisms.size();
            }

            int root = find(orbits, candidate);

            for(int atom : explored)
                if(find(orbits, atom) == root)
                    return true;

            return false;
        }


        private static int find(int[] parents, int atom)
        {
            while(parents[atom] != atom)
            {
                parents[atom] = parents[parents[atom]];
                atom = parents[atom];
            }

            return atom;
        }


        private static void union(int[] parents, int atom1, int atom2)
        {
            int root1 = find(parents, atom1);
            int root2 = find(parents, atom2);

            if(root1 != root2)
                parents[Math.max(root1, root2)] = Math.min(root1, root2);
        }
    }
}

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
package cz.iocb.chemgraph.smiles;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import cz.iocb.chemgraph.canonical.CanonicalResult;
import cz.iocb.chemgraph.canonical.Canonicalizer;
import cz.iocb.chemgraph.molecule.Atom;
import cz.iocb.chemgraph.molecule.AtomicNumbers;
import cz.iocb.chemgraph.molecule.Bond;
import cz.iocb.chemgraph.molecule.BondDirection;
import cz.iocb.chemgraph.molecule.DoubleBondStereo;
import cz.iocb.chemgraph.molecule.Molecule;
import cz.iocb.chemgraph.shared.PerceptionSettings;
import cz.iocb.chemgraph.valence.HydrogenCompletion;
import cz.iocb.chemgraph.valence.ValenceModel;



/**
 * SMILES writer.
 *
 * The first depth-first pass fixes the spanning tree and finds the ring closure bonds, the second pass writes the
 * atoms in the same order. Both passes keep their own stack, so the depth of the tree is not limited by the call
 * stack. Directional single bonds are chosen anew from the configurations of the double bonds. Canonical output starts at the lowest ranked atom and visits neighbours in rank order;
 * otherwise atom ids are used in place of ranks.
 */
public class SmilesGenerator
{
    private static final Logger LOGGER = LogManager.getLogger(SmilesGenerator.class);

    private static final int MAX_RING_NUMBER = 99;
    private static final int NONE = -1;

    private final Canonicalizer canonicalizer;


    public SmilesGenerator()
    {
        this(PerceptionSettings.getDefault());
    }


    public SmilesGenerator(PerceptionSettings settings)
    {
        this.canonicalizer = new Canonicalizer(settings);
    }


    public String generate(Molecule molecule, boolean canonical)
    {
        if(canonical)
            return generate(canonicalizer.canonicalize(molecule));

        Map<Integer, Integer> priorities = new HashMap<Integer, Integer>();
        int[] ids = molecule.getAtomIds();

        for(int i = 0; i < ids.length; i++)
            priorities.put(ids[i], i);

        return generate(molecule, priorities);
    }


    /**
     * Writes the molecule visiting atoms in the order given by a precomputed ranking.
     */
    public String generate(CanonicalResult canonical)
    {
        return normalizeDirections(generate(canonical.getMolecule(), canonical.getRanking()));
    }


    /**
     * Writes several molecules as one dot-separated SMILES. Canonical output sorts the fragments, so the result does
     * not depend on the order of the list.
     */
    public String generate(List<Molecule> molecules, boolean canonical)
    {
        List<String> fragments = new ArrayList<String>(molecules.size());

        for(Molecule molecule : molecules)
            fragments.add(generate(molecule, canonical));

        if(canonical)
            Collections.sort(fragments);

        return String.join(".", fragments);
    }


    /**
     * Flips all directional bonds if the first one is written as '\\'. Flipping every mark keeps the configuration of
     * every double bond.
     */
    private static String normalizeDirections(String smiles)
    {
        for(int i = 0; i < smiles.length(); i++)
        {
            char c = smiles.charAt(i);

            if(c == '/')
                return smiles;

            if(c == '\\')
                break;
        }

        StringBuilder builder = new StringBuilder(smiles.length());

        for(int i = 0; i < smiles.length(); i++)
        {
            char c = smiles.charAt(i);
            builder.append(c == '/' ? '\\' : c == '\\' ? '/' : c);
        }

        return builder.toString();
    }


    private static String generate(Molecule molecule, Map<Integer, Integer> priorities)
    {
        Writer writer = new Writer(molecule, priorities);
        List<Integer> atoms = new ArrayList<Integer>();

        for(Atom atom : molecule.getAtoms())
            atoms.add(atom.getId());

        Collections.sort(atoms, writer.byPriority);

        List<Integer> roots = new ArrayList<Integer>();

        for(int atom : atoms)
        {
            if(writer.visited.contains(atom))
                continue;

            writer.discover(atom);
            roots.add(atom);
        }

        writer.assignDirections();

        StringBuilder builder = new StringBuilder();

        for(int root : roots)
        {
            if(builder.length() > 0)
                builder.append('.');

            writer.write(builder, root);
        }

        return builder.toString();
    }


    private static class Writer
    {
        final Molecule molecule;
        final Map<Integer, Integer> priorities;
        final Comparator<Integer> byPriority;
        final Comparator<Integer> byPreorder;

        final Set<Integer> visited = new HashSet<Integer>();
        final Map<Integer, Integer> preorder = new HashMap<Integer, Integer>();
        final Map<Integer, List<Integer>> children = new HashMap<Integer, List<Integer>>();
        final Map<Integer, List<Bond>> ringBonds = new HashMap<Integer, List<Bond>>();
        final Set<Bond> closures = new HashSet<Bond>();

        // directions of single bonds relative to their atom1 -> atom2 orientation
        final Map<Bond, BondDirection> directions = new HashMap<Bond, BondDirection>();

        final Map<Bond, Integer> openDigits = new HashMap<Bond, Integer>();
        final boolean[] usedDigits = new boolean[MAX_RING_NUMBER + 1];


        Writer(Molecule molecule, Map<Integer, Integer> priorities)
        {
            this.molecule = molecule;
            this.priorities = priorities;
            this.byPriority = new Comparator<Integer>()
            {
                @Override
                public int compare(Integer a, Integer b)
                {
                    return Integer.compare(priorities.get(a), priorities.get(b));
                }
            };
            this.byPreorder = new Comparator<Integer>()
            {
                @Override
                public int compare(Integer a, Integer b)
                {
                    return Integer.compare(preorder.get(a), preorder.get(b));
                }
            };
        }


        /**
         * Builds the spanning tree of the component of the root and collects its ring closure bonds.
         */
        void discover(int root)
        {
            Deque<TreeFrame> stack = new ArrayDeque<TreeFrame>();
            stack.push(enter(root, null));

            while(!stack.isEmpty())
            {
                TreeFrame frame = stack.peek();

                if(frame.next == frame.neighbours.size())
                {
                    stack.pop();
                    continue;
                }

                int neighbour = frame.neighbours.get(frame.next++);
                Bond bond = molecule.getBond(frame.atom, neighbour);

                if(bond == frame.parent)
                    continue;

                if(!visited.contains(neighbour))
                {
                    children.get(frame.atom).add(neighbour);
                    stack.push(enter(neighbour, bond));
                }
                else if(closures.add(bond))
                {
                    ringBonds.get(neighbour).add(bond);
                    ringBonds.get(frame.atom).add(bond);
                }
            }
        }


        private TreeFrame enter(int atom, Bond parent)
        {
            visited.add(atom);
            preorder.put(atom, preorder.size());
            children.put(atom, new ArrayList<Integer>());
            ringBonds.put(atom, new ArrayList<Bond>());

            List<Integer> neighbours = new ArrayList<Integer>();

            for(int neighbour : molecule.getNeighbours(atom))
                neighbours.add(neighbour);

            Collections.sort(neighbours, byPriority);

            return new TreeFrame(atom, parent, neighbours);
        }


        /**
         * Chooses the directional single bonds that express the configuration of every stereo double bond. Double
         * bonds are handled in the order they are written; the first mark of a free double bond is written as '/'
         * and the other marks follow from it.
         */
        void assignDirections()
        {
            List<DoubleBondStereo> bonds = DoubleBondStereo.perceive(molecule);

            Collections.sort(bonds, new Comparator<DoubleBondStereo>()
            {
                @Override
                public int compare(DoubleBondStereo a, DoubleBondStereo b)
                {
                    return Integer.compare(firstPreorder(a), firstPreorder(b));
                }
            });

            for(DoubleBondStereo bond : bonds)
            {
                int first = preorder.get(bond.getAtom1()) < preorder.get(bond.getAtom2()) ? bond.getAtom1() :
                        bond.getAtom2();
                int second = bond.getBond().getOther(first);

                int end = first;
                int anchor = marked(bond, first);

                if(anchor == NONE)
                {
                    end = second;
                    anchor = marked(bond, second);
                }

                if(anchor == NONE)
                {
                    end = first;
                    anchor = substituents(bond, first).get(0);
                    setDirection(molecule.getBond(anchor, end), anchor,
                            preorder.get(anchor) < preorder.get(end) ? BondDirection.UP : BondDirection.DOWN);
                }

                BondDirection anchorDirection = getDirection(molecule.getBond(anchor, end), anchor);
                int other = bond.getBond().getOther(end);
                int target = marked(bond, other);

                if(target == NONE)
                {
                    target = substituents(bond, other).get(0);
                    BondDirection direction = bond.isTrans(anchor, target) ? anchorDirection : anchorDirection.flip();
                    setDirection(molecule.getBond(other, target), other, direction);
                }
                else
                {
                    BondDirection direction = bond.isTrans(anchor, target) ? anchorDirection : anchorDirection.flip();

                    if(getDirection(molecule.getBond(other, target), other) != direction)
                        LOGGER.debug("configuration of double bond " + bond.getBond() + " cannot be written");
                }
            }
        }


        private int firstPreorder(DoubleBondStereo bond)
        {
            return Math.min(preorder.get(bond.getAtom1()), preorder.get(bond.getAtom2()));
        }


        private List<Integer> substituents(DoubleBondStereo bond, int atom)
        {
            List<Integer> list = new ArrayList<Integer>();

            for(int substituent : bond.getSubstituents(atom))
                list.add(substituent);

            Collections.sort(list, byPreorder);
            return list;
        }


        /**
         * @return the first substituent in written order whose bond to the atom already has a direction, or NONE
         */
        private int marked(DoubleBondStereo bond, int atom)
        {
            for(int substituent : substituents(bond, atom))
                if(directions.containsKey(molecule.getBond(atom, substituent)))
                    return substituent;

            return NONE;
        }


        private BondDirection getDirection(Bond bond, int from)
        {
            BondDirection direction = directions.get(bond);

            if(direction == null)
                return null;

            return from == bond.getAtom1() ? direction : direction.flip();
        }


        private void setDirection(Bond bond, int from, BondDirection direction)
        {
            directions.put(bond, from == bond.getAtom1() ? direction : direction.flip());
        }


        /**
         * Writes the component of the root along the spanning tree, every child except the last one as a branch.
         */
        void write(StringBuilder builder, int root)
        {
            Deque<BranchFrame> stack = new ArrayDeque<BranchFrame>();
            stack.push(writeAtom(builder, root, null, false));

            while(!stack.isEmpty())
            {
                BranchFrame frame = stack.peek();
                List<Integer> next = children.get(frame.atom);

                if(frame.next == next.size())
                {
                    stack.pop();

                    if(frame.branch)
                        builder.append(')');

                    continue;
                }

                int child = next.get(frame.next++);
                boolean branch = frame.next < next.size();

                if(branch)
                    builder.append('(');

                stack.push(writeAtom(builder, child, molecule.getBond(frame.atom, child), branch));
            }
        }


        private BranchFrame writeAtom(StringBuilder builder, int atom, Bond parent, boolean branch)
        {
            if(parent != null)
                builder.append(bondSymbol(parent, parent.getOther(atom)));

            List<Bond> rings = orderRingBonds(atom);
            List<Integer> written = new ArrayList<Integer>();
            Atom value = molecule.getAtom(atom);

            if(parent != null)
                written.add(parent.getOther(atom));

            for(Bond bond : rings)
                written.add(bond.getOther(atom));

            written.addAll(children.get(atom));

            builder.append(atomSymbol(value, written, parent != null));

            List<Integer> released = new ArrayList<Integer>();

            for(Bond bond : rings)
            {
                Integer digit = openDigits.remove(bond);

                if(digit != null)
                {
                    builder.append(ringNumber(digit));
                    released.add(digit);
                }
                else
                {
                    digit = allocateDigit();
                    openDigits.put(bond, digit);
                    builder.append(bondSymbol(bond, atom));
                    builder.append(ringNumber(digit));
                }
            }

            for(int digit : released)
                usedDigits[digit] = false;

            return new BranchFrame(atom, branch);
        }


        /**
         * Orders ring bonds of an atom: closures first in the order their rings were opened, openings after them in
         * priority order of the partner atoms.
         */
        private List<Bond> orderRingBonds(final int atom)
        {
            List<Bond> closing = new ArrayList<Bond>();
            List<Bond> opening = new ArrayList<Bond>();

            for(Bond bond : ringBonds.get(atom))
            {
                if(openDigits.containsKey(bond))
                    closing.add(bond);
                else
                    opening.add(bond);
            }

            Collections.sort(closing, new Comparator<Bond>()
            {
                @Override
                public int compare(Bond a, Bond b)
                {
                    return Integer.compare(preorder.get(a.getOther(atom)), preorder.get(b.getOther(atom)));
                }
            });

            Collections.sort(opening, new Comparator<Bond>()
            {
                @Override
                public int compare(Bond a, Bond b)
                {
                    return byPriority.compare(a.getOther(atom), b.getOther(atom));
                }
            });

            closing.addAll(opening);
            return closing;
        }


        private int allocateDigit()
        {
            for(int digit = 1; digit <= MAX_RING_NUMBER; digit++)
            {
                if(!usedDigits[digit])
                {
                    usedDigits[digit] = true;
                    return digit;
                }
            }

            throw new IllegalStateException("more than " + MAX_RING_NUMBER + " rings are open at once");
        }


        private String bondSymbol(Bond bond, int from)
        {
            int to = bond.getOther(from);
            boolean aromaticAtoms = molecule.getAtom(from).isAromatic() && molecule.getAtom(to).isAromatic();

            switch(bond.getOrder())
            {
                case AROMATIC:
                    return aromaticAtoms ? "" : ":";
                case DOUBLE:
                    return "=";
                case TRIPLE:
                    return "#";
                case QUADRUPLE:
                    return "$";
                default:
                    BondDirection direction = getDirection(bond, from);

                    if(direction == BondDirection.UP)
                        return "/";
                    else if(direction == BondDirection.DOWN)
                        return "\\";

                    return aromaticAtoms ? "-" : "";
            }
        }


        private String atomSymbol(Atom atom, List<Integer> written, boolean hasParent)
        {
            String symbol = atom.isAromatic() ? atom.getSymbol().toLowerCase() : atom.getSymbol();
            int hydrogens = atom.getHydrogenCount();

            String chirality = atom.getChirality();

            if(chirality != null)
            {
                if(hydrogens > 0)
                    written.add(hasParent ? 1 : 0, Atom.IMPLICIT_HYDROGEN);

                chirality = orientChirality(atom, written);
            }

            boolean organic = isOrganic(atom);
            int bondOrderSum = molecule.getBondOrderSum(atom.getId());

            boolean bracket = !organic || atom.getIsotope() != 0 || atom.getCharge() != 0 || chirality != null
                    || atom.getAtomClass() != 0
                    || hydrogens != HydrogenCompletion.implicitHydrogens(atom.getAtomicNumber(), atom.isAromatic(),
                            bondOrderSum);

            if(!bracket)
                return symbol;

            StringBuilder builder = new StringBuilder();
            builder.append('[');

            if(atom.getIsotope() != 0)
                builder.append(atom.getIsotope());

            builder.append(symbol);

            if(chirality != null)
                builder.append(chirality);

            if(hydrogens > 0)
                builder.append('H');

            if(hydrogens > 1)
                builder.append(hydrogens);

            if(atom.getCharge() > 0)
                builder.append('+');
            else if(atom.getCharge() < 0)
                builder.append('-');

            if(Math.abs(atom.getCharge()) > 1)
                builder.append(Math.abs(atom.getCharge()));

            if(atom.getAtomClass() != 0)
                builder.append(':').append(atom.getAtomClass());

            builder.append(']');
            return builder.toString();
        }


        /**
         * Re-expresses the chirality marker for the neighbour order of the output.
         *
         * @return the marker valid for the written order, or null if it has to be dropped
         */
        private String orientChirality(Atom atom, List<Integer> written)
        {
            int[] reference = atom.getNeighbourOrder();

            if(written.size() < 3)
            {
                LOGGER.debug("chirality dropped on atom " + atom + " with fewer than three neighbours");
                return null;
            }

            if(reference.length != written.size())
            {
                LOGGER.debug("chirality dropped on atom " + atom + " with an incomplete reference order");
                return null;
            }

            int[] permutation = new int[reference.length];

            for(int i = 0; i < reference.length; i++)
            {
                permutation[i] = written.indexOf(reference[i]);

                if(permutation[i] < 0)
                {
                    LOGGER.debug("chirality dropped on atom " + atom + " with an unknown reference neighbour");
                    return null;
                }
            }

            int inversions = 0;

            for(int i = 0; i < permutation.length; i++)
                for(int j = i + 1; j < permutation.length; j++)
                    if(permutation[i] > permutation[j])
                        inversions++;

            String chirality = atom.getChirality();

            if(inversions % 2 == 0)
                return chirality;

            switch(chirality)
            {
                case "@":
                    return "@@";
                case "@@":
                    return "@";
                case "@TH1":
                    return "@TH2";
                case "@TH2":
                    return "@TH1";
                case "@AL1":
                    return "@AL2";
                case "@AL2":
                    return "@AL1";
                default:
                    return chirality;
            }
        }


        private static boolean isOrganic(Atom atom)
        {
            int number = atom.getAtomicNumber();

            if(number == AtomicNumbers.WILDCARD)
                return true;

            if(atom.isAromatic())
                return ValenceModel.getOrganicValences(number, true) != null;

            return ValenceModel.getOrganicValences(number, false) != null;
        }


        private static String ringNumber(int digit)
        {
            return digit < 10 ? String.valueOf(digit) : "%" + digit;
        }
    }


    private static class TreeFrame
    {
        final int atom;
        final Bond parent;
        final List<Integer> neighbours;
        int next;


        TreeFrame(int atom, Bond parent, List<Integer> neighbours)
        {
            this.atom = atom;
            this.parent = parent;
            this.neighbours = neighbours;
        }
    }


    private static class BranchFrame
    {
        final int atom;
        final boolean branch;
        int next;


        BranchFrame(int atom, boolean branch)
        {
            this.atom = atom;
            this.branch = branch;
        }
    }
}

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
package cz.iocb.chemgraph.kekule;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import cz.iocb.chemgraph.molecule.Atom;
import cz.iocb.chemgraph.molecule.Bond;
import cz.iocb.chemgraph.molecule.BondOrder;
import cz.iocb.chemgraph.molecule.Molecule;
import cz.iocb.chemgraph.molecule.RingInfo;
import cz.iocb.chemgraph.rings.RingPerception;
import cz.iocb.chemgraph.valence.ValenceModel;



/**
 * Assigns alternating single and double bonds to aromatic bonds.
 *
 * An atom on aromatic bonds needs exactly one double bond when it has a spare valence and no double bond yet. The
 * search visits fusion bonds first, then the bonds of every ring in ring order, then the remaining aromatic bonds;
 * each bond is tried as a double bond before a single one. Choices forced by an atom with a single remaining
 * candidate are propagated immediately and every assignment is recorded in a trail used to undo dead ends.
 */
public class Kekulizer
{
    private static final Logger LOGGER = LogManager.getLogger(Kekulizer.class);

    private static final byte UNASSIGNED = 0;
    private static final byte SINGLE = 1;
    private static final byte DOUBLE = 2;

    private final int[] bondAtom1;
    private final int[] bondAtom2;
    private final int[][] atomBonds;
    private final boolean[] needsDouble;
    private final boolean[] matched;
    private final byte[] state;
    private final ArrayDeque<Integer> trail = new ArrayDeque<Integer>();


    private Kekulizer(int atomCount, List<Bond> bonds, Map<Integer, Integer> atomIndexes, boolean[] needsDouble)
    {
        int bondCount = bonds.size();
        this.bondAtom1 = new int[bondCount];
        this.bondAtom2 = new int[bondCount];
        this.needsDouble = needsDouble;
        this.matched = new boolean[atomCount];
        this.state = new byte[bondCount];

        List<List<Integer>> lists = new ArrayList<List<Integer>>(atomCount);

        for(int i = 0; i < atomCount; i++)
            lists.add(new ArrayList<Integer>());

        for(int i = 0; i < bondCount; i++)
        {
            bondAtom1[i] = atomIndexes.get(bonds.get(i).getAtom1());
            bondAtom2[i] = atomIndexes.get(bonds.get(i).getAtom2());
            lists.get(bondAtom1[i]).add(i);
            lists.get(bondAtom2[i]).add(i);
        }

        this.atomBonds = new int[atomCount][];

        for(int i = 0; i < atomCount; i++)
        {
            atomBonds[i] = new int[lists.get(i).size()];

            for(int j = 0; j < atomBonds[i].length; j++)
                atomBonds[i][j] = lists.get(i).get(j);
        }
    }


    /**
     * Kekulizes the molecule. A molecule without aromatic bonds is returned unchanged.
     *
     * @param molecule molecule with aromatic bonds
     * @return molecule with only single and double bonds in place of the aromatic ones and no aromatic atom flags
     * @throws KekulizationException if no assignment satisfies every atom
     */
    public static Molecule kekulize(Molecule molecule) throws KekulizationException
    {
        if(!molecule.hasAromaticBonds())
            return molecule;

        RingInfo ringInfo = molecule.getRingInfo();

        if(ringInfo == null)
            ringInfo = RingPerception.perceiveRings(molecule);

        List<Bond> order = orderBonds(molecule, ringInfo);

        Map<Integer, Integer> atomIndexes = new HashMap<Integer, Integer>();
        List<Atom> atoms = new ArrayList<Atom>();

        for(Bond bond : order)
        {
            for(int id : new int[] { bond.getAtom1(), bond.getAtom2() })
            {
                if(!atomIndexes.containsKey(id))
                {
                    atomIndexes.put(id, atoms.size());
                    atoms.add(molecule.getAtom(id));
                }
            }
        }

        boolean[] needsDouble = new boolean[atoms.size()];

        for(int i = 0; i < atoms.size(); i++)
            needsDouble[i] = needsDoubleBond(molecule, atoms.get(i));

        Kekulizer kekulizer = new Kekulizer(atoms.size(), order, atomIndexes, needsDouble);

        for(int i = 0; i < atoms.size(); i++)
        {
            if(!kekulizer.check(i))
                throw failure(atoms.get(i));
        }

        if(!kekulizer.search(0))
            throw failure(atoms.get(0));


        Map<Integer, BondOrder> assigned = new HashMap<Integer, BondOrder>();

        for(int i = 0; i < order.size(); i++)
            assigned.put(order.get(i).getId(), kekulizer.state[i] == DOUBLE ? BondOrder.DOUBLE : BondOrder.SINGLE);

        List<Bond> bonds = new ArrayList<Bond>(molecule.getBondCount());

        for(Bond bond : molecule.getBonds())
        {
            BondOrder value = assigned.get(bond.getId());
            bonds.add(value == null ? bond : bond.withOrder(value));
        }

        List<Atom> newAtoms = new ArrayList<Atom>(molecule.getAtomCount());

        for(Atom atom : molecule.getAtoms())
            newAtoms.add(atom.withAromatic(false));

        return molecule.with(newAtoms, bonds);
    }


    /**
     * Kekulizes the molecule without throwing.
     */
    public static KekulizationResult tryKekulize(Molecule molecule)
    {
        try
        {
            return KekulizationResult.success(kekulize(molecule));
        }
        catch(KekulizationException e)
        {
            LOGGER.debug("kekulization failed: " + e.getMessage());
            return KekulizationResult.failure(e.getMessage());
        }
    }


    static boolean needsDoubleBond(Molecule molecule, Atom atom)
    {
        for(Bond bond : molecule.getBonds(atom.getId()))
            if(bond.getOrder() == BondOrder.DOUBLE)
                return false;

        return ValenceModel.getSpareValence(molecule, atom) >= 1;
    }


    private static List<Bond> orderBonds(Molecule molecule, RingInfo ringInfo)
    {
        Set<Bond> ordered = new LinkedHashSet<Bond>();

        for(Bond bond : molecule.getBonds())
            if(bond.isAromatic() && ringInfo.getBondRingCount(bond.getId()) > 1)
                ordered.add(bond);

        for(int ring = 0; ring < ringInfo.getRingCount(); ring++)
        {
            for(int id : ringInfo.getRingBonds(ring))
            {
                Bond bond = molecule.getBondById(id);

                if(bond.isAromatic())
                    ordered.add(bond);
            }
        }

        for(Bond bond : molecule.getBonds())
            if(bond.isAromatic())
                ordered.add(bond);

        return new ArrayList<Bond>(ordered);
    }


    private static KekulizationException failure(Atom atom)
    {
        return new KekulizationException(
                "no alternating single/double bond assignment exists for the aromatic system of atom " + atom,
                atom.getId());
    }


    private boolean isOpen(int atom)
    {
        return needsDouble[atom] && !matched[atom];
    }


    private boolean set(int bond, byte value)
    {
        if(state[bond] != UNASSIGNED)
            return state[bond] == value;

        int atom1 = bondAtom1[bond];
        int atom2 = bondAtom2[bond];

        if(value == DOUBLE && (!isOpen(atom1) || !isOpen(atom2)))
            return false;

        state[bond] = value;
        trail.push(bond);

        if(value == DOUBLE)
        {
            matched[atom1] = true;
            matched[atom2] = true;

            for(int atom : new int[] { atom1, atom2 })
                for(int other : atomBonds[atom])
                    if(state[other] == UNASSIGNED && !set(other, SINGLE))
                        return false;

            return true;
        }

        return check(atom1) && check(atom2);
    }


    /**
     * Verifies that an atom still needing a double bond has a candidate bond left, forcing it if there is just one.
     */
    private boolean check(int atom)
    {
        if(!isOpen(atom))
            return true;

        int candidate = -1;
        int count = 0;

        for(int bond : atomBonds[atom])
        {
            int other = bondAtom1[bond] == atom ? bondAtom2[bond] : bondAtom1[bond];

            if(state[bond] == UNASSIGNED && isOpen(other))
            {
                candidate = bond;
                count++;
            }
        }

        if(count == 0)
            return false;

        if(count == 1)
            return set(candidate, DOUBLE);

        return true;
    }


    private void undo(int mark)
    {
        while(trail.size() > mark)
        {
            int bond = trail.pop();

            if(state[bond] == DOUBLE)
            {
                matched[bondAtom1[bond]] = false;
                matched[bondAtom2[bond]] = false;
            }

            state[bond] = UNASSIGNED;
        }
    }


    private boolean search(int position)
    {
        while(position < state.length && state[position] != UNASSIGNED)
            position++;

        if(position == state.length)
        {
            for(int atom = 0; atom < needsDouble.length; atom++)
                if(isOpen(atom))
                    return false;

            return true;
        }

        int mark = trail.size();

        if(isOpen(bondAtom1[position]) && isOpen(bondAtom2[position]))
        {
            if(set(position, DOUBLE) && search(position + 1))
                return true;

            undo(mark);
        }

        if(set(position, SINGLE) && search(position + 1))
            return true;

        undo(mark);
        return false;
    }
}

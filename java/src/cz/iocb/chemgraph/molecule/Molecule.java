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
package cz.iocb.chemgraph.molecule;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;



/**
 * Immutable molecular graph. Every derivation (ring perception, aromaticity perception, kekulization) returns a new
 * instance; the identity of an instance is therefore a valid key for memoized derived values.
 */
public class Molecule
{
    private final List<Atom> atoms;
    private final List<Bond> bonds;
    private final RingInfo ringInfo;

    private final Map<Integer, Atom> atomMap = new LinkedHashMap<Integer, Atom>();
    private final Map<Integer, Bond> bondMap = new LinkedHashMap<Integer, Bond>();
    private final Map<Integer, List<Bond>> atomBonds = new HashMap<Integer, List<Bond>>();
    private final Map<Long, Bond> pairMap = new HashMap<Long, Bond>();


    public Molecule(List<Atom> atoms, List<Bond> bonds)
    {
        this(atoms, bonds, null);
    }


    public Molecule(List<Atom> atoms, List<Bond> bonds, RingInfo ringInfo)
    {
        this.atoms = Collections.unmodifiableList(new ArrayList<Atom>(atoms));
        this.bonds = Collections.unmodifiableList(new ArrayList<Bond>(bonds));
        this.ringInfo = ringInfo;

        for(Atom atom : atoms)
        {
            if(atomMap.put(atom.getId(), atom) != null)
                throw new IllegalArgumentException("duplicate atom id " + atom.getId());

            atomBonds.put(atom.getId(), new ArrayList<Bond>());
        }

        for(Bond bond : bonds)
        {
            if(!atomMap.containsKey(bond.getAtom1()) || !atomMap.containsKey(bond.getAtom2()))
                throw new IllegalArgumentException("bond " + bond.getId() + " references an unknown atom");

            if(bondMap.put(bond.getId(), bond) != null)
                throw new IllegalArgumentException("duplicate bond id " + bond.getId());

            if(pairMap.put(pairKey(bond.getAtom1(), bond.getAtom2()), bond) != null)
                throw new IllegalArgumentException(
                        "atoms " + bond.getAtom1() + " and " + bond.getAtom2() + " are bonded twice");

            atomBonds.get(bond.getAtom1()).add(bond);
            atomBonds.get(bond.getAtom2()).add(bond);
        }
    }


    /**
     * Returns a copy with the given ring information attached and the ring ids of atoms and bonds filled in.
     */
    public Molecule withRingInfo(RingInfo ringInfo)
    {
        List<Atom> newAtoms = new ArrayList<Atom>(atoms.size());
        List<Bond> newBonds = new ArrayList<Bond>(bonds.size());

        for(Atom atom : atoms)
            newAtoms.add(atom.withRingIds(ringInfo.getAtomRings(atom.getId())));

        for(Bond bond : bonds)
            newBonds.add(bond.withRingIds(ringInfo.getBondRings(bond.getId())));

        return new Molecule(newAtoms, newBonds, ringInfo);
    }


    /**
     * Returns a copy with the atoms and bonds replaced; ring information is kept because the graph topology is
     * assumed to be unchanged.
     */
    public Molecule with(List<Atom> atoms, List<Bond> bonds)
    {
        return new Molecule(atoms, bonds, ringInfo);
    }


    public List<Atom> getAtoms()
    {
        return atoms;
    }


    public List<Bond> getBonds()
    {
        return bonds;
    }


    public int getAtomCount()
    {
        return atoms.size();
    }


    public int getBondCount()
    {
        return bonds.size();
    }


    public boolean containsAtom(int id)
    {
        return atomMap.containsKey(id);
    }


    public Atom getAtom(int id)
    {
        Atom atom = atomMap.get(id);

        if(atom == null)
            throw new IllegalArgumentException("unknown atom id " + id);

        return atom;
    }


    public Bond getBondById(int id)
    {
        Bond bond = bondMap.get(id);

        if(bond == null)
            throw new IllegalArgumentException("unknown bond id " + id);

        return bond;
    }


    /**
     * @return the bond between the two atoms, or null if they are not bonded
     */
    public Bond getBond(int atom1, int atom2)
    {
        return pairMap.get(pairKey(atom1, atom2));
    }


    public List<Bond> getBonds(int atom)
    {
        List<Bond> list = atomBonds.get(atom);

        if(list == null)
            throw new IllegalArgumentException("unknown atom id " + atom);

        return Collections.unmodifiableList(list);
    }


    public int[] getNeighbours(int atom)
    {
        List<Bond> list = getBonds(atom);
        int[] neighbours = new int[list.size()];

        for(int i = 0; i < neighbours.length; i++)
            neighbours[i] = list.get(i).getOther(atom);

        return neighbours;
    }


    public int getDegree(int atom)
    {
        return getBonds(atom).size();
    }


    /**
     * @return sum of bond valences of the atom, aromatic bonds counting as one
     */
    public int getBondOrderSum(int atom)
    {
        int sum = 0;

        for(Bond bond : getBonds(atom))
            sum += bond.getOrder().getValence();

        return sum;
    }


    public boolean hasAromaticBonds()
    {
        for(Bond bond : bonds)
            if(bond.isAromatic())
                return true;

        return false;
    }


    /**
     * @return ring information, or null if rings have not been perceived yet
     */
    public RingInfo getRingInfo()
    {
        return ringInfo;
    }


    /**
     * @return atom ids sorted in ascending order
     */
    public int[] getAtomIds()
    {
        int[] ids = new int[atoms.size()];

        for(int i = 0; i < ids.length; i++)
            ids[i] = atoms.get(i).getId();

        Arrays.sort(ids);
        return ids;
    }


    private static long pairKey(int atom1, int atom2)
    {
        long low = Math.min(atom1, atom2);
        long high = Math.max(atom1, atom2);
        return (high << 32) | (low & 0xffffffffL);
    }


    @Override
    public String toString()
    {
        return "Molecule" + atoms + bonds;
    }
}

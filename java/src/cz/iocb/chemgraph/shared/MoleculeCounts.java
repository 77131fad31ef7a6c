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
package cz.iocb.chemgraph.shared;

import java.util.Map;
import java.util.TreeMap;
import cz.iocb.chemgraph.molecule.Atom;
import cz.iocb.chemgraph.molecule.Molecule;



/**
 * Class to counting elements and hydrogens in a given molecule
 */
public class MoleculeCounts
{
    private final Map<String, Integer> elementCounts = new TreeMap<String, Integer>();
    private int hydrogenCount;


    public MoleculeCounts(Molecule molecule)
    {
        for(Atom atom : molecule.getAtoms())
        {
            String symbol = atom.getSymbol();

            elementCounts.merge(symbol, 1, Integer::sum);
            hydrogenCount += atom.getHydrogenCount();

            if(symbol.equals("H"))
                hydrogenCount++;
        }
    }


    /**
     * @return number of atoms of every element symbol, hydrogens attached to other atoms not included
     */
    public Map<String, Integer> getElementCounts()
    {
        return new TreeMap<String, Integer>(elementCounts);
    }


    /**
     * @return number of hydrogens, both attached and written as atoms
     */
    public int getHydrogenCount()
    {
        return hydrogenCount;
    }


    /**
     * Compares the element multisets and the total hydrogen counts of two molecules.
     */
    public boolean hasSameComposition(MoleculeCounts other)
    {
        return elementCounts.equals(other.elementCounts) && hydrogenCount == other.hydrogenCount;
    }
}

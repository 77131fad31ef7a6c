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
package cz.iocb.chemgraph.aromaticity;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import cz.iocb.chemgraph.aromaticity.PiElectronRule.Ring;
import cz.iocb.chemgraph.kekule.KekulizationException;
import cz.iocb.chemgraph.kekule.Kekulizer;
import cz.iocb.chemgraph.molecule.Atom;
import cz.iocb.chemgraph.molecule.Bond;
import cz.iocb.chemgraph.molecule.BondOrder;
import cz.iocb.chemgraph.molecule.Molecule;
import cz.iocb.chemgraph.molecule.RingInfo;
import cz.iocb.chemgraph.rings.RingPerception;
import cz.iocb.chemgraph.shared.PerceptionSettings;



/**
 * Hückel aromaticity perception on the smallest set of smallest rings.
 *
 * Every ring within the configured size range is tested on its own: it is aromatic when no atom disrupts the
 * conjugation and the donated pi electrons count 4n + 2. Two ortho-fused rings that both fail are tested once more
 * on their common perimeter, which covers systems like azulene.
 */
public class AromaticityPerceiver
{
    private static final Logger LOGGER = LogManager.getLogger(AromaticityPerceiver.class);

    private final int minRingSize;
    private final int maxRingSize;


    public AromaticityPerceiver(PerceptionSettings settings)
    {
        this(settings.getMinAromaticRingSize(), settings.getMaxAromaticRingSize());
    }


    public AromaticityPerceiver(int minRingSize, int maxRingSize)
    {
        this.minRingSize = minRingSize;
        this.maxRingSize = maxRingSize;
    }


    /**
     * Perceives aromaticity. Aromatic bonds of the input are first resolved to a Kekulé structure, so lowercase
     * input alone never makes a ring aromatic.
     *
     * @param molecule molecule in Kekulé or aromatic form
     * @param ringInfo rings of the molecule, perceived when null
     * @return molecule whose atoms and bonds of aromatic rings are flagged aromatic and nothing else is
     */
    public Molecule perceiveAromaticity(Molecule molecule, RingInfo ringInfo)
    {
        if(ringInfo == null)
            ringInfo = molecule.getRingInfo() != null ? molecule.getRingInfo() : RingPerception.perceiveRings(molecule);

        if(molecule.getRingInfo() != ringInfo)
            molecule = molecule.withRingInfo(ringInfo);

        if(molecule.hasAromaticBonds())
        {
            try
            {
                molecule = Kekulizer.kekulize(molecule);
            }
            catch(KekulizationException e)
            {
                LOGGER.warn("aromatic bonds kept without Kekulé structure: " + e.getMessage());
            }
        }


        int ringCount = ringInfo.getRingCount();
        boolean[] candidate = new boolean[ringCount];
        boolean[] aromatic = new boolean[ringCount];

        for(int i = 0; i < ringCount; i++)
        {
            int size = ringInfo.getRingSize(i);
            candidate[i] = size >= minRingSize && size <= maxRingSize;

            if(candidate[i])
                aromatic[i] = isAromatic(molecule, ringInfo, toSet(ringInfo.getRingAtoms(i)));
        }

        Set<Integer> aromaticAtoms = new HashSet<Integer>();
        Set<Integer> aromaticBonds = new HashSet<Integer>();

        for(int i = 0; i < ringCount; i++)
            if(aromatic[i])
                mark(ringInfo, i, aromaticAtoms, aromaticBonds);

        for(int i = 0; i < ringCount; i++)
        {
            if(!candidate[i] || aromatic[i])
                continue;

            for(int j = i + 1; j < ringCount; j++)
            {
                if(!candidate[j] || aromatic[j] || sharedBondCount(ringInfo, i, j) != 1)
                    continue;

                Set<Integer> perimeter = toSet(ringInfo.getRingAtoms(i));
                perimeter.addAll(toSet(ringInfo.getRingAtoms(j)));

                if(isAromatic(molecule, ringInfo, perimeter))
                {
                    LOGGER.debug("rings " + i + " and " + j + " are aromatic as a fused system");
                    mark(ringInfo, i, aromaticAtoms, aromaticBonds);
                    mark(ringInfo, j, aromaticAtoms, aromaticBonds);
                }
            }
        }


        List<Atom> atoms = new ArrayList<Atom>(molecule.getAtomCount());
        List<Bond> bonds = new ArrayList<Bond>(molecule.getBondCount());

        for(Atom atom : molecule.getAtoms())
            atoms.add(atom.withAromatic(aromaticAtoms.contains(atom.getId())));

        for(Bond bond : molecule.getBonds())
        {
            if(aromaticBonds.contains(bond.getId()))
            {
                bonds.add(bond.withOrder(BondOrder.AROMATIC));
            }
            else if(bond.isAromatic())
            {
                LOGGER.warn("bond " + bond + " outside aromatic rings is treated as single");
                bonds.add(bond.withOrder(BondOrder.SINGLE));
            }
            else
            {
                bonds.add(bond);
            }
        }

        return molecule.with(atoms, bonds);
    }


    private static boolean isAromatic(Molecule molecule, RingInfo ringInfo, Set<Integer> ringAtoms)
    {
        Ring ring = new Ring(molecule, ringInfo, ringAtoms);
        int electrons = 0;

        for(int id : ringAtoms)
        {
            int contribution = PiElectronRule.contribution(ring, molecule.getAtom(id));

            if(contribution == PiElectronRule.DISRUPTED)
                return false;

            electrons += contribution;
        }

        return isHuckel(electrons);
    }


    /**
     * @return true if the electron count is 4n + 2 for some n >= 0
     */
    static boolean isHuckel(int electrons)
    {
        return electrons >= 2 && (electrons - 2) % 4 == 0;
    }


    private static void mark(RingInfo ringInfo, int ring, Set<Integer> atoms, Set<Integer> bonds)
    {
        for(int atom : ringInfo.getRingAtoms(ring))
            atoms.add(atom);

        for(int bond : ringInfo.getRingBonds(ring))
            bonds.add(bond);
    }


    private static int sharedBondCount(RingInfo ringInfo, int ring1, int ring2)
    {
        Set<Integer> bonds = toSet(ringInfo.getRingBonds(ring1));
        int count = 0;

        for(int bond : ringInfo.getRingBonds(ring2))
            if(bonds.contains(bond))
                count++;

        return count;
    }


    private static Set<Integer> toSet(int[] values)
    {
        Set<Integer> set = new HashSet<Integer>();

        for(int value : values)
            set.add(value);

        return set;
    }
}

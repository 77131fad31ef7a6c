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

import java.util.List;
import cz.iocb.chemgraph.aromaticity.AromaticityPerceiver;
import cz.iocb.chemgraph.canonical.CanonicalResult;
import cz.iocb.chemgraph.canonical.Canonicalizer;
import cz.iocb.chemgraph.kekule.KekulizationResult;
import cz.iocb.chemgraph.kekule.Kekulizer;
import cz.iocb.chemgraph.molecule.Molecule;
import cz.iocb.chemgraph.molecule.RingInfo;
import cz.iocb.chemgraph.rings.RingPerception;
import cz.iocb.chemgraph.smiles.ParseError;
import cz.iocb.chemgraph.smiles.ParseResult;
import cz.iocb.chemgraph.smiles.SmilesException;
import cz.iocb.chemgraph.smiles.SmilesGenerator;
import cz.iocb.chemgraph.smiles.SmilesParser;



/**
 * Class for creating molecules and deriving their structural information with the default settings
 */
public class MoleculeCreator
{
    public static ParseResult parse(String smiles)
    {
        return new SmilesParser(PerceptionSettings.getDefault()).parse(smiles);
    }


    /**
     * Parses a SMILES string that must not contain any fatal error.
     *
     * @param smiles SMILES string
     * @return molecules of all fragments
     * @throws SmilesException describing the first fatal error
     */
    public static List<Molecule> getMoleculesFromSmiles(String smiles) throws SmilesException
    {
        ParseResult result = parse(smiles);

        for(ParseError error : result.getErrors())
            if(error.isFatal())
                throw new SmilesException(error.getKind(), error.getMessage(), error.getPosition());

        return result.getMolecules();
    }


    public static String generate(Molecule molecule)
    {
        return generate(molecule, true);
    }


    public static String generate(Molecule molecule, boolean canonical)
    {
        return new SmilesGenerator(PerceptionSettings.getDefault()).generate(molecule, canonical);
    }


    public static String generate(List<Molecule> molecules, boolean canonical)
    {
        return new SmilesGenerator(PerceptionSettings.getDefault()).generate(molecules, canonical);
    }


    public static String canonicalSmiles(String smiles) throws SmilesException
    {
        return generate(getMoleculesFromSmiles(smiles), true);
    }


    public static RingInfo perceiveRings(Molecule molecule)
    {
        return RingPerception.perceiveRings(molecule);
    }


    public static Molecule perceiveAromaticity(Molecule molecule, RingInfo ringInfo)
    {
        return new AromaticityPerceiver(PerceptionSettings.getDefault()).perceiveAromaticity(molecule, ringInfo);
    }


    public static KekulizationResult kekulize(Molecule molecule)
    {
        return Kekulizer.tryKekulize(molecule);
    }


    public static CanonicalResult canonicalize(Molecule molecule)
    {
        return new Canonicalizer(PerceptionSettings.getDefault()).canonicalize(molecule);
    }
}

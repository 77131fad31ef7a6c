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
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import cz.iocb.chemgraph.aromaticity.AromaticityPerceiver;
import cz.iocb.chemgraph.kekule.KekulizationException;
import cz.iocb.chemgraph.kekule.Kekulizer;
import cz.iocb.chemgraph.molecule.Atom;
import cz.iocb.chemgraph.molecule.Bond;
import cz.iocb.chemgraph.molecule.BondDirection;
import cz.iocb.chemgraph.molecule.BondOrder;
import cz.iocb.chemgraph.molecule.Molecule;
import cz.iocb.chemgraph.molecule.MoleculeBuilder;
import cz.iocb.chemgraph.rings.RingPerception;
import cz.iocb.chemgraph.shared.PerceptionSettings;
import cz.iocb.chemgraph.smiles.BracketAtomParser.BracketAtom;
import cz.iocb.chemgraph.valence.HydrogenCompletion;



/**
 * SMILES parser. Every dot-separated fragment becomes its own molecule; errors are collected per fragment and a
 * fragment with a fatal error is dropped without affecting its siblings. Returned molecules carry their rings and
 * perceived aromaticity.
 */
public class SmilesParser
{
    private static final Logger LOGGER = LogManager.getLogger(SmilesParser.class);

    private static final int RING_PLACEHOLDER = Integer.MIN_VALUE;


    private static class AtomDraft
    {
        int id;
        int position;
        String symbol;
        int atomicNumber;
        int charge;
        int isotope;
        int hydrogenCount;
        boolean aromatic;
        String chirality;
        int atomClass;
        boolean bracket;
        List<Integer> neighbourOrder = new ArrayList<Integer>();
    }


    private static class RingOpening
    {
        final AtomDraft atom;
        final char bond;
        final int slot;
        final int position;

        RingOpening(AtomDraft atom, char bond, int slot, int position)
        {
            this.atom = atom;
            this.bond = bond;
            this.slot = slot;
            this.position = position;
        }
    }


    private final AromaticityPerceiver perceiver;


    public SmilesParser()
    {
        this(PerceptionSettings.getDefault());
    }


    public SmilesParser(PerceptionSettings settings)
    {
        this.perceiver = new AromaticityPerceiver(settings);
    }


    public ParseResult parse(String smiles)
    {
        if(smiles == null)
            throw new IllegalArgumentException("smiles is null");

        // anything after the first whitespace is a title
        int end = 0;

        while(end < smiles.length() && !Character.isWhitespace(smiles.charAt(end)))
            end++;

        String text = smiles.substring(0, end);

        List<Molecule> molecules = new ArrayList<Molecule>();
        List<ParseError> errors = new ArrayList<ParseError>();
        int[] counters = new int[2];
        int fragment = 0;
        int start = 0;

        while(start <= text.length())
        {
            int dot = text.indexOf('.', start);
            int stop = dot < 0 ? text.length() : dot;

            if(stop > start)
            {
                Molecule molecule = parseFragment(text.substring(start, stop), start, fragment, counters, errors);

                if(molecule != null)
                    molecules.add(molecule);

                fragment++;
            }

            start = stop + 1;
        }

        for(ParseError error : errors)
            LOGGER.debug("smiles " + text + ": " + error);

        return new ParseResult(molecules, errors);
    }


    private Molecule parseFragment(String text, int offset, int fragment, int[] counters, List<ParseError> errors)
    {
        List<AtomDraft> drafts = new ArrayList<AtomDraft>();
        List<Bond> bonds = new ArrayList<Bond>();

        try
        {
            List<Token> tokens = new SmilesTokenizer(text, offset).tokenize();

            if(!buildGraph(tokens, drafts, bonds, counters, fragment, offset + text.length(), errors))
                return null;
        }
        catch(SmilesException e)
        {
            errors.add(new ParseError(e.getKind(), e.getMessage(), e.getPosition(), fragment, true));
            return null;
        }


        Map<Integer, Integer> positions = new HashMap<Integer, Integer>();
        List<Atom> atoms = new ArrayList<Atom>(drafts.size());

        for(AtomDraft draft : drafts)
        {
            if(draft.chirality != null && draft.neighbourOrder.size() < 3)
            {
                LOGGER.debug("chirality dropped on atom " + draft.id + " with " + draft.neighbourOrder.size()
                        + " neighbours");
                draft.chirality = null;
            }

            int[] order = null;

            if(draft.chirality != null)
            {
                order = new int[draft.neighbourOrder.size()];

                for(int i = 0; i < order.length; i++)
                    order[i] = draft.neighbourOrder.get(i);
            }

            positions.put(draft.id, draft.position);
            atoms.add(new Atom(draft.id, draft.symbol, draft.atomicNumber, draft.charge, draft.isotope,
                    draft.hydrogenCount, draft.aromatic, draft.chirality, draft.atomClass, draft.bracket, true, null,
                    order));
        }

        Molecule molecule = HydrogenCompletion.completeHydrogens(new Molecule(atoms, bonds));
        molecule = RingPerception.withRings(molecule);

        try
        {
            molecule = Kekulizer.kekulize(molecule);
        }
        catch(KekulizationException e)
        {
            Integer position = positions.get(e.getAtom());
            errors.add(new ParseError(ErrorKind.KEKULIZATION, e.getMessage(), position == null ? offset : position,
                    fragment, true));
            return null;
        }

        molecule = HydrogenCompletion.validateValences(molecule);

        for(Atom atom : molecule.getAtoms())
            if(!atom.isValenceValid())
                errors.add(new ParseError(ErrorKind.VALENCE, "atom " + atom.getSymbol() + " exceeds its valence",
                        positions.get(atom.getId()), fragment, false));

        return perceiver.perceiveAromaticity(molecule, molecule.getRingInfo());
    }


    /**
     * Builds atoms and bonds from the tokens of one fragment.
     *
     * @return false if the fragment contains an unclosed ring, which is reported for every open ring number
     */
    private static boolean buildGraph(List<Token> tokens, List<AtomDraft> drafts, List<Bond> bonds, int[] counters,
            int fragment, int end, List<ParseError> errors) throws SmilesException
    {
        ArrayDeque<AtomDraft> branches = new ArrayDeque<AtomDraft>();
        Map<Integer, RingOpening> rings = new TreeMap<Integer, RingOpening>();
        Map<Long, Bond> pairs = new HashMap<Long, Bond>();

        AtomDraft previous = null;
        Token pendingBond = null;
        Token last = null;

        for(Token token : tokens)
        {
            switch(token.type)
            {
                case ATOM:
                case BRACKET_ATOM:
                    AtomDraft atom = createAtom(token, counters);

                    if(previous != null)
                    {
                        addBond(previous, atom, bondSymbol(pendingBond), bonds, pairs, counters, token.position);
                        previous.neighbourOrder.add(atom.id);
                        atom.neighbourOrder.add(previous.id);
                    }
                    else if(pendingBond != null)
                    {
                        throw new SmilesException(ErrorKind.SYNTAX, "bond without a preceding atom",
                                pendingBond.position);
                    }

                    if(atom.bracket && atom.hydrogenCount > 0)
                        atom.neighbourOrder.add(Atom.IMPLICIT_HYDROGEN);

                    drafts.add(atom);
                    previous = atom;
                    pendingBond = null;
                    break;

                case BOND:
                    if(previous == null)
                        throw new SmilesException(ErrorKind.SYNTAX, "bond without a preceding atom", token.position);

                    if(pendingBond != null)
                        throw new SmilesException(ErrorKind.SYNTAX, "two consecutive bond symbols", token.position);

                    pendingBond = token;
                    break;

                case BRANCH_OPEN:
                    if(previous == null)
                        throw new SmilesException(ErrorKind.SYNTAX, "branch without a preceding atom",
                                token.position);

                    if(pendingBond != null)
                        throw new SmilesException(ErrorKind.SYNTAX, "bond symbol before a branch",
                                pendingBond.position);

                    branches.push(previous);
                    break;

                case BRANCH_CLOSE:
                    if(branches.isEmpty())
                        throw new SmilesException(ErrorKind.SYNTAX, "unmatched ')'", token.position);

                    if(pendingBond != null)
                        throw new SmilesException(ErrorKind.SYNTAX, "bond symbol at the end of a branch",
                                pendingBond.position);

                    if(last != null && last.type == TokenType.BRANCH_OPEN)
                        throw new SmilesException(ErrorKind.SYNTAX, "empty branch", token.position);

                    previous = branches.pop();
                    break;

                case RING_CLOSURE:
                    if(previous == null)
                        throw new SmilesException(ErrorKind.SYNTAX, "ring closure without a preceding atom",
                                token.position);

                    int number = token.getRingNumber();
                    RingOpening opening = rings.remove(number);

                    if(opening == null)
                    {
                        rings.put(number, new RingOpening(previous, bondSymbol(pendingBond),
                                previous.neighbourOrder.size(), token.position));
                        previous.neighbourOrder.add(RING_PLACEHOLDER);
                    }
                    else
                    {
                        closeRing(opening, previous, bondSymbol(pendingBond), number, bonds, pairs, counters,
                                token.position);
                    }

                    pendingBond = null;
                    break;
            }

            last = token;
        }

        if(pendingBond != null)
            throw new SmilesException(ErrorKind.SYNTAX, "bond symbol at the end of the fragment", pendingBond.position);

        if(!branches.isEmpty())
            throw new SmilesException(ErrorKind.SYNTAX, "unclosed branch", end);

        if(drafts.isEmpty())
            throw new SmilesException(ErrorKind.SYNTAX, "fragment contains no atom", end);

        for(Map.Entry<Integer, RingOpening> entry : rings.entrySet())
            errors.add(new ParseError(ErrorKind.RING_CLOSURE, "ring closure " + entry.getKey() + " is not closed",
                    entry.getValue().position, fragment, true));

        return rings.isEmpty();
    }


    private static void closeRing(RingOpening opening, AtomDraft closing, char closingBond, int number,
            List<Bond> bonds, Map<Long, Bond> pairs, int[] counters, int position) throws SmilesException
    {
        if(opening.atom == closing)
            throw new SmilesException(ErrorKind.RING_CLOSURE, "ring closure " + number + " closes on the same atom",
                    position);

        if(pairs.containsKey(pairKey(opening.atom.id, closing.id)))
            throw new SmilesException(ErrorKind.RING_CLOSURE,
                    "ring closure " + number + " duplicates an existing bond", position);

        char openingBond = opening.bond;

        if(openingBond != 0 && closingBond != 0 && openingBond != closingBond && !(isDirectional(openingBond)
                && isDirectional(closingBond)))
            throw new SmilesException(ErrorKind.RING_CLOSURE,
                    "ring closure " + number + " has conflicting bond symbols", position);

        // a directional symbol refers to the way from the atom it is written at
        if(openingBond == 0 && closingBond != 0)
            addBond(closing, opening.atom, closingBond, bonds, pairs, counters, position);
        else
            addBond(opening.atom, closing, openingBond, bonds, pairs, counters, position);

        opening.atom.neighbourOrder.set(opening.slot, closing.id);
        closing.neighbourOrder.add(opening.atom.id);
    }


    private static AtomDraft createAtom(Token token, int[] counters) throws SmilesException
    {
        AtomDraft atom = new AtomDraft();
        atom.id = counters[0]++;
        atom.position = token.position;

        if(token.type == TokenType.BRACKET_ATOM)
        {
            BracketAtom bracket = BracketAtomParser.parse(token.text, token.position);
            atom.symbol = bracket.symbol;
            atom.atomicNumber = bracket.atomicNumber;
            atom.charge = bracket.charge;
            atom.isotope = bracket.isotope;
            atom.hydrogenCount = bracket.hydrogenCount;
            atom.aromatic = bracket.aromatic;
            atom.chirality = bracket.chirality;
            atom.atomClass = bracket.atomClass;
            atom.bracket = true;
        }
        else
        {
            String symbol = token.text;
            atom.aromatic = Character.isLowerCase(symbol.charAt(0));
            atom.symbol = atom.aromatic ? symbol.toUpperCase() : symbol;
            atom.atomicNumber = MoleculeBuilder.getAtomicNumber(atom.symbol);
        }

        return atom;
    }


    private static void addBond(AtomDraft atom1, AtomDraft atom2, char symbol, List<Bond> bonds,
            Map<Long, Bond> pairs, int[] counters, int position) throws SmilesException
    {
        long key = pairKey(atom1.id, atom2.id);

        if(pairs.containsKey(key))
            throw new SmilesException(ErrorKind.RING_CLOSURE, "atoms are bonded twice", position);

        BondOrder order;
        BondDirection direction = BondDirection.NONE;

        switch(symbol)
        {
            case '-':
                order = BondOrder.SINGLE;
                break;
            case '=':
                order = BondOrder.DOUBLE;
                break;
            case '#':
                order = BondOrder.TRIPLE;
                break;
            case '$':
                order = BondOrder.QUADRUPLE;
                break;
            case ':':
                order = BondOrder.AROMATIC;
                break;
            case '/':
                order = BondOrder.SINGLE;
                direction = BondDirection.UP;
                break;
            case '\\':
                order = BondOrder.SINGLE;
                direction = BondDirection.DOWN;
                break;
            default:
                order = atom1.aromatic && atom2.aromatic ? BondOrder.AROMATIC : BondOrder.SINGLE;
        }

        Bond bond = new Bond(counters[1]++, atom1.id, atom2.id, order, direction, null);
        bonds.add(bond);
        pairs.put(key, bond);
    }


    private static char bondSymbol(Token token)
    {
        return token == null ? 0 : token.text.charAt(0);
    }


    private static boolean isDirectional(char symbol)
    {
        return symbol == '/' || symbol == '\\';
    }


    private static long pairKey(int atom1, int atom2)
    {
        long low = Math.min(atom1, atom2);
        long high = Math.max(atom1, atom2);
        return (high << 32) | low;
    }
}

package cz.iocb.chemgraph.valence;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import cz.iocb.chemgraph.molecule.Atom;
import cz.iocb.chemgraph.molecule.AtomicNumbers;
import cz.iocb.chemgraph.molecule.Molecule;



/**
 * Allowed valences of the elements the engine reasons about. Elements outside the table are never checked.
 */
public class ValenceModel
{
    private static final Map<Integer, int[]> organicValences = new HashMap<Integer, int[]>();
    private static final Map<Integer, int[]> aromaticValences = new HashMap<Integer, int[]>();
    private static final Map<Integer, int[]> valences = new HashMap<Integer, int[]>();

    static
    {
        organicValences.put((int) AtomicNumbers.B, new int[] { 3 });
        organicValences.put((int) AtomicNumbers.C, new int[] { 4 });
        organicValences.put((int) AtomicNumbers.N, new int[] { 3, 5 });
        organicValences.put((int) AtomicNumbers.O, new int[] { 2 });
        organicValences.put((int) AtomicNumbers.P, new int[] { 3, 5 });
        organicValences.put((int) AtomicNumbers.S, new int[] { 2, 4, 6 });
        organicValences.put((int) AtomicNumbers.F, new int[] { 1 });
        organicValences.put((int) AtomicNumbers.Cl, new int[] { 1 });
        organicValences.put((int) AtomicNumbers.Br, new int[] { 1 });
        organicValences.put((int) AtomicNumbers.I, new int[] { 1 });

        aromaticValences.put((int) AtomicNumbers.B, new int[] { 2 });
        aromaticValences.put((int) AtomicNumbers.C, new int[] { 3 });
        aromaticValences.put((int) AtomicNumbers.N, new int[] { 2 });
        aromaticValences.put((int) AtomicNumbers.O, new int[] { 2 });
        aromaticValences.put((int) AtomicNumbers.P, new int[] { 2 });
        aromaticValences.put((int) AtomicNumbers.S, new int[] { 2 });

        valences.putAll(organicValences);
        valences.put((int) AtomicNumbers.H, new int[] { 1 });
        valences.put((int) AtomicNumbers.Si, new int[] { 4 });
        valences.put((int) AtomicNumbers.Ge, new int[] { 4 });
        valences.put((int) AtomicNumbers.As, new int[] { 3, 5 });
        valences.put((int) AtomicNumbers.Se, new int[] { 2, 4, 6 });
        valences.put((int) AtomicNumbers.Te, new int[] { 2, 4, 6 });
        valences.put((int) AtomicNumbers.Cl, new int[] { 1, 3, 5, 7 });
        valences.put((int) AtomicNumbers.Br, new int[] { 1, 3, 5, 7 });
        valences.put((int) AtomicNumbers.I, new int[] { 1, 3, 5, 7 });
    }


    /**
     * @return default valences used for implicit hydrogens of an unbracketed atom, or null outside the organic subset
     */
    public static int[] getOrganicValences(int atomicNumber, boolean aromatic)
    {
        int[] values = aromatic ? aromaticValences.get(atomicNumber) : organicValences.get(atomicNumber);
        return values == null ? null : values.clone();
    }


    /**
     * Returns the valences an atom may have with the given formal charge. Group 13 loses a bond per positive charge,
     * group 14 loses one per charge of either sign and the later groups gain one per positive charge.
     *
     * @return allowed valences in ascending order, or null for an element outside the table
     */
    public static int[] getAllowedValences(int atomicNumber, int charge)
    {
        int[] base = valences.get(atomicNumber);

        if(base == null)
            return null;

        int shift;

        if(atomicNumber == AtomicNumbers.B)
            shift = -charge;
        else if(atomicNumber == AtomicNumbers.C || atomicNumber == AtomicNumbers.Si
                || atomicNumber == AtomicNumbers.Ge)
            shift = -Math.abs(charge);
        else if(atomicNumber == AtomicNumbers.H)
            shift = -Math.abs(charge);
        else
            shift = charge;

        List<Integer> allowed = new ArrayList<Integer>();

        for(int value : base)
            if(value + shift >= 0 && !allowed.contains(value + shift))
                allowed.add(value + shift);

        int[] result = new int[allowed.size()];

        for(int i = 0; i < result.length; i++)
            result[i] = allowed.get(i);

        return result;
    }


    /**
     * @return valence used by the atom, aromatic bonds counting as one
     */
    public static int getUsedValence(Molecule molecule, Atom atom)
    {
        return molecule.getBondOrderSum(atom.getId()) + atom.getHydrogenCount();
    }


    /**
     * Returns the number of bonds the atom could still form before reaching its nearest allowed valence.
     *
     * @return spare valence, 0 for elements outside the table or atoms above every allowed valence
     */
    public static int getSpareValence(Molecule molecule, Atom atom)
    {
        int[] allowed = getAllowedValences(atom.getAtomicNumber(), atom.getCharge());

        if(allowed == null)
            return 0;

        int used = getUsedValence(molecule, atom);

        for(int value : allowed)
            if(value >= used)
                return value - used;

        return 0;
    }


    /**
     * Checks that the atom does not exceed the highest valence allowed for its element and charge.
     */
    public static boolean isValid(Molecule molecule, Atom atom)
    {
        int[] allowed = getAllowedValences(atom.getAtomicNumber(), atom.getCharge());

        if(allowed == null || allowed.length == 0)
            return true;

        return getUsedValence(molecule, atom) <= allowed[allowed.length - 1];
    }
}

package cz.iocb.chemgraph.molecule;

import java.util.ArrayList;
import java.util.List;



/**
 * Configuration of a double bond given by directional single bonds around it.
 *
 * The configuration is stored for one reference substituent on each side; any other pair of substituents is derived
 * from it, a second substituent on the same side always lies opposite to the first one.
 */
public class DoubleBondStereo
{
    private final Bond bond;
    private final int[] substituents1;
    private final int[] substituents2;
    private final int reference1;
    private final int reference2;
    private final boolean referenceTrans;


    private DoubleBondStereo(Bond bond, int[] substituents1, int[] substituents2, int reference1, int reference2,
            boolean referenceTrans)
    {
        this.bond = bond;
        this.substituents1 = substituents1;
        this.substituents2 = substituents2;
        this.reference1 = reference1;
        this.reference2 = reference2;
        this.referenceTrans = referenceTrans;
    }


    /**
     * Finds all double bonds that carry a directional single bond on both sides.
     */
    public static List<DoubleBondStereo> perceive(Molecule molecule)
    {
        List<DoubleBondStereo> list = new ArrayList<DoubleBondStereo>();

        for(Bond bond : molecule.getBonds())
        {
            if(bond.getOrder() != BondOrder.DOUBLE)
                continue;

            int atom1 = bond.getAtom1();
            int atom2 = bond.getAtom2();

            int[] substituents1 = substituents(molecule, atom1, atom2);
            int[] substituents2 = substituents(molecule, atom2, atom1);

            if(substituents1 == null || substituents2 == null || shareAtom(substituents1, substituents2))
                continue;

            int reference1 = marked(molecule, atom1, substituents1);
            int reference2 = marked(molecule, atom2, substituents2);

            if(reference1 == Atom.IMPLICIT_HYDROGEN || reference2 == Atom.IMPLICIT_HYDROGEN)
                continue;

            BondDirection direction1 = molecule.getBond(reference1, atom1).getDirectionFrom(reference1);
            BondDirection direction2 = molecule.getBond(atom2, reference2).getDirectionFrom(atom2);

            list.add(new DoubleBondStereo(bond, substituents1, substituents2, reference1, reference2,
                    direction1 == direction2));
        }

        return list;
    }


    /**
     * @return substituents of the atom other than its double bond partner, or null if there is none, more than two,
     *         or one of them is not bonded by a single bond
     */
    private static int[] substituents(Molecule molecule, int atom, int partner)
    {
        List<Bond> bonds = molecule.getBonds(atom);

        if(bonds.size() < 2 || bonds.size() > 3)
            return null;

        int[] substituents = new int[bonds.size() - 1];
        int count = 0;

        for(Bond bond : bonds)
        {
            int other = bond.getOther(atom);

            if(other == partner)
                continue;

            if(bond.getOrder() != BondOrder.SINGLE)
                return null;

            substituents[count++] = other;
        }

        return substituents;
    }


    private static int marked(Molecule molecule, int atom, int[] substituents)
    {
        for(int substituent : substituents)
            if(molecule.getBond(atom, substituent).getDirection() != BondDirection.NONE)
                return substituent;

        return Atom.IMPLICIT_HYDROGEN;
    }


    public Bond getBond()
    {
        return bond;
    }


    public int getAtom1()
    {
        return bond.getAtom1();
    }


    public int getAtom2()
    {
        return bond.getAtom2();
    }


    /**
     * @return substituents of the given end of the double bond
     */
    public int[] getSubstituents(int atom)
    {
        if(atom == bond.getAtom1())
            return substituents1.clone();
        else if(atom == bond.getAtom2())
            return substituents2.clone();

        throw new IllegalArgumentException("atom " + atom + " is not part of bond " + bond.getId());
    }


    /**
     * Tells whether two substituents lie on opposite sides of the double bond. The substituents have to belong to
     * different ends of the bond, in any order.
     */
    public boolean isTrans(int substituent1, int substituent2)
    {
        if(contains(substituents2, substituent1) && contains(substituents1, substituent2))
            return isTrans(substituent2, substituent1);

        if(!contains(substituents1, substituent1) || !contains(substituents2, substituent2))
            throw new IllegalArgumentException(
                    "atoms " + substituent1 + " and " + substituent2 + " are not substituents of bond " + bond.getId());

        return referenceTrans ^ (substituent1 != reference1) ^ (substituent2 != reference2);
    }


    private static boolean shareAtom(int[] array1, int[] array2)
    {
        for(int item : array1)
            if(contains(array2, item))
                return true;

        return false;
    }


    private static boolean contains(int[] array, int value)
    {
        for(int item : array)
            if(item == value)
                return true;

        return false;
    }
}

package cz.iocb.chemgraph.valence;

import java.util.ArrayList;
import java.util.List;
import cz.iocb.chemgraph.molecule.Atom;
import cz.iocb.chemgraph.molecule.Molecule;



public class HydrogenCompletion
{
    /**
     * Computes the implicit hydrogens of an unbracketed atom: the difference between the bond order sum and the
     * lowest default valence that is not below it.
     *
     * @param atomicNumber element of the atom
     * @param aromatic whether the atom was written in lowercase
     * @param bondOrderSum bond order sum, aromatic bonds counting as one
     * @return number of implicit hydrogens, 0 for elements outside the organic subset
     */
    public static int implicitHydrogens(int atomicNumber, boolean aromatic, int bondOrderSum)
    {
        int[] valences = ValenceModel.getOrganicValences(atomicNumber, aromatic);

        if(valences == null)
            return 0;

        for(int valence : valences)
            if(valence >= bondOrderSum)
                return valence - bondOrderSum;

        return 0;
    }


    public static int implicitHydrogens(Molecule molecule, Atom atom)
    {
        return implicitHydrogens(atom.getAtomicNumber(), atom.isAromatic(), molecule.getBondOrderSum(atom.getId()));
    }


    /**
     * Recomputes hydrogen counts of all unbracketed atoms.
     */
    public static Molecule completeHydrogens(Molecule molecule)
    {
        List<Atom> atoms = new ArrayList<Atom>(molecule.getAtomCount());

        for(Atom atom : molecule.getAtoms())
        {
            if(atom.isBracket())
                atoms.add(atom);
            else
                atoms.add(atom.withHydrogenCount(implicitHydrogens(molecule, atom)));
        }

        return molecule.with(atoms, molecule.getBonds());
    }


    /**
     * Flags atoms exceeding their allowed valence.
     */
    public static Molecule validateValences(Molecule molecule)
    {
        List<Atom> atoms = new ArrayList<Atom>(molecule.getAtomCount());

        for(Atom atom : molecule.getAtoms())
            atoms.add(atom.withValenceValid(ValenceModel.isValid(molecule, atom)));

        return molecule.with(atoms, molecule.getBonds());
    }
}

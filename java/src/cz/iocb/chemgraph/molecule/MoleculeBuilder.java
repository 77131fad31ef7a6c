package cz.iocb.chemgraph.molecule;

import java.util.ArrayList;
import java.util.List;
import org.openscience.cdk.tools.periodictable.PeriodicTable;



/**
 * Assembles a molecule atom by atom. Atom and bond ids are assigned in insertion order starting at zero.
 */
public class MoleculeBuilder
{
    private final List<Atom> atoms = new ArrayList<Atom>();
    private final List<Bond> bonds = new ArrayList<Bond>();


    public int addAtom(String symbol, int hydrogenCount)
    {
        return addAtom(symbol, hydrogenCount, 0, false);
    }


    public int addAtom(String symbol, int hydrogenCount, int charge, boolean aromatic)
    {
        int id = atoms.size();
        atoms.add(new Atom(id, symbol, getAtomicNumber(symbol), charge, 0, hydrogenCount, aromatic, null, 0, false,
                true, null, null));
        return id;
    }


    public int addBond(int atom1, int atom2, BondOrder order)
    {
        if(atom1 < 0 || atom1 >= atoms.size() || atom2 < 0 || atom2 >= atoms.size())
            throw new IllegalArgumentException("bond references an unknown atom");

        int id = bonds.size();
        bonds.add(new Bond(id, atom1, atom2, order));
        return id;
    }


    public Molecule build()
    {
        return new Molecule(atoms, bonds);
    }


    /**
     * Resolves an element symbol to its atomic number.
     *
     * @return atomic number, 0 for the wildcard atom, or -1 for an unknown symbol
     */
    public static int getAtomicNumber(String symbol)
    {
        if(symbol.equals("*"))
            return AtomicNumbers.WILDCARD;

        Integer number = PeriodicTable.getAtomicNumber(symbol);

        if(number == null || number <= 0 || !symbol.equals(PeriodicTable.getSymbol(number)))
            return -1;

        return number;
    }
}

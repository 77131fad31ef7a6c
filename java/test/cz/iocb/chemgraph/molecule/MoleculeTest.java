package cz.iocb.chemgraph.molecule;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import org.junit.Test;



public class MoleculeTest
{
    private static Molecule ethanol()
    {
        MoleculeBuilder builder = new MoleculeBuilder();
        int c1 = builder.addAtom("C", 3);
        int c2 = builder.addAtom("C", 2);
        int o = builder.addAtom("O", 1);
        builder.addBond(c1, c2, BondOrder.SINGLE);
        builder.addBond(c2, o, BondOrder.SINGLE);
        return builder.build();
    }


    @Test
    public void testLookup()
    {
        Molecule molecule = ethanol();

        assertEquals(3, molecule.getAtomCount());
        assertEquals(2, molecule.getBondCount());
        assertEquals(8, molecule.getAtom(2).getAtomicNumber());
        assertEquals(2, molecule.getDegree(1));
        assertArrayEquals(new int[] { 0, 2 }, molecule.getNeighbours(1));
        assertEquals(1, molecule.getBond(2, 1).getId());
        assertNull(molecule.getBond(0, 2));
        assertEquals(2, molecule.getBondOrderSum(1));
        assertNull(molecule.getRingInfo());
    }


    @Test(expected = IllegalArgumentException.class)
    public void testDuplicateBond()
    {
        MoleculeBuilder builder = new MoleculeBuilder();
        int a = builder.addAtom("C", 3);
        int b = builder.addAtom("C", 3);
        builder.addBond(a, b, BondOrder.SINGLE);
        builder.addBond(b, a, BondOrder.DOUBLE);
        builder.build();
    }


    @Test(expected = IllegalArgumentException.class)
    public void testSelfLoop()
    {
        new Bond(0, 1, 1, BondOrder.SINGLE);
    }


    @Test(expected = IllegalArgumentException.class)
    public void testUnknownAtom()
    {
        ethanol().getAtom(42);
    }


    @Test
    public void testUnknownElement()
    {
        assertEquals(-1, MoleculeBuilder.getAtomicNumber("Xx"));
        assertEquals(0, MoleculeBuilder.getAtomicNumber("*"));
        assertEquals(17, MoleculeBuilder.getAtomicNumber("Cl"));
        assertEquals(-1, MoleculeBuilder.getAtomicNumber("cl"));
    }


    @Test
    public void testBondDirection()
    {
        Bond bond = new Bond(0, 3, 4, BondOrder.SINGLE, BondDirection.UP, null);

        assertEquals(BondDirection.UP, bond.getDirectionFrom(3));
        assertEquals(BondDirection.DOWN, bond.getDirectionFrom(4));
        assertEquals(bond, new Bond(0, 4, 3, BondOrder.SINGLE, BondDirection.DOWN, null));
        assertFalse(bond.equals(new Bond(0, 4, 3, BondOrder.SINGLE, BondDirection.UP, null)));
    }


    @Test
    public void testAtomsAreImmutable()
    {
        Atom atom = new Atom(0, "C", 6, 4);
        Atom aromatic = atom.withAromatic(true);

        assertFalse(atom.isAromatic());
        assertTrue(aromatic.isAromatic());
        assertEquals(atom.getId(), aromatic.getId());

        int[] rings = { 1, 2 };
        Atom ringAtom = atom.withRingIds(rings);
        rings[0] = 7;

        assertArrayEquals(new int[] { 1, 2 }, ringAtom.getRingIds());
    }
}

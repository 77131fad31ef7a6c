package cz.iocb.chemgraph.valence;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import org.junit.Test;
import cz.iocb.chemgraph.molecule.AtomicNumbers;
import cz.iocb.chemgraph.molecule.BondOrder;
import cz.iocb.chemgraph.molecule.Molecule;
import cz.iocb.chemgraph.molecule.MoleculeBuilder;



public class ValenceModelTest
{
    @Test
    public void testChargedValences()
    {
        assertArrayEquals(new int[] { 4 }, ValenceModel.getAllowedValences(AtomicNumbers.C, 0));
        assertArrayEquals(new int[] { 3 }, ValenceModel.getAllowedValences(AtomicNumbers.C, -1));
        assertArrayEquals(new int[] { 3 }, ValenceModel.getAllowedValences(AtomicNumbers.C, 1));
        assertArrayEquals(new int[] { 4, 6 }, ValenceModel.getAllowedValences(AtomicNumbers.N, 1));
        assertArrayEquals(new int[] { 2, 4 }, ValenceModel.getAllowedValences(AtomicNumbers.N, -1));
        assertArrayEquals(new int[] { 1 }, ValenceModel.getAllowedValences(AtomicNumbers.O, -1));
        assertArrayEquals(new int[] { 4 }, ValenceModel.getAllowedValences(AtomicNumbers.B, -1));
        assertArrayEquals(new int[] { 2, 4, 6 }, ValenceModel.getAllowedValences(AtomicNumbers.S, 0));
        assertNull(ValenceModel.getAllowedValences(26, 0));
    }


    @Test
    public void testSpareValence()
    {
        MoleculeBuilder builder = new MoleculeBuilder();
        int c = builder.addAtom("C", 2);
        int n = builder.addAtom("N", 0);
        builder.addBond(c, n, BondOrder.SINGLE);
        Molecule molecule = builder.build();

        assertEquals(1, ValenceModel.getSpareValence(molecule, molecule.getAtom(c)));
        assertEquals(2, ValenceModel.getSpareValence(molecule, molecule.getAtom(n)));
        assertTrue(ValenceModel.isValid(molecule, molecule.getAtom(c)));
    }


    @Test
    public void testExceededValence()
    {
        MoleculeBuilder builder = new MoleculeBuilder();
        int c = builder.addAtom("C", 0);

        for(int i = 0; i < 5; i++)
            builder.addBond(c, builder.addAtom("F", 0), BondOrder.SINGLE);

        Molecule molecule = builder.build();

        assertFalse(ValenceModel.isValid(molecule, molecule.getAtom(c)));
        assertEquals(0, ValenceModel.getSpareValence(molecule, molecule.getAtom(c)));
        assertTrue(ValenceModel.isValid(molecule, molecule.getAtom(1)));
    }
}

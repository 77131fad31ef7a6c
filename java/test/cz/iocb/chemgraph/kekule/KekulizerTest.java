package cz.iocb.chemgraph.kekule;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import org.junit.Test;
import cz.iocb.chemgraph.molecule.Atom;
import cz.iocb.chemgraph.molecule.Bond;
import cz.iocb.chemgraph.molecule.BondOrder;
import cz.iocb.chemgraph.molecule.Molecule;
import cz.iocb.chemgraph.molecule.MoleculeBuilder;
import cz.iocb.chemgraph.shared.MoleculeCreator;



public class KekulizerTest
{
    private static Molecule parse(String smiles)
    {
        return MoleculeCreator.parse(smiles).getMolecule();
    }


    private static int doubleBonds(Molecule molecule, int atom)
    {
        int count = 0;

        for(Bond bond : molecule.getBonds(atom))
            if(bond.getOrder() == BondOrder.DOUBLE)
                count++;

        return count;
    }


    private static Molecule aromaticRing(int size)
    {
        MoleculeBuilder builder = new MoleculeBuilder();

        for(int i = 0; i < size; i++)
            builder.addAtom("C", 1, 0, true);

        for(int i = 0; i < size; i++)
            builder.addBond(i, (i + 1) % size, BondOrder.AROMATIC);

        return builder.build();
    }


    @Test
    public void testBenzene() throws KekulizationException
    {
        Molecule kekule = Kekulizer.kekulize(aromaticRing(6));

        assertFalse(kekule.hasAromaticBonds());

        for(Atom atom : kekule.getAtoms())
        {
            assertEquals(1, doubleBonds(kekule, atom.getId()));
            assertFalse(atom.isAromatic());
            assertEquals(1, atom.getHydrogenCount());
        }
    }


    @Test
    public void testExactlyOneDoubleBondPerAtom() throws KekulizationException
    {
        String[] structures = { "c1ccc2ccccc2c1", "c1ccc2cc3ccccc3cc2c1", "c1cc2cccccc2c1", "c1ccncc1",
                "c1cc[nH]c1", "O=c1cccc[nH]1", "c1ccc2[nH]ccc2c1", "c1ccc(cc1)-c1ccccc1" };

        for(String smiles : structures)
        {
            Molecule molecule = parse(smiles);
            Molecule kekule = Kekulizer.kekulize(molecule);

            assertFalse(smiles, kekule.hasAromaticBonds());

            for(Atom atom : molecule.getAtoms())
            {
                int count = doubleBonds(kekule, atom.getId());

                if(atom.isAromatic() && atom.getHydrogenCount() + molecule.getDegree(atom.getId()) == 3
                        && atom.getAtomicNumber() == 6)
                    assertEquals(smiles + " " + atom, 1, count);
                else
                    assertTrue(smiles + " " + atom, count <= 1);
            }
        }
    }


    @Test
    public void testStable() throws KekulizationException
    {
        Molecule first = Kekulizer.kekulize(parse("c1ccc2ccccc2c1"));
        Molecule second = Kekulizer.kekulize(first);

        assertSame(first, second);
        assertEquals(first.getBonds(), Kekulizer.kekulize(parse("c1ccc2ccccc2c1")).getBonds());
    }


    @Test
    public void testOddRing()
    {
        try
        {
            Kekulizer.kekulize(aromaticRing(5));
            fail();
        }
        catch(KekulizationException e)
        {
            assertTrue(e.getAtom() >= 0 && e.getAtom() < 5);
        }

        KekulizationResult result = Kekulizer.tryKekulize(aromaticRing(5));

        assertFalse(result.isSuccess());
        assertNotNull(result.getMessage());
    }


    @Test(expected = IllegalStateException.class)
    public void testFailedResultHasNoMolecule()
    {
        Kekulizer.tryKekulize(aromaticRing(7)).getMolecule();
    }


    @Test
    public void testSuccessResult()
    {
        KekulizationResult result = MoleculeCreator.kekulize(aromaticRing(6));

        assertTrue(result.isSuccess());

        int doubles = 0;

        for(Bond bond : result.getMolecule().getBonds())
            if(bond.getOrder() == BondOrder.DOUBLE)
                doubles++;

        assertEquals(3, doubles);
    }


    @Test
    public void testExistingDoubleBond()
    {
        Molecule molecule = parse("O=c1cccc[nH]1");

        assertFalse(Kekulizer.needsDoubleBond(molecule, molecule.getAtom(1)));
        assertFalse(Kekulizer.needsDoubleBond(molecule, molecule.getAtom(6)));
        assertTrue(Kekulizer.needsDoubleBond(molecule, molecule.getAtom(2)));
    }
}

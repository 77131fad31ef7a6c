package cz.iocb.chemgraph.molecule;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import java.util.List;
import org.junit.Test;
import cz.iocb.chemgraph.shared.MoleculeCreator;



public class RingInfoTest
{
    private static Molecule parse(String smiles)
    {
        return MoleculeCreator.parse(smiles).getMolecule();
    }


    @Test
    public void testNaphthalene()
    {
        Molecule molecule = parse("c1ccc2ccccc2c1");
        RingInfo rings = molecule.getRingInfo();

        assertEquals(2, rings.getRingCount());
        assertEquals(6, rings.getRingSize(0));
        assertEquals(2, rings.getRingsOfSize(6).length);

        // atoms 3 and 8 are shared by both rings
        assertEquals(2, rings.getAtomRingCount(3));
        assertEquals(2, rings.getAtomRingCount(8));
        assertEquals(1, rings.getAtomRingCount(0));
        assertEquals(2, molecule.getAtom(3).getRingCount());

        Bond fusion = molecule.getBond(3, 8);
        assertEquals(2, rings.getBondRingCount(fusion.getId()));
        assertTrue(rings.isBondInRingOfSize(fusion.getId(), 6));
        assertFalse(rings.isBondInRingOfSize(fusion.getId(), 5));

        List<int[]> systems = rings.getRingSystems();
        assertEquals(1, systems.size());
        assertArrayEquals(new int[] { 0, 1 }, systems.get(0));
    }


    @Test
    public void testSeparateRingSystems()
    {
        Molecule molecule = parse("C1CC1CCC1CCCC1");
        RingInfo rings = molecule.getRingInfo();

        assertEquals(2, rings.getRingCount());
        assertEquals(2, rings.getRingSystems().size());
        assertTrue(rings.isAtomInRingOfSize(0, 3));
        assertTrue(rings.isAtomInRingOfSize(6, 5));
        assertFalse(rings.isAtomInRing(4));
        assertFalse(rings.isBondInRing(molecule.getBond(3, 4).getId()));
        assertEquals(0, rings.getAtomRings(4).length);
    }


    @Test
    public void testRingBondsFollowRingAtoms()
    {
        Molecule molecule = parse("C1CCCCC1");
        RingInfo rings = molecule.getRingInfo();
        int[] atoms = rings.getRingAtoms(0);
        int[] bonds = rings.getRingBonds(0);

        assertArrayEquals(new int[] { 0, 1, 2, 3, 4, 5 }, atoms);

        for(int i = 0; i < atoms.length; i++)
            assertEquals(molecule.getBond(atoms[i], atoms[(i + 1) % atoms.length]).getId(), bonds[i]);
    }


    @Test
    public void testEmpty()
    {
        RingInfo rings = RingInfo.empty();

        assertEquals(0, rings.getRingCount());
        assertEquals(0, rings.getRingSystems().size());
        assertFalse(rings.isAtomInRing(0));
    }
}

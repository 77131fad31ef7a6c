package cz.iocb.chemgraph.molecule;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import java.util.List;
import org.junit.Test;
import cz.iocb.chemgraph.shared.MoleculeCreator;



public class DoubleBondStereoTest
{
    private static List<DoubleBondStereo> perceive(String smiles)
    {
        return DoubleBondStereo.perceive(MoleculeCreator.parse(smiles).getMolecule());
    }


    @Test
    public void testTransAndCis()
    {
        List<DoubleBondStereo> trans = perceive("F/C=C/F");
        assertEquals(1, trans.size());
        assertTrue(trans.get(0).isTrans(0, 3));
        assertTrue(trans.get(0).isTrans(3, 0));

        List<DoubleBondStereo> cis = perceive("F/C=C\\F");
        assertEquals(1, cis.size());
        assertFalse(cis.get(0).isTrans(0, 3));
    }


    @Test
    public void testSecondSubstituent()
    {
        // F/C(Cl)=C/F: the chlorine lies opposite to the fluorine on its own side
        DoubleBondStereo bond = perceive("F/C(Cl)=C/F").get(0);

        assertTrue(bond.isTrans(0, 4));
        assertFalse(bond.isTrans(2, 4));
        assertEquals(2, bond.getSubstituents(1).length);
    }


    @Test
    public void testUnmarkedBonds()
    {
        assertTrue(perceive("FC=CF").isEmpty());
        assertTrue(perceive("F/C=CF").isEmpty());
        assertTrue(perceive("C/C=C=C/C").isEmpty());
        assertTrue(perceive("c1ccccc1").isEmpty());
    }


    @Test
    public void testDiene()
    {
        List<DoubleBondStereo> bonds = perceive("F/C=C/C=C\\F");

        assertEquals(2, bonds.size());
        assertTrue(bonds.get(0).isTrans(0, 3));
        assertFalse(bonds.get(1).isTrans(2, 5));
    }


    @Test(expected = IllegalArgumentException.class)
    public void testForeignSubstituent()
    {
        perceive("F/C=C/F").get(0).isTrans(0, 1);
    }
}

package cz.iocb.chemgraph.rings;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.Test;
import org.openscience.cdk.graph.Cycles;
import org.openscience.cdk.interfaces.IAtomContainer;
import org.openscience.cdk.interfaces.IRingSet;
import org.openscience.cdk.silent.SilentChemObjectBuilder;
import org.openscience.cdk.smiles.SmilesParser;
import cz.iocb.chemgraph.molecule.BondOrder;
import cz.iocb.chemgraph.molecule.Molecule;
import cz.iocb.chemgraph.molecule.MoleculeBuilder;
import cz.iocb.chemgraph.molecule.RingInfo;
import cz.iocb.chemgraph.shared.MoleculeCreator;



public class RingPerceptionTest
{
    private static final String[] structures = { "c1ccccc1", "C1CCCCC1", "c1ccc2ccccc2c1", "C1CCC2(CC1)CC2",
            "C1CC2CCC1C2", "C1C2CC3CC1CC(C2)C3", "C12C3C4C1C5C2C3C45", "c1ccc(cc1)-c1ccccc1",
            "C1CCC2C(C1)CCC1C2CCC2CCCC12", "c1ccc2cc3ccccc3cc2c1", "C1CC1C1CC1", "CCCCO" };


    private static Molecule parse(String smiles)
    {
        return MoleculeCreator.parse(smiles).getMolecule();
    }


    private static List<Integer> sizes(RingInfo rings)
    {
        List<Integer> sizes = new ArrayList<Integer>();

        for(int i = 0; i < rings.getRingCount(); i++)
            sizes.add(rings.getRingSize(i));

        Collections.sort(sizes);
        return sizes;
    }


    @Test
    public void testBenzene()
    {
        RingInfo rings = RingPerception.perceiveRings(parse("c1ccccc1"));

        assertEquals(1, rings.getRingCount());
        assertArrayEquals(new int[] { 0, 1, 2, 3, 4, 5 }, rings.getRingAtoms(0));
    }


    @Test
    public void testCycleRank()
    {
        for(String smiles : structures)
        {
            Molecule molecule = parse(smiles);
            RingInfo rings = RingPerception.perceiveRings(molecule);

            assertEquals(smiles, molecule.getBondCount() - molecule.getAtomCount() + 1, rings.getRingCount());
        }
    }


    @Test
    public void testSmallestRings()
    {
        assertEquals(Collections.nCopies(2, 6), sizes(RingPerception.perceiveRings(parse("c1ccc2ccccc2c1"))));
        assertEquals(Arrays.asList(3, 6), sizes(RingPerception.perceiveRings(parse("C1CCC2(CC1)CC2"))));
        assertEquals(Arrays.asList(5, 5), sizes(RingPerception.perceiveRings(parse("C1CC2CCC1C2"))));
        assertEquals(Collections.nCopies(3, 6), sizes(RingPerception.perceiveRings(parse("C1C2CC3CC1CC(C2)C3"))));
        assertEquals(Collections.nCopies(5, 4), sizes(RingPerception.perceiveRings(parse("C12C3C4C1C5C2C3C45"))));
    }


    @Test
    public void testAgreesWithCdk() throws Exception
    {
        SmilesParser cdkParser = new SmilesParser(SilentChemObjectBuilder.getInstance());

        for(String smiles : structures)
        {
            IAtomContainer container = cdkParser.parseSmiles(smiles);
            IRingSet cdkRings = Cycles.sssr(container).toRingSet();
            List<Integer> expected = new ArrayList<Integer>();

            for(IAtomContainer ring : cdkRings.atomContainers())
                expected.add(ring.getAtomCount());

            Collections.sort(expected);

            assertEquals(smiles, expected, sizes(RingPerception.perceiveRings(parse(smiles))));
        }
    }


    @Test
    public void testDisconnectedComponents()
    {
        MoleculeBuilder builder = new MoleculeBuilder();

        for(int ring = 0; ring < 2; ring++)
        {
            int a = builder.addAtom("C", 2);
            int b = builder.addAtom("C", 2);
            int c = builder.addAtom("C", 2);
            builder.addBond(a, b, BondOrder.SINGLE);
            builder.addBond(b, c, BondOrder.SINGLE);
            builder.addBond(c, a, BondOrder.SINGLE);
        }

        RingInfo rings = RingPerception.perceiveRings(builder.build());

        assertEquals(2, rings.getRingCount());
        assertArrayEquals(new int[] { 0, 1, 2 }, rings.getRingAtoms(0));
        assertArrayEquals(new int[] { 3, 4, 5 }, rings.getRingAtoms(1));
    }


    @Test
    public void testNoRings()
    {
        assertEquals(0, RingPerception.perceiveRings(parse("CC(C)CO")).getRingCount());
    }


    @Test
    public void testWithRings()
    {
        MoleculeBuilder builder = new MoleculeBuilder();
        int a = builder.addAtom("C", 2);
        int b = builder.addAtom("C", 2);
        int c = builder.addAtom("C", 2);
        builder.addBond(a, b, BondOrder.SINGLE);
        builder.addBond(b, c, BondOrder.SINGLE);
        builder.addBond(c, a, BondOrder.SINGLE);
        Molecule molecule = builder.build();

        Molecule withRings = RingPerception.withRings(molecule);

        assertEquals(null, molecule.getRingInfo());
        assertEquals(1, withRings.getRingInfo().getRingCount());
        assertArrayEquals(new int[] { 0 }, withRings.getAtom(b).getRingIds());
        assertArrayEquals(new int[] { 0 }, withRings.getBond(c, a).getRingIds());
    }


    @Test
    public void testNormalize()
    {
        assertArrayEquals(new int[] { 0, 2, 3, 1, 4 }, RingPerception.normalize(new int[] { 3, 1, 4, 0, 2 }));
        assertArrayEquals(new int[] { 0, 1, 2 }, RingPerception.normalize(new int[] { 2, 1, 0 }));
    }
}

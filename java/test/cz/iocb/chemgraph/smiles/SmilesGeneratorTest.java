package cz.iocb.chemgraph.smiles;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import org.junit.Test;
import cz.iocb.chemgraph.molecule.Atom;
import cz.iocb.chemgraph.molecule.Bond;
import cz.iocb.chemgraph.molecule.BondOrder;
import cz.iocb.chemgraph.molecule.Molecule;
import cz.iocb.chemgraph.molecule.MoleculeBuilder;
import cz.iocb.chemgraph.shared.MoleculeCounts;



public class SmilesGeneratorTest
{
    private static final String[] molecules = { "CCO", "CC(=O)O", "c1ccccc1", "Cc1ccccc1", "c1ccncc1",
            "c1cc[nH]c1", "c1ccc2ccccc2c1", "O=C1C=CC(=O)C=C1", "C1CCCCC1", "C1CC2CCC1C2", "[NH4+]",
            "[O-]C(=O)c1ccccc1", "N[C@@H](C)C(=O)O", "F/C=C/F", "C#N", "[13CH4]", "OS(=O)(=O)O", "c1ccsc1",
            "Cn1ccnc1", "c1ccc(cc1)-c1ccccc1", "[Na+].[Cl-]", "CCCCCCCC(=O)OCC" };

    private final SmilesParser parser = new SmilesParser();
    private final SmilesGenerator generator = new SmilesGenerator();


    private List<Molecule> parse(String smiles)
    {
        ParseResult result = parser.parse(smiles);
        assertFalse(smiles + ": " + result.getErrors(), result.hasFatalErrors());
        return result.getMolecules();
    }


    private String canonical(String smiles)
    {
        return generator.generate(parse(smiles), true);
    }


    @Test
    public void testCanonicalForms()
    {
        assertEquals("CCO", canonical("OCC"));
        assertEquals("CC(=O)O", canonical("OC(=O)C"));
        assertEquals("c1ccccc1", canonical("c1ccccc1"));
        assertEquals("c1ccccc1", canonical("C1=CC=CC=C1"));
        assertEquals("C1CCCCC1", canonical("C1CCCCC1"));
        assertEquals("Cc1ccccc1", canonical("c1ccccc1C"));
        assertEquals("c1cc[nH]c1", canonical("[nH]1cccc1"));
        assertEquals("[Cl-].[Na+]", canonical("[Na+].[Cl-]"));
        assertEquals("[NH4+]", canonical("[NH4+]"));
        assertEquals("[13CH4]", canonical("[13CH4]"));
        assertEquals("[CH2]", canonical("[CH2]"));
        assertEquals("*C", canonical("C*"));
    }


    @Test
    public void testRoundTrip()
    {
        for(String smiles : molecules)
        {
            List<Molecule> original = parse(smiles);
            String generated = generator.generate(original, true);
            List<Molecule> reparsed = parse(generated);

            assertEquals(smiles, original.size(), reparsed.size());

            for(int i = 0; i < original.size(); i++)
            {
                Molecule first = original.get(i);
                Molecule second = reparsed.get(i);

                assertEquals(generated, first.getAtomCount(), second.getAtomCount());
                assertEquals(generated, first.getBondCount(), second.getBondCount());
            }

            MoleculeCounts before = new MoleculeCounts(original.get(0));
            boolean found = false;

            for(Molecule molecule : reparsed)
                found |= before.hasSameComposition(new MoleculeCounts(molecule));

            assertTrue(generated, found);
        }
    }


    @Test
    public void testIdempotence()
    {
        for(String smiles : molecules)
        {
            String once = canonical(smiles);
            assertEquals(smiles, once, canonical(once));
        }
    }


    @Test
    public void testInputOrderIndependence()
    {
        String[][] pairs = { { "OCC", "CCO" }, { "c1ccccc1C", "Cc1ccccc1" }, { "OC(=O)C", "CC(O)=O" },
                { "n1ccccc1", "c1ccncc1" }, { "C1CC1CN", "NCC1CC1" },
                { "[O-]C(=O)c1ccccc1", "c1ccc(cc1)C([O-])=O" }, { "C1=CC=CC=C1", "c1ccccc1" },
                { "O.CC", "CC.O" } };

        for(String[] pair : pairs)
            assertEquals(pair[0] + " " + pair[1], canonical(pair[0]), canonical(pair[1]));
    }


    @Test
    public void testShuffledAtomOrder()
    {
        String[] structures = { "O[C@H](C(=O)O)[C@@H](O)C(=O)O", "O[C@H](C(=O)O)[C@H](O)C(=O)O",
                "C[C@H]1CC[C@@H](C)CC1", "C[C@H]1CC[C@H](C)CC1", "F/C=C/C=C\\F", "F/C=C/C=C/F",
                "C1CC2C3CCC4C5CCC6C1C26C345", "C12C3C4C1C5C2C3C45", "N[C@@H](C)C(=O)O", "c1ccc2ccccc2c1",
                "CC(C)(C)c1ccc(O)cc1" };

        Random random = new Random(20171);

        for(String smiles : structures)
        {
            String expected = canonical(smiles);

            for(int i = 0; i < 40; i++)
            {
                String written = generator.generate(shuffle(parse(smiles).get(0), random), false);
                assertEquals(smiles + " written as " + written, expected, canonical(written));
            }
        }

        assertFalse(canonical(structures[0]).equals(canonical(structures[1])));
        assertFalse(canonical(structures[2]).equals(canonical(structures[3])));
        assertFalse(canonical(structures[4]).equals(canonical(structures[5])));
    }


    /**
     * Renumbers the atoms randomly and writes the bonds in random order and orientation.
     */
    private static Molecule shuffle(Molecule molecule, Random random)
    {
        List<Integer> ids = new ArrayList<Integer>();

        for(int id : molecule.getAtomIds())
            ids.add(id);

        List<Integer> targets = new ArrayList<Integer>(ids);
        Collections.shuffle(targets, random);

        Map<Integer, Integer> mapping = new HashMap<Integer, Integer>();

        for(int i = 0; i < ids.size(); i++)
            mapping.put(ids.get(i), targets.get(i));

        List<Atom> atoms = new ArrayList<Atom>();

        for(Atom atom : molecule.getAtoms())
        {
            int[] reference = atom.getNeighbourOrder();
            int[] order = new int[reference.length];

            for(int i = 0; i < reference.length; i++)
                order[i] = reference[i] == Atom.IMPLICIT_HYDROGEN ? Atom.IMPLICIT_HYDROGEN : mapping.get(reference[i]);

            atoms.add(new Atom(mapping.get(atom.getId()), atom.getSymbol(), atom.getAtomicNumber(), atom.getCharge(),
                    atom.getIsotope(), atom.getHydrogenCount(), atom.isAromatic(), atom.getChirality(),
                    atom.getAtomClass(), atom.isBracket(), atom.isValenceValid(), null, order));
        }

        Collections.shuffle(atoms, random);

        List<Bond> source = new ArrayList<Bond>(molecule.getBonds());
        Collections.shuffle(source, random);

        List<Bond> bonds = new ArrayList<Bond>();

        for(int i = 0; i < source.size(); i++)
        {
            Bond bond = source.get(i);
            int atom1 = mapping.get(bond.getAtom1());
            int atom2 = mapping.get(bond.getAtom2());

            if(random.nextBoolean())
                bonds.add(new Bond(i, atom2, atom1, bond.getOrder(), bond.getDirection().flip(), null));
            else
                bonds.add(new Bond(i, atom1, atom2, bond.getOrder(), bond.getDirection(), null));
        }

        return new Molecule(atoms, bonds);
    }


    @Test
    public void testLongChain()
    {
        MoleculeBuilder builder = new MoleculeBuilder();
        int previous = builder.addAtom("C", 3);

        for(int i = 1; i < 10000; i++)
        {
            int atom = builder.addAtom("C", i == 9999 ? 3 : 2);
            builder.addBond(previous, atom, BondOrder.SINGLE);
            previous = atom;
        }

        StringBuilder expected = new StringBuilder();

        for(int i = 0; i < 10000; i++)
            expected.append('C');

        Molecule chain = builder.build();

        assertEquals(expected.toString(), generator.generate(chain, false));
        assertEquals(expected.toString(), generator.generate(chain, true));
    }


    @Test
    public void testDeepBranches()
    {
        // the chain is numbered before the methyl groups, so every chain step opens a branch
        MoleculeBuilder builder = new MoleculeBuilder();
        int[] chain = new int[3001];
        chain[0] = builder.addAtom("C", 3);

        for(int i = 1; i <= 3000; i++)
        {
            chain[i] = builder.addAtom("C", i == 3000 ? 2 : 1);
            builder.addBond(chain[i - 1], chain[i], BondOrder.SINGLE);
        }

        for(int i = 1; i <= 3000; i++)
            builder.addBond(chain[i], builder.addAtom("C", 3), BondOrder.SINGLE);

        String smiles = generator.generate(builder.build(), false);
        int opened = 0;
        int closed = 0;

        for(char c : smiles.toCharArray())
        {
            if(c == '(')
                opened++;
            else if(c == ')')
                closed++;
        }

        assertTrue(smiles.startsWith("CC(C(C("));
        assertTrue(smiles.endsWith("C)C)C"));
        assertEquals(2999, opened);
        assertEquals(2999, closed);
    }


    @Test
    public void testUnpairedDirectionDropped()
    {
        assertEquals("CC=CF", generator.generate(parse("C/C=CF").get(0), false));
        assertEquals(canonical("CC=CF"), canonical("C/C=CF"));
    }


    @Test
    public void testStereo()
    {
        assertEquals("C[C@@H](C(=O)O)N", canonical("N[C@@H](C)C(=O)O"));
        assertEquals("C[C@@H](C(=O)O)N", canonical("C[C@H](N)C(=O)O"));
        assertEquals("C[C@H](C(=O)O)N", canonical("N[C@H](C)C(=O)O"));

        assertEquals("C(=C/F)\\F", canonical("F/C=C/F"));
        assertEquals(canonical("F/C=C/F"), canonical("F\\C=C\\F"));
        assertFalse(canonical("F/C=C/F").equals(canonical("F/C=C\\F")));
    }


    @Test
    public void testAromaticSingleBond()
    {
        String biphenyl = canonical("c1ccccc1c1ccccc1");

        assertTrue(biphenyl, biphenyl.contains("-"));
        assertEquals(biphenyl, canonical("c1ccc(cc1)-c1ccccc1"));
    }


    @Test
    public void testAtomIdOrder()
    {
        assertEquals("OCC", generator.generate(parse("OCC").get(0), false));
        assertEquals("[Na+].[Cl-]", generator.generate(parse("[Na+].[Cl-]"), false));
        assertEquals("C1CC1C1CC1", generator.generate(parse("C1CC1C1CC1").get(0), false));
    }


    @Test
    public void testTwoDigitRingNumbers()
    {
        MoleculeBuilder builder = new MoleculeBuilder();
        int hub = builder.addAtom("C", 0);
        int previous = -1;

        for(int i = 1; i <= 11; i++)
        {
            int hydrogens = i == 1 || i == 11 ? 2 : 1;
            int atom = builder.addAtom("C", hydrogens);
            builder.addBond(hub, atom, BondOrder.SINGLE);

            if(previous >= 0)
                builder.addBond(previous, atom, BondOrder.SINGLE);

            previous = atom;
        }

        Molecule molecule = builder.build();
        String smiles = generator.generate(molecule, false);

        assertEquals("C123456789%10CC1C2C3C4C5C6C7C8C9C%10", smiles);

        ParseResult result = parser.parse(smiles);
        assertFalse(result.hasFatalErrors());
        assertEquals(12, result.getMolecule().getAtomCount());
        assertEquals(21, result.getMolecule().getBondCount());
    }


    @Test
    public void testFragmentsFromOneMolecule()
    {
        MoleculeBuilder builder = new MoleculeBuilder();
        builder.addAtom("O", 2);
        builder.addAtom("O", 2);

        assertEquals("O.O", generator.generate(builder.build(), true));
        assertEquals(Arrays.asList("O", "O"), Arrays.asList(canonical("O.O").split("\\.")));
    }
}

package cz.iocb.chemgraph.aromaticity;

import java.util.Set;
import cz.iocb.chemgraph.molecule.Atom;
import cz.iocb.chemgraph.molecule.AtomicNumbers;
import cz.iocb.chemgraph.molecule.Bond;
import cz.iocb.chemgraph.molecule.BondOrder;
import cz.iocb.chemgraph.molecule.Molecule;
import cz.iocb.chemgraph.molecule.RingInfo;
import cz.iocb.chemgraph.valence.ValenceModel;



/**
 * Ordered rules deciding how many pi electrons a ring atom donates. The first applicable rule wins; the last rule
 * applies to every atom, so the list is closed.
 */
enum PiElectronRule
{
    UNSUPPORTED_ELEMENT
    {
        @Override
        int apply(Ring ring, Atom atom)
        {
            return isSupported(atom.getAtomicNumber()) ? NOT_APPLICABLE : DISRUPTED;
        }
    },

    TRIPLE_BOND
    {
        @Override
        int apply(Ring ring, Atom atom)
        {
            for(Bond bond : ring.molecule.getBonds(atom.getId()))
                if(bond.getOrder() == BondOrder.TRIPLE || bond.getOrder() == BondOrder.QUADRUPLE)
                    return DISRUPTED;

            return NOT_APPLICABLE;
        }
    },

    RING_DOUBLE_BOND
    {
        @Override
        int apply(Ring ring, Atom atom)
        {
            for(Bond bond : ring.molecule.getBonds(atom.getId()))
                if(bond.getOrder() == BondOrder.DOUBLE && ring.atoms.contains(bond.getOther(atom.getId())))
                    return 1;

            return NOT_APPLICABLE;
        }
    },

    FUSED_DOUBLE_BOND
    {
        @Override
        int apply(Ring ring, Atom atom)
        {
            Bond bond = exocyclicDoubleBond(ring, atom);

            if(bond != null && ring.ringInfo.isAtomInRing(bond.getOther(atom.getId())))
                return 1;

            return NOT_APPLICABLE;
        }
    },

    EXOCYCLIC_HETEROATOM_DOUBLE_BOND
    {
        @Override
        int apply(Ring ring, Atom atom)
        {
            Bond bond = exocyclicDoubleBond(ring, atom);

            if(bond == null)
                return NOT_APPLICABLE;

            int other = ring.molecule.getAtom(bond.getOther(atom.getId())).getAtomicNumber();

            if(other == AtomicNumbers.O || other == AtomicNumbers.N || other == AtomicNumbers.S)
                return 0;

            return NOT_APPLICABLE;
        }
    },

    EXOCYCLIC_DOUBLE_BOND
    {
        @Override
        int apply(Ring ring, Atom atom)
        {
            return exocyclicDoubleBond(ring, atom) != null ? DISRUPTED : NOT_APPLICABLE;
        }
    },

    AROMATIC_BOND_WITH_SPARE_VALENCE
    {
        @Override
        int apply(Ring ring, Atom atom)
        {
            for(Bond bond : ring.molecule.getBonds(atom.getId()))
                if(bond.isAromatic() && ring.atoms.contains(bond.getOther(atom.getId()))
                        && ValenceModel.getSpareValence(ring.molecule, atom) >= 1)
                    return 1;

            return NOT_APPLICABLE;
        }
    },

    CARBON_ION
    {
        @Override
        int apply(Ring ring, Atom atom)
        {
            if(atom.getAtomicNumber() != AtomicNumbers.C)
                return NOT_APPLICABLE;

            if(atom.getCharge() == -1)
                return 2;
            else if(atom.getCharge() == 1)
                return 0;

            return DISRUPTED;
        }
    },

    PNICTOGEN_LONE_PAIR
    {
        @Override
        int apply(Ring ring, Atom atom)
        {
            if(!isPnictogen(atom.getAtomicNumber()))
                return NOT_APPLICABLE;

            if(atom.getCharge() < 0 || atom.getHydrogenCount() > 0)
                return 2;

            return NOT_APPLICABLE;
        }
    },

    PNICTOGEN_SUBSTITUTED
    {
        @Override
        int apply(Ring ring, Atom atom)
        {
            if(!isPnictogen(atom.getAtomicNumber()))
                return NOT_APPLICABLE;

            boolean substituted = false;

            for(int neighbour : ring.molecule.getNeighbours(atom.getId()))
            {
                if(ring.atoms.contains(neighbour))
                    continue;

                if(ring.molecule.getAtom(neighbour).getAtomicNumber() != AtomicNumbers.C)
                    return 2;

                substituted = true;
            }

            return substituted ? 1 : NOT_APPLICABLE;
        }
    },

    PNICTOGEN
    {
        @Override
        int apply(Ring ring, Atom atom)
        {
            return isPnictogen(atom.getAtomicNumber()) ? 1 : NOT_APPLICABLE;
        }
    },

    CHALCOGEN
    {
        @Override
        int apply(Ring ring, Atom atom)
        {
            int number = atom.getAtomicNumber();

            if(number != AtomicNumbers.O && number != AtomicNumbers.S && number != AtomicNumbers.Se
                    && number != AtomicNumbers.Te)
                return NOT_APPLICABLE;

            if(atom.getCharge() == 0 && atom.getHydrogenCount() == 0
                    && ring.molecule.getDegree(atom.getId()) == 2)
                return 2;

            return DISRUPTED;
        }
    },

    BORON
    {
        @Override
        int apply(Ring ring, Atom atom)
        {
            return atom.getAtomicNumber() == AtomicNumbers.B ? 0 : NOT_APPLICABLE;
        }
    },

    SATURATED
    {
        @Override
        int apply(Ring ring, Atom atom)
        {
            return DISRUPTED;
        }
    };


    static final int DISRUPTED = -1;
    static final int NOT_APPLICABLE = Integer.MIN_VALUE;


    /**
     * Atoms of a ring, or of the perimeter of two fused rings, under evaluation.
     */
    static class Ring
    {
        final Molecule molecule;
        final RingInfo ringInfo;
        final Set<Integer> atoms;

        Ring(Molecule molecule, RingInfo ringInfo, Set<Integer> atoms)
        {
            this.molecule = molecule;
            this.ringInfo = ringInfo;
            this.atoms = atoms;
        }
    }


    abstract int apply(Ring ring, Atom atom);


    /**
     * @return number of donated pi electrons, or {@link #DISRUPTED} when the atom breaks the conjugation
     */
    static int contribution(Ring ring, Atom atom)
    {
        for(PiElectronRule rule : values())
        {
            int value = rule.apply(ring, atom);

            if(value != NOT_APPLICABLE)
                return value;
        }

        return DISRUPTED;
    }


    private static Bond exocyclicDoubleBond(Ring ring, Atom atom)
    {
        for(Bond bond : ring.molecule.getBonds(atom.getId()))
            if(bond.getOrder() == BondOrder.DOUBLE && !ring.atoms.contains(bond.getOther(atom.getId())))
                return bond;

        return null;
    }


    private static boolean isPnictogen(int number)
    {
        return number == AtomicNumbers.N || number == AtomicNumbers.P || number == AtomicNumbers.As;
    }


    private static boolean isSupported(int number)
    {
        return number == AtomicNumbers.C || number == AtomicNumbers.N || number == AtomicNumbers.O
                || number == AtomicNumbers.S || number == AtomicNumbers.P || number == AtomicNumbers.Se
                || number == AtomicNumbers.As || number == AtomicNumbers.B || number == AtomicNumbers.Te;
    }
}

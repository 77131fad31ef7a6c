package cz.iocb.chemgraph.molecule;

import java.util.Arrays;
import java.util.Objects;



/**
 * Immutable atom of a molecular graph.
 */
public class Atom
{
    /** Placeholder for the implicit hydrogen in the chirality reference order. */
    public static final int IMPLICIT_HYDROGEN = -1;

    private static final int[] EMPTY = new int[0];

    private final int id;
    private final String symbol;
    private final int atomicNumber;
    private final int charge;
    private final int isotope;
    private final int hydrogenCount;
    private final boolean aromatic;
    private final String chirality;
    private final int atomClass;
    private final boolean bracket;
    private final boolean valenceValid;
    private final int[] ringIds;
    private final int[] neighbourOrder;


    public Atom(int id, String symbol, int atomicNumber, int charge, int isotope, int hydrogenCount, boolean aromatic,
            String chirality, int atomClass, boolean bracket, boolean valenceValid, int[] ringIds,
            int[] neighbourOrder)
    {
        if(symbol == null)
            throw new IllegalArgumentException("atom symbol is missing");

        if(hydrogenCount < 0)
            throw new IllegalArgumentException("negative hydrogen count on atom " + id);

        this.id = id;
        this.symbol = symbol;
        this.atomicNumber = atomicNumber;
        this.charge = charge;
        this.isotope = isotope;
        this.hydrogenCount = hydrogenCount;
        this.aromatic = aromatic;
        this.chirality = chirality;
        this.atomClass = atomClass;
        this.bracket = bracket;
        this.valenceValid = valenceValid;
        this.ringIds = ringIds == null ? EMPTY : ringIds.clone();
        this.neighbourOrder = neighbourOrder == null ? EMPTY : neighbourOrder.clone();
    }


    public Atom(int id, String symbol, int atomicNumber, int hydrogenCount)
    {
        this(id, symbol, atomicNumber, 0, 0, hydrogenCount, false, null, 0, false, true, null, null);
    }


    public Atom withAromatic(boolean aromatic)
    {
        if(aromatic == this.aromatic)
            return this;

        return new Atom(id, symbol, atomicNumber, charge, isotope, hydrogenCount, aromatic, chirality, atomClass,
                bracket, valenceValid, ringIds, neighbourOrder);
    }


    public Atom withHydrogenCount(int hydrogenCount)
    {
        return new Atom(id, symbol, atomicNumber, charge, isotope, hydrogenCount, aromatic, chirality, atomClass,
                bracket, valenceValid, ringIds, neighbourOrder);
    }


    public Atom withChirality(String chirality, int[] neighbourOrder)
    {
        return new Atom(id, symbol, atomicNumber, charge, isotope, hydrogenCount, aromatic, chirality, atomClass,
                bracket, valenceValid, ringIds, neighbourOrder);
    }


    public Atom withValenceValid(boolean valenceValid)
    {
        if(valenceValid == this.valenceValid)
            return this;

        return new Atom(id, symbol, atomicNumber, charge, isotope, hydrogenCount, aromatic, chirality, atomClass,
                bracket, valenceValid, ringIds, neighbourOrder);
    }


    public Atom withRingIds(int[] ringIds)
    {
        return new Atom(id, symbol, atomicNumber, charge, isotope, hydrogenCount, aromatic, chirality, atomClass,
                bracket, valenceValid, ringIds, neighbourOrder);
    }


    public int getId()
    {
        return id;
    }


    public String getSymbol()
    {
        return symbol;
    }


    public int getAtomicNumber()
    {
        return atomicNumber;
    }


    public int getCharge()
    {
        return charge;
    }


    /**
     * @return mass number, or 0 when no isotope was given
     */
    public int getIsotope()
    {
        return isotope;
    }


    /**
     * @return total number of attached hydrogens, implicit and bracket ones together
     */
    public int getHydrogenCount()
    {
        return hydrogenCount;
    }


    public boolean isAromatic()
    {
        return aromatic;
    }


    /**
     * @return chirality marker as written (@, @@, @TH1, @SP2, ...), or null
     */
    public String getChirality()
    {
        return chirality;
    }


    public int getAtomClass()
    {
        return atomClass;
    }


    public boolean isBracket()
    {
        return bracket;
    }


    public boolean isValenceValid()
    {
        return valenceValid;
    }


    public int[] getRingIds()
    {
        return ringIds.clone();
    }


    public int getRingCount()
    {
        return ringIds.length;
    }


    public boolean isInRing()
    {
        return ringIds.length > 0;
    }


    /**
     * Returns neighbour ids in the order the chirality marker refers to. The implicit hydrogen is represented by
     * {@link #IMPLICIT_HYDROGEN}.
     */
    public int[] getNeighbourOrder()
    {
        return neighbourOrder.clone();
    }


    @Override
    public boolean equals(Object object)
    {
        if(this == object)
            return true;

        if(!(object instanceof Atom))
            return false;

        Atom other = (Atom) object;

        return id == other.id && atomicNumber == other.atomicNumber && charge == other.charge
                && isotope == other.isotope && hydrogenCount == other.hydrogenCount && aromatic == other.aromatic
                && atomClass == other.atomClass && bracket == other.bracket && valenceValid == other.valenceValid
                && symbol.equals(other.symbol) && Objects.equals(chirality, other.chirality)
                && Arrays.equals(ringIds, other.ringIds) && Arrays.equals(neighbourOrder, other.neighbourOrder);
    }


    @Override
    public int hashCode()
    {
        return Objects.hash(id, symbol, charge, isotope, hydrogenCount, aromatic, chirality);
    }


    @Override
    public String toString()
    {
        return (aromatic ? symbol.toLowerCase() : symbol) + id;
    }
}

package cz.iocb.chemgraph.molecule;

import java.util.Arrays;
import java.util.Objects;



/**
 * Immutable bond of a molecular graph. The atoms are kept in the order they were written, the direction refers to
 * the way from the first to the second atom.
 */
public class Bond
{
    private static final int[] EMPTY = new int[0];

    private final int id;
    private final int atom1;
    private final int atom2;
    private final BondOrder order;
    private final BondDirection direction;
    private final int[] ringIds;


    public Bond(int id, int atom1, int atom2, BondOrder order, BondDirection direction, int[] ringIds)
    {
        if(atom1 == atom2)
            throw new IllegalArgumentException("bond " + id + " connects atom " + atom1 + " to itself");

        if(order == null)
            throw new IllegalArgumentException("bond order is missing");

        this.id = id;
        this.atom1 = atom1;
        this.atom2 = atom2;
        this.order = order;
        this.direction = direction == null ? BondDirection.NONE : direction;
        this.ringIds = ringIds == null ? EMPTY : ringIds.clone();
    }


    public Bond(int id, int atom1, int atom2, BondOrder order)
    {
        this(id, atom1, atom2, order, BondDirection.NONE, null);
    }


    public Bond withOrder(BondOrder order)
    {
        if(order == this.order)
            return this;

        return new Bond(id, atom1, atom2, order, direction, ringIds);
    }


    public Bond withRingIds(int[] ringIds)
    {
        return new Bond(id, atom1, atom2, order, direction, ringIds);
    }


    public int getId()
    {
        return id;
    }


    public int getAtom1()
    {
        return atom1;
    }


    public int getAtom2()
    {
        return atom2;
    }


    public boolean contains(int atom)
    {
        return atom1 == atom || atom2 == atom;
    }


    public int getOther(int atom)
    {
        if(atom == atom1)
            return atom2;
        else if(atom == atom2)
            return atom1;

        throw new IllegalArgumentException("atom " + atom + " is not part of bond " + id);
    }


    public BondOrder getOrder()
    {
        return order;
    }


    public boolean isAromatic()
    {
        return order == BondOrder.AROMATIC;
    }


    public BondDirection getDirection()
    {
        return direction;
    }


    /**
     * Returns the direction as seen when walking from the given atom to the other one.
     */
    public BondDirection getDirectionFrom(int atom)
    {
        return atom == atom1 ? direction : direction.flip();
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


    @Override
    public boolean equals(Object object)
    {
        if(this == object)
            return true;

        if(!(object instanceof Bond))
            return false;

        Bond other = (Bond) object;

        if(id != other.id || order != other.order || !Arrays.equals(ringIds, other.ringIds))
            return false;

        if(atom1 == other.atom1 && atom2 == other.atom2)
            return direction == other.direction;

        return atom1 == other.atom2 && atom2 == other.atom1 && direction == other.direction.flip();
    }


    @Override
    public int hashCode()
    {
        return Objects.hash(id, Math.min(atom1, atom2), Math.max(atom1, atom2), order);
    }


    @Override
    public String toString()
    {
        return atom1 + "-" + atom2 + ":" + order;
    }
}

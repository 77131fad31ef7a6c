package cz.iocb.chemgraph.molecule;



public enum BondOrder
{
    SINGLE(1), DOUBLE(2), TRIPLE(3), QUADRUPLE(4), AROMATIC(11);

    private int value;

    private BondOrder(int value)
    {
        this.value = value;
    };

    public int getValue()
    {
        return value;
    }


    /**
     * Returns the contribution of the bond to the valence of its atoms. An aromatic bond counts as one, its extra
     * electron is accounted for by the aromatic valence tables.
     */
    public int getValence()
    {
        return this == AROMATIC ? 1 : value;
    }
}

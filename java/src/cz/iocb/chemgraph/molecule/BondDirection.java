package cz.iocb.chemgraph.molecule;



public enum BondDirection
{
    NONE(0), UP(1), DOWN(2);

    private int value;

    private BondDirection(int value)
    {
        this.value = value;
    };

    public int getValue()
    {
        return value;
    }


    public BondDirection flip()
    {
        if(this == UP)
            return DOWN;
        else if(this == DOWN)
            return UP;
        else
            return NONE;
    }
}

package cz.iocb.chemgraph.smiles;



public enum ErrorKind
{
    SYNTAX(0), RING_CLOSURE(1), UNSUPPORTED_ELEMENT(2), VALENCE(3), KEKULIZATION(4);

    private int value;

    private ErrorKind(int value)
    {
        this.value = value;
    };

    public int getValue()
    {
        return value;
    }
}

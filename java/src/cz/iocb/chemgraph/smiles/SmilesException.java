package cz.iocb.chemgraph.smiles;



public class SmilesException extends Exception
{
    private static final long serialVersionUID = 1L;

    private final ErrorKind kind;
    private final int position;


    public SmilesException(ErrorKind kind, String message, int position)
    {
        super(message);
        this.kind = kind;
        this.position = position;
    }


    public ErrorKind getKind()
    {
        return kind;
    }


    public int getPosition()
    {
        return position;
    }
}

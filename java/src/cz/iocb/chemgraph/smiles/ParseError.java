package cz.iocb.chemgraph.smiles;



/**
 * Problem found while parsing one fragment of a SMILES string.
 */
public class ParseError
{
    private final ErrorKind kind;
    private final String message;
    private final int position;
    private final int fragment;
    private final boolean fatal;


    public ParseError(ErrorKind kind, String message, int position, int fragment, boolean fatal)
    {
        this.kind = kind;
        this.message = message;
        this.position = position;
        this.fragment = fragment;
        this.fatal = fatal;
    }


    public ErrorKind getKind()
    {
        return kind;
    }


    public String getMessage()
    {
        return message;
    }


    /**
     * @return character offset in the whole SMILES string
     */
    public int getPosition()
    {
        return position;
    }


    /**
     * @return zero-based index of the dot-separated fragment
     */
    public int getFragment()
    {
        return fragment;
    }


    /**
     * @return true if the fragment was dropped because of this error
     */
    public boolean isFatal()
    {
        return fatal;
    }


    @Override
    public String toString()
    {
        return kind + " at " + position + ": " + message;
    }
}

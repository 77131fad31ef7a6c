package cz.iocb.chemgraph.kekule;



public class KekulizationException extends Exception
{
    private static final long serialVersionUID = 1L;

    private final int atom;


    public KekulizationException(String message, int atom)
    {
        super(message);
        this.atom = atom;
    }


    /**
     * @return id of an atom of the failing aromatic system, or -1 if unknown
     */
    public int getAtom()
    {
        return atom;
    }
}

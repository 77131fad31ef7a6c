package cz.iocb.chemgraph.kekule;

import cz.iocb.chemgraph.molecule.Molecule;



/**
 * Outcome of a kekulization. A failure keeps the message instead of a molecule, it never degrades to a silently
 * non-aromatic structure.
 */
public class KekulizationResult
{
    private final Molecule molecule;
    private final String message;


    private KekulizationResult(Molecule molecule, String message)
    {
        this.molecule = molecule;
        this.message = message;
    }


    public static KekulizationResult success(Molecule molecule)
    {
        return new KekulizationResult(molecule, null);
    }


    public static KekulizationResult failure(String message)
    {
        return new KekulizationResult(null, message);
    }


    public boolean isSuccess()
    {
        return molecule != null;
    }


    /**
     * @return the kekulized molecule
     * @throws IllegalStateException if the kekulization failed
     */
    public Molecule getMolecule()
    {
        if(molecule == null)
            throw new IllegalStateException("kekulization failed: " + message);

        return molecule;
    }


    /**
     * @return failure message, or null on success
     */
    public String getMessage()
    {
        return message;
    }
}

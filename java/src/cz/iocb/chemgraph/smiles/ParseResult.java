package cz.iocb.chemgraph.smiles;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import cz.iocb.chemgraph.molecule.Molecule;



public class ParseResult
{
    private final List<Molecule> molecules;
    private final List<ParseError> errors;


    ParseResult(List<Molecule> molecules, List<ParseError> errors)
    {
        this.molecules = Collections.unmodifiableList(new ArrayList<Molecule>(molecules));
        this.errors = Collections.unmodifiableList(new ArrayList<ParseError>(errors));
    }


    /**
     * @return molecules of the fragments parsed without a fatal error, in input order
     */
    public List<Molecule> getMolecules()
    {
        return molecules;
    }


    public List<ParseError> getErrors()
    {
        return errors;
    }


    public boolean hasErrors()
    {
        return !errors.isEmpty();
    }


    public boolean hasFatalErrors()
    {
        for(ParseError error : errors)
            if(error.isFatal())
                return true;

        return false;
    }


    /**
     * @return the only molecule of the result
     * @throws IllegalStateException if the result does not hold exactly one molecule
     */
    public Molecule getMolecule()
    {
        if(molecules.size() != 1)
            throw new IllegalStateException("result holds " + molecules.size() + " molecules");

        return molecules.get(0);
    }
}

package cz.iocb.chemgraph.canonical;

import java.util.Collections;
import java.util.Map;
import cz.iocb.chemgraph.molecule.Molecule;



/**
 * Canonical ranking of the atoms of a molecule. The molecule itself keeps its atom ids.
 */
public class CanonicalResult
{
    private final Molecule molecule;
    private final Map<Integer, Integer> ranking;
    private final int[] order;


    CanonicalResult(Molecule molecule, Map<Integer, Integer> ranking, int[] order)
    {
        this.molecule = molecule;
        this.ranking = Collections.unmodifiableMap(ranking);
        this.order = order;
    }


    public Molecule getMolecule()
    {
        return molecule;
    }


    public int getRank(int atom)
    {
        Integer rank = ranking.get(atom);

        if(rank == null)
            throw new IllegalArgumentException("unknown atom id " + atom);

        return rank;
    }


    /**
     * @return map of atom ids to ranks 0 .. n-1
     */
    public Map<Integer, Integer> getRanking()
    {
        return ranking;
    }


    /**
     * @return atom ids ordered by rank
     */
    public int[] getOrder()
    {
        return order.clone();
    }
}

package cz.iocb.chemgraph.rings;

import java.util.BitSet;
import java.util.HashMap;
import java.util.Map;



/**
 * Incremental Gaussian elimination over GF(2). Rows are edge incidence vectors, each stored under its lowest set bit.
 */
class CycleBasis
{
    private final Map<Integer, BitSet> rows = new HashMap<Integer, BitSet>();


    /**
     * Adds the vector to the basis if it is independent of the vectors added so far.
     *
     * @return true if the vector was independent and has been added
     */
    boolean add(BitSet vector)
    {
        BitSet reduced = (BitSet) vector.clone();

        while(!reduced.isEmpty())
        {
            int pivot = reduced.nextSetBit(0);
            BitSet row = rows.get(pivot);

            if(row == null)
            {
                rows.put(pivot, reduced);
                return true;
            }

            reduced.xor(row);
        }

        return false;
    }


    int size()
    {
        return rows.size();
    }
}

package cz.iocb.chemgraph.molecule;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;



/**
 * Smallest set of smallest rings of a molecule. Each ring is a cyclic sequence of atom ids starting at its lowest
 * id and continuing toward the smaller of the two neighbours of that atom. Ring ids are positions in the ring list.
 */
public class RingInfo
{
    private static final int[] EMPTY = new int[0];

    private final List<int[]> ringAtoms;
    private final List<int[]> ringBonds;
    private final Map<Integer, int[]> atomRings = new HashMap<Integer, int[]>();
    private final Map<Integer, int[]> bondRings = new HashMap<Integer, int[]>();


    public RingInfo(List<int[]> ringAtoms, List<int[]> ringBonds)
    {
        if(ringAtoms.size() != ringBonds.size())
            throw new IllegalArgumentException("ring atom and ring bond lists differ in size");

        this.ringAtoms = new ArrayList<int[]>(ringAtoms.size());
        this.ringBonds = new ArrayList<int[]>(ringBonds.size());

        for(int i = 0; i < ringAtoms.size(); i++)
        {
            this.ringAtoms.add(ringAtoms.get(i).clone());
            this.ringBonds.add(ringBonds.get(i).clone());
        }

        Map<Integer, List<Integer>> atomMap = new HashMap<Integer, List<Integer>>();
        Map<Integer, List<Integer>> bondMap = new HashMap<Integer, List<Integer>>();

        for(int i = 0; i < ringAtoms.size(); i++)
        {
            for(int atom : ringAtoms.get(i))
                atomMap.computeIfAbsent(atom, k -> new ArrayList<Integer>()).add(i);

            for(int bond : ringBonds.get(i))
                bondMap.computeIfAbsent(bond, k -> new ArrayList<Integer>()).add(i);
        }

        for(Map.Entry<Integer, List<Integer>> entry : atomMap.entrySet())
            atomRings.put(entry.getKey(), toArray(entry.getValue()));

        for(Map.Entry<Integer, List<Integer>> entry : bondMap.entrySet())
            bondRings.put(entry.getKey(), toArray(entry.getValue()));
    }


    public static RingInfo empty()
    {
        return new RingInfo(Collections.<int[]> emptyList(), Collections.<int[]> emptyList());
    }


    public int getRingCount()
    {
        return ringAtoms.size();
    }


    public List<int[]> getRings()
    {
        List<int[]> rings = new ArrayList<int[]>(ringAtoms.size());

        for(int[] ring : ringAtoms)
            rings.add(ring.clone());

        return rings;
    }


    public int[] getRingAtoms(int ring)
    {
        return ringAtoms.get(ring).clone();
    }


    public int[] getRingBonds(int ring)
    {
        return ringBonds.get(ring).clone();
    }


    public int getRingSize(int ring)
    {
        return ringAtoms.get(ring).length;
    }


    public boolean isAtomInRing(int atom)
    {
        return atomRings.containsKey(atom);
    }


    public boolean isBondInRing(int bond)
    {
        return bondRings.containsKey(bond);
    }


    public int getAtomRingCount(int atom)
    {
        return atomRings.getOrDefault(atom, EMPTY).length;
    }


    public int getBondRingCount(int bond)
    {
        return bondRings.getOrDefault(bond, EMPTY).length;
    }


    public int[] getAtomRings(int atom)
    {
        return atomRings.getOrDefault(atom, EMPTY).clone();
    }


    public int[] getBondRings(int bond)
    {
        return bondRings.getOrDefault(bond, EMPTY).clone();
    }


    public boolean isAtomInRingOfSize(int atom, int size)
    {
        for(int ring : atomRings.getOrDefault(atom, EMPTY))
            if(ringAtoms.get(ring).length == size)
                return true;

        return false;
    }


    public boolean isBondInRingOfSize(int bond, int size)
    {
        for(int ring : bondRings.getOrDefault(bond, EMPTY))
            if(ringAtoms.get(ring).length == size)
                return true;

        return false;
    }


    public int[] getRingsOfSize(int size)
    {
        List<Integer> rings = new ArrayList<Integer>();

        for(int i = 0; i < ringAtoms.size(); i++)
            if(ringAtoms.get(i).length == size)
                rings.add(i);

        return toArray(rings);
    }


    /**
     * Groups rings sharing at least one atom into ring systems.
     *
     * @return ring ids of every ring system, systems ordered by their lowest ring id
     */
    public List<int[]> getRingSystems()
    {
        int[] system = new int[ringAtoms.size()];

        for(int i = 0; i < system.length; i++)
            system[i] = i;

        for(int[] rings : atomRings.values())
            for(int i = 1; i < rings.length; i++)
                union(system, rings[0], rings[i]);

        Map<Integer, List<Integer>> groups = new HashMap<Integer, List<Integer>>();
        List<Integer> roots = new ArrayList<Integer>();

        for(int i = 0; i < system.length; i++)
        {
            int root = find(system, i);

            if(!groups.containsKey(root))
            {
                groups.put(root, new ArrayList<Integer>());
                roots.add(root);
            }

            groups.get(root).add(i);
        }

        List<int[]> result = new ArrayList<int[]>(roots.size());

        for(int root : roots)
            result.add(toArray(groups.get(root)));

        return result;
    }


    private static int find(int[] parent, int i)
    {
        while(parent[i] != i)
            i = parent[i] = parent[parent[i]];

        return i;
    }


    private static void union(int[] parent, int a, int b)
    {
        int ra = find(parent, a);
        int rb = find(parent, b);

        if(ra < rb)
            parent[rb] = ra;
        else if(rb < ra)
            parent[ra] = rb;
    }


    private static int[] toArray(List<Integer> list)
    {
        int[] array = new int[list.size()];

        for(int i = 0; i < array.length; i++)
            array[i] = list.get(i);

        return array;
    }
}

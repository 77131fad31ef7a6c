package cz.iocb.chemgraph.shared;

import java.util.Map;
import java.util.WeakHashMap;
import cz.iocb.chemgraph.canonical.CanonicalResult;
import cz.iocb.chemgraph.canonical.Canonicalizer;
import cz.iocb.chemgraph.molecule.Molecule;
import cz.iocb.chemgraph.molecule.RingInfo;
import cz.iocb.chemgraph.rings.RingPerception;
import cz.iocb.chemgraph.smiles.SmilesGenerator;



/**
 * Memo table of values derived from molecules. The cache is owned by its caller and is not thread safe; entries are
 * keyed by molecule identity and disappear together with the molecule.
 */
public class DerivedValueCache
{
    private static class Entry
    {
        RingInfo ringInfo;
        CanonicalResult canonical;
        String smiles;
    }


    private final Map<Molecule, Entry> entries = new WeakHashMap<Molecule, Entry>();
    private final Canonicalizer canonicalizer;
    private final SmilesGenerator generator;
    private long generation = 0;


    public DerivedValueCache()
    {
        this(PerceptionSettings.getDefault());
    }


    public DerivedValueCache(PerceptionSettings settings)
    {
        this.canonicalizer = new Canonicalizer(settings);
        this.generator = new SmilesGenerator(settings);
    }


    public RingInfo getRingInfo(Molecule molecule)
    {
        Entry entry = entry(molecule);

        if(entry.ringInfo == null)
            entry.ringInfo = molecule.getRingInfo() != null ? molecule.getRingInfo()
                    : RingPerception.perceiveRings(molecule);

        return entry.ringInfo;
    }


    public CanonicalResult getCanonicalResult(Molecule molecule)
    {
        Entry entry = entry(molecule);

        if(entry.canonical == null)
            entry.canonical = canonicalizer.canonicalize(molecule);

        return entry.canonical;
    }


    public String getCanonicalSmiles(Molecule molecule)
    {
        Entry entry = entry(molecule);

        if(entry.smiles == null)
            entry.smiles = generator.generate(getCanonicalResult(molecule));

        return entry.smiles;
    }


    public boolean contains(Molecule molecule)
    {
        return entries.containsKey(molecule);
    }


    public void invalidate(Molecule molecule)
    {
        entries.remove(molecule);
        generation++;
    }


    public void clear()
    {
        entries.clear();
        generation++;
    }


    public int size()
    {
        return entries.size();
    }


    /**
     * @return counter incremented by every invalidation, so holders of derived values can tell they are stale
     */
    public long getGeneration()
    {
        return generation;
    }


    private Entry entry(Molecule molecule)
    {
        Entry entry = entries.get(molecule);

        if(entry == null)
        {
            entry = new Entry();
            entries.put(molecule, entry);
        }

        return entry;
    }
}

package cz.iocb.chemgraph.shared;

import java.io.IOException;
import java.io.InputStream;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;



/**
 * Tunable parameters of aromaticity perception and canonical ranking.
 */
public class PerceptionSettings
{
    private static final Logger LOGGER = LogManager.getLogger(PerceptionSettings.class);

    static final String resourceName = "/chemgraph.properties";
    static final String minRingSizeName = "aromaticity.ring.min";
    static final String maxRingSizeName = "aromaticity.ring.max";
    static final String maxSearchNodesName = "canonical.search.max";

    static final int defaultMinRingSize = 5;
    static final int defaultMaxRingSize = 7;
    static final int defaultMaxSearchNodes = 10000;

    private static volatile PerceptionSettings defaults;

    private final int minAromaticRingSize;
    private final int maxAromaticRingSize;
    private final int maxCanonicalSearchNodes;


    public PerceptionSettings(int minAromaticRingSize, int maxAromaticRingSize, int maxCanonicalSearchNodes)
    {
        if(minAromaticRingSize < 3 || maxAromaticRingSize < minAromaticRingSize)
            throw new IllegalArgumentException(
                    "invalid aromatic ring size range " + minAromaticRingSize + "-" + maxAromaticRingSize);

        if(maxCanonicalSearchNodes < 1)
            throw new IllegalArgumentException("invalid canonical search bound " + maxCanonicalSearchNodes);

        this.minAromaticRingSize = minAromaticRingSize;
        this.maxAromaticRingSize = maxAromaticRingSize;
        this.maxCanonicalSearchNodes = maxCanonicalSearchNodes;
    }


    public PerceptionSettings(ConfigurationProperties properties)
    {
        this(properties.getIntProperty(minRingSizeName, defaultMinRingSize),
                properties.getIntProperty(maxRingSizeName, defaultMaxRingSize),
                properties.getIntProperty(maxSearchNodesName, defaultMaxSearchNodes));
    }


    /**
     * Returns the settings read from chemgraph.properties on the classpath, or the built-in values when the resource
     * is absent.
     */
    public static PerceptionSettings getDefault()
    {
        if(defaults == null)
        {
            synchronized(PerceptionSettings.class)
            {
                if(defaults == null)
                    defaults = load();
            }
        }

        return defaults;
    }


    private static PerceptionSettings load()
    {
        try(InputStream stream = PerceptionSettings.class.getResourceAsStream(resourceName))
        {
            if(stream == null)
            {
                LOGGER.debug("resource " + resourceName + " not found, using built-in settings");
                return new PerceptionSettings(defaultMinRingSize, defaultMaxRingSize, defaultMaxSearchNodes);
            }

            return new PerceptionSettings(new ConfigurationProperties(stream));
        }
        catch(IOException e)
        {
            throw new IllegalStateException("cannot read " + resourceName, e);
        }
    }


    public int getMinAromaticRingSize()
    {
        return minAromaticRingSize;
    }


    public int getMaxAromaticRingSize()
    {
        return maxAromaticRingSize;
    }


    public int getMaxCanonicalSearchNodes()
    {
        return maxCanonicalSearchNodes;
    }
}

package cz.iocb.chemgraph.shared;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import java.io.ByteArrayInputStream;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Properties;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;



public class PerceptionSettingsTest
{
    @Rule
    public TemporaryFolder folder = new TemporaryFolder();


    @Test
    public void testDefaults()
    {
        PerceptionSettings settings = PerceptionSettings.getDefault();

        assertEquals(5, settings.getMinAromaticRingSize());
        assertEquals(7, settings.getMaxAromaticRingSize());
        assertEquals(10000, settings.getMaxCanonicalSearchNodes());
    }


    @Test
    public void testFromProperties()
    {
        Properties properties = new Properties();
        properties.setProperty("aromaticity.ring.max", " 6 ");

        PerceptionSettings settings = new PerceptionSettings(new ConfigurationProperties(properties));

        assertEquals(5, settings.getMinAromaticRingSize());
        assertEquals(6, settings.getMaxAromaticRingSize());
        assertEquals(10000, settings.getMaxCanonicalSearchNodes());
    }


    @Test
    public void testFromFile() throws IOException
    {
        File file = folder.newFile("chemgraph.properties");
        Files.write(file.toPath(), "aromaticity.ring.min=4\ncanonical.search.max=10\n".getBytes(
                StandardCharsets.UTF_8));

        PerceptionSettings settings = new PerceptionSettings(new ConfigurationProperties(file.getPath()));

        assertEquals(4, settings.getMinAromaticRingSize());
        assertEquals(7, settings.getMaxAromaticRingSize());
        assertEquals(10, settings.getMaxCanonicalSearchNodes());
    }


    @Test(expected = IllegalArgumentException.class)
    public void testInvalidRange()
    {
        new PerceptionSettings(7, 5, 100);
    }


    @Test(expected = IllegalArgumentException.class)
    public void testInvalidNumber() throws IOException
    {
        ConfigurationProperties properties = new ConfigurationProperties(
                new ByteArrayInputStream("aromaticity.ring.min=five".getBytes(StandardCharsets.UTF_8)));

        new PerceptionSettings(properties);
    }


    @Test
    public void testConfigurationProperties()
    {
        Properties values = new Properties();
        values.setProperty("name", "value");
        values.setProperty("flag", "TRUE");

        ConfigurationProperties properties = new ConfigurationProperties(values);

        assertTrue(properties.containsProperty("name"));
        assertFalse(properties.containsProperty("missing"));
        assertEquals("value", properties.getProperty("name"));
        assertEquals("other", properties.getProperty("missing", "other"));
        assertTrue(properties.getBooleanProperty("flag"));
        assertFalse(properties.getBooleanProperty("missing", false));
        assertEquals(3, properties.getIntProperty("missing", 3));
    }


    @Test(expected = IllegalArgumentException.class)
    public void testMissingProperty()
    {
        new ConfigurationProperties(new Properties()).getProperty("missing");
    }
}

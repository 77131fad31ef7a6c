package cz.iocb.chemgraph.shared;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.Properties;



public class ConfigurationProperties
{
    private final Properties properties = new Properties();


    public ConfigurationProperties(String fileName) throws IOException
    {
        try(InputStream stream = new FileInputStream(fileName))
        {
            load(stream);
        }
    }


    public ConfigurationProperties(InputStream stream) throws IOException
    {
        load(stream);
    }


    public ConfigurationProperties(Properties properties)
    {
        this.properties.putAll(properties);
    }


    private void load(InputStream stream) throws IOException
    {
        try(Reader reader = new InputStreamReader(stream, StandardCharsets.UTF_8))
        {
            properties.load(reader);
        }
    }


    public boolean containsProperty(String name)
    {
        return properties.getProperty(name) != null;
    }


    public String getProperty(String name)
    {
        String value = properties.getProperty(name);

        if(value == null)
            throw new IllegalArgumentException("property '" + name + "' is not set");

        return value.trim();
    }


    public String getProperty(String name, String defaultValue)
    {
        String value = properties.getProperty(name);
        return value == null ? defaultValue : value.trim();
    }


    public int getIntProperty(String name)
    {
        String value = getProperty(name);

        try
        {
            return Integer.parseInt(value);
        }
        catch(NumberFormatException e)
        {
            throw new IllegalArgumentException("property '" + name + "' is not an integer: " + value, e);
        }
    }


    public int getIntProperty(String name, int defaultValue)
    {
        return containsProperty(name) ? getIntProperty(name) : defaultValue;
    }


    public boolean getBooleanProperty(String name)
    {
        String value = getProperty(name);

        if(value.equalsIgnoreCase("true"))
            return true;
        else if(value.equalsIgnoreCase("false"))
            return false;

        throw new IllegalArgumentException("property '" + name + "' is not a boolean: " + value);
    }


    public boolean getBooleanProperty(String name, boolean defaultValue)
    {
        return containsProperty(name) ? getBooleanProperty(name) : defaultValue;
    }
}

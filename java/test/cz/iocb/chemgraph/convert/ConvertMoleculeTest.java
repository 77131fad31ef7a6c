package cz.iocb.chemgraph.convert;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import org.junit.Test;
import cz.iocb.chemgraph.shared.PerceptionSettings;



public class ConvertMoleculeTest
{
    private final ConvertMolecule converter = new ConvertMolecule(PerceptionSettings.getDefault());


    @Test
    public void testSingleLine()
    {
        assertEquals("CC(=O)O", converter.toCanonicalSmiles("OC(C)=O acetic acid"));
        assertEquals("[Cl-].[Na+]", converter.toCanonicalSmiles("[Na+].[Cl-]"));
        assertTrue(converter.toCanonicalSmiles("C1CC").startsWith("#error RING_CLOSURE at 1"));
    }


    @Test
    public void testStream() throws IOException
    {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        BufferedReader reader = new BufferedReader(new StringReader("OCC\nC(C\n\n  c1ccccc1  \n"));

        int failures;

        try(PrintStream out = new PrintStream(bytes, true, "UTF-8"))
        {
            failures = converter.convert(reader, out);
        }

        String[] lines = new String(bytes.toByteArray(), StandardCharsets.UTF_8).split("\\R");

        assertEquals(1, failures);
        assertEquals(3, lines.length);
        assertEquals("CCO", lines[0]);
        assertTrue(lines[1], lines[1].startsWith("#error SYNTAX"));
        assertEquals("c1ccccc1", lines[2]);
    }
}

/*
 * Copyright (C) 2015-2018 Jakub Galgonek   galgonek@uochb.cas.cz
 *
 * This program is free software; you can redistribute it and/or modify it under the terms of the GNU Lesser General
 * Public License as published by the Free Software Foundation; either version 2.1 of the License, or (at your option)
 * any later version. All we ask is that proper credit is given for our work, which includes - but is not limited to -
 * adding the above copyright notice to the beginning of your source code files, and to any copyright notice that you
 * may distribute with programs based on this work.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Lesser General Public License for more
 * details.
 */
package cz.iocb.chemgraph.convert;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import cz.iocb.chemgraph.shared.ConfigurationProperties;
import cz.iocb.chemgraph.shared.PerceptionSettings;
import cz.iocb.chemgraph.smiles.ParseError;
import cz.iocb.chemgraph.smiles.ParseResult;
import cz.iocb.chemgraph.smiles.SmilesGenerator;
import cz.iocb.chemgraph.smiles.SmilesParser;



/**
 * Converts a file of SMILES strings, one per line, to canonical SMILES.
 */
public class ConvertMolecule
{
    private static final Logger LOGGER = LogManager.getLogger(ConvertMolecule.class);

    private final SmilesParser parser;
    private final SmilesGenerator generator;


    public ConvertMolecule(PerceptionSettings settings)
    {
        this.parser = new SmilesParser(settings);
        this.generator = new SmilesGenerator(settings);
    }


    /**
     * Converts one SMILES string.
     *
     * @return canonical SMILES, or a line starting with '#' describing the first fatal error
     */
    public String toCanonicalSmiles(String smiles)
    {
        ParseResult result = parser.parse(smiles);

        for(ParseError error : result.getErrors())
            if(error.isFatal())
                return "#error " + error.getKind() + " at " + error.getPosition() + ": " + error.getMessage();

        return generator.generate(result.getMolecules(), true);
    }


    /**
     * Converts every non-empty line of the reader.
     *
     * @return number of lines that could not be converted
     */
    public int convert(BufferedReader reader, PrintStream out) throws IOException
    {
        int failures = 0;
        String line;

        while((line = reader.readLine()) != null)
        {
            if(line.trim().isEmpty())
                continue;

            String converted = toCanonicalSmiles(line.trim());

            if(converted.startsWith("#"))
                failures++;

            out.println(converted);
        }

        return failures;
    }


    public static void main(String[] args) throws Exception
    {
        if(args.length < 1 || args.length > 2)
        {
            System.err.println("wrong number of parameters");
            System.exit(1);
        }


        PerceptionSettings settings = PerceptionSettings.getDefault();

        if(args.length == 2)
            settings = new PerceptionSettings(new ConfigurationProperties(args[1]));

        ConvertMolecule converter = new ConvertMolecule(settings);

        try(BufferedReader reader = Files.newBufferedReader(Paths.get(args[0]), StandardCharsets.UTF_8))
        {
            int failures = converter.convert(reader, System.out);

            if(failures > 0)
                LOGGER.warn(failures + " lines of " + args[0] + " could not be converted");
        }
    }
}

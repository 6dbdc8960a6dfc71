// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;


/**
 * Tests for the configuration.
 *
 * @author Jürgen Moßgraber
 */
class ConverterConfigTest
{
    @Test
    void bundledDefaults () throws IOException
    {
        final ConverterConfig config = new ConverterConfig ((File) null);
        assertEquals ("2.24.0", config.getLilyPondVersion ());
        assertEquals ("5.0", config.getMeiVersion ());
        assertEquals (2, config.getSerializerIndent ());
        assertTrue (config.isXmlFormatted ());
    }


    @Test
    void userFileOverridesDefaults (@TempDir final Path folder) throws IOException
    {
        final Path userFile = folder.resolve ("user.properties");
        Files.writeString (userFile, "serializer.indent = 4\nxml.formatted=false\n", StandardCharsets.UTF_8);
        final ConverterConfig config = new ConverterConfig (userFile.toFile ());
        assertEquals (4, config.getSerializerIndent ());
        assertFalse (config.isXmlFormatted ());
        assertEquals ("2.24.0", config.getLilyPondVersion ());
    }


    @Test
    void missingUserFileIsIgnored (@TempDir final Path folder) throws IOException
    {
        final ConverterConfig config = new ConverterConfig (folder.resolve ("missing.properties").toFile ());
        assertEquals ("5.0", config.getMeiVersion ());
    }


    @Test
    void invalidIndent () throws IOException
    {
        final Properties overrides = new Properties ();
        overrides.setProperty (ConverterConfig.SERIALIZER_INDENT, "wide");
        overrides.setProperty (ConverterConfig.LILYPOND_VERSION, "2.22.1");
        final ConverterConfig config = new ConverterConfig (overrides);
        assertEquals ("2.22.1", config.getLilyPondVersion ());
        assertThrows (IllegalArgumentException.class, config::getSerializerIndent);
    }
}

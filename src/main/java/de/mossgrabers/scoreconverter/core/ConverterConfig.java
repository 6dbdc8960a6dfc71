// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.core;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.Properties;


/**
 * The settings of the converter. The bundled defaults are overridden by the properties of the file
 * ".scoreconverter.properties" in the home folder of the user, if present.
 *
 * @author Jürgen Moßgraber
 */
public class ConverterConfig
{
    /** The LilyPond version written if a document does not contain one. */
    public static final String  LILYPOND_VERSION  = "lilypond.version";
    /** The MEI version written into created documents. */
    public static final String  MEI_VERSION       = "mei.version";
    /** The number of spaces per indentation level of written LilyPond files. */
    public static final String  SERIALIZER_INDENT = "serializer.indent";
    /** Indent written XML. */
    public static final String  XML_FORMATTED     = "xml.formatted";

    private static final String DEFAULTS          = "/de/mossgrabers/scoreconverter/scoreconverter.properties";
    private static final String USER_FILE         = ".scoreconverter.properties";

    private final Properties    properties        = new Properties ();


    /**
     * Constructor. Loads the bundled defaults and the file of the user.
     *
     * @throws IOException Could not read one of the files
     */
    public ConverterConfig () throws IOException
    {
        this (new File (System.getProperty ("user.home"), USER_FILE));
    }


    /**
     * Constructor. Loads the bundled defaults and the given file.
     *
     * @param userFile The file with the settings of the user, ignored if it does not exist
     * @throws IOException Could not read one of the files
     */
    public ConverterConfig (final File userFile) throws IOException
    {
        try (final InputStream in = ConverterConfig.class.getResourceAsStream (DEFAULTS))
        {
            if (in == null)
                throw new IOException ("Missing resource " + DEFAULTS);
            load (this.properties, in);
        }

        if (userFile != null && userFile.isFile ())
        {
            try (final InputStream in = new FileInputStream (userFile))
            {
                load (this.properties, in);
            }
        }
    }


    /**
     * Constructor which only uses the given properties on top of the bundled defaults. For tests.
     *
     * @param overrides The properties to apply
     * @throws IOException Could not read the defaults
     */
    public ConverterConfig (final Properties overrides) throws IOException
    {
        this ((File) null);
        this.properties.putAll (overrides);
    }


    /**
     * Get the LilyPond version to write if a document does not contain one.
     *
     * @return The version
     */
    public String getLilyPondVersion ()
    {
        return this.properties.getProperty (LILYPOND_VERSION, "2.24.0");
    }


    /**
     * Get the MEI version to write.
     *
     * @return The version
     */
    public String getMeiVersion ()
    {
        return this.properties.getProperty (MEI_VERSION, "5.0");
    }


    /**
     * Get the number of spaces per indentation level.
     *
     * @return The number of spaces
     */
    public int getSerializerIndent ()
    {
        final String value = this.properties.getProperty (SERIALIZER_INDENT, "2").trim ();
        try
        {
            return Math.max (0, Integer.parseInt (value));
        }
        catch (final NumberFormatException ex)
        {
            throw new IllegalArgumentException (SERIALIZER_INDENT + " is not a number: " + value, ex);
        }
    }


    /**
     * Should written XML be indented?
     *
     * @return True to indent
     */
    public boolean isXmlFormatted ()
    {
        return Boolean.parseBoolean (this.properties.getProperty (XML_FORMATTED, "true").trim ());
    }


    private static void load (final Properties properties, final InputStream in) throws IOException
    {
        try (final Reader reader = new InputStreamReader (in, StandardCharsets.UTF_8))
        {
            properties.load (reader);
        }
    }
}

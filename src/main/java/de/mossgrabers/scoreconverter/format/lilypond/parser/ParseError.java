// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.lilypond.parser;

import java.text.ParseException;


/**
 * A fatal error while parsing a LilyPond source. Carries the offset of the offending token and a
 * description of the construct which was expected there.
 *
 * @author Jürgen Moßgraber
 */
public class ParseError extends ParseException
{
    private static final long serialVersionUID = 4326018815361285711L;

    private final String      expected;


    /**
     * Constructor.
     *
     * @param message The error message
     * @param offset The offset in the source
     * @param expected The expected construct
     */
    public ParseError (final String message, final int offset, final String expected)
    {
        super (message + " at offset " + offset + " (expected " + expected + ")", offset);
        this.expected = expected;
    }


    /**
     * Get the description of the construct which was expected.
     *
     * @return The description
     */
    public String getExpected ()
    {
        return this.expected;
    }
}

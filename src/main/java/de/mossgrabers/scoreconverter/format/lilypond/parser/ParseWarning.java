// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.lilypond.parser;

/**
 * A non-fatal problem found while parsing. The input was accepted.
 *
 * @author Jürgen Moßgraber
 */
public class ParseWarning
{
    /** The kinds of warnings. */
    public enum Type
    {
        /** Both ' and , marks on one pitch. The net shift is their sum. */
        MIXED_OCTAVE_MARKS,
        /** Octave marks written after the duration instead of before it. */
        OCTAVE_AFTER_DURATION,
        /** An unexpected construct was skipped. */
        RECOVERED_ERROR
    }


    private final Type   type;
    private final int    offset;
    private final String message;


    /**
     * Constructor.
     *
     * @param type The type of the warning
     * @param offset The offset in the source
     * @param message A description
     */
    public ParseWarning (final Type type, final int offset, final String message)
    {
        this.type = type;
        this.offset = offset;
        this.message = message;
    }


    public Type getType ()
    {
        return this.type;
    }


    public int getOffset ()
    {
        return this.offset;
    }


    public String getMessage ()
    {
        return this.message;
    }


    /** {@inheritDoc} */
    @Override
    public String toString ()
    {
        return this.type + " at " + this.offset + ": " + this.message;
    }
}

// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.lilypond.model;

/**
 * The modes of a key signature.
 *
 * @author Jürgen Moßgraber
 */
public enum KeyMode
{
    MAJOR(0),
    MINOR(-3),
    IONIAN(0),
    DORIAN(-2),
    PHRYGIAN(-4),
    LYDIAN(1),
    MIXOLYDIAN(-1),
    AEOLIAN(-3),
    LOCRIAN(-5);


    private final int fifthsOffset;


    private KeyMode (final int fifthsOffset)
    {
        this.fifthsOffset = fifthsOffset;
    }


    /**
     * Get the offset on the circle of fifths relative to the major key with the same tonic.
     *
     * @return The offset
     */
    public int getFifthsOffset ()
    {
        return this.fifthsOffset;
    }


    /**
     * Get the command name.
     *
     * @return The name, e.g. 'major'
     */
    public String getName ()
    {
        return this.name ().toLowerCase ();
    }


    /**
     * Lookup a mode by its command name.
     *
     * @param name The name
     * @return The mode or null if unknown
     */
    public static KeyMode fromName (final String name)
    {
        for (final KeyMode mode: values ())
        {
            if (mode.getName ().equals (name))
                return mode;
        }
        return null;
    }
}

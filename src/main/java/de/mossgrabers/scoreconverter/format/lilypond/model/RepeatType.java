// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.lilypond.model;

/**
 * The kinds of repeats.
 *
 * @author Jürgen Moßgraber
 */
public enum RepeatType
{
    VOLTA,
    UNFOLD,
    PERCENT,
    TREMOLO,
    SEGNO;


    /**
     * Get the name used in the source.
     *
     * @return The name, e.g. 'volta'
     */
    public String getName ()
    {
        return this.name ().toLowerCase ();
    }


    /**
     * Lookup a repeat type by its name.
     *
     * @param name The name
     * @return The type or null
     */
    public static RepeatType fromName (final String name)
    {
        for (final RepeatType type: values ())
        {
            if (type.getName ().equals (name))
                return type;
        }
        return null;
    }
}

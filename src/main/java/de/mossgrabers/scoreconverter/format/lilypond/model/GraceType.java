// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.lilypond.model;

/**
 * The kinds of grace note groups.
 *
 * @author Jürgen Moßgraber
 */
public enum GraceType
{
    GRACE("grace"),
    ACCIACCATURA("acciaccatura"),
    APPOGGIATURA("appoggiatura"),
    SLASHED_GRACE("slashedGrace");


    private final String command;


    private GraceType (final String command)
    {
        this.command = command;
    }


    public String getCommand ()
    {
        return this.command;
    }


    /**
     * Lookup a grace type by its command name.
     *
     * @param command The command without backslash
     * @return The type or null
     */
    public static GraceType fromCommand (final String command)
    {
        for (final GraceType type: values ())
        {
            if (type.command.equals (command))
                return type;
        }
        return null;
    }
}

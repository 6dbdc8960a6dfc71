// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.lilypond.model;

/**
 * The kinds of output definition blocks.
 *
 * @author Jürgen Moßgraber
 */
public enum OutputDefType
{
    PAPER("paper"),
    LAYOUT("layout"),
    MIDI("midi");


    private final String command;


    private OutputDefType (final String command)
    {
        this.command = command;
    }


    public String getCommand ()
    {
        return this.command;
    }


    /**
     * Lookup a type by its command.
     *
     * @param command The command without backslash
     * @return The type or null
     */
    public static OutputDefType fromCommand (final String command)
    {
        for (final OutputDefType type: values ())
        {
            if (type.command.equals (command))
                return type;
        }
        return null;
    }
}

// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.lilypond.model;

/**
 * The commands which change context properties or grob properties.
 *
 * @author Jürgen Moßgraber
 */
public enum PropertyCommand
{
    OVERRIDE("override", true),
    REVERT("revert", false),
    SET("set", true),
    UNSET("unset", false);


    private final String  command;
    private final boolean hasValue;


    private PropertyCommand (final String command, final boolean hasValue)
    {
        this.command = command;
        this.hasValue = hasValue;
    }


    public String getCommand ()
    {
        return this.command;
    }


    /**
     * Check if the command is followed by '= value'.
     *
     * @return True if it has a value
     */
    public boolean hasValue ()
    {
        return this.hasValue;
    }


    /**
     * Lookup a command.
     *
     * @param command The command without backslash
     * @return The property command or null
     */
    public static PropertyCommand fromCommand (final String command)
    {
        for (final PropertyCommand value: values ())
        {
            if (value.command.equals (command))
                return value;
        }
        return null;
    }
}

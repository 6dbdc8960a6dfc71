// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.lilypond.model;

/**
 * A property command: override, revert, set or unset.
 *
 * @author Jürgen Moßgraber
 */
public class PropertyOperation extends Music
{
    private final PropertyCommand command;
    private final boolean         once;
    private final String          path;
    private final String          value;


    /**
     * Constructor.
     *
     * @param command The command
     * @param once True if prefixed by \once
     * @param path The property path, e.g. Staff.TimeSignature.color
     * @param value The source text of the value, null for revert and unset
     */
    public PropertyOperation (final PropertyCommand command, final boolean once, final String path, final String value)
    {
        this.command = command;
        this.once = once;
        this.path = path;
        this.value = value;
    }


    public PropertyCommand getCommand ()
    {
        return this.command;
    }


    public boolean isOnce ()
    {
        return this.once;
    }


    public String getPath ()
    {
        return this.path;
    }


    public String getValue ()
    {
        return this.value;
    }


    /** {@inheritDoc} */
    @Override
    public <R> R accept (final MusicVisitor<R> visitor)
    {
        return visitor.visitPropertyOperation (this);
    }


    /** {@inheritDoc} */
    @Override
    protected Object [] getFields ()
    {
        return new Object []
        {
            this.command,
            Boolean.valueOf (this.once),
            this.path,
            this.value
        };
    }
}

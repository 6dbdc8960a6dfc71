// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.lilypond.model;

/**
 * A reference to a variable, e.g. \melody.
 *
 * @author Jürgen Moßgraber
 */
public class IdentifierMusic extends Music
{
    private final String name;


    /**
     * Constructor.
     *
     * @param name The name of the variable
     */
    public IdentifierMusic (final String name)
    {
        this.name = name;
    }


    public String getName ()
    {
        return this.name;
    }


    /** {@inheritDoc} */
    @Override
    public <R> R accept (final MusicVisitor<R> visitor)
    {
        return visitor.visitIdentifierMusic (this);
    }


    /** {@inheritDoc} */
    @Override
    protected Object [] getFields ()
    {
        return new Object []
        {
            this.name
        };
    }
}

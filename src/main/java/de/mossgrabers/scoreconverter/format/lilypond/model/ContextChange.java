// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.lilypond.model;

/**
 * A change to another context, e.g. \change Staff = "down".
 *
 * @author Jürgen Moßgraber
 */
public class ContextChange extends Music
{
    private final String contextType;
    private final String name;


    /**
     * Constructor.
     *
     * @param contextType The type of the context
     * @param name The name of the context
     */
    public ContextChange (final String contextType, final String name)
    {
        this.contextType = contextType;
        this.name = name;
    }


    public String getContextType ()
    {
        return this.contextType;
    }


    public String getName ()
    {
        return this.name;
    }


    /** {@inheritDoc} */
    @Override
    public <R> R accept (final MusicVisitor<R> visitor)
    {
        return visitor.visitContextChange (this);
    }


    /** {@inheritDoc} */
    @Override
    protected Object [] getFields ()
    {
        return new Object []
        {
            this.contextType,
            this.name
        };
    }
}

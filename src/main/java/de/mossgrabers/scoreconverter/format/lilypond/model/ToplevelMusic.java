// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.lilypond.model;

/**
 * A music expression on the top level or in a block.
 *
 * @author Jürgen Moßgraber
 */
public class ToplevelMusic extends ToplevelExpression
{
    private final Music music;


    /**
     * Constructor.
     *
     * @param music The music
     */
    public ToplevelMusic (final Music music)
    {
        this.music = music;
    }


    public Music getMusic ()
    {
        return this.music;
    }


    /** {@inheritDoc} */
    @Override
    public <R> R accept (final ToplevelVisitor<R> visitor)
    {
        return visitor.visitMusic (this);
    }


    /** {@inheritDoc} */
    @Override
    protected Object [] getFields ()
    {
        return new Object []
        {
            this.music
        };
    }
}

// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.lilypond.model;

/**
 * A group of grace notes.
 *
 * @author Jürgen Moßgraber
 */
public class GraceMusic extends Music
{
    private final GraceType graceType;
    private final Music     body;


    /**
     * Constructor.
     *
     * @param graceType The kind of grace notes
     * @param body The grace notes
     */
    public GraceMusic (final GraceType graceType, final Music body)
    {
        this.graceType = graceType;
        this.body = body;
    }


    public GraceType getGraceType ()
    {
        return this.graceType;
    }


    public Music getBody ()
    {
        return this.body;
    }


    /** {@inheritDoc} */
    @Override
    public <R> R accept (final MusicVisitor<R> visitor)
    {
        return visitor.visitGraceMusic (this);
    }


    /** {@inheritDoc} */
    @Override
    protected Object [] getFields ()
    {
        return new Object []
        {
            this.graceType,
            this.body
        };
    }
}

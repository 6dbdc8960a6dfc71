// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.lilypond.model;

import java.util.List;


/**
 * A repeat with optional alternative endings.
 *
 * @author Jürgen Moßgraber
 */
public class RepeatMusic extends Music
{
    private final RepeatType  repeatType;
    private final int         count;
    private final Music       body;
    private final List<Music> alternatives;


    /**
     * Constructor.
     *
     * @param repeatType The kind of repeat
     * @param count The number of repetitions
     * @param body The repeated music
     * @param alternatives The alternative endings, null if there is no \alternative block
     */
    public RepeatMusic (final RepeatType repeatType, final int count, final Music body, final List<Music> alternatives)
    {
        this.repeatType = repeatType;
        this.count = count;
        this.body = body;
        this.alternatives = alternatives == null ? null : List.copyOf (alternatives);
    }


    public RepeatType getRepeatType ()
    {
        return this.repeatType;
    }


    public int getCount ()
    {
        return this.count;
    }


    public Music getBody ()
    {
        return this.body;
    }


    public List<Music> getAlternatives ()
    {
        return this.alternatives;
    }


    /** {@inheritDoc} */
    @Override
    public <R> R accept (final MusicVisitor<R> visitor)
    {
        return visitor.visitRepeatMusic (this);
    }


    /** {@inheritDoc} */
    @Override
    protected Object [] getFields ()
    {
        return new Object []
        {
            this.repeatType,
            Integer.valueOf (this.count),
            this.body,
            this.alternatives
        };
    }
}

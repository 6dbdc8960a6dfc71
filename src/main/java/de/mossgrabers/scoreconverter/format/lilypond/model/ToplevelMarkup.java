// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.lilypond.model;

/**
 * A top-level \markup or \markuplist.
 *
 * @author Jürgen Moßgraber
 */
public class ToplevelMarkup extends ToplevelExpression
{
    private final Markup  markup;
    private final boolean list;


    /**
     * Constructor.
     *
     * @param markup The markup
     * @param list True for \markuplist
     */
    public ToplevelMarkup (final Markup markup, final boolean list)
    {
        this.markup = markup;
        this.list = list;
    }


    public Markup getMarkup ()
    {
        return this.markup;
    }


    public boolean isList ()
    {
        return this.list;
    }


    /** {@inheritDoc} */
    @Override
    public <R> R accept (final ToplevelVisitor<R> visitor)
    {
        return visitor.visitMarkup (this);
    }


    /** {@inheritDoc} */
    @Override
    protected Object [] getFields ()
    {
        return new Object []
        {
            this.markup,
            Boolean.valueOf (this.list)
        };
    }
}

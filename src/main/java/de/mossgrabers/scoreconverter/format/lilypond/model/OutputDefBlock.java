// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.lilypond.model;

import java.util.List;


/**
 * A \paper, \layout or \midi block. Contains assignments and raw \context blocks.
 *
 * @author Jürgen Moßgraber
 */
public class OutputDefBlock extends ToplevelExpression
{
    private final OutputDefType            type;
    private final List<ToplevelExpression> items;


    /**
     * Constructor.
     *
     * @param type The type of the block
     * @param items The assignments and raw blocks
     */
    public OutputDefBlock (final OutputDefType type, final List<ToplevelExpression> items)
    {
        this.type = type;
        this.items = List.copyOf (items);
    }


    public OutputDefType getType ()
    {
        return this.type;
    }


    public List<ToplevelExpression> getItems ()
    {
        return this.items;
    }


    /** {@inheritDoc} */
    @Override
    public <R> R accept (final ToplevelVisitor<R> visitor)
    {
        return visitor.visitOutputDef (this);
    }


    /** {@inheritDoc} */
    @Override
    protected Object [] getFields ()
    {
        return new Object []
        {
            this.type,
            this.items
        };
    }
}

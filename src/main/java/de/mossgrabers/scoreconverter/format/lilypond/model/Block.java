// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.lilypond.model;

import java.util.List;


/**
 * A \score, \book or \bookpart block.
 *
 * @author Jürgen Moßgraber
 */
public class Block extends ToplevelExpression
{
    private final BlockType                type;
    private final List<ToplevelExpression> items;


    /**
     * Constructor.
     *
     * @param type The type of the block
     * @param items The content in the order of the source
     */
    public Block (final BlockType type, final List<ToplevelExpression> items)
    {
        this.type = type;
        this.items = List.copyOf (items);
    }


    public BlockType getType ()
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
        return visitor.visitBlock (this);
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

// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.lilypond.model;

import java.util.List;


/**
 * A complete LilyPond source file.
 *
 * @author Jürgen Moßgraber
 */
public class LilyPondFile extends AstNode
{
    private final String                  version;
    private final List<ToplevelExpression> items;


    /**
     * Constructor.
     *
     * @param version The content of the \version statement, null if there is none
     * @param items The top-level expressions in the order of the source
     */
    public LilyPondFile (final String version, final List<ToplevelExpression> items)
    {
        this.version = version;
        this.items = List.copyOf (items);
    }


    public String getVersion ()
    {
        return this.version;
    }


    public List<ToplevelExpression> getItems ()
    {
        return this.items;
    }


    /** {@inheritDoc} */
    @Override
    protected Object [] getFields ()
    {
        return new Object []
        {
            this.version,
            this.items
        };
    }
}

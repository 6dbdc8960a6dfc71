// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.lilypond.model;

import java.util.List;


/**
 * Music in a new or existing context, e.g. \new Staff = "violin" \with { ... } { ... }.
 *
 * @author Jürgen Moßgraber
 */
public class ContextMusic extends Music
{
    private final ContextKeyword       keyword;
    private final String               contextType;
    private final String               name;
    private final List<ContextModItem> withItems;
    private final Music                body;


    /**
     * Constructor.
     *
     * @param keyword \new or \context
     * @param contextType The type of the context, e.g. Staff
     * @param name The name of the context, null if none
     * @param withItems The content of the \with block, null if there is no block
     * @param body The music
     */
    public ContextMusic (final ContextKeyword keyword, final String contextType, final String name, final List<ContextModItem> withItems, final Music body)
    {
        this.keyword = keyword;
        this.contextType = contextType;
        this.name = name;
        this.withItems = withItems == null ? null : List.copyOf (withItems);
        this.body = body;
    }


    public ContextKeyword getKeyword ()
    {
        return this.keyword;
    }


    public String getContextType ()
    {
        return this.contextType;
    }


    public String getName ()
    {
        return this.name;
    }


    public List<ContextModItem> getWithItems ()
    {
        return this.withItems;
    }


    public Music getBody ()
    {
        return this.body;
    }


    /** {@inheritDoc} */
    @Override
    public <R> R accept (final MusicVisitor<R> visitor)
    {
        return visitor.visitContextMusic (this);
    }


    /** {@inheritDoc} */
    @Override
    protected Object [] getFields ()
    {
        return new Object []
        {
            this.keyword,
            this.contextType,
            this.name,
            this.withItems,
            this.body
        };
    }
}

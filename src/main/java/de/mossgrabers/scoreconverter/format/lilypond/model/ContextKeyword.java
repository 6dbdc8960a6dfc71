// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.lilypond.model;

/**
 * The keyword which creates or refers to a context.
 *
 * @author Jürgen Moßgraber
 */
public enum ContextKeyword
{
    /** \new: always creates a new context. */
    NEW("new"),
    /** \context: refers to an existing context or creates it. */
    CONTEXT("context");


    private final String keyword;


    private ContextKeyword (final String keyword)
    {
        this.keyword = keyword;
    }


    public String getKeyword ()
    {
        return this.keyword;
    }
}

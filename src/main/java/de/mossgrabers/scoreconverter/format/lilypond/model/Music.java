// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.lilypond.model;

/**
 * Base class of all kinds of music expressions. The set of subclasses is closed, consumers
 * dispatch over it with a {@link MusicVisitor}.
 *
 * @author Jürgen Moßgraber
 */
public abstract class Music extends AstNode
{
    /**
     * Dispatch to the matching method of the visitor.
     *
     * @param visitor The visitor
     * @param <R> The result type
     * @return The result of the visitor
     */
    public abstract <R> R accept (MusicVisitor<R> visitor);
}

// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.lilypond.model;

/**
 * Base class of the expressions which can appear on the top level of a file or inside of score,
 * book and bookpart blocks.
 *
 * @author Jürgen Moßgraber
 */
public abstract class ToplevelExpression extends AstNode
{
    /**
     * Dispatch to the matching method of the visitor.
     *
     * @param visitor The visitor
     * @param <R> The result type
     * @return The result of the visitor
     */
    public abstract <R> R accept (ToplevelVisitor<R> visitor);
}

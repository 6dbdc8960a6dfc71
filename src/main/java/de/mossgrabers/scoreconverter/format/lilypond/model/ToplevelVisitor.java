// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.lilypond.model;

/**
 * Visitor over all kinds of top-level expressions.
 *
 * @param <R> The result type
 *
 * @author Jürgen Moßgraber
 */
public interface ToplevelVisitor<R>
{
    /**
     * Visit an assignment.
     *
     * @param assignment The assignment
     * @return The result
     */
    R visitAssignment (Assignment assignment);


    /**
     * Visit a score, book or bookpart block.
     *
     * @param block The block
     * @return The result
     */
    R visitBlock (Block block);


    /**
     * Visit a header block.
     *
     * @param header The block
     * @return The result
     */
    R visitHeader (HeaderBlock header);


    /**
     * Visit a paper, layout or midi block.
     *
     * @param outputDef The block
     * @return The result
     */
    R visitOutputDef (OutputDefBlock outputDef);


    /**
     * Visit music.
     *
     * @param music The music
     * @return The result
     */
    R visitMusic (ToplevelMusic music);


    /**
     * Visit a markup or markup list.
     *
     * @param markup The markup
     * @return The result
     */
    R visitMarkup (ToplevelMarkup markup);


    /**
     * Visit a Scheme expression.
     *
     * @param scheme The expression
     * @return The result
     */
    R visitScheme (ToplevelScheme scheme);


    /**
     * Visit a raw block.
     *
     * @param raw The block
     * @return The result
     */
    R visitRaw (RawBlock raw);
}

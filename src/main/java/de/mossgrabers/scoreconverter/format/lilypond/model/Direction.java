// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.lilypond.model;

/**
 * The placement prefix of a post event.
 *
 * @author Jürgen Moßgraber
 */
public enum Direction
{
    /** No prefix at all. */
    NONE(""),
    /** Default placement, written as '-'. */
    NEUTRAL("-"),
    /** Above the staff, written as '^'. */
    UP("^"),
    /** Below the staff, written as '_'. */
    DOWN("_");


    private final String prefix;


    private Direction (final String prefix)
    {
        this.prefix = prefix;
    }


    /**
     * Get the prefix character.
     *
     * @return The prefix, empty for NONE
     */
    public String getPrefix ()
    {
        return this.prefix;
    }
}

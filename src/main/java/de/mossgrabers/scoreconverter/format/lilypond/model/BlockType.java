// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.lilypond.model;

/**
 * The kinds of structural blocks.
 *
 * @author Jürgen Moßgraber
 */
public enum BlockType
{
    SCORE("score"),
    BOOK("book"),
    BOOKPART("bookpart");


    private final String command;


    private BlockType (final String command)
    {
        this.command = command;
    }


    public String getCommand ()
    {
        return this.command;
    }
}

// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.lilypond.model;

import java.util.List;


/**
 * One figure of a figured bass event, e.g. the '6+' in '<6+ 4>'.
 *
 * @author Jürgen Moßgraber
 */
public class Figure extends AstNode
{
    /** The modifications which follow the number and alteration of a figure. */
    public enum Modification
    {
        /** \+ */
        AUGMENTED ("\\+"),
        /** \! */
        NO_CONTINUATION ("\\!"),
        /** / */
        DIMINISHED ("/"),
        /** \\ */
        AUGMENTED_SLASH ("\\\\");


        private final String symbol;


        private Modification (final String symbol)
        {
            this.symbol = symbol;
        }


        public String getSymbol ()
        {
            return this.symbol;
        }
    }


    private final Integer            number;
    private final String             alteration;
    private final List<Modification> modifications;
    private final boolean            bracketStart;
    private final boolean            bracketEnd;


    /**
     * Constructor.
     *
     * @param number The figure number, null for a space ('_')
     * @param alteration The alteration characters ('+', '-', '!', '++', '--') or empty
     * @param modifications The modifications in the order of their appearance, might be empty
     * @param bracketStart True if the figure opens a bracket
     * @param bracketEnd True if the figure closes a bracket
     */
    public Figure (final Integer number, final String alteration, final List<Modification> modifications, final boolean bracketStart, final boolean bracketEnd)
    {
        this.number = number;
        this.alteration = alteration;
        this.modifications = List.copyOf (modifications);
        this.bracketStart = bracketStart;
        this.bracketEnd = bracketEnd;
    }


    public Integer getNumber ()
    {
        return this.number;
    }


    public String getAlteration ()
    {
        return this.alteration;
    }


    public List<Modification> getModifications ()
    {
        return this.modifications;
    }


    /**
     * Get the modifications as they are written after the figure.
     *
     * @return The symbols of all modifications, e.g. '\+/'
     */
    public String formatModifications ()
    {
        final StringBuilder sb = new StringBuilder ();
        for (final Modification modification: this.modifications)
            sb.append (modification.getSymbol ());
        return sb.toString ();
    }


    public boolean isBracketStart ()
    {
        return this.bracketStart;
    }


    public boolean isBracketEnd ()
    {
        return this.bracketEnd;
    }


    /** {@inheritDoc} */
    @Override
    protected Object [] getFields ()
    {
        return new Object []
        {
            this.number,
            this.alteration,
            this.modifications,
            Boolean.valueOf (this.bracketStart),
            Boolean.valueOf (this.bracketEnd)
        };
    }
}

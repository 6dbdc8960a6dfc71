// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.extension;

/**
 * A bar line glyph, e.g. '|.' or ':|.'.
 *
 * @author Jürgen Moßgraber
 */
public class Barline extends ExtensionPayload
{
    private final String glyph;


    /**
     * Constructor.
     *
     * @param glyph The glyph
     */
    public Barline (final String glyph)
    {
        this.glyph = glyph;
    }


    public String getGlyph ()
    {
        return this.glyph;
    }


    /** {@inheritDoc} */
    @Override
    protected Object [] getFields ()
    {
        return new Object []
        {
            this.glyph
        };
    }
}

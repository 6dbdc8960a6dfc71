// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.extension;

/**
 * Marks a rest which is positioned at a pitch, e.g. 'c'4\rest'.
 *
 * @author Jürgen Moßgraber
 */
public class PitchedRest extends ExtensionPayload
{
    private final String pitch;


    /**
     * Constructor.
     *
     * @param pitch The absolute pitch as LilyPond text, e.g. "c'"
     */
    public PitchedRest (final String pitch)
    {
        this.pitch = pitch;
    }


    public String getPitch ()
    {
        return this.pitch;
    }


    /** {@inheritDoc} */
    @Override
    protected Object [] getFields ()
    {
        return new Object []
        {
            this.pitch
        };
    }
}

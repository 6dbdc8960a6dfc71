// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.extension;

/**
 * The exact duration of a multi-measure rest including the number of measures.
 *
 * @author Jürgen Moßgraber
 */
public class MRestDetail extends ExtensionPayload
{
    private final String duration;


    /**
     * Constructor.
     *
     * @param duration The serialized duration, e.g. '1*4' or '2.*3'
     */
    public MRestDetail (final String duration)
    {
        this.duration = duration;
    }


    public String getDuration ()
    {
        return this.duration;
    }


    /** {@inheritDoc} */
    @Override
    protected Object [] getFields ()
    {
        return new Object []
        {
            this.duration
        };
    }
}

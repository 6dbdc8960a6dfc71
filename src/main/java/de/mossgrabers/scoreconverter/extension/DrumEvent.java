// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.extension;

/**
 * A drum note or chord which is represented by a placeholder note in the document.
 *
 * @author Jürgen Moßgraber
 */
public class DrumEvent extends ExtensionPayload
{
    private final String source;


    /**
     * Constructor.
     *
     * @param source The serialized drum event, e.g. 'bd4' or '&lt;bd sn&gt;8'
     */
    public DrumEvent (final String source)
    {
        this.source = source;
    }


    public String getSource ()
    {
        return this.source;
    }


    /** {@inheritDoc} */
    @Override
    protected Object [] getFields ()
    {
        return new Object []
        {
            this.source
        };
    }
}

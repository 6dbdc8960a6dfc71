// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.extension;

/**
 * A figured bass event.
 *
 * @author Jürgen Moßgraber
 */
public class FiguredBass extends ExtensionPayload
{
    private final String source;


    /**
     * Constructor.
     *
     * @param source The serialized figure event, e.g. '&lt;6 4&gt;2'
     */
    public FiguredBass (final String source)
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

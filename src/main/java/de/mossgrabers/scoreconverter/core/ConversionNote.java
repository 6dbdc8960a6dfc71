// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.core;

/**
 * A note about information which was approximated or dropped during a conversion.
 *
 * @author Jürgen Moßgraber
 */
public class ConversionNote
{
    private final String elementId;
    private final String message;


    /**
     * Constructor.
     *
     * @param elementId The ID of the affected element, null if not related to an element
     * @param message The description
     */
    public ConversionNote (final String elementId, final String message)
    {
        this.elementId = elementId;
        this.message = message;
    }


    public String getElementId ()
    {
        return this.elementId;
    }


    public String getMessage ()
    {
        return this.message;
    }


    /** {@inheritDoc} */
    @Override
    public String toString ()
    {
        return this.elementId == null ? this.message : this.elementId + ": " + this.message;
    }
}

// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.mei.model;

import jakarta.xml.bind.annotation.XmlValue;


/**
 * One figure of a figured bass indication.
 *
 * @author Jürgen Moßgraber
 */
public class F
{
    /** The text of the figure, e.g. '6' or '#'. */
    @XmlValue
    public String text;


    /**
     * Constructor.
     */
    public F ()
    {
        // Intentionally empty
    }


    /**
     * Constructor.
     *
     * @param text The text of the figure
     */
    public F (final String text)
    {
        this.text = text;
    }
}

// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.mei.model;

import jakarta.xml.bind.annotation.XmlAttribute;
import jakarta.xml.bind.annotation.XmlValue;


/**
 * A title, e.g. the main title or a subtitle.
 *
 * @author Jürgen Moßgraber
 */
public class Title
{
    /** The kind of title, e.g. 'subordinate'. */
    @XmlAttribute
    public String type;

    /** The text. */
    @XmlValue
    public String text;


    /**
     * Constructor.
     */
    public Title ()
    {
        // Intentionally empty
    }


    /**
     * Constructor.
     *
     * @param text The text
     * @param type The kind of title, null for the main title
     */
    public Title (final String text, final String type)
    {
        this.text = text;
        this.type = type;
    }
}

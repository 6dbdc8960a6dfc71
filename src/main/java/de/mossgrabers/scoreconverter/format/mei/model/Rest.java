// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.mei.model;

import jakarta.xml.bind.annotation.XmlAttribute;


/**
 * A rest.
 *
 * @author Jürgen Moßgraber
 */
public class Rest extends LayerElement
{
    /** The pitch at which the rest is displayed. */
    @XmlAttribute
    public String  ploc;

    /** The octave at which the rest is displayed. */
    @XmlAttribute
    public Integer oloc;
}

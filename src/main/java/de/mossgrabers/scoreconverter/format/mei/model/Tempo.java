// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.mei.model;

import jakarta.xml.bind.annotation.XmlAttribute;


/**
 * A tempo indication.
 *
 * @author Jürgen Moßgraber
 */
public class Tempo extends TextControlEvent
{
    /** The beats per minute. */
    @XmlAttribute
    public Double  mm;

    /** The duration of the beat, e.g. 4 for a quarter. */
    @XmlAttribute(name = "mm.unit")
    public String  mmUnit;

    /** The dots of the beat duration. */
    @XmlAttribute(name = "mm.dots")
    public Integer mmDots;
}

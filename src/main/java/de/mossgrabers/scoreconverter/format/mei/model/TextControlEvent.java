// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.mei.model;

import jakarta.xml.bind.annotation.XmlTransient;
import jakarta.xml.bind.annotation.XmlValue;


/**
 * Base class of control events with a text content.
 *
 * @author Jürgen Moßgraber
 */
@XmlTransient
public abstract class TextControlEvent extends ControlEvent
{
    /** The text. */
    @XmlValue
    public String text;
}

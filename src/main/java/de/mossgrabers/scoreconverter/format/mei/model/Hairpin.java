// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.mei.model;

import jakarta.xml.bind.annotation.XmlAttribute;


/**
 * A crescendo or decrescendo hairpin.
 *
 * @author Jürgen Moßgraber
 */
public class Hairpin extends ControlEvent
{
    /** The form: cres or dim. */
    @XmlAttribute
    public String form;
}

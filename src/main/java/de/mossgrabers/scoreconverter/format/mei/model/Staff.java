// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.mei.model;

import jakarta.xml.bind.annotation.XmlAttribute;
import jakarta.xml.bind.annotation.XmlElement;

import java.util.ArrayList;
import java.util.List;


/**
 * The content of one staff in a measure.
 *
 * @author Jürgen Moßgraber
 */
public class Staff extends MeiElement
{
    /** The number of the staff, refers to the staff definition. */
    @XmlAttribute
    public Integer     n;

    /** The layers (voices). */
    @XmlElement(name = "layer")
    public List<Layer> layers = new ArrayList<> ();
}

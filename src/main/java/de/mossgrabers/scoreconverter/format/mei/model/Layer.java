// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.mei.model;

import jakarta.xml.bind.annotation.XmlAttribute;
import jakarta.xml.bind.annotation.XmlElement;
import jakarta.xml.bind.annotation.XmlElements;

import java.util.ArrayList;
import java.util.List;


/**
 * A layer (voice) of a staff.
 *
 * @author Jürgen Moßgraber
 */
public class Layer extends MeiElement
{
    /** The number of the layer in the staff. */
    @XmlAttribute
    public Integer            n;

    /** The events of the layer. */
    @XmlElements(
    {
        @XmlElement(name = "note", type = Note.class),
        @XmlElement(name = "chord", type = Chord.class),
        @XmlElement(name = "rest", type = Rest.class),
        @XmlElement(name = "mRest", type = MRest.class),
        @XmlElement(name = "space", type = Space.class)
    })
    public List<LayerElement> children = new ArrayList<> ();
}

// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.mei.model;

import jakarta.xml.bind.annotation.XmlAttribute;
import jakarta.xml.bind.annotation.XmlTransient;

import javax.xml.XMLConstants;


/**
 * Base class of all elements. Every element can be identified by its xml:id and carry a free text
 * label.
 *
 * @author Jürgen Moßgraber
 */
@XmlTransient
public abstract class MeiElement
{
    /** The namespace of all MEI elements. */
    public static final String MEI_NAMESPACE = "http://www.music-encoding.org/ns/mei";

    /** The unique ID of the element. */
    @XmlAttribute(name = "id", namespace = XMLConstants.XML_NS_URI)
    public String              id;

    /** A free text label. */
    @XmlAttribute
    public String              label;
}

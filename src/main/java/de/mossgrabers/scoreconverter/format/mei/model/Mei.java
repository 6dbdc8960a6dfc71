// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.mei.model;

import jakarta.xml.bind.annotation.XmlAttribute;
import jakarta.xml.bind.annotation.XmlElement;
import jakarta.xml.bind.annotation.XmlRootElement;
import jakarta.xml.bind.annotation.XmlType;


/**
 * The root element of a MEI document.
 *
 * @author Jürgen Moßgraber
 */
@XmlRootElement(name = "mei")
@XmlType(propOrder =
{
    "meiHead",
    "music"
})
public class Mei extends MeiElement
{
    /** The version of the MEI schema. */
    @XmlAttribute
    public String    meiversion;

    /** The meta-data. */
    @XmlElement
    public MeiHead   meiHead;

    /** The music. */
    @XmlElement
    public MeiMusic  music;
}

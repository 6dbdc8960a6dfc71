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
 * A group of staves, e.g. a piano staff.
 *
 * @author Jürgen Moßgraber
 */
public class StaffGrp extends MeiElement
{
    /** The bracket symbol: brace, bracket, bracketsq, line or none. */
    @XmlAttribute
    public String           symbol;

    /** The nested staff groups and staff definitions. */
    @XmlElements(
    {
        @XmlElement(name = "staffGrp", type = StaffGrp.class),
        @XmlElement(name = "staffDef", type = StaffDef.class)
    })
    public List<MeiElement> children = new ArrayList<> ();
}

// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.mei.model;

import jakarta.xml.bind.annotation.XmlElement;


/**
 * The score definition contains the hierarchy of staff groups and staves.
 *
 * @author Jürgen Moßgraber
 */
public class ScoreDef extends MeiElement
{
    /** The root staff group. */
    @XmlElement
    public StaffGrp staffGrp = new StaffGrp ();
}

// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.mei.model;

import jakarta.xml.bind.annotation.XmlElement;


/**
 * The music element of a MEI document.
 *
 * @author Jürgen Moßgraber
 */
public class MeiMusic extends MeiElement
{
    /** The body which contains the divisions. */
    @XmlElement
    public Body body = new Body ();
}

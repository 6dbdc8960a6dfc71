// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.mei.model;

import jakarta.xml.bind.annotation.XmlElement;


/**
 * The header of a MEI document.
 *
 * @author Jürgen Moßgraber
 */
public class MeiHead extends MeiElement
{
    /** The description of the file. */
    @XmlElement
    public FileDesc fileDesc = new FileDesc ();
}

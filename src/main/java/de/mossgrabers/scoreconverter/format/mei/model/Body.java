// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.mei.model;

import jakarta.xml.bind.annotation.XmlElement;

import java.util.ArrayList;
import java.util.List;


/**
 * The body contains the musical divisions.
 *
 * @author Jürgen Moßgraber
 */
public class Body extends MeiElement
{
    /** The divisions. */
    @XmlElement(name = "mdiv")
    public List<Mdiv> mdivs = new ArrayList<> ();
}

// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.mei.model;

import jakarta.xml.bind.annotation.XmlElement;

import java.util.ArrayList;
import java.util.List;


/**
 * A section of a score.
 *
 * @author Jürgen Moßgraber
 */
public class Section extends MeiElement
{
    /** The measures. */
    @XmlElement(name = "measure")
    public List<Measure> measures = new ArrayList<> ();
}

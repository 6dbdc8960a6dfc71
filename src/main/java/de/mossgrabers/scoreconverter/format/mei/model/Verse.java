// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.mei.model;

import jakarta.xml.bind.annotation.XmlAttribute;
import jakarta.xml.bind.annotation.XmlElement;

import java.util.ArrayList;
import java.util.List;


/**
 * One verse of lyrics attached to a note.
 *
 * @author Jürgen Moßgraber
 */
public class Verse extends MeiElement
{
    /** The number of the verse. */
    @XmlAttribute
    public Integer   n;

    /** The syllables. */
    @XmlElement(name = "syl")
    public List<Syl> syls = new ArrayList<> ();
}

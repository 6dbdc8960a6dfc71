// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.mei.model;

import jakarta.xml.bind.annotation.XmlAttribute;
import jakarta.xml.bind.annotation.XmlElement;

import java.util.ArrayList;
import java.util.List;


/**
 * A chord, several notes with the same duration.
 *
 * @author Jürgen Moßgraber
 */
public class Chord extends LayerElement
{
    /** Tie: i (initial), m (medial) or t (terminal). */
    @XmlAttribute
    public String      tie;

    /** Grace chord: acc (acciaccatura), unacc or unknown. */
    @XmlAttribute
    public String      grace;

    /** The notes. */
    @XmlElement(name = "note")
    public List<Note>  notes  = new ArrayList<> ();

    /** The lyrics attached to the chord. */
    @XmlElement(name = "verse")
    public List<Verse> verses = new ArrayList<> ();
}

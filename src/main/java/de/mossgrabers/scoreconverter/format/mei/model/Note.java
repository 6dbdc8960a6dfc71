// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.mei.model;

import jakarta.xml.bind.annotation.XmlAttribute;
import jakarta.xml.bind.annotation.XmlElement;

import java.util.ArrayList;
import java.util.List;


/**
 * A note.
 *
 * @author Jürgen Moßgraber
 */
public class Note extends LayerElement
{
    /** The pitch name: c, d, e, f, g, a or b. */
    @XmlAttribute
    public String      pname;

    /** The octave, 4 is the octave of middle C. */
    @XmlAttribute
    public Integer     oct;

    /** The accidental, e.g. s, f, ss, ff, n, 1qs or 3qf. */
    @XmlAttribute
    public String      accid;

    /** Tie: i (initial), m (medial) or t (terminal). */
    @XmlAttribute
    public String      tie;

    /** Grace note: acc (acciaccatura), unacc or unknown. */
    @XmlAttribute
    public String      grace;

    /** The lyrics attached to the note. */
    @XmlElement(name = "verse")
    public List<Verse> verses = new ArrayList<> ();
}

// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.mei.model;

import jakarta.xml.bind.annotation.XmlAttribute;
import jakarta.xml.bind.annotation.XmlElement;
import jakarta.xml.bind.annotation.XmlElements;
import jakarta.xml.bind.annotation.XmlType;

import java.util.ArrayList;
import java.util.List;


/**
 * A measure which contains the staves and the control events which refer to their content.
 *
 * @author Jürgen Moßgraber
 */
@XmlType(propOrder =
{
    "staves",
    "controlEvents"
})
public class Measure extends MeiElement
{
    /** The number of the measure. */
    @XmlAttribute
    public String             n;

    /** The staves. */
    @XmlElement(name = "staff")
    public List<Staff>        staves        = new ArrayList<> ();

    /** The control events. */
    @XmlElements(
    {
        @XmlElement(name = "dir", type = Dir.class),
        @XmlElement(name = "tempo", type = Tempo.class),
        @XmlElement(name = "slur", type = Slur.class),
        @XmlElement(name = "tie", type = Tie.class),
        @XmlElement(name = "hairpin", type = Hairpin.class),
        @XmlElement(name = "dynam", type = Dynam.class),
        @XmlElement(name = "tupletSpan", type = TupletSpan.class),
        @XmlElement(name = "beamSpan", type = BeamSpan.class),
        @XmlElement(name = "harm", type = Harm.class),
        @XmlElement(name = "fb", type = Fb.class)
    })
    public List<ControlEvent> controlEvents = new ArrayList<> ();
}

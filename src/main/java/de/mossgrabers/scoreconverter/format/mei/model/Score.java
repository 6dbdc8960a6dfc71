// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.mei.model;

import jakarta.xml.bind.annotation.XmlElement;
import jakarta.xml.bind.annotation.XmlType;

import java.util.ArrayList;
import java.util.List;


/**
 * A score: the definition of the staves and the sections with the music.
 *
 * @author Jürgen Moßgraber
 */
@XmlType(propOrder =
{
    "scoreDef",
    "sections"
})
public class Score extends MeiElement
{
    /** The definition of the staves. */
    @XmlElement
    public ScoreDef      scoreDef = new ScoreDef ();

    /** The sections. */
    @XmlElement(name = "section")
    public List<Section> sections = new ArrayList<> ();
}

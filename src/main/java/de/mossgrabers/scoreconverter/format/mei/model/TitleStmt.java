// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.mei.model;

import jakarta.xml.bind.annotation.XmlElement;

import java.util.ArrayList;
import java.util.List;


/**
 * The titles of a work.
 *
 * @author Jürgen Moßgraber
 */
public class TitleStmt extends MeiElement
{
    /** The titles. The first one is the main title. */
    @XmlElement(name = "title")
    public List<Title> titles = new ArrayList<> ();
}

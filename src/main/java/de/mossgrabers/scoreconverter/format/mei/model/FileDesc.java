// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.mei.model;

import jakarta.xml.bind.annotation.XmlElement;


/**
 * The description of a MEI file.
 *
 * @author Jürgen Moßgraber
 */
public class FileDesc extends MeiElement
{
    /** Title and responsibilities. */
    @XmlElement
    public TitleStmt titleStmt = new TitleStmt ();
}

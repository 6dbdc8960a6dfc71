// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.mei.model;

/**
 * A slur.
 *
 * @author Jürgen Moßgraber
 */
public class Slur extends ControlEvent
{
    // Only the common attributes
}

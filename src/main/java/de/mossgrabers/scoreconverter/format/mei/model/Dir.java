// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.mei.model;

/**
 * A directive: text, an articulation or the range of a musical construct.
 *
 * @author Jürgen Moßgraber
 */
public class Dir extends TextControlEvent
{
    // Only the common attributes
}

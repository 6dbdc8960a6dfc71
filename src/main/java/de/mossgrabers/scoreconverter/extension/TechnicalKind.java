// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.extension;

/**
 * The kinds of technical indications.
 *
 * @author Jürgen Moßgraber
 */
public enum TechnicalKind
{
    /** Up-bow. */
    UP_BOW,
    /** Down-bow. */
    DOWN_BOW,
    /** Harmonic, flageolet. */
    HARMONIC,
    /** Open string. */
    OPEN_STRING,
    /** Thumb position. */
    THUMB_POSITION,
    /** Fingering. */
    FINGERING,
    /** Pluck. */
    PLUCK,
    /** Double tongue. */
    DOUBLE_TONGUE,
    /** Triple tongue. */
    TRIPLE_TONGUE,
    /** Stopped. */
    STOPPED,
    /** Snap pizzicato. */
    SNAP_PIZZICATO,
    /** Fret. */
    FRET,
    /** String number. */
    STRING,
    /** Hammer-on. */
    HAMMER_ON,
    /** Pull-off. */
    PULL_OFF,
    /** Bend. */
    BEND,
    /** Tap. */
    TAP,
    /** Heel (organ pedal). */
    HEEL,
    /** Toe (organ pedal). */
    TOE,
    /** Fingernails. */
    FINGERNAILS,
    /** Hole (wind instruments). */
    HOLE,
    /** Arrow. */
    ARROW,
    /** Handbell technique. */
    HANDBELL,
    /** Brass bend. */
    BRASS_BEND,
    /** Any other technique. */
    OTHER
}

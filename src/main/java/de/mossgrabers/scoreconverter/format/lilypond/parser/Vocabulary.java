// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.lilypond.parser;

import java.util.Set;


/**
 * Command names which need to be known by the parser since they change the interpretation of the
 * following tokens.
 *
 * @author Jürgen Moßgraber
 */
public final class Vocabulary
{
    /** Dynamics which can follow a note. */
    public static final Set<String> DYNAMICS             = Set.of ("ppppp", "pppp", "ppp", "pp", "p", "mp", "mf", "f", "ff", "fff", "ffff", "fffff", "fp", "sf", "sff", "sfp", "sfz", "sp", "spp", "fz", "rfz", "n");

    /** Named articulations and other commands which are attached to a note. */
    public static final Set<String> ARTICULATIONS        = Set.of ("accent", "espressivo", "marcato", "portato", "staccatissimo", "staccato", "tenuto", "prall", "prallup", "pralldown", "upprall", "downprall", "prallprall", "lineprall", "prallmordent", "mordent", "upmordent", "downmordent", "trill", "turn", "reverseturn", "shortfermata", "fermata", "longfermata", "verylongfermata", "upbow", "downbow", "flageolet", "thumb", "lheel", "rheel", "ltoe", "rtoe", "open", "halfopen", "snappizzicato", "stopped", "segno", "coda", "varcoda", "arpeggio", "glissando", "laissezVibrer", "repeatTie", "harmonic", "startTrillSpan", "stopTrillSpan", "startTextSpan", "stopTextSpan", "sustainOn", "sustainOff", "sostenutoOn", "sostenutoOff", "unaCorda", "treCorde");

    /** Markup commands which do not take a markup argument. */
    public static final Set<String> MARKUP_WITHOUT_ARGUMENT = Set.of ("null", "hspace", "vspace", "musicglyph", "char", "fromproperty", "strut", "draw-line", "draw-hline", "draw-circle", "doubleflat", "flat", "sharp", "natural", "doublesharp", "semiflat", "semisharp", "sesquiflat", "sesquisharp", "fermata", "segno", "coda", "varcoda", "note-by-number", "page-ref", "epsfile", "filled-box", "arrow-head", "beam", "triangle", "rest-by-number", "fret-diagram", "fret-diagram-terse", "fret-diagram-verbose", "woodwind-diagram", "harp-pedal");

    /** Markup commands which take two markup arguments. */
    public static final Set<String> MARKUP_TWO_ARGUMENTS = Set.of ("combine", "fraction", "put-adjacent", "overlay");

    /** Length units of numeric expressions. */
    public static final Set<String> UNITS                = Set.of ("mm", "cm", "in", "pt");


    /**
     * Private constructor since this is a utility class.
     */
    private Vocabulary ()
    {
        // Intentionally empty
    }
}

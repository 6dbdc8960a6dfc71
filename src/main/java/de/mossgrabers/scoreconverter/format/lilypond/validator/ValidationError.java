// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.lilypond.validator;

/**
 * A structural problem found in a LilyPond AST.
 *
 * @author Jürgen Moßgraber
 */
public class ValidationError
{
    /** The kinds of structural problems. */
    public enum Type
    {
        SCORE_NO_MUSIC,
        INVALID_DURATION_BASE,
        EXCESSIVE_DOTS,
        ZERO_MULTIPLIER_DENOMINATOR,
        UNKNOWN_CONTEXT_TYPE,
        UNKNOWN_CLEF_NAME,
        INVALID_TIME_NUMERATOR,
        INVALID_TIME_DENOMINATOR,
        EMPTY_CHORD,
        UNMATCHED_SLUR,
        UNMATCHED_PHRASING_SLUR,
        UNMATCHED_BEAM,
        UNMATCHED_HAIRPIN,
        UNKNOWN_DYNAMIC,
        INVALID_FINGERING,
        INVALID_STRING_NUMBER,
        INVALID_TREMOLO,
        INVALID_TUPLET_FRACTION,
        INVALID_AFTER_GRACE_FRACTION,
        INVALID_REPEAT_COUNT,
        EMPTY_BAR_LINE,
        INVALID_CHORD_STEP,
        INVALID_FIGURE_NUMBER,
        EMPTY_TEMPO,
        INVALID_TEMPO_BPM,
        INVALID_TEMPO_RANGE
    }


    private final Type   type;
    private final String message;


    /**
     * Constructor.
     *
     * @param type The kind of problem
     * @param message A description
     */
    public ValidationError (final Type type, final String message)
    {
        this.type = type;
        this.message = message;
    }


    public Type getType ()
    {
        return this.type;
    }


    public String getMessage ()
    {
        return this.message;
    }


    /** {@inheritDoc} */
    @Override
    public String toString ()
    {
        return this.type + ": " + this.message;
    }
}

// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.convert;

import de.mossgrabers.scoreconverter.format.lilypond.model.Pitch;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;


/**
 * Converts between the written pitches of a music expression and absolute pitches. The written
 * pitches depend on the enclosing relative, fixed and transpose expressions. The same context
 * object is used in both directions: {@link #toAbsolute(Pitch)} while importing and
 * {@link #toWritten(Pitch)} while exporting. Both advance the reference pitch of a relative
 * expression identically, therefore writing the absolute pitches of a resolved sequence
 * reproduces the original written pitches.
 *
 * @author Jürgen Moßgraber
 */
public class PitchContext
{
    /** The reference of a relative expression without a start pitch. */
    public static final Pitch DEFAULT_REFERENCE = new Pitch ('f', 0, 0);


    private enum Mode
    {
        ABSOLUTE,
        RELATIVE,
        FIXED
    }


    /** The state of a relative expression which is shared with nested transpositions. */
    private static class RelativeState
    {
        private Pitch   reference;
        private boolean inChord;
        private Pitch   chordFirst;


        RelativeState (final Pitch reference)
        {
            this.reference = reference;
        }
    }


    private final Mode          mode;
    private final Pitch         fixedReference;
    private final RelativeState state;
    private final List<Pitch[]> transpositions;


    private PitchContext (final Mode mode, final Pitch fixedReference, final RelativeState state, final List<Pitch []> transpositions)
    {
        this.mode = mode;
        this.fixedReference = fixedReference;
        this.state = state;
        this.transpositions = transpositions;
    }


    /**
     * Create a context for absolute pitches.
     *
     * @return The context
     */
    public static PitchContext absolute ()
    {
        return new PitchContext (Mode.ABSOLUTE, null, null, Collections.emptyList ());
    }


    /**
     * Create a nested context for a relative expression.
     *
     * @param reference The written start pitch, null for the default reference
     * @return The nested context
     */
    public PitchContext enterRelative (final Pitch reference)
    {
        final Pitch start = reference == null ? DEFAULT_REFERENCE : reference.plain ();
        return new PitchContext (Mode.RELATIVE, null, new RelativeState (start), this.transpositions);
    }


    /**
     * Create a nested context for a fixed expression.
     *
     * @param reference The pitch whose octave is added to all pitches
     * @return The nested context
     */
    public PitchContext enterFixed (final Pitch reference)
    {
        return new PitchContext (Mode.FIXED, reference.plain (), null, this.transpositions);
    }


    /**
     * Create a nested context for a transposition. A relative expression continues with the same
     * reference pitch inside of the transposition.
     *
     * @param from The start of the interval
     * @param to The end of the interval
     * @return The nested context
     */
    public PitchContext enterTranspose (final Pitch from, final Pitch to)
    {
        final List<Pitch []> nested = new ArrayList<> (this.transpositions);
        nested.add (new Pitch []
        {
            from.plain (),
            to.plain ()
        });
        return new PitchContext (this.mode, this.fixedReference, this.state, nested);
    }


    /**
     * Check if the context does not change any pitch.
     *
     * @return True if absolute and not transposed
     */
    public boolean isIdentity ()
    {
        return this.mode == Mode.ABSOLUTE && this.transpositions.isEmpty ();
    }


    /**
     * Start a chord. Inside of a chord each pitch is relative to the previous pitch of the chord,
     * after the chord the first pitch of the chord becomes the reference.
     */
    public void startChord ()
    {
        if (this.state == null)
            return;
        this.state.inChord = true;
        this.state.chordFirst = null;
    }


    /**
     * End a chord.
     */
    public void endChord ()
    {
        if (this.state == null)
            return;
        this.state.inChord = false;
        if (this.state.chordFirst != null)
            this.state.reference = this.state.chordFirst;
        this.state.chordFirst = null;
    }


    /**
     * Convert a written pitch to an absolute pitch and advance the reference.
     *
     * @param written The written pitch
     * @return The absolute pitch
     */
    public Pitch toAbsolute (final Pitch written)
    {
        Pitch pitch;
        switch (this.mode)
        {
            case RELATIVE:
                pitch = written.resolveRelative (this.state.reference.getStep (), this.state.reference.getOctave ());
                this.advance (pitch);
                break;
            case FIXED:
                pitch = written.withOctave (written.getOctave () + this.fixedReference.getOctave ());
                break;
            default:
                pitch = written;
                break;
        }

        for (int i = this.transpositions.size () - 1; i >= 0; i--)
        {
            final Pitch [] transposition = this.transpositions.get (i);
            pitch = pitch.transpose (transposition[0], transposition[1]);
        }
        return pitch;
    }


    /**
     * Convert an absolute pitch to the written pitch and advance the reference. This is the
     * inverse of {@link #toAbsolute(Pitch)}.
     *
     * @param absolute The absolute pitch
     * @return The written pitch
     */
    public Pitch toWritten (final Pitch absolute)
    {
        Pitch pitch = absolute;
        for (final Pitch [] transposition: this.transpositions)
            pitch = pitch.untranspose (transposition[0], transposition[1]);

        switch (this.mode)
        {
            case RELATIVE:
                final int marks = pitch.toRelativeMarks (this.state.reference.getStep (), this.state.reference.getOctave ());
                this.advance (pitch);
                return pitch.withOctave (marks);
            case FIXED:
                return pitch.withOctave (pitch.getOctave () - this.fixedReference.getOctave ());
            default:
                return pitch;
        }
    }


    private void advance (final Pitch pitch)
    {
        final Pitch plain = pitch.plain ();
        if (this.state.inChord && this.state.chordFirst == null)
            this.state.chordFirst = plain;
        this.state.reference = plain;
    }
}

// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.lilypond.model;

/**
 * A pitch: note name step, alteration and octave marks. Uses the Dutch note names (c, cis, ces,
 * ...). The octave is the number of ' (positive) or , (negative) marks. Octave 0 is the octave
 * below middle C, which makes c' middle C.
 *
 * @author Jürgen Moßgraber
 */
public class Pitch extends AstNode
{
    private static final String STEPS          = "cdefgab";
    private static final int [] STEP_SEMITONES =
    {
        0,
        2,
        4,
        5,
        7,
        9,
        11
    };

    /** The absolute octave (in MEI counting) of octave mark 0. */
    public static final int     BASE_OCTAVE    = 3;

    private final char          step;
    private final double        alter;
    private final int           octave;
    private final boolean       forceAccidental;
    private final boolean       cautionary;
    private final Integer       octaveCheck;


    /**
     * Constructor for a plain pitch.
     *
     * @param step The step 'a'..'g'
     * @param alter The alteration in half-steps, e.g. 1 for sharp, -0.5 for quarter-tone flat
     * @param octave The octave marks
     */
    public Pitch (final char step, final double alter, final int octave)
    {
        this (step, alter, octave, false, false, null);
    }


    /**
     * Constructor.
     *
     * @param step The step 'a'..'g'
     * @param alter The alteration in half-steps
     * @param octave The octave marks
     * @param forceAccidental Display the accidental in any case (!)
     * @param cautionary Display a cautionary accidental (?)
     * @param octaveCheck The octave check (=), null if none
     */
    public Pitch (final char step, final double alter, final int octave, final boolean forceAccidental, final boolean cautionary, final Integer octaveCheck)
    {
        this.step = step;
        this.alter = alter;
        this.octave = octave;
        this.forceAccidental = forceAccidental;
        this.cautionary = cautionary;
        this.octaveCheck = octaveCheck;
    }


    /**
     * Parse a Dutch note name.
     *
     * @param name The name, e.g. 'fis' or 'beh'
     * @return The pitch with octave 0 or null if the name is not a note name
     */
    public static Pitch fromNoteName (final String name)
    {
        if (name.isEmpty () || STEPS.indexOf (name.charAt (0)) < 0)
            return null;
        final char step = name.charAt (0);
        final String suffix = name.substring (1);
        final boolean isVowel = step == 'a' || step == 'e';
        final double alter;
        switch (suffix)
        {
            case "":
                alter = 0;
                break;
            case "is":
                alter = 1;
                break;
            case "isis":
                alter = 2;
                break;
            case "es":
                alter = -1;
                break;
            case "eses":
                alter = -2;
                break;
            case "s":
                if (!isVowel)
                    return null;
                alter = -1;
                break;
            case "ses":
                if (!isVowel)
                    return null;
                alter = -2;
                break;
            case "ih":
                alter = 0.5;
                break;
            case "isih":
                alter = 1.5;
                break;
            case "eh":
                alter = -0.5;
                break;
            case "eseh":
                alter = -1.5;
                break;
            default:
                return null;
        }
        return new Pitch (step, alter, 0);
    }


    public char getStep ()
    {
        return this.step;
    }


    public double getAlter ()
    {
        return this.alter;
    }


    public int getOctave ()
    {
        return this.octave;
    }


    public boolean isForceAccidental ()
    {
        return this.forceAccidental;
    }


    public boolean isCautionary ()
    {
        return this.cautionary;
    }


    public Integer getOctaveCheck ()
    {
        return this.octaveCheck;
    }


    /**
     * Create a copy with a different octave.
     *
     * @param newOctave The new octave marks
     * @return The new pitch
     */
    public Pitch withOctave (final int newOctave)
    {
        return new Pitch (this.step, this.alter, newOctave, this.forceAccidental, this.cautionary, this.octaveCheck);
    }


    /**
     * Create a copy without display flags and octave check.
     *
     * @return The plain pitch
     */
    public Pitch plain ()
    {
        return new Pitch (this.step, this.alter, this.octave);
    }


    /**
     * Get the absolute octave in the counting of the document model (middle C is in octave 4).
     *
     * @return The absolute octave
     */
    public int getAbsoluteOctave ()
    {
        return BASE_OCTAVE + this.octave;
    }


    /**
     * Get the index of the step, 0 for c up to 6 for b.
     *
     * @return The index
     */
    public int getStepIndex ()
    {
        return stepIndex (this.step);
    }


    /**
     * Get the position of the pitch in half-steps relative to c (octave 0).
     *
     * @return The number of half-steps
     */
    public double getSemitones ()
    {
        return STEP_SEMITONES[this.getStepIndex ()] + this.alter + 12.0 * this.octave;
    }


    /**
     * Resolve the pitch of a relative music expression. The octave marks of this pitch are an
     * offset to the octave of the pitch closest to the reference (within a fourth).
     *
     * @param refStep The step of the reference pitch
     * @param refOctave The absolute octave marks of the reference pitch
     * @return The absolute pitch
     */
    public Pitch resolveRelative (final char refStep, final int refOctave)
    {
        return this.withOctave (closestOctave (this.step, refStep, refOctave) + this.octave);
    }


    /**
     * The inverse of {@link #resolveRelative(char, int)}: calculate the octave marks needed to
     * reach this absolute pitch from the reference.
     *
     * @param refStep The step of the reference pitch
     * @param refOctave The absolute octave marks of the reference pitch
     * @return The relative octave marks
     */
    public int toRelativeMarks (final char refStep, final int refOctave)
    {
        return this.octave - closestOctave (this.step, refStep, refOctave);
    }


    /**
     * Transpose the pitch by the interval between two pitches.
     *
     * @param from The start of the interval
     * @param to The end of the interval
     * @return The transposed pitch
     */
    public Pitch transpose (final Pitch from, final Pitch to)
    {
        final int stepInterval = to.getStepIndex () - from.getStepIndex () + 7 * (to.octave - from.octave);
        final double semitoneInterval = to.getSemitones () - from.getSemitones ();

        final int diatonic = this.getStepIndex () + 7 * this.octave + stepInterval;
        final int newStepIndex = Math.floorMod (diatonic, 7);
        final int newOctave = Math.floorDiv (diatonic, 7);
        final double target = this.getSemitones () + semitoneInterval;
        final double newAlter = target - (STEP_SEMITONES[newStepIndex] + 12.0 * newOctave);
        return new Pitch (STEPS.charAt (newStepIndex), newAlter, newOctave, this.forceAccidental, this.cautionary, this.octaveCheck);
    }


    /**
     * Reverts a transposition.
     *
     * @param from The start of the interval which was applied
     * @param to The end of the interval which was applied
     * @return The original pitch
     */
    public Pitch untranspose (final Pitch from, final Pitch to)
    {
        return this.transpose (to, from);
    }


    /**
     * Format the note name (without octave marks).
     *
     * @return The name, e.g. 'fis'
     */
    public String getNoteName ()
    {
        final boolean isVowel = this.step == 'a' || this.step == 'e';
        final int quarters = (int) Math.round (this.alter * 2);
        final String suffix;
        switch (quarters)
        {
            case 2:
                suffix = "is";
                break;
            case 4:
                suffix = "isis";
                break;
            case -2:
                suffix = isVowel ? "s" : "es";
                break;
            case -4:
                suffix = isVowel ? "ses" : "eses";
                break;
            case 1:
                suffix = "ih";
                break;
            case 3:
                suffix = "isih";
                break;
            case -1:
                suffix = "eh";
                break;
            case -3:
                suffix = "eseh";
                break;
            default:
                suffix = "";
                break;
        }
        return this.step + suffix;
    }


    /**
     * Format the octave marks.
     *
     * @return The marks, e.g. "''" or ","
     */
    public String getOctaveMarks ()
    {
        return marks (this.octave);
    }


    /**
     * Format octave marks.
     *
     * @param octave The number of marks, negative for ,
     * @return The marks
     */
    public static String marks (final int octave)
    {
        return (octave >= 0 ? "'" : ",").repeat (Math.abs (octave));
    }


    /**
     * Get the index of a step.
     *
     * @param step The step 'a'..'g'
     * @return The index, 0 for c up to 6 for b
     */
    public static int stepIndex (final char step)
    {
        final int index = STEPS.indexOf (step);
        return index < 0 ? 0 : index;
    }


    private static int closestOctave (final char step, final char refStep, final int refOctave)
    {
        final int refIndex = stepIndex (refStep);
        int stepDiff = stepIndex (step) - refIndex;
        if (stepDiff > 3)
            stepDiff -= 7;
        else if (stepDiff < -3)
            stepDiff += 7;

        final int targetIndex = refIndex + stepDiff;
        if (targetIndex < 0)
            return refOctave - 1;
        if (targetIndex >= 7)
            return refOctave + 1;
        return refOctave;
    }


    /** {@inheritDoc} */
    @Override
    protected Object [] getFields ()
    {
        return new Object []
        {
            Character.valueOf (this.step),
            Double.valueOf (this.alter),
            Integer.valueOf (this.octave),
            Boolean.valueOf (this.forceAccidental),
            Boolean.valueOf (this.cautionary),
            this.octaveCheck
        };
    }
}

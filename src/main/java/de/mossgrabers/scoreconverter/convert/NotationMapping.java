// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.convert;

import de.mossgrabers.scoreconverter.format.lilypond.model.ClefEvent;
import de.mossgrabers.scoreconverter.format.lilypond.model.Duration;
import de.mossgrabers.scoreconverter.format.lilypond.model.KeyMode;
import de.mossgrabers.scoreconverter.format.lilypond.model.KeySignature;
import de.mossgrabers.scoreconverter.format.lilypond.model.Pitch;
import de.mossgrabers.scoreconverter.format.lilypond.model.TimeSignature;
import de.mossgrabers.scoreconverter.format.mei.model.Note;
import de.mossgrabers.scoreconverter.format.mei.model.StaffDef;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;


/**
 * Maps pitches, durations, clefs, keys and meters between LilyPond and MEI.
 *
 * @author Jürgen Moßgraber
 */
public class NotationMapping
{
    private static final String               FIFTHS_STEPS       = "fcgdaeb";
    private static final Pattern              CLEF_TRANSPOSITION = Pattern.compile ("^(.+?)([_^])[(\\[]?(\\d+)[)\\]]?$");

    private static final Map<String, String>  ACCIDENTALS        = new HashMap<> ();
    private static final Map<String, Double>  ALTERATIONS        = new HashMap<> ();
    private static final Map<String, String>  CLEF_SHAPES        = new HashMap<> ();
    private static final Map<String, Integer> CLEF_LINES         = new HashMap<> ();

    static
    {
        addAccidental (1, "s");
        addAccidental (-1, "f");
        addAccidental (2, "ss");
        addAccidental (-2, "ff");
        addAccidental (0.5, "1qs");
        addAccidental (1.5, "3qs");
        addAccidental (-0.5, "1qf");
        addAccidental (-1.5, "3qf");
        ALTERATIONS.put ("n", Double.valueOf (0));
        ALTERATIONS.put ("x", Double.valueOf (2));

        addClef ("treble", "G", 2);
        addClef ("violin", "G", 2);
        addClef ("G", "G", 2);
        addClef ("G2", "G", 2);
        addClef ("french", "G", 1);
        addClef ("G1", "G", 1);
        addClef ("soprano", "C", 1);
        addClef ("C1", "C", 1);
        addClef ("mezzosoprano", "C", 2);
        addClef ("C2", "C", 2);
        addClef ("alto", "C", 3);
        addClef ("C", "C", 3);
        addClef ("C3", "C", 3);
        addClef ("tenor", "C", 4);
        addClef ("C4", "C", 4);
        addClef ("baritone", "C", 5);
        addClef ("C5", "C", 5);
        addClef ("varbaritone", "F", 3);
        addClef ("F3", "F", 3);
        addClef ("bass", "F", 4);
        addClef ("F", "F", 4);
        addClef ("F4", "F", 4);
        addClef ("subbass", "F", 5);
        addClef ("F5", "F", 5);
        addClef ("percussion", "perc", 3);
        addClef ("tab", "TAB", 5);
        addClef ("moderntab", "TAB", 5);
    }


    /**
     * Private constructor since this is a utility class.
     */
    private NotationMapping ()
    {
        // Intentionally empty
    }


    private static void addAccidental (final double alter, final String accid)
    {
        ACCIDENTALS.put (Double.toString (alter), accid);
        ALTERATIONS.put (accid, Double.valueOf (alter));
    }


    private static void addClef (final String name, final String shape, final int line)
    {
        CLEF_SHAPES.put (name, shape);
        CLEF_LINES.put (name, Integer.valueOf (line));
    }


    /**
     * Get the MEI accidental of an alteration.
     *
     * @param alter The alteration in half-steps
     * @return The accidental, null if there is no matching symbol; also null for 0
     */
    public static String toAccidental (final double alter)
    {
        return ACCIDENTALS.get (Double.toString (alter));
    }


    /**
     * Get the alteration of an MEI accidental.
     *
     * @param accid The accidental, may be null
     * @return The alteration in half-steps, 0 if unknown
     */
    public static double toAlteration (final String accid)
    {
        if (accid == null)
            return 0;
        final Double alter = ALTERATIONS.get (accid);
        return alter == null ? 0 : alter.doubleValue ();
    }


    /**
     * Set the pitch attributes of a note.
     *
     * @param note The note
     * @param pitch The absolute pitch
     * @return False if the alteration could not be represented
     */
    public static boolean setPitch (final Note note, final Pitch pitch)
    {
        note.pname = String.valueOf (pitch.getStep ());
        note.oct = Integer.valueOf (pitch.getAbsoluteOctave ());
        if (pitch.getAlter () == 0)
            return true;
        note.accid = toAccidental (pitch.getAlter ());
        return note.accid != null;
    }


    /**
     * Get the absolute pitch of a note.
     *
     * @param note The note
     * @return The pitch, null if the note has no pitch
     */
    public static Pitch getPitch (final Note note)
    {
        if (note.pname == null || note.pname.length () != 1)
            return null;
        final int octave = note.oct == null ? 0 : note.oct.intValue () - Pitch.BASE_OCTAVE;
        return new Pitch (Character.toLowerCase (note.pname.charAt (0)), toAlteration (note.accid), octave);
    }


    /**
     * Format the base of a duration for the dur attribute.
     *
     * @param duration The duration
     * @return The value
     */
    public static String toDur (final Duration duration)
    {
        return Integer.toString (duration.getBase ());
    }


    /**
     * Parse a dur attribute.
     *
     * @param dur The value, may be null
     * @param defaultBase The base to use if the value is missing or not a number
     * @return The base
     */
    public static int fromDur (final String dur, final int defaultBase)
    {
        if (dur == null)
            return defaultBase;
        switch (dur)
        {
            case "breve":
            case "long":
            case "maxima":
                return 1;
            default:
                try
                {
                    final int base = Integer.parseInt (dur);
                    return Duration.isValidBase (base) ? base : defaultBase;
                }
                catch (final NumberFormatException ex)
                {
                    return defaultBase;
                }
        }
    }


    /**
     * Set the clef attributes of a staff definition.
     *
     * @param staffDef The staff definition
     * @param clef The clef
     * @return False if the clef is unknown
     */
    public static boolean setClef (final StaffDef staffDef, final ClefEvent clef)
    {
        String name = clef.getName ();
        final Matcher matcher = CLEF_TRANSPOSITION.matcher (name);
        if (matcher.matches ())
        {
            name = matcher.group (1);
            staffDef.clefDis = Integer.valueOf (matcher.group (3));
            staffDef.clefDisPlace = "_".equals (matcher.group (2)) ? "below" : "above";
        }
        final String shape = CLEF_SHAPES.get (name);
        if (shape == null)
        {
            staffDef.clefDis = null;
            staffDef.clefDisPlace = null;
            return false;
        }
        staffDef.clefShape = shape;
        staffDef.clefLine = CLEF_LINES.get (name);
        return true;
    }


    /**
     * Create a clef from the attributes of a staff definition.
     *
     * @param staffDef The staff definition
     * @return The clef or null if there is no clef
     */
    public static ClefEvent getClef (final StaffDef staffDef)
    {
        if (staffDef.clefShape == null)
            return null;
        final int line = staffDef.clefLine == null ? -1 : staffDef.clefLine.intValue ();
        final String name;
        switch (staffDef.clefShape)
        {
            case "G":
                name = line == 1 ? "french" : "treble";
                break;
            case "F":
                name = line == 3 ? "varbaritone" : line == 5 ? "subbass" : "bass";
                break;
            case "C":
                switch (line)
                {
                    case 1:
                        name = "soprano";
                        break;
                    case 2:
                        name = "mezzosoprano";
                        break;
                    case 4:
                        name = "tenor";
                        break;
                    case 5:
                        name = "baritone";
                        break;
                    default:
                        name = "alto";
                        break;
                }
                break;
            case "perc":
                name = "percussion";
                break;
            case "TAB":
                name = "tab";
                break;
            default:
                return null;
        }
        if (staffDef.clefDis == null)
            return new ClefEvent (name);
        return new ClefEvent (name + ("above".equals (staffDef.clefDisPlace) ? "^" : "_") + staffDef.clefDis);
    }


    /**
     * Set the key attributes of a staff definition.
     *
     * @param staffDef The staff definition
     * @param key The key
     */
    public static void setKey (final StaffDef staffDef, final KeySignature key)
    {
        final Pitch tonic = key.getTonic ();
        final int tonicFifths = FIFTHS_STEPS.indexOf (tonic.getStep ()) - 1 + 7 * (int) Math.round (tonic.getAlter ());
        final int fifths = tonicFifths + key.getMode ().getFifthsOffset ();
        if (fifths == 0)
            staffDef.keySig = "0";
        else
            staffDef.keySig = Math.abs (fifths) + (fifths > 0 ? "s" : "f");
        staffDef.keyMode = key.getMode ().getName ();
    }


    /**
     * Create a key from the attributes of a staff definition.
     *
     * @param staffDef The staff definition
     * @return The key or null if there is no key signature
     */
    public static KeySignature getKey (final StaffDef staffDef)
    {
        if (staffDef.keySig == null || staffDef.keySig.isEmpty ())
            return null;
        final int fifths;
        try
        {
            if ("0".equals (staffDef.keySig))
                fifths = 0;
            else
            {
                final int count = Integer.parseInt (staffDef.keySig.substring (0, staffDef.keySig.length () - 1));
                fifths = staffDef.keySig.endsWith ("f") ? -count : count;
            }
        }
        catch (final NumberFormatException ex)
        {
            return null;
        }

        KeyMode mode = staffDef.keyMode == null ? null : KeyMode.fromName (staffDef.keyMode);
        if (mode == null)
            mode = KeyMode.MAJOR;
        final int index = fifths - mode.getFifthsOffset () + 1;
        final char step = FIFTHS_STEPS.charAt (Math.floorMod (index, 7));
        final int alter = Math.floorDiv (index, 7);
        return new KeySignature (new Pitch (step, alter, 0), mode);
    }


    /**
     * Set the meter attributes of a staff definition.
     *
     * @param staffDef The staff definition
     * @param time The time signature
     */
    public static void setMeter (final StaffDef staffDef, final TimeSignature time)
    {
        final List<String> counts = new ArrayList<> ();
        for (final Integer numerator: time.getNumerators ())
            counts.add (numerator.toString ());
        staffDef.meterCount = String.join ("+", counts);
        staffDef.meterUnit = Integer.valueOf (time.getDenominator ());
    }


    /**
     * Create a time signature from the attributes of a staff definition.
     *
     * @param staffDef The staff definition
     * @return The time signature or null if there is no meter
     */
    public static TimeSignature getMeter (final StaffDef staffDef)
    {
        if (staffDef.meterCount == null || staffDef.meterUnit == null)
            return null;
        final List<Integer> numerators = new ArrayList<> ();
        try
        {
            for (final String count: staffDef.meterCount.split ("\\+"))
                numerators.add (Integer.valueOf (count.trim ()));
        }
        catch (final NumberFormatException ex)
        {
            return null;
        }
        return new TimeSignature (numerators, staffDef.meterUnit.intValue ());
    }
}

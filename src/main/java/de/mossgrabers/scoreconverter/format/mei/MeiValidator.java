// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.mei;

import de.mossgrabers.scoreconverter.format.mei.model.Chord;
import de.mossgrabers.scoreconverter.format.mei.model.ControlEvent;
import de.mossgrabers.scoreconverter.format.mei.model.Layer;
import de.mossgrabers.scoreconverter.format.mei.model.LayerElement;
import de.mossgrabers.scoreconverter.format.mei.model.Mdiv;
import de.mossgrabers.scoreconverter.format.mei.model.Measure;
import de.mossgrabers.scoreconverter.format.mei.model.Mei;
import de.mossgrabers.scoreconverter.format.mei.model.MeiElement;
import de.mossgrabers.scoreconverter.format.mei.model.Note;
import de.mossgrabers.scoreconverter.format.mei.model.Score;
import de.mossgrabers.scoreconverter.format.mei.model.Section;
import de.mossgrabers.scoreconverter.format.mei.model.Staff;
import de.mossgrabers.scoreconverter.format.mei.model.StaffDef;
import de.mossgrabers.scoreconverter.format.mei.model.StaffGrp;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;


/**
 * Structural checks of a MEI document: unique IDs, IDs on all events, resolvable references,
 * valid durations and non-empty containers.
 *
 * @author Jürgen Moßgraber
 */
public class MeiValidator
{
    private static final Set<String> NAMED_DURATIONS = Set.of ("breve", "long", "maxima");

    private final Set<String>        ids             = new HashSet<> ();
    private final List<String>       problems        = new ArrayList<> ();


    /**
     * Validate a document.
     *
     * @param mei The document
     * @throws IOException Contains the list of all found problems
     */
    public static void validate (final Mei mei) throws IOException
    {
        final List<String> problems = check (mei);
        if (!problems.isEmpty ())
            throw new IOException ("Invalid MEI document:\n" + String.join ("\n", problems));
    }


    /**
     * Check a document.
     *
     * @param mei The document
     * @return The found problems, empty if the document is valid
     */
    public static List<String> check (final Mei mei)
    {
        final MeiValidator validator = new MeiValidator ();
        validator.checkDocument (mei);
        return validator.problems;
    }


    /**
     * Check if a duration value is valid.
     *
     * @param dur The value of a dur attribute
     * @return True if valid
     */
    public static boolean isValidDuration (final String dur)
    {
        if (NAMED_DURATIONS.contains (dur))
            return true;
        try
        {
            final int value = Integer.parseInt (dur);
            return value >= 1 && value <= 2048 && (value & value - 1) == 0;
        }
        catch (final NumberFormatException ex)
        {
            return false;
        }
    }


    private void checkDocument (final Mei mei)
    {
        this.register (mei);
        if (mei.music == null || mei.music.body == null || mei.music.body.mdivs.isEmpty ())
        {
            this.problems.add ("The document contains no musical division.");
            return;
        }
        this.register (mei.music);

        // IDs first, references can point forward
        final List<ControlEvent> controlEvents = new ArrayList<> ();
        for (final Mdiv mdiv: mei.music.body.mdivs)
        {
            this.register (mdiv);
            if (mdiv.score == null)
            {
                this.problems.add ("Division " + describe (mdiv) + " contains no score.");
                continue;
            }
            this.checkScore (mdiv.score, controlEvents);
        }

        for (final ControlEvent controlEvent: controlEvents)
        {
            this.checkReference (controlEvent, controlEvent.getStartId (), "startid");
            this.checkReference (controlEvent, controlEvent.getEndId (), "endid");
        }
    }


    private void checkScore (final Score score, final List<ControlEvent> controlEvents)
    {
        this.register (score);
        if (score.scoreDef == null || score.scoreDef.staffGrp == null)
            this.problems.add ("Score " + describe (score) + " has no staff definitions.");
        else
            this.checkStaffGroup (score.scoreDef.staffGrp);

        if (score.sections.isEmpty ())
            this.problems.add ("Score " + describe (score) + " contains no section.");
        for (final Section section: score.sections)
        {
            this.register (section);
            if (section.measures.isEmpty ())
                this.problems.add ("Section " + describe (section) + " contains no measure.");
            for (final Measure measure: section.measures)
            {
                this.register (measure);
                if (measure.staves.isEmpty ())
                    this.problems.add ("Measure " + describe (measure) + " contains no staff.");
                for (final Staff staff: measure.staves)
                {
                    this.register (staff);
                    for (final Layer layer: staff.layers)
                    {
                        this.register (layer);
                        for (final LayerElement element: layer.children)
                            this.checkEvent (element);
                    }
                }
                for (final ControlEvent controlEvent: measure.controlEvents)
                {
                    this.register (controlEvent);
                    controlEvents.add (controlEvent);
                }
            }
        }
    }


    private void checkStaffGroup (final StaffGrp staffGrp)
    {
        this.register (staffGrp);
        if (staffGrp.children.isEmpty ())
            this.problems.add ("Staff group " + describe (staffGrp) + " is empty.");
        for (final MeiElement child: staffGrp.children)
        {
            if (child instanceof final StaffGrp group)
                this.checkStaffGroup (group);
            else
            {
                this.register (child);
                if (child instanceof final StaffDef staffDef && staffDef.n == null)
                    this.problems.add ("Staff definition " + describe (staffDef) + " has no number.");
            }
        }
    }


    private void checkEvent (final LayerElement element)
    {
        if (element.id == null || element.id.isBlank ())
            this.problems.add ("Event '" + element.getClass ().getSimpleName () + "' has no ID.");
        this.register (element);

        if (element.dur != null && !isValidDuration (element.dur))
            this.problems.add ("Event " + describe (element) + " has an invalid duration: " + element.dur);

        if (element instanceof final Chord chord)
        {
            if (chord.notes.isEmpty ())
                this.problems.add ("Chord " + describe (chord) + " contains no note.");
            for (final Note note: chord.notes)
                this.register (note);
        }
    }


    private void checkReference (final ControlEvent controlEvent, final String id, final String attribute)
    {
        if (id != null && !this.ids.contains (id))
            this.problems.add ("The " + attribute + " of " + describe (controlEvent) + " refers to an unknown element: " + id);
    }


    private void register (final MeiElement element)
    {
        if (element.id == null)
            return;
        if (!this.ids.add (element.id))
            this.problems.add ("Duplicate ID: " + element.id);
    }


    private static String describe (final MeiElement element)
    {
        return element.id == null ? "<" + element.getClass ().getSimpleName () + ">" : "'" + element.id + "'";
    }
}

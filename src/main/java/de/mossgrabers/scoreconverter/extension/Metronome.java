// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.extension;

/**
 * The details of a metronome marking. There are three mutually exclusive forms: beat unit =
 * beats per minute, a metric modulation (beat unit = beat unit) and a textual note relation.
 *
 * @author Jürgen Moßgraber
 */
public class Metronome extends ExtensionPayload
{
    /** The form of the marking. */
    public enum Form
    {
        /** E.g. 4. = 132-144. */
        BEAT_UNIT_BPM,
        /** E.g. 4 = 4. */
        METRIC_MODULATION,
        /** A free text relation. */
        NOTE_RELATION
    }


    private final Form    form;
    private final String  text;
    private final String  unit;
    private final Integer bpmLow;
    private final Integer bpmHigh;
    private final String  otherUnit;
    private final String  relation;


    private Metronome (final Form form, final String text, final String unit, final Integer bpmLow, final Integer bpmHigh, final String otherUnit, final String relation)
    {
        this.form = form;
        this.text = text;
        this.unit = unit;
        this.bpmLow = bpmLow;
        this.bpmHigh = bpmHigh;
        this.otherUnit = otherUnit;
        this.relation = relation;
    }


    /**
     * Create a beat unit = beats per minute marking.
     *
     * @param text The serialized tempo text, null if none
     * @param unit The serialized beat unit, e.g. '4.'
     * @param bpmLow The beats per minute or the lower end of a range
     * @param bpmHigh The upper end of a range, null if there is no range
     * @return The marking
     */
    public static Metronome beatUnit (final String text, final String unit, final int bpmLow, final Integer bpmHigh)
    {
        return new Metronome (Form.BEAT_UNIT_BPM, text, unit, Integer.valueOf (bpmLow), bpmHigh, null, null);
    }


    /**
     * Create a metric modulation.
     *
     * @param text The serialized tempo text, null if none
     * @param unit The serialized first beat unit
     * @param otherUnit The serialized second beat unit
     * @return The marking
     */
    public static Metronome metricModulation (final String text, final String unit, final String otherUnit)
    {
        return new Metronome (Form.METRIC_MODULATION, text, unit, null, null, otherUnit, null);
    }


    /**
     * Create a note relation.
     *
     * @param text The serialized tempo text, null if none
     * @param relation The relation
     * @return The marking
     */
    public static Metronome noteRelation (final String text, final String relation)
    {
        return new Metronome (Form.NOTE_RELATION, text, null, null, null, null, relation);
    }


    public Form getForm ()
    {
        return this.form;
    }


    public String getText ()
    {
        return this.text;
    }


    public String getUnit ()
    {
        return this.unit;
    }


    public Integer getBpmLow ()
    {
        return this.bpmLow;
    }


    public Integer getBpmHigh ()
    {
        return this.bpmHigh;
    }


    public String getOtherUnit ()
    {
        return this.otherUnit;
    }


    public String getRelation ()
    {
        return this.relation;
    }


    /** {@inheritDoc} */
    @Override
    protected Object [] getFields ()
    {
        return new Object []
        {
            this.form,
            this.text,
            this.unit,
            this.bpmLow,
            this.bpmHigh,
            this.otherUnit,
            this.relation
        };
    }
}

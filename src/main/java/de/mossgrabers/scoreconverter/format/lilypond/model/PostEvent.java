// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.lilypond.model;

/**
 * An event attached to a note, chord or rest, e.g. a slur, a dynamic or an articulation.
 *
 * @author Jürgen Moßgraber
 */
public class PostEvent extends AstNode
{
    /** The kinds of post events. */
    public enum Type
    {
        TIE,
        SLUR_START,
        SLUR_END,
        PHRASING_SLUR_START,
        PHRASING_SLUR_END,
        BEAM_START,
        BEAM_END,
        CRESCENDO,
        DECRESCENDO,
        HAIRPIN_END,
        /** A dynamic like \f, the value is the name. */
        DYNAMIC,
        /** A shorthand like -. or ->, the value is the script character. */
        ARTICULATION,
        /** A named articulation like \staccato, the value is the name. */
        NAMED_ARTICULATION,
        /** A finger number like -3. */
        FINGERING,
        /** A string number like \2. */
        STRING_NUMBER,
        /** A tremolo like :32, number 0 means no value. */
        TREMOLO,
        /** A text like ^"text". */
        TEXT_SCRIPT,
        LYRIC_HYPHEN,
        LYRIC_EXTENDER
    }


    private final Type      type;
    private final Direction direction;
    private final String    value;
    private final int       number;
    private final Markup    text;


    /**
     * Constructor.
     *
     * @param type The type
     * @param direction The placement
     * @param value The name for dynamics and articulations
     * @param number The number for fingerings, string numbers and tremolos
     * @param text The text of a text script
     */
    public PostEvent (final Type type, final Direction direction, final String value, final int number, final Markup text)
    {
        this.type = type;
        this.direction = direction;
        this.value = value;
        this.number = number;
        this.text = text;
    }


    /**
     * Create a post event without further values.
     *
     * @param type The type
     * @return The event
     */
    public static PostEvent of (final Type type)
    {
        return new PostEvent (type, Direction.NONE, null, 0, null);
    }


    /**
     * Create a post event with a name.
     *
     * @param type The type
     * @param direction The placement
     * @param value The name
     * @return The event
     */
    public static PostEvent named (final Type type, final Direction direction, final String value)
    {
        return new PostEvent (type, direction, value, 0, null);
    }


    /**
     * Create a post event with a number.
     *
     * @param type The type
     * @param direction The placement
     * @param number The number
     * @return The event
     */
    public static PostEvent numbered (final Type type, final Direction direction, final int number)
    {
        return new PostEvent (type, direction, null, number, null);
    }


    /**
     * Create a text script.
     *
     * @param direction The placement
     * @param text The text
     * @return The event
     */
    public static PostEvent textScript (final Direction direction, final Markup text)
    {
        return new PostEvent (Type.TEXT_SCRIPT, direction, null, 0, text);
    }


    public Type getType ()
    {
        return this.type;
    }


    public Direction getDirection ()
    {
        return this.direction;
    }


    public String getValue ()
    {
        return this.value;
    }


    public int getNumber ()
    {
        return this.number;
    }


    public Markup getText ()
    {
        return this.text;
    }


    /** {@inheritDoc} */
    @Override
    protected Object [] getFields ()
    {
        return new Object []
        {
            this.type,
            this.direction,
            this.value,
            Integer.valueOf (this.number),
            this.text
        };
    }
}

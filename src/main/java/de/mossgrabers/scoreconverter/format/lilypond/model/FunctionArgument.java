// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.lilypond.model;

/**
 * An argument of a music function call.
 *
 * @author Jürgen Moßgraber
 */
public class FunctionArgument extends AstNode
{
    /** The kinds of arguments. */
    public enum Type
    {
        STRING,
        NUMBER,
        FRACTION,
        DURATION,
        SCHEME,
        DEFAULT,
        MUSIC
    }


    private final Type     type;
    private final String   text;
    private final Duration duration;
    private final Music    music;


    private FunctionArgument (final Type type, final String text, final Duration duration, final Music music)
    {
        this.type = type;
        this.text = text;
        this.duration = duration;
        this.music = music;
    }


    /**
     * Create an argument which is represented by its text (string, number, fraction, Scheme).
     *
     * @param type The type
     * @param text The text, for strings the unquoted content
     * @return The argument
     */
    public static FunctionArgument ofText (final Type type, final String text)
    {
        return new FunctionArgument (type, text, null, null);
    }


    /**
     * Create a duration argument.
     *
     * @param duration The duration
     * @return The argument
     */
    public static FunctionArgument ofDuration (final Duration duration)
    {
        return new FunctionArgument (Type.DURATION, null, duration, null);
    }


    /**
     * Create a music argument.
     *
     * @param music The music
     * @return The argument
     */
    public static FunctionArgument ofMusic (final Music music)
    {
        return new FunctionArgument (Type.MUSIC, null, null, music);
    }


    /**
     * Create the \default argument.
     *
     * @return The argument
     */
    public static FunctionArgument ofDefault ()
    {
        return new FunctionArgument (Type.DEFAULT, null, null, null);
    }


    public Type getType ()
    {
        return this.type;
    }


    public String getText ()
    {
        return this.text;
    }


    public Duration getDuration ()
    {
        return this.duration;
    }


    public Music getMusic ()
    {
        return this.music;
    }


    /**
     * Create a copy with different music.
     *
     * @param newMusic The music
     * @return The new argument
     */
    public FunctionArgument withMusic (final Music newMusic)
    {
        return new FunctionArgument (this.type, this.text, this.duration, newMusic);
    }


    /** {@inheritDoc} */
    @Override
    protected Object [] getFields ()
    {
        return new Object []
        {
            this.type,
            this.text,
            this.duration,
            this.music
        };
    }
}

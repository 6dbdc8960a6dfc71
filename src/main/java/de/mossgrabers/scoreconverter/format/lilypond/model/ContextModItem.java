// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.lilypond.model;

/**
 * An item of a \with block or of a context definition.
 *
 * @author Jürgen Moßgraber
 */
public class ContextModItem extends AstNode
{
    /** The kinds of context modifications. */
    public enum Type
    {
        CONSISTS("consists"),
        REMOVE("remove"),
        ACCEPTS("accepts"),
        DENIES("denies"),
        ALIAS("alias"),
        OVERRIDE("override"),
        REVERT("revert"),
        /** A 'property = value' assignment. */
        ASSIGNMENT(null),
        /** A reference to a context definition, e.g. \Staff. */
        CONTEXT_REF(null);


        private final String command;


        private Type (final String command)
        {
            this.command = command;
        }


        public String getCommand ()
        {
            return this.command;
        }


        /**
         * Lookup the type of a command.
         *
         * @param command The command without backslash
         * @return The type or null
         */
        public static Type fromCommand (final String command)
        {
            for (final Type type: values ())
            {
                if (command.equals (type.command))
                    return type;
            }
            return null;
        }
    }


    private final Type   type;
    private final String path;
    private final String value;


    /**
     * Constructor.
     *
     * @param type The type of the modification
     * @param path The engraver, property path or context name
     * @param value The source text of the value, null if there is none
     */
    public ContextModItem (final Type type, final String path, final String value)
    {
        this.type = type;
        this.path = path;
        this.value = value;
    }


    public Type getType ()
    {
        return this.type;
    }


    public String getPath ()
    {
        return this.path;
    }


    public String getValue ()
    {
        return this.value;
    }


    /** {@inheritDoc} */
    @Override
    protected Object [] getFields ()
    {
        return new Object []
        {
            this.type,
            this.path,
            this.value
        };
    }
}

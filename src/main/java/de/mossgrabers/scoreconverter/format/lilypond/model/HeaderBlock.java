// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.lilypond.model;

import java.util.List;


/**
 * A \header block.
 *
 * @author Jürgen Moßgraber
 */
public class HeaderBlock extends ToplevelExpression
{
    private final List<Assignment> fields;


    /**
     * Constructor.
     *
     * @param fields The header fields
     */
    public HeaderBlock (final List<Assignment> fields)
    {
        this.fields = List.copyOf (fields);
    }


    public List<Assignment> getFieldList ()
    {
        return this.fields;
    }


    /**
     * Lookup a field with a string value.
     *
     * @param name The name of the field, e.g. 'title'
     * @return The text or null if not present or not a string or markup
     */
    public String getText (final String name)
    {
        for (final Assignment field: this.fields)
        {
            if (!field.getName ().equals (name))
                continue;
            final AssignmentValue value = field.getValue ();
            if (value.getKind () == AssignmentValue.Kind.STRING)
                return value.getText ();
            if (value.getKind () == AssignmentValue.Kind.MARKUP)
                return value.getMarkup ().getText ();
        }
        return null;
    }


    /** {@inheritDoc} */
    @Override
    public <R> R accept (final ToplevelVisitor<R> visitor)
    {
        return visitor.visitHeader (this);
    }


    /** {@inheritDoc} */
    @Override
    protected Object [] getFields ()
    {
        return new Object []
        {
            this.fields
        };
    }
}

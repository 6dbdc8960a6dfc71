// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.extension;

/**
 * A technical indication, e.g. a fingering or an up-bow.
 *
 * @author Jürgen Moßgraber
 */
public class Technical extends ExtensionPayload
{
    private final TechnicalKind kind;
    private final String        value;


    /**
     * Constructor.
     *
     * @param kind The kind of technique
     * @param value An additional value, e.g. the finger or the name of the articulation, null if
     *            none
     */
    public Technical (final TechnicalKind kind, final String value)
    {
        this.kind = kind;
        this.value = value;
    }


    public TechnicalKind getKind ()
    {
        return this.kind;
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
            this.kind,
            this.value
        };
    }
}

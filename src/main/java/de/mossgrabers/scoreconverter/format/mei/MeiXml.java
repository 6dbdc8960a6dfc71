// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.format.mei;

import de.mossgrabers.scoreconverter.format.mei.model.Mei;

import jakarta.xml.bind.JAXBContext;
import jakarta.xml.bind.JAXBException;
import jakarta.xml.bind.Marshaller;
import jakarta.xml.bind.Unmarshaller;

import java.io.IOException;
import java.io.InputStream;
import java.io.StringWriter;


/**
 * Reads and writes MEI documents as XML.
 *
 * @author Jürgen Moßgraber
 */
public class MeiXml
{
    /**
     * Private constructor since this is a utility class.
     */
    private MeiXml ()
    {
        // Intentionally empty
    }


    /**
     * Convert a document to XML.
     *
     * @param mei The document
     * @param formatted Indent the XML if true
     * @return The XML text
     * @throws IOException Could not create the XML
     */
    public static String toXML (final Mei mei, final boolean formatted) throws IOException
    {
        try
        {
            final JAXBContext context = createContext ();
            final Marshaller marshaller = context.createMarshaller ();
            marshaller.setProperty (Marshaller.JAXB_FORMATTED_OUTPUT, Boolean.valueOf (formatted));
            marshaller.setProperty (Marshaller.JAXB_ENCODING, "UTF-8");

            final StringWriter sw = new StringWriter ();
            marshaller.marshal (mei, sw);
            return sw.toString ();
        }
        catch (final JAXBException ex)
        {
            throw new IOException (ex);
        }
    }


    /**
     * Read a document from XML.
     *
     * @param in The stream to read from
     * @return The document
     * @throws IOException Could not read the XML or it is not a MEI document
     */
    public static Mei fromXML (final InputStream in) throws IOException
    {
        try
        {
            final JAXBContext context = createContext ();
            final Unmarshaller unmarshaller = context.createUnmarshaller ();
            final Object result = unmarshaller.unmarshal (in);
            if (result instanceof final Mei mei)
                return mei;
            throw new IOException ("Not a MEI document.");
        }
        catch (final JAXBException ex)
        {
            throw new IOException (ex);
        }
    }


    private static JAXBContext createContext () throws JAXBException
    {
        return JAXBContext.newInstance (Mei.class);
    }
}

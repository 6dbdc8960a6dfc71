// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.scoreconverter.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import de.mossgrabers.scoreconverter.format.lilypond.LilyPondDestinationFormat;
import de.mossgrabers.scoreconverter.format.lilypond.LilyPondSourceFormat;
import de.mossgrabers.scoreconverter.format.mei.MeiDestinationFormat;
import de.mossgrabers.scoreconverter.format.mei.MeiSourceFormat;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;


/**
 * Tests for the conversion of files.
 *
 * @author Jürgen Moßgraber
 */
class ConversionTaskTest
{
    /** Collects the IDs of all messages. */
    private static class RecordingNotifier implements INotifier
    {
        private final List<String> messages = new ArrayList<> ();
        private final List<String> errors   = new ArrayList<> ();
        private boolean            cancelled;


        @Override
        public void log (final String messageID, final String... replaceStrings)
        {
            this.messages.add (messageID);
        }


        @Override
        public void logError (final String messageID, final String... replaceStrings)
        {
            this.errors.add (messageID);
        }


        @Override
        public void logError (final String messageID, final Throwable throwable)
        {
            this.errors.add (messageID);
        }


        @Override
        public void logError (final Throwable throwable)
        {
            this.errors.add (throwable.getClass ().getSimpleName ());
        }


        @Override
        public boolean isCancelled ()
        {
            return this.cancelled;
        }
    }


    private RecordingNotifier notifier;
    private ConverterConfig   config;


    @BeforeEach
    void setUp () throws IOException
    {
        this.notifier = new RecordingNotifier ();
        this.config = new ConverterConfig ((File) null);
    }


    @Test
    void lilyPondToMeiAndBack (@TempDir final Path folder) throws IOException
    {
        final Path source = folder.resolve ("song.ly");
        Files.writeString (source, "\\version \"2.24.0\"\n{ c'4 d' e'2 }\n", StandardCharsets.UTF_8);

        final ConversionTask toMei = new ConversionTask (source.toFile (), folder.toFile (), new LilyPondSourceFormat (this.notifier, this.config), new MeiDestinationFormat (this.notifier, this.config), this.notifier);
        assertEquals (Boolean.TRUE, toMei.call ());
        final Path meiFile = folder.resolve ("song.mei");
        assertTrue (Files.isRegularFile (meiFile));
        assertTrue (Files.readString (meiFile, StandardCharsets.UTF_8).contains ("pname=\"e\""));

        final Path output = Files.createDirectory (folder.resolve ("out"));
        final ConversionTask toLilyPond = new ConversionTask (meiFile.toFile (), output.toFile (), new MeiSourceFormat (this.notifier, this.config), new LilyPondDestinationFormat (this.notifier, this.config), this.notifier);
        assertEquals (Boolean.TRUE, toLilyPond.call ());
        final String written = Files.readString (output.resolve ("song.ly"), StandardCharsets.UTF_8);
        assertTrue (written.startsWith ("\\version \"2.24.0\""));
        assertTrue (written.contains ("{ c'4 d' e'2 }"));

        assertTrue (this.notifier.errors.isEmpty ());
        assertEquals ("IDS_NOTIFY_CONVERSION_FINISHED", this.notifier.messages.get (this.notifier.messages.size () - 1));
    }


    @Test
    void missingSourceFile (@TempDir final Path folder)
    {
        final File missing = folder.resolve ("missing.ly").toFile ();
        final ConversionTask task = new ConversionTask (missing, folder.toFile (), new LilyPondSourceFormat (this.notifier, this.config), new MeiDestinationFormat (this.notifier, this.config), this.notifier);
        assertEquals (Boolean.FALSE, task.call ());
        assertEquals (List.of ("IDS_NOTIFY_COULD_NOT_READ"), this.notifier.errors);
    }


    @Test
    void cancelledBeforeWriting (@TempDir final Path folder) throws IOException
    {
        final Path source = folder.resolve ("song.ly");
        Files.writeString (source, "{ c'4 }\n", StandardCharsets.UTF_8);
        this.notifier.cancelled = true;

        final ConversionTask task = new ConversionTask (source.toFile (), folder.toFile (), new LilyPondSourceFormat (this.notifier, this.config), new MeiDestinationFormat (this.notifier, this.config), this.notifier);
        assertEquals (Boolean.FALSE, task.call ());
        assertFalse (Files.exists (folder.resolve ("song.mei")));
        assertEquals ("IDS_NOTIFY_CANCELED", this.notifier.messages.get (this.notifier.messages.size () - 1));
    }
}

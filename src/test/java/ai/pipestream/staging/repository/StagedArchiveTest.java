package ai.pipestream.staging.repository;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.zip.ZipInputStream;

import static org.junit.jupiter.api.Assertions.*;

class StagedArchiveTest {

    @Test
    void testEntriesKeepInsertionOrder() throws IOException {
        StagedArchive archive = new StagedArchive();
        archive.addEntry("z.txt", new ByteArrayInputStream("z".getBytes(StandardCharsets.UTF_8)));
        archive.addEntry("a/a.txt", new ByteArrayInputStream("a".getBytes(StandardCharsets.UTF_8)));

        try (ZipInputStream in = new ZipInputStream(new ByteArrayInputStream(archive.toByteArray()))) {
            assertEquals("z.txt", in.getNextEntry().getName());
            assertEquals("a/a.txt", in.getNextEntry().getName());
            assertNull(in.getNextEntry());
        }
    }

    @Test
    void testFinalizedArchiveRejectsEntries() throws IOException {
        StagedArchive archive = new StagedArchive();
        archive.addEntry("a.txt", new ByteArrayInputStream(new byte[] {1}));

        byte[] first = archive.toByteArray();

        assertSame(first, archive.toByteArray());
        assertThrows(IllegalStateException.class,
                () -> archive.addEntry("b.txt", new ByteArrayInputStream(new byte[] {2})));
    }

    @Test
    void testEmptyArchiveIsValidZip() throws IOException {
        byte[] bytes = new StagedArchive().toByteArray();

        try (ZipInputStream in = new ZipInputStream(new ByteArrayInputStream(bytes))) {
            assertNull(in.getNextEntry());
        }
    }
}

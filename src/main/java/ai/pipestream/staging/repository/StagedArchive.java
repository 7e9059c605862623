package ai.pipestream.staging.repository;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * In-memory zip bundle built from a finished staging area.
 * Entries keep the order in which they were added. The archive is finalized by the
 * first call to {@link #toByteArray()}; after that no more entries can be added.
 */
public class StagedArchive {

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private final ZipOutputStream zip = new ZipOutputStream(buffer);
    private final List<String> entryNames = new ArrayList<>();
    private byte[] finished;

    /**
     * Add one entry.
     *
     * @param relativePath entry name, {@code /}-separated
     * @param contents     entry bytes, read fully and not closed
     */
    public void addEntry(String relativePath, InputStream contents) throws IOException {
        if (finished != null) {
            throw new IllegalStateException("Archive already finalized");
        }
        zip.putNextEntry(new ZipEntry(relativePath));
        contents.transferTo(zip);
        zip.closeEntry();
        entryNames.add(relativePath);
    }

    public void addFile(String relativePath, Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            addEntry(relativePath, in);
        }
    }

    public List<String> entryNames() {
        return Collections.unmodifiableList(entryNames);
    }

    /**
     * Finalize the zip and return its bytes. Repeated calls return the same array, which callers
     * must not modify.
     */
    public byte[] toByteArray() {
        if (finished == null) {
            try {
                zip.finish();
                zip.close();
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to write zip file", e);
            }
            finished = buffer.toByteArray();
        }
        return finished;
    }
}

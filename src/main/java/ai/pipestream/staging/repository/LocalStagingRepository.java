package ai.pipestream.staging.repository;

import ai.pipestream.staging.exception.InvalidRequestException;
import ai.pipestream.staging.exception.StagingStorageException;
import org.jboss.logging.Logger;

import java.io.BufferedOutputStream;
import java.io.Closeable;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Filesystem-backed staging areas.
 * <p>
 * Layout under the root:
 * <pre>
 * {owner}/{address}/{namespace}-{index}/
 *     repository_contents/   staged files, by relative path
 *     repository_state       one lowercase state token
 * </pre>
 */
public class LocalStagingRepository implements StagingRepository, Closeable {

    private static final Logger LOG = Logger.getLogger(LocalStagingRepository.class);

    static final String CONTENTS_DIR = "repository_contents";
    static final String FINISHING_DIR = "repository_finishing";
    static final String STATE_FILE = "repository_state";
    static final String TEMP_PREFIX = "local-repository";

    private final Path root;
    private final boolean deleteOnClose;
    private final RepositoryIndexAllocator allocator;

    public LocalStagingRepository(Path root, boolean deleteOnClose) {
        this(root, deleteOnClose, new RepositoryIndexAllocator());
    }

    LocalStagingRepository(Path root, boolean deleteOnClose, RepositoryIndexAllocator allocator) {
        this.root = root.toAbsolutePath().normalize();
        this.deleteOnClose = deleteOnClose;
        this.allocator = allocator;
        try {
            Files.createDirectories(this.root);
        } catch (IOException e) {
            throw StagingStorageException.ioFailure("init", this.root, e);
        }
    }

    /**
     * A repository rooted in a fresh temporary directory that {@link #close()} removes.
     */
    public static LocalStagingRepository createTemporary() {
        try {
            return new LocalStagingRepository(Files.createTempDirectory(TEMP_PREFIX), true);
        } catch (IOException e) {
            throw StagingStorageException.ioFailure("init", TEMP_PREFIX, e);
        }
    }

    public Path root() {
        return root;
    }

    @Override
    public RepositoryKey start(String ownerIdentity, String clientAddress, String namespace) {
        RepositoryKey key = allocator.allocate(ownerIdentity, clientAddress, namespace);
        Path area = areaFor("start", key);
        try {
            Files.createDirectories(area.resolve(CONTENTS_DIR));
            writeState(area, RepositoryState.OPEN);
        } catch (IOException e) {
            throw StagingStorageException.ioFailure("start", key, e);
        }
        LOG.debugf("Started repository %s at %s", key, area);
        return key;
    }

    @Override
    public RepositoryKey openWithoutNamespace(String ownerIdentity, String clientAddress) {
        RepositoryKey key = allocator.current(ownerIdentity, clientAddress);
        while (true) {
            Path area = areaFor("open", key);
            try {
                if (!Files.exists(area.resolve(STATE_FILE))) {
                    Files.createDirectories(area.resolve(CONTENTS_DIR));
                }
                if (createOpenMarker(area)) {
                    LOG.debugf("Opened repository %s at %s", key, area);
                    return key;
                }
                if (readState(area) == RepositoryState.OPEN) {
                    return key;
                }
            } catch (IOException e) {
                throw StagingStorageException.ioFailure("open", key, e);
            }
            // finished already; a closed repository is never reopened
            key = allocator.advancePast(key);
        }
    }

    @Override
    public long addFile(NamespaceAuthorization authorization, RepositoryKey key, String relativePath,
                        InputStream contents) {
        allocator.validate("addFile", key);
        authorization.requireFile("addFile", key, relativePath);
        Path area = areaFor("addFile", key);
        requireState("addFile", key, area, RepositoryState.OPEN);

        Path contentsRoot = area.resolve(CONTENTS_DIR);
        Path target = resolveContained(contentsRoot, relativePath);
        try {
            Files.createDirectories(target.getParent());
            try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(target))) {
                long written = contents.transferTo(out);
                LOG.debugf("Staged %d bytes into %s: %s", written, key, relativePath);
                return written;
            }
        } catch (IOException e) {
            throw StagingStorageException.ioFailure("addFile", target, e);
        }
    }

    @Override
    public StagedArchive finish(RepositoryKey key) {
        allocator.validate("finish", key);
        Path area = areaFor("finish", key);
        requireState("finish", key, area, RepositoryState.OPEN);

        Path finishing = claimContents(key, area);
        StagedArchive archive = new StagedArchive();
        try {
            List<Path> files;
            try (Stream<Path> walk = Files.walk(finishing)) {
                files = walk.filter(Files::isRegularFile).collect(Collectors.toList());
            }
            for (Path file : files) {
                String entryName = finishing.relativize(file).toString().replace(File.separatorChar, '/');
                archive.addFile(entryName, file);
            }
            deleteRecursively(finishing);
            writeState(area, RepositoryState.CLOSED);
        } catch (IOException e) {
            throw StagingStorageException.ioFailure("finish", key, e);
        }
        LOG.infof("Finished repository %s with %d entries", key, archive.entryNames().size());
        return archive;
    }

    /**
     * Renames the contents directory out of the way so that only one caller can finish a repository.
     *
     * @return the renamed directory, owned by the caller from now on
     */
    private static Path claimContents(RepositoryKey key, Path area) {
        Path finishing = area.resolve(FINISHING_DIR);
        try {
            Files.move(area.resolve(CONTENTS_DIR), finishing, StandardCopyOption.ATOMIC_MOVE);
            return finishing;
        } catch (NoSuchFileException | FileAlreadyExistsException | DirectoryNotEmptyException e) {
            throw new InvalidRequestException("finish", "Repository " + key + " is already being finished", e);
        } catch (IOException e) {
            throw StagingStorageException.ioFailure("finish", key, e);
        }
    }

    @Override
    public void release(RepositoryKey key) {
        allocator.validate("release", key);
        Path area = areaFor("release", key);
        RepositoryState state = readStateOrNotFound(area, key);
        if (state != RepositoryState.CLOSED && state != RepositoryState.RELEASED) {
            throw new InvalidRequestException("release",
                    "Repository " + key + " cannot be released while " + state.token());
        }
        try {
            writeState(area, RepositoryState.RELEASED);
        } catch (IOException e) {
            throw StagingStorageException.ioFailure("release", key, e);
        }
        LOG.infof("Released repository %s", key);
    }

    @Override
    public RepositoryState getState(RepositoryKey key) {
        Path area;
        try {
            allocator.validate("getState", key);
            area = areaFor("getState", key);
        } catch (InvalidRequestException e) {
            LOG.debugf("Reporting %s as not found: %s", key, e.getMessage());
            return RepositoryState.NOT_FOUND;
        }
        return readStateOrNotFound(area, key);
    }

    /**
     * Removes the root when it was created by {@link #createTemporary()}.
     */
    @Override
    public void close() {
        if (!deleteOnClose) {
            return;
        }
        try {
            deleteRecursively(root);
            LOG.debugf("Removed temporary staging root %s", root);
        } catch (IOException e) {
            throw StagingStorageException.ioFailure("close", root, e);
        }
    }

    private Path areaFor(String operation, RepositoryKey key) {
        Path area = root.resolve(segment(operation, key.ownerIdentity()))
                .resolve(segment(operation, key.addressOrDefault()))
                .resolve(segment(operation, key.repositoryId()))
                .normalize();
        if (!area.startsWith(root)) {
            throw InvalidRequestException.unknownRepository(operation, key);
        }
        return area;
    }

    private static String segment(String operation, String value) {
        if (value.isEmpty() || value.equals(".") || value.equals("..")
                || value.indexOf('/') >= 0 || value.indexOf('\\') >= 0 || value.indexOf('\0') >= 0) {
            throw new InvalidRequestException(operation, "Invalid repository key component: " + value);
        }
        return value;
    }

    private static Path resolveContained(Path contentsRoot, String relativePath) {
        if (relativePath == null || relativePath.isBlank()) {
            throw InvalidRequestException.invalidPath("addFile", relativePath);
        }
        String portable = relativePath.replace('\\', '/');
        while (portable.startsWith("/")) {
            portable = portable.substring(1);
        }
        Path target;
        try {
            target = contentsRoot.resolve(portable).normalize();
        } catch (InvalidPathException e) {
            throw new InvalidRequestException("addFile", "Invalid path to upload: " + relativePath, e);
        }
        if (!target.startsWith(contentsRoot) || target.equals(contentsRoot)) {
            throw InvalidRequestException.invalidPath("addFile", relativePath);
        }
        return target;
    }

    private void requireState(String operation, RepositoryKey key, Path area, RepositoryState required) {
        RepositoryState state = readStateOrNotFound(area, key);
        if (state == RepositoryState.NOT_FOUND) {
            throw InvalidRequestException.unknownRepository(operation, key);
        }
        if (state != required) {
            throw new InvalidRequestException(operation,
                    "Repository " + key + " is " + state.token() + ", expected " + required.token());
        }
    }

    private RepositoryState readStateOrNotFound(Path area, RepositoryKey key) {
        if (!Files.isRegularFile(area.resolve(STATE_FILE))) {
            return RepositoryState.NOT_FOUND;
        }
        try {
            return readState(area);
        } catch (IOException e) {
            throw StagingStorageException.ioFailure("readState", key, e);
        }
    }

    private static RepositoryState readState(Path area) throws IOException {
        String token = Files.readString(area.resolve(STATE_FILE), StandardCharsets.UTF_8);
        try {
            return RepositoryState.fromToken(token);
        } catch (IllegalArgumentException e) {
            throw new IOException("Corrupt state marker in " + area, e);
        }
    }

    /**
     * Replaces the marker by rename so readers never see a partially written token.
     */
    private static void writeState(Path area, RepositoryState state) throws IOException {
        Path pending = Files.createTempFile(area, STATE_FILE, ".tmp");
        try {
            Files.writeString(pending, state.token(), StandardCharsets.UTF_8);
            Files.move(pending, area.resolve(STATE_FILE),
                    StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } finally {
            Files.deleteIfExists(pending);
        }
    }

    /**
     * @return true if this call created the marker, false if one already existed
     */
    private static boolean createOpenMarker(Path area) throws IOException {
        Path pending = Files.createTempFile(area, STATE_FILE, ".tmp");
        try {
            Files.writeString(pending, RepositoryState.OPEN.token(), StandardCharsets.UTF_8);
            Files.createLink(area.resolve(STATE_FILE), pending);
            return true;
        } catch (FileAlreadyExistsException e) {
            LOG.tracef("State marker already present in %s", area);
            return false;
        } finally {
            Files.deleteIfExists(pending);
        }
    }

    private static void deleteRecursively(Path path) throws IOException {
        if (!Files.exists(path)) {
            return;
        }
        List<Path> paths;
        try (Stream<Path> walk = Files.walk(path)) {
            paths = walk.sorted(Comparator.reverseOrder()).collect(Collectors.toList());
        }
        for (Path p : paths) {
            Files.deleteIfExists(p);
        }
    }
}

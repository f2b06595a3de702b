package com.questrail.herald.store;

import com.questrail.herald.internal.time.SystemWallClock;
import com.questrail.herald.internal.time.WallClock;
import com.questrail.herald.observability.HeraldErrorEvent;
import com.questrail.herald.observability.HeraldObservabilitySink;
import com.questrail.herald.observability.NullObservabilitySink;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * FileStateStore
 * =============================================================================
 * {@link StateStore} keeping one JSON file per domain: {@code <dir>/<domain>.json}.
 *
 * <h2>Crash consistency</h2>
 * <p>Each write goes to {@code <domain>.json.tmp}, is forced to disk, and is
 * then moved over the live file with {@code ATOMIC_MOVE}. A crash leaves
 * either the old or the new file, never a torn one.</p>
 *
 * <h2>Startup</h2>
 * <ul>
 *   <li>No file: the domain starts from its default state.</li>
 *   <li>Unreadable file: reported as {@link HeraldErrorEvent.Kind#STATE_CORRUPTION},
 *       moved aside to {@code <domain>.json.corrupt-<epochMillis>} for later
 *       inspection, and the domain starts from its default state. Other domains
 *       are unaffected.</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * <p>One {@link ReentrantLock} guards the cached value, the revision counter
 * and the file. {@link #read()} returns the last committed value without
 * taking the lock.</p>
 */
public final class FileStateStore<S> implements StateStore<S> {

    private final String domain;
    private final Path file;
    private final Path tempFile;
    private final StateCodec<S> codec;
    private final int writeAttempts;
    private final WallClock wallClock;
    private final HeraldObservabilitySink observabilitySink;

    private final ReentrantLock lock = new ReentrantLock();

    private volatile S current;
    private long revision;
    private boolean closed;

    private FileStateStore(Builder<S> builder) {
        this.domain = builder.domain;
        this.file = builder.directory.resolve(builder.domain + ".json");
        this.tempFile = builder.directory.resolve(builder.domain + ".json.tmp");
        this.codec = builder.codec;
        this.writeAttempts = builder.writeAttempts;
        this.wallClock = builder.wallClock;
        this.observabilitySink = builder.observabilitySink;
    }

    public static <S> Builder<S> builder(String domain, Class<S> stateType) {
        return new Builder<>(domain, stateType);
    }

    private void load(Supplier<S> defaults) throws IOException {
        Files.createDirectories(file.getParent());
        if (!Files.exists(file)) {
            current = defaults.get();
            revision = 0;
            return;
        }

        try {
            StateEnvelope<S> envelope = codec.decode(readBytes());
            if (!domain.equals(envelope.domain())) {
                throw new StateCorruptionException(
                        "record belongs to domain '" + envelope.domain() + "'");
            }
            if (envelope.schemaVersion() > StateEnvelope.CURRENT_SCHEMA) {
                throw new StateCorruptionException(
                        "record schema " + envelope.schemaVersion() + " is newer than "
                                + StateEnvelope.CURRENT_SCHEMA);
            }
            current = envelope.state();
            revision = envelope.revision();
        } catch (StateCorruptionException e) {
            Path quarantine = quarantine();
            observabilitySink.onError(new HeraldErrorEvent(
                    wallClock.now(),
                    domain,
                    HeraldErrorEvent.Kind.STATE_CORRUPTION,
                    "State file " + file + " unreadable, starting from defaults"
                            + (quarantine != null ? "; original kept at " + quarantine : ""),
                    e));
            current = defaults.get();
            revision = 0;
        }
    }

    private byte[] readBytes() throws StateCorruptionException {
        try {
            return Files.readAllBytes(file);
        } catch (IOException e) {
            throw new StateCorruptionException("state file cannot be read: " + e.getMessage(), e);
        }
    }

    private Path quarantine() {
        Path target = file.resolveSibling(file.getFileName() + ".corrupt-" + wallClock.now().toEpochMilli());
        try {
            return Files.move(file, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            observabilitySink.onError(new HeraldErrorEvent(
                    wallClock.now(),
                    domain,
                    HeraldErrorEvent.Kind.PERSISTENCE,
                    "Could not move unreadable state file aside; it will be overwritten on next write",
                    e));
            return null;
        }
    }

    @Override
    public String domain() {
        return domain;
    }

    @Override
    public S read() {
        return current;
    }

    /**
     * Revision of the last committed write; 0 if nothing was ever written.
     */
    public long revision() {
        lock.lock();
        try {
            return revision;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public <R, X extends Exception> R transact(Transaction<S, R, X> transaction) throws X {
        Objects.requireNonNull(transaction, "transaction");
        lock.lock();
        try {
            if (closed) {
                throw new IllegalStateException("State store for '" + domain + "' is closed");
            }
            Commit<S, R> commit = transaction.apply(current);
            S next = commit.newState();
            if (!next.equals(current)) {
                write(next, revision + 1);
                current = next;
                revision++;
            }
            return commit.result();
        } finally {
            lock.unlock();
        }
    }

    private void write(S state, long nextRevision) {
        StateEnvelope<S> envelope = new StateEnvelope<>(
                StateEnvelope.CURRENT_SCHEMA, domain, nextRevision, wallClock.now(), state);

        IOException last = null;
        for (int attempt = 1; attempt <= writeAttempts; attempt++) {
            try {
                writeAtomically(codec.encode(envelope));
                return;
            } catch (IOException e) {
                last = e;
            }
        }
        throw new PersistenceException(domain,
                "Writing " + file + " failed after " + writeAttempts + " attempt(s)", last);
    }

    private void writeAtomically(byte[] bytes) throws IOException {
        try (FileChannel channel = FileChannel.open(tempFile,
                StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING,
                StandardOpenOption.WRITE)) {
            ByteBuffer buffer = ByteBuffer.wrap(bytes);
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            channel.force(true);
        }
        try {
            Files.move(tempFile, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tempFile, file, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    @Override
    public void close() {
        lock.lock();
        try {
            closed = true;
        } finally {
            lock.unlock();
        }
    }

    public static final class Builder<S> {
        private final String domain;
        private final Class<S> stateType;
        private Path directory;
        private Supplier<S> defaults;
        private StateCodec<S> codec;
        private int writeAttempts = 3;
        private WallClock wallClock = SystemWallClock.INSTANCE;
        private HeraldObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;

        private Builder(String domain, Class<S> stateType) {
            this.domain = Objects.requireNonNull(domain, "domain");
            this.stateType = Objects.requireNonNull(stateType, "stateType");
        }

        public Builder<S> withDirectory(Path directory) {
            this.directory = directory;
            return this;
        }

        public Builder<S> withDefaults(Supplier<S> defaults) {
            this.defaults = defaults;
            return this;
        }

        public Builder<S> withCodec(StateCodec<S> codec) {
            this.codec = codec;
            return this;
        }

        public Builder<S> withWriteAttempts(int attempts) {
            if (attempts < 1) {
                throw new IllegalArgumentException("writeAttempts must be >= 1");
            }
            this.writeAttempts = attempts;
            return this;
        }

        public Builder<S> withWallClock(WallClock clock) {
            this.wallClock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public Builder<S> withObservabilitySink(HeraldObservabilitySink sink) {
            this.observabilitySink = Objects.requireNonNullElse(sink, NullObservabilitySink.INSTANCE);
            return this;
        }

        /**
         * Loads (or defaults) the state and returns the open store.
         *
         * @throws PersistenceException the state directory cannot be created or read
         */
        public FileStateStore<S> open() {
            Objects.requireNonNull(directory, "directory");
            Objects.requireNonNull(defaults, "defaults");
            if (codec == null) {
                codec = new JsonStateCodec<>(stateType);
            }
            FileStateStore<S> store = new FileStateStore<>(this);
            try {
                store.load(defaults);
            } catch (IOException e) {
                throw new PersistenceException(domain, "Cannot open state directory " + directory, e);
            }
            return store;
        }
    }
}

// file: src/main/java/io/kvledger/storage/AtomicFileWriter.java
package io.kvledger.storage;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Level;
import java.util.logging.Logger;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardOpenOption.*;

/**
 * Replaces a file's whole content so that readers see either the old or the new
 * version, never a mix.
 * <p>
 * Steps:
 *   - write everything to "<name>.tmp" next to the target,
 *   - fsync the temp file,
 *   - rename it onto the target with ATOMIC_MOVE.
 * A crash before the rename leaves the previous target untouched and a stale
 * temp file, which {@link #discardStaleTemp()} removes on the next start.
 */
final class AtomicFileWriter {
    private static final Logger log = Logger.getLogger(AtomicFileWriter.class.getName());

    private final Path target;
    private final Path tmp;

    AtomicFileWriter(Path target) throws IOException {
        this.target = target.toAbsolutePath();
        this.tmp = this.target.resolveSibling(this.target.getFileName() + ".tmp");
        Path parent = this.target.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }

    Path target() {
        return target;
    }

    void write(byte[] content) throws IOException {
        try {
            try (FileChannel ch = FileChannel.open(tmp, CREATE, WRITE, TRUNCATE_EXISTING)) {
                ByteBuffer buf = ByteBuffer.wrap(content);
                while (buf.hasRemaining()) {
                    ch.write(buf);
                }
                ch.force(true);
            }
            Files.move(tmp, target, ATOMIC_MOVE);
        } catch (IOException e) {
            try {
                Files.deleteIfExists(tmp);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw e;
        }
    }

    /** Remove a temp file left behind by a write that never reached the rename. */
    void discardStaleTemp() throws IOException {
        if (Files.deleteIfExists(tmp)) {
            log.log(Level.INFO, "Discarded unfinished write " + tmp);
        }
    }
}

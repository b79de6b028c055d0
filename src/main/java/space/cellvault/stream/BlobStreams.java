package space.cellvault.stream;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import space.cellvault.blob.BlobStore;
import space.cellvault.blob.BlobStoreRegistry;
import space.cellvault.blob.Chunk;
import space.cellvault.blob.ObjectDescriptor;
import space.cellvault.common.exception.BlobStoreException;
import space.cellvault.common.exception.BlobStreamException;
import space.cellvault.common.exception.ValidationException;

import java.io.Closeable;
import java.io.Flushable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.util.List;

/**
 * Moves object content between client streams and the blocks and chunks of a
 * {@link BlobStore}.
 * <p>
 * Every operation runs sequentially on the calling thread: chunk offsets and
 * the running digest depend on order. Faults are logged and rethrown; size
 * and checksum are only committed once all data is stored.
 */
@ApplicationScoped
public class BlobStreams {

    private static final Logger LOG = Logger.getLogger(BlobStreams.class);

    @Inject
    BlobStoreRegistry registry;

    @ConfigProperty(name = "blobstore.digest-algorithm", defaultValue = "MD5")
    String digestAlgorithm;

    BlobStreams() {
    }

    public BlobStreams(BlobStoreRegistry registry) {
        this(registry, "MD5");
    }

    public BlobStreams(BlobStoreRegistry registry, String digestAlgorithm) {
        this.registry = registry;
        this.digestAlgorithm = digestAlgorithm;
    }

    @FunctionalInterface
    private interface ChunkVisitor<E extends Exception> {
        void visit(Chunk chunk) throws E;
    }

    // ==================== Read ====================

    public ObjectDescriptor drain(ObjectDescriptor descriptor, OutputStream sink) {
        return drain(descriptor, sink, true);
    }

    /**
     * Write the content of an object to {@code sink}, block by block.
     *
     * @param descriptor The fully written object.
     * @param sink       The stream receiving the bytes.
     * @param close      Whether to flush and close the sink afterwards, on
     *                   success and failure alike.
     * @return The descriptor.
     */
    public ObjectDescriptor drain(ObjectDescriptor descriptor, OutputStream sink, boolean close) {
        RuntimeException failure = null;
        try {
            BlobStore store = registry.forDescriptor(descriptor);
            List<Long> blocks = store.blocks(descriptor);
            LOG.debugf("Got %d blocks for %s", blocks.size(), descriptor);

            for (long block : blocks) {
                walkBlock(store, descriptor, block, chunk -> write(sink, chunk.payload()));
            }
            return descriptor;
        } catch (IOException e) {
            failure = new BlobStreamException("Failed to write " + descriptor + " to sink", e);
            LOG.errorf(e, "Error during read of %s", descriptor);
            throw failure;
        } catch (RuntimeException e) {
            failure = e;
            LOG.errorf(e, "Error during read of %s", descriptor);
            throw e;
        } finally {
            if (close) {
                LOG.debug("Closing sink after read");
                release(sink, "sink", failure);
            }
        }
    }

    // ==================== Write ====================

    public ObjectDescriptor ingest(InputStream source, ObjectDescriptor descriptor) {
        return ingest(source, descriptor, true);
    }

    /**
     * Store the content of {@code source} as the data of a fresh object and
     * commit its size and checksum.
     *
     * @param source     The stream to read until its end.
     * @param descriptor The object to fill.
     * @param close      Whether to close the source afterwards, on success and
     *                   failure alike.
     * @return The descriptor, with size and checksum committed.
     */
    public ObjectDescriptor ingest(InputStream source, ObjectDescriptor descriptor, boolean close) {
        RuntimeException failure = null;
        try {
            BlobStore store = registry.forDescriptor(descriptor);
            IncrementalDigest digest = IncrementalDigest.of(digestAlgorithm);

            long block = 0;
            long offset = 0;
            boolean blockStarted = true;
            store.startBlock(descriptor, block, offset);

            while (true) {
                int maxChunkSize = store.maxChunkSize(descriptor);
                if (maxChunkSize <= 0) {
                    throw new BlobStoreException(
                            String.format("Invalid max chunk size %d for %s", maxChunkSize, descriptor));
                }

                byte[] buffer = new byte[maxChunkSize];
                int read = source.read(buffer);
                if (read <= 0) {
                    LOG.debugf("Read whole stream for %s", descriptor);
                    break;
                }

                // a short write leaves a remainder that is offered again
                int written = 0;
                while (written < read) {
                    if (!blockStarted) {
                        LOG.debugf("Marking new block %d for %s", block, descriptor);
                        store.startBlock(descriptor, block, offset);
                        blockStarted = true;
                    }

                    int accepted = store.writeChunk(descriptor, block, offset,
                            ByteBuffer.wrap(buffer, written, read - written));
                    if (accepted <= 0) {
                        throw new BlobStoreException(String.format(
                                "Store accepted no bytes at block %d offset %d for %s", block, offset, descriptor));
                    }

                    digest.update(buffer, written, accepted);
                    written += accepted;
                    offset += accepted;

                    if (store.isBoundary(block, offset)) {
                        block = offset;
                        blockStarted = false;
                    }
                }
            }

            String checksum = digest.hex();
            descriptor.commit(offset, checksum);
            LOG.debugf("Stored size %d and checksum %s for %s", offset, checksum, descriptor);
            return descriptor;
        } catch (IOException e) {
            failure = new BlobStreamException("Failed to read source of " + descriptor, e);
            LOG.errorf(e, "Error during write of %s", descriptor);
            throw failure;
        } catch (RuntimeException e) {
            failure = e;
            LOG.errorf(e, "Error during write of %s", descriptor);
            throw e;
        } finally {
            if (close) {
                LOG.debug("Closing source after write");
                release(source, "source", failure);
            }
        }
    }

    // ==================== Copy ====================

    /**
     * Duplicate the blocks and chunks of a complete object at the same
     * coordinates and carry over its size and checksum.
     *
     * @param source      The complete object to copy.
     * @param destination The fresh object to fill.
     * @return The destination descriptor.
     */
    public ObjectDescriptor duplicate(ObjectDescriptor source, ObjectDescriptor destination) {
        if (!source.isComplete()) {
            throw new ValidationException("Cannot copy incomplete object: " + source);
        }

        try {
            BlobStore from = registry.forDescriptor(source);
            BlobStore to = registry.forDescriptor(destination);

            for (long block : from.blocks(source)) {
                LOG.debugf("Copying block %d of %s", block, source);
                to.startBlock(destination, block, block);
                walkBlock(from, source, block,
                        chunk -> writeFully(to, destination, block, chunk.offset(), chunk.payload()));
            }

            destination.commit(source.size, source.checksum);
            return destination;
        } catch (RuntimeException e) {
            LOG.errorf(e, "Error during copy of %s to %s", source, destination);
            throw e;
        }
    }

    // ==================== Multipart ====================

    /**
     * Concatenate the parts of a multipart upload into one object.
     * <p>
     * Each part addresses its content from offset 0; its blocks and chunks are
     * shifted by the total length of all preceding parts. One checksum is
     * computed over the whole concatenation.
     *
     * @param parts       The complete parts, in part number order.
     * @param destination The fresh object to fill.
     * @param notifier    Receives a {@code BLOCK} event per copied block and a
     *                    {@code CHUNK} event per copied chunk.
     * @return The destination descriptor, with size and checksum committed.
     */
    public ObjectDescriptor consolidate(List<ObjectDescriptor> parts, ObjectDescriptor destination,
            ProgressNotifier notifier) {
        try {
            BlobStore to = registry.forDescriptor(destination);
            IncrementalDigest digest = IncrementalDigest.of(digestAlgorithm);
            long globalOffset = 0;

            for (ObjectDescriptor part : parts) {
                BlobStore from = registry.forDescriptor(part);
                LOG.debugf("Streaming part %s at offset %d", part, globalOffset);

                long shift = globalOffset;
                long partLength = 0;
                for (long block : from.blocks(part)) {
                    long globalBlock = shift + block;
                    to.startBlock(destination, globalBlock, globalBlock);
                    notifier.onProgress(ProgressNotifier.Granularity.BLOCK);

                    long end = walkBlock(from, part, block, chunk -> {
                        notifier.onProgress(ProgressNotifier.Granularity.CHUNK);
                        writeFully(to, destination, globalBlock, shift + chunk.offset(), chunk.payload());
                        digest.update(chunk.payload());
                    });
                    partLength = Math.max(partLength, end);
                }

                if (part.size != null && part.size != partLength) {
                    LOG.warnf("Part %s records size %d but %d bytes were stored", part, part.size, partLength);
                }
                globalOffset += partLength;
            }

            String checksum = digest.hex();
            destination.commit(globalOffset, checksum);
            LOG.debugf("Stored size %d and checksum %s for %s", globalOffset, checksum, destination);
            return destination;
        } catch (RuntimeException e) {
            LOG.errorf(e, "Error during consolidation of %d parts into %s", parts.size(), destination);
            throw e;
        }
    }

    // ==================== Integrity ====================

    /**
     * Recompute the checksum of a stored object and compare it with the
     * committed one.
     *
     * @return {@code false} for an incomplete object or a mismatch.
     */
    public boolean verify(ObjectDescriptor descriptor) {
        if (!descriptor.isComplete()) {
            LOG.debugf("Not verifying incomplete object %s", descriptor);
            return false;
        }

        BlobStore store = registry.forDescriptor(descriptor);
        IncrementalDigest digest = IncrementalDigest.of(digestAlgorithm);
        long size = 0;
        for (long block : store.blocks(descriptor)) {
            long end = walkBlock(store, descriptor, block, chunk -> digest.update(chunk.payload()));
            size += end - block;
        }

        String computed = digest.hex();
        boolean valid = computed.equals(descriptor.checksum) && size == descriptor.size;
        if (!valid) {
            LOG.warnf("Integrity check failed for %s: expected=%s (%d bytes), computed=%s (%d bytes)",
                    descriptor, descriptor.checksum, descriptor.size, computed, size);
        }
        return valid;
    }

    // ==================== Helpers ====================

    /**
     * Visit the chunks of one block page by page until the store reports it
     * exhausted.
     *
     * @return The offset following the last chunk, or the block id for an
     *         empty block.
     */
    private static <E extends Exception> long walkBlock(BlobStore store, ObjectDescriptor descriptor, long block,
            ChunkVisitor<E> visitor) throws E {
        long offset = block;
        List<Chunk> chunks = store.chunks(descriptor, block, offset);
        while (!chunks.isEmpty()) {
            LOG.debugf("Got %d chunks at offset %d of %s", chunks.size(), offset, descriptor);
            for (Chunk chunk : chunks) {
                visitor.visit(chunk);
            }
            offset = chunks.get(chunks.size() - 1).end();
            chunks = store.chunks(descriptor, block, offset);
        }
        return offset;
    }

    private static void writeFully(BlobStore store, ObjectDescriptor descriptor, long block, long offset,
            ByteBuffer payload) {
        ByteBuffer remaining = payload.duplicate();
        long at = offset;
        while (remaining.hasRemaining()) {
            int accepted = store.writeChunk(descriptor, block, at, remaining);
            if (accepted <= 0) {
                throw new BlobStoreException(String.format(
                        "Store accepted no bytes at block %d offset %d for %s", block, at, descriptor));
            }
            remaining.position(remaining.position() + accepted);
            at += accepted;
        }
    }

    private static void write(OutputStream sink, ByteBuffer payload) throws IOException {
        if (payload.hasArray()) {
            sink.write(payload.array(), payload.arrayOffset() + payload.position(), payload.remaining());
        } else {
            byte[] bytes = new byte[payload.remaining()];
            payload.duplicate().get(bytes);
            sink.write(bytes);
        }
    }

    /**
     * Flush and close a client stream. A cleanup fault is attached to the
     * failure already in flight, or thrown if there is none.
     */
    private static void release(Closeable stream, String name, RuntimeException failure) {
        IOException problem = null;
        if (stream instanceof Flushable) {
            try {
                ((Flushable) stream).flush();
            } catch (IOException e) {
                problem = e;
            }
        }
        try {
            stream.close();
        } catch (IOException e) {
            if (problem == null) {
                problem = e;
            } else {
                problem.addSuppressed(e);
            }
        }

        if (problem == null) {
            return;
        }
        if (failure != null) {
            failure.addSuppressed(problem);
            return;
        }
        throw new BlobStreamException("Failed to release " + name, problem);
    }
}

package space.cellvault.blob;

import io.quarkus.hibernate.reactive.panache.Panache;
import io.quarkus.vertx.VertxContextSupport;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Named;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import space.cellvault.blob.entity.BlobBlock;
import space.cellvault.blob.entity.BlobChunk;
import space.cellvault.common.exception.BlobStoreException;

import java.nio.ByteBuffer;
import java.util.List;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Chunk store persisting blocks and chunks in PostgreSQL.
 * <p>
 * The streaming engine is blocking, so every call bridges onto the Vert.x
 * context required by Hibernate Reactive and waits for the result. Callers
 * must therefore run on a worker thread.
 */
@ApplicationScoped
@Named("postgres")
public class PostgresBlobStore implements BlobStore {

    private static final Logger LOG = Logger.getLogger(PostgresBlobStore.class);

    @ConfigProperty(name = "blobstore.postgres.max-chunk-size", defaultValue = "524288")
    int maxChunkSize;

    @ConfigProperty(name = "blobstore.postgres.max-block-size", defaultValue = "4194304")
    long maxBlockSize;

    @ConfigProperty(name = "blobstore.postgres.page-size", defaultValue = "16")
    int pageSize;

    @Override
    public List<Long> blocks(ObjectDescriptor descriptor) {
        return await(() -> Panache.withSession(
                () -> BlobBlock.findOrderedByBlob(descriptor.inode, descriptor.version))
                .map(blocks -> blocks.stream().map(b -> b.blockId).collect(Collectors.toList())),
                "list blocks", descriptor);
    }

    @Override
    public List<Chunk> chunks(ObjectDescriptor descriptor, long block, long fromOffset) {
        return await(() -> Panache.withSession(
                () -> BlobChunk.findPage(descriptor.inode, descriptor.version, block, fromOffset, pageSize))
                .map(chunks -> chunks.stream()
                        .map(c -> new Chunk(c.blockId, c.chunkOffset, ByteBuffer.wrap(c.data)))
                        .collect(Collectors.toList())),
                "read chunks", descriptor);
    }

    @Override
    public void startBlock(ObjectDescriptor descriptor, long block, long offset) {
        LOG.debugf("Starting block %d at offset %d for %s", block, offset, descriptor);
        await(() -> Panache.withTransaction(() -> BlobBlock.exists(descriptor.inode, descriptor.version, block)
                .flatMap(exists -> {
                    if (exists) {
                        return Uni.createFrom().voidItem();
                    }
                    BlobBlock entity = new BlobBlock();
                    entity.inode = descriptor.inode;
                    entity.versionId = descriptor.version;
                    entity.blockId = block;
                    entity.startOffset = offset;
                    return entity.persist().replaceWithVoid();
                })), "start block", descriptor);
    }

    @Override
    public int writeChunk(ObjectDescriptor descriptor, long block, long offset, ByteBuffer payload) {
        int accepted = Math.min(payload.remaining(), maxChunkSize);
        byte[] data = new byte[accepted];
        payload.duplicate().get(data);

        BlobChunk chunk = new BlobChunk();
        chunk.inode = descriptor.inode;
        chunk.versionId = descriptor.version;
        chunk.blockId = block;
        chunk.chunkOffset = offset;
        chunk.size = accepted;
        chunk.data = data;

        // Each chunk in its own transaction
        await(() -> Panache.withTransaction(() -> chunk.persist().replaceWithVoid()), "write chunk", descriptor);
        return accepted;
    }

    @Override
    public int maxChunkSize(ObjectDescriptor descriptor) {
        return maxChunkSize;
    }

    @Override
    public boolean isBoundary(long block, long offset) {
        return offset - block >= maxBlockSize;
    }

    /**
     * Count all stored blocks. Used by the readiness check to reach the database.
     */
    public Uni<Long> countBlocks() {
        return Panache.withSession(() -> BlobBlock.count());
    }

    private static <T> T await(Supplier<Uni<T>> work, String operation, ObjectDescriptor descriptor) {
        try {
            return VertxContextSupport.subscribeAndAwait(work);
        } catch (Error e) {
            throw e;
        } catch (Throwable t) {
            throw new BlobStoreException(String.format("Failed to %s for %s", operation, descriptor), t);
        }
    }
}

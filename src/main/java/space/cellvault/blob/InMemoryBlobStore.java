package space.cellvault.blob;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Named;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import space.cellvault.common.exception.BlobStoreException;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Chunk store keeping blocks and chunks in process memory.
 * Used for single-node deployments and as the reference backend in tests.
 */
@ApplicationScoped
@Named("memory")
public class InMemoryBlobStore implements BlobStore {

    private static final Logger LOG = Logger.getLogger(InMemoryBlobStore.class);

    @ConfigProperty(name = "blobstore.memory.max-chunk-size", defaultValue = "1048576")
    int maxChunkSize;

    @ConfigProperty(name = "blobstore.memory.max-block-size", defaultValue = "4194304")
    long maxBlockSize;

    @ConfigProperty(name = "blobstore.memory.page-size", defaultValue = "16")
    int pageSize;

    // blob -> block id -> chunk offset -> bytes
    private final Map<String, NavigableMap<Long, NavigableMap<Long, byte[]>>> blobs = new ConcurrentHashMap<>();

    public InMemoryBlobStore() {
    }

    public InMemoryBlobStore(int maxChunkSize, long maxBlockSize) {
        this(maxChunkSize, maxBlockSize, 16);
    }

    public InMemoryBlobStore(int maxChunkSize, long maxBlockSize, int pageSize) {
        this.maxChunkSize = maxChunkSize;
        this.maxBlockSize = maxBlockSize;
        this.pageSize = pageSize;
    }

    @Override
    public List<Long> blocks(ObjectDescriptor descriptor) {
        NavigableMap<Long, NavigableMap<Long, byte[]>> blocks = blobs.get(blobKey(descriptor));
        if (blocks == null) {
            return List.of();
        }
        return new ArrayList<>(blocks.keySet());
    }

    @Override
    public List<Chunk> chunks(ObjectDescriptor descriptor, long block, long fromOffset) {
        NavigableMap<Long, NavigableMap<Long, byte[]>> blocks = blobs.get(blobKey(descriptor));
        NavigableMap<Long, byte[]> chunks = blocks == null ? null : blocks.get(block);
        if (chunks == null) {
            return List.of();
        }

        List<Chunk> page = new ArrayList<>(pageSize);
        for (Map.Entry<Long, byte[]> entry : chunks.tailMap(fromOffset, true).entrySet()) {
            if (page.size() == pageSize) {
                break;
            }
            page.add(new Chunk(block, entry.getKey(), ByteBuffer.wrap(entry.getValue().clone())));
        }
        return page;
    }

    @Override
    public void startBlock(ObjectDescriptor descriptor, long block, long offset) {
        LOG.debugf("Starting block %d at offset %d for %s", block, offset, descriptor);
        blobs.computeIfAbsent(blobKey(descriptor), k -> new ConcurrentSkipListMap<>())
                .putIfAbsent(block, new ConcurrentSkipListMap<>());
    }

    @Override
    public int writeChunk(ObjectDescriptor descriptor, long block, long offset, ByteBuffer payload) {
        NavigableMap<Long, NavigableMap<Long, byte[]>> blocks = blobs.get(blobKey(descriptor));
        NavigableMap<Long, byte[]> chunks = blocks == null ? null : blocks.get(block);
        if (chunks == null) {
            throw new BlobStoreException(
                    String.format("Block %d was not started for %s", block, descriptor));
        }

        int accepted = Math.min(payload.remaining(), maxChunkSize);
        byte[] data = new byte[accepted];
        payload.duplicate().get(data);
        chunks.put(offset, data);
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
     * Drop all data of an object.
     */
    public void delete(ObjectDescriptor descriptor) {
        blobs.remove(blobKey(descriptor));
    }

    private static String blobKey(ObjectDescriptor descriptor) {
        return descriptor.inode + "/" + descriptor.version;
    }
}

package space.cellvault.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import space.cellvault.blob.BlobStoreRegistry;
import space.cellvault.blob.InMemoryBlobStore;
import space.cellvault.blob.ObjectDescriptor;
import space.cellvault.common.exception.ValidationException;
import space.cellvault.stream.BlobStreams;
import space.cellvault.stream.ProgressNotifier;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ObjectStreamService.
 */
class ObjectStreamServiceTest {

    private static final UUID CONTAINER = UUID.randomUUID();
    private static final byte[] TEST_DATA = "This is test content for the object store.".getBytes(StandardCharsets.UTF_8);

    private ObjectStreamService service;

    @BeforeEach
    void setUp() {
        InMemoryBlobStore store = new InMemoryBlobStore(8, 32);
        service = new ObjectStreamService();
        service.streams = new BlobStreams(BlobStoreRegistry.of("default", Map.of("default", store)));
    }

    // ==================== Object Tests ====================

    @Test
    void testPutAndGetObject() {
        ObjectDescriptor descriptor = ObjectDescriptor.create(CONTAINER, "test-file.txt", null);

        ObjectDescriptor stored = service.putObject(new ByteArrayInputStream(TEST_DATA), descriptor)
                .await().indefinitely();

        assertEquals(TEST_DATA.length, stored.size);
        assertNotNull(stored.checksum);

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        service.getObject(stored, out).await().indefinitely();
        assertArrayEquals(TEST_DATA, out.toByteArray());
    }

    @Test
    void testGetObject_Incomplete() {
        ObjectDescriptor descriptor = ObjectDescriptor.create(CONTAINER, "pending.txt", null);

        assertThrows(ValidationException.class,
                () -> service.getObject(descriptor, new ByteArrayOutputStream()).await().indefinitely());
    }

    @Test
    void testCopyObject() {
        ObjectDescriptor source = put("original.txt", TEST_DATA);
        ObjectDescriptor destination = ObjectDescriptor.create(CONTAINER, "copy.txt", null);

        ObjectDescriptor copy = service.copyObject(source, destination).await().indefinitely();

        assertEquals(source.checksum, copy.checksum);
        assertTrue(service.verifyIntegrity(copy).await().indefinitely());
    }

    @Test
    void testVerifyIntegrity_Incomplete() {
        ObjectDescriptor descriptor = ObjectDescriptor.create(CONTAINER, "pending.txt", null);

        assertFalse(service.verifyIntegrity(descriptor).await().indefinitely());
    }

    // ==================== Multipart Tests ====================

    @Test
    void testCompleteMultipartUpload_OrdersParts() {
        ObjectDescriptor third = putPart(3, "!");
        ObjectDescriptor first = putPart(1, "multi");
        ObjectDescriptor second = putPart(2, "part");
        ObjectDescriptor destination = ObjectDescriptor.create(CONTAINER, "assembled.txt", null);

        service.completeMultipartUpload(List.of(third, first, second), destination, ProgressNotifier.NONE)
                .await().indefinitely();

        assertEquals(10L, destination.size);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        service.getObject(destination, out).await().indefinitely();
        assertEquals("multipart!", out.toString(StandardCharsets.UTF_8));
    }

    @Test
    void testCompleteMultipartUpload_DuplicatePartNumber() {
        List<ObjectDescriptor> parts = List.of(putPart(1, "a"), putPart(1, "b"));
        ObjectDescriptor destination = ObjectDescriptor.create(CONTAINER, "assembled.txt", null);

        assertThrows(ValidationException.class, () -> service
                .completeMultipartUpload(parts, destination, ProgressNotifier.NONE).await().indefinitely());
        assertFalse(destination.isComplete());
    }

    @Test
    void testCompleteMultipartUpload_IncompletePart() {
        ObjectDescriptor pending = ObjectDescriptor.part(CONTAINER, "upload", 2, null);
        List<ObjectDescriptor> parts = List.of(putPart(1, "a"), pending);

        assertThrows(ValidationException.class, () -> ObjectStreamService.orderParts(parts));
    }

    @Test
    void testOrderParts_MissingPartNumber() {
        ObjectDescriptor notAPart = put("plain.txt", TEST_DATA);

        assertThrows(ValidationException.class, () -> ObjectStreamService.orderParts(List.of(notAPart)));
    }

    // ==================== Helpers ====================

    private ObjectDescriptor put(String key, byte[] data) {
        ObjectDescriptor descriptor = ObjectDescriptor.create(CONTAINER, key, null);
        return service.putObject(new ByteArrayInputStream(data), descriptor).await().indefinitely();
    }

    private ObjectDescriptor putPart(int partNumber, String content) {
        ObjectDescriptor part = ObjectDescriptor.part(CONTAINER, "upload", partNumber, null);
        return service.putObject(new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8)), part)
                .await().indefinitely();
    }
}

package space.cellvault.stream;

import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for IncrementalDigest.
 */
class IncrementalDigestTest {

    @Test
    void testHex_EmptyInput() {
        assertEquals("d41d8cd98f00b204e9800998ecf8427e", IncrementalDigest.md5().hex());
    }

    @Test
    void testHex_KnownValue() {
        IncrementalDigest digest = IncrementalDigest.md5();
        byte[] data = "abc".getBytes(StandardCharsets.US_ASCII);
        digest.update(data, 0, data.length);

        assertEquals("900150983cd24fb0d6963f7d28e17f72", digest.hex());
    }

    @Test
    void testUpdate_PiecewiseMatchesWhole() throws Exception {
        byte[] data = "The quick brown fox jumps over the lazy dog".getBytes(StandardCharsets.US_ASCII);

        IncrementalDigest digest = IncrementalDigest.md5();
        digest.update(data, 0, 10);
        digest.update(data, 10, 5);
        digest.update(data, 15, data.length - 15);

        String expected = HexFormat.of().formatHex(MessageDigest.getInstance("MD5").digest(data));
        assertEquals(expected, digest.hex());
    }

    @Test
    void testUpdate_ByteBufferKeepsPosition() {
        ByteBuffer payload = ByteBuffer.wrap("xxabc".getBytes(StandardCharsets.US_ASCII));
        payload.position(2);

        IncrementalDigest digest = IncrementalDigest.md5();
        digest.update(payload);

        assertEquals(2, payload.position());
        assertEquals(3, payload.remaining());
        assertEquals("900150983cd24fb0d6963f7d28e17f72", digest.hex());
    }

    @Test
    void testHex_KeepsLeadingZeros() throws Exception {
        // find an input whose digest starts with a zero byte
        MessageDigest md = MessageDigest.getInstance("MD5");
        byte[] input = null;
        for (int i = 0; input == null; i++) {
            byte[] candidate = Integer.toString(i).getBytes(StandardCharsets.US_ASCII);
            if (md.digest(candidate)[0] == 0) {
                input = candidate;
            }
        }

        IncrementalDigest digest = IncrementalDigest.md5();
        digest.update(input, 0, input.length);
        String hex = digest.hex();

        assertEquals(32, hex.length());
        assertTrue(hex.startsWith("00"));
        assertEquals(hex.toLowerCase(), hex);
    }

    @Test
    void testOf_OtherAlgorithm() {
        IncrementalDigest digest = IncrementalDigest.of("SHA-256");

        assertEquals("SHA-256", digest.getAlgorithm());
        assertEquals(64, digest.hex().length());
    }

    @Test
    void testOf_UnknownAlgorithm() {
        assertThrows(IllegalArgumentException.class, () -> IncrementalDigest.of("NOPE-1"));
    }

    @Test
    void testUpdate_ConcurrentCallersAreSerialized() throws Exception {
        IncrementalDigest digest = IncrementalDigest.md5();
        byte[] single = { 'a' };
        int threads = 8;
        int updates = 5000;

        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                futures.add(pool.submit(() -> {
                    for (int i = 0; i < updates; i++) {
                        digest.update(single, 0, 1);
                    }
                }));
            }
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        byte[] all = new byte[threads * updates];
        Arrays.fill(all, (byte) 'a');
        String expected = HexFormat.of().formatHex(MessageDigest.getInstance("MD5").digest(all));
        assertEquals(expected, digest.hex());
    }
}

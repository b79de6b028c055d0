package space.cellvault.stream;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for KeepAliveNotifier.
 */
class KeepAliveNotifierTest {

    @Test
    void testWritesSpacePerBlock() {
        ByteArrayOutputStream response = new ByteArrayOutputStream();
        KeepAliveNotifier notifier = new KeepAliveNotifier(response);

        notifier.onProgress(ProgressNotifier.Granularity.BLOCK);
        notifier.onProgress(ProgressNotifier.Granularity.CHUNK);
        notifier.onProgress(ProgressNotifier.Granularity.CHUNK);
        notifier.onProgress(ProgressNotifier.Granularity.BLOCK);

        assertEquals("  ", response.toString(StandardCharsets.US_ASCII));
        assertFalse(notifier.isBroken());
    }

    @Test
    void testBrokenResponseStopsKeepAlives() throws IOException {
        OutputStream response = mock(OutputStream.class);
        doThrow(new IOException("client went away")).when(response).write(anyInt());
        KeepAliveNotifier notifier = new KeepAliveNotifier(response);

        notifier.onProgress(ProgressNotifier.Granularity.BLOCK);
        notifier.onProgress(ProgressNotifier.Granularity.BLOCK);

        assertTrue(notifier.isBroken());
        verify(response, times(1)).write(anyInt());
        verify(response, never()).flush();
    }
}

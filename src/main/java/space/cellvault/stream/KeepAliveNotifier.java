package space.cellvault.stream;

import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.OutputStream;

/**
 * Keeps a client connection busy while a multipart upload is consolidated by
 * writing a single space to the response for every block copied.
 * <p>
 * Leading whitespace is ignored by XML parsers, so the final response body
 * can still be written to the same stream afterwards.
 */
public class KeepAliveNotifier implements ProgressNotifier {

    private static final Logger LOG = Logger.getLogger(KeepAliveNotifier.class);

    private final OutputStream response;

    private volatile boolean broken;

    public KeepAliveNotifier(OutputStream response) {
        this.response = response;
    }

    @Override
    public void onProgress(Granularity granularity) {
        if (granularity != Granularity.BLOCK || broken) {
            return;
        }
        try {
            response.write(' ');
            response.flush();
        } catch (IOException e) {
            // the consolidation must still complete
            broken = true;
            LOG.warnf("Keep-alive write failed, no further keep-alives will be sent: %s", e.getMessage());
        }
    }

    public boolean isBroken() {
        return broken;
    }
}

package space.cellvault.stream;

import java.nio.ByteBuffer;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Running checksum over a byte stream that is fed piecewise.
 * <p>
 * Updates are serialized so that chunk completions delivered from backend
 * I/O threads cannot interleave inside the underlying {@link MessageDigest}.
 */
public final class IncrementalDigest {

    private final MessageDigest digest;

    private IncrementalDigest(MessageDigest digest) {
        this.digest = digest;
    }

    public static IncrementalDigest md5() {
        return of("MD5");
    }

    /**
     * @throws IllegalArgumentException if the JDK offers no such algorithm
     */
    public static IncrementalDigest of(String algorithm) {
        try {
            return new IncrementalDigest(MessageDigest.getInstance(algorithm));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalArgumentException("Hash algorithm not available: " + algorithm, e);
        }
    }

    public synchronized void update(byte[] bytes, int offset, int length) {
        digest.update(bytes, offset, length);
    }

    /**
     * Folds in the remaining bytes of {@code payload}, leaving its position untouched.
     */
    public synchronized void update(ByteBuffer payload) {
        digest.update(payload.duplicate());
    }

    /**
     * Completes the digest as lower-case hex, always two characters per
     * digest byte. The accumulator is reset afterwards.
     */
    public synchronized String hex() {
        return HexFormat.of().formatHex(digest.digest());
    }

    public String getAlgorithm() {
        return digest.getAlgorithm();
    }
}

package space.cellvault.stream;

/**
 * Callback receiving progress of a multipart consolidation.
 */
@FunctionalInterface
public interface ProgressNotifier {

    ProgressNotifier NONE = granularity -> {
    };

    enum Granularity {
        BLOCK,
        CHUNK
    }

    void onProgress(Granularity granularity);
}

package in.hostsnap.snapshot.change;

/**
 * Configurable choice of change detector.
 */
public enum ChangeDetectionMode {
    MULTISET(MultisetChangeDetector.INSTANCE),
    CONTENT_HASH(ContentHashChangeDetector.INSTANCE);

    private final ChangeDetector detector;

    ChangeDetectionMode(ChangeDetector detector) {
        this.detector = detector;
    }

    public ChangeDetector detector() {
        return detector;
    }
}

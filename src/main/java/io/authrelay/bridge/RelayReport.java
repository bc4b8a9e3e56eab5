package io.authrelay.bridge;

public record RelayReport(int delivered, int timedOut, int failed) {
    public static final RelayReport EMPTY = new RelayReport(0, 0, 0);

    public RelayReport plus(RelayReport other) {
        return new RelayReport(delivered + other.delivered, timedOut + other.timedOut, failed + other.failed);
    }

    public boolean progressed() {
        return delivered > 0 || timedOut > 0;
    }
}

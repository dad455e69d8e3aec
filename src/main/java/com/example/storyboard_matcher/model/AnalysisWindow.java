package com.example.storyboard_matcher.model;

/**
 * Sub-span of a source video, in absolute source seconds.
 *
 * @param startSeconds inclusive start, {@code >= 0}.
 * @param endSeconds   exclusive end, greater than {@code startSeconds}.
 */
public record AnalysisWindow(double startSeconds, double endSeconds) {

    public AnalysisWindow {
        if (startSeconds < 0) {
            throw new IllegalArgumentException("start_offset_seconds must be >= 0.");
        }
        if (endSeconds <= startSeconds) {
            throw new IllegalArgumentException("end_offset_seconds must be greater than start_offset_seconds.");
        }
    }

    public double span() {
        return endSeconds - startSeconds;
    }

    /**
     * @return true when {@code [start, end]} lies inside this window, allowing {@code tolerance} seconds on both sides.
     */
    public boolean contains(double start, double end, double tolerance) {
        return start >= startSeconds - tolerance && end <= endSeconds + tolerance;
    }
}

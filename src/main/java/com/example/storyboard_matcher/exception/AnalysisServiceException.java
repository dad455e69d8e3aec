package com.example.storyboard_matcher.exception;

public class AnalysisServiceException extends MatcherException {
    private final int statusCode;

    public AnalysisServiceException(String message) {
        this(message, -1, null);
    }

    public AnalysisServiceException(String message, Throwable cause) {
        this(message, -1, cause);
    }

    public AnalysisServiceException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /**
     * @return HTTP status reported by the service, or {@code -1} when the call never got a response.
     */
    public int getStatusCode() {
        return statusCode;
    }

    public boolean isTransient() {
        return statusCode == 429 || statusCode >= 500;
    }
}

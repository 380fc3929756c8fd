package com.gentoro.mistadopt.exception;

/** Retrieving an adoption configuration from the Mist API failed. */
public class FetchException extends ProvisionerException {

  /** Why the fetch failed. */
  public enum Reason {
    /** Network failure, 5xx or rate limiting that outlived the retry budget. */
    UNAVAILABLE(true),
    /** 401/403: the API key is not accepted for this organization. */
    UNAUTHORIZED(false),
    /** 404: unknown organization or site. */
    NOT_FOUND(false),
    /** Any other 4xx. */
    REJECTED(false),
    /** 200 without a usable {@code cmd} payload. */
    INVALID_RESPONSE(false),
    /** The calling thread was interrupted while waiting. */
    INTERRUPTED(false);

    private final boolean retryable;

    Reason(boolean retryable) {
      this.retryable = retryable;
    }

    public boolean isRetryable() {
      return retryable;
    }
  }

  private final Reason reason;
  private final int httpStatus;

  public FetchException(Reason reason, int httpStatus, String message) {
    super(ProvisionerErrorCode.FETCH_ERROR, message);
    this.reason = reason;
    this.httpStatus = httpStatus;
  }

  public FetchException(Reason reason, String message, Throwable cause) {
    super(ProvisionerErrorCode.FETCH_ERROR, message, cause);
    this.reason = reason;
    this.httpStatus = 0;
  }

  public Reason getReason() {
    return reason;
  }

  /** HTTP status of the last response, or 0 when no response was received. */
  public int getHttpStatus() {
    return httpStatus;
  }

  public boolean isRetryable() {
    return reason.isRetryable();
  }
}

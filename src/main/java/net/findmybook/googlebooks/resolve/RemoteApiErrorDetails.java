package net.findmybook.googlebooks.resolve;

import jakarta.annotation.Nullable;

/**
 * Machine-readable part of a remote failure.
 *
 * @param code code from the error envelope
 * @param message message from the error envelope
 * @param reason reason of the first envelope error item, if any
 * @param status canonical status name from the envelope, if any
 * @param httpStatus status line code of the HTTP response that carried the envelope
 */
public record RemoteApiErrorDetails(int code,
                                    String message,
                                    @Nullable String reason,
                                    @Nullable String status,
                                    int httpStatus) {
}

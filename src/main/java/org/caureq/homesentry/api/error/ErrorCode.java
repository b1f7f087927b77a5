package org.caureq.homesentry.api.error;

public enum ErrorCode {
    BAD_REQUEST, WEBHOOK_FAILED, AUTH_REQUIRED, FORBIDDEN, INTERNAL_ERROR
}

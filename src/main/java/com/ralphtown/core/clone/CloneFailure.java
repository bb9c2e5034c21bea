package com.ralphtown.core.clone;

/** Classified reason a clone failed. */
public enum CloneFailure {
    SSH_AUTH_FAILED,
    HTTPS_AUTH_FAILED,
    NETWORK_ERROR,
    OPERATION_FAILED
}

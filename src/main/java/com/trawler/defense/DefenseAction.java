package com.trawler.defense;

public enum DefenseAction {
    /** proxy reported as failed; take the next one */
    ROTATE,
    /** backoff already slept; try the same URL again on the same proxy */
    BACKOFF_RETRY,
    /** give up on this URL */
    ABORT
}

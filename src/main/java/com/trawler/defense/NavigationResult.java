package com.trawler.defense;

public enum NavigationResult {
    COMPLETED,
    TIMED_OUT,
    FAILED
}

package com.trawler.service;

import java.time.Duration;
import java.time.Instant;

/**
 * Counts from the last harvest run, exposed on the admin endpoint.
 */
public record HarvestReport(int sources, int candidates, int working, int selected, Duration elapsed, Instant finishedAt) {
}

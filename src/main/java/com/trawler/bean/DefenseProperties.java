package com.trawler.bean;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "defense")
public class DefenseProperties {
    private String targetDomain = "google.com/maps";
    private int maxRetries = 3;
    private int maxRotations = 3;
    /** Listings scraped through one proxy before rotating; 0 keeps a proxy until it fails */
    private int listingsPerProxy = 1;
    private Duration errorWindow = Duration.ofMinutes(5);
    private String resultsSelector = "div[role='feed']";
    private String challengeSelector = "iframe[src*='recaptcha'], div.recaptcha, div#recaptcha, div#captcha-form";
    private List<String> captchaMarkers = new ArrayList<>(List.of(
            "captcha",
            "unusual traffic",
            "suspicious activity"));
    private List<String> rateLimitMarkers = new ArrayList<>(List.of(
            "rate limit",
            "too many requests",
            "temporarily blocked",
            "access denied"));
    private List<String> noResultsMarkers = new ArrayList<>(List.of(
            "no results found"));
}

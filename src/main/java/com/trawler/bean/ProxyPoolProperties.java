package com.trawler.bean;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "proxy-pool")
public class ProxyPoolProperties {
    private String stateDir = "data";
    private Duration freshness = Duration.ofHours(24);
    private int maxFailures = 3;
    private boolean allowDirectConnection = true;
    private int targetCount = 10;
    private int retainedSnapshots = 5;
    private Duration refreshCheckInterval = Duration.ofMinutes(15);
    private boolean warmOnStartup = true;
}

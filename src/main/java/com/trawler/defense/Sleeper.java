package com.trawler.defense;

import java.time.Duration;

@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration);
}

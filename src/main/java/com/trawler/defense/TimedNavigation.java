package com.trawler.defense;

@FunctionalInterface
public interface TimedNavigation {

    NavigationResult attempt(String url);
}

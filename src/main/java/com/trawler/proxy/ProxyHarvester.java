package com.trawler.proxy;

import java.util.List;

/**
 * Source, test and rank pipeline the pool calls on refresh.
 */
@FunctionalInterface
public interface ProxyHarvester {

    /**
     * @return ranked working proxies, empty when nothing usable was found
     */
    List<ProxyRecord> harvest();
}

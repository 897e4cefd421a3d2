package com.trawler.proxy.source;

import com.trawler.proxy.ProxyCandidate;

import java.util.List;

public interface ProxySource {

    String name();

    /**
     * Never throws: a broken source contributes no candidates.
     */
    List<ProxyCandidate> fetchCandidates();
}

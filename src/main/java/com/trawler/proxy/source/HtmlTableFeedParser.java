package com.trawler.proxy.source;

import com.trawler.proxy.ProxyCandidate;
import com.trawler.util.AddressUtil;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Positional parser for the free-proxy-list.net family of HTML tables
 * (IP, port, code, country, anonymity, google, https, last checked).
 */
@Component
@Slf4j
public class HtmlTableFeedParser implements ProxyFeedParser {

    private static final int MIN_COLUMNS = 8;
    private static final int COL_IP = 0;
    private static final int COL_PORT = 1;
    private static final int COL_COUNTRY = 2;
    private static final int COL_HTTPS = 6;

    @Override
    public FeedKind kind() {
        return FeedKind.HTML_TABLE;
    }

    @Override
    public List<ProxyCandidate> parse(String raw, String sourceUrl) {
        if (raw == null || raw.isBlank()) {
            return List.of();
        }

        Document document = Jsoup.parse(raw);
        Element table = findProxyTable(document);
        if (table == null) {
            log.warn("No proxy table found at {}", sourceUrl);
            return List.of();
        }

        List<ProxyCandidate> candidates = new ArrayList<>();
        int skipped = 0;
        for (Element row : table.select("tbody tr")) {
            Elements cols = row.select("td");
            if (cols.size() < MIN_COLUMNS) {
                skipped++;
                continue;
            }

            String ip = cols.get(COL_IP).text().trim();
            int port = AddressUtil.parsePort(cols.get(COL_PORT).text());
            if (!AddressUtil.isIpv4(ip) || port < 0) {
                skipped++;
                continue;
            }

            boolean https = "yes".equalsIgnoreCase(cols.get(COL_HTTPS).text().trim());
            candidates.add(new ProxyCandidate(ip, port, https, sourceUrl, cols.get(COL_COUNTRY).text()));
        }

        if (candidates.isEmpty() && skipped > 0) {
            log.warn("Proxy table at {} has an unexpected layout ({} rows skipped)", sourceUrl, skipped);
        }
        return candidates;
    }

    private Element findProxyTable(Document document) {
        Element table = document.selectFirst("table#proxylisttable");
        if (table == null) {
            table = document.selectFirst("table.table");
        }
        if (table == null) {
            table = document.selectFirst("table");
        }
        return table;
    }
}

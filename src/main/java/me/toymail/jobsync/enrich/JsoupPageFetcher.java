package me.toymail.jobsync.enrich;

import me.toymail.jobsync.store.EngineConfig;
import org.jsoup.Connection;
import org.jsoup.Jsoup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.MalformedURLException;
import java.net.SocketTimeoutException;
import java.net.URL;

/**
 * HTTP GET through jsoup. Redirects are followed by hand so the chain length can be capped.
 */
public final class JsoupPageFetcher implements PageFetcher {
    private static final Logger log = LoggerFactory.getLogger(JsoupPageFetcher.class);

    private final EngineConfig.Enrichment cfg;

    public JsoupPageFetcher(EngineConfig.Enrichment cfg) {
        this.cfg = cfg;
    }

    @Override
    public FetchedPage fetch(String url) throws EnrichmentFetchException {
        String target = LinkedInUrls.fetchUrl(url);
        int redirects = 0;
        while (true) {
            Connection.Response res = execute(target);
            int status = res.statusCode();
            if (status >= 300 && status < 400) {
                String location = res.header("Location");
                if (location == null || location.isBlank()) {
                    throw new EnrichmentFetchException("Redirect without Location from " + target);
                }
                if (++redirects > cfg.maxRedirects) {
                    throw new EnrichmentFetchException("Too many redirects (> " + cfg.maxRedirects + ") for " + url);
                }
                target = resolve(target, location);
                log.debug("Following redirect {} to {}", redirects, target);
                continue;
            }
            if (status == 429) {
                throw new EnrichmentFetchException("Rate limited (HTTP 429) by " + host(target));
            }
            if (status < 200 || status >= 300) {
                throw new EnrichmentFetchException("HTTP " + status + " from " + target);
            }
            return new FetchedPage(url, target, status, res.body());
        }
    }

    private Connection.Response execute(String target) throws EnrichmentFetchException {
        try {
            Connection conn = Jsoup.connect(target)
                    .userAgent(cfg.userAgent)
                    .header("Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8")
                    .header("Accept-Language", "en-US,en;q=0.9")
                    .timeout(cfg.requestTimeoutMs)
                    .followRedirects(false)
                    .ignoreHttpErrors(true);
            if (LinkedInUrls.isLinkedIn(target)) conn.referrer("https://www.linkedin.com/jobs/");
            return conn.execute();
        } catch (SocketTimeoutException e) {
            throw new EnrichmentFetchException("Timed out after " + cfg.requestTimeoutMs + " ms: " + target, e);
        } catch (IOException | IllegalArgumentException e) {
            throw new EnrichmentFetchException("Cannot fetch " + target + ": " + e.getMessage(), e);
        }
    }

    static String resolve(String base, String location) throws EnrichmentFetchException {
        try {
            return new URL(new URL(base), location).toString();
        } catch (MalformedURLException e) {
            throw new EnrichmentFetchException("Bad redirect target " + location, e);
        }
    }

    private static String host(String url) {
        try {
            return new URL(url).getHost();
        } catch (MalformedURLException e) {
            return url;
        }
    }
}

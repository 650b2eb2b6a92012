package io.osquerymcp.spring;

import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Rejects requests whose Host header is not in {@code osquery.allowed-hosts}.
 *
 * <p>Patterns are exact host names, {@code *} (anything) or {@code *.example.com}
 * (any subdomain). Ports are ignored.
 */
public class TrustedHostFilter implements Filter {

    private static final Logger log = LoggerFactory.getLogger(TrustedHostFilter.class);

    private final List<String> allowedHosts;

    public TrustedHostFilter(List<String> allowedHosts) {
        this.allowedHosts = allowedHosts.stream()
            .map(h -> h.trim().toLowerCase(Locale.ROOT))
            .filter(h -> !h.isEmpty())
            .collect(Collectors.toList());
    }

    @Override
    public void doFilter(ServletRequest request, ServletResponse response,
                         FilterChain chain) throws IOException, ServletException {
        HttpServletRequest httpRequest = (HttpServletRequest) request;
        String host = hostOf(httpRequest.getHeader("Host"));

        if (!isAllowed(host)) {
            log.warn("Rejected request with untrusted Host header: {}", host);
            ((HttpServletResponse) response).sendError(HttpServletResponse.SC_BAD_REQUEST, "Invalid host header");
            return;
        }
        chain.doFilter(request, response);
    }

    boolean isAllowed(String host) {
        if (allowedHosts.isEmpty() || allowedHosts.contains("*")) {
            return true;
        }
        if (host == null) {
            return false;
        }
        for (String pattern : allowedHosts) {
            if (pattern.startsWith("*.") ? host.endsWith(pattern.substring(1)) : pattern.equals(host)) {
                return true;
            }
        }
        return false;
    }

    static String hostOf(String header) {
        if (header == null || header.isBlank()) {
            return null;
        }
        String host = header.trim().toLowerCase(Locale.ROOT);
        if (host.startsWith("[")) {
            int end = host.indexOf(']');
            return end > 0 ? host.substring(0, end + 1) : host;
        }
        int colon = host.indexOf(':');
        return colon >= 0 ? host.substring(0, colon) : host;
    }
}

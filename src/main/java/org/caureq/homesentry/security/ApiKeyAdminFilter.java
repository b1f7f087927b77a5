package org.caureq.homesentry.security;

import jakarta.servlet.*;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.caureq.homesentry.api.error.ErrorCode;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.List;

/** Admin routes: X-ADMIN-API-KEY plus a client IP allow-list (exact IPv4 or CIDR, "*" for any). */
@Slf4j
@Component
public class ApiKeyAdminFilter implements Filter {
    private final String adminKey;
    private final List<String> cidrs;

    public ApiKeyAdminFilter(Environment env) {
        this.adminKey = env.getProperty("homesentry.admin.api-key", "");
        var raw = env.getProperty("homesentry.admin.allow-ips", "127.0.0.1");
        this.cidrs = List.of(raw.trim().split("\\s*,\\s*"));
        if (adminKey.isBlank()) log.warn("[Admin] no admin API key configured - admin routes are locked");
    }

    @Override
    public void doFilter(ServletRequest req, ServletResponse res, FilterChain chain)
            throws IOException, ServletException {
        var r = (HttpServletRequest) req;
        var w = (HttpServletResponse) res;

        if (!r.getRequestURI().startsWith("/api/admin/")) { chain.doFilter(req, res); return; }

        String k = r.getHeader("X-ADMIN-API-KEY");
        if (adminKey.isBlank() || k == null || !k.equals(adminKey)) {
            ErrorResponses.write(r, w, HttpServletResponse.SC_UNAUTHORIZED,
                    ErrorCode.AUTH_REQUIRED, "Missing/invalid admin key");
            return;
        }

        String ip = r.getRemoteAddr();
        if ("0:0:0:0:0:0:0:1".equals(ip) || "::1".equals(ip)) ip = "127.0.0.1";

        if (!isAllowed(ip)) {
            ErrorResponses.write(r, w, HttpServletResponse.SC_FORBIDDEN,
                    ErrorCode.FORBIDDEN, "IP not allowed: " + ip);
            return;
        }

        chain.doFilter(req, res);
    }

    boolean isAllowed(String ip) {
        for (var rule : cidrs) {
            if (rule.equals("*")) return true;
            if (!rule.contains("/")) {
                if (rule.equals(ip)) return true;
            } else if (matchesCidr(ip, rule)) {
                return true;
            }
        }
        return false;
    }

    // IPv4 only
    private static boolean matchesCidr(String ip, String cidr) {
        try {
            String[] parts = cidr.split("/");
            int prefix = Integer.parseInt(parts[1]);
            byte[] addr = InetAddress.getByName(ip).getAddress();
            byte[] net = InetAddress.getByName(parts[0]).getAddress();
            if (addr.length != 4 || net.length != 4 || prefix < 0 || prefix > 32) return false;

            int mask = prefix == 0 ? 0 : 0xffffffff << (32 - prefix);
            return (toInt(addr) & mask) == (toInt(net) & mask);
        } catch (NumberFormatException | UnknownHostException | ArrayIndexOutOfBoundsException e) {
            log.debug("[Admin] ignoring malformed allow-list rule {}: {}", cidr, e.toString());
            return false;
        }
    }

    private static int toInt(byte[] b) {
        return ((b[0] & 0xff) << 24) | ((b[1] & 0xff) << 16) | ((b[2] & 0xff) << 8) | (b[3] & 0xff);
    }
}

package com.flavorsnap.backend.common.web;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Echoes (or generates) {@code X-Request-Id} and exposes it, plus the caller-supplied
 * {@code X-Actor-Id}, to the log pattern through the MDC.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestIdFilter extends OncePerRequestFilter {

    public static final String HEADER = "X-Request-Id";
    public static final String ACTOR_HEADER = "X-Actor-Id";
    public static final String ATTR = "requestId";
    public static final String MDC_KEY = "rid";
    public static final String MDC_ACTOR = "actor";

    // header 直接進 log，先擋掉換行/控制字元
    private static final Pattern SAFE = Pattern.compile("[A-Za-z0-9._:@-]{1,128}");

    @Override
    protected void doFilterInternal(HttpServletRequest req, HttpServletResponse res, FilterChain chain)
            throws ServletException, IOException {

        String rid = req.getHeader(HEADER);
        if (rid == null || !SAFE.matcher(rid).matches()) rid = UUID.randomUUID().toString();

        req.setAttribute(ATTR, rid);
        MDC.put(MDC_KEY, rid);

        String actor = req.getHeader(ACTOR_HEADER);
        if (actor != null && SAFE.matcher(actor).matches()) MDC.put(MDC_ACTOR, actor);

        // ✅ 成功/失敗都會帶回去
        res.setHeader(HEADER, rid);

        try {
            chain.doFilter(req, res);
        } finally {
            MDC.remove(MDC_KEY);
            MDC.remove(MDC_ACTOR);
        }
    }

    public static String getOrCreate(HttpServletRequest req) {
        Object v = req.getAttribute(ATTR);
        return (v == null) ? UUID.randomUUID().toString() : String.valueOf(v);
    }
}

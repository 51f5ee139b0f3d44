package com.sessionhub.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.util.AntPathMatcher;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;

/**
 * HTTP 链路日志过滤器：透传或生成 traceId / requestId，写入 MDC 并输出 HTTP_IN / HTTP_OUT。
 * 针对单个会话的请求额外写入 MDC sessionId，与生命周期日志对齐。
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class RequestTraceLoggingFilter extends OncePerRequestFilter {

    static final String HEADER_TRACE_ID = "X-Trace-Id";
    static final String HEADER_REQUEST_ID = "X-Request-Id";
    private static final String MDC_TRACE_ID = "traceId";
    private static final String MDC_REQUEST_ID = "requestId";
    private static final String MDC_SESSION_ID = "sessionId";
    private static final String SESSION_PATH_PATTERN = "/api/sessions/{sessionId}";

    private final ObservabilityHttpLogProperties properties;
    private final AntPathMatcher pathMatcher = new AntPathMatcher();

    public RequestTraceLoggingFilter(ObservabilityHttpLogProperties properties) {
        this.properties = properties;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        if (!properties.isEnabled()) {
            return true;
        }
        String path = normalizePath(request.getRequestURI());
        if (matchesAny(path, properties.getExcludePathPatterns())) {
            return true;
        }
        List<String> includePatterns = properties.getIncludePathPatterns();
        return includePatterns != null && !includePatterns.isEmpty() && !matchesAny(path, includePatterns);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        String traceId = resolveOrCreate(request.getHeader(HEADER_TRACE_ID));
        String requestId = resolveOrCreate(request.getHeader(HEADER_REQUEST_ID));
        String method = request.getMethod();
        String path = normalizePath(request.getRequestURI());

        response.setHeader(HEADER_TRACE_ID, traceId);
        response.setHeader(HEADER_REQUEST_ID, requestId);
        MDC.put(MDC_TRACE_ID, traceId);
        MDC.put(MDC_REQUEST_ID, requestId);
        String sessionId = resolveSessionId(path);
        if (sessionId != null) {
            MDC.put(MDC_SESSION_ID, sessionId);
        }

        boolean sampled = shouldSample();
        long startNs = System.nanoTime();
        if (sampled) {
            log.info("HTTP_IN method={}, path={}, sessionId={}, query={}, clientIp={}",
                    method, path, StringUtils.defaultString(sessionId, "-"),
                    StringUtils.defaultIfBlank(request.getQueryString(), "-"), resolveClientIp(request));
        }

        Exception error = null;
        try {
            filterChain.doFilter(request, response);
        } catch (ServletException | IOException | RuntimeException ex) {
            error = ex;
            throw ex;
        } finally {
            long costMs = (System.nanoTime() - startNs) / 1_000_000L;
            boolean slow = costMs >= Math.max(properties.getSlowRequestThresholdMs(), 0L);
            if (error != null) {
                log.warn("HTTP_OUT method={}, path={}, status={}, costMs={}, outcome=error, errorType={}, errorMessage={}",
                        method, path, response.getStatus(), costMs,
                        error.getClass().getSimpleName(), StringUtils.abbreviate(error.getMessage(), 200));
            } else if (sampled || slow) {
                log.info("HTTP_OUT method={}, path={}, status={}, costMs={}, outcome=success, slow={}",
                        method, path, response.getStatus(), costMs, slow);
            }
            MDC.remove(MDC_SESSION_ID);
            MDC.remove(MDC_REQUEST_ID);
            MDC.remove(MDC_TRACE_ID);
        }
    }

    /**
     * /api/sessions/validate 是批量接口，不视为会话路径。
     */
    private String resolveSessionId(String path) {
        if (!pathMatcher.match(SESSION_PATH_PATTERN, path)) {
            return null;
        }
        String sessionId = pathMatcher.extractUriTemplateVariables(SESSION_PATH_PATTERN, path).get(MDC_SESSION_ID);
        return "validate".equals(sessionId) ? null : sessionId;
    }

    private String resolveOrCreate(String value) {
        if (StringUtils.isNotBlank(value)) {
            return value.trim();
        }
        return UUID.randomUUID().toString().replace("-", "");
    }

    private boolean shouldSample() {
        double rate = properties.getSampleRate();
        if (rate <= 0D) {
            return false;
        }
        return rate >= 1D || ThreadLocalRandom.current().nextDouble() <= rate;
    }

    private String resolveClientIp(HttpServletRequest request) {
        String forwarded = request.getHeader("X-Forwarded-For");
        if (StringUtils.isNotBlank(forwarded)) {
            return StringUtils.substringBefore(forwarded, ",").trim();
        }
        return StringUtils.defaultIfBlank(request.getRemoteAddr(), "unknown");
    }

    private boolean matchesAny(String path, List<String> patterns) {
        if (patterns == null) {
            return false;
        }
        for (String pattern : patterns) {
            if (StringUtils.isNotBlank(pattern) && pathMatcher.match(pattern.trim(), path)) {
                return true;
            }
        }
        return false;
    }

    private String normalizePath(String path) {
        return StringUtils.defaultIfBlank(path, "/").trim();
    }
}

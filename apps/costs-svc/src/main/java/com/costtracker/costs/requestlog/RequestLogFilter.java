package com.costtracker.costs.requestlog;

import com.costtracker.costs.config.CostsProperties;
import com.costtracker.costs.model.RequestLogRecord;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Records every completed request locally and, when enabled, ships it to the remote logs
 * endpoint.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class RequestLogFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(RequestLogFilter.class);

    private final RequestLogService requestLogService;
    private final LogShipper logShipper;
    private final String serviceName;
    private final Clock clock;

    public RequestLogFilter(RequestLogService requestLogService, LogShipper logShipper, CostsProperties properties, Clock clock) {
        this.requestLogService = requestLogService;
        this.logShipper = logShipper;
        this.serviceName = properties.serviceName();
        this.clock = clock;
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain
    ) throws ServletException, IOException {
        long start = System.nanoTime();
        try {
            filterChain.doFilter(request, response);
        } finally {
            long elapsedMs = (System.nanoTime() - start) / 1_000_000;
            RequestLogRecord record = RequestLogRecord.request(
                    clock.instant(),
                    serviceName,
                    request.getMethod(),
                    request.getRequestURI(),
                    response.getStatus(),
                    elapsedMs);
            requestLogService.recordOwn(record);
            if (logShipper.enabled()) {
                logShipper.ship(record).subscribe(result -> log.debug("Request log shipping: {}", result));
            }
        }
    }
}

package com.attendance.tracker.web;

import com.attendance.tracker.common.exception.UnauthorizedException;
import com.attendance.tracker.config.AttendanceProperties;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Lets a request through only when its admin header carries the configured administrator id.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AdminIdentityInterceptor implements HandlerInterceptor {

    public static final String ADMIN_HEADER = "X-Admin-Id";

    private final AttendanceProperties props;

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        String expected = props.getAdmin().getId();
        if (!StringUtils.hasText(expected)) {
            log.warn("attendance.admin.id is not configured; rejecting {} {}", request.getMethod(), request.getRequestURI());
            throw new UnauthorizedException("Unauthorized access");
        }
        String presented = request.getHeader(ADMIN_HEADER);
        if (!expected.equals(presented == null ? null : presented.trim())) {
            log.warn("Unauthorized {} {} (admin header: {})", request.getMethod(), request.getRequestURI(),
                    presented == null ? "missing" : "mismatch");
            throw new UnauthorizedException("Unauthorized access");
        }
        return true;
    }
}

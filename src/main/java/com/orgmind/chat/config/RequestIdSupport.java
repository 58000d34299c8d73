package com.orgmind.chat.config;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

import java.util.UUID;

public final class RequestIdSupport {

    public static final String HEADER_REQUEST_ID = "X-Request-Id";
    /** request attribute 与 MDC 共用的键 */
    public static final String ATTR_REQUEST_ID = "requestId";

    private RequestIdSupport() {
    }

    public static String newRequestId() {
        return "req_" + UUID.randomUUID().toString().replace("-", "").substring(0, 16);
    }

    public static String resolve(HttpServletRequest request) {
        if (request == null) {
            return newRequestId();
        }
        if (request.getAttribute(ATTR_REQUEST_ID) instanceof String value && !value.isBlank()) {
            return value;
        }
        String header = request.getHeader(HEADER_REQUEST_ID);
        String requestId = (header != null && !header.isBlank()) ? header : newRequestId();
        request.setAttribute(ATTR_REQUEST_ID, requestId);
        return requestId;
    }

    /** 从当前线程绑定的请求解析；不在请求线程上时生成新ID */
    public static String resolveCurrent() {
        if (RequestContextHolder.getRequestAttributes() instanceof ServletRequestAttributes attributes) {
            return resolve(attributes.getRequest());
        }
        return newRequestId();
    }
}

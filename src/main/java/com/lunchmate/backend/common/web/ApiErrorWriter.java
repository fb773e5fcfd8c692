package com.lunchmate.backend.common.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The one error body shape: {code, message, requestId}. Used by the controller advice and by the
 * security filters, which answer before any controller runs.
 */
@Component
@RequiredArgsConstructor
public class ApiErrorWriter {

    private final ObjectMapper om;

    public static Map<String, Object> body(String code, String message, HttpServletRequest req) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("code", code);
        if (message != null && !message.isBlank()) m.put("message", message);
        String rid = RequestIdFilter.current(req);
        if (rid != null) m.put("requestId", rid);
        return m;
    }

    public void write(HttpServletRequest req, HttpServletResponse res,
                      HttpStatus status, String code, String message) throws IOException {
        res.setStatus(status.value());
        res.setContentType(MediaType.APPLICATION_JSON_VALUE);
        res.setCharacterEncoding(StandardCharsets.UTF_8.name());
        om.writeValue(res.getWriter(), body(code, message, req));
    }
}

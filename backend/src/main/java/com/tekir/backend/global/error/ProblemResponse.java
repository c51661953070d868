package com.tekir.backend.global.error;

import com.tekir.backend.global.web.RequestIdFilter;

import org.slf4j.MDC;
import org.springframework.http.HttpStatus;

/**
 * RFC 7807 style body. {@code requestId} repeats the X-Request-Id header so a client report can be matched to logs.
 */
public record ProblemResponse(
        String type,
        String title,
        int status,
        String detail,
        String instance,
        String code,
        String requestId
) {

    private static final String TYPE_PREFIX = "https://tekir.co/errors/";

    public static ProblemResponse of(HttpStatus httpStatus, String code, String detail, String instance) {
        String safeCode = (code != null && !code.isBlank()) ? code : httpStatus.name();
        String slug = safeCode.toLowerCase().replace('_', '-').replaceAll("[^a-z0-9\\-.]+", "-");
        String safeDetail = (detail != null && !detail.isBlank()) ? detail : httpStatus.getReasonPhrase();
        return new ProblemResponse(TYPE_PREFIX + slug, httpStatus.getReasonPhrase(), httpStatus.value(),
                safeDetail, instance, safeCode, MDC.get(RequestIdFilter.REQUEST_ID_MDC_KEY));
    }
}

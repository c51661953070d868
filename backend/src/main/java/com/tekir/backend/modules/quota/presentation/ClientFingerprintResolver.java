package com.tekir.backend.modules.quota.presentation;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.util.WebUtils;

/**
 * Extracts the caller's origin hash, device id and session token from an HTTP request.
 * The raw address is never stored.
 */
@Component
public class ClientFingerprintResolver {

    public static final String DEVICE_ID_HEADER = "X-Device-Id";
    public static final String SESSION_TOKEN_HEADER = "X-Session-Token";
    private static final String FORWARDED_FOR_HEADER = "X-Forwarded-For";
    private static final String REAL_IP_HEADER = "X-Real-IP";

    private final String ipSalt;
    private final String cookieName;

    public ClientFingerprintResolver(
            @Value("${tekir.session.ip-salt:}") String ipSalt,
            @Value("${tekir.session.cookie-name:session-token}") String cookieName
    ) {
        this.ipSalt = ipSalt == null ? "" : ipSalt;
        this.cookieName = cookieName;
    }

    public ClientFingerprint resolve(HttpServletRequest request) {
        String ip = clientIp(request);
        String hashedIp = ip == null ? null : hash(ip);
        String deviceId = request.getHeader(DEVICE_ID_HEADER);
        return new ClientFingerprint(hashedIp, StringUtils.hasText(deviceId) ? deviceId.trim() : null);
    }

    /**
     * Cookie first, then the {@value #SESSION_TOKEN_HEADER} header for non-browser clients.
     */
    public String sessionToken(HttpServletRequest request) {
        Cookie cookie = WebUtils.getCookie(request, cookieName);
        if (cookie != null && StringUtils.hasText(cookie.getValue())) {
            return cookie.getValue().trim();
        }
        String header = request.getHeader(SESSION_TOKEN_HEADER);
        return StringUtils.hasText(header) ? header.trim() : null;
    }

    String clientIp(HttpServletRequest request) {
        String forwarded = request.getHeader(FORWARDED_FOR_HEADER);
        if (StringUtils.hasText(forwarded)) {
            String first = forwarded.split(",")[0].trim();
            if (!first.isEmpty()) {
                return first;
            }
        }
        String realIp = request.getHeader(REAL_IP_HEADER);
        if (StringUtils.hasText(realIp)) {
            return realIp.trim();
        }
        String remote = request.getRemoteAddr();
        return StringUtils.hasText(remote) ? remote : null;
    }

    String hash(String ip) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hashed = digest.digest((ip + ipSalt).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hashed);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}

package com.tekir.backend.modules.quota.presentation;

import static org.assertj.core.api.Assertions.assertThat;

import jakarta.servlet.http.Cookie;

import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;

class ClientFingerprintResolverTest {

    private final ClientFingerprintResolver resolver = new ClientFingerprintResolver("pepper", "session-token");

    @Test
    void firstForwardedHopWins() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.addHeader("X-Forwarded-For", " 203.0.113.7 , 10.0.0.1");
        request.addHeader("X-Real-IP", "198.51.100.2");
        request.setRemoteAddr("127.0.0.1");

        assertThat(resolver.clientIp(request)).isEqualTo("203.0.113.7");
    }

    @Test
    void fallsBackToRealIpThenRemoteAddress() {
        MockHttpServletRequest withRealIp = new MockHttpServletRequest();
        withRealIp.addHeader("X-Real-IP", "198.51.100.2");
        withRealIp.setRemoteAddr("127.0.0.1");
        assertThat(resolver.clientIp(withRealIp)).isEqualTo("198.51.100.2");

        MockHttpServletRequest bare = new MockHttpServletRequest();
        bare.setRemoteAddr("192.0.2.10");
        assertThat(resolver.clientIp(bare)).isEqualTo("192.0.2.10");
    }

    @Test
    void hashIsStableHexAndDependsOnSalt() {
        String hashed = resolver.hash("203.0.113.7");

        assertThat(hashed).hasSize(64).matches("[0-9a-f]+");
        assertThat(resolver.hash("203.0.113.7")).isEqualTo(hashed);
        assertThat(new ClientFingerprintResolver("", "session-token").hash("203.0.113.7")).isNotEqualTo(hashed);
    }

    @Test
    void resolvesDeviceIdAndNeverExposesRawAddress() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.setRemoteAddr("192.0.2.10");
        request.addHeader("X-Device-Id", "  ios-abc  ");

        ClientFingerprint fingerprint = resolver.resolve(request);

        assertThat(fingerprint.deviceId()).isEqualTo("ios-abc");
        assertThat(fingerprint.hashedIp()).isNotEqualTo("192.0.2.10").hasSize(64);
    }

    @Test
    void cookieTokenTakesPrecedenceOverHeader() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.setCookies(new Cookie("session-token", "from-cookie"));
        request.addHeader("X-Session-Token", "from-header");
        assertThat(resolver.sessionToken(request)).isEqualTo("from-cookie");

        MockHttpServletRequest headerOnly = new MockHttpServletRequest();
        headerOnly.addHeader("X-Session-Token", "from-header");
        assertThat(resolver.sessionToken(headerOnly)).isEqualTo("from-header");

        assertThat(resolver.sessionToken(new MockHttpServletRequest())).isNull();
    }
}

package com.sunny.procurehub.platform.security;

import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.sunny.procurehub.platform.config.PlatformSecurityProperties;
import com.sunny.procurehub.platform.exception.auth.CsrfInvalidException;
import jakarta.servlet.http.Cookie;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class CsrfInterceptorTest {

    private CsrfInterceptor interceptor;

    @BeforeEach
    void setUp() {
        PlatformSecurityProperties properties = new PlatformSecurityProperties();
        interceptor = new CsrfInterceptor(properties, new PlatformCookieManager(properties));
    }

    @Test
    void preHandle_shouldAllowSafeMethods() {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/approvals/mine");
        request.setCookies(new Cookie("ph_session", "session-token"));

        assertTrue(interceptor.preHandle(request, new MockHttpServletResponse(), new Object()));
    }

    @Test
    void preHandle_shouldSkipWhitelistedAuthPaths() {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/auth/logout");
        request.setCookies(new Cookie("ph_session", "session-token"));

        assertTrue(interceptor.preHandle(request, new MockHttpServletResponse(), new Object()));
    }

    @Test
    void preHandle_shouldRejectMissingHeaderWhenSessionPresent() {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/approvals/9/approve");
        request.setCookies(new Cookie("ph_session", "session-token"), new Cookie("ph_csrf", "csrf-token"));

        assertThrows(CsrfInvalidException.class,
                () -> interceptor.preHandle(request, new MockHttpServletResponse(), new Object()));
    }

    @Test
    void preHandle_shouldRejectMismatchedHeader() {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/invites");
        request.setCookies(new Cookie("ph_session", "session-token"), new Cookie("ph_csrf", "csrf-token"));
        request.addHeader("X-CSRF-Token", "other-token");

        assertThrows(CsrfInvalidException.class,
                () -> interceptor.preHandle(request, new MockHttpServletResponse(), new Object()));
    }

    @Test
    void preHandle_shouldAcceptMatchingDoubleSubmit() {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/invites");
        request.setCookies(new Cookie("ph_session", "session-token"), new Cookie("ph_csrf", "csrf-token"));
        request.addHeader("X-CSRF-Token", "csrf-token");

        assertTrue(interceptor.preHandle(request, new MockHttpServletResponse(), new Object()));
    }

    @Test
    void preHandle_shouldLeaveAnonymousWritesToSessionCheck() {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/approvals");

        assertTrue(interceptor.preHandle(request, new MockHttpServletResponse(), new Object()));
    }
}

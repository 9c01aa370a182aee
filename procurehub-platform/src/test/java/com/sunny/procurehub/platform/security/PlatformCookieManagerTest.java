package com.sunny.procurehub.platform.security;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.sunny.procurehub.platform.config.PlatformSecurityProperties;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.mock.web.MockHttpServletResponse;

class PlatformCookieManagerTest {

    @Test
    void setSessionCookies_shouldMarkCookiesSecureByDefault() {
        MockHttpServletResponse response = new MockHttpServletResponse();

        new PlatformCookieManager(new PlatformSecurityProperties()).setSessionCookies(response, "session-token", "csrf");

        List<String> cookies = response.getHeaders(HttpHeaders.SET_COOKIE);
        assertEquals(2, cookies.size());
        assertTrue(cookies.get(0).startsWith("ph_session=session-token"));
        assertTrue(cookies.get(0).contains("Secure"));
        assertTrue(cookies.get(0).contains("HttpOnly"));
        assertTrue(cookies.get(1).contains("Secure"));
        assertFalse(cookies.get(1).contains("HttpOnly"));
    }

    @Test
    void setVisitorCookie_shouldOmitSecureWhenDisabledForLocalDevelopment() {
        PlatformSecurityProperties properties = new PlatformSecurityProperties();
        properties.getCookie().setSecure(false);
        MockHttpServletResponse response = new MockHttpServletResponse();

        new PlatformCookieManager(properties).setVisitorCookie(response, "v1.payload.signature");

        String cookie = response.getHeader(HttpHeaders.SET_COOKIE);
        assertTrue(cookie.startsWith("ph_visitor=v1.payload.signature"));
        assertFalse(cookie.contains("Secure"));
        assertTrue(cookie.contains("SameSite=Lax"));
    }
}

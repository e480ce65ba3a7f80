package com.bookstay.common.security;

import jakarta.servlet.http.Cookie;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;

import static org.assertj.core.api.Assertions.assertThat;

class BearerTokenResolverTest {

    @Test
    @DisplayName("쿠키 > 요청 속성 > 헤더 순으로 우선")
    void resolve_CookieWinsOverAttributeAndHeader() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.setCookies(new Cookie("Authentication", "from-cookie"));
        request.setAttribute("Authentication", "from-attribute");
        request.addHeader("Authentication", "from-header");

        assertThat(BearerTokenResolver.resolve(request)).contains("from-cookie");
    }

    @Test
    @DisplayName("쿠키가 없으면 요청 속성")
    void resolve_AttributeWinsOverHeader() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.setAttribute("Authentication", "from-attribute");
        request.addHeader("Authentication", "from-header");

        assertThat(BearerTokenResolver.resolve(request)).contains("from-attribute");
    }

    @Test
    @DisplayName("빈 쿠키 값은 건너뛰고 헤더로 넘어감")
    void resolve_BlankCookie_FallsBackToHeader() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.setCookies(new Cookie("Authentication", ""), new Cookie("other", "x"));
        request.addHeader("Authentication", "from-header");

        assertThat(BearerTokenResolver.resolve(request)).contains("from-header");
    }

    @Test
    @DisplayName("세 위치 모두 없으면 empty")
    void resolve_NoCredential_Empty() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.addHeader("Authorization", "Bearer something");

        assertThat(BearerTokenResolver.resolve(request)).isEmpty();
    }
}

package dev.phonebook.contactsservice.security;

import static org.junit.jupiter.api.Assertions.*;

import dev.phonebook.contactsservice.config.BanProperties;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class RequestBanFilterTest {

    private final RequestBanFilter filter = new RequestBanFilter(
        new BanProperties(List.of("192.168.1.1"), List.of("Googlebot", "Python-urllib")));

    @Test
    void bannedAddress_isForbidden() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/");
        request.setRemoteAddr("192.168.1.1");
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request, response, chain);

        assertEquals(403, response.getStatus());
        assertEquals("{\"detail\":\"You are banned\"}", response.getContentAsString());
        assertNull(chain.getRequest());
    }

    @Test
    void bannedUserAgent_isForbidden() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/");
        request.addHeader("User-Agent", "Mozilla/5.0 (compatible; Googlebot/2.1)");
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(request, response, new MockFilterChain());

        assertEquals(403, response.getStatus());
    }

    @Test
    void regularClient_passes() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/");
        request.addHeader("User-Agent", "curl/8.0");
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request, response, chain);

        assertEquals(200, response.getStatus());
        assertNotNull(chain.getRequest());
    }

    @Test
    void missingUserAgent_passes() throws Exception {
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(new MockHttpServletRequest("GET", "/"), new MockHttpServletResponse(), chain);

        assertNotNull(chain.getRequest());
    }
}

package org.example.kbsync.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.core.context.SecurityContextHolder;

import static org.assertj.core.api.Assertions.assertThat;

class SyncApiKeyFilterTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @AfterEach
    void clearContext() {
        SecurityContextHolder.clearContext();
    }

    @Test
    void syncEndpointsAreUnavailableWithoutConfiguredKey() throws Exception {
        SyncApiKeyFilter filter = new SyncApiKeyFilter(new SyncProperties(), objectMapper);
        MockHttpServletRequest request = syncRequest("anything");
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request, response, chain);

        assertThat(response.getStatus()).isEqualTo(503);
        assertThat(objectMapper.readTree(response.getContentAsString()).path("code").asInt()).isEqualTo(503);
        assertThat(chain.getRequest()).isNull();
    }

    @Test
    void matchingKeyPassesWithSyncAuthority() throws Exception {
        SyncApiKeyFilter filter = new SyncApiKeyFilter(properties("secret"), objectMapper);
        MockHttpServletResponse response = new MockHttpServletResponse();
        boolean[] authorized = {false};

        filter.doFilter(syncRequest("secret"), response, (req, res) ->
                authorized[0] = SecurityContextHolder.getContext().getAuthentication().getAuthorities().stream()
                        .anyMatch(a -> SyncApiKeyFilter.ROLE_SYNC.equals(a.getAuthority())));

        assertThat(response.getStatus()).isEqualTo(200);
        assertThat(authorized[0]).isTrue();
        assertThat(SecurityContextHolder.getContext().getAuthentication()).isNull();
    }

    @Test
    void keyComparisonIsExact() throws Exception {
        SyncApiKeyFilter filter = new SyncApiKeyFilter(properties("secret"), objectMapper);
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(syncRequest("secret "), response, chain);

        assertThat(response.getStatus()).isEqualTo(403);
        assertThat(chain.getRequest()).isNull();
    }

    @Test
    void otherPathsAreNotFiltered() throws Exception {
        SyncApiKeyFilter filter = new SyncApiKeyFilter(new SyncProperties(), objectMapper);
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/documents/processing/stats");
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request, response, chain);

        assertThat(response.getStatus()).isEqualTo(200);
        assertThat(chain.getRequest()).isSameAs(request);
    }

    private static MockHttpServletRequest syncRequest(String key) {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/sync/status");
        request.addHeader(SyncApiKeyFilter.API_KEY_HEADER, key);
        return request;
    }

    private static SyncProperties properties(String apiKey) {
        SyncProperties properties = new SyncProperties();
        properties.setApiKey(apiKey);
        return properties;
    }
}

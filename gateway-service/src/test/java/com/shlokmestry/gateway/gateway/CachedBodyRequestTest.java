package com.shlokmestry.gateway.gateway;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;

class CachedBodyRequestTest {

    @Test
    void bodyCanBeReadRepeatedly() throws IOException {
        MockHttpServletRequest req = new MockHttpServletRequest("POST", "/api/contact");
        req.setContent("{\"a\":1}".getBytes(StandardCharsets.UTF_8));

        CachedBodyRequest cached = CachedBodyRequest.wrap(req, 64);

        assertThat(new String(cached.body(), StandardCharsets.UTF_8)).isEqualTo("{\"a\":1}");
        assertThat(cached.getInputStream().readAllBytes()).isEqualTo(cached.body());
        assertThat(cached.getReader().readLine()).isEqualTo("{\"a\":1}");
    }

    @Test
    void urlEncodedBodyIsMergedIntoParameters() throws IOException {
        MockHttpServletRequest req = new MockHttpServletRequest("POST", "/api/newsletter");
        req.setContentType("application/x-www-form-urlencoded; charset=UTF-8");
        req.setCharacterEncoding("UTF-8");
        req.addParameter("source", "footer");
        req.setContent("email=ada%40example.com&tag=a&tag=b+c&source=form".getBytes(StandardCharsets.UTF_8));

        CachedBodyRequest cached = CachedBodyRequest.wrap(req, 256);

        assertThat(cached.getParameter("email")).isEqualTo("ada@example.com");
        assertThat(cached.getParameterValues("tag")).containsExactly("a", "b c");
        assertThat(cached.getParameterValues("source")).containsExactly("footer", "form");
        assertThat(Collections.list(cached.getParameterNames())).containsExactly("source", "email", "tag");
        assertThat(cached.getReader().readLine()).startsWith("email=");
    }

    @Test
    void jsonBodyIsNotTreatedAsParameters() throws IOException {
        MockHttpServletRequest req = new MockHttpServletRequest("POST", "/api/contact");
        req.setContentType("application/json");
        req.setContent("a=1".getBytes(StandardCharsets.UTF_8));

        CachedBodyRequest cached = CachedBodyRequest.wrap(req, 64);

        assertThat(cached.getParameter("a")).isNull();
        assertThat(cached.getParameterMap()).isEmpty();
    }

    @Test
    void oversizedBodyIsRejected() {
        MockHttpServletRequest req = new MockHttpServletRequest("POST", "/api/contact");
        req.setContent(new byte[65]);

        assertThatThrownBy(() -> CachedBodyRequest.wrap(req, 64))
                .isInstanceOf(CachedBodyRequest.BodyTooLargeException.class);
    }
}

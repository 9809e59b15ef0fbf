package com.mrdom.copilot.test.infrastructure;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mrdom.copilot.domain.query.model.valobj.ConnectorLookupResult;
import com.mrdom.copilot.domain.query.model.valobj.ConnectorQuery;
import com.mrdom.copilot.infrastructure.connector.ConnectorSettings;
import com.mrdom.copilot.infrastructure.connector.MauticMarketingConnector;
import com.mrdom.copilot.infrastructure.util.JsonCodec;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.test.web.client.RequestMatcher;
import org.springframework.web.client.RestClient;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;

import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.queryParam;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

public class MauticMarketingConnectorTest {

    private static final String EMAIL = "maria@exemplo.com";
    private static final String CONTACTS_URL = "http://mautic.test/api/contacts";
    private static final String CONTACT_BODY = "{\"total\":\"1\",\"contacts\":{\"42\":{\"id\":42,\"points\":120,"
            + "\"lastActive\":\"2026-10-01 10:00:00\",\"tags\":[{\"tag\":\"vip\"},{\"tag\":\"lead-quente\"}],"
            + "\"fields\":{\"core\":{\"email\":{\"value\":\"maria@exemplo.com\"}}}}}}";

    private MockRestServiceServer server;
    private MauticMarketingConnector connector;

    @BeforeEach
    public void setUp() {
        RestClient.Builder builder = RestClient.builder();
        this.server = MockRestServiceServer.bindTo(builder).build();
        this.connector = new MauticMarketingConnector(builder,
                new ConnectorSettings("http://mautic.test/api", "mautic", "secret"),
                new JsonCodec(new ObjectMapper()));
    }

    @Test
    public void shouldMapContactWithSegments() {
        server.expect(requestTo(startsWith(CONTACTS_URL + "?")))
                .andExpect(queryParam("limit", "1"))
                .andRespond(withSuccess(CONTACT_BODY, MediaType.APPLICATION_JSON));
        server.expect(requestTo(CONTACTS_URL + "/42/segments"))
                .andRespond(withSuccess("{\"total\":2,\"lists\":{\"3\":{\"id\":3,\"name\":\"Clientes VIP\"},"
                        + "\"5\":{\"id\":5,\"name\":\"Newsletter\"}}}", MediaType.APPLICATION_JSON));

        ConnectorLookupResult result = connector.lookup(new ConnectorQuery(EMAIL, "Quais campanhas?"));

        server.verify();
        Assertions.assertEquals(ConnectorLookupResult.Status.FOUND, result.status());
        Assertions.assertEquals("42", result.record().get("contact_id"));
        Assertions.assertEquals(EMAIL, result.record().get("email"));
        Assertions.assertEquals("120", result.record().get("points"));
        Assertions.assertEquals("vip,lead-quente", result.record().get("tags"));
        Assertions.assertEquals("Clientes VIP,Newsletter", result.record().get("segments"));
        Assertions.assertEquals("2026-10-01 10:00:00", result.record().get("last_active"));
    }

    @Test
    public void shouldKeepContactWhenSegmentsFail() {
        server.expect(requestTo(startsWith(CONTACTS_URL + "?")))
                .andRespond(withSuccess(CONTACT_BODY, MediaType.APPLICATION_JSON));
        server.expect(requestTo(CONTACTS_URL + "/42/segments"))
                .andRespond(withServerError());

        ConnectorLookupResult result = connector.lookup(new ConnectorQuery(EMAIL, null));

        Assertions.assertEquals(ConnectorLookupResult.Status.FOUND, result.status());
        Assertions.assertEquals("120", result.record().get("points"));
        Assertions.assertFalse(result.record().containsKey("segments"));
    }

    @Test
    public void shouldSearchByEmailWithPlusSign() {
        server.expect(requestTo(startsWith(CONTACTS_URL + "?")))
                .andExpect(decodedSearch("email:maria+vip@exemplo.com"))
                .andRespond(withSuccess("{\"total\":\"0\",\"contacts\":[]}", MediaType.APPLICATION_JSON));

        ConnectorLookupResult result = connector.lookup(new ConnectorQuery("maria+vip@exemplo.com", null));

        server.verify();
        Assertions.assertEquals(ConnectorLookupResult.Status.NOT_FOUND, result.status());
    }

    @Test
    public void shouldReturnNotFoundWithoutContacts() {
        server.expect(requestTo(startsWith(CONTACTS_URL + "?")))
                .andRespond(withSuccess("{\"total\":\"0\",\"contacts\":[]}", MediaType.APPLICATION_JSON));

        ConnectorLookupResult result = connector.lookup(new ConnectorQuery(EMAIL, null));

        server.verify();
        Assertions.assertEquals(ConnectorLookupResult.Status.NOT_FOUND, result.status());
    }

    @Test
    public void shouldReportUnreadableResponse() {
        server.expect(requestTo(startsWith(CONTACTS_URL + "?")))
                .andRespond(withSuccess("{not json", MediaType.APPLICATION_JSON));

        ConnectorLookupResult result = connector.lookup(new ConnectorQuery(EMAIL, null));

        Assertions.assertTrue(result.isError());
        Assertions.assertTrue(result.errorMessage().startsWith("mautic response unreadable"));
    }

    @Test
    public void shouldRequireEmail() {
        ConnectorLookupResult result = connector.lookup(new ConnectorQuery(" ", null));

        Assertions.assertTrue(result.isError());
        server.verify();
    }

    private static RequestMatcher decodedSearch(String expected) {
        return request -> {
            String raw = UriComponentsBuilder.fromUri(request.getURI()).build().getQueryParams().getFirst("search");
            Assertions.assertNotNull(raw);
            Assertions.assertEquals(expected, URLDecoder.decode(raw, StandardCharsets.UTF_8));
        };
    }
}

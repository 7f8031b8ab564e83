package io.github.amadeusitgroup.chunkedtransfer;

import com.github.tomakehurst.wiremock.junit5.WireMockRuntimeInfo;
import com.github.tomakehurst.wiremock.junit5.WireMockTest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for HttpTransport against a local HTTP server.
 */
@WireMockTest
public class HttpTransportTest {

    private HttpTransport transport;

    @BeforeEach
    public void setUp(WireMockRuntimeInfo wmRuntimeInfo) {
        transport = new HttpTransport(wmRuntimeInfo.getHttpBaseUrl() + "/", 5000, 5000, 300000);
    }

    @AfterEach
    public void tearDown() {
        transport.close();
    }

    @Test
    public void testGetWithHeaders() throws IOException {
        stubFor(get(urlEqualTo("/files/a.bin"))
            .withHeader("Range", equalTo("bytes=0-3"))
            .willReturn(aResponse()
                .withStatus(206)
                .withHeader("Content-Range", "bytes 0-3/10")
                .withBody("abcd")));

        TransportResponse response = transport.send(TransportRequest.builder("GET", "/files/a.bin")
            .header("Range", "bytes=0-3")
            .timeoutMs(2000)
            .build());

        assertEquals(206, response.getStatusCode(), "Partial content expected");
        assertEquals("abcd", new String(response.getBody(), StandardCharsets.UTF_8), "Body expected");
        assertEquals("bytes 0-3/10", response.getHeader("content-range"), "Headers are case-insensitive");
        verify(getRequestedFor(urlEqualTo("/files/a.bin"))
            .withHeader("User-Agent", equalTo(HttpTransport.USER_AGENT)));
        assertEquals(1, transport.getConnectionsOpened(), "One request opened one connection");
    }

    @Test
    public void testPostSendsBody() throws IOException {
        stubFor(post(urlEqualTo("/upload/chunk")).willReturn(aResponse().withStatus(201)));

        TransportResponse response = transport.send(TransportRequest.builder("POST", "/upload/chunk")
            .header("Content-Type", "application/x-protobuf")
            .body(new byte[] {1, 2, 3})
            .build());

        assertEquals(201, response.getStatusCode(), "Created expected");
        assertEquals(0, response.getBody().length, "Empty body");
        verify(postRequestedFor(urlEqualTo("/upload/chunk"))
            .withHeader("Content-Type", equalTo("application/x-protobuf"))
            .withRequestBody(binaryEqualTo(new byte[] {1, 2, 3})));
    }

    @Test
    public void testErrorBodyIsRead() throws IOException {
        stubFor(get(urlEqualTo("/missing")).willReturn(aResponse().withStatus(404).withBody("not here")));

        TransportResponse response = transport.send(TransportRequest.builder("GET", "/missing").build());

        assertFalse(response.isSuccessful(), "404 is not successful");
        assertEquals("not here", new String(response.getBody(), StandardCharsets.UTF_8), "Error body expected");
        TransferException error = assertThrows(TransferException.class, () -> response.requireSuccess("Lookup"),
            "requireSuccess should throw");
        assertEquals(404, error.getStatusCode(), "Status should be carried");
    }

    @Test
    public void testHeadHasNoBody() throws IOException {
        stubFor(head(urlEqualTo("/files/a.bin")).willReturn(aResponse()
            .withStatus(200)
            .withHeader("Accept-Ranges", "bytes")));

        TransportResponse response = transport.send(TransportRequest.builder("HEAD", "/files/a.bin").build());

        assertEquals(200, response.getStatusCode(), "OK expected");
        assertEquals("bytes", response.getHeader("Accept-Ranges"), "Header expected");
        assertEquals(0, response.getBody().length, "HEAD has no body");
    }

    @Test
    public void testCancelledTokenFailsFast() {
        CancellationToken token = new CancellationToken();
        token.cancel("stop");

        assertThrows(TransferCancelledException.class,
            () -> transport.send(TransportRequest.builder("GET", "/files/a.bin").build(), token),
            "Cancelled token should prevent the request");
        verify(0, getRequestedFor(urlEqualTo("/files/a.bin")));
    }

    @Test
    public void testClosedTransportRejectsRequests() {
        transport.close();

        assertFalse(transport.isOpen(), "Transport should be closed");
        assertThrows(TransferException.class,
            () -> transport.send(TransportRequest.builder("GET", "/files/a.bin").build()),
            "Closed transport should refuse requests");
    }

    @Test
    public void testTrailingSlashIsTrimmed() {
        assertFalse(transport.getBaseUrl().endsWith("/"), "Base URL should not end with a slash");
    }
}

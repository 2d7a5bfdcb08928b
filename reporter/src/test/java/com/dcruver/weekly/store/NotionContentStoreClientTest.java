package com.dcruver.weekly.store;

import com.dcruver.weekly.domain.Block;
import com.dcruver.weekly.domain.Document;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class NotionContentStoreClientTest {

    @Mock
    private HttpClient httpClient;

    @Mock
    private HttpResponse<String> response;

    private NotionContentStoreClient client;

    @BeforeEach
    void setUp() {
        ContentStoreProperties properties = new ContentStoreProperties();
        properties.setBaseUrl("https://store.test/v1");
        properties.setApiKey("secret");
        properties.setPageSize(500);

        client = new NotionContentStoreClient(httpClient, new ObjectMapper(), new NotionPayloadMapper(), properties);
    }

    @Test
    void testChildPageRequestCarriesCursorPageSizeAndHeaders() throws Exception {
        when(response.statusCode()).thenReturn(200);
        when(response.body()).thenReturn("""
            {"results": [{"id": "b1", "type": "paragraph", "has_children": false,
                          "paragraph": {"rich_text": [{"plain_text": "hi"}]}}],
             "next_cursor": null, "has_more": false}
            """);
        doReturn(response).when(httpClient).send(any(), any());

        ContentPage<Block> page = client.fetchChildPage("parent-1", "cur 2");

        assertEquals("b1", page.getItems().get(0).getId());

        ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient).send(captor.capture(), any());
        HttpRequest sent = captor.getValue();
        assertEquals("GET", sent.method());
        assertEquals("https://store.test/v1/blocks/parent-1/children?page_size=100&start_cursor=cur+2",
            sent.uri().toString());
        assertEquals("Bearer secret", sent.headers().firstValue("Authorization").orElseThrow());
        assertEquals("2022-06-28", sent.headers().firstValue("Notion-Version").orElseThrow());
    }

    @Test
    void testCollectionPageIsAPostQuery() throws Exception {
        when(response.statusCode()).thenReturn(200);
        when(response.body()).thenReturn("""
            {"results": [{"id": "p1", "properties": {}}], "next_cursor": "n", "has_more": true}
            """);
        doReturn(response).when(httpClient).send(any(), any());

        ContentPage<Document> page = client.fetchCollectionPage("db-1", null);

        assertEquals("p1", page.getItems().get(0).getId());
        assertEquals("n", page.getNextCursor());

        ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient).send(captor.capture(), any());
        assertEquals("POST", captor.getValue().method());
        assertEquals("https://store.test/v1/databases/db-1/query", captor.getValue().uri().toString());
    }

    @Test
    void testHttpErrorUsesApiMessage() throws Exception {
        when(response.statusCode()).thenReturn(404);
        when(response.body()).thenReturn("{\"object\": \"error\", \"message\": \"Could not find block\"}");
        doReturn(response).when(httpClient).send(any(), any());

        ContentStoreException thrown = assertThrows(ContentStoreException.class,
            () -> client.fetchChildPage("missing", null));

        assertEquals(404, thrown.getStatusCode());
        assertTrue(thrown.getMessage().contains("Could not find block"));
    }

    @Test
    void testHttpErrorWithPlainBody() throws Exception {
        when(response.statusCode()).thenReturn(502);
        when(response.body()).thenReturn("Bad Gateway");
        doReturn(response).when(httpClient).send(any(), any());

        ContentStoreException thrown = assertThrows(ContentStoreException.class,
            () -> client.fetchCollection("db-1"));

        assertEquals(502, thrown.getStatusCode());
        assertTrue(thrown.getMessage().endsWith("Bad Gateway"));
    }

    @Test
    void testNetworkFailureHasStatusZero() throws Exception {
        doThrow(new IOException("connection reset")).when(httpClient).send(any(), any());

        ContentStoreException thrown = assertThrows(ContentStoreException.class,
            () -> client.fetchChildPage("b", null));

        assertEquals(0, thrown.getStatusCode());
        assertInstanceOf(IOException.class, thrown.getCause());
    }
}

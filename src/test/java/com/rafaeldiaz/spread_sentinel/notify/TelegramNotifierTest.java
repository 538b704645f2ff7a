package com.rafaeldiaz.spread_sentinel.notify;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.*;
import okio.Buffer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TelegramNotifierTest {

    @Mock
    private OkHttpClient mockHttpClient;
    @Mock
    private Call mockCall;

    private TelegramNotifier notifier;

    @BeforeEach
    void setUp() {
        lenient().when(mockHttpClient.newCall(any(Request.class))).thenReturn(mockCall);
        notifier = new TelegramNotifier(mockHttpClient, "TOKEN", "42", "https://tg.test");
    }

    @Test
    @DisplayName("sendMessage con chat_id, texto HTML y parse_mode")
    void testSendsHtmlMessage() throws IOException {
        when(mockCall.execute()).thenReturn(response(200, "{\"ok\":true}"));

        notifier.notify("<b>Hola \"mundo\"</b>\nlínea 2");

        ArgumentCaptor<Request> captor = ArgumentCaptor.forClass(Request.class);
        verify(mockHttpClient).newCall(captor.capture());
        Request req = captor.getValue();
        assertEquals("https://tg.test/botTOKEN/sendMessage", req.url().toString());

        Buffer buffer = new Buffer();
        req.body().writeTo(buffer);
        JsonNode json = new ObjectMapper().readTree(buffer.readUtf8());
        assertEquals("42", json.path("chat_id").asText());
        assertEquals("<b>Hola \"mundo\"</b>\nlínea 2", json.path("text").asText());
        assertEquals("HTML", json.path("parse_mode").asText());
    }

    @Test
    @DisplayName("Fallos HTTP o de red se registran, nunca se lanzan")
    void testFailuresAreSwallowedIntoLog() throws IOException {
        when(mockCall.execute()).thenReturn(response(400, "{\"ok\":false,\"description\":\"can't parse entities\"}"));
        assertDoesNotThrow(() -> notifier.notify("<b>roto"));

        when(mockCall.execute()).thenThrow(new IOException("timeout"));
        assertDoesNotThrow(() -> notifier.notify("hola"));
    }

    private static Response response(int code, String body) {
        return new Response.Builder()
                .request(new Request.Builder().url("https://test.com").build())
                .protocol(Protocol.HTTP_1_1)
                .code(code)
                .message("OK")
                .body(ResponseBody.create(body, MediaType.parse("application/json")))
                .build();
    }
}

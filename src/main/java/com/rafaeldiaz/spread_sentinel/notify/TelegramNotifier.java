package com.rafaeldiaz.spread_sentinel.notify;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.rafaeldiaz.spread_sentinel.utils.BotLogger;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

import java.io.IOException;

/**
 * 📨 Envío de mensajes HTML al chat configurado vía {@code sendMessage}.
 */
public class TelegramNotifier implements Notifier {

    public static final String DEFAULT_API_URL = "https://api.telegram.org";
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final OkHttpClient client;
    private final ObjectMapper mapper = new ObjectMapper();
    private final String apiUrl;
    private final String botToken;
    private final String chatId;

    public TelegramNotifier(OkHttpClient client, String botToken, String chatId) {
        this(client, botToken, chatId, DEFAULT_API_URL);
    }

    public TelegramNotifier(OkHttpClient client, String botToken, String chatId, String apiUrl) {
        this.client = client;
        this.botToken = botToken;
        this.chatId = chatId;
        this.apiUrl = apiUrl;
    }

    @Override
    public void notify(String htmlText) {
        ObjectNode payload = mapper.createObjectNode()
                .put("chat_id", chatId)
                .put("text", htmlText)
                .put("parse_mode", "HTML");

        Request request = new Request.Builder()
                .url(apiUrl + "/bot" + botToken + "/sendMessage")
                .post(RequestBody.create(payload.toString(), JSON))
                .build();

        try (Response response = client.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                String body = response.body() != null ? response.body().string() : "";
                BotLogger.error("📵 Telegram rechazó el mensaje: HTTP " + response.code() + " " + body);
            }
        } catch (IOException e) {
            BotLogger.error("📵 Error enviando mensaje a Telegram: " + e.getMessage());
        }
    }
}

package com.rafaeldiaz.spread_sentinel.connect;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rafaeldiaz.spread_sentinel.model.Quote;
import com.rafaeldiaz.spread_sentinel.model.TradeAction;
import com.rafaeldiaz.spread_sentinel.utils.EnvProvider;
import com.rafaeldiaz.spread_sentinel.utils.SignatureUtil;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Base64;
import java.util.Iterator;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 🔌 Conector Kraken (REST /0/public y /0/private).
 * Firma: Base64(HMAC-SHA512(path + SHA256(nonce + postdata), Base64Decode(secret))).
 */
public class KrakenGateway implements VenueGateway {

    public static final String NAME = "kraken";
    private static final String BASE_URL = "https://api.kraken.com";
    private static final MediaType FORM = MediaType.get("application/x-www-form-urlencoded; charset=utf-8");

    private final OkHttpClient client;
    private final ObjectMapper mapper = new ObjectMapper();
    private final String baseUrl;
    private final String apiKey;
    private final String apiSecret;

    // El nonce debe crecer siempre, incluso con dos loops firmando a la vez
    private final AtomicLong lastNonce = new AtomicLong();

    public KrakenGateway(OkHttpClient client, EnvProvider env) {
        this(client, env, BASE_URL);
    }

    public KrakenGateway(OkHttpClient client, EnvProvider env, String baseUrl) {
        this.client = client;
        this.baseUrl = baseUrl;
        this.apiKey = env.get("KRAKEN_API_KEY");
        this.apiSecret = env.get("KRAKEN_API_SECRET");
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Quote fetchQuote(String symbol) throws VenueException {
        Request request = new Request.Builder()
                .url(baseUrl + "/0/public/Ticker?pair=" + pairName(symbol))
                .get()
                .build();

        JsonNode result = execute(request);
        Iterator<JsonNode> pairs = result.elements();
        if (!pairs.hasNext()) {
            throw new VenueException(NAME, "Ticker vacío para " + symbol);
        }
        JsonNode ticker = pairs.next();
        double ask = parseDouble(ticker.path("a").path(0).asText(""), "a");
        double bid = parseDouble(ticker.path("b").path(0).asText(""), "b");
        return new Quote(NAME, ask, bid, Instant.now());
    }

    @Override
    public double fetchFreeBalance(String currency) throws VenueException {
        JsonNode result = execute(privateRequest("/0/private/BalanceEx", ""));
        JsonNode entry = result.path(assetName(currency));
        if (entry.isMissingNode()) {
            return 0.0;
        }
        double balance = parseDouble(entry.path("balance").asText("0"), "balance");
        double onHold = parseDouble(entry.path("hold_trade").asText("0"), "hold_trade");
        return balance - onHold;
    }

    @Override
    public String submitMarketOrder(String symbol, TradeAction side, double amount) throws VenueException {
        String params = "ordertype=market"
                + "&type=" + side.venueSide()
                + "&volume=" + String.format(Locale.US, "%.8f", amount)
                + "&pair=" + pairName(symbol);

        JsonNode result = execute(privateRequest("/0/private/AddOrder", params));
        JsonNode txid = result.path("txid");
        if (!txid.isArray() || txid.isEmpty()) {
            throw new VenueException(NAME, "Orden sin txid: " + result);
        }
        return txid.get(0).asText();
    }

    /** BTC/USDT -> XBTUSDT (Kraken llama XBT al bitcoin). */
    static String pairName(String symbol) {
        String[] parts = symbol.toUpperCase(Locale.ROOT).split("/");
        if (parts.length != 2) {
            throw new IllegalArgumentException("Símbolo inválido: " + symbol);
        }
        return assetName(parts[0]) + assetName(parts[1]);
    }

    static String assetName(String currency) {
        String upper = currency.toUpperCase(Locale.ROOT);
        return "BTC".equals(upper) ? "XBT" : upper;
    }

    // =========================================================================
    // 🔐 FIRMA
    // =========================================================================
    Request privateRequest(String path, String params) throws VenueException {
        if (apiKey == null || apiSecret == null) {
            throw new VenueException(NAME, "Credenciales Kraken no configuradas");
        }
        String nonce = String.valueOf(nextNonce());
        String postData = "nonce=" + nonce + (params.isEmpty() ? "" : "&" + params);

        byte[] hash = SignatureUtil.sha256(nonce + postData);
        byte[] pathBytes = path.getBytes(StandardCharsets.UTF_8);
        byte[] message = new byte[pathBytes.length + hash.length];
        System.arraycopy(pathBytes, 0, message, 0, pathBytes.length);
        System.arraycopy(hash, 0, message, pathBytes.length, hash.length);

        byte[] secret;
        try {
            secret = Base64.getDecoder().decode(apiSecret);
        } catch (IllegalArgumentException e) {
            throw new VenueException(NAME, "KRAKEN_API_SECRET no es Base64 válido", e);
        }

        return new Request.Builder()
                .url(baseUrl + path)
                .header("API-Key", apiKey)
                .header("API-Sign", SignatureUtil.hmacSha512Base64(secret, message))
                .post(RequestBody.create(postData, FORM))
                .build();
    }

    private long nextNonce() {
        long now = System.currentTimeMillis() * 1000;
        return lastNonce.updateAndGet(prev -> Math.max(prev + 1, now));
    }

    private JsonNode execute(Request request) throws VenueException {
        try (Response response = client.newCall(request).execute()) {
            ResponseBody body = response.body();
            String raw = body != null ? body.string() : "";
            if (!response.isSuccessful()) {
                throw new VenueException(NAME, "HTTP " + response.code() + ": " + raw);
            }
            JsonNode root = mapper.readTree(raw);
            JsonNode errors = root.path("error");
            if (errors.isArray() && !errors.isEmpty()) {
                StringBuilder sb = new StringBuilder();
                for (JsonNode err : errors) {
                    if (sb.length() > 0) sb.append(", ");
                    sb.append(err.asText());
                }
                throw new VenueException(NAME, sb.toString());
            }
            return root.path("result");
        } catch (IOException e) {
            throw new VenueException(NAME, "Error de red: " + e.getMessage(), e);
        }
    }

    private double parseDouble(String text, String field) throws VenueException {
        try {
            return Double.parseDouble(text);
        } catch (NumberFormatException e) {
            throw new VenueException(NAME, "Campo " + field + " ilegible: '" + text + "'", e);
        }
    }
}

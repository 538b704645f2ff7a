package com.rafaeldiaz.spread_sentinel.connect;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
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
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * 🔌 Conector OKX (API v5, spot).
 * Firma: Base64(HMAC-SHA256(timestamp + METHOD + requestPath + body)) + passphrase.
 */
public class OkxGateway implements VenueGateway {

    public static final String NAME = "okx";
    private static final String BASE_URL = "https://www.okx.com";
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final DateTimeFormatter TS_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

    private final OkHttpClient client;
    private final ObjectMapper mapper = new ObjectMapper();
    private final String baseUrl;
    private final String apiKey;
    private final String apiSecret;
    private final String passphrase;
    private final Clock clock;

    public OkxGateway(OkHttpClient client, EnvProvider env) {
        this(client, env, BASE_URL, Clock.systemUTC());
    }

    public OkxGateway(OkHttpClient client, EnvProvider env, String baseUrl, Clock clock) {
        this.client = client;
        this.baseUrl = baseUrl;
        this.apiKey = env.get("OKX_API_KEY");
        this.apiSecret = env.get("OKX_API_SECRET");
        this.passphrase = env.get("OKX_PASSWORD");
        this.clock = clock;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Quote fetchQuote(String symbol) throws VenueException {
        String path = "/api/v5/market/ticker?instId=" + instrumentId(symbol);
        Request request = new Request.Builder().url(baseUrl + path).get().build();

        JsonNode ticker = firstData(execute(request));
        double ask = parseDouble(ticker, "askPx");
        double bid = parseDouble(ticker, "bidPx");
        return new Quote(NAME, ask, bid, Instant.now(clock));
    }

    @Override
    public double fetchFreeBalance(String currency) throws VenueException {
        String path = "/api/v5/account/balance?ccy=" + currency;
        JsonNode account = firstData(execute(signedRequest("GET", path, "")));

        for (JsonNode detail : account.path("details")) {
            if (currency.equalsIgnoreCase(detail.path("ccy").asText())) {
                return parseDouble(detail, "availBal");
            }
        }
        // Moneda sin saldo: OKX no la lista
        return 0.0;
    }

    @Override
    public String submitMarketOrder(String symbol, TradeAction side, double amount) throws VenueException {
        ObjectNode body = mapper.createObjectNode()
                .put("instId", instrumentId(symbol))
                .put("tdMode", "cash")
                .put("side", side.venueSide())
                .put("ordType", "market")
                .put("sz", String.format(Locale.US, "%.8f", amount))
                // Cantidad expresada en moneda base también para compras a mercado
                .put("tgtCcy", "base_ccy");

        JsonNode order = firstData(execute(signedRequest("POST", "/api/v5/trade/order", body.toString())));
        String orderId = order.path("ordId").asText("");
        if (orderId.isEmpty()) {
            throw new VenueException(NAME, "Orden sin ordId: " + order.path("sMsg").asText("respuesta vacía"));
        }
        return orderId;
    }

    static String instrumentId(String symbol) {
        return symbol.replace("/", "-").toUpperCase(Locale.ROOT);
    }

    // =========================================================================
    // 🔐 FIRMA
    // =========================================================================
    Request signedRequest(String method, String path, String body) throws VenueException {
        if (apiKey == null || apiSecret == null || passphrase == null) {
            throw new VenueException(NAME, "Credenciales OKX no configuradas");
        }
        String timestamp = TS_FORMAT.format(Instant.now(clock));
        String signature = SignatureUtil.hmacSha256Base64(apiSecret, timestamp + method + path + body);

        Request.Builder builder = new Request.Builder()
                .url(baseUrl + path)
                .header("OK-ACCESS-KEY", apiKey)
                .header("OK-ACCESS-SIGN", signature)
                .header("OK-ACCESS-TIMESTAMP", timestamp)
                .header("OK-ACCESS-PASSPHRASE", passphrase);

        if ("POST".equals(method)) {
            builder.post(RequestBody.create(body, JSON));
        } else {
            builder.get();
        }
        return builder.build();
    }

    private JsonNode execute(Request request) throws VenueException {
        try (Response response = client.newCall(request).execute()) {
            ResponseBody responseBody = response.body();
            String raw = responseBody != null ? responseBody.string() : "";
            if (!response.isSuccessful()) {
                throw new VenueException(NAME, "HTTP " + response.code() + ": " + raw);
            }
            JsonNode root = mapper.readTree(raw);
            if (!"0".equals(root.path("code").asText())) {
                // Para órdenes el motivo real viene en data[0].sMsg
                String detail = root.path("data").path(0).path("sMsg").asText("");
                String msg = root.path("msg").asText("");
                throw new VenueException(NAME, "code " + root.path("code").asText()
                        + ": " + (detail.isEmpty() ? msg : detail));
            }
            return root;
        } catch (IOException e) {
            throw new VenueException(NAME, "Error de red: " + e.getMessage(), e);
        }
    }

    private JsonNode firstData(JsonNode root) throws VenueException {
        JsonNode data = root.path("data");
        if (!data.isArray() || data.isEmpty()) {
            throw new VenueException(NAME, "Respuesta sin datos");
        }
        return data.get(0);
    }

    private double parseDouble(JsonNode node, String field) throws VenueException {
        String text = node.path(field).asText("");
        try {
            return Double.parseDouble(text);
        } catch (NumberFormatException e) {
            throw new VenueException(NAME, "Campo " + field + " ilegible: '" + text + "'", e);
        }
    }
}

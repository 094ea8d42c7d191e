package com.earningsbot.data;

import com.earningsbot.config.Config;
import com.earningsbot.model.DailyClose;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.json.JSONTokener;

import java.io.IOException;
import java.math.BigDecimal;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Financial Modeling Prep client.
 * Timeouts, I/O errors and 5xx responses are retried with capped exponential backoff;
 * 429 surfaces immediately as {@link RateLimitException}; other 4xx are not retried.
 */
public class FmpClient implements MarketDataSource {
    private static final Logger LOG = LogManager.getLogger(FmpClient.class);
    private static final String USER_AGENT = "earningsbot/1.0";

    private final String baseUrl;
    private final String apiKey;
    private final int timeoutSec;
    private final int maxAttempts;
    private final long retryBaseMs;
    private final long retryCapMs;
    private final int lookbackBars;
    private final HttpClient httpClient;

    public FmpClient(Config config, String apiKey) {
        this.baseUrl = trimTrailingSlash(config.getString("fmp.base_url"));
        this.apiKey = apiKey == null ? "" : apiKey.trim();
        this.timeoutSec = Math.max(1, config.getInt("fmp.request_timeout_sec", 30));
        this.maxAttempts = Math.max(1, config.getInt("fmp.retry.max_attempts", 3));
        this.retryBaseMs = Math.max(0L, config.getLong("fmp.retry.base_ms", 2000L));
        this.retryCapMs = Math.max(this.retryBaseMs, config.getLong("fmp.retry.cap_ms", 10000L));
        this.lookbackBars = Math.max(2, config.getInt("fmp.lookback_bars", DEFAULT_LOOKBACK_BARS));
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(Math.max(1, config.getInt("fmp.connect_timeout_sec", 20))))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Override
    public int lookbackBars() {
        return lookbackBars;
    }

    @Override
    public List<String> listIndexConstituents() {
        JSONArray data = requestArray("sp500-constituent", Map.of());
        return extractSymbols(data);
    }

    @Override
    public List<String> earningsOn(LocalDate date) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("from", date.toString());
        params.put("to", date.toString());
        JSONArray data = requestArray("earnings-calendar", params);
        return extractSymbols(data);
    }

    @Override
    public List<DailyClose> historicalCloses(String symbol, int count) {
        JSONArray data = requestArray("historical-price-eod/full", Map.of("symbol", symbol));
        List<DailyClose> bars = parseCloses(data);
        if (bars.size() <= count) {
            return bars;
        }
        return new ArrayList<>(bars.subList(0, Math.max(0, count)));
    }

    static List<String> extractSymbols(JSONArray data) {
        Set<String> out = new LinkedHashSet<>();
        if (data == null) {
            return List.of();
        }
        for (int i = 0; i < data.length(); i++) {
            JSONObject item = data.optJSONObject(i);
            if (item == null) {
                continue;
            }
            String symbol = item.optString("symbol", "").trim();
            if (!symbol.isEmpty()) {
                out.add(symbol);
            }
        }
        return new ArrayList<>(out);
    }

    /**
     * Parses {@code [{date, close, ...}]} into closes sorted newest first.
     */
    static List<DailyClose> parseCloses(JSONArray data) {
        List<DailyClose> out = new ArrayList<>();
        if (data == null) {
            return out;
        }
        for (int i = 0; i < data.length(); i++) {
            JSONObject item = data.optJSONObject(i);
            if (item == null) {
                continue;
            }
            String dateText = item.optString("date", "").trim();
            Object rawClose = item.opt("close");
            if (dateText.isEmpty() || rawClose == null || JSONObject.NULL.equals(rawClose)) {
                continue;
            }
            try {
                LocalDate date = LocalDate.parse(dateText.length() > 10 ? dateText.substring(0, 10) : dateText);
                out.add(new DailyClose(date, new BigDecimal(rawClose.toString())));
            } catch (DateTimeParseException | NumberFormatException e) {
                LOG.debug("skip malformed bar: {}", item);
            }
        }
        out.sort(Comparator.comparing((DailyClose bar) -> bar.tradeDate).reversed());
        return out;
    }

    JSONArray requestArray(String endpoint, Map<String, String> params) {
        Object body = request(endpoint, params);
        if (body instanceof JSONArray array) {
            return array;
        }
        LOG.warn("Unexpected {} response format: {}", endpoint, abbreviate(String.valueOf(body)));
        return new JSONArray();
    }

    Object request(String endpoint, Map<String, String> params) {
        String url = buildUrl(endpoint, params);
        MarketDataException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                LOG.debug("FMP request: endpoint={} params={} attempt={}", endpoint, params, attempt);
                FmpResponse response = send(url);
                if (response.statusCode() == 429) {
                    throw new RateLimitException("FMP API rate limit exceeded: endpoint=" + endpoint);
                }
                if (response.statusCode() / 100 != 2) {
                    boolean serverSide = response.statusCode() >= 500;
                    throw new MarketDataException(
                            "fmp http status=" + response.statusCode() + " endpoint=" + endpoint,
                            serverSide,
                            response.statusCode(),
                            null
                    );
                }
                return parseJson(endpoint, response.body());
            } catch (MarketDataException e) {
                if (!e.isRetryable()) {
                    throw e;
                }
                last = e;
            }
            if (attempt < maxAttempts) {
                long delay = backoffMillis(attempt);
                LOG.warn("FMP request failed, retrying: endpoint={} attempt={}/{} delay_ms={} cause={}",
                        endpoint, attempt, maxAttempts, delay, last.getMessage());
                try {
                    pause(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new MarketDataException("fmp request interrupted: endpoint=" + endpoint, false, 0, ie);
                }
            }
        }
        throw last;
    }

    /**
     * Performs one HTTP GET. Timeouts and I/O failures become retryable exceptions.
     */
    protected FmpResponse send(String url) {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .header("User-Agent", USER_AGENT)
                .header("Accept", "application/json")
                .timeout(Duration.ofSeconds(timeoutSec))
                .GET()
                .build();
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            return new FmpResponse(response.statusCode(), response.body());
        } catch (HttpTimeoutException e) {
            throw new MarketDataException("fmp request timed out", true, 0, e);
        } catch (IOException e) {
            throw new MarketDataException("fmp request failed: " + e.getMessage(), true, 0, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MarketDataException("fmp request interrupted", false, 0, e);
        }
    }

    protected void pause(long millis) throws InterruptedException {
        if (millis > 0L) {
            Thread.sleep(millis);
        }
    }

    long backoffMillis(int attempt) {
        long factor = 1L << Math.min(20, Math.max(0, attempt - 1));
        return Math.min(retryCapMs, retryBaseMs * factor);
    }

    private Object parseJson(String endpoint, String body) {
        String text = body == null ? "" : body.trim();
        if (text.isEmpty()) {
            return new JSONArray();
        }
        try {
            return new JSONTokener(text).nextValue();
        } catch (JSONException e) {
            throw new MarketDataException("fmp unparseable payload: endpoint=" + endpoint, false, 200, e);
        }
    }

    private String buildUrl(String endpoint, Map<String, String> params) {
        StringBuilder sb = new StringBuilder(baseUrl).append('/').append(endpoint).append('?');
        for (Map.Entry<String, String> entry : params.entrySet()) {
            sb.append(encode(entry.getKey())).append('=').append(encode(entry.getValue())).append('&');
        }
        sb.append("apikey=").append(encode(apiKey));
        return sb.toString();
    }

    private static String encode(String value) {
        return URLEncoder.encode(value == null ? "" : value, StandardCharsets.UTF_8);
    }

    private static String trimTrailingSlash(String url) {
        String value = url == null ? "" : url.trim();
        while (value.endsWith("/")) {
            value = value.substring(0, value.length() - 1);
        }
        return value;
    }

    private static String abbreviate(String text) {
        return text.length() > 120 ? text.substring(0, 120) + "..." : text;
    }

    public record FmpResponse(int statusCode, String body) {
    }
}

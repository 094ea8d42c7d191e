package com.earningsbot.data;

import com.earningsbot.config.Config;
import com.earningsbot.model.DailyClose;
import com.earningsbot.model.PricePair;
import org.json.JSONArray;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FmpClientTest {

    @Test
    void serverErrorsShouldBeRetriedWithExponentialBackoff() {
        ScriptedFmpClient client = new ScriptedFmpClient()
                .respond(503, "")
                .respond(502, "")
                .respond(200, "[{\"symbol\":\"AAPL\"},{\"symbol\":\"MSFT\"}]");

        List<String> symbols = client.listIndexConstituents();

        assertEquals(List.of("AAPL", "MSFT"), symbols);
        assertEquals(3, client.urls.size());
        assertEquals(List.of(2000L, 4000L), client.pauses);
    }

    @Test
    void exhaustedRetriesShouldSurfaceTheLastFailure() {
        ScriptedFmpClient client = new ScriptedFmpClient()
                .fail(new MarketDataException("fmp request timed out", true))
                .respond(500, "")
                .respond(500, "");

        MarketDataException error = assertThrows(MarketDataException.class, client::listIndexConstituents);

        assertEquals(500, error.statusCode());
        assertEquals(3, client.urls.size());
    }

    @Test
    void rateLimitShouldNotBeRetried() {
        ScriptedFmpClient client = new ScriptedFmpClient().respond(429, "{}");

        assertThrows(RateLimitException.class, () -> client.earningsOn(LocalDate.of(2025, 1, 15)));
        assertEquals(1, client.urls.size());
        assertTrue(client.pauses.isEmpty());
    }

    @Test
    void clientErrorsShouldNotBeRetried() {
        ScriptedFmpClient client = new ScriptedFmpClient().respond(404, "");

        MarketDataException error = assertThrows(MarketDataException.class, client::listIndexConstituents);

        assertFalse(error.isRetryable());
        assertEquals(404, error.statusCode());
        assertEquals(1, client.urls.size());
    }

    @Test
    void unexpectedPayloadShapeShouldYieldEmptyList() {
        ScriptedFmpClient client = new ScriptedFmpClient().respond(200, "{\"Error Message\":\"Invalid API KEY\"}");

        assertTrue(client.listIndexConstituents().isEmpty());
    }

    @Test
    void earningsRequestShouldAskForASingleDay() {
        ScriptedFmpClient client = new ScriptedFmpClient()
                .respond(200, "[{\"symbol\":\"X\"},{\"symbol\":\" \"},{\"symbol\":\"X\"},{\"symbol\":\"Y\"}]");

        List<String> symbols = client.earningsOn(LocalDate.of(2025, 1, 15));

        assertEquals(List.of("X", "Y"), symbols);
        String url = client.urls.get(0);
        assertTrue(url.startsWith("https://fmp.test/stable/earnings-calendar?"));
        assertTrue(url.contains("from=2025-01-15&to=2025-01-15"));
        assertTrue(url.endsWith("apikey=secret"));
    }

    @Test
    void historicalClosesShouldBeSortedNewestFirstAndTrimmed() {
        ScriptedFmpClient client = new ScriptedFmpClient().respond(200, "["
                + "{\"date\":\"2025-01-16\",\"close\":101.5},"
                + "{\"date\":\"2025-01-21\",\"close\":88},"
                + "{\"date\":\"2025-01-17\",\"close\":100.0},"
                + "{\"date\":\"\",\"close\":1},"
                + "{\"date\":\"2025-01-15\",\"close\":null}"
                + "]");

        List<DailyClose> bars = client.historicalCloses("X", 2);

        assertEquals(2, bars.size());
        assertEquals(LocalDate.of(2025, 1, 21), bars.get(0).tradeDate);
        assertEquals(0, new BigDecimal("88").compareTo(bars.get(0).close));
        assertEquals(LocalDate.of(2025, 1, 17), bars.get(1).tradeDate);
    }

    @Test
    void priceAndPrevCloseShouldComeFromTheLookbackWindow() {
        ScriptedFmpClient client = new ScriptedFmpClient().respond(200,
                "[{\"date\":\"2025-01-21\",\"close\":88.00},{\"date\":\"2025-01-17\",\"close\":100.00}]");

        PricePair pair = client.priceAndPrevClose("X", LocalDate.of(2025, 1, 21)).orElseThrow();

        assertEquals(0, new BigDecimal("88.00").compareTo(pair.close()));
        assertEquals(0, new BigDecimal("100.00").compareTo(pair.prevClose()));
        assertTrue(client.urls.get(0).contains("historical-price-eod/full?symbol=X"));
    }

    @Test
    void parseClosesShouldSkipMalformedEntries() {
        JSONArray data = new JSONArray("[{\"date\":\"not-a-date\",\"close\":1},{\"close\":2},7]");

        assertTrue(FmpClient.parseCloses(data).isEmpty());
    }

    @Test
    void backoffShouldBeCapped() {
        ScriptedFmpClient client = new ScriptedFmpClient();

        assertEquals(2000L, client.backoffMillis(1));
        assertEquals(4000L, client.backoffMillis(2));
        assertEquals(8000L, client.backoffMillis(3));
        assertEquals(10000L, client.backoffMillis(4));
    }

    private static final class ScriptedFmpClient extends FmpClient {
        private final Deque<Object> script = new ArrayDeque<>();
        final List<String> urls = new ArrayList<>();
        final List<Long> pauses = new ArrayList<>();

        private ScriptedFmpClient() {
            super(Config.fromConfigurationProperties(Path.of("."), Map.of(
                    "fmp", Map.of("base_url", "https://fmp.test/stable/")
            )), "secret");
        }

        ScriptedFmpClient respond(int status, String body) {
            script.add(new FmpResponse(status, body));
            return this;
        }

        ScriptedFmpClient fail(MarketDataException failure) {
            script.add(failure);
            return this;
        }

        @Override
        protected FmpResponse send(String url) {
            urls.add(url);
            Object next = script.poll();
            if (next instanceof MarketDataException failure) {
                throw failure;
            }
            if (next == null) {
                throw new IllegalStateException("no scripted response for " + url);
            }
            return (FmpResponse) next;
        }

        @Override
        protected void pause(long millis) {
            pauses.add(millis);
        }
    }
}

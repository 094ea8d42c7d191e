package com.earningsbot.app;

import com.earningsbot.alerts.AlertService;
import com.earningsbot.app.properties.DbProperties;
import com.earningsbot.app.properties.ScanProperties;
import com.earningsbot.config.Config;
import com.earningsbot.data.FmpClient;
import com.earningsbot.data.MarketDataSource;
import com.earningsbot.db.Database;
import com.earningsbot.db.MigrationRunner;
import com.earningsbot.db.PgSignalStore;
import com.earningsbot.db.SymbolCacheDao;
import com.earningsbot.runner.DailyScanOrchestrator;
import com.earningsbot.store.SignalStore;
import com.earningsbot.universe.SymbolUniverseCache;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.context.properties.bind.Bindable;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;
import org.springframework.core.env.Environment;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;

@Configuration
@EnableConfigurationProperties({DbProperties.class, ScanProperties.class})
public class EarningsBotBootstrapConfig {
    private static final Logger LOG = LogManager.getLogger(EarningsBotBootstrapConfig.class);

    @Bean
    public Config earningsBotConfig(Environment environment) {
        return buildConfig(environment, Path.of(".").toAbsolutePath().normalize());
    }

    static Config buildConfig(Environment environment, Path workingDir) {
        Map<String, Object> rawProperties = Binder.get(environment)
                .bind("", Bindable.mapOf(String.class, Object.class))
                .orElseGet(Map::of);
        return Config.fromConfigurationProperties(workingDir, rawProperties);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @Lazy
    public Database database(DbProperties dbProperties) {
        Database database = new Database(
                readDbUrl(dbProperties),
                readDbUser(dbProperties),
                readDbPass(dbProperties),
                readDbSchema(dbProperties)
        );
        LOG.info("DB url={}, schema={}", database.maskedJdbcUrl(), database.schema());
        try {
            new MigrationRunner().run(database);
        } catch (Exception e) {
            throw new IllegalStateException("Database migration failed: " + e.getMessage(), e);
        }
        return database;
    }

    @Bean
    @Lazy
    public SignalStore signalStore(Database database, Clock clock) {
        return new PgSignalStore(database, clock);
    }

    @Bean
    @Lazy
    public MarketDataSource marketDataSource(Config config) {
        String apiKey = firstNonBlank(System.getenv("FMP_API_KEY"), config.getString("fmp.api_key"));
        if (apiKey.isEmpty()) {
            LOG.warn("FMP API key is not configured (env FMP_API_KEY or fmp.api_key)");
        }
        return new FmpClient(config, apiKey);
    }

    @Bean
    @Lazy
    public SymbolUniverseCache symbolUniverseCache(Database database, MarketDataSource marketDataSource) {
        return new SymbolUniverseCache(new SymbolCacheDao(database), marketDataSource);
    }

    @Bean
    @Lazy
    public DailyScanOrchestrator dailyScanOrchestrator(
            SymbolUniverseCache symbolUniverseCache,
            MarketDataSource marketDataSource,
            SignalStore signalStore,
            Clock clock,
            ScanProperties scanProperties
    ) {
        Duration ttl = Duration.ofHours(Math.max(1, scanProperties.getUniverseCacheTtlHours()));
        return new DailyScanOrchestrator(symbolUniverseCache, marketDataSource, signalStore, clock, ttl);
    }

    @Bean
    @Lazy
    public AlertService alertService(SignalStore signalStore, Clock clock) {
        return new AlertService(signalStore, clock);
    }

    private String readDbUrl(DbProperties dbProperties) {
        return firstNonBlank(
                System.getenv("EARNINGSBOT_DB_URL"),
                dbProperties == null ? null : dbProperties.getUrl(),
                "jdbc:postgresql://localhost:5432/earningsbot"
        );
    }

    private String readDbUser(DbProperties dbProperties) {
        return firstNonBlank(
                System.getenv("EARNINGSBOT_DB_USER"),
                dbProperties == null ? null : dbProperties.getUser(),
                "earningsbot"
        );
    }

    private String readDbPass(DbProperties dbProperties) {
        return firstNonBlank(
                System.getenv("EARNINGSBOT_DB_PASS"),
                dbProperties == null ? null : dbProperties.getPass(),
                "earningsbot"
        );
    }

    private String readDbSchema(DbProperties dbProperties) {
        return firstNonBlank(
                dbProperties == null ? null : dbProperties.getSchema(),
                "earningsbot"
        );
    }

    static String firstNonBlank(String... values) {
        if (values == null) {
            return "";
        }
        for (String value : values) {
            if (value == null) {
                continue;
            }
            String trimmed = value.trim();
            if (!trimmed.isEmpty()) {
                return trimmed;
            }
        }
        return "";
    }
}

package io.forecast4j.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.forecast4j.ForecastEngine;
import io.forecast4j.HistoricalWeatherClient;
import io.forecast4j.PushDeliveryClient;
import io.forecast4j.WeatherProviderClient;
import io.forecast4j.core.CatchUpPolicy;
import io.forecast4j.core.DeliveryResult;
import io.forecast4j.core.FetchException;
import io.forecast4j.core.SchedulerJobStore;
import io.forecast4j.internal.CronScheduler;
import io.forecast4j.internal.HistoryBackfill;
import io.forecast4j.internal.NotificationFanout;
import io.forecast4j.internal.WeatherCache;
import io.forecast4j.internal.mongo.MongoSchedulerJobStore;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class ForecastAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(ForecastConfig.class))
            .withBean(MongoTemplate.class, () -> mock(MongoTemplate.class))
            .withBean(ObjectMapper.class, ObjectMapper::new);

    @Test
    void shouldAutoConfigureEngineWhenClientsArePresent() {
        contextRunner
                .withBean(WeatherProviderClient.class, () -> (city, units) -> {
                    throw FetchException.permanentFailure("not used");
                })
                .withBean(PushDeliveryClient.class, () -> (token, platform, payload) -> DeliveryResult.OK)
                .withPropertyValues(
                        "forecast.tick-interval=500ms",
                        "forecast.catch-up-policy=all-missed",
                        "forecast.delivery-parallelism=2",
                        "forecast.history-retention=0s"
                )
                .run(context -> {
                    assertThat(context).hasSingleBean(ForecastEngine.class);
                    assertThat(context).hasSingleBean(ForecastLifecycle.class);
                    assertThat(context).hasSingleBean(WeatherCache.class);
                    assertThat(context).hasSingleBean(NotificationFanout.class);
                    assertThat(context).hasSingleBean(CronScheduler.class);
                    assertThat(context).getBean(SchedulerJobStore.class).isInstanceOf(MongoSchedulerJobStore.class);

                    ForecastProperties props = context.getBean(ForecastProperties.class);
                    assertThat(props.getTickInterval()).isEqualTo(Duration.ofMillis(500));
                    assertThat(props.getCatchUpPolicy()).isEqualTo(CatchUpPolicy.ALL_MISSED);
                    assertThat(props.getDeliveryParallelism()).isEqualTo(2);
                    assertThat(props.getStalenessWindow()).isEqualTo(Duration.ofMinutes(30));
                });
    }

    @Test
    void shouldWireHistoryBackfillOnlyWhenEnabledWithHistoricalClient() {
        ApplicationContextRunner withClients = contextRunner
                .withBean(WeatherProviderClient.class, () -> (city, units) -> {
                    throw FetchException.permanentFailure("not used");
                })
                .withBean(PushDeliveryClient.class, () -> (token, platform, payload) -> DeliveryResult.OK)
                .withBean(HistoricalWeatherClient.class, () -> (city, units, day) -> List.of())
                .withPropertyValues("forecast.history-retention=0s");

        withClients.run(context -> assertThat(context).doesNotHaveBean(HistoryBackfill.class));

        withClients
                .withPropertyValues(
                        "forecast.backfill-enabled=true",
                        "forecast.backfill-max-days=3",
                        "forecast.backfill-fallback-cities=Paris,Lyon"
                )
                .run(context -> {
                    assertThat(context).hasSingleBean(HistoryBackfill.class);
                    assertThat(context).hasSingleBean(ForecastEngine.class);
                    ForecastProperties props = context.getBean(ForecastProperties.class);
                    assertThat(props.getBackfillMaxDays()).isEqualTo(3);
                    assertThat(props.getBackfillFallbackCities()).containsExactly("Paris", "Lyon");
                    assertThat(props.getBackfillCron()).isEqualTo("0 3 * * *");
                });
    }

    @Test
    void shouldNotCreateEngineWithoutClients() {
        contextRunner.run(context -> {
            assertThat(context).hasNotFailed();
            assertThat(context).doesNotHaveBean(ForecastEngine.class);
            assertThat(context).doesNotHaveBean(ForecastLifecycle.class);
            assertThat(context).hasSingleBean(SchedulerJobStore.class);
            assertThat(context).hasSingleBean(ForecastMongoIndexConfig.class);
        });
    }

    @Test
    void shouldBackOffWhenDisabled() {
        contextRunner
                .withPropertyValues("forecast.enabled=false")
                .run(context -> {
                    assertThat(context).doesNotHaveBean(ForecastProperties.class);
                    assertThat(context).doesNotHaveBean(SchedulerJobStore.class);
                });
    }
}

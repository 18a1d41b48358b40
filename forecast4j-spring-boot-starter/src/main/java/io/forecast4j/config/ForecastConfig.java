package io.forecast4j.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.forecast4j.ForecastEngine;
import io.forecast4j.HistoricalWeatherClient;
import io.forecast4j.PushDeliveryClient;
import io.forecast4j.WeatherProviderClient;
import io.forecast4j.core.DeviceRegistry;
import io.forecast4j.core.SchedulerJobStore;
import io.forecast4j.core.WeatherHistoryStore;
import io.forecast4j.internal.CronScheduler;
import io.forecast4j.internal.DefaultForecastEngine;
import io.forecast4j.internal.HistoryBackfill;
import io.forecast4j.internal.JobExecutionLocks;
import io.forecast4j.internal.JobExecutor;
import io.forecast4j.internal.NotificationFanout;
import io.forecast4j.internal.RetryPolicy;
import io.forecast4j.internal.UpstreamCallBudget;
import io.forecast4j.internal.WeatherCache;
import io.forecast4j.internal.mongo.MongoDeviceRegistry;
import io.forecast4j.internal.mongo.MongoSchedulerJobStore;
import io.forecast4j.internal.mongo.MongoWeatherHistoryStore;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.time.Clock;

/**
 * Spring Boot auto-configuration entrypoint for the forecast engine.
 *
 * <p>The application supplies the {@link WeatherProviderClient} and {@link PushDeliveryClient} beans;
 * the engine is only wired when both are present. A {@link HistoricalWeatherClient} bean together with
 * {@code forecast.backfill-enabled=true} adds the nightly history backfill.
 */
@AutoConfiguration
@ConditionalOnClass({ForecastEngine.class, MongoTemplate.class})
@EnableConfigurationProperties(ForecastProperties.class)
@ConditionalOnProperty(prefix = "forecast", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ForecastConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock forecastClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean(SchedulerJobStore.class)
    public MongoSchedulerJobStore mongoSchedulerJobStore(MongoTemplate mongoTemplate, ObjectMapper objectMapper) {
        return new MongoSchedulerJobStore(mongoTemplate, objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean(DeviceRegistry.class)
    public MongoDeviceRegistry mongoDeviceRegistry(MongoTemplate mongoTemplate) {
        return new MongoDeviceRegistry(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean(WeatherHistoryStore.class)
    public MongoWeatherHistoryStore mongoWeatherHistoryStore(MongoTemplate mongoTemplate) {
        return new MongoWeatherHistoryStore(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    protected ForecastMongoIndexConfig forecastMongoIndexConfig(MongoTemplate mongoTemplate) {
        return new ForecastMongoIndexConfig(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    public UpstreamCallBudget upstreamCallBudget(ForecastProperties props, Clock clock) {
        return new UpstreamCallBudget(props.getDailyCallLimit(), clock);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(WeatherProviderClient.class)
    public WeatherCache weatherCache(WeatherHistoryStore historyStore,
                                     WeatherProviderClient provider,
                                     UpstreamCallBudget budget,
                                     ForecastProperties props,
                                     Clock clock) {
        return new WeatherCache(historyStore, provider, budget,
                props.getStalenessWindow(), props.isServeStaleOnError(), clock);
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    @ConditionalOnBean(PushDeliveryClient.class)
    public NotificationFanout notificationFanout(PushDeliveryClient client, ForecastProperties props) {
        return new NotificationFanout(client,
                props.getDeliveryParallelism(),
                props.getDeliveryTimeout(),
                RetryPolicy.fixed(props.getDeliveryMaxAttempts(), props.getDeliveryBackoff()));
    }

    @Bean
    @ConditionalOnMissingBean
    public JobExecutionLocks jobExecutionLocks() {
        return new JobExecutionLocks();
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean({WeatherCache.class, NotificationFanout.class})
    public JobExecutor jobExecutor(WeatherCache cache,
                                   DeviceRegistry deviceRegistry,
                                   NotificationFanout fanout,
                                   SchedulerJobStore jobStore,
                                   JobExecutionLocks locks,
                                   ForecastProperties props,
                                   Clock clock) {
        RetryPolicy fetchRetry = new RetryPolicy(
                props.getFetchMaxAttempts(), props.getFetchInitialBackoff(), props.getFetchMaxBackoff());
        return new JobExecutor(cache, deviceRegistry, fanout, jobStore, locks, fetchRetry, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(HistoricalWeatherClient.class)
    @ConditionalOnProperty(prefix = "forecast", name = "backfill-enabled", havingValue = "true")
    public HistoryBackfill historyBackfill(HistoricalWeatherClient client,
                                           WeatherHistoryStore historyStore,
                                           DeviceRegistry deviceRegistry,
                                           SchedulerJobStore jobStore,
                                           UpstreamCallBudget budget,
                                           ForecastProperties props,
                                           Clock clock) {
        return new HistoryBackfill(client, historyStore, deviceRegistry, jobStore, budget,
                props.getBackfillFallbackCities(), props.getBackfillMaxDays(), props.getBackfillCallDelay(), clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public CronScheduler cronScheduler(SchedulerJobStore jobStore, ForecastProperties props) {
        return new CronScheduler(jobStore,
                props.getTickInterval(),
                props.getJobRefreshInterval(),
                props.getCatchUpPolicy(),
                props.getMaxMissedRuns());
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(JobExecutor.class)
    public ForecastEngine forecastEngine(ForecastProperties props,
                                         CronScheduler scheduler,
                                         JobExecutor executor,
                                         SchedulerJobStore jobStore,
                                         WeatherHistoryStore historyStore,
                                         ObjectProvider<HistoryBackfill> backfill,
                                         Clock clock) {
        return new DefaultForecastEngine(props, scheduler, executor, jobStore, historyStore,
                backfill.getIfAvailable(), clock);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(ForecastEngine.class)
    public ForecastLifecycle forecastLifecycle(ForecastEngine engine) {
        return new ForecastLifecycle(engine);
    }

    @Bean
    @ConditionalOnProperty(prefix = "forecast", name = "ensure-indexes-on-startup", havingValue = "true")
    public SmartInitializingSingleton forecastIndexesInitializer(ForecastMongoIndexConfig indexConfig) {
        return indexConfig::ensureIndexes;
    }
}

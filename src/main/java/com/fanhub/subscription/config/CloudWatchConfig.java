package com.fanhub.subscription.config;

import io.micrometer.cloudwatch2.CloudWatchMeterRegistry;
import io.micrometer.core.instrument.Clock;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.config.MeterFilter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.cloudwatch.CloudWatchAsyncClient;

import java.time.Duration;
import java.util.Map;

/**
 * Publishes the subscription meters (subscribe outcomes, rejections, unsubscribes,
 * retention purges and sweep timing, count cache hits) to CloudWatch.
 *
 * Only meters under {@value #EXPORTED_PREFIX} are shipped; JVM, HTTP and pool meters
 * stay available through Actuator. With cloud.aws.cloudwatch.enabled=false this
 * configuration is skipped and Actuator's in-memory registry records everything.
 *
 * @author FanHub Team
 */
@Configuration
@ConditionalOnProperty(name = "cloud.aws.cloudwatch.enabled", havingValue = "true", matchIfMissing = true)
public class CloudWatchConfig {

    static final String EXPORTED_PREFIX = "fanhub.subscription.";

    @Value("${cloud.aws.region:ap-northeast-2}")
    private String region;

    @Value("${cloud.aws.cloudwatch.namespace:FanHub}")
    private String namespace;

    @Value("${cloud.aws.cloudwatch.batch-size:20}")
    private int batchSize;

    @Value("${cloud.aws.cloudwatch.step:PT1M}")
    private String step;

    @Value("${spring.application.name:fanhub-subscription}")
    private String applicationName;

    @Bean(destroyMethod = "close")
    public CloudWatchAsyncClient cloudWatchAsyncClient() {
        return CloudWatchAsyncClient.builder()
                .region(Region.of(region))
                .credentialsProvider(DefaultCredentialsProvider.create())
                .build();
    }

    @Bean
    public MeterRegistry meterRegistry(CloudWatchAsyncClient cloudWatchAsyncClient) {
        Map<String, String> settings = Map.of(
                "cloudwatch.namespace", namespace,
                "cloudwatch.batchSize", Integer.toString(batchSize),
                "cloudwatch.step", Duration.parse(step).toString()
        );
        io.micrometer.cloudwatch2.CloudWatchConfig cloudWatchConfig = settings::get;

        CloudWatchMeterRegistry registry = new CloudWatchMeterRegistry(cloudWatchConfig, Clock.SYSTEM, cloudWatchAsyncClient);
        registry.config()
                .commonTags("application", applicationName)
                .meterFilter(subscriptionMetersOnly());
        return registry;
    }

    /**
     * Accepts subscription meters and denies the rest, keeping the CloudWatch bill to what dashboards use.
     */
    static MeterFilter subscriptionMetersOnly() {
        return MeterFilter.denyUnless(id -> id.getName().startsWith(EXPORTED_PREFIX));
    }
}

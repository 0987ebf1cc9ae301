package com.id.fieldbridge.config;

import com.id.fieldbridge.modules.aggregation.model.AggregationSettings;
import com.id.fieldbridge.modules.decoder.model.DecoderSettings;
import com.id.fieldbridge.modules.sink.model.SinkSettings;
import com.id.fieldbridge.modules.subscription.model.PipelineSettings;
import com.id.fieldbridge.modules.subscription.model.TransportSettings;
import lombok.Getter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

@Configuration
@Getter
public class AppConfig {

    @Value("${fieldbridge.launch.sanctioned:false}")
    private boolean launchSanctioned;

    @Value("${fieldbridge.decoder.topic-prefix:fieldbridge}")
    private String decoderTopicPrefix;

    @Value("${fieldbridge.decoder.legacy-topic:mqtt/global}")
    private String decoderLegacyTopic;

    @Value("${fieldbridge.decoder.default-device-id:}")
    private String decoderDefaultDeviceId;

    @Value("${fieldbridge.decoder.stamp-missing-timestamp:false}")
    private boolean decoderStampMissingTimestamp;

    @Value("${fieldbridge.decoder.legacy-device-id:robot-01}")
    private String decoderLegacyDeviceId;

    @Value("${fieldbridge.decoder.legacy-stamp-missing-timestamp:true}")
    private boolean decoderLegacyStampMissingTimestamp;

    @Value("${fieldbridge.decoder.timestamp-unit:MILLISECONDS}")
    private TimeUnit decoderTimestampUnit;

    @Value("${fieldbridge.aggregation.epoch-resolution-ms:1000}")
    private long aggregationEpochResolutionMs;

    @Value("${fieldbridge.aggregation.window-timeout-ms:2000}")
    private long aggregationWindowTimeoutMs;

    @Value("${fieldbridge.aggregation.max-open-entries:10000}")
    private int aggregationMaxOpenEntries;

    @Value("${fieldbridge.aggregation.sealed-key-memory:4096}")
    private int aggregationSealedKeyMemory;

    @Value("${fieldbridge.aggregation.expected-variants:LOCATION,THERMAL}")
    private List<String> aggregationExpectedVariants;

    @Value("${fieldbridge.aggregation.device-classes:}")
    private String aggregationDeviceClasses;

    @Value("${fieldbridge.sink.document-collection:SensorReadings}")
    private String sinkDocumentCollection;

    @Value("${fieldbridge.sink.timeseries-collection:SensorPoints}")
    private String sinkTimeSeriesCollection;

    @Value("${fieldbridge.sink.max-attempts:5}")
    private int sinkMaxAttempts;

    @Value("${fieldbridge.sink.initial-backoff-ms:200}")
    private long sinkInitialBackoffMs;

    @Value("${fieldbridge.sink.max-backoff-ms:5000}")
    private long sinkMaxBackoffMs;

    @Value("${fieldbridge.sink.write-timeout-ms:15000}")
    private long sinkWriteTimeoutMs;

    @Value("${fieldbridge.sink.writer-threads:8}")
    private int sinkWriterThreads;

    @Value("${fieldbridge.sink.writer-queue-size:1024}")
    private int sinkWriterQueueSize;

    @Value("${fieldbridge.pipeline.worker-threads:8}")
    private int pipelineWorkerThreads;

    @Value("${fieldbridge.pipeline.worker-queue-size:4096}")
    private int pipelineWorkerQueueSize;

    @Value("${fieldbridge.pipeline.commit-threads:4}")
    private int pipelineCommitThreads;

    @Value("${fieldbridge.pipeline.commit-queue-size:1024}")
    private int pipelineCommitQueueSize;

    @Value("${fieldbridge.pipeline.shutdown-grace-ms:10000}")
    private long pipelineShutdownGraceMs;

    @Value("${fieldbridge.transport.enabled:true}")
    private boolean transportEnabled;

    @Value("${fieldbridge.transport.broker-url:tcp://localhost:1883}")
    private String transportBrokerUrl;

    @Value("${fieldbridge.transport.client-id:fieldbridge-server}")
    private String transportClientId;

    @Value("${fieldbridge.transport.username:}")
    private String transportUsername;

    @Value("${fieldbridge.transport.password:}")
    private String transportPassword;

    @Value("${fieldbridge.transport.qos:1}")
    private int transportQos;

    @Value("${fieldbridge.transport.keep-alive-s:120}")
    private int transportKeepAliveS;

    @Value("${fieldbridge.transport.connect-timeout-s:10}")
    private int transportConnectTimeoutS;

    @Value("${fieldbridge.transport.reconnect-initial-ms:1000}")
    private long transportReconnectInitialMs;

    @Value("${fieldbridge.transport.reconnect-max-ms:30000}")
    private long transportReconnectMaxMs;

    @Value("${fieldbridge.query.default-limit:10}")
    private int queryDefaultLimit;

    @Value("${fieldbridge.query.max-limit:1000}")
    private int queryMaxLimit;

    @Bean
    public DecoderSettings decoderSettings() {
        return DecoderSettings.builder()
                .topicPrefix(decoderTopicPrefix)
                .legacyTopic(decoderLegacyTopic)
                .defaultDeviceId(decoderDefaultDeviceId == null || decoderDefaultDeviceId.isBlank() ? null : decoderDefaultDeviceId)
                .stampMissingTimestamp(decoderStampMissingTimestamp)
                .legacyDeviceId(decoderLegacyDeviceId == null || decoderLegacyDeviceId.isBlank() ? null : decoderLegacyDeviceId)
                .legacyStampMissingTimestamp(decoderLegacyStampMissingTimestamp)
                .timestampUnit(decoderTimestampUnit)
                .build();
    }

    @Bean
    public AggregationSettings aggregationSettings() {
        return AggregationSettings.builder()
                .epochResolution(Duration.ofMillis(aggregationEpochResolutionMs))
                .windowTimeout(Duration.ofMillis(aggregationWindowTimeoutMs))
                .maxOpenEntries(aggregationMaxOpenEntries)
                .sealedKeyMemory(aggregationSealedKeyMemory)
                .expectedVariants(aggregationExpectedVariants)
                .deviceClasses(aggregationDeviceClasses)
                .build();
    }

    @Bean
    public SinkSettings sinkSettings() {
        return SinkSettings.builder()
                .documentCollection(sinkDocumentCollection)
                .timeSeriesCollection(sinkTimeSeriesCollection)
                .maxAttempts(sinkMaxAttempts)
                .initialBackoff(Duration.ofMillis(sinkInitialBackoffMs))
                .maxBackoff(Duration.ofMillis(sinkMaxBackoffMs))
                .writeTimeout(Duration.ofMillis(sinkWriteTimeoutMs))
                .writerThreads(sinkWriterThreads)
                .writerQueueSize(sinkWriterQueueSize)
                .build();
    }

    @Bean
    public PipelineSettings pipelineSettings() {
        return PipelineSettings.builder()
                .workerThreads(pipelineWorkerThreads)
                .workerQueueSize(pipelineWorkerQueueSize)
                .commitThreads(pipelineCommitThreads)
                .commitQueueSize(pipelineCommitQueueSize)
                .shutdownGrace(Duration.ofMillis(pipelineShutdownGraceMs))
                .build();
    }

    @Bean
    public TransportSettings transportSettings() {
        return TransportSettings.builder()
                .enabled(transportEnabled)
                .brokerUrl(transportBrokerUrl)
                .clientId(transportClientId)
                .username(transportUsername == null || transportUsername.isBlank() ? null : transportUsername)
                .password(transportPassword == null || transportPassword.isBlank() ? null : transportPassword)
                .qos(transportQos)
                .keepAliveSeconds(transportKeepAliveS)
                .connectTimeoutSeconds(transportConnectTimeoutS)
                .reconnectInitialBackoff(Duration.ofMillis(transportReconnectInitialMs))
                .reconnectMaxBackoff(Duration.ofMillis(transportReconnectMaxMs))
                .build();
    }
}

package com.toolstock.notifier.consumer;

import com.toolstock.notifier.config.NotifierConfig;
import com.toolstock.notifier.model.SendJob;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.common.errors.WakeupException;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Kafka consumer loop feeding send jobs to the {@link JobProcessor}.
 *
 * <h2>Offset management</h2>
 * Offsets are committed <em>after</em> the whole batch was processed
 * (at-least-once). A crash between send and commit re-sends the batch.
 * Batches are kept small ({@code max-poll-records}) because every job may
 * wait out the rate limit delay.
 *
 * <h2>Error handling</h2>
 * <ul>
 *   <li>Malformed JSON: logged and skipped (offset committed).</li>
 *   <li>Per-job failures are typed outcomes, they never reach this loop.</li>
 *   <li>{@link WakeupException}: clean shutdown signal from {@link #shutdown()}.</li>
 * </ul>
 */
public class SendJobConsumer implements Runnable, AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(SendJobConsumer.class);
    private static final Duration POLL_TIMEOUT = Duration.ofMillis(500);

    private final Consumer<String, String> consumer;
    private final JobProcessor             processor;
    private final String                   topic;
    private final AtomicBoolean            running = new AtomicBoolean(false);

    private long totalReceived  = 0L;
    private long totalMalformed = 0L;

    public SendJobConsumer(final NotifierConfig config, final JobProcessor processor) {
        this(new KafkaConsumer<>(buildKafkaProperties(config)), processor, config.getJobsTopic());
    }

    public SendJobConsumer(final Consumer<String, String> consumer, final JobProcessor processor, final String topic) {
        this.consumer  = consumer;
        this.processor = processor;
        this.topic     = topic;
    }

    @Override
    public void run() {
        running.set(true);
        consumer.subscribe(List.of(topic));
        LOG.info("Send job consumer started, subscribed to {}", topic);

        try {
            while (running.get()) {
                final ConsumerRecords<String, String> records = consumer.poll(POLL_TIMEOUT);

                for (final ConsumerRecord<String, String> record : records) {
                    processRecord(record);
                }

                if (!records.isEmpty()) {
                    consumer.commitSync();
                }
            }
        } catch (WakeupException e) {
            if (running.get()) {
                LOG.error("Unexpected WakeupException while still running", e);
            } else {
                LOG.debug("Consumer woken up for shutdown");
            }
        } catch (Exception e) {
            LOG.error("Fatal error in consumer loop", e);
        } finally {
            running.set(false);
            consumer.close();
            LOG.info("Consumer closed. Stats: received={} malformed={} {}",
                    totalReceived, totalMalformed, processor.statsLine());
        }
    }

    /** Signal the consumer loop to stop on the next poll boundary. */
    public void shutdown() {
        running.set(false);
        consumer.wakeup();
        LOG.info("Shutdown signal sent to send job consumer");
    }

    public boolean isRunning() {
        return running.get();
    }

    @Override
    public void close() {
        shutdown();
    }

    private void processRecord(final ConsumerRecord<String, String> record) {
        totalReceived++;
        final SendJob job;
        try {
            job = SendJob.fromJson(record.value());
        } catch (IllegalArgumentException e) {
            LOG.error("Malformed send job JSON, skipping. partition={} offset={} error={}",
                    record.partition(), record.offset(), e.getMessage());
            totalMalformed++;
            return;
        }
        processor.process(job);
    }

    public long getTotalReceived()  { return totalReceived; }
    public long getTotalMalformed() { return totalMalformed; }

    static Properties buildKafkaProperties(final NotifierConfig cfg) {
        final Properties props = new Properties();
        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG,     cfg.getBootstrapServers());
        props.put(ConsumerConfig.GROUP_ID_CONFIG,              cfg.getConsumerGroupId());
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG,     cfg.getAutoOffsetReset());
        props.put(ConsumerConfig.MAX_POLL_RECORDS_CONFIG,      cfg.getMaxPollRecords());
        props.put(ConsumerConfig.MAX_POLL_INTERVAL_MS_CONFIG,  cfg.getMaxPollIntervalMs());
        props.put(ConsumerConfig.SESSION_TIMEOUT_MS_CONFIG,    cfg.getSessionTimeoutMs());
        props.put(ConsumerConfig.HEARTBEAT_INTERVAL_MS_CONFIG, cfg.getHeartbeatIntervalMs());
        // Manual offset commit: we commit after processing, not before
        props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, "false");
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        return props;
    }
}

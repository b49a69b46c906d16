package com.toolstock.notifier.consumer;

import com.toolstock.notifier.config.NotifierConfig;
import com.toolstock.notifier.model.JobOutcome;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.serialization.StringSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Properties;

/**
 * {@code outcomes.sink = kafka}: publishes each {@link JobOutcome} as JSON to
 * the outcomes topic, keyed by job id so that outcomes of one job stay ordered.
 */
public class KafkaOutcomeSink implements OutcomeSink {

    private static final Logger LOG = LoggerFactory.getLogger(KafkaOutcomeSink.class);

    private final Producer<String, String> producer;
    private final String                   topic;

    public KafkaOutcomeSink(final NotifierConfig config) {
        this(new KafkaProducer<>(buildKafkaProperties(config)), config.getOutcomesTopic());
    }

    public KafkaOutcomeSink(final Producer<String, String> producer, final String topic) {
        this.producer = producer;
        this.topic    = topic;
    }

    @Override
    public void publish(final JobOutcome outcome) {
        final ProducerRecord<String, String> record =
                new ProducerRecord<>(topic, outcome.getJobId(), outcome.toJson());
        producer.send(record, (metadata, error) -> {
            if (error != null) {
                LOG.error("Failed to publish outcome for job {}: {}", outcome.getJobId(), error.getMessage());
            } else {
                LOG.debug("Outcome for job {} published to {}-{}@{}",
                        outcome.getJobId(), metadata.topic(), metadata.partition(), metadata.offset());
            }
        });
    }

    @Override
    public void close() {
        producer.flush();
        producer.close();
    }

    static Properties buildKafkaProperties(final NotifierConfig cfg) {
        final Properties props = new Properties();
        props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, cfg.getBootstrapServers());
        props.put(ProducerConfig.ACKS_CONFIG, "all");
        props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, "true");
        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
        props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
        return props;
    }
}

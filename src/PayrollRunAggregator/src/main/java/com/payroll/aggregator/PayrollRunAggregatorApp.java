package com.payroll.aggregator;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.payroll.engine.model.PayrollTotals;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.*;
import java.util.stream.Collectors;

public class PayrollRunAggregatorApp {

    private static final Logger log = LoggerFactory.getLogger(PayrollRunAggregatorApp.class);
    private static final ObjectMapper mapper = new ObjectMapper();
    private static final long RESTART_DELAY_MS = 30_000;

    static final String PAYSLIPS_TOPIC = "employee-payslips";
    static final String RUN_TOTALS_TOPIC = "payroll-run-totals";

    // In-memory state
    static final PayrollRunAggregator aggregator = new PayrollRunAggregator();

    private static volatile boolean shuttingDown = false;

    public static void main(String[] args) {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown hook fired, signaling graceful shutdown...");
            shuttingDown = true;
        }));

        while (!shuttingDown) {
            boolean shouldRestart = runOnce();
            if (!shouldRestart) {
                break;
            }
            log.info("Will restart in {} seconds...", RESTART_DELAY_MS / 1000);
            try {
                Thread.sleep(RESTART_DELAY_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (shuttingDown) {
                break;
            }
            log.info("Restarting Payroll Run Aggregator...");
        }

        log.info("Payroll Run Aggregator exited");
    }

    private static boolean runOnce() {
        // Clear stale in-memory state from any previous run
        aggregator.clear();

        String bootstrapServers = envOrDefault("KAFKA_BOOTSTRAP_SERVERS", "localhost:29092");
        String groupId = envOrDefault("APPLICATION_ID", "payroll-run-aggregator");

        try {
            // Rebuild per-run state from everything already committed
            prescan(bootstrapServers);

            try (KafkaConsumer<String, String> consumer = new KafkaConsumer<>(consumerConfig(bootstrapServers, groupId, true));
                 KafkaProducer<String, String> producer = new KafkaProducer<>(producerConfig(bootstrapServers))) {

                consumer.subscribe(Collections.singletonList(PAYSLIPS_TOPIC));
                log.info("Payroll Run Aggregator started, subscribed to [{}]", PAYSLIPS_TOPIC);

                while (!shuttingDown) {
                    ConsumerRecords<String, String> records = consumer.poll(Duration.ofSeconds(1));
                    for (ConsumerRecord<String, String> record : records) {
                        try {
                            String runId = aggregator.apply(record.key(), record.value());
                            if (runId != null) {
                                produceRunTotals(runId, producer);
                            }
                        } catch (Exception e) {
                            log.error("Error processing record from {}: {}", record.topic(), e.getMessage(), e);
                        }
                    }
                }
            }

            return false; // graceful shutdown
        } catch (Exception e) {
            log.error("Payroll Run Aggregator failed: {}", e.getMessage(), e);
            return true; // restart
        }
    }

    /**
     * Pre-scan the payslips topic from the beginning to rebuild in-memory state.
     * Uses a temporary consumer group with manual partition assignment.
     */
    private static void prescan(String bootstrapServers) {
        log.info("Pre-scanning {} to rebuild in-memory state...", PAYSLIPS_TOPIC);

        String prescanGroup = "run-aggregator-prescan-" + System.currentTimeMillis();
        try (KafkaConsumer<String, String> consumer =
                 new KafkaConsumer<>(consumerConfig(bootstrapServers, prescanGroup, false))) {
            List<TopicPartition> partitions = new ArrayList<>();
            try {
                partitions.addAll(
                    consumer.partitionsFor(PAYSLIPS_TOPIC).stream()
                        .map(pi -> new TopicPartition(pi.topic(), pi.partition()))
                        .collect(Collectors.toList())
                );
            } catch (Exception e) {
                log.warn("Topic {} not available for pre-scan: {}", PAYSLIPS_TOPIC, e.getMessage());
            }

            if (partitions.isEmpty()) {
                log.info("No partitions available for pre-scan, starting fresh");
                return;
            }

            consumer.assign(partitions);
            consumer.seekToBeginning(partitions);

            Map<TopicPartition, Long> endOffsets = consumer.endOffsets(partitions);
            int payslipCount = 0, skipped = 0;

            while (!caughtUp(consumer, partitions, endOffsets)) {
                ConsumerRecords<String, String> records = consumer.poll(Duration.ofSeconds(5));
                for (ConsumerRecord<String, String> record : records) {
                    try {
                        aggregator.apply(record.key(), record.value());
                        payslipCount++;
                    } catch (Exception e) {
                        skipped++;
                        log.debug("Skipping unparseable payslip at offset {}: {}", record.offset(), e.getMessage());
                    }
                }
            }

            log.info("Pre-scan complete: {} payslip records, {} skipped, {} runs in state",
                payslipCount, skipped, aggregator.runCount());
        } catch (Exception e) {
            log.warn("Pre-scan failed (starting with empty state): {}", e.getMessage());
        }
    }

    private static boolean caughtUp(KafkaConsumer<String, String> consumer, List<TopicPartition> partitions,
                                    Map<TopicPartition, Long> endOffsets) {
        for (TopicPartition tp : partitions) {
            if (consumer.position(tp) < endOffsets.get(tp)) {
                return false;
            }
        }
        return true;
    }

    static Properties consumerConfig(String bootstrapServers, String groupId, boolean autoCommit) {
        Properties props = new Properties();
        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ConsumerConfig.GROUP_ID_CONFIG, groupId);
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");
        props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, String.valueOf(autoCommit));
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        return props;
    }

    static Properties producerConfig(String bootstrapServers) {
        Properties props = new Properties();
        props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
        props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
        // Run totals for one run must not be reordered by retries
        props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, "true");
        return props;
    }

    /**
     * Produce the run's current totals to payroll-run-totals, or a tombstone once the run is empty.
     */
    private static void produceRunTotals(String runId, KafkaProducer<String, String> producer) throws Exception {
        PayrollTotals totals = aggregator.totalsFor(runId);
        if (totals == null) {
            producer.send(new ProducerRecord<>(RUN_TOTALS_TOPIC, runId, null));
            producer.flush();
            log.info("Payroll run has no payslips, tombstone sent: {}", runId);
            return;
        }

        producer.send(new ProducerRecord<>(RUN_TOTALS_TOPIC, runId, mapper.writeValueAsString(totals)));
        producer.flush();

        log.info("Run totals produced: run={}, employees={}, gross={}, net={}",
            runId, totals.getEmployeeCount(), totals.getTotalGrossEarnings(), totals.getTotalNetPay());
    }

    private static String envOrDefault(String key, String defaultValue) {
        String value = System.getenv(key);
        return value != null ? value : defaultValue;
    }
}

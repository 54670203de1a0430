package com.payroll.processor;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.payroll.engine.payslip.PayslipAssembler;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.serialization.Serdes;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.streams.KafkaStreams;
import org.apache.kafka.streams.StreamsConfig;
import org.apache.kafka.streams.Topology;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.CountDownLatch;
import java.util.stream.Collectors;

public class PayslipApp {

    private static final Logger log = LoggerFactory.getLogger(PayslipApp.class);

    static final String TAX_RULES_TOPIC = "tax-rules";
    static final String PAYSLIP_REQUESTS_TOPIC = "payslip-requests";
    static final String PAYSLIPS_TOPIC = "employee-payslips";

    public static void main(String[] args) {
        Properties props = buildConfig();
        String appId = props.getProperty(StreamsConfig.APPLICATION_ID_CONFIG);
        String bootstrapServers = props.getProperty(StreamsConfig.BOOTSTRAP_SERVERS_CONFIG);

        // Rules and YTD figures are held in memory, so every start replays both
        // input topics from the earliest offset to rebuild them.
        ConsumerGroupReset.reset(appId, bootstrapServers);

        TaxRuleStore ruleStore = new TaxRuleStore();
        YtdLedger ytdLedger = new YtdLedger();

        // Load every rule before any request is processed. The two input topics are
        // partitioned differently, so during replay a request can otherwise reach
        // the processor ahead of the rule it depends on.
        prescanTaxRules(bootstrapServers, ruleStore);

        Topology topology = buildTopology(ruleStore, ytdLedger, new PayslipAssembler());
        log.info("Topology:\n{}", topology.describe());

        KafkaStreams streams = new KafkaStreams(topology, props);
        streams.cleanUp();

        CountDownLatch latch = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down...");
            streams.close();
            latch.countDown();
        }));

        try {
            streams.start();
            log.info("Payslip Processor started");
            latch.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Read the tax-rules topic from the beginning into the rule store.
     */
    private static void prescanTaxRules(String bootstrapServers, TaxRuleStore ruleStore) {
        ObjectMapper mapper = new ObjectMapper();
        Properties props = new Properties();
        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ConsumerConfig.GROUP_ID_CONFIG, "payslip-prescan-" + System.currentTimeMillis());
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");
        props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, "false");
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());

        try (KafkaConsumer<String, String> consumer = new KafkaConsumer<>(props)) {
            List<TopicPartition> partitions = consumer.partitionsFor(TAX_RULES_TOPIC)
                .stream()
                .map(pi -> new TopicPartition(pi.topic(), pi.partition()))
                .collect(Collectors.toList());
            consumer.assign(partitions);
            consumer.seekToBeginning(partitions);

            Map<TopicPartition, Long> endOffsets = consumer.endOffsets(partitions);
            int totalRecords = 0;
            int skipped = 0;

            while (!caughtUp(consumer, partitions, endOffsets)) {
                ConsumerRecords<String, String> records = consumer.poll(Duration.ofSeconds(5));
                for (ConsumerRecord<String, String> record : records) {
                    totalRecords++;
                    if (record.value() == null) continue;
                    try {
                        PayslipProcessor.applyTaxRule(ruleStore, mapper.readTree(record.value()));
                    } catch (Exception e) {
                        skipped++;
                        log.debug("Skipping unparseable tax rule at offset {}: {}", record.offset(), e.getMessage());
                    }
                }
            }

            log.info("Pre-scan complete: {} records scanned, {} skipped, {} rules loaded",
                totalRecords, skipped, ruleStore.size());
        } catch (Exception e) {
            log.warn("Pre-scan failed (rules will load as the topology replays): {}", e.getMessage());
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

    static Topology buildTopology(TaxRuleStore ruleStore, YtdLedger ytdLedger, PayslipAssembler assembler) {
        Topology topology = new Topology();

        // Sources
        topology.addSource("tax-rules-source",
            Serdes.String().deserializer(), Serdes.String().deserializer(),
            TAX_RULES_TOPIC);

        topology.addSource("payslip-requests-source",
            Serdes.String().deserializer(), Serdes.String().deserializer(),
            PAYSLIP_REQUESTS_TOPIC);

        // Processors, one per source
        topology.addProcessor("tax-rules-processor",
            () -> new PayslipProcessor(PayslipProcessor.TAX_RULES_SOURCE, ruleStore, ytdLedger, assembler),
            "tax-rules-source");

        topology.addProcessor("payslip-requests-processor",
            () -> new PayslipProcessor(PayslipProcessor.PAYSLIP_REQUESTS_SOURCE, ruleStore, ytdLedger, assembler),
            "payslip-requests-source");

        // Sink
        topology.addSink("payslips-sink",
            PAYSLIPS_TOPIC,
            Serdes.String().serializer(), Serdes.String().serializer(),
            "payslip-requests-processor");

        return topology;
    }

    private static Properties buildConfig() {
        Properties props = new Properties();
        props.put(StreamsConfig.APPLICATION_ID_CONFIG,
            envOrDefault("APPLICATION_ID", "payslip-processor"));
        props.put(StreamsConfig.BOOTSTRAP_SERVERS_CONFIG,
            envOrDefault("KAFKA_BOOTSTRAP_SERVERS", "localhost:29092"));
        props.put(StreamsConfig.DEFAULT_KEY_SERDE_CLASS_CONFIG,
            Serdes.StringSerde.class.getName());
        props.put(StreamsConfig.DEFAULT_VALUE_SERDE_CLASS_CONFIG,
            Serdes.StringSerde.class.getName());
        // Single thread keeps YTD ledger updates for one employee in request order
        props.put(StreamsConfig.NUM_STREAM_THREADS_CONFIG, 1);
        props.put(StreamsConfig.COMMIT_INTERVAL_MS_CONFIG, 1000);
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");
        return props;
    }

    private static String envOrDefault(String key, String defaultValue) {
        String value = System.getenv(key);
        return value != null ? value : defaultValue;
    }
}

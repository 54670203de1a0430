package com.payroll.aggregator;

import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;

class PayrollRunAggregatorAppTest {

    @Test
    void mainConsumerCommitsAndStartsFromEarliest() {
        Properties props = PayrollRunAggregatorApp.consumerConfig("broker:9092", "payroll-run-aggregator", true);

        assertThat(props.getProperty(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG)).isEqualTo("broker:9092");
        assertThat(props.getProperty(ConsumerConfig.GROUP_ID_CONFIG)).isEqualTo("payroll-run-aggregator");
        assertThat(props.getProperty(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG)).isEqualTo("earliest");
        assertThat(props.getProperty(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG)).isEqualTo("true");
        assertThat(props.getProperty(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG))
            .isEqualTo(StringDeserializer.class.getName());
        assertThat(props.getProperty(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG))
            .isEqualTo(StringDeserializer.class.getName());
    }

    @Test
    void prescanConsumerNeverCommits() {
        Properties props = PayrollRunAggregatorApp.consumerConfig("broker:9092", "run-aggregator-prescan-1", false);

        assertThat(props.getProperty(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG)).isEqualTo("false");
        assertThat(props.getProperty(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG)).isEqualTo("earliest");
    }

    @Test
    void producerWritesStringsIdempotently() {
        Properties props = PayrollRunAggregatorApp.producerConfig("broker:9092");

        assertThat(props.getProperty(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG)).isEqualTo("broker:9092");
        assertThat(props.getProperty(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG))
            .isEqualTo(StringSerializer.class.getName());
        assertThat(props.getProperty(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG))
            .isEqualTo(StringSerializer.class.getName());
        assertThat(props.getProperty(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG)).isEqualTo("true");
    }
}

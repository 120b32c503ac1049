package com.skycaster.forecast.ledger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.header.internals.RecordHeader;
import org.springframework.kafka.core.KafkaTemplate;

import java.nio.charset.StandardCharsets;

/**
 * Publishes ledger records as JSON, keyed by request id. Delivery failures are
 * logged and counted only.
 */
@Slf4j
@RequiredArgsConstructor
public class KafkaRequestLedger implements RequestLedger {

    private static final String EVENT_TYPE = "WEATHER_REQUEST_RECORDED";

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;
    private final String topic;

    @Override
    public void record(WeatherRequestRecord record) {
        try {
            ProducerRecord<String, String> producerRecord =
                    new ProducerRecord<>(topic, record.getRequestId(), objectMapper.writeValueAsString(record));
            producerRecord.headers().add(new RecordHeader("event-type", EVENT_TYPE.getBytes(StandardCharsets.UTF_8)));

            kafkaTemplate.send(producerRecord).whenComplete((result, ex) -> {
                if (ex == null) {
                    meterRegistry.counter("skycaster.ledger.records", "outcome", "published").increment();
                    log.debug("Ledger record {} published to {}", record.getRequestId(), topic);
                } else {
                    meterRegistry.counter("skycaster.ledger.records", "outcome", "failed").increment();
                    log.error("Failed to publish ledger record {} to {}", record.getRequestId(), topic, ex);
                }
            });

        } catch (JsonProcessingException e) {
            meterRegistry.counter("skycaster.ledger.records", "outcome", "failed").increment();
            log.error("Failed to serialize ledger record {}", record.getRequestId(), e);
        } catch (RuntimeException e) {
            meterRegistry.counter("skycaster.ledger.records", "outcome", "failed").increment();
            log.error("Failed to send ledger record {} to {}", record.getRequestId(), topic, e);
        }
    }
}

package dk.trustworks.payroll.cache;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.instrumentation.annotations.WithSpan;
import io.smallrye.reactive.messaging.annotations.Blocking;
import io.smallrye.reactive.messaging.kafka.api.IncomingKafkaRecordMetadata;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.jbosslog.JBossLog;
import org.eclipse.microprofile.reactive.messaging.Acknowledgment;
import org.eclipse.microprofile.reactive.messaging.Incoming;
import org.eclipse.microprofile.reactive.messaging.Message;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletionStage;

/**
 * Listens to row-change notifications from the database and evicts the affected caches.
 *
 * <p>Payload: {@code {"table": "payroll_items", "filter": {"payroll_id": "..."}}}. Notifications
 * only refresh caches and never drive business logic, so unreadable payloads are logged and
 * acknowledged.
 */
@JBossLog
@ApplicationScoped
public class TableChangeConsumer {

    static final String CHANNEL = "payroll-table-changes";

    @Inject
    CacheInvalidationManager invalidationManager;

    @Inject
    MeterRegistry registry;

    private final ObjectMapper mapper = new ObjectMapper();

    @Incoming(CHANNEL)
    @Acknowledgment(Acknowledgment.Strategy.MANUAL)
    @WithSpan("consumer.payroll-table-changes")
    @Blocking
    public CompletionStage<Void> onMessage(Message<String> msg) {
        Optional<IncomingKafkaRecordMetadata> meta = msg.getMetadata(IncomingKafkaRecordMetadata.class);
        String topic = meta.map(IncomingKafkaRecordMetadata::getTopic).orElse(CHANNEL);
        long offset = meta.map(IncomingKafkaRecordMetadata::getOffset).orElse(-1L);
        try {
            TableChange change = parse(msg.getPayload());
            if (change == null) {
                log.warnf("Change notification without table; ack. topic=%s offset=%d", topic, offset);
                registry.counter("kafka.consumer.messages", "result", "skipped", "channel", CHANNEL).increment();
                return msg.ack();
            }
            boolean handled = invalidationManager.onTableChange(change.table(), change.filter());
            log.debugf("Processed change notification table=%s handled=%s topic=%s offset=%d",
                    change.table(), handled, topic, offset);
            registry.counter("kafka.consumer.messages", "result", "success", "channel", CHANNEL).increment();
            return msg.ack();
        } catch (Exception e) {
            registry.counter("kafka.consumer.messages", "result", "error", "channel", CHANNEL).increment();
            log.errorf(e, "Unreadable change notification; ack. topic=%s offset=%d", topic, offset);
            return msg.ack();
        }
    }

    TableChange parse(String json) throws Exception {
        if (json == null || json.isBlank()) {
            return null;
        }
        JsonNode root = mapper.readTree(json);
        JsonNode table = root.get("table");
        if (table == null || table.isNull() || table.asText().isBlank()) {
            return null;
        }
        JsonNode filterNode = root.get("filter");
        Map<String, Object> filter = filterNode == null || filterNode.isNull()
                ? Map.of()
                : mapper.convertValue(filterNode, new TypeReference<Map<String, Object>>() { });
        return new TableChange(table.asText(), filter);
    }

    record TableChange(String table, Map<String, Object> filter) {
    }
}

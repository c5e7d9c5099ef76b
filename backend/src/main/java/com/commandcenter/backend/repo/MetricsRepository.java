package com.commandcenter.backend.repo;

import com.commandcenter.backend.domain.Metrics;
import com.commandcenter.backend.domain.MetricsPatch;
import com.commandcenter.backend.domain.Timestamps;
import com.commandcenter.backend.service.storage.JsonCollectionStore;
import com.commandcenter.backend.service.storage.PersistentDocument;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Singleton metrics document. Patches merge field by field and always stamp token_usage.last_updated.
 */
@Component
public class MetricsRepository {

    public static final String KEY = "metrics";
    private static final TypeReference<Metrics> TYPE = new TypeReference<>() {};

    private final PersistentDocument<Metrics> doc;
    private final ObjectMapper om;
    private final Clock clock;

    public MetricsRepository(JsonCollectionStore store, ObjectMapper om, Clock clock) {
        this.doc = new PersistentDocument<>(store, KEY, TYPE, Metrics::new);
        this.om = om;
        this.clock = clock;
    }

    public Metrics get() {
        return doc.read();
    }

    public Metrics patch(MetricsPatch patch) {
        return doc.update(m -> {
            if (patch.hasProvider()) m.setProvider(patch.provider());
            if (patch.hasModel()) m.setModel(patch.model());

            Metrics.TokenUsage usage = m.tokenUsage();
            if (patch.hasPremiumRemaining()) usage.setPremiumRemaining(patch.premiumRemaining());
            if (patch.hasChatRemaining()) usage.setChatRemaining(patch.chatRemaining());
            if (patch.tokenUsage() != null) {
                try {
                    om.updateValue(usage, patch.tokenUsage());
                } catch (JsonMappingException e) {
                    throw new IllegalArgumentException("invalid token_usage: " + e.getOriginalMessage(), e);
                }
            }
            usage.setLastUpdated(Timestamps.now(clock));
            return m;
        });
    }
}

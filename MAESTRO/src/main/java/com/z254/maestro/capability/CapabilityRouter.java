package com.z254.maestro.capability;

import com.z254.maestro.config.MaestroProperties;
import com.z254.maestro.domain.message.MessageType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Maps task categories to the capabilities they need and capabilities to the message type
 * their workers are dispatched with.
 */
@Slf4j
@Component
public class CapabilityRouter {

    private final Map<String, List<String>> categoryCapabilities;
    private final Map<String, String> messageTypes;

    public CapabilityRouter(MaestroProperties properties) {
        this.categoryCapabilities = properties.getRouting().getCategoryCapabilities();
        this.messageTypes = properties.getRouting().getMessageTypes();
    }

    /**
     * Capabilities for a category: the configured list, else the category name itself.
     */
    public List<String> capabilitiesFor(String category) {
        if (category == null || category.isBlank()) {
            return new ArrayList<>();
        }
        List<String> configured = categoryCapabilities.get(category);
        if (configured != null && !configured.isEmpty()) {
            return new ArrayList<>(configured);
        }
        return new ArrayList<>(List.of(category));
    }

    /**
     * Dispatch type for a capability, {@link MessageType#EXECUTE_TASK} unless configured otherwise.
     */
    public MessageType dispatchTypeFor(String capability) {
        String topic = messageTypes.get(capability);
        if (topic == null) {
            return MessageType.EXECUTE_TASK;
        }
        return MessageType.fromTopic(topic)
                .filter(MessageType::isDispatch)
                .orElseGet(() -> {
                    log.warn("Ignoring non-dispatch message type {} configured for {}", topic, capability);
                    return MessageType.EXECUTE_TASK;
                });
    }
}

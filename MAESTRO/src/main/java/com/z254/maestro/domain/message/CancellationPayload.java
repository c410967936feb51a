package com.z254.maestro.domain.message;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import static com.z254.maestro.domain.message.MessagePayload.hasText;
import static com.z254.maestro.domain.message.MessagePayload.require;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CancellationPayload implements MessagePayload {

    private String taskId;
    private String stepId;
    private String reason;

    @Override
    public void validate() {
        require(hasText(taskId), "cancellation requires taskId");
    }
}

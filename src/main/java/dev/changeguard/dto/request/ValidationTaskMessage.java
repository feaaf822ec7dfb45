package dev.changeguard.dto.request;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/** Queue message asking a worker to process one change. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ValidationTaskMessage(String changeId, String changeNumber) {

    public boolean isValid() {
        return changeId != null && !changeId.isBlank();
    }
}

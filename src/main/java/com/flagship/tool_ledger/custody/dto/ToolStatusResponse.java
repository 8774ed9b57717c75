package com.flagship.tool_ledger.custody.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.tool_ledger.inventory.Tool;
import com.flagship.tool_ledger.inventory.ToolStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Instant status of a tool: read from the item document, no history query involved.
 */
@Value
@Builder
public class ToolStatusResponse {

    @JsonProperty("id")
    String id;

    @JsonProperty("unique_id")
    String uniqueId;

    @JsonProperty("name")
    String name;

    @JsonProperty("brand")
    String brand;

    @JsonProperty("model")
    String model;

    @JsonProperty("status")
    ToolStatus status;

    @JsonProperty("current_holder_uid")
    String currentHolderUid;

    @JsonProperty("last_assigned_to_name")
    String lastAssignedToName;

    @JsonProperty("last_assigned_to_job_code")
    String lastAssignedToJobCode;

    @JsonProperty("last_assigned_by_name")
    String lastAssignedByName;

    @JsonProperty("last_assigned_at")
    Instant lastAssignedAt;

    @JsonProperty("last_checkin_at")
    Instant lastCheckinAt;

    @JsonProperty("last_checkin_by_name")
    String lastCheckinByName;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static ToolStatusResponse from(Tool tool) {
        return ToolStatusResponse.builder()
            .id(tool.getId())
            .uniqueId(tool.getUniqueId())
            .name(tool.getName())
            .brand(tool.getBrand())
            .model(tool.getModel())
            .status(tool.getStatus())
            .currentHolderUid(tool.getCurrentHolderRef())
            .lastAssignedToName(tool.getLastAssignedToName())
            .lastAssignedToJobCode(tool.getLastAssignedToJobCode())
            .lastAssignedByName(tool.getLastAssignedByName())
            .lastAssignedAt(tool.getLastAssignedAt())
            .lastCheckinAt(tool.getLastCheckinAt())
            .lastCheckinByName(tool.getLastCheckinByName())
            .updatedAt(tool.getUpdatedAt())
            .build();
    }
}

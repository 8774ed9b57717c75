package com.flagship.tool_ledger.inventory.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.tool_ledger.inventory.Staff;
import com.flagship.tool_ledger.inventory.StaffRole;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class StaffResponse {

    @JsonProperty("uid")
    String uid;

    @JsonProperty("full_name")
    String fullName;

    @JsonProperty("job_code")
    String jobCode;

    @JsonProperty("role")
    StaffRole role;

    @JsonProperty("active")
    boolean active;

    @JsonProperty("assigned_item_ids")
    List<String> assignedItemIds;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static StaffResponse from(Staff staff) {
        return StaffResponse.builder()
            .uid(staff.getUid())
            .fullName(staff.getFullName())
            .jobCode(staff.getJobCode())
            .role(staff.getRole())
            .active(staff.isActive())
            .assignedItemIds(staff.getAssignedItemIds())
            .updatedAt(staff.getUpdatedAt())
            .build();
    }
}

package com.flagship.tool_ledger.history;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Names captured when the entry was written, so history stays readable after
 * staff or items are renamed.
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class EntryMetadata {
    String staffName;
    String staffJobCode;
    String itemName;
    String adminName;
}

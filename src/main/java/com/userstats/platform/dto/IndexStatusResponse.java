package com.userstats.platform.dto;

import com.userstats.platform.model.IndexCapability;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IndexStatusResponse {
    private String indexName;
    private IndexCapability capability;
    private boolean buildTriggered;
}

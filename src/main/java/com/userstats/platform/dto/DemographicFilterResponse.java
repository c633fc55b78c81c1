package com.userstats.platform.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.userstats.platform.model.FilteredUser;
import com.userstats.platform.service.QueryService;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DemographicFilterResponse {
    private List<FilteredUser> users;
    private QueryService.FilterPath path;

    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private Instant retrievedAt;
}

package buildinghealth.domain.dto.sample;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record DashboardSnapshotDTO(
        @JsonProperty("recent_data") List<ResultViewDTO> recentData,
        @JsonProperty("anomalies") List<ResultViewDTO> anomalies
) {}

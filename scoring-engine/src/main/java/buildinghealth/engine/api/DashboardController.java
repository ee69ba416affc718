package buildinghealth.engine.api;

import buildinghealth.config.ApiRoutes;
import buildinghealth.domain.dto.sample.DashboardSnapshotDTO;
import buildinghealth.engine.scoring.RecentResultsBuffer;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
@Tag(name = "Panel", description = "Datos recientes y registro de anomalías para la UI")
public class DashboardController {

    private final RecentResultsBuffer recentResults;

    @GetMapping(ApiRoutes.DATA)
    @Operation(summary = "Últimas lecturas clasificadas y anomalías recientes")
    public DashboardSnapshotDTO getData() {
        return recentResults.snapshot();
    }
}

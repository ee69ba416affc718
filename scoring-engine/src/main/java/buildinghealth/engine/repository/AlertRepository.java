package buildinghealth.engine.repository;

import buildinghealth.domain.dto.alert.AlertStatus;
import buildinghealth.engine.entity.AlertEntity;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;

@Repository
public interface AlertRepository extends JpaRepository<AlertEntity, String> {

    List<AlertEntity> findByStatusIn(Collection<AlertStatus> statuses);

    Page<AlertEntity> findByTimestampBetween(LocalDateTime start, LocalDateTime end, Pageable pageable);
}

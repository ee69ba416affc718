package buildinghealth.engine.entity;

import buildinghealth.domain.dto.alert.AlertSeverity;
import buildinghealth.domain.dto.alert.AlertStatus;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.Map;

/**
 * Alerta persistida por cada muestra clasificada como anómala.
 */
@Entity
@Table(name = "alerts", indexes = {
        @Index(name = "idx_alerts_timestamp", columnList = "timestamp"),
        @Index(name = "idx_alerts_status", columnList = "status")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString
public class AlertEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(length = 36)
    private String id;

    @Column(nullable = false, length = 128)
    private String sourceId;

    @Column(nullable = false)
    private LocalDateTime timestamp;

    /** Instante de la lectura que disparó la alerta. */
    @Column(nullable = false)
    private Instant sampleTimestamp;

    @Column(nullable = false)
    @Enumerated(EnumType.STRING)
    private AlertSeverity severity;

    @Column(nullable = false)
    @Enumerated(EnumType.STRING)
    private AlertStatus status;

    @Column(nullable = false)
    private String message;

    private double score;

    private double threshold;

    private long modelVersion;

    @JdbcTypeCode(SqlTypes.JSON)
    private Map<String, Double> metrics;

    @PrePersist
    protected void onCreate() {
        if (this.timestamp == null) {
            this.timestamp = LocalDateTime.now();
        }
        if (this.status == null) {
            this.status = AlertStatus.NEW;
        }
    }
}

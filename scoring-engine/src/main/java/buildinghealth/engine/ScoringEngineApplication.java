package buildinghealth.engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Punto de entrada del motor de puntuación.
 * <p>
 * Arranca la API de ingesta, carga (o entrena) el modelo y, con
 * {@code --health.training.run-once=true}, entrena una vez y sale con el código del resultado.
 */
@SpringBootApplication(scanBasePackages = "buildinghealth")
@EnableScheduling
public class ScoringEngineApplication {

    public static void main(String[] args) {
        // El puerto se puede configurar vía args: --server.port=9090
        SpringApplication.run(ScoringEngineApplication.class, args);
    }
}

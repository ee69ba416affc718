package buildinghealth.engine.service;

import buildinghealth.domain.model.ClassificationResult;
import buildinghealth.domain.sample.Sample;
import buildinghealth.engine.scoring.RecentResultsBuffer;
import buildinghealth.engine.scoring.ResultListener;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

/**
 * Difunde cada resultado a los suscriptores de {@code /topic/results}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LiveFeedPublisher implements ResultListener {

    public static final String RESULTS_TOPIC = "/topic/results";

    private final SimpMessagingTemplate messagingTemplate;

    @Override
    public void onResult(Sample sample, ClassificationResult result) {
        try {
            messagingTemplate.convertAndSend(RESULTS_TOPIC, RecentResultsBuffer.toView(sample, result));
        } catch (MessagingException e) {
            log.warn("No se pudo difundir el resultado de '{}': {}", sample.sourceId(), e.getMessage());
        }
    }
}

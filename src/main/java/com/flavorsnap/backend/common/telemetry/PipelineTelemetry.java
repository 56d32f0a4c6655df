package com.flavorsnap.backend.common.telemetry;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 每個 pipeline 事件一行 key=value log（rid / actor 由 MDC 帶出）
 */
@Slf4j
@Service
public class PipelineTelemetry {

    public void categorySubmitted(String categoryId, String submittedBy, int imageCount) {
        log.info("pipeline_event event=category_submitted categoryId={} submittedBy={} images={}",
                safe(categoryId), safe(submittedBy), imageCount);
    }

    public void voteCast(String categoryId, String voterId, String voteType, String outcome, int votesUp, int votesDown) {
        log.info("pipeline_event event=vote_cast categoryId={} voterId={} voteType={} outcome={} votesUp={} votesDown={}",
                safe(categoryId), safe(voterId), safe(voteType), safe(outcome), votesUp, votesDown);
    }

    public void categoryModerated(String categoryId, String moderatorId, String status) {
        log.info("pipeline_event event=category_moderated categoryId={} moderatorId={} status={}",
                safe(categoryId), safe(moderatorId), safe(status));
    }

    public void trainingJobEnqueued(String jobId, String categoryId) {
        log.info("pipeline_event event=training_job_enqueued jobId={} categoryId={}", safe(jobId), safe(categoryId));
    }

    public void trainingStatusUpdated(String jobId, String from, String to, String errorMessage) {
        if ("FAILED".equals(to)) {
            log.warn("pipeline_event event=training_status_updated jobId={} from={} to={} error={}",
                    safe(jobId), safe(from), safe(to), safe(errorMessage));
            return;
        }
        log.info("pipeline_event event=training_status_updated jobId={} from={} to={}", safe(jobId), safe(from), safe(to));
    }

    public void predictionRecorded(String predictionId, String label, double confidence) {
        log.info("pipeline_event event=prediction_recorded predictionId={} label={} confidence={}",
                safe(predictionId), safe(label), confidence);
    }

    private static String safe(String s) { return (s == null || s.isBlank()) ? "NA" : s; }
}

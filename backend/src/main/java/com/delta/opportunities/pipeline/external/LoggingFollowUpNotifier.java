package com.delta.opportunities.pipeline.external;

import com.delta.opportunities.pipeline.model.FollowUpTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class LoggingFollowUpNotifier implements FollowUpNotifier {
    private static final Logger log = LoggerFactory.getLogger(LoggingFollowUpNotifier.class);

    @Override
    public void notify(FollowUpTask task) {
        log.info("Follow-up {} due for application {} at {}", task.kind(), task.applicationId(), task.dueAt());
    }
}

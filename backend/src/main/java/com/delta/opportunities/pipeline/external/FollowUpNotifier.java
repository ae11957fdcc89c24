package com.delta.opportunities.pipeline.external;

import com.delta.opportunities.pipeline.model.FollowUpTask;

public interface FollowUpNotifier {

    void notify(FollowUpTask task);
}

package com.delta.opportunities.pipeline.external;

import com.delta.opportunities.pipeline.model.WeightAdjustmentSignal;

public interface LearningSink {

    void publish(WeightAdjustmentSignal signal);
}

package com.delta.opportunities.pipeline.error;

import com.delta.opportunities.pipeline.model.ApplicationState;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.CONFLICT)
public class IllegalStateTransitionException extends RuntimeException {
    private final ApplicationState currentState;

    public IllegalStateTransitionException(long applicationId, ApplicationState currentState, String action) {
        super("Application " + applicationId + " cannot " + action + " from state " + currentState);
        this.currentState = currentState;
    }

    public ApplicationState getCurrentState() {
        return currentState;
    }
}

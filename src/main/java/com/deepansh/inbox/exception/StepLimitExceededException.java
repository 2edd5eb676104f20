package com.deepansh.inbox.exception;

import com.deepansh.inbox.model.AgentTurn;

import java.util.List;

/** Fatal to the run only. Carries the partial history for the report. */
public class StepLimitExceededException extends AgentException {

    private final int stepLimit;
    private final List<AgentTurn> turns;

    public StepLimitExceededException(int stepLimit, List<AgentTurn> turns) {
        super("Step limit of " + stepLimit + " reached before the task finished");
        this.stepLimit = stepLimit;
        this.turns = List.copyOf(turns);
    }

    public int getStepLimit() {
        return stepLimit;
    }

    public List<AgentTurn> getTurns() {
        return turns;
    }
}

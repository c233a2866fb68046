package me.golemcore.graph.domain.loop;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.Getter;
import me.golemcore.graph.domain.model.RunError;
import me.golemcore.graph.domain.model.RunStatus;

/**
 * Mutable state machine of one run, owned exclusively by the run loop.
 *
 * <p>
 * {@code step} grows by one per processed decision; {@code controlEpoch} grows
 * only when a route hands control to a different agent.
 */
@Getter
public class RunState {

    private String currentAgentKey;
    private int step;
    private int controlEpoch;
    private RunStatus status = RunStatus.RUNNING;
    private Object finalPayload;
    private RunError error;
    private int consecutiveToolFailures;

    public RunState(String startAgentKey) {
        this.currentAgentKey = startAgentKey;
    }

    public void advanceStep() {
        requireRunning();
        step++;
    }

    /**
     * Moves control to {@code targetAgentKey}.
     *
     * @return true if control changed hands (and a new epoch started)
     */
    public boolean routeTo(String targetAgentKey) {
        requireRunning();
        if (targetAgentKey.equals(currentAgentKey)) {
            return false;
        }
        currentAgentKey = targetAgentKey;
        controlEpoch++;
        return true;
    }

    public int recordToolFailure() {
        return ++consecutiveToolFailures;
    }

    public void resetToolFailures() {
        consecutiveToolFailures = 0;
    }

    public void complete(Object payload) {
        requireRunning();
        finalPayload = payload;
        status = RunStatus.DONE;
    }

    public void fail(RunError runError) {
        requireRunning();
        error = runError;
        status = RunStatus.FAILED;
    }

    public boolean isRunning() {
        return status == RunStatus.RUNNING;
    }

    private void requireRunning() {
        if (status != RunStatus.RUNNING) {
            throw new IllegalStateException("Run already finished with status " + status);
        }
    }
}

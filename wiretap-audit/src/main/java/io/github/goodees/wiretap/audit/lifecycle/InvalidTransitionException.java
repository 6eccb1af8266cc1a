package io.github.goodees.wiretap.audit.lifecycle;

/*-
 * #%L
 * wiretap
 * %%
 * Copyright (C) 2026 The Wiretap Authors
 * %%
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * #L%
 */

/**
 * Signal has no edge from the current stage of a request.
 */
public class InvalidTransitionException extends Exception {
    private final LifecycleState.Stage stage;
    private final LifecycleSignal.Kind signal;

    public InvalidTransitionException(LifecycleState.Stage stage, LifecycleSignal.Kind signal) {
        super(describe(stage, signal));
        this.stage = stage;
        this.signal = signal;
    }

    public LifecycleState.Stage getStage() {
        return stage;
    }

    public LifecycleSignal.Kind getSignal() {
        return signal;
    }

    /**
     * Human readable reason why a signal is not accepted in a stage.
     * @param stage current stage
     * @param signal the signal
     * @return the reason
     */
    public static String describe(LifecycleState.Stage stage, LifecycleSignal.Kind signal) {
        switch (stage) {
            case COMPLETED:
            case FAILED:
                return "Request already " + stage.name().toLowerCase() + ", cannot accept " + signal;
            default:
                break;
        }
        switch (signal) {
            case RECEIVED:
                return "Request already received";
            case FORWARDED:
                return stage == LifecycleState.Stage.NOT_STARTED ? "Cannot forward request that was not received"
                        : "Request already forwarded";
            case RESPONSE:
                return stage == LifecycleState.Stage.RESPONSE_RECEIVED ? "Response already received"
                        : "Cannot receive response to request that was not forwarded";
            case RETURNED:
                return "Cannot return response that was not received";
            default:
                return "Signal " + signal + " is not accepted in stage " + stage;
        }
    }
}

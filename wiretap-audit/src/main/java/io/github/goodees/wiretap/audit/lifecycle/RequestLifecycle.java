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

import io.github.goodees.wiretap.audit.lifecycle.LifecycleSignal.Kind;
import io.github.goodees.wiretap.audit.lifecycle.LifecycleState.Stage;

import java.time.Instant;

/**
 * State machine of a request:
 *
 * <pre>
 * NOT_STARTED -RECEIVED-> RECEIVED -FORWARDED-> FORWARDED -RESPONSE-> RESPONSE_RECEIVED -any-> COMPLETED
 * any non terminal stage -FAILURE|CANCELLATION-> FAILED
 * </pre>
 *
 * <p>RESPONSE_RECEIVED is completed by whatever signal comes next, including activity of other requests in the
 * session. A RETURNED signal, when the proxy reports delivery to client, completes it explicitly.
 * {@link #settle(LifecycleState)} reads a request that got its response as completed.
 *
 * <p>{@link #transition(LifecycleState, LifecycleSignal)} is total: signals without an edge leave the state
 * unchanged. The guarded operations throw {@link InvalidTransitionException} instead.
 */
public final class RequestLifecycle {
    private RequestLifecycle() {

    }

    public static LifecycleState transition(LifecycleState state, LifecycleSignal signal) {
        Stage stage = state.getStage();
        if (stage.isTerminal()) {
            return state;
        }
        Instant at = signal.getAt();
        switch (signal.getKind()) {
            case FAILURE:
            case CANCELLATION:
                return state.failed(at, signal.getReason().orElse(signal.getKind().name().toLowerCase()));
            default:
                break;
        }
        if (stage == Stage.RESPONSE_RECEIVED) {
            return state.completed(at);
        }
        if (hasEdge(stage, signal.getKind())) {
            switch (signal.getKind()) {
                case RECEIVED:
                    return state.received(at);
                case FORWARDED:
                    return state.forwarded(at);
                case RESPONSE:
                    return state.responseReceived(at);
                default:
                    break;
            }
        }
        return state;
    }

    /**
     * Whether the signal has a declared edge from current stage. Commands record signals without an edge as
     * diagnostics. Implicit completion of RESPONSE_RECEIVED is not a declared edge.
     * @param state current state
     * @param kind the signal
     * @return true if signal is accepted
     */
    public static boolean accepts(LifecycleState state, Kind kind) {
        return hasEdge(state.getStage(), kind);
    }

    private static boolean hasEdge(Stage stage, Kind kind) {
        if (stage.isTerminal()) {
            return false;
        }
        switch (kind) {
            case FAILURE:
            case CANCELLATION:
                return true;
            case RECEIVED:
                return stage == Stage.NOT_STARTED;
            case FORWARDED:
                return stage == Stage.RECEIVED;
            case RESPONSE:
                return stage == Stage.FORWARDED;
            case RETURNED:
                return stage == Stage.RESPONSE_RECEIVED;
            default:
                return false;
        }
    }

    /**
     * Observable final state of a request.
     * @param state folded state
     * @return the state, with RESPONSE_RECEIVED read as COMPLETED at the time of response
     */
    public static LifecycleState settle(LifecycleState state) {
        if (state.getStage() == Stage.RESPONSE_RECEIVED) {
            return state.completed(state.getRespondedAt().orElse(null));
        }
        return state;
    }

    public static LifecycleState apply(LifecycleState state, LifecycleSignal signal)
            throws InvalidTransitionException {
        if (!accepts(state, signal.getKind())) {
            throw new InvalidTransitionException(state.getStage(), signal.getKind());
        }
        return transition(state, signal);
    }

    public static LifecycleState receive(LifecycleState state, Instant at) throws InvalidTransitionException {
        return apply(state, LifecycleSignal.of(Kind.RECEIVED, at));
    }

    public static LifecycleState forward(LifecycleState state, Instant at) throws InvalidTransitionException {
        return apply(state, LifecycleSignal.of(Kind.FORWARDED, at));
    }

    public static LifecycleState respond(LifecycleState state, Instant at) throws InvalidTransitionException {
        return apply(state, LifecycleSignal.of(Kind.RESPONSE, at));
    }

    public static LifecycleState complete(LifecycleState state, Instant at) throws InvalidTransitionException {
        return apply(state, LifecycleSignal.of(Kind.RETURNED, at));
    }

    public static LifecycleState fail(LifecycleState state, Instant at, String reason)
            throws InvalidTransitionException {
        return apply(state, LifecycleSignal.failure(at, reason));
    }
}

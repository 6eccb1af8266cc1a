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
import org.junit.Test;

import java.time.Instant;
import java.util.UUID;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class RequestLifecycleTest {
    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

    private final LifecycleState initial = LifecycleState.notStarted(UUID.randomUUID());

    private static Instant at(int seconds) {
        return T0.plusSeconds(seconds);
    }

    private LifecycleState responded() throws InvalidTransitionException {
        LifecycleState state = RequestLifecycle.receive(initial, at(0));
        state = RequestLifecycle.forward(state, at(1));
        return RequestLifecycle.respond(state, at(2));
    }

    @Test
    public void happy_path_records_every_timestamp() throws InvalidTransitionException {
        LifecycleState state = RequestLifecycle.complete(responded(), at(3));

        assertEquals(Stage.COMPLETED, state.getStage());
        assertEquals(at(0), state.getReceivedAt().get());
        assertEquals(at(1), state.getForwardedAt().get());
        assertEquals(at(2), state.getRespondedAt().get());
        assertEquals(at(3), state.getFinishedAt().get());
        assertFalse(state.getFailureReason().isPresent());
        assertTrue(state.isTerminal());
        assertEquals(initial.getRequestId(), state.getRequestId());
    }

    @Test
    public void transitions_do_not_modify_previous_state() throws InvalidTransitionException {
        LifecycleState received = RequestLifecycle.receive(initial, at(0));

        assertEquals(Stage.NOT_STARTED, initial.getStage());
        assertFalse(initial.getReceivedAt().isPresent());
        assertEquals(Stage.RECEIVED, received.getStage());
    }

    @Test
    public void failure_is_accepted_from_every_non_terminal_stage() throws InvalidTransitionException {
        LifecycleState received = RequestLifecycle.receive(initial, at(0));
        LifecycleState forwarded = RequestLifecycle.forward(received, at(1));
        LifecycleState responded = RequestLifecycle.respond(forwarded, at(2));
        for (LifecycleState state : new LifecycleState[]{initial, received, forwarded, responded}) {
            LifecycleState failed = RequestLifecycle.fail(state, at(5), "upstream timeout");
            assertEquals(Stage.FAILED, failed.getStage());
            assertEquals("upstream timeout", failed.getFailureReason().get());
            assertEquals(at(5), failed.getFinishedAt().get());
            assertEquals(state.getReceivedAt(), failed.getReceivedAt());
        }
    }

    @Test
    public void cancellation_fails_the_request() throws InvalidTransitionException {
        LifecycleState state = RequestLifecycle.receive(initial, at(0));
        state = RequestLifecycle.apply(state, LifecycleSignal.cancellation(at(1), "client went away"));

        assertEquals(Stage.FAILED, state.getStage());
        assertEquals("client went away", state.getFailureReason().get());
    }

    @Test
    public void failure_without_reason_names_the_signal() {
        LifecycleState state = RequestLifecycle.transition(initial, LifecycleSignal.cancellation(at(0), null));

        assertEquals("cancellation", state.getFailureReason().get());
    }

    @Test
    public void terminal_states_absorb_every_signal() throws InvalidTransitionException {
        LifecycleState completed = RequestLifecycle.complete(responded(), at(3));
        LifecycleState failed = RequestLifecycle.fail(initial, at(3), "boom");
        for (LifecycleState terminal : new LifecycleState[]{completed, failed}) {
            for (Kind kind : Kind.values()) {
                assertSame(terminal, RequestLifecycle.transition(terminal, LifecycleSignal.of(kind, at(10))));
                assertFalse(RequestLifecycle.accepts(terminal, kind));
            }
        }
    }

    @Test
    public void out_of_order_signals_leave_state_unchanged() throws InvalidTransitionException {
        assertSame(initial, RequestLifecycle.transition(initial, LifecycleSignal.of(Kind.FORWARDED, at(0))));
        assertSame(initial, RequestLifecycle.transition(initial, LifecycleSignal.of(Kind.RESPONSE, at(0))));
        assertSame(initial, RequestLifecycle.transition(initial, LifecycleSignal.of(Kind.OTHER, at(0))));

        LifecycleState received = RequestLifecycle.receive(initial, at(0));
        assertSame(received, RequestLifecycle.transition(received, LifecycleSignal.of(Kind.RECEIVED, at(1))));
        assertSame(received, RequestLifecycle.transition(received, LifecycleSignal.of(Kind.RESPONSE, at(1))));
    }

    @Test
    public void any_signal_completes_a_received_response() throws InvalidTransitionException {
        LifecycleState state = RequestLifecycle.transition(responded(), LifecycleSignal.of(Kind.OTHER, at(7)));

        assertEquals(Stage.COMPLETED, state.getStage());
        assertEquals(at(7), state.getFinishedAt().get());
    }

    @Test
    public void implicit_completion_is_not_a_declared_edge() throws InvalidTransitionException {
        LifecycleState state = responded();

        assertTrue(RequestLifecycle.accepts(state, Kind.RETURNED));
        assertTrue(RequestLifecycle.accepts(state, Kind.FAILURE));
        assertFalse(RequestLifecycle.accepts(state, Kind.OTHER));
        assertFalse(RequestLifecycle.accepts(state, Kind.RESPONSE));
    }

    @Test
    public void settle_reads_received_response_as_completed() throws InvalidTransitionException {
        LifecycleState settled = RequestLifecycle.settle(responded());

        assertEquals(Stage.COMPLETED, settled.getStage());
        assertEquals(at(2), settled.getFinishedAt().get());
    }

    @Test
    public void settle_keeps_other_stages() throws InvalidTransitionException {
        LifecycleState forwarded = RequestLifecycle.forward(RequestLifecycle.receive(initial, at(0)), at(1));

        assertSame(initial, RequestLifecycle.settle(initial));
        assertSame(forwarded, RequestLifecycle.settle(forwarded));
    }

    @Test
    public void duplicate_receive_is_rejected() throws InvalidTransitionException {
        LifecycleState received = RequestLifecycle.receive(initial, at(0));
        try {
            RequestLifecycle.receive(received, at(1));
            fail("Duplicate receive should be rejected");
        } catch (InvalidTransitionException e) {
            assertEquals(Stage.RECEIVED, e.getStage());
            assertEquals(Kind.RECEIVED, e.getSignal());
            assertThat(e.getMessage(), is("Request already received"));
        }
    }

    @Test
    public void forward_before_receive_is_rejected() {
        try {
            RequestLifecycle.forward(initial, at(0));
            fail("Forward before receive should be rejected");
        } catch (InvalidTransitionException e) {
            assertThat(e.getMessage(), is("Cannot forward request that was not received"));
        }
    }

    @Test
    public void response_before_forward_is_rejected() throws InvalidTransitionException {
        LifecycleState received = RequestLifecycle.receive(initial, at(0));
        try {
            RequestLifecycle.respond(received, at(1));
            fail("Response before forward should be rejected");
        } catch (InvalidTransitionException e) {
            assertThat(e.getMessage(), is("Cannot receive response to request that was not forwarded"));
        }
    }

    @Test
    public void return_before_response_is_rejected() throws InvalidTransitionException {
        LifecycleState received = RequestLifecycle.receive(initial, at(0));
        try {
            RequestLifecycle.complete(received, at(1));
            fail("Return before response should be rejected");
        } catch (InvalidTransitionException e) {
            assertThat(e.getMessage(), is("Cannot return response that was not received"));
        }
    }

    @Test
    public void completed_request_cannot_fail() throws InvalidTransitionException {
        LifecycleState completed = RequestLifecycle.complete(responded(), at(3));
        try {
            RequestLifecycle.fail(completed, at(4), "late error");
            fail("Completed request should not fail");
        } catch (InvalidTransitionException e) {
            assertEquals(Stage.COMPLETED, e.getStage());
            assertThat(e.getMessage(), is("Request already completed, cannot accept FAILURE"));
        }
    }
}

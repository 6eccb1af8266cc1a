package io.github.goodees.wiretap.projection;

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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.github.goodees.wiretap.core.EventIds;
import io.github.goodees.wiretap.core.StoredEvent;
import io.github.goodees.wiretap.core.StreamId;
import io.github.goodees.wiretap.immutables.events.DepositedEvent;
import io.github.goodees.wiretap.immutables.events.LedgerEvent;
import io.github.goodees.wiretap.immutables.events.WithdrawnEvent;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Balance per account, as a projection state that survives JSON.
 */
public final class Balances {
    private final Map<String, Integer> accounts;

    @JsonCreator
    public Balances(@JsonProperty("accounts") Map<String, Integer> accounts) {
        this.accounts = Collections.unmodifiableMap(new TreeMap<>(accounts));
    }

    public static Balances empty() {
        return new Balances(Collections.emptyMap());
    }

    public static Balances apply(Balances state, StoredEvent<LedgerEvent> event) {
        LedgerEvent payload = event.getPayload();
        if (payload instanceof DepositedEvent) {
            return state.with(payload.getAccount(), ((DepositedEvent) payload).getAmount());
        }
        if (payload instanceof WithdrawnEvent) {
            return state.with(payload.getAccount(), -((WithdrawnEvent) payload).getAmount());
        }
        return state;
    }

    public static StoredEvent<LedgerEvent> stored(long position, LedgerEvent payload) {
        return new StoredEvent<>(StreamId.of("account", payload.getAccount()), EventIds.next(), position, position,
                Instant.ofEpochSecond(1_700_000_000L + position), payload, Collections.emptyMap());
    }

    Balances with(String account, int delta) {
        Map<String, Integer> copy = new TreeMap<>(accounts);
        copy.merge(account, delta, Integer::sum);
        return new Balances(copy);
    }

    @JsonProperty("accounts")
    public Map<String, Integer> getAccounts() {
        return accounts;
    }

    public int balance(String account) {
        return accounts.getOrDefault(account, 0);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        return accounts.equals(((Balances) o).accounts);
    }

    @Override
    public int hashCode() {
        return accounts.hashCode();
    }

    @Override
    public String toString() {
        return "Balances" + accounts;
    }
}

package io.github.goodees.wiretap.audit.chain;

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
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Proof of integrity of an entry. The content hash covers the canonical payload and a nonce unique to the entry.
 */
@JsonInclude(JsonInclude.Include.NON_ABSENT)
public final class IntegrityProof {
    private final Hash256 contentHash;
    private final Hash256 previousEntryHash;
    private final long sequenceNumber;
    private final String timestampNonce;

    @JsonCreator
    public IntegrityProof(@JsonProperty("contentHash") Hash256 contentHash,
            @JsonProperty("previousEntryHash") Hash256 previousEntryHash,
            @JsonProperty("sequenceNumber") long sequenceNumber,
            @JsonProperty("timestampNonce") String timestampNonce) {
        this.contentHash = Objects.requireNonNull(contentHash, "Content hash must be specified");
        this.previousEntryHash = previousEntryHash;
        this.sequenceNumber = sequenceNumber;
        this.timestampNonce = Objects.requireNonNull(timestampNonce, "Nonce must be specified");
    }

    /**
     * Create proof for content at given position of a chain.
     * @param content canonical form of the payload
     * @param previousHash content hash of the previous entry, null for the first one
     * @param sequenceNumber position in the chain
     * @param now time of creation, part of the nonce
     * @return the proof
     */
    public static IntegrityProof create(String content, Hash256 previousHash, long sequenceNumber, Instant now) {
        String nonce = now + "_" + UUID.randomUUID();
        return new IntegrityProof(hash(content, nonce), previousHash, sequenceNumber, nonce);
    }

    private static Hash256 hash(String content, String nonce) {
        return Hash256.of(content + "_" + nonce);
    }

    /**
     * Check the proof against content.
     * @param content canonical form of the payload
     * @return true if the content is the one the proof was created for
     */
    public boolean verify(String content) {
        return contentHash.equals(hash(content, timestampNonce));
    }

    public Hash256 getContentHash() {
        return contentHash;
    }

    public Optional<Hash256> getPreviousEntryHash() {
        return Optional.ofNullable(previousEntryHash);
    }

    public long getSequenceNumber() {
        return sequenceNumber;
    }

    public String getTimestampNonce() {
        return timestampNonce;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        IntegrityProof that = (IntegrityProof) o;
        return sequenceNumber == that.sequenceNumber && contentHash.equals(that.contentHash)
                && Objects.equals(previousEntryHash, that.previousEntryHash)
                && timestampNonce.equals(that.timestampNonce);
    }

    @Override
    public int hashCode() {
        return Objects.hash(contentHash, previousEntryHash, sequenceNumber, timestampNonce);
    }

    @Override
    public String toString() {
        return "IntegrityProof[#" + sequenceNumber + " " + contentHash + "]";
    }
}

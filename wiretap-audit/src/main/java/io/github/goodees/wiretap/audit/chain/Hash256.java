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
import com.fasterxml.jackson.annotation.JsonValue;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Objects;

/**
 * SHA-256 digest in lowercase hex.
 */
public final class Hash256 {
    private static final int LENGTH = 64;

    private final String value;

    private Hash256(String value) {
        this.value = value;
    }

    public static Hash256 of(String content) {
        return of(content.getBytes(StandardCharsets.UTF_8));
    }

    public static Hash256 of(byte[] content) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] hash = md.digest(content);
            StringBuilder hexString = new StringBuilder(LENGTH);
            for (byte b : hash) {
                String hex = Integer.toHexString(0xff & b);
                if (hex.length() == 1) {
                    hexString.append('0');
                }
                hexString.append(hex);
            }
            return new Hash256(hexString.toString());
        } catch (NoSuchAlgorithmException e) {
            // every JRE has to provide SHA-256
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    /**
     * Read hash from its textual form.
     * @param hex 64 hex digits
     * @return the hash
     * @throws IllegalArgumentException when value is not a SHA-256 hex digest
     */
    @JsonCreator
    public static Hash256 fromHex(String hex) {
        Objects.requireNonNull(hex, "Hash must be specified");
        String normalized = hex.toLowerCase();
        if (normalized.length() != LENGTH || !normalized.chars().allMatch(c -> Character.digit(c, 16) >= 0)) {
            throw new IllegalArgumentException("'" + hex + "' is not a SHA-256 hex digest");
        }
        return new Hash256(normalized);
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        return value.equals(((Hash256) o).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}

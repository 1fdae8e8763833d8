/*
 * Copyright 2026 Mark Andrew Ray-Smith
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
 */
package dev.mars.staffbook.identity;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;

/**
 * One-way password digest.
 * <p>
 * Lowercase hex SHA-256 of the UTF-8 bytes, unsalted, so digests already
 * present in {@code employees.json} keep verifying.
 */
public final class PasswordHasher {

    private static final String ALGORITHM = "SHA-256";

    /**
     * Returns the hex digest of {@code password}.
     */
    public String hash(String password) {
        Objects.requireNonNull(password, "password");
        byte[] digest = newDigest().digest(password.getBytes(StandardCharsets.UTF_8));
        return HexFormat.of().formatHex(digest);
    }

    /**
     * Returns true if {@code password} hashes to {@code digest}.
     */
    public boolean verify(String password, String digest) {
        if (password == null || digest == null) {
            return false;
        }
        return hash(password).equals(digest);
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance(ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            // Every JRE is required to ship SHA-256
            throw new IllegalStateException(ALGORITHM + " not available", e);
        }
    }
}

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

package me.golemcore.flow.domain.service;

import java.util.regex.Pattern;

/**
 * Normalization of correlation keys shared by every producer and consumer of
 * the webhook bridge. {@code "a/b/"}, {@code "/a/b"} and {@code "a//b"} all
 * address {@code "a/b"}.
 */
public final class CorrelationKeys {

    private static final Pattern REPEATED_SLASHES = Pattern.compile("/{2,}");

    private CorrelationKeys() {
    }

    public static String normalize(String key) {
        if (key == null) {
            throw new IllegalArgumentException("Correlation key must not be null");
        }
        String normalized = REPEATED_SLASHES.matcher(key.trim()).replaceAll("/");
        int start = 0;
        int end = normalized.length();
        while (start < end && normalized.charAt(start) == '/') {
            start++;
        }
        while (end > start && normalized.charAt(end - 1) == '/') {
            end--;
        }
        return normalized.substring(start, end);
    }

    /**
     * Key of the trigger node {@code nodeId} inside workflow
     * {@code workflowId}.
     */
    public static String of(String workflowId, String nodeId) {
        return normalize(workflowId + "/" + nodeId);
    }

    /**
     * First segment of a key, which by convention names the workflow.
     */
    public static String workflowIdOf(String key) {
        String normalized = normalize(key);
        int slash = normalized.indexOf('/');
        return slash < 0 ? normalized : normalized.substring(0, slash);
    }
}

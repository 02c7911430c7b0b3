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

package me.golemcore.flow.tools.mail;

import java.util.Locale;

/**
 * Connection security for the outgoing SMTP connection.
 */
public enum MailSecurity {

    /** Implicit TLS, usually port 465. */
    SSL,

    /** STARTTLS upgrade, usually port 587. */
    STARTTLS,

    NONE;

    /**
     * Parses {@code ssl}, {@code starttls} or {@code none}, ignoring case. Blank
     * means {@link #STARTTLS}.
     *
     * @throws IllegalArgumentException
     *             if the value is not recognized
     */
    public static MailSecurity fromString(String value) {
        if (value == null || value.isBlank()) {
            return STARTTLS;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}

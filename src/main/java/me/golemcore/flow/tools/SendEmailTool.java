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

package me.golemcore.flow.tools;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.mail.AuthenticationFailedException;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.Transport;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.flow.domain.model.ToolDefinition;
import me.golemcore.flow.domain.model.ToolResult;
import me.golemcore.flow.infrastructure.config.FlowProperties;
import me.golemcore.flow.tools.mail.MailSecurity;
import me.golemcore.flow.tools.mail.MailSessionFactory;

import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.regex.Pattern;

/**
 * Email tool ({@code send_email}) delivering over SMTP with Jakarta Mail.
 *
 * <p>
 * Unset connection settings fall back to {@code flow.tools.smtp.*}. The From
 * address is always the configured username.
 */
@Slf4j
@SuppressWarnings("PMD.ReplaceJavaUtilDate") // MimeMessage.setSentDate requires java.util.Date
public class SendEmailTool implements AgentTool {

    static final String NAME = "send_email";

    private static final String PARAM_TO = "to";
    private static final String PARAM_SUBJECT = "subject";
    private static final String PARAM_BODY = "body";
    private static final String PARAM_CC = "cc";
    private static final String PARAM_HTML = "html";
    private static final String TYPE = "type";
    private static final String TYPE_STRING = "string";
    private static final String DESCRIPTION = "description";
    private static final String SENT = "sent";

    static final Pattern EMAIL_PATTERN = Pattern.compile(
            "^[a-zA-Z0-9._%+\\-]+@[a-zA-Z0-9.\\-]+\\.[a-zA-Z]{2,}$");

    private final Settings settings;
    private final String host;
    private final int port;
    private final String username;
    private final String password;
    private final MailSecurity security;
    private final int connectTimeout;
    private final int readTimeout;

    public SendEmailTool(Settings settings, FlowProperties.SmtpToolProperties defaults) {
        this.settings = settings;
        this.host = firstNonBlank(settings.getHost(), defaults.getHost());
        this.port = settings.getPort() != null ? settings.getPort() : defaults.getPort();
        this.username = firstNonBlank(settings.getUsername(), defaults.getUsername());
        this.password = firstNonBlank(settings.getPassword(), defaults.getPassword());
        this.security = MailSecurity.fromString(firstNonBlank(settings.getSecurity(), defaults.getSecurity()));
        this.connectTimeout = defaults.getConnectTimeout();
        this.readTimeout = settings.getTimeout() != null && settings.getTimeout() > 0
                ? settings.getTimeout() * 1000
                : defaults.getReadTimeout();
    }

    @Override
    public ToolDefinition getDefinition() {
        String description = settings.getDescription() != null && !settings.getDescription().isBlank()
                ? settings.getDescription()
                : "Send emails. Recipients can be comma-separated.";
        return ToolDefinition.builder()
                .name(NAME)
                .description(description)
                .inputSchema(Map.of(
                        TYPE, "object",
                        "properties", Map.of(
                                PARAM_TO, Map.of(
                                        TYPE, TYPE_STRING,
                                        DESCRIPTION, "Recipient email addresses (comma-separated)"),
                                PARAM_SUBJECT, Map.of(
                                        TYPE, TYPE_STRING,
                                        DESCRIPTION, "Email subject"),
                                PARAM_BODY, Map.of(
                                        TYPE, TYPE_STRING,
                                        DESCRIPTION, "Email body"),
                                PARAM_CC, Map.of(
                                        TYPE, TYPE_STRING,
                                        DESCRIPTION, "CC recipients (comma-separated)"),
                                PARAM_HTML, Map.of(
                                        TYPE, "boolean",
                                        DESCRIPTION, "Send the body as HTML (default: false)")),
                        "required", List.of(PARAM_TO, PARAM_SUBJECT, PARAM_BODY)))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> arguments) {
        return CompletableFuture.supplyAsync(() -> {
            if (!settings.allowedOperations().contains("send")) {
                throw new ToolExecutionException("Operation 'send' is not allowed for " + NAME);
            }
            if (host == null || username == null) {
                throw new ToolExecutionException("SMTP host and username must be configured for " + NAME);
            }
            String to = requireText(arguments, PARAM_TO);
            String subject = requireText(arguments, PARAM_SUBJECT);
            String body = requireText(arguments, PARAM_BODY);
            String cc = arguments.get(PARAM_CC) instanceof String value && !value.isBlank() ? value : null;

            List<String> invalid = invalidAddresses(to);
            if (cc != null) {
                invalid.addAll(invalidAddresses(cc));
            }
            if (!invalid.isEmpty()) {
                String error = "Invalid email address: " + String.join(", ", invalid);
                return ToolResult.failure(error, failureData(error));
            }

            try {
                MimeMessage message = buildMessage(to, cc, subject, body,
                        Boolean.TRUE.equals(arguments.get(PARAM_HTML)));
                deliver(message);
                log.info("[Tool:{}] Email sent to {}", NAME, to);
                Map<String, Object> data = new LinkedHashMap<>();
                data.put(SENT, true);
                data.put(PARAM_TO, to);
                data.put(PARAM_SUBJECT, subject);
                return ToolResult.success("Email sent to " + to, data);
            } catch (AuthenticationFailedException e) {
                log.warn("[Tool:{}] SMTP authentication failed", NAME);
                String error = "SMTP authentication failed. Check username and password.";
                return ToolResult.failure(error, failureData(error));
            } catch (MessagingException e) {
                log.warn("[Tool:{}] SMTP error: {}", NAME, sanitize(e.getMessage()));
                String error = "SMTP error: " + sanitize(e.getMessage());
                return ToolResult.failure(error, failureData(error));
            }
        });
    }

    private MimeMessage buildMessage(String to, String cc, String subject, String body, boolean html)
            throws MessagingException {
        Session session = MailSessionFactory.createSmtpSession(host, port, username, password, security,
                connectTimeout, readTimeout);
        MimeMessage message = new MimeMessage(session);
        message.setFrom(new InternetAddress(username));
        message.setRecipients(Message.RecipientType.TO, InternetAddress.parse(to));
        if (cc != null) {
            message.setRecipients(Message.RecipientType.CC, InternetAddress.parse(cc));
        }
        message.setSubject(subject, "UTF-8");
        message.setContent(body, html ? "text/html; charset=UTF-8" : "text/plain; charset=UTF-8");
        message.setSentDate(new Date());
        return message;
    }

    protected void deliver(MimeMessage message) throws MessagingException {
        Transport.send(message);
    }

    static List<String> invalidAddresses(String recipients) {
        List<String> invalid = new ArrayList<>();
        for (String address : recipients.split(",")) {
            String trimmed = address.trim();
            if (!EMAIL_PATTERN.matcher(trimmed).matches()) {
                invalid.add(trimmed);
            }
        }
        return invalid;
    }

    private String sanitize(String message) {
        if (message == null) {
            return "Unknown error";
        }
        String sanitized = message;
        if (username != null) {
            sanitized = sanitized.replace(username, "***");
        }
        if (password != null) {
            sanitized = sanitized.replace(password, "***");
        }
        return sanitized;
    }

    private static Map<String, Object> failureData(String error) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("error", error);
        data.put(SENT, false);
        return data;
    }

    private static String requireText(Map<String, Object> arguments, String name) {
        if (arguments.get(name) instanceof String value && !value.isBlank()) {
            return value;
        }
        throw new ToolExecutionException("Missing required parameter: " + name);
    }

    private static String firstNonBlank(String first, String second) {
        if (first != null && !first.isBlank()) {
            return first;
        }
        return second != null && !second.isBlank() ? second : null;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Settings {
        private String description;
        private String host;
        private Integer port;
        private String username;
        private String password;
        private String security;
        private List<String> allowedOperations;
        private Integer timeout;

        List<String> allowedOperations() {
            if (allowedOperations == null || allowedOperations.isEmpty()) {
                return List.of("send");
            }
            return allowedOperations.stream().map(op -> op.toLowerCase(Locale.ROOT)).toList();
        }
    }
}

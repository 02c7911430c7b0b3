package me.golemcore.flow.tools;

import jakarta.mail.AuthenticationFailedException;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import me.golemcore.flow.domain.model.ToolResult;
import me.golemcore.flow.infrastructure.config.FlowProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SendEmailToolTest {

    private static final String USERNAME = "bot@example.com";
    private static final String PASSWORD = "hunter2";

    private FlowProperties.SmtpToolProperties defaults;

    @BeforeEach
    void setUp() {
        defaults = new FlowProperties.SmtpToolProperties();
        defaults.setHost("smtp.example.com");
        defaults.setUsername(USERNAME);
        defaults.setPassword(PASSWORD);
    }

    @Test
    void shouldSendPlainTextMessageFromConfiguredUser() throws Exception {
        RecordingTool tool = new RecordingTool(new SendEmailTool.Settings(), defaults, null);

        ToolResult result = tool.execute(Map.of(
                "to", "alice@example.com, bob@example.com",
                "subject", "Weekly report",
                "body", "All green",
                "cc", "carol@example.com")).get();

        assertTrue(result.isSuccess());
        assertEquals(true, ((Map<?, ?>) result.getData()).get("sent"));
        assertEquals(1, tool.sent.size());
        MimeMessage message = tool.sent.get(0);
        assertEquals(USERNAME, message.getFrom()[0].toString());
        assertEquals(2, message.getRecipients(Message.RecipientType.TO).length);
        assertEquals(1, message.getRecipients(Message.RecipientType.CC).length);
        assertEquals("Weekly report", message.getSubject());
    }

    @Test
    void shouldRejectInvalidAddressesWithoutSending() throws Exception {
        RecordingTool tool = new RecordingTool(new SendEmailTool.Settings(), defaults, null);

        ToolResult result = tool.execute(Map.of("to", "alice@example.com, not-an-address",
                "subject", "s", "body", "b")).get();

        assertFalse(result.isSuccess());
        assertEquals("Invalid email address: not-an-address", result.getError());
        assertTrue(tool.sent.isEmpty());
    }

    @Test
    void shouldReportAuthenticationFailure() throws Exception {
        RecordingTool tool = new RecordingTool(new SendEmailTool.Settings(), defaults,
                new AuthenticationFailedException("535 bad credentials for " + USERNAME));

        ToolResult result = tool.execute(Map.of("to", "a@example.com", "subject", "s", "body", "b")).get();

        assertFalse(result.isSuccess());
        assertEquals("SMTP authentication failed. Check username and password.", result.getError());
    }

    @Test
    void shouldMaskCredentialsInSmtpErrors() throws Exception {
        RecordingTool tool = new RecordingTool(new SendEmailTool.Settings(), defaults,
                new MessagingException("relay denied for " + USERNAME + " using " + PASSWORD));

        ToolResult result = tool.execute(Map.of("to", "a@example.com", "subject", "s", "body", "b")).get();

        assertFalse(result.isSuccess());
        assertEquals("SMTP error: relay denied for *** using ***", result.getError());
    }

    @Test
    void shouldRequireSubject() {
        RecordingTool tool = new RecordingTool(new SendEmailTool.Settings(), defaults, null);

        ExecutionException error = assertThrows(ExecutionException.class,
                () -> tool.execute(Map.of("to", "a@example.com", "body", "b")).get());

        assertEquals("Missing required parameter: subject", error.getCause().getMessage());
    }

    @Test
    void shouldFailWhenSmtpIsNotConfigured() {
        RecordingTool tool = new RecordingTool(new SendEmailTool.Settings(),
                new FlowProperties.SmtpToolProperties(), null);

        ExecutionException error = assertThrows(ExecutionException.class,
                () -> tool.execute(Map.of("to", "a@example.com", "subject", "s", "body", "b")).get());

        assertInstanceOf(ToolExecutionException.class, error.getCause());
    }

    @Test
    void shouldHonorAllowedOperations() {
        SendEmailTool.Settings settings = new SendEmailTool.Settings();
        settings.setAllowedOperations(List.of("read"));
        RecordingTool tool = new RecordingTool(settings, defaults, null);

        ExecutionException error = assertThrows(ExecutionException.class,
                () -> tool.execute(Map.of("to", "a@example.com", "subject", "s", "body", "b")).get());

        assertTrue(error.getCause().getMessage().contains("not allowed"));
    }

    @Test
    void shouldListInvalidAddresses() {
        assertEquals(List.of("x@", "@y.com"), SendEmailTool.invalidAddresses("ok@example.com, x@, @y.com"));
    }

    private static final class RecordingTool extends SendEmailTool {

        private final List<MimeMessage> sent = new ArrayList<>();
        private final MessagingException failure;

        RecordingTool(Settings settings, FlowProperties.SmtpToolProperties defaults, MessagingException failure) {
            super(settings, defaults);
            this.failure = failure;
        }

        @Override
        protected void deliver(MimeMessage message) throws MessagingException {
            if (failure != null) {
                throw failure;
            }
            sent.add(message);
        }
    }
}

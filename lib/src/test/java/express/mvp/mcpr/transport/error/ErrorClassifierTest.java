package express.mvp.mcpr.transport.error;

import static org.junit.jupiter.api.Assertions.*;

import express.mvp.mcpr.transport.TransportException;
import express.mvp.mcpr.transport.codec.DecodeException;
import java.io.EOFException;
import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link ErrorClassifier}. */
@DisplayName("ErrorClassifier")
class ErrorClassifierTest {

    @AfterEach
    void tearDown() {
        ErrorClassifier.removeClassifier(IllegalStateException.class);
    }

    @Nested
    @DisplayName("Built-in rules")
    class BuiltInTests {

        @Test
        @DisplayName("Null is UNKNOWN")
        void nullIsUnknown() {
            assertEquals(ErrorCategory.UNKNOWN, ErrorClassifier.classify(null));
        }

        @Test
        @DisplayName("Connection problems are NETWORK")
        void network() {
            assertEquals(
                    ErrorCategory.NETWORK, ErrorClassifier.classify(new ConnectException("x")));
            assertEquals(
                    ErrorCategory.NETWORK, ErrorClassifier.classify(new SocketException("x")));
            assertEquals(ErrorCategory.NETWORK, ErrorClassifier.classify(new EOFException()));
            assertEquals(
                    ErrorCategory.NETWORK,
                    ErrorClassifier.classify(new IOException("Broken pipe")));
        }

        @Test
        @DisplayName("Timeouts are TRANSIENT")
        void timeouts() {
            assertEquals(
                    ErrorCategory.TRANSIENT,
                    ErrorClassifier.classify(new SocketTimeoutException("read")));
            assertEquals(
                    ErrorCategory.TRANSIENT,
                    ErrorClassifier.classify(new HttpTimeoutException("request")));
        }

        @Test
        @DisplayName("Wire and credential problems are PROTOCOL")
        void protocol() {
            assertEquals(
                    ErrorCategory.PROTOCOL,
                    ErrorClassifier.classify(
                            new DecodeException(DecodeException.Kind.MALFORMED, "bad")));
            assertEquals(
                    ErrorCategory.PROTOCOL,
                    ErrorClassifier.classify(new AuthRejectedException("denied")));
            assertEquals(
                    ErrorCategory.PROTOCOL,
                    ErrorClassifier.classify(
                            new TransportException("unexpected content type text/html")));
        }

        @Test
        @DisplayName("A program that cannot be started is FATAL")
        void cannotRunProgram() {
            IOException cause =
                    new IOException("Cannot run program \"missing\": error=2, No such file");
            assertEquals(
                    ErrorCategory.FATAL,
                    ErrorClassifier.classify(new TransportException("spawn failed", cause)));
        }

        @Test
        @DisplayName("Causes are consulted when the wrapper says nothing")
        void followsCause() {
            TransportException wrapped =
                    new TransportException("open failed", new ConnectException("refused"));
            assertEquals(ErrorCategory.NETWORK, ErrorClassifier.classify(wrapped));
        }
    }

    @Nested
    @DisplayName("Custom classifiers")
    class CustomTests {

        @Test
        @DisplayName("Custom classifier wins over built-in rules")
        void customWins() {
            ErrorClassifier.registerClassifier(
                    IllegalStateException.class, t -> ErrorCategory.FATAL);
            assertEquals(
                    ErrorCategory.FATAL,
                    ErrorClassifier.classify(new IllegalStateException("connection reset")));
        }

        @Test
        @DisplayName("A null answer defers to built-in rules")
        void nullDefers() {
            ErrorClassifier.registerClassifier(IllegalStateException.class, t -> null);
            assertEquals(
                    ErrorCategory.NETWORK,
                    ErrorClassifier.classify(new IllegalStateException("connection reset")));
        }
    }

    @Test
    @DisplayName("describeError names category, type and cause")
    void describeError() {
        String text =
                ErrorClassifier.describeError(
                        new TransportException("open failed", new ConnectException("refused")));
        assertTrue(text.startsWith("NETWORK TransportException: open failed"), text);
        assertTrue(text.contains("ConnectException"), text);
    }
}

package express.mvp.mcpr.transport.error;

import express.mvp.mcpr.transport.codec.DecodeException;
import express.mvp.mcpr.transport.framing.FramingException;
import java.io.EOFException;
import java.io.IOException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.nio.channels.ClosedChannelException;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;
import javax.net.ssl.SSLException;

/**
 * Classifies exceptions into error categories for recovery decisions.
 *
 * <p>This classifier uses exception type matching first and message analysis second. Custom
 * classifiers can be registered for application-specific exceptions (for example the failure
 * type of a custom {@link express.mvp.mcpr.transport.Transport}).
 *
 * <h2>Classification Strategy</h2>
 *
 * <ol>
 *   <li>Check custom classifiers first (assignable type match)
 *   <li>Check for JVM errors and security violations
 *   <li>Check the exception type hierarchy
 *   <li>Analyze the exception message for patterns
 *   <li>Recurse into the cause, defaulting to UNKNOWN
 * </ol>
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * try {
 *     transport.open();
 * } catch (TransportException e) {
 *     ErrorCategory category = ErrorClassifier.classify(e);
 *     if (!category.isRetryable()) {
 *         stateMachine.transitionTo(ConnectionState.FAILED);
 *     }
 * }
 * }</pre>
 *
 * @see ErrorCategory
 */
public final class ErrorClassifier {

    /** Custom classifiers keyed by exception class. */
    private static final Map<Class<? extends Throwable>, Function<Throwable, ErrorCategory>>
            CUSTOM_CLASSIFIERS = new ConcurrentHashMap<>();

    private ErrorClassifier() {
        // Utility class
    }

    /**
     * Classifies an exception into an error category.
     *
     * @param throwable the exception to classify
     * @return the error category, never null
     */
    public static ErrorCategory classify(Throwable throwable) {
        if (throwable == null) {
            return ErrorCategory.UNKNOWN;
        }

        for (Map.Entry<Class<? extends Throwable>, Function<Throwable, ErrorCategory>> entry :
                CUSTOM_CLASSIFIERS.entrySet()) {
            if (entry.getKey().isInstance(throwable)) {
                ErrorCategory custom = entry.getValue().apply(throwable);
                if (custom != null) {
                    return custom;
                }
            }
        }

        if (throwable instanceof VirtualMachineError && !(throwable instanceof OutOfMemoryError)) {
            return ErrorCategory.FATAL;
        }
        if (throwable instanceof LinkageError || throwable instanceof SecurityException) {
            return ErrorCategory.FATAL;
        }

        if (throwable instanceof AuthRejectedException
                || throwable instanceof FramingException
                || throwable instanceof DecodeException) {
            return ErrorCategory.PROTOCOL;
        }

        if (isResourceError(throwable)) {
            return ErrorCategory.RESOURCE;
        }

        if (isTimeoutError(throwable)) {
            return ErrorCategory.TRANSIENT;
        }

        if (isNetworkError(throwable)) {
            return ErrorCategory.NETWORK;
        }

        if (throwable instanceof InterruptedException) {
            return ErrorCategory.TRANSIENT;
        }

        ErrorCategory messageCategory = classifyByMessage(throwable);
        if (messageCategory != null) {
            return messageCategory;
        }

        Throwable cause = throwable.getCause();
        if (cause != null && cause != throwable) {
            return classify(cause);
        }

        return ErrorCategory.UNKNOWN;
    }

    private static boolean isNetworkError(Throwable t) {
        if (t instanceof ConnectException) return true;
        if (t instanceof UnknownHostException) return true;
        if (t instanceof NoRouteToHostException) return true;
        if (t instanceof ClosedChannelException) return true;
        if (t instanceof SocketException) return true;
        if (t instanceof EOFException) return true;
        if (t instanceof SSLException) return true;

        if (t instanceof IOException) {
            String lower = lowerMessage(t);
            return lower.contains("connection")
                    || lower.contains("socket")
                    || lower.contains("stream closed")
                    || lower.contains("broken pipe");
        }
        return false;
    }

    private static boolean isTimeoutError(Throwable t) {
        if (t instanceof TimeoutException) return true;
        if (t instanceof SocketTimeoutException) return true;
        if (t instanceof HttpTimeoutException) return true;

        String lower = lowerMessage(t);
        return lower.contains("timeout") || lower.contains("timed out");
    }

    private static boolean isResourceError(Throwable t) {
        if (t instanceof OutOfMemoryError) return true;
        if (t instanceof RejectedExecutionException) return true;

        String lower = lowerMessage(t);
        return lower.contains("too many open files")
                || lower.contains("resource temporarily unavailable")
                || (lower.contains("resource") && lower.contains("exhaust"));
    }

    private static ErrorCategory classifyByMessage(Throwable t) {
        String lower = lowerMessage(t);
        if (lower.isEmpty()) {
            return null;
        }

        // A program that cannot be started will not start on retry
        if (lower.contains("cannot run program") || lower.contains("permission denied")) {
            return ErrorCategory.FATAL;
        }

        if (lower.contains("connection")
                && (lower.contains("reset")
                        || lower.contains("refused")
                        || lower.contains("closed")
                        || lower.contains("lost"))) {
            return ErrorCategory.NETWORK;
        }

        if (lower.contains("busy") || lower.contains("temporarily")) {
            return ErrorCategory.TRANSIENT;
        }

        if (lower.contains("malformed") || lower.contains("unexpected content type")) {
            return ErrorCategory.PROTOCOL;
        }

        return null;
    }

    private static String lowerMessage(Throwable t) {
        String msg = t.getMessage();
        return msg == null ? "" : msg.toLowerCase(Locale.ROOT);
    }

    /**
     * Registers a custom classifier for a specific exception type.
     *
     * <p>Custom classifiers are checked before built-in classification. A classifier that returns
     * {@code null} defers to the built-in rules.
     *
     * @param exceptionType the exception class to match (subclasses match too)
     * @param classifier function mapping a matching exception to its category
     * @param <T> the exception type
     */
    public static <T extends Throwable> void registerClassifier(
            Class<T> exceptionType, Function<Throwable, ErrorCategory> classifier) {
        CUSTOM_CLASSIFIERS.put(exceptionType, classifier);
    }

    /**
     * Removes a previously registered custom classifier.
     *
     * @param exceptionType the exception class
     */
    public static void removeClassifier(Class<? extends Throwable> exceptionType) {
        CUSTOM_CLASSIFIERS.remove(exceptionType);
    }

    /**
     * Returns a one-line description of the classification result, for log messages.
     *
     * @param throwable the exception to describe
     * @return formatted description including category and type
     */
    public static String describeError(Throwable throwable) {
        if (throwable == null) {
            return "null exception";
        }
        ErrorCategory category = classify(throwable);
        StringBuilder sb = new StringBuilder();
        sb.append(category.name())
                .append(' ')
                .append(throwable.getClass().getSimpleName())
                .append(": ")
                .append(throwable.getMessage());
        Throwable cause = throwable.getCause();
        if (cause != null) {
            sb.append(" (cause ")
                    .append(cause.getClass().getSimpleName())
                    .append(": ")
                    .append(cause.getMessage())
                    .append(')');
        }
        return sb.toString();
    }
}

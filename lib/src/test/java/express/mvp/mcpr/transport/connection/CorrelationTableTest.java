package express.mvp.mcpr.transport.connection;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.node.IntNode;
import express.mvp.mcpr.transport.error.CallCancelledException;
import express.mvp.mcpr.transport.error.CallTimeoutException;
import express.mvp.mcpr.transport.error.ConnectionResetException;
import express.mvp.mcpr.transport.message.Message;
import express.mvp.mcpr.transport.message.Notification;
import express.mvp.mcpr.transport.message.RequestId;
import express.mvp.mcpr.transport.message.Response;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link CorrelationTable}. */
@DisplayName("CorrelationTable")
class CorrelationTableTest {

    private static final long FAR = System.nanoTime() + TimeUnit.HOURS.toNanos(1);

    private CorrelationTable table;

    @BeforeEach
    void setUp() {
        table = new CorrelationTable("test");
    }

    private static Throwable failureOf(CompletableFuture<Message> reply) {
        ExecutionException e = assertThrows(ExecutionException.class, reply::get);
        return e.getCause();
    }

    @Nested
    @DisplayName("Completion")
    class CompletionTests {

        @Test
        @DisplayName("A reply completes its own call only")
        void replyMatchesId() throws Exception {
            CorrelationTable.Entry one = table.register(RequestId.of(1), "get", FAR);
            CorrelationTable.Entry two = table.register(RequestId.of(2), "list", FAR);

            assertTrue(table.complete(new Response(RequestId.of(2), IntNode.valueOf(2))));

            assertFalse(one.reply().isDone());
            assertEquals(IntNode.valueOf(2), ((Response) two.reply().get()).result());
            assertEquals(1, table.size());
        }

        @Test
        @DisplayName("Unmatched and anonymous replies are reported as unmatched")
        void unmatched() {
            assertFalse(table.complete(new Response(RequestId.of(9), IntNode.valueOf(0))));
            assertFalse(table.complete(new Notification("tick", null)));
        }

        @Test
        @DisplayName("Duplicate ids are rejected")
        void duplicateId() {
            table.register(RequestId.of(1), "get", FAR);
            assertThrows(
                    IllegalStateException.class,
                    () -> table.register(RequestId.of(1), "get", FAR));
        }
    }

    @Nested
    @DisplayName("Failure paths")
    class FailureTests {

        @Test
        @DisplayName("Cancel removes the entry and releases the caller")
        void cancel() {
            CorrelationTable.Entry entry = table.register(RequestId.of(1), "get", FAR);
            assertTrue(table.cancel(RequestId.of(1)));
            assertFalse(table.isPending(RequestId.of(1)));
            assertThrows(CallCancelledException.class, () -> entry.reply().get());
            assertFalse(table.cancel(RequestId.of(1)));
        }

        @Test
        @DisplayName("Expire fails only calls past their deadline")
        void expire() {
            long now = System.nanoTime();
            CorrelationTable.Entry late = table.register(RequestId.of(1), "get", now - 1);
            CorrelationTable.Entry fresh = table.register(RequestId.of(2), "get", FAR);

            assertEquals(1, table.expire(now));

            assertInstanceOf(CallTimeoutException.class, failureOf(late.reply()));
            assertFalse(fresh.reply().isDone());
            assertEquals(1, table.size());
        }

        @Test
        @DisplayName("A late reply after expiry does not resurrect the call")
        void lateReplyAfterExpiry() {
            long now = System.nanoTime();
            table.register(RequestId.of(1), "get", now - 1);
            table.expire(now);
            assertFalse(table.complete(new Response(RequestId.of(1), IntNode.valueOf(1))));
        }

        @Test
        @DisplayName("failSentBefore spares calls not yet written")
        void failSentBefore() {
            CorrelationTable.Entry written = table.register(RequestId.of(1), "get", FAR);
            CorrelationTable.Entry waiting = table.register(RequestId.of(2), "get", FAR);
            CorrelationTable.Entry current = table.register(RequestId.of(3), "get", FAR);
            table.markSent(RequestId.of(1), 1);
            table.markSent(RequestId.of(3), 2);

            int failed = table.failSentBefore(2, new ConnectionResetException("reset", null));

            assertEquals(1, failed);
            assertInstanceOf(ConnectionResetException.class, failureOf(written.reply()));
            assertEquals(-1, waiting.sentEpoch());
            assertFalse(waiting.reply().isDone());
            assertFalse(current.reply().isDone());
        }

        @Test
        @DisplayName("failAll empties the table")
        void failAll() {
            table.register(RequestId.of(1), "get", FAR);
            table.register(RequestId.of(2), "get", FAR);
            assertEquals(2, table.failAll(new IllegalStateException("closed")));
            assertEquals(0, table.size());
        }
    }
}

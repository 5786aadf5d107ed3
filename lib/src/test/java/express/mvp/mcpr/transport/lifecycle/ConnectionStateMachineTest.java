package express.mvp.mcpr.transport.lifecycle;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link ConnectionStateMachine}. */
@DisplayName("ConnectionStateMachine")
class ConnectionStateMachineTest {

    private ConnectionStateMachine machine;

    @BeforeEach
    void setUp() {
        machine = new ConnectionStateMachine("test-conn");
    }

    @Nested
    @DisplayName("Initial state")
    class InitialStateTests {

        @Test
        @DisplayName("Starts in INITIALIZING")
        void startsInitializing() {
            assertEquals(ConnectionState.INITIALIZING, machine.getState());
            assertEquals("test-conn", machine.getConnectionId());
        }

        @Test
        @DisplayName("toString includes connection ID and state")
        void toStringIncludesIdAndState() {
            String str = machine.toString();
            assertTrue(str.contains("test-conn"));
            assertTrue(str.contains("Initializing"));
        }
    }

    @Nested
    @DisplayName("Transitions")
    class TransitionTests {

        @Test
        @DisplayName("Full fault and recovery cycle")
        void faultAndRecovery() {
            assertTrue(machine.transitionTo(ConnectionState.ACTIVE, null));
            assertTrue(machine.transitionTo(ConnectionState.DEGRADED, new RuntimeException("x")));
            assertTrue(machine.transitionTo(ConnectionState.RECONNECTING, null));
            assertTrue(machine.transitionTo(ConnectionState.ACTIVE, null));
            assertEquals(ConnectionState.ACTIVE, machine.getState());
        }

        @Test
        @DisplayName("Degraded can recover in place")
        void degradedRecovers() {
            machine.transitionTo(ConnectionState.ACTIVE, null);
            machine.transitionTo(ConnectionState.DEGRADED, null);
            assertTrue(machine.transitionTo(ConnectionState.ACTIVE, null));
        }

        @Test
        @DisplayName("Active cannot jump straight to RECONNECTING")
        void activeToReconnectingInvalid() {
            machine.transitionTo(ConnectionState.ACTIVE, null);
            assertFalse(machine.transitionTo(ConnectionState.RECONNECTING, null));
            assertEquals(ConnectionState.ACTIVE, machine.getState());
        }

        @Test
        @DisplayName("Active cannot fail without reconnecting first")
        void activeToFailedInvalid() {
            machine.transitionTo(ConnectionState.ACTIVE, null);
            assertFalse(machine.transitionTo(ConnectionState.FAILED, null));
        }

        @Test
        @DisplayName("Self transitions are rejected")
        void selfTransitionRejected() {
            assertFalse(ConnectionStateMachine.isValidTransition(
                    ConnectionState.ACTIVE, ConnectionState.ACTIVE));
        }

        @Test
        @DisplayName("Terminal states allow nothing")
        void terminalStates() {
            assertTrue(machine.transitionTo(ConnectionState.CLOSED, null));
            for (ConnectionState target : ConnectionState.values()) {
                assertFalse(machine.transitionTo(target, null), target.name());
            }
            assertTrue(ConnectionStateMachine.getValidTransitions(ConnectionState.FAILED).isEmpty());
        }

        @Test
        @DisplayName("Every non-terminal state can close")
        void everyStateCanClose() {
            for (ConnectionState from : ConnectionState.values()) {
                if (!from.isTerminal()) {
                    assertTrue(
                            ConnectionStateMachine.isValidTransition(from, ConnectionState.CLOSED),
                            from.name());
                }
            }
        }

        @Test
        @DisplayName("transitionFrom only fires from the expected state")
        void transitionFromExpected() {
            assertFalse(machine.transitionFrom(
                    ConnectionState.ACTIVE, ConnectionState.DEGRADED, null));
            assertTrue(machine.transitionFrom(
                    ConnectionState.INITIALIZING, ConnectionState.RECONNECTING, null));
            assertEquals(ConnectionState.RECONNECTING, machine.getState());
        }

        @Test
        @DisplayName("Reconnecting may fail")
        void reconnectingToFailed() {
            assertEquals(
                    EnumSet.of(
                            ConnectionState.ACTIVE, ConnectionState.FAILED, ConnectionState.CLOSED),
                    ConnectionStateMachine.getValidTransitions(ConnectionState.RECONNECTING));
        }
    }

    @Nested
    @DisplayName("Listeners")
    class ListenerTests {

        @Test
        @DisplayName("Listeners see previous state, new state and cause")
        void listenerArguments() {
            List<String> seen = new ArrayList<>();
            RuntimeException fault = new RuntimeException("fault");
            machine.addListener(
                    (previous, current, cause) ->
                            seen.add(previous + ">" + current + ":" + (cause == fault)));
            machine.transitionTo(ConnectionState.ACTIVE, null);
            machine.transitionTo(ConnectionState.DEGRADED, fault);
            assertEquals(List.of("Initializing>Active:false", "Active>Degraded:true"), seen);
        }

        @Test
        @DisplayName("A failing listener does not stop others")
        void failingListenerIsolated() {
            AtomicInteger calls = new AtomicInteger();
            machine.addListener((p, c, e) -> {
                throw new IllegalStateException("boom");
            });
            machine.addListener((p, c, e) -> calls.incrementAndGet());
            assertTrue(machine.transitionTo(ConnectionState.ACTIVE, null));
            assertEquals(1, calls.get());
        }

        @Test
        @DisplayName("Removed listeners are not called")
        void removedListener() {
            AtomicInteger calls = new AtomicInteger();
            ConnectionStateListener listener = (p, c, e) -> calls.incrementAndGet();
            machine.addListener(listener);
            assertTrue(machine.removeListener(listener));
            machine.transitionTo(ConnectionState.ACTIVE, null);
            assertEquals(0, calls.get());
        }
    }

    @Nested
    @DisplayName("Concurrency")
    class ConcurrencyTests {

        @Test
        @DisplayName("Exactly one of many racing transitions wins")
        void oneWinner() throws Exception {
            machine.transitionTo(ConnectionState.ACTIVE, null);
            int threads = 8;
            ExecutorService pool = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            List<Boolean> results = Collections.synchronizedList(new ArrayList<>());
            for (int i = 0; i < threads; i++) {
                pool.execute(() -> {
                    try {
                        start.await();
                        results.add(machine.transitionFrom(
                                ConnectionState.ACTIVE, ConnectionState.DEGRADED, null));
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                });
            }
            start.countDown();
            pool.shutdown();
            assertTrue(pool.awaitTermination(5, TimeUnit.SECONDS));
            assertEquals(1, results.stream().filter(Boolean::booleanValue).count());
        }

        @Test
        @DisplayName("awaitSettled wakes on the transition out of a transitional state")
        void awaitSettledWakes() throws Exception {
            Thread opener = new Thread(() -> {
                try {
                    Thread.sleep(100);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                machine.transitionTo(ConnectionState.ACTIVE, null);
            });
            opener.start();
            ConnectionState settled =
                    machine.awaitSettled(System.nanoTime() + TimeUnit.SECONDS.toNanos(5));
            assertEquals(ConnectionState.ACTIVE, settled);
            opener.join();
        }

        @Test
        @DisplayName("awaitSettled returns the transitional state at the deadline")
        void awaitSettledTimesOut() throws Exception {
            ConnectionState settled =
                    machine.awaitSettled(System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(50));
            assertEquals(ConnectionState.INITIALIZING, settled);
        }
    }
}

package express.mvp.mcpr.transport;

import express.mvp.mcpr.transport.codec.JsonMessageCodec;
import express.mvp.mcpr.transport.error.FrameRejectedException;
import express.mvp.mcpr.transport.message.Message;
import java.time.Duration;
import java.util.Arrays;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory transport driven by the test: it decides when opens fail, what the peer sends, and
 * when the channel breaks.
 */
public final class ScriptedTransport implements Transport {

    private final JsonMessageCodec codec = new JsonMessageCodec();
    private final TransportCounters counters = new TransportCounters();
    private final BlockingQueue<Message> sent = new LinkedBlockingQueue<>();
    private final AtomicInteger opens = new AtomicInteger();
    private final AtomicInteger failingOpens = new AtomicInteger();
    private final AtomicBoolean probeAnswers = new AtomicBoolean(true);
    private final ConcurrentLinkedQueue<Boolean> scriptedProbes = new ConcurrentLinkedQueue<>();
    private final AtomicInteger probes = new AtomicInteger();
    private final AtomicBoolean failSends = new AtomicBoolean();
    private final AtomicInteger maxPayload = new AtomicInteger(Integer.MAX_VALUE);
    private final TransportKind kind;

    private volatile InboundQueue inbound;
    private volatile boolean open;

    public ScriptedTransport() {
        this(TransportKind.SOCKET);
    }

    public ScriptedTransport(TransportKind kind) {
        this.kind = kind;
    }

    /** Makes the next {@code count} opens fail. */
    public ScriptedTransport failNextOpens(int count) {
        failingOpens.set(count);
        return this;
    }

    /** Makes every open fail from now on. */
    public ScriptedTransport failAllOpens() {
        failingOpens.set(Integer.MAX_VALUE);
        return this;
    }

    public ScriptedTransport probeAnswers(boolean answers) {
        probeAnswers.set(answers);
        return this;
    }

    /** Answers the next probes with {@code answers}, then falls back to {@link #probeAnswers}. */
    public ScriptedTransport scriptProbes(Boolean... answers) {
        scriptedProbes.addAll(Arrays.asList(answers));
        return this;
    }

    public ScriptedTransport failSends(boolean fail) {
        failSends.set(fail);
        return this;
    }

    /** Refuses payloads above {@code limit} bytes without writing them, as a framer would. */
    public ScriptedTransport rejectPayloadsLargerThan(int limit) {
        maxPayload.set(limit);
        return this;
    }

    /** Delivers a message as if the peer had sent it. */
    public void deliver(Message message) {
        deliver(codec.encode(message));
    }

    /** Delivers raw bytes as if the peer had sent them. */
    public void deliver(byte[] payload) {
        InboundQueue queue = inbound;
        if (queue == null) {
            throw new IllegalStateException("not open");
        }
        queue.offer(payload);
    }

    /** Breaks the current channel; the reader sees a receive failure. */
    public void breakChannel() {
        InboundQueue queue = inbound;
        if (queue != null) {
            queue.fail(new TransportException("channel broken by test"));
        }
    }

    /** Waits for the next message written to this transport. */
    public Message nextSent(Duration timeout) throws InterruptedException {
        Message message = sent.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (message == null) {
            throw new AssertionError("nothing sent within " + timeout);
        }
        return message;
    }

    public int sentCount() {
        return sent.size();
    }

    public int opens() {
        return opens.get();
    }

    public int probes() {
        return probes.get();
    }

    @Override
    public void open() {
        opens.incrementAndGet();
        if (failingOpens.get() > 0) {
            failingOpens.decrementAndGet();
            throw new TransportException("scripted open failure");
        }
        inbound = new InboundQueue();
        open = true;
    }

    @Override
    public void send(byte[] payload) {
        if (!open || failSends.get()) {
            throw new TransportException("scripted send failure");
        }
        if (payload.length > maxPayload.get()) {
            throw new FrameRejectedException(
                    "payload of " + payload.length + " bytes exceeds " + maxPayload.get(), null);
        }
        counters.recordSent(payload.length);
        sent.add(codec.decode(payload));
    }

    @Override
    public byte[] receive() {
        InboundQueue queue = inbound;
        if (queue == null) {
            throw new TransportException("not open");
        }
        byte[] payload = queue.take();
        counters.recordReceived(payload.length);
        return payload;
    }

    @Override
    public boolean probe(Duration deadline) {
        probes.incrementAndGet();
        Boolean scripted = scriptedProbes.poll();
        boolean answer = scripted != null ? scripted : probeAnswers.get();
        return open && answer;
    }

    @Override
    public void close() {
        open = false;
        InboundQueue queue = inbound;
        if (queue != null) {
            queue.fail(new TransportException("closed"));
        }
    }

    @Override
    public TransportKind kind() {
        return kind;
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public TransportHealth health() {
        return counters.snapshot(open);
    }
}

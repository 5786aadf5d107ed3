package express.mvp.mcpr.transport.framing;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Tests for {@link LineFramingHandler}. */
class LineFramingHandlerTest {

    private final LineFramingHandler handler = new LineFramingHandler(32);

    private static ByteArrayInputStream stream(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    private static String text(byte[] frame) {
        return new String(frame, StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("Appends a line feed on write")
    void appendsLineFeed() throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        handler.writeFrame(out, "{}".getBytes(StandardCharsets.UTF_8));
        assertEquals("{}\n", out.toString(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("Refuses payloads containing a line feed")
    void refusesEmbeddedLineFeed() {
        assertThrows(
                FramingException.class,
                () ->
                        handler.writeFrame(
                                new ByteArrayOutputStream(),
                                "a\nb".getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    @DisplayName("Reads LF and CRLF terminated lines and skips blank ones")
    void readsLines() throws Exception {
        ByteArrayInputStream in = stream("one\r\n\n\ntwo\n");
        assertEquals("one", text(handler.readFrame(in)));
        assertEquals("two", text(handler.readFrame(in)));
        assertNull(handler.readFrame(in));
    }

    @Test
    @DisplayName("Stream ending mid-line is an EOF error")
    void partialLine() throws Exception {
        ByteArrayInputStream in = stream("whole\npart");
        assertEquals("whole", text(handler.readFrame(in)));
        assertThrows(EOFException.class, () -> handler.readFrame(in));
    }

    @Test
    @DisplayName("Lines over the limit are rejected")
    void overlongLine() {
        String line = "x".repeat(40) + "\n";
        assertThrows(FramingException.class, () -> handler.readFrame(stream(line)));
    }
}

package express.mvp.mcpr.transport.pipe;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import express.mvp.mcpr.transport.codec.JsonMessageCodec;
import express.mvp.mcpr.transport.message.ErrorObject;
import express.mvp.mcpr.transport.message.ErrorResponse;
import express.mvp.mcpr.transport.message.Message;
import express.mvp.mcpr.transport.message.Request;
import express.mvp.mcpr.transport.message.Response;
import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

/**
 * Subordinate process for pipe tests. Answers {@code add} and {@code ping} over stdin/stdout.
 *
 * <p>With the argument {@code crash-on-add} it exits with code 3 instead of answering {@code add}.
 */
public final class ArithmeticPeer {

    public static final int CRASH_EXIT_CODE = 3;

    private static final JsonNodeFactory JSON = JsonNodeFactory.instance;

    private ArithmeticPeer() {}

    public static void main(String[] args) throws Exception {
        boolean crashOnAdd = args.length > 0 && "crash-on-add".equals(args[0]);
        JsonMessageCodec codec = new JsonMessageCodec();
        PrintStream out = new PrintStream(System.out, false, StandardCharsets.UTF_8);
        BufferedReader in =
                new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        System.err.println("arithmetic peer ready");

        String line;
        while ((line = in.readLine()) != null) {
            Message message = codec.decode(line.getBytes(StandardCharsets.UTF_8));
            if (!(message instanceof Request)) {
                continue;
            }
            Request request = (Request) message;
            Message reply;
            switch (request.method()) {
                case "add" -> {
                    if (crashOnAdd) {
                        System.err.println("error: crashing on purpose");
                        System.exit(CRASH_EXIT_CODE);
                    }
                    int a = request.params().get("a").asInt();
                    int b = request.params().get("b").asInt();
                    reply = new Response(request.id(), JSON.objectNode().put("sum", a + b));
                }
                case "ping" -> reply = new Response(request.id(), JSON.objectNode());
                default ->
                        reply =
                                new ErrorResponse(
                                        request.id(),
                                        new ErrorObject(
                                                ErrorObject.METHOD_NOT_FOUND,
                                                "Method not found: " + request.method()));
            }
            out.write(codec.encode(reply));
            out.write('\n');
            out.flush();
        }
    }
}

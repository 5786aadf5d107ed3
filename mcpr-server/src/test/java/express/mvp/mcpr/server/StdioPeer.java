package express.mvp.mcpr.server;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;

/** Subordinate process for mixed-transport tests: serves {@code resources/read} over stdio. */
public final class StdioPeer {

    private StdioPeer() {}

    public static void main(String[] args) {
        MethodTable methods =
                MethodTable.builder()
                        .method(
                                "resources/read",
                                params -> {
                                    String uri = params.get("uri").asText();
                                    return JsonNodeFactory.instance
                                            .objectNode()
                                            .put("uri", uri)
                                            .put("text", "contents of " + uri);
                                })
                        .build();
        McprServerConfig config =
                McprServerConfig.builder()
                        .port(McprServerConfig.DISABLED)
                        .eventStreamPort(McprServerConfig.DISABLED)
                        .methods(methods)
                        .build();
        new McprServer(config).serveStdio();
    }
}

package io.mcpconf.core.model;

import java.util.List;
import java.util.Map;
import java.util.Objects;

public record ServerConfig(
    TransportType transport,
    String command,
    List<String> args,
    String url,
    Map<String, String> headers,
    Map<String, String> env,
    String workingDir,
    int timeout
) {
    public static final int DEFAULT_TIMEOUT_SECONDS = 30;

    public ServerConfig {
        Objects.requireNonNull(transport, "transport must not be null");
        args = Copies.list(args);
        headers = Copies.map(headers);
        env = Copies.map(env);
    }

    public static ServerConfig stdio(String command, List<String> args, Map<String, String> env) {
        return new ServerConfig(TransportType.STDIO, command, args, null, null, env, null, DEFAULT_TIMEOUT_SECONDS);
    }

    public static ServerConfig remote(TransportType transport, String url, Map<String, String> headers) {
        return new ServerConfig(transport, null, null, url, headers, null, null, DEFAULT_TIMEOUT_SECONDS);
    }
}

package io.mcpconf.core.convert;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.mcpconf.core.error.UnsupportedTransportException;
import io.mcpconf.core.model.Capabilities;
import io.mcpconf.core.model.Compatibility;
import io.mcpconf.core.model.DeploymentType;
import io.mcpconf.core.model.Requirements;
import io.mcpconf.core.model.Security;
import io.mcpconf.core.model.ServerConfig;
import io.mcpconf.core.model.ServerEntry;
import io.mcpconf.core.model.TransportType;
import io.mcpconf.core.schema.RegistrySchema;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class FormatConverterTest {

    @Test
    void shouldConvertStdioEntryToClaudeDesktop() {
        Map<String, Object> result = FormatConverter.toClaudeDesktop(pythonServer(), "test-server");

        assertThat(result).isEqualTo(Map.of(
            "mcpServers", Map.of(
                "test-server", Map.of(
                    "command", "python",
                    "args", List.of("server.py"),
                    "env", Map.of("API_KEY", "secret")
                )
            )
        ));
    }

    @Test
    void shouldConvertHttpsEntryToClaudeDesktop() {
        Map<String, Object> result = FormatConverter.toClaudeDesktop(remoteServer(), "test-server");

        assertThat(result).isEqualTo(Map.of(
            "mcpServers", Map.of(
                "test-server", Map.of(
                    "url", "https://api.example.com/mcp",
                    "headers", Map.of("Authorization", "Bearer token")
                )
            )
        ));
    }

    @Test
    @SuppressWarnings("unchecked")
    void editingConvertedDocumentsShouldLeaveEntryUntouched() {
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("name", "Python Server");
        raw.put("description", "Runs a python script");
        raw.put("version", "1.0.0");
        raw.put("deployment", "local");
        raw.put("config", Map.of(
            "transport", "stdio",
            "command", "python",
            "args", List.of("server.py"),
            "env", Map.of("API_KEY", "secret")
        ));
        raw.put("requirements", Map.of("platforms", List.of("linux")));
        ServerEntry server = RegistrySchema.parseServerEntry("x", raw);

        Map<String, Object> claude = (Map<String, Object>) ((Map<String, Object>) FormatConverter
            .toClaudeDesktop(server, "x").get("mcpServers")).get("x");
        ((List<String>) claude.get("args")).add("--extra");
        ((Map<String, String>) claude.get("env")).put("OTHER_TOKEN", "t");

        Map<String, Object> manifest = FormatConverter.toDxtManifest(server, "x");
        Map<String, Object> mcpConfig = (Map<String, Object>) ((Map<String, Object>) manifest.get("server"))
            .get("mcp_config");
        ((List<String>) mcpConfig.get("args")).clear();
        ((List<String>) ((Map<String, Object>) manifest.get("compatibility")).get("platforms")).add("win32");

        assertThat(server.config().args()).containsExactly("server.py");
        assertThat(server.config().env()).containsOnlyKeys("API_KEY");
        assertThat(server.requirements().platforms()).containsExactly("linux");
        assertThat(FormatConverter.toHostsLine(server, "x")).isEqualTo("x local stdio python:server.py auth=key env=API_KEY");
    }

    @Test
    void shouldOmitEmptyOptionalsFromClaudeDesktop() {
        ServerEntry server = ServerEntry.of(
            "Bare", "No extras", "1.0.0", DeploymentType.LOCAL,
            ServerConfig.stdio("node", List.of(), Map.of())
        );

        Map<String, Object> result = FormatConverter.toClaudeDesktop(server, "bare");

        assertThat(result).isEqualTo(Map.of("mcpServers", Map.of("bare", Map.of("command", "node"))));
    }

    @Test
    void shouldConvertHttpEntryToGithubMcp() {
        ServerEntry server = ServerEntry.of(
            "Test Server", "Test description", "1.0.0", DeploymentType.REMOTE,
            ServerConfig.remote(TransportType.HTTP, "http://localhost:8080/mcp", Map.of("Authorization", "Bearer token"))
        );

        Map<String, Object> result = FormatConverter.toGithubMcp(server, "test-server");

        assertThat(result).isEqualTo(Map.of(
            "servers", Map.of(
                "test-server", Map.of(
                    "type", "http",
                    "url", "http://localhost:8080/mcp",
                    "headers", Map.of("Authorization", "Bearer token")
                )
            )
        ));
        assertThat(FormatConverter.toGithubMcp(server, "test-server")).isEqualTo(result);
    }

    @Test
    void shouldOmitHeadersFromGithubMcpWhenAbsent() {
        ServerEntry server = ServerEntry.of(
            "Sentry", "Sentry", "1.0.0", DeploymentType.REMOTE,
            ServerConfig.remote(TransportType.HTTPS, "https://mcp.sentry.dev/mcp", null)
        );

        Map<String, Object> result = FormatConverter.toGithubMcp(server, "sentry");

        assertThat(result).isEqualTo(Map.of(
            "servers", Map.of("sentry", Map.of("type", "http", "url", "https://mcp.sentry.dev/mcp"))
        ));
    }

    @Test
    void githubMcpShouldRejectNonHttpTransportsTheSameWayEveryTime() {
        ServerEntry websocket = ServerEntry.of(
            "Socket", "Socket server", "1.0.0", DeploymentType.REMOTE,
            ServerConfig.remote(TransportType.WEBSOCKET, "wss://example.com/mcp", null)
        );

        assertThatThrownBy(() -> FormatConverter.toGithubMcp(pythonServer(), "test-server"))
            .isInstanceOf(UnsupportedTransportException.class)
            .hasMessage("GitHub MCP format only supports http or https transport, got stdio");
        assertThatThrownBy(() -> FormatConverter.toGithubMcp(pythonServer(), "test-server"))
            .hasMessage("GitHub MCP format only supports http or https transport, got stdio");
        assertThatThrownBy(() -> FormatConverter.toGithubMcp(websocket, "socket"))
            .isInstanceOf(UnsupportedTransportException.class)
            .hasMessage("GitHub MCP format only supports http or https transport, got websocket")
            .satisfies(e -> {
                UnsupportedTransportException error = (UnsupportedTransportException) e;
                assertThat(error.format()).isEqualTo("github");
                assertThat(error.transport()).isEqualTo(TransportType.WEBSOCKET);
            });
    }

    @Test
    void shouldBuildDxtManifestForPythonServer() {
        ServerEntry server = new ServerEntry(
            "Test Python Server",
            "Python-based server",
            "1.2.3",
            DeploymentType.LOCAL,
            ServerConfig.stdio("uv", List.of("run", "server.py"), null),
            "MIT",
            "https://github.com/example/server",
            new Capabilities(List.of("search", "fetch"), null, null),
            new Requirements(List.of("darwin", "linux"), null, null, null),
            null,
            new Compatibility(">=0.10.0", null)
        );

        Map<String, Object> manifest = FormatConverter.toDxtManifest(server, "py-server");

        Map<String, Object> expected = new LinkedHashMap<>();
        expected.put("dxt_version", "1.0");
        expected.put("name", "py-server");
        expected.put("display_name", "Test Python Server");
        expected.put("version", "1.2.3");
        expected.put("description", "Python-based server");
        expected.put("server", Map.of(
            "type", "python",
            "mcp_config", Map.of("command", "uv", "args", List.of("run", "server.py"))
        ));
        expected.put("license", "MIT");
        expected.put("repository", "https://github.com/example/server");
        expected.put("tools", List.of(
            Map.of("name", "search", "description", "Tool: search"),
            Map.of("name", "fetch", "description", "Tool: fetch")
        ));
        expected.put("compatibility", Map.of("claude_desktop", ">=0.10.0", "platforms", List.of("darwin", "linux")));
        assertThat(manifest).isEqualTo(expected);
        assertThat(FormatConverter.toDxtManifest(server, "py-server")).isEqualTo(manifest);
    }

    @Test
    void shouldClassifyRuntimeFromCommand() {
        assertThat(FormatConverter.runtimeType("uv")).isEqualTo("python");
        assertThat(FormatConverter.runtimeType("uvx")).isEqualTo("python");
        assertThat(FormatConverter.runtimeType("python3")).isEqualTo("python");
        assertThat(FormatConverter.runtimeType("node")).isEqualTo("node");
        assertThat(FormatConverter.runtimeType("npx")).isEqualTo("node");
        assertThat(FormatConverter.runtimeType(null)).isEqualTo("node");
    }

    @Test
    void shouldBuildMinimalDxtManifestForNodeServer() {
        ServerEntry server = ServerEntry.of(
            "Files", "File access", "0.1.0", DeploymentType.LOCAL,
            ServerConfig.stdio("node", List.of("index.js"), null)
        );

        Map<String, Object> manifest = FormatConverter.toDxtManifest(server, "files");

        assertThat(manifest).containsOnlyKeys("dxt_version", "name", "display_name", "version", "description", "server");
        assertThat(manifest.get("server")).isEqualTo(Map.of(
            "type", "node",
            "mcp_config", Map.of("command", "node", "args", List.of("index.js"))
        ));
    }

    @Test
    void shouldEmitDxtCompatibilityFromPlatformsAlone() {
        ServerEntry server = new ServerEntry(
            "Files", "File access", "0.1.0", DeploymentType.LOCAL,
            ServerConfig.stdio("node", null, null),
            null, null, new Capabilities(List.of(), null, null),
            new Requirements(List.of("linux"), null, null, null), null, null
        );

        Map<String, Object> manifest = FormatConverter.toDxtManifest(server, "files");

        assertThat(manifest).doesNotContainKey("tools");
        assertThat(manifest.get("compatibility")).isEqualTo(Map.of("platforms", List.of("linux")));
    }

    @Test
    void dxtManifestShouldRejectNonStdioTransport() {
        assertThatThrownBy(() -> FormatConverter.toDxtManifest(remoteServer(), "test-server"))
            .isInstanceOf(UnsupportedTransportException.class)
            .hasMessage("DXT manifest only supports stdio transport, got https");
    }

    @Test
    void shouldRenderHostsLineForStdioEntry() {
        assertThat(FormatConverter.toHostsLine(pythonServer(), "test-server"))
            .isEqualTo("test-server local stdio python:server.py auth=key env=API_KEY");
    }

    @Test
    void shouldRenderHostsLineForHttpsEntry() {
        assertThat(FormatConverter.toHostsLine(remoteServer(), "test-server"))
            .isEqualTo("test-server remote https https://api.example.com/mcp auth=bearer");
    }

    @Test
    void shouldDetectKeyAuthFromNonBearerHeader() {
        ServerEntry server = ServerEntry.of(
            "Basic", "Basic auth", "1.0.0", DeploymentType.REMOTE,
            ServerConfig.remote(TransportType.HTTP, "http://localhost/mcp", Map.of("Authorization", "Basic xyz"))
        );

        assertThat(FormatConverter.toHostsLine(server, "basic"))
            .isEqualTo("basic remote http http://localhost/mcp auth=key");
    }

    @Test
    void shouldListEnvKeysInInsertionOrderAndFlagSandbox() {
        Map<String, String> env = new LinkedHashMap<>();
        env.put("LOG_LEVEL", "debug");
        env.put("GITHUB_TOKEN", "ghp");
        env.put("HOME", "/tmp");
        ServerEntry server = new ServerEntry(
            "GitHub", "GitHub tools", "1.0.0", DeploymentType.HYBRID,
            ServerConfig.stdio("npx", null, env),
            null, null, null, null,
            new Security(true, null, true),
            null
        );

        assertThat(FormatConverter.toHostsLine(server, "github"))
            .isEqualTo("github hybrid stdio npx auth=key env=LOG_LEVEL,GITHUB_TOKEN,HOME sandbox=true");
    }

    @Test
    void shouldFallBackToUnknownEndpoint() {
        ServerEntry server = ServerEntry.of(
            "Socket", "Socket server", "1.0.0", DeploymentType.REMOTE,
            new ServerConfig(TransportType.WEBSOCKET, null, null, null, null, null, null, 30)
        );

        assertThat(FormatConverter.toHostsLine(server, "socket")).isEqualTo("socket remote websocket unknown");
    }

    @Test
    void shouldImportClaudeDesktopStdioServer() {
        Map<String, Map<String, Object>> imported = FormatConverter.fromClaudeDesktop(Map.of(
            "mcpServers", Map.of("weather", Map.of("command", "python", "args", List.of("weather.py")))
        ));

        assertThat(imported).containsOnlyKeys("weather");
        ServerEntry weather = RegistrySchema.parseServerEntry(imported.get("weather"));
        assertThat(weather.name()).isEqualTo("Weather");
        assertThat(weather.description()).isEqualTo("Imported from Claude Desktop configuration");
        assertThat(weather.version()).isEqualTo("1.0.0");
        assertThat(weather.deployment()).isEqualTo(DeploymentType.LOCAL);
        assertThat(weather.config().transport()).isEqualTo(TransportType.STDIO);
        assertThat(weather.config().args()).containsExactly("weather.py");
    }

    @Test
    void shouldImportClaudeDesktopRemoteServers() {
        Map<String, Map<String, Object>> imported = FormatConverter.fromClaudeDesktop(Map.of(
            "mcpServers", Map.of(
                "sentry-issues", Map.of("url", "https://mcp.sentry.dev/mcp", "headers", Map.of("X-Org", "acme")),
                "local-api", Map.of("url", "http://localhost:3000/mcp")
            )
        ));

        ServerEntry sentry = RegistrySchema.parseServerEntry(imported.get("sentry-issues"));
        assertThat(sentry.name()).isEqualTo("Sentry Issues");
        assertThat(sentry.deployment()).isEqualTo(DeploymentType.REMOTE);
        assertThat(sentry.config().transport()).isEqualTo(TransportType.HTTPS);
        assertThat(sentry.config().headers()).containsEntry("X-Org", "acme");

        ServerEntry local = RegistrySchema.parseServerEntry(imported.get("local-api"));
        assertThat(local.config().transport()).isEqualTo(TransportType.HTTP);
    }

    @Test
    void shouldLeaveTransportUnsetWhenNeitherCommandNorUrl() {
        Map<String, Map<String, Object>> imported = FormatConverter.fromClaudeDesktop(Map.of(
            "mcpServers", Map.of("broken", Map.of("cwd", "/tmp"))
        ));

        assertThat(RegistrySchema.validateServerEntry(imported.get("broken"))).containsOnlyKeys("config.transport");
    }

    @Test
    void shouldReturnNothingWithoutMcpServersKey() {
        assertThat(FormatConverter.fromClaudeDesktop(Map.of("globalShortcut", "Ctrl+Space"))).isEmpty();
    }

    @Test
    void shouldRoundTripClaudeDesktopConfiguration() {
        Map<String, Object> stdio = Map.of(
            "mcpServers", Map.of(
                "weather", Map.of("command", "python", "args", List.of("weather.py"), "env", Map.of("API_KEY", "secret"))
            )
        );
        Map<String, Object> remote = Map.of(
            "mcpServers", Map.of(
                "sentry", Map.of("url", "https://mcp.sentry.dev/mcp", "headers", Map.of("Authorization", "Bearer t"))
            )
        );

        for (Map<String, Object> original : List.of(stdio, remote)) {
            FormatConverter.fromClaudeDesktop(original).forEach((serverId, raw) -> {
                ServerEntry server = RegistrySchema.parseServerEntry(raw);
                assertThat(FormatConverter.toClaudeDesktop(server, serverId)).isEqualTo(original);
            });
        }
    }

    @Test
    void shouldTitleCaseServerIds() {
        assertThat(FormatConverter.displayName("my-cool-server")).isEqualTo("My Cool Server");
        assertThat(FormatConverter.displayName("github")).isEqualTo("Github");
        assertThat(FormatConverter.displayName("3d-viewer")).isEqualTo("3D Viewer");
        assertThat(FormatConverter.displayName("SQLITE-db")).isEqualTo("Sqlite Db");
    }

    private static ServerEntry pythonServer() {
        return ServerEntry.of(
            "Test Server", "Test description", "1.0.0", DeploymentType.LOCAL,
            ServerConfig.stdio("python", List.of("server.py"), Map.of("API_KEY", "secret"))
        );
    }

    private static ServerEntry remoteServer() {
        return ServerEntry.of(
            "Test Server", "Test description", "1.0.0", DeploymentType.REMOTE,
            ServerConfig.remote(TransportType.HTTPS, "https://api.example.com/mcp", Map.of("Authorization", "Bearer token"))
        );
    }
}

package com.example.pairprog.execution;

import com.example.pairprog.config.ExecutionProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.util.StreamUtils;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.util.*;

/**
 * Runs a code snippet in a remote Piston sandbox.
 *
 * Sandbox problems never escape as exceptions; they come back in {@link ExecutionResult#error()}.
 * Only an unknown language is rejected up front.
 */
@Service
public class ExecutionService {

    private static final Logger log = LoggerFactory.getLogger(ExecutionService.class);

    /** editor language -> (piston language, version) */
    static final Map<String, SandboxRuntime> RUNTIMES;
    static {
        Map<String, SandboxRuntime> m = new LinkedHashMap<>();
        m.put("python", new SandboxRuntime("python", "3.10", "py"));
        m.put("javascript", new SandboxRuntime("javascript", "18.15.0", "js"));
        m.put("typescript", new SandboxRuntime("typescript", "5.0.3", "ts"));
        m.put("java", new SandboxRuntime("java", "15.0.2", "java"));
        m.put("cpp", new SandboxRuntime("c++", "10.2.0", "cpp"));
        m.put("c", new SandboxRuntime("c", "10.2.0", "c"));
        m.put("go", new SandboxRuntime("go", "1.16.2", "go"));
        m.put("rust", new SandboxRuntime("rust", "1.68.2", "rs"));
        m.put("ruby", new SandboxRuntime("ruby", "3.0.1", "rb"));
        RUNTIMES = Collections.unmodifiableMap(m);
    }

    record SandboxRuntime(String language, String version, String extension) { }

    private final RestClient restClient;
    private final ExecutionProperties props;
    private final ObjectMapper objectMapper;

    public ExecutionService(RestClient executionRestClient, ExecutionProperties props, ObjectMapper objectMapper) {
        this.restClient = executionRestClient;
        this.props = props;
        this.objectMapper = objectMapper;
    }

    public static Set<String> supportedLanguages() {
        return RUNTIMES.keySet();
    }

    /** File extension the sandbox gets for {@code language}; {@code txt} when unknown. */
    public static String fileExtension(String language) {
        SandboxRuntime rt = (language == null) ? null : RUNTIMES.get(language);
        return (rt == null) ? "txt" : rt.extension();
    }

    public ExecutionResult execute(String code, String language) {
        SandboxRuntime rt = (language == null) ? null : RUNTIMES.get(language);
        if (rt == null) throw new UnsupportedLanguageException(language, RUNTIMES.keySet());

        Map<String, Object> request = pistonRequest(code, language, rt);
        long started = System.nanoTime();
        try {
            return restClient.post()
                    .uri(props.getPistonUrl())
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(request)
                    .exchange((req, res) -> {
                        double elapsed = secondsSince(started);
                        String body = StreamUtils.copyToString(res.getBody(), StandardCharsets.UTF_8);
                        if (res.getStatusCode().value() != 200) {
                            log.warn("Sandbox answered {} for language={}", res.getStatusCode().value(), language);
                            return ExecutionResult.failure("Execution service error: " + body, elapsed);
                        }
                        return toResult(objectMapper.readTree(body), elapsed);
                    });
        } catch (ResourceAccessException e) {
            if (e.getCause() instanceof SocketTimeoutException) {
                log.warn("Sandbox timed out after {} (language={})", props.getTimeout(), language);
                return ExecutionResult.failure(
                        "Execution timed out. Please try again or reduce the code complexity.",
                        props.getTimeout().toMillis() / 1000.0);
            }
            log.warn("Sandbox unreachable (language={}): {}", language, e.toString());
            return ExecutionResult.failure("Execution failed: " + e.getMessage(), 0.0);
        } catch (RuntimeException e) {
            log.warn("Sandbox call failed (language={}): {}", language, e.toString());
            return ExecutionResult.failure("Execution failed: " + e.getMessage(), 0.0);
        }
    }

    private Map<String, Object> pistonRequest(String code, String language, SandboxRuntime rt) {
        Map<String, Object> file = new LinkedHashMap<>();
        file.put("name", "main." + fileExtension(language));
        file.put("content", code == null ? "" : code);

        Map<String, Object> req = new LinkedHashMap<>();
        req.put("language", rt.language());
        req.put("version", rt.version());
        req.put("files", List.of(file));
        req.put("stdin", "");
        req.put("args", List.of());
        req.put("compile_timeout", props.getCompileTimeoutMs());
        req.put("run_timeout", props.getRunTimeoutMs());
        req.put("compile_memory_limit", -1);
        req.put("run_memory_limit", -1);
        return req;
    }

    static ExecutionResult toResult(JsonNode result, double elapsed) {
        JsonNode run = result.path("run");
        JsonNode compile = result.path("compile");

        String stdout = run.path("stdout").asText("");
        String stderr = run.path("stderr").asText("");
        String compileOut = compile.path("stdout").asText("");
        String compileErr = compile.path("stderr").asText("");

        String output = stdout;
        if (!compileOut.isEmpty()) {
            output = "Compile Output:\n" + compileOut + "\n\n" + output;
        }

        String error = null;
        if (!stderr.isEmpty() || !compileErr.isEmpty()) {
            List<String> parts = new ArrayList<>();
            if (!compileErr.isEmpty()) parts.add("Compile Error:\n" + compileErr);
            if (!stderr.isEmpty()) parts.add("Runtime Error:\n" + stderr);
            error = String.join("\n\n", parts);
        }

        return new ExecutionResult(output.isEmpty() ? "(No output)" : output.strip(), error, elapsed);
    }

    private static double secondsSince(long startedNanos) {
        return (System.nanoTime() - startedNanos) / 1_000_000_000.0;
    }
}

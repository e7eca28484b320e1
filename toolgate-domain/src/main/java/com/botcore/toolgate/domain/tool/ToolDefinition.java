package com.botcore.toolgate.domain.tool;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Catalog entry describing how one tool maps onto a backend endpoint.
 *
 * pathTemplate may contain {param} placeholders that are filled from the call arguments.
 * timeoutMs == null means "use the gateway default".
 * arguments == null means the tool declares no input schema and arguments are forwarded as given;
 * once declared, every path placeholder must be among them.
 * service == {@link #IN_PROCESS} marks a tool answered by the gateway itself, not proxied.
 */
public record ToolDefinition(
        String name,
        String title,
        String description,
        Tier tier,
        String category,
        String service,
        HttpMethod method,
        String pathTemplate,
        Long timeoutMs,
        boolean skipAuth,
        List<ArgumentSpec> arguments
) {

    public static final String IN_PROCESS = "in-process";

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([A-Za-z0-9_]+)}");

    public ToolDefinition {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(tier, "tier");
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(service, "service");
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(pathTemplate, "pathTemplate");
        if (name.isBlank()) throw new IllegalArgumentException("tool name must not be blank");
        if (!pathTemplate.startsWith("/")) throw new IllegalArgumentException("pathTemplate must start with '/': " + pathTemplate);
        if (timeoutMs != null && timeoutMs <= 0) throw new IllegalArgumentException("timeoutMs must be positive");
        if (title == null || title.isBlank()) title = name;
        if (description == null) description = "";
        if (arguments != null) {
            arguments = List.copyOf(arguments);
            checkArguments(name, method, pathTemplate, arguments);
        }
    }

    public ToolDefinition(String name, String title, String description, Tier tier, String category, String service,
                          HttpMethod method, String pathTemplate, Long timeoutMs, boolean skipAuth) {
        this(name, title, description, tier, category, service, method, pathTemplate, timeoutMs, skipAuth, null);
    }

    /** Names of the {placeholders} in declaration order. */
    public List<String> pathParameters() {
        return placeholders(pathTemplate);
    }

    public boolean declaresArguments() {
        return arguments != null;
    }

    public Optional<ArgumentSpec> bodyArgument() {
        if (arguments == null) return Optional.empty();
        return arguments.stream().filter(ArgumentSpec::body).findFirst();
    }

    public boolean inProcess() {
        return IN_PROCESS.equals(service);
    }

    public ToolInvocation invocation(Map<String, Object> parameters) {
        return new ToolInvocation(name, tier, parameters, category);
    }

    private static List<String> placeholders(String pathTemplate) {
        List<String> out = new ArrayList<>();
        Matcher m = PLACEHOLDER.matcher(pathTemplate);
        while (m.find()) {
            out.add(m.group(1));
        }
        return out;
    }

    private static void checkArguments(String name, HttpMethod method, String pathTemplate, List<ArgumentSpec> arguments) {
        Set<String> names = new HashSet<>();
        int bodies = 0;
        for (ArgumentSpec a : arguments) {
            if (!names.add(a.name())) {
                throw new IllegalArgumentException("duplicate argument '" + a.name() + "' in tool " + name);
            }
            if (a.body()) bodies++;
        }
        if (bodies > 1) throw new IllegalArgumentException("at most one body argument per tool: " + name);
        if (bodies == 1 && !method.carriesBody()) {
            throw new IllegalArgumentException("body argument on a " + method + " tool: " + name);
        }
        for (String p : placeholders(pathTemplate)) {
            if (!names.contains(p)) {
                throw new IllegalArgumentException("path placeholder '" + p + "' is not a declared argument of " + name);
            }
        }
    }
}

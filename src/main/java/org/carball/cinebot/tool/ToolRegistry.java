package org.carball.cinebot.tool;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Dispatch table from {@link ToolName} to handler. Arguments are checked against the declared
 * parameters before a handler runs.
 */
@Slf4j
public class ToolRegistry {

    private final Map<ToolName, ToolDefinition> definitions = new EnumMap<>(ToolName.class);
    private final Map<ToolName, ToolHandler> handlers = new EnumMap<>(ToolName.class);

    /**
     * Registry with the catalog tools and, when given, the online lookup tools.
     */
    public static ToolRegistry create(CatalogTools catalogTools, OmdbTools omdbTools) {
        ToolRegistry registry = new ToolRegistry();
        catalogTools.registerWith(registry);
        if (omdbTools != null) {
            omdbTools.registerWith(registry);
        }
        log.info("Registered {} tools", registry.definitions.size());
        return registry;
    }

    public ToolRegistry register(ToolDefinition definition, ToolHandler handler) {
        if (handlers.containsKey(definition.getName())) {
            throw new IllegalStateException("Tool already registered: " + definition.getName());
        }
        definitions.put(definition.getName(), definition);
        handlers.put(definition.getName(), handler);
        return this;
    }

    public List<ToolDefinition> definitions() {
        return new ArrayList<>(definitions.values());
    }

    public boolean isRegistered(String name) {
        return ToolName.fromWireName(name).map(handlers::containsKey).orElse(false);
    }

    /**
     * Runs the named tool.
     *
     * @return the tool's result text
     * @throws UnknownToolException      if no tool is registered under the name
     * @throws InvalidArgumentsException if a required argument is missing or malformed
     * @throws ExternalLookupException   if an online lookup fails
     */
    public String dispatch(String name, Map<String, Object> arguments) {
        ToolName tool = ToolName.fromWireName(name)
                .filter(handlers::containsKey)
                .orElseThrow(() -> new UnknownToolException(name));

        ToolArguments toolArguments = new ToolArguments(tool, arguments);
        List<String> missing = definitions.get(tool).getRequiredParameterNames().stream()
                .filter(parameter -> !toolArguments.has(parameter))
                .collect(Collectors.toList());
        if (!missing.isEmpty()) {
            throw new InvalidArgumentsException(String.format(
                    "Missing required argument(s) for %s: %s", tool, String.join(", ", missing)));
        }

        log.debug("Dispatching {} with {}", tool, arguments);
        String result = handlers.get(tool).execute(toolArguments);
        log.trace("{} returned:\n{}", tool, result);
        return result;
    }
}

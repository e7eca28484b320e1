package com.botcore.toolgate.api.tools;

import com.botcore.toolgate.domain.tool.ArgumentSpec;
import com.botcore.toolgate.domain.tool.Tier;
import com.botcore.toolgate.domain.tool.ToolDefinition;

import java.util.List;

/** Catalog entry as exposed to agents. Routing details stay server-side. */
public record ToolSummary(String name, String title, String description, Tier tier, String category,
                          boolean requiresConfirmation, List<ArgumentSpec> arguments) {

  static ToolSummary of(ToolDefinition def) {
    return new ToolSummary(def.name(), def.title(), def.description(), def.tier(), def.category(),
        def.tier().requiresConfirmation(), def.declaresArguments() ? def.arguments() : List.of());
  }
}

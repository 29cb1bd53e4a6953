package dev.automate.model;

import java.util.List;

/**
 * The command a Write, Query or SetAndQuery step sends: template text, an optional catalog
 * reference, inline parameter declarations and the step's bound values.
 */
public record CommandInvocation(
    String command,
    String catalogKey, // nullable
    List<CommandParam> params,
    ParameterBinding bindings
) {
    public CommandInvocation {
        command = command == null ? "" : command;
        params = params == null ? List.of() : List.copyOf(params);
        bindings = bindings == null ? ParameterBinding.empty() : bindings;
    }

    /** A plain command with nothing to bind. */
    public static CommandInvocation of(String command) {
        return new CommandInvocation(command, null, List.of(), ParameterBinding.empty());
    }
}

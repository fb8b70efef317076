package com.arxmlviewer.core.model;

import java.util.List;

/**
 * An operation of a client-server interface, or a trigger of a trigger interface.
 *
 * @param name operation short name
 * @param description optional description
 * @param arguments arguments in declaration order
 */
public record Operation(
    String name,
    String description,
    List<OperationArgument> arguments
) {
    public Operation {
        if (name == null) {
            name = "";
        }
        arguments = arguments == null ? List.of() : List.copyOf(arguments);
    }

    public List<OperationArgument> inputArguments() {
        return arguments.stream().filter(argument -> argument.direction().isInput()).toList();
    }

    public List<OperationArgument> outputArguments() {
        return arguments.stream().filter(argument -> argument.direction().isOutput()).toList();
    }
}

package dev.fumaz.sprout.exception;

import org.jetbrains.annotations.NotNull;

/**
 * Thrown when adding an alias whose name is already defined.
 */
public class AliasAlreadyDefinedException extends ConfigurationException {

    private final @NotNull String name;

    public AliasAlreadyDefinedException(@NotNull String name) {
        super("Cannot define alias '" + name + "'. An alias with given name is already defined.");
        this.name = name;
    }

    public @NotNull String getName() {
        return name;
    }
}

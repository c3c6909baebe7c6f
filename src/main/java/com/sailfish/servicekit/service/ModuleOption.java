package com.sailfish.servicekit.service;

/**
 * Option applied, in declaration order, to a module's typed configuration before the module is built.
 *
 * @param <C> The configuration type of the module.
 */
@FunctionalInterface
public interface ModuleOption<C> {

    /**
     * @throws IllegalArgumentException if the option cannot be applied.
     */
    void apply(C config);
}

package com.sailfish.servicekit.service;

import java.util.List;

/**
 * Creates the modules of one kind during service startup.
 */
@FunctionalInterface
public interface ModuleCreateFunc {

    /**
     * @param info Name and host of the module being created.
     * @return The created modules, in start order.
     * @throws Exception if creation fails; this is fatal for service startup.
     */
    List<Module> create(ModuleCreateInfo info) throws Exception;
}

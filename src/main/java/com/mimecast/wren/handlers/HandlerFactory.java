package com.mimecast.wren.handlers;

import java.util.List;

/**
 * Handler construction from command line arguments.
 * <p>Optional capability, handlers without one can still be built programmatically or from config.
 *
 * @see com.mimecast.wren.main.Factories
 */
@FunctionalInterface
public interface HandlerFactory {

    /**
     * Creates a handler from the given arguments.
     *
     * @param args Handler arguments.
     * @return Handler instance.
     * @throws UsageException Invalid arguments.
     */
    Handler create(List<String> args) throws UsageException;
}

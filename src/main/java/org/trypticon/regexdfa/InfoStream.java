package org.trypticon.regexdfa;

import java.util.function.Supplier;

/**
 * Receives progress messages from the stages of a compilation, tagged with the component
 * that produced them.
 */
public interface InfoStream {

    /**
     * Discards everything.
     */
    InfoStream NO_OUTPUT = new InfoStream() {
        @Override
        public void message(String component, String line) {
        }

        @Override
        public boolean isEnabled(String component) {
            return false;
        }
    };

    /**
     * Logs a message for a component.
     *
     * @param component the component name.
     * @param line the message line.
     */
    void message(String component, String line);

    /**
     * Tests whether a message for a given component will be logged.
     *
     * @param component the component name.
     * @return {@code true} if messages for that component will be logged.
     */
    boolean isEnabled(String component);

    /**
     * Logs a message for a component, only building the line if the component is enabled.
     *
     * @param component the component name.
     * @param line supplies the message line.
     */
    default void message(String component, Supplier<String> line) {
        if (isEnabled(component)) {
            message(component, line.get());
        }
    }
}

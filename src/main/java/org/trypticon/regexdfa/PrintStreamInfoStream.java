package org.trypticon.regexdfa;

import javax.annotation.Nonnull;
import java.io.PrintStream;

/**
 * Info stream which prints every message to a {@link PrintStream}, prefixed with its component.
 */
public class PrintStreamInfoStream implements InfoStream {

    @Nonnull
    private final PrintStream stream;

    public PrintStreamInfoStream(@Nonnull PrintStream stream) {
        this.stream = stream;
    }

    @Override
    public void message(String component, String line) {
        stream.println(component + ": " + line);
    }

    @Override
    public boolean isEnabled(String component) {
        return true;
    }
}

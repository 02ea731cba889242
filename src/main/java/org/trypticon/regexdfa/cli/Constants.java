package org.trypticon.regexdfa.cli;

/**
 * Constants shared by the commands.
 */
class Constants {
    /**
     * The name the application is invoked as.
     */
    static final String APP_NAME = "regexdfa";

    private Constants() {
    }
}

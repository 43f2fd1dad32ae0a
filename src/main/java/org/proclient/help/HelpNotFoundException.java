package org.proclient.help;

import org.proclient.operation.Message;

/**
 * Thrown when help is requested for a name the catalog does not know.
 */
public class HelpNotFoundException extends Exception {

    private final String name;

    public HelpNotFoundException(final String name) {
        super(Message.NO_HELP_CONTENT.format(name));
        this.name = name;
    }

    public String getName() {
        return name;
    }
}

package org.proclient.system;

import org.proclient.operation.Message;

/**
 * Thrown when a command that needs root privileges is run by another user.
 */
public class PrivilegeException extends Exception {

    public PrivilegeException() {
        super(Message.NONROOT_USER.format());
    }
}

package org.proclient.spi;

/**
 * Decides whether the current process runs with root privileges.
 */
public interface IPrivilegeChecker {

    boolean isRoot();
}

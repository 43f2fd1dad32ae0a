package org.proclient.system;

import com.sun.security.auth.module.UnixSystem;
import org.proclient.spi.IPrivilegeChecker;

/**
 * Checks the effective user id of the running JVM.
 */
public class UnixPrivilegeChecker implements IPrivilegeChecker {

    @Override
    public boolean isRoot() {
        return new UnixSystem().getUid() == 0;
    }
}

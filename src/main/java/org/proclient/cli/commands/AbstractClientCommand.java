package org.proclient.cli.commands;

import org.proclient.cli.CommandLineInterface;
import org.proclient.spi.ServiceRegistry;
import org.proclient.system.PrivilegeException;
import picocli.CommandLine;
import picocli.CommandLine.ParentCommand;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

/**
 * Base of all {@code pro} subcommands. The privilege check runs before anything else,
 * configuration loading included; a non-root invocation ends with the message on stderr and exit code 1.
 */
abstract class AbstractClientCommand implements Callable<Integer> {

    @ParentCommand
    private CommandLineInterface parent;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public final Integer call() throws Exception {
        try {
            ensureRoot();
        } catch (final PrivilegeException e) {
            err().println(e.getMessage());
            err().flush();
            return 1;
        }
        return execute();
    }

    /**
     * Runs the command once the caller is known to be privileged.
     *
     * @return The process exit code.
     * @throws Exception if the command fails unexpectedly; reported on stderr with exit code 1.
     */
    protected abstract int execute() throws Exception;

    protected CommandLineInterface parent() {
        return parent;
    }

    protected ServiceRegistry registry() {
        return parent.getRegistry();
    }

    protected PrintWriter out() {
        return spec.commandLine().getOut();
    }

    protected PrintWriter err() {
        return spec.commandLine().getErr();
    }

    private void ensureRoot() throws PrivilegeException {
        if (!parent.getPrivilegeChecker().isRoot()) {
            throw new PrivilegeException();
        }
    }
}

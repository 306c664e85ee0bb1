package org.ndfcclient.cli.commands;

import org.ndfcclient.cli.AbstractCommand;
import org.ndfcclient.rest.Sender;
import org.springframework.boot.ApplicationArguments;
import org.springframework.stereotype.Component;

import java.io.PrintStream;

/**
 * Logs in to the controller and reports the role of the user.
 */
@Component
public class LoginCommand extends AbstractCommand {

    private final Sender sender;

    public LoginCommand(Sender sender) {
        super("login", "Log in to the controller and show the user's role");
        this.sender = sender;
    }

    @Override
    public boolean requiresLogin() {
        return false;
    }

    @Override
    public void execute(ApplicationArguments args, PrintStream out) {
        sender.login();
        print(out, newObject().put("logged_in", sender.isLoggedIn()).put("rbac", sender.getRbac()));
    }
}

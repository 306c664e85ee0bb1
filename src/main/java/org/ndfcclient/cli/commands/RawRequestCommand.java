package org.ndfcclient.cli.commands;

import com.fasterxml.jackson.databind.JsonNode;
import org.ndfcclient.cli.AbstractCommand;
import org.ndfcclient.cli.UsageException;
import org.ndfcclient.rest.ControllerResponse;
import org.ndfcclient.rest.NdfcException;
import org.ndfcclient.rest.RestSend;
import org.springframework.boot.ApplicationArguments;
import org.springframework.http.HttpMethod;

import java.io.PrintStream;
import java.util.List;

/**
 * Sends one request to an arbitrary controller path and prints the normalized reply.
 */
abstract class RawRequestCommand extends AbstractCommand {

    private final RestSend restSend;
    private final HttpMethod verb;

    RawRequestCommand(String name, String description, RestSend restSend, HttpMethod verb) {
        super(name, description);
        this.restSend = restSend;
        this.verb = verb;
    }

    @Override
    public void execute(ApplicationArguments args, PrintStream out) {
        List<String> operands = args.getNonOptionArgs();
        if (operands.size() < 2 || operands.get(1).isBlank()) {
            throw new UsageException(getName() + " requires a request path");
        }
        JsonNode payload = payload(operands);
        ControllerResponse response = restSend.commit(verb, operands.get(1), payload);
        print(out, response.toJson());
        if (!restSend.getResultCurrent().isSuccess()) {
            throw new NdfcException("Request unsuccessful. " + restSend.getResultCurrent()
                    + ". More detail (if any): " + restSend.errorMessage(), response.getReturnCode());
        }
    }

    /**
     * Request body built from the operands following the path, or null.
     */
    protected abstract JsonNode payload(List<String> operands);
}

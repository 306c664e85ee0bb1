package org.ndfcclient.cli.commands;

import com.fasterxml.jackson.databind.JsonNode;
import org.ndfcclient.rest.RestSend;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * {@code rest-get <path>}: sends one GET and prints the normalized reply.
 */
@Component
public class RestGetCommand extends RawRequestCommand {

    public RestGetCommand(RestSend restSend) {
        super("rest-get", "GET <path> and print the reply", restSend, HttpMethod.GET);
    }

    @Override
    protected JsonNode payload(List<String> operands) {
        return null;
    }
}

package org.ndfcclient.cli.commands;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import org.ndfcclient.cli.UsageException;
import org.ndfcclient.rest.RestSend;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * {@code rest-post <path> <json>}: sends one POST and prints the normalized reply.
 */
@Component
public class RestPostCommand extends RawRequestCommand {

    public RestPostCommand(RestSend restSend) {
        super("rest-post", "POST <path> <json> and print the reply", restSend, HttpMethod.POST);
    }

    @Override
    protected JsonNode payload(List<String> operands) {
        if (operands.size() < 3) {
            throw new UsageException(getName() + " requires a JSON payload after the path");
        }
        try {
            return objectMapper.readTree(operands.get(2));
        } catch (JsonProcessingException e) {
            throw new UsageException("payload is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }
}

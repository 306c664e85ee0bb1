package org.ndfcclient.cli.commands;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.ndfcclient.cli.ConfigCommand;
import org.ndfcclient.cli.ConfigFileReader;
import org.ndfcclient.imagepolicy.ImagePolicyRequest;
import org.ndfcclient.imagepolicy.ImagePolicyService;
import org.ndfcclient.rest.Results;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Shows image policies by name. Names the controller does not know are skipped.
 */
@Component
public class ImagePolicyInfoCommand extends ConfigCommand<ImagePolicyRequest> {

    private final ImagePolicyService imagePolicyService;

    public ImagePolicyInfoCommand(ConfigFileReader configFileReader, ImagePolicyService imagePolicyService) {
        super("image-policy-info", "Show image policies", configFileReader, ImagePolicyRequest.class);
        this.imagePolicyService = imagePolicyService;
    }

    @Override
    protected void process(List<ImagePolicyRequest> items, Results results, PrintStream out) {
        List<String> names = new ArrayList<>();
        for (ImagePolicyRequest item : items) {
            names.add(item.getName());
        }
        ObjectNode output = newObject();
        for (Map.Entry<String, JsonNode> entry : imagePolicyService.getPolicies(names).entrySet()) {
            output.set(entry.getKey(), entry.getValue());
        }
        print(out, output);
    }
}

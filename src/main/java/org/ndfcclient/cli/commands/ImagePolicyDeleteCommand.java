package org.ndfcclient.cli.commands;

import org.ndfcclient.cli.ConfigCommand;
import org.ndfcclient.cli.ConfigFileReader;
import org.ndfcclient.imagepolicy.ImagePolicyRequest;
import org.ndfcclient.imagepolicy.ImagePolicyService;
import org.ndfcclient.rest.Results;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Deletes every listed image policy in one request.
 */
@Component
public class ImagePolicyDeleteCommand extends ConfigCommand<ImagePolicyRequest> {

    private final ImagePolicyService imagePolicyService;

    public ImagePolicyDeleteCommand(ConfigFileReader configFileReader, ImagePolicyService imagePolicyService) {
        super("image-policy-delete", "Delete image policies", configFileReader, ImagePolicyRequest.class);
        this.imagePolicyService = imagePolicyService;
    }

    @Override
    protected void process(List<ImagePolicyRequest> items, Results results, PrintStream out) {
        List<String> names = new ArrayList<>();
        for (ImagePolicyRequest item : items) {
            names.add(item.getName());
        }
        imagePolicyService.delete(names, results);
    }
}

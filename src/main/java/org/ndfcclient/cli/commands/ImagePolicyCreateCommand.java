package org.ndfcclient.cli.commands;

import org.ndfcclient.cli.ConfigCommand;
import org.ndfcclient.cli.ConfigFileReader;
import org.ndfcclient.imagepolicy.ImagePolicyCreateRequest;
import org.ndfcclient.imagepolicy.ImagePolicyService;
import org.ndfcclient.rest.Results;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.List;

/**
 * Creates image policies.
 */
@Component
public class ImagePolicyCreateCommand extends ConfigCommand<ImagePolicyCreateRequest> {

    private final ImagePolicyService imagePolicyService;

    public ImagePolicyCreateCommand(ConfigFileReader configFileReader, ImagePolicyService imagePolicyService) {
        super("image-policy-create", "Create image policies", configFileReader, ImagePolicyCreateRequest.class);
        this.imagePolicyService = imagePolicyService;
    }

    @Override
    protected void process(List<ImagePolicyCreateRequest> items, Results results, PrintStream out) {
        for (ImagePolicyCreateRequest item : items) {
            imagePolicyService.create(item, results);
        }
    }
}

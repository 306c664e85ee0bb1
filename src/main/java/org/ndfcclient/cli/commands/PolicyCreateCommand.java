package org.ndfcclient.cli.commands;

import org.ndfcclient.cli.ConfigCommand;
import org.ndfcclient.cli.ConfigFileReader;
import org.ndfcclient.policy.PolicyCreateRequest;
import org.ndfcclient.policy.PolicyService;
import org.ndfcclient.rest.Results;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.List;

/**
 * Creates switch policies.
 */
@Component
public class PolicyCreateCommand extends ConfigCommand<PolicyCreateRequest> {

    private final PolicyService policyService;

    public PolicyCreateCommand(ConfigFileReader configFileReader, PolicyService policyService) {
        super("policy-create", "Create switch policies", configFileReader, PolicyCreateRequest.class);
        this.policyService = policyService;
    }

    @Override
    protected void process(List<PolicyCreateRequest> items, Results results, PrintStream out) {
        for (PolicyCreateRequest item : items) {
            policyService.create(item, results);
        }
    }
}

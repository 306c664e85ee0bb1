package org.ndfcclient.cli.commands;

import org.ndfcclient.cli.ConfigCommand;
import org.ndfcclient.cli.ConfigFileReader;
import org.ndfcclient.policy.PolicyService;
import org.ndfcclient.policy.SwitchPolicyRequest;
import org.ndfcclient.rest.Results;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.List;

/**
 * Deletes switch policies selected by description.
 */
@Component
public class PolicyDeleteCommand extends ConfigCommand<SwitchPolicyRequest> {

    private final PolicyService policyService;

    public PolicyDeleteCommand(ConfigFileReader configFileReader, PolicyService policyService) {
        super("policy-delete", "Delete switch policies by description", configFileReader, SwitchPolicyRequest.class);
        this.policyService = policyService;
    }

    @Override
    protected void process(List<SwitchPolicyRequest> items, Results results, PrintStream out) {
        for (SwitchPolicyRequest item : items) {
            policyService.delete(item, results);
        }
    }
}

package org.ndfcclient.cli.commands;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.ndfcclient.cli.ConfigCommand;
import org.ndfcclient.cli.ConfigFileReader;
import org.ndfcclient.policy.PolicyService;
import org.ndfcclient.policy.SwitchPolicyRequest;
import org.ndfcclient.rest.Results;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.List;

/**
 * Shows the policies of switches, optionally only those with a given description.
 */
@Component
public class PolicyInfoSwitchCommand extends ConfigCommand<SwitchPolicyRequest> {

    private final PolicyService policyService;

    public PolicyInfoSwitchCommand(ConfigFileReader configFileReader, PolicyService policyService) {
        super("policy-info-switch", "Show the policies of switches", configFileReader, SwitchPolicyRequest.class);
        this.policyService = policyService;
    }

    @Override
    protected void process(List<SwitchPolicyRequest> items, Results results, PrintStream out) {
        ObjectNode output = newObject();
        for (SwitchPolicyRequest item : items) {
            ObjectNode fabric = output.has(item.getFabricName())
                    ? (ObjectNode) output.get(item.getFabricName()) : output.putObject(item.getFabricName());
            ArrayNode policies = fabric.putArray(item.getSwitchName());
            for (JsonNode policy : policyService.getSwitchPolicies(item.getFabricName(), item.getSwitchName())) {
                String description = item.getDescription();
                if (description == null || description.isBlank()
                        || description.equals(policy.path("description").asText())) {
                    policies.add(policy);
                }
            }
        }
        print(out, output);
    }
}

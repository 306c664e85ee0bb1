package org.ndfcclient.rest;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Controller REST paths.
 */
public final class Endpoints {

    public static final String API_V1 = "/appcenter/cisco/ndfc/api/v1";

    public static final String CONTROL = API_V1 + "/lan-fabric/rest/control";

    public static final String CONTROL_FABRICS = CONTROL + "/fabrics";

    /** Fabric create, update and delete live outside lan-fabric */
    public static final String REST_CONTROL_FABRICS = API_V1 + "/rest/control/fabrics";

    public static final String TOP_DOWN_FABRICS = API_V1 + "/lan-fabric/rest/top-down/fabrics";

    public static final String POLICIES = CONTROL + "/policies";

    public static final String IMAGE_POLICY_MGNT = API_V1 + "/imagemanagement/rest/policymgnt";

    public static final String INTERFACE = API_V1 + "/lan-fabric/rest/interface";

    public static final String RESOURCE_MANAGER = API_V1 + "/lan-fabric/rest/resource-manager";

    private Endpoints() {
    }

    public static String fabric(String fabric) {
        return CONTROL_FABRICS + "/" + encode(fabric);
    }

    public static String inventory(String fabric) {
        return fabric(fabric) + "/inventory/switchesByFabric";
    }

    public static String testReachability(String fabric) {
        return fabric(fabric) + "/inventory/test-reachability";
    }

    public static String discover(String fabric) {
        return fabric(fabric) + "/inventory/discover";
    }

    public static String configSave(String fabric) {
        return fabric(fabric) + "/config-save";
    }

    public static String configDeploy(String fabric) {
        return fabric(fabric) + "/config-deploy?forceShowRun=false";
    }

    public static String recalculateAndDeploy(String fabric) {
        return fabric(fabric) + "/recalculateAndDeploy";
    }

    public static String switchResourceUsage(String serialNumber) {
        return RESOURCE_MANAGER + "/switchView/" + encode(serialNumber);
    }

    public static String topDown(String fabric) {
        return TOP_DOWN_FABRICS + "/" + encode(fabric);
    }

    /**
     * Joins names into a comma separated query parameter value.
     */
    public static String joinQuery(List<String> values) {
        StringBuilder joined = new StringBuilder();
        for (String value : values) {
            if (joined.length() > 0) {
                joined.append(',');
            }
            joined.append(encode(value));
        }
        return joined.toString();
    }

    public static String encode(String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20");
    }
}

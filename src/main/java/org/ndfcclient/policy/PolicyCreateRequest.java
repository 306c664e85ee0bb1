package org.ndfcclient.policy;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;
import jakarta.validation.constraints.NotBlank;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parameters of a new switch policy. The description must be unique on the switch
 * since it is what policy-delete matches on.
 */
public class PolicyCreateRequest {

    @NotBlank
    @JsonProperty("description")
    private String description;

    @NotBlank
    @JsonProperty("entity_name")
    private String entityName;

    @NotBlank
    @JsonProperty("entity_type")
    private String entityType;

    @NotBlank
    @JsonProperty("fabric_name")
    private String fabricName;

    @NotBlank
    @JsonProperty("switch_name")
    private String switchName;

    @JsonSetter(nulls = Nulls.AS_EMPTY)
    @JsonProperty("nv_pairs")
    private Map<String, Object> nvPairs = new LinkedHashMap<>();

    @JsonProperty("priority")
    private int priority = 200;

    @JsonProperty("source")
    private String source = "";

    @JsonProperty("template_name")
    private String templateName = "";

    @JsonProperty("template_content_type")
    private String templateContentType = "string";

    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }
    public String getEntityName() { return entityName; }
    public void setEntityName(String entityName) { this.entityName = entityName; }
    public String getEntityType() { return entityType; }
    public void setEntityType(String entityType) { this.entityType = entityType; }
    public String getFabricName() { return fabricName; }
    public void setFabricName(String fabricName) { this.fabricName = fabricName; }
    public String getSwitchName() { return switchName; }
    public void setSwitchName(String switchName) { this.switchName = switchName; }
    public Map<String, Object> getNvPairs() { return nvPairs; }
    public void setNvPairs(Map<String, Object> nvPairs) { this.nvPairs = nvPairs; }
    public int getPriority() { return priority; }
    public void setPriority(int priority) { this.priority = priority; }
    public String getSource() { return source; }
    public void setSource(String source) { this.source = source; }
    public String getTemplateName() { return templateName; }
    public void setTemplateName(String templateName) { this.templateName = templateName; }
    public String getTemplateContentType() { return templateContentType; }
    public void setTemplateContentType(String templateContentType) { this.templateContentType = templateContentType; }

    @Override
    public String toString() {
        return "PolicyCreateRequest{fabricName='" + fabricName + "', switchName='" + switchName
                + "', templateName='" + templateName + "', description='" + description + "'}";
    }
}

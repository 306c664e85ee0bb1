package org.ndfcclient.imagepolicy;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

/**
 * Names an image policy to query or delete.
 */
public class ImagePolicyRequest {

    @NotBlank
    @JsonProperty("name")
    private String name;

    public ImagePolicyRequest() {
    }

    public ImagePolicyRequest(String name) {
        this.name = name;
    }

    public String getName() { return name; }

    public void setName(String name) { this.name = name; }

    @Override
    public String toString() {
        return "ImagePolicyRequest{name='" + name + "'}";
    }
}

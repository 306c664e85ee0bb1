package org.ndfcclient.imagepolicy;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;

import java.util.ArrayList;
import java.util.List;

/**
 * An image policy: the NX-OS release, packages and EPLD image to apply to a platform.
 */
public class ImagePolicyCreateRequest {

    @NotBlank
    @JsonProperty("name")
    private String name;

    @JsonProperty("agnostic")
    private boolean agnostic = false;

    @JsonProperty("description")
    private String description = "";

    @JsonProperty("epld_image")
    private String epldImage = "";

    @Valid
    @JsonProperty("packages")
    private Packages packages = new Packages();

    @NotBlank
    @JsonProperty("platform")
    private String platform;

    @NotBlank
    @JsonProperty("release")
    private String release;

    @JsonProperty("type")
    private String type = "PLATFORM";

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public boolean isAgnostic() { return agnostic; }
    public void setAgnostic(boolean agnostic) { this.agnostic = agnostic; }
    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }
    public String getEpldImage() { return epldImage; }
    public void setEpldImage(String epldImage) { this.epldImage = epldImage; }
    public Packages getPackages() { return packages; }
    public void setPackages(Packages packages) { this.packages = packages; }
    public String getPlatform() { return platform; }
    public void setPlatform(String platform) { this.platform = platform; }
    public String getRelease() { return release; }
    public void setRelease(String release) { this.release = release; }
    public String getType() { return type; }
    public void setType(String type) { this.type = type; }

    @Override
    public String toString() {
        return "ImagePolicyCreateRequest{name='" + name + "', platform='" + platform
                + "', release='" + release + "', type='" + type + "'}";
    }

    /**
     * Packages to install and uninstall.
     */
    public static class Packages {

        @JsonSetter(nulls = Nulls.AS_EMPTY)
        @JsonProperty("install")
        private List<String> install = new ArrayList<>();

        @JsonSetter(nulls = Nulls.AS_EMPTY)
        @JsonProperty("uninstall")
        private List<String> uninstall = new ArrayList<>();

        public List<String> getInstall() { return install; }

        public void setInstall(List<String> install) { this.install = install; }

        public List<String> getUninstall() { return uninstall; }

        public void setUninstall(List<String> uninstall) { this.uninstall = uninstall; }
    }
}

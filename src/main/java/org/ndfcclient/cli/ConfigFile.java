package org.ndfcclient.cli;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A YAML request document: {@code config:} followed by a list of request items.
 *
 * @param <T> Request item type
 */
public class ConfigFile<T> {

    @JsonProperty("config")
    private List<T> config;

    public List<T> getConfig() { return config; }

    public void setConfig(List<T> config) { this.config = config; }
}

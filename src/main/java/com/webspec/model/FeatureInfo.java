package com.webspec.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Identifies the feature an {@link ExecutionResult} belongs to. */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class FeatureInfo {

    private final String name;
    private final String file;
    private final String description;

    @JsonCreator
    public FeatureInfo(@JsonProperty("name") String name,
                       @JsonProperty("file") String file,
                       @JsonProperty("description") String description) {
        this.name        = name != null ? name : "";
        this.file        = file;
        this.description = description;
    }

    public FeatureInfo(String name) {
        this(name, null, null);
    }

    public String getName()        { return name; }
    public String getFile()        { return file; }
    public String getDescription() { return description; }

    @Override
    public String toString() {
        return String.format("FeatureInfo{name='%s', file=%s}", name, file);
    }
}

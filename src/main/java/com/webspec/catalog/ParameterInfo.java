package com.webspec.catalog;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/** Describes one captured parameter of a catalog step. */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ParameterInfo {

    private String  name;
    private String  type;         // string | integer | css
    private boolean required = true;
    private String  description;

    public ParameterInfo() {}

    public ParameterInfo(String name, String type, boolean required, String description) {
        this.name        = name;
        this.type        = type;
        this.required    = required;
        this.description = description;
    }

    public String  getName()        { return name; }
    public String  getType()        { return type; }
    public boolean isRequired()     { return required; }
    public String  getDescription() { return description; }

    public void setName(String name)               { this.name = name; }
    public void setType(String type)               { this.type = type; }
    public void setRequired(boolean required)      { this.required = required; }
    public void setDescription(String description) { this.description = description; }
}

package com.webspec.catalog;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.List;

/**
 * Descriptive metadata for one step: its canonical pattern, aliases, category,
 * parameters and example texts. Used for listing, searching and validating
 * steps; matching at run time goes through the pattern registry.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class StepInfo {

    private String              id;
    private String              pattern;
    private List<String>        aliases    = new ArrayList<>();
    private String              category;
    private String              description;
    private List<ParameterInfo> parameters = new ArrayList<>();
    private List<String>        examples   = new ArrayList<>();

    public StepInfo() {}

    public StepInfo(String id, String pattern, String category, String description) {
        this.id          = id;
        this.pattern     = pattern;
        this.category    = category;
        this.description = description;
    }

    /** Catalog pattern followed by its aliases. */
    @JsonIgnore
    public List<String> getAllPatterns() {
        List<String> all = new ArrayList<>();
        if (pattern != null) all.add(pattern);
        all.addAll(aliases);
        return all;
    }

    // ── Getters ───────────────────────────────────────────────────────────────

    public String              getId()          { return id; }
    public String              getPattern()     { return pattern; }
    public List<String>        getAliases()     { return aliases; }
    public String              getCategory()    { return category; }
    public String              getDescription() { return description; }
    public List<ParameterInfo> getParameters()  { return parameters; }
    public List<String>        getExamples()    { return examples; }

    // ── Setters ───────────────────────────────────────────────────────────────

    public void setId(String id)                            { this.id = id; }
    public void setPattern(String pattern)                  { this.pattern = pattern; }
    public void setAliases(List<String> aliases)            { this.aliases = aliases != null ? aliases : new ArrayList<>(); }
    public void setCategory(String category)                { this.category = category; }
    public void setDescription(String description)          { this.description = description; }
    public void setParameters(List<ParameterInfo> params)   { this.parameters = params != null ? params : new ArrayList<>(); }
    public void setExamples(List<String> examples)          { this.examples = examples != null ? examples : new ArrayList<>(); }

    @Override
    public String toString() {
        return String.format("StepInfo{id='%s', category='%s', pattern=/%s/}", id, category, pattern);
    }
}

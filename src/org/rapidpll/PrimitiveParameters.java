package org.rapidpll;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

public class PrimitiveParameters {

    private final String primitiveName;
    private final Map<String, String> attributes;
    private final Map<String, Object> parameters;
    private final Map<String, String> inputPorts;
    private final Map<String, String> outputPorts;
    private final List<String> resetSyncDomains;
    private final String lockedExpr;

    public PrimitiveParameters(String primitiveName, Map<String, String> attributes, Map<String, Object> parameters,
                               Map<String, String> inputPorts, Map<String, String> outputPorts,
                               List<String> resetSyncDomains, String lockedExpr) {
        this.primitiveName = primitiveName;
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        this.parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        this.inputPorts = Collections.unmodifiableMap(new LinkedHashMap<>(inputPorts));
        this.outputPorts = Collections.unmodifiableMap(new LinkedHashMap<>(outputPorts));
        this.resetSyncDomains = Collections.unmodifiableList(new ArrayList<>(resetSyncDomains));
        this.lockedExpr = lockedExpr;
    }

    public String getPrimitiveName() {
        return primitiveName;
    }

    public Map<String, String> getAttributes() {
        return attributes;
    }

    public Map<String, Object> getParameters() {
        return parameters;
    }

    public Object getParameter(String name) {
        return parameters.get(name);
    }

    public Map<String, String> getInputPorts() {
        return inputPorts;
    }

    public Map<String, String> getOutputPorts() {
        return outputPorts;
    }

    public List<String> getResetSyncDomains() {
        return resetSyncDomains;
    }

    public String getLockedExpr() {
        return lockedExpr;
    }

    public String toJson() {
        Gson gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();
        return gson.toJson(this);
    }
}

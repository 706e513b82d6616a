package io.endsession.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Base type for OAuth2/OpenID Connect protocol messages: an insertion-ordered mapping of
 * parameter names to {@link Parameter} values.
 *
 * <p>
 * Setting a parameter to {@code null} removes it. Not thread-safe; a message is owned by a
 * single request.
 */
public abstract class ProtocolMessage {

    private final Map<String, Parameter> parameters = new LinkedHashMap<>();

    protected ProtocolMessage() {}

    protected ProtocolMessage(Map<String, Parameter> parameters) {
        if (parameters != null) {
            this.parameters.putAll(parameters);
        }
    }

    /** Returns the parameter with the given name, or {@code null} if absent. */
    public Parameter getParameter(String name) {
        return parameters.get(name);
    }

    /** Returns the parameter as a single string, or {@code null} if absent. */
    public String getString(String name) {
        Parameter parameter = parameters.get(name);
        return parameter != null ? parameter.asString() : null;
    }

    public boolean hasParameter(String name) {
        return parameters.containsKey(name);
    }

    public void setParameter(String name, Parameter value) {
        if (value == null) {
            parameters.remove(name);
        } else {
            parameters.put(name, value);
        }
    }

    public void setParameter(String name, String value) {
        setParameter(name, value != null ? Parameter.of(value) : null);
    }

    public void setParameter(String name, List<String> values) {
        setParameter(name, values != null ? Parameter.of(values) : null);
    }

    /** Removes the parameter, returning {@code true} if it was present. */
    public boolean removeParameter(String name) {
        return parameters.remove(name) != null;
    }

    /** Unmodifiable view of all parameters, in insertion order. */
    public Map<String, Parameter> parameters() {
        return Collections.unmodifiableMap(parameters);
    }

    public int count() {
        return parameters.size();
    }

    public boolean isEmpty() {
        return parameters.isEmpty();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + parameters.keySet();
    }
}

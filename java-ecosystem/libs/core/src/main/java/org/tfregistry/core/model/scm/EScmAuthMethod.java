package org.tfregistry.core.model.scm;

/**
 * How a user proves their identity to an SCM provider.
 */
public enum EScmAuthMethod {
    OAUTH("oauth"),
    PAT("pat");

    private final String id;

    EScmAuthMethod(String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }
}

package com.phillippitts.draco.exception;

/**
 * Thrown when an operation names a component that was never registered with the
 * lifecycle manager. Never retried: the caller has a wiring error.
 */
public class UnknownComponentException extends DracoException {

    private final String componentName;

    public UnknownComponentException(String componentName) {
        super("Component not registered: " + componentName);
        this.componentName = componentName;
    }

    public String getComponentName() {
        return componentName;
    }
}

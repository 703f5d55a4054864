package com.phillippitts.draco.exception;

/**
 * Thrown when a component's loader fails (or returns no instance).
 *
 * <p>The component moves to {@code ERROR}; the next acquire retries the load.
 */
public class ComponentLoadException extends DracoException {

    private final String componentName;

    public ComponentLoadException(String componentName, Throwable cause) {
        super("Failed to load component " + componentName + ": " + describe(cause), cause);
        this.componentName = componentName;
    }

    public ComponentLoadException(String componentName, String message, Throwable cause) {
        super(message + " (component: " + componentName + ")", cause);
        this.componentName = componentName;
    }

    public String getComponentName() {
        return componentName;
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown cause";
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}

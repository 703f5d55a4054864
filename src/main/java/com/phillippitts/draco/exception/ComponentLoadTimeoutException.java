package com.phillippitts.draco.exception;

/**
 * Thrown when a caller gives up waiting for another caller's in-flight load.
 * The in-flight load itself keeps running.
 */
public class ComponentLoadTimeoutException extends DracoException {

    private final String componentName;
    private final long waitedMillis;

    public ComponentLoadTimeoutException(String componentName, long waitedMillis) {
        super("Timed out after " + waitedMillis + "ms waiting for component " + componentName + " to load");
        this.componentName = componentName;
        this.waitedMillis = waitedMillis;
    }

    public String getComponentName() {
        return componentName;
    }

    public long getWaitedMillis() {
        return waitedMillis;
    }
}

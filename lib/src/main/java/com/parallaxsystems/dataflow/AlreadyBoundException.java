package com.parallaxsystems.dataflow;

/**
 * Thrown when binding a {@link DataflowVariable} that already holds a value.
 * The variable keeps its original value.
 */
public class AlreadyBoundException extends IllegalStateException {

    private final transient Object boundValue;

    /**
     * Creates a new AlreadyBoundException.
     *
     * @param message the detail message
     * @param boundValue the value the variable already holds
     */
    public AlreadyBoundException(String message, Object boundValue) {
        super(message);
        this.boundValue = boundValue;
    }

    /**
     * Returns the value the variable was bound to before the rejected bind.
     *
     * @return the existing value, possibly null
     */
    public Object getBoundValue() {
        return boundValue;
    }
}

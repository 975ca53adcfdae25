package com.pavan.reversemap.collection;

/**
 * Thrown when bulk construction meets an element that is not an array-like key-value pair.
 */
public class MalformedEntryException extends IllegalArgumentException {
    
    static final String MESSAGE = "iterable for Map should have array-like objects";
    
    private final transient Object element;
    
    public MalformedEntryException(Object element) {
        super(MESSAGE);
        this.element = element;
    }
    
    /**
     * Returns the offending element of the source sequence.
     */
    public Object getElement() {
        return element;
    }
}

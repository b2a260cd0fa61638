package com.tally.ledger.exception;

/**
 * Lookup failure for journals, entries, fiscal years and periods
 */
public class ResourceNotFoundException extends AccountingException {

    public ResourceNotFoundException(String resource, Object id) {
        super(resource.toUpperCase().replace(' ', '_') + "_NOT_FOUND", ErrorCategory.NOT_FOUND,
            String.format("%s not found: %s", resource, id), resource, id);
    }
}

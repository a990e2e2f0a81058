package org.carball.cablesizer.engine;

import lombok.Getter;
import org.carball.cablesizer.model.standard.Standard;

/**
 * Raised when a table has no row for the requested size, material, rating,
 * temperature or conductor count under the active standard.
 */
@Getter
public class LookupException extends RuntimeException {

    private final Standard standard;

    public LookupException(Standard standard, String message) {
        super(message);
        this.standard = standard;
    }
}

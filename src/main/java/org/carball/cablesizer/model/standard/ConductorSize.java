package org.carball.cablesizer.model.standard;

/**
 * A tabulated conductor size of one standard. Sizes are strictly ordered by
 * {@link #index()} within their standard and never compared across standards.
 */
public interface ConductorSize {

    Standard standard();

    /**
     * Bare designation as printed in the table, e.g. "6", "1/0" or "250".
     */
    String designation();

    /**
     * Designation with its unit, e.g. "6 mm²", "1/0 AWG" or "250 kcmil".
     */
    String formatted();

    /**
     * Position in the standard's ordered size list, smallest first.
     */
    int index();
}

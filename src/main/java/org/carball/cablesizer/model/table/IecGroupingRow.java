package org.carball.cablesizer.model.table;

import org.carball.cablesizer.model.standard.IecReferenceMethod;

import java.util.Map;

public record IecGroupingRow(int circuits, Map<IecReferenceMethod, Double> factorByMethod) {

    public double factorFor(IecReferenceMethod method) {
        return factorByMethod.get(method);
    }
}

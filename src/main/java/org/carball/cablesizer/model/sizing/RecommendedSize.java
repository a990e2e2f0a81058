package org.carball.cablesizer.model.sizing;

import org.carball.cablesizer.model.standard.ConductorSize;

public record RecommendedSize(String designation, String formatted, int index) {

    public static RecommendedSize of(ConductorSize size) {
        return new RecommendedSize(size.designation(), size.formatted(), size.index());
    }
}

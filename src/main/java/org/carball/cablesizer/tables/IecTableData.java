package org.carball.cablesizer.tables;

import org.carball.cablesizer.model.standard.IecReferenceMethod;
import org.carball.cablesizer.model.table.IecGroupingRow;
import org.carball.cablesizer.model.table.TemperatureBucket;

import java.util.List;
import java.util.Map;

/**
 * IEC 60364-5-52 data: Table B.52.4 current-carrying capacities with the
 * matching mV/A/m voltage drop, Table B.52.14 ambient correction and
 * Table B.52.17 grouping.
 */
final class IecTableData {

    // 60 shares the PVC column, 70 is PVC, 90 is XLPE/EPR.
    static final int[] RATINGS = {60, 70, 90};

    static final double MINIMUM_AMBIENT = -40;
    static final double MAXIMUM_AMBIENT = 80;

    // Columns: mV/A/m, 60°C, 70°C, 90°C. Indexed by MetricSize ordinal.
    static final double[][] COPPER = {
            {12.1, 14, 17.5, 22},
            {7.41, 19, 23, 30},
            {4.61, 25, 31, 40},
            {3.08, 32, 40, 51},
            {1.83, 44, 54, 70},
            {1.15, 59, 68, 94},
            {0.727, 77, 89, 119},
            {0.524, 96, 110, 148},
            {0.387, 117, 133, 180},
            {0.268, 149, 168, 232},
            {0.193, 180, 201, 282},
            {0.153, 208, 232, 328},
            {0.124, 236, 258, 374},
            {0.0991, 268, 289, 424},
            {0.0754, 315, 341, 500},
            {0.0601, 360, 384, 561},
            {0.0470, 410, 430, 656},
            {0.0366, 470, 490, 749},
            {0.0283, 540, 560, 855}
    };

    // Aluminium starts at 2.5 mm² and stops at 500 mm².
    static final double[][] ALUMINUM = {
            null,
            {12.1, 14.5, 18, 23},
            {7.54, 19.5, 24, 31},
            {5.03, 25, 31, 40},
            {3.00, 34, 42, 54},
            {1.88, 46, 53, 73},
            {1.19, 60, 69, 92},
            {0.858, 75, 86, 115},
            {0.633, 92, 104, 140},
            {0.439, 116, 131, 180},
            {0.316, 140, 157, 219},
            {0.250, 162, 181, 254},
            {0.203, 184, 201, 290},
            {0.162, 209, 225, 329},
            {0.123, 246, 266, 388},
            {0.0986, 281, 300, 435},
            {0.0770, 322, 335, 510},
            {0.0600, 368, 382, 582},
            null
    };

    // Cold-side factors above 1.0 are tabulated here and capped by the composer.
    static final List<TemperatureBucket> TEMPERATURE = List.of(
            bucket(MINIMUM_AMBIENT - 1, 10, 1.22, 1.22, 1.15),
            bucket(10, 15, 1.17, 1.17, 1.12),
            bucket(15, 20, 1.12, 1.12, 1.08),
            bucket(20, 25, 1.06, 1.06, 1.04),
            bucket(25, 30, 1.00, 1.00, 1.00),
            bucket(30, 35, 0.94, 0.94, 0.96),
            bucket(35, 40, 0.87, 0.87, 0.91),
            bucket(40, 45, 0.79, 0.79, 0.87),
            bucket(45, 50, 0.71, 0.71, 0.82),
            bucket(50, 55, 0.61, 0.61, 0.76),
            bucket(55, 60, 0.50, 0.50, 0.71),
            bucket(60, 65, 0.35, 0.35, 0.65),
            bucket(65, 70, 0, 0, 0.58),
            bucket(70, 75, 0, 0, 0.50),
            bucket(75, 80, 0, 0, 0.41)
    );

    static final List<IecGroupingRow> GROUPING = List.of(
            row(1, 1.00, 1.00, 1.00, 1.00),
            row(2, 0.80, 0.85, 0.85, 0.88),
            row(3, 0.70, 0.79, 0.79, 0.82),
            row(4, 0.65, 0.75, 0.75, 0.77),
            row(5, 0.60, 0.73, 0.73, 0.75),
            row(6, 0.57, 0.72, 0.72, 0.73),
            row(7, 0.54, 0.70, 0.70, 0.73),
            row(8, 0.52, 0.70, 0.70, 0.72),
            row(9, 0.50, 0.70, 0.70, 0.72),
            row(12, 0.45, 0.65, 0.65, 0.70),
            row(16, 0.41, 0.60, 0.60, 0.68),
            row(20, 0.38, 0.57, 0.57, 0.66)
    );

    static final double MINIMUM_PROTECTIVE_CONDUCTOR = 2.5;

    private IecTableData() {
    }

    private static TemperatureBucket bucket(double lower, double upper, double f60, double f70, double f90) {
        return new TemperatureBucket(lower, upper, Map.of(60, f60, 70, f70, 90, f90));
    }

    private static IecGroupingRow row(int circuits, double a, double b, double c, double e) {
        return new IecGroupingRow(circuits, Map.of(
                IecReferenceMethod.A, a,
                IecReferenceMethod.B, b,
                IecReferenceMethod.C, c,
                IecReferenceMethod.E, e));
    }
}

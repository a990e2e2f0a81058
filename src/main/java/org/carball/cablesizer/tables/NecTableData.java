package org.carball.cablesizer.tables;

import org.carball.cablesizer.model.standard.AwgSize;
import org.carball.cablesizer.model.table.EquipmentGroundingRow;
import org.carball.cablesizer.model.table.GroupingBucket;
import org.carball.cablesizer.model.table.TemperatureBucket;

import java.util.List;
import java.util.Map;

/**
 * NEC 2020 data: Table 310.16 ampacities, Chapter 9 Table 8 DC resistance,
 * 310.15(B)(1) temperature correction, 310.15(C)(1) adjustment and 250.122.
 */
final class NecTableData {

    static final int[] RATINGS = {60, 75, 90};

    static final double MINIMUM_AMBIENT = -40;
    static final double MAXIMUM_AMBIENT = 90;

    // Columns: Ω/1000ft, 60°C, 75°C, 90°C. Indexed by AwgSize ordinal.
    static final double[][] COPPER = {
            {3.14, 15, 15, 15},
            {1.98, 20, 25, 30},
            {1.24, 30, 35, 40},
            {0.778, 40, 50, 55},
            {0.491, 55, 65, 75},
            {0.308, 70, 85, 95},
            {0.245, 85, 100, 115},
            {0.194, 95, 115, 130},
            {0.154, 110, 130, 145},
            {0.122, 125, 150, 170},
            {0.0967, 145, 175, 195},
            {0.0766, 165, 200, 225},
            {0.0608, 195, 230, 260},
            {0.0515, 215, 255, 290},
            {0.0429, 240, 285, 320},
            {0.0367, 260, 310, 350},
            {0.0321, 280, 335, 380},
            {0.0258, 320, 380, 430},
            {0.0214, 350, 420, 475},
            {0.0171, 385, 475, 535},
            {0.0129, 445, 545, 615}
    };

    // 14 AWG aluminium is not listed.
    static final double[][] ALUMINUM = {
            null,
            {3.25, 15, 20, 25},
            {2.04, 25, 30, 35},
            {1.28, 35, 40, 45},
            {0.808, 40, 50, 55},
            {0.508, 55, 65, 75},
            {0.403, 65, 75, 85},
            {0.319, 75, 90, 100},
            {0.253, 85, 100, 115},
            {0.201, 100, 120, 135},
            {0.159, 115, 135, 150},
            {0.126, 130, 155, 175},
            {0.100, 150, 180, 205},
            {0.0847, 170, 205, 230},
            {0.0707, 190, 230, 255},
            {0.0605, 210, 250, 280},
            {0.0529, 225, 270, 305},
            {0.0424, 260, 310, 350},
            {0.0353, 285, 340, 385},
            {0.0282, 315, 385, 435},
            {0.0212, 375, 445, 500}
    };

    static final List<TemperatureBucket> TEMPERATURE = List.of(
            bucket(MINIMUM_AMBIENT - 1, 30, 1.00, 1.00, 1.00),
            bucket(30, 35, 0.91, 0.94, 0.96),
            bucket(35, 40, 0.82, 0.88, 0.91),
            bucket(40, 45, 0.71, 0.82, 0.87),
            bucket(45, 50, 0.58, 0.75, 0.82),
            bucket(50, 55, 0.41, 0.67, 0.76),
            bucket(55, 60, 0, 0.58, 0.71),
            bucket(60, 65, 0, 0.47, 0.65),
            bucket(65, 70, 0, 0.33, 0.58),
            bucket(70, 75, 0, 0, 0.50),
            bucket(75, 80, 0, 0, 0.41),
            bucket(80, 85, 0, 0, 0.29),
            bucket(85, 90, 0, 0, 0)
    );

    static final List<GroupingBucket> GROUPING = List.of(
            new GroupingBucket(1, 3, 1.00),
            new GroupingBucket(4, 6, 0.80),
            new GroupingBucket(7, 9, 0.70),
            new GroupingBucket(10, 20, 0.50),
            new GroupingBucket(21, 30, 0.45),
            new GroupingBucket(31, 40, 0.40)
    );

    static final GroupingBucket EXTENDED_GROUPING = new GroupingBucket(41, Integer.MAX_VALUE, 0.35);

    static final List<EquipmentGroundingRow> EQUIPMENT_GROUNDING = List.of(
            new EquipmentGroundingRow(15, AwgSize.AWG_14, AwgSize.AWG_12),
            new EquipmentGroundingRow(20, AwgSize.AWG_12, AwgSize.AWG_10),
            new EquipmentGroundingRow(60, AwgSize.AWG_10, AwgSize.AWG_8),
            new EquipmentGroundingRow(100, AwgSize.AWG_8, AwgSize.AWG_6),
            new EquipmentGroundingRow(200, AwgSize.AWG_6, AwgSize.AWG_4),
            new EquipmentGroundingRow(300, AwgSize.AWG_4, AwgSize.AWG_2),
            new EquipmentGroundingRow(400, AwgSize.AWG_3, AwgSize.AWG_1),
            new EquipmentGroundingRow(500, AwgSize.AWG_2, AwgSize.AWG_1_0),
            new EquipmentGroundingRow(600, AwgSize.AWG_1, AwgSize.AWG_2_0),
            new EquipmentGroundingRow(800, AwgSize.AWG_1_0, AwgSize.AWG_3_0),
            new EquipmentGroundingRow(1000, AwgSize.AWG_2_0, AwgSize.AWG_4_0),
            new EquipmentGroundingRow(1200, AwgSize.AWG_3_0, AwgSize.KCMIL_250),
            new EquipmentGroundingRow(1600, AwgSize.AWG_4_0, AwgSize.KCMIL_350),
            new EquipmentGroundingRow(2000, AwgSize.KCMIL_250, AwgSize.KCMIL_400),
            new EquipmentGroundingRow(2500, AwgSize.KCMIL_350, AwgSize.KCMIL_600),
            new EquipmentGroundingRow(3000, AwgSize.KCMIL_400, AwgSize.KCMIL_600),
            new EquipmentGroundingRow(4000, AwgSize.KCMIL_500, AwgSize.KCMIL_750)
    );

    private NecTableData() {
    }

    private static TemperatureBucket bucket(double lower, double upper, double f60, double f75, double f90) {
        return new TemperatureBucket(lower, upper, Map.of(60, f60, 75, f75, 90, f90));
    }
}

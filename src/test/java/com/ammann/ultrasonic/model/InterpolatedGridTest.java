/* (C)2026 */
package com.ammann.ultrasonic.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class InterpolatedGridTest
{

    @Test
    void sourceArraysDoNotLeakIntoGrid()
    {
        double[] xAxis = {0.0, 1.0};
        double[] yAxis = {0.0, 2.0};
        double[][] values = {{0.001, Double.NaN}, {0.002, 0.003}};
        InterpolatedGrid grid = new InterpolatedGrid(xAxis, yAxis, values);

        xAxis[1] = 99.0;
        yAxis[1] = 99.0;
        values[0][1] = 0.5;
        values[1] = new double[] {7.0, 7.0};

        assertThat(grid.xAxis()).containsExactly(0.0, 1.0);
        assertThat(grid.yAxis()).containsExactly(0.0, 2.0);
        assertThat(grid.isMissing(0, 1)).isTrue();
        assertThat(grid.values()[1]).containsExactly(0.002, 0.003);
    }

    @Test
    void returnedArraysAreCopies()
    {
        InterpolatedGrid grid = new InterpolatedGrid(
                new double[] {0.0, 1.0},
                new double[] {0.0},
                new double[][] {{0.001, Double.NaN}}
        );

        grid.xAxis()[0] = 42.0;
        grid.yAxis()[0] = 42.0;
        grid.values()[0][1] = 0.5;

        assertThat(grid.xAxis()[0]).isEqualTo(0.0);
        assertThat(grid.yAxis()[0]).isEqualTo(0.0);
        assertThat(grid.isMissing(0, 1)).isTrue();
        assertThat(grid.finiteValues()).containsExactly(0.001);
        assertThat(grid.missingMask()[0]).containsExactly(false, true);
    }
}

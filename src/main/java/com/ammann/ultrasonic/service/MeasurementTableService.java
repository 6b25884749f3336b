/* (C)2026 */
package com.ammann.ultrasonic.service;

import com.ammann.ultrasonic.dto.MeasurementTableDTO;
import com.ammann.ultrasonic.enumeration.MeasurementMode;
import com.ammann.ultrasonic.exception.SchemaException;
import com.ammann.ultrasonic.exception.ValidationException;
import com.ammann.ultrasonic.model.MeasurementPoint;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Maps a column/row table onto measurement points for the selected mode.
 *
 * <p>Column names are matched case-insensitively after trimming. Extra columns are
 * ignored. Missing required columns abort the run with a {@link SchemaException}
 * before any computation; {@code null} cells become non-computable values.
 */
@ApplicationScoped
public class MeasurementTableService
{

    private static final Logger LOG = Logger.getLogger(MeasurementTableService.class);

    /**
     * Validates the table schema and converts each row to a {@link MeasurementPoint}.
     *
     * @param table measurement table
     * @param mode  acquisition mode that decides the required columns
     * @return points in row order
     * @throws SchemaException     if a required column is absent
     * @throws ValidationException if the table is missing or a row is malformed
     */
    public List<MeasurementPoint> toMeasurementPoints(MeasurementTableDTO table, MeasurementMode mode)
    {
        if (table == null || table.columns() == null) {
            throw ValidationException.missingParameter("table.columns", "every analysis");
        }

        Map<String, Integer> positions = new HashMap<>();
        for (int i = 0; i < table.columns().size(); i++) {
            String column = table.columns().get(i);
            if (column != null) {
                positions.putIfAbsent(normalize(column), i);
            }
        }

        List<String> missing = mode.requiredColumns().stream()
                .filter(column -> !positions.containsKey(column))
                .toList();
        if (!missing.isEmpty()) {
            LOG.warnf("Rejecting %s table: missing columns %s (present: %s)", mode, missing, table.columns());
            throw new SchemaException(mode, missing);
        }

        List<List<Double>> rows = table.rows() != null ? table.rows() : List.of();
        int width = table.columns().size();
        int x = positions.get(MeasurementMode.COLUMN_X);
        int y = positions.get(MeasurementMode.COLUMN_Y);
        int[] payload = mode.getPayloadColumns().stream().mapToInt(positions::get).toArray();

        List<MeasurementPoint> points = new ArrayList<>(rows.size());
        for (int r = 0; r < rows.size(); r++) {
            List<Double> row = rows.get(r);
            if (row == null || row.size() != width) {
                throw ValidationException.invalidParameter(
                        "table.rows[" + r + "]",
                        row == null ? null : row.size() + " cells",
                        width + " cells");
            }
            if (mode == MeasurementMode.LONGITUDINAL) {
                points.add(MeasurementPoint.longitudinal(
                        cell(row, x), cell(row, y), cell(row, payload[0])));
            } else {
                points.add(MeasurementPoint.shear(
                        cell(row, x), cell(row, y),
                        cell(row, payload[0]), cell(row, payload[1])));
            }
        }

        LOG.debugf("Parsed %d %s points", points.size(), mode);
        return points;
    }

    private static String normalize(String column)
    {
        return column.trim().toLowerCase(Locale.ROOT);
    }

    private static double cell(List<Double> row, int index)
    {
        Double value = row.get(index);
        return value != null ? value : Double.NaN;
    }
}

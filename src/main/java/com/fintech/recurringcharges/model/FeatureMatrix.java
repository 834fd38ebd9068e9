package com.fintech.recurringcharges.model;

import com.fintech.recurringcharges.exception.FeatureExtractionException;

import java.util.Arrays;

/**
 * Row-major feature matrix. Every row has exactly {@link FeatureMode#getDimension()} columns.
 */
public final class FeatureMatrix {

    private final double[][] rows;
    private final FeatureMode mode;

    public FeatureMatrix(double[][] rows, FeatureMode mode) {
        for (int i = 0; i < rows.length; i++) {
            if (rows[i].length != mode.getDimension()) {
                throw new FeatureExtractionException(String.format(
                        "Row %d has %d features, expected %d for %s mode",
                        i, rows[i].length, mode.getDimension(), mode));
            }
        }
        this.rows = rows;
        this.mode = mode;
    }

    public static FeatureMatrix empty(FeatureMode mode) {
        return new FeatureMatrix(new double[0][], mode);
    }

    public FeatureMode getMode() {
        return mode;
    }

    public int getRowCount() {
        return rows.length;
    }

    public int getColumnCount() {
        return mode.getDimension();
    }

    public double[] getRow(int index) {
        return rows[index].clone();
    }

    public double[][] toArray() {
        double[][] copy = new double[rows.length][];
        for (int i = 0; i < rows.length; i++) {
            copy[i] = rows[i].clone();
        }
        return copy;
    }

    public boolean isEmpty() {
        return rows.length == 0;
    }

    @Override
    public String toString() {
        return "FeatureMatrix[" + rows.length + "x" + mode.getDimension() + ", " + mode + "]";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FeatureMatrix)) {
            return false;
        }
        FeatureMatrix other = (FeatureMatrix) o;
        return mode == other.mode && Arrays.deepEquals(rows, other.rows);
    }

    @Override
    public int hashCode() {
        return 31 * mode.hashCode() + Arrays.deepHashCode(rows);
    }
}

package com.gridfolio.engine.model;

import java.util.List;

public record CorrelationTable(List<String> columns, double[][] matrix) {

    public CorrelationTable {
        columns = List.copyOf(columns);
        double[][] copy = new double[matrix.length][];
        for (int i = 0; i < matrix.length; i++) {
            copy[i] = matrix[i].clone();
        }
        matrix = copy;
    }

    public double get(String row, String column) {
        return matrix[columns.indexOf(row)][columns.indexOf(column)];
    }
}

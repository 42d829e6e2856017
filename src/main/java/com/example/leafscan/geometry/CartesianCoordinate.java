package com.example.leafscan.geometry;

public record CartesianCoordinate(
        double x,
        double y,
        double z
) {
}

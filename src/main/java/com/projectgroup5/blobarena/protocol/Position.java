package com.projectgroup5.blobarena.protocol;

public record Position(double x, double y) {
}

package com.projectgroup5.blobarena.game;

public record Point(double x, double y) {
}

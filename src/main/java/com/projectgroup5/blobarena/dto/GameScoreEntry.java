package com.projectgroup5.blobarena.dto;

public class GameScoreEntry {

    private int playerId;
    private String name;
    private long score;
    private double radius;

    public GameScoreEntry(int playerId, String name, long score, double radius) {
        this.playerId = playerId;
        this.name = name;
        this.score = score;
        this.radius = radius;
    }

    public GameScoreEntry() {
    }

    public int getPlayerId() {
        return playerId;
    }

    public void setPlayerId(int playerId) {
        this.playerId = playerId;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public long getScore() {
        return score;
    }

    public void setScore(long score) {
        this.score = score;
    }

    public double getRadius() {
        return radius;
    }

    public void setRadius(double radius) {
        this.radius = radius;
    }
}

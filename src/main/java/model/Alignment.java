package model;

public enum Alignment {
    LEFT,
    CENTER,
    RIGHT
}

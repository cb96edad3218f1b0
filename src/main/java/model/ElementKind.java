package model;

public enum ElementKind {
    BOX,
    BUTTON,
    INPUT,
    LINK,
    CHECKBOX,
    TEXT,
    DIVIDER,
    ROW,
    SPACER
}

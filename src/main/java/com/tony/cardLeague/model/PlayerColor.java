package com.tony.cardLeague.model;

// Les 8 couleurs de carte qui déterminent la chimie d'une équipe
public enum PlayerColor {
    DARK_GREEN, LIGHT_GREEN, DARK_BLUE, LIGHT_BLUE, RED, YELLOW, PURPLE, ORANGE
}
